package biz.kryukov.dev.endpoint;

/**
 * No explicit port, and the scheme has no default port (e.g. {@code tcp://host}).
 * Still an {@link Kind#INVALID_ADDRESS} failure.
 */
public class MissingPortException extends InvalidAddressException {

    private final Scheme scheme;

    public MissingPortException(String input, Scheme scheme) {
        super(input);
        this.scheme = scheme;
    }

    /**
     * Returns the recognized scheme without a default port,
     * or {@code null} when the scheme is not supported at all.
     */
    public Scheme scheme() {
        return scheme;
    }
}
