package biz.kryukov.dev.endpoint;

/**
 * The input parsed as a URL, but its scheme is not one of the supported network schemes.
 */
public class InvalidSchemeException extends ParseEndpointException {

    public InvalidSchemeException(String scheme) {
        super(Kind.INVALID_SCHEME, scheme, "unsupported scheme: " + scheme);
    }
}
