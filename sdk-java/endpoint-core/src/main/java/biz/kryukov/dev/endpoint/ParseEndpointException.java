package biz.kryukov.dev.endpoint;

/**
 * Base exception for endpoint parsing and resolution failures.
 *
 * <p>Every failure carries one of two kinds:
 * <ul>
 *   <li>{@link Kind#INVALID_SCHEME}: the input is a well-formed URL with an unsupported scheme</li>
 *   <li>{@link Kind#INVALID_ADDRESS}: malformed URL, missing host or port, unresolvable host,
 *       or an endpoint that has no socket address</li>
 * </ul>
 * Callers that only care about the coarse taxonomy switch on {@link #kind()};
 * the concrete subclasses allow finer {@code catch} clauses.
 */
public class ParseEndpointException extends Exception {

    /** Coarse failure kind. */
    public enum Kind {
        INVALID_SCHEME,
        INVALID_ADDRESS
    }

    private final Kind kind;
    private final String detail;

    protected ParseEndpointException(Kind kind, String detail, String message) {
        super(message);
        this.kind = kind;
        this.detail = detail;
    }

    protected ParseEndpointException(Kind kind, String detail, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = detail;
    }

    /** Returns the failure kind. */
    public Kind kind() {
        return kind;
    }

    /** Returns the offending input, scheme or host name. */
    public String detail() {
        return detail;
    }
}
