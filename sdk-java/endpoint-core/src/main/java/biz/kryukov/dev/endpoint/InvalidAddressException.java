package biz.kryukov.dev.endpoint;

/**
 * Malformed URL, missing host or port, failed name resolution,
 * or an endpoint without a socket address.
 */
public class InvalidAddressException extends ParseEndpointException {

    public InvalidAddressException(String detail) {
        super(Kind.INVALID_ADDRESS, detail, "invalid address: " + detail);
    }

    public InvalidAddressException(String detail, Throwable cause) {
        super(Kind.INVALID_ADDRESS, detail, "invalid address: " + detail, cause);
    }
}
