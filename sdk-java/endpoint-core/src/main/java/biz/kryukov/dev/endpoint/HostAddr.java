package biz.kryukov.dev.endpoint;

import com.google.common.net.InetAddresses;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Host of a network endpoint: either a literal IP address or a domain name.
 *
 * <p>A pure value. Classification never touches DNS; resolving a {@link Domain}
 * is the job of {@link biz.kryukov.dev.endpoint.resolver.EndpointResolver}.
 */
public sealed interface HostAddr permits HostAddr.Ip, HostAddr.Domain {

    /**
     * Classifies host text. IPv4 and IPv6 literals (IPv6 optionally in brackets)
     * become {@link Ip}; any other non-blank text becomes a {@link Domain} verbatim.
     *
     * @param host host text as found in a URL authority
     * @return classified host
     * @throws IllegalArgumentException if {@code host} is blank
     */
    static HostAddr of(String host) {
        Objects.requireNonNull(host, "host");
        String literal = host;
        if (literal.length() > 2 && literal.startsWith("[") && literal.endsWith("]")) {
            literal = literal.substring(1, literal.length() - 1);
        }
        if (InetAddresses.isInetAddress(literal)) {
            return new Ip(parseLiteral(literal));
        }
        return new Domain(host);
    }

    /**
     * Parses an IP literal, keeping IPv4-mapped IPv6 ({@code ::ffff:a.b.c.d}) as an IPv6 address.
     * {@link InetAddresses#forString} alone would collapse those to IPv4.
     */
    private static InetAddress parseLiteral(String literal) {
        InetAddress address = InetAddresses.forString(literal);
        if (!InetAddresses.isMappedIPv4Address(literal)) {
            return address;
        }
        byte[] mapped = new byte[16];
        mapped[10] = (byte) 0xff;
        mapped[11] = (byte) 0xff;
        byte[] raw = address.getAddress();
        System.arraycopy(raw, raw.length - 4, mapped, 12, 4);
        try {
            return Inet6Address.getByAddress(null, mapped, -1);
        } catch (UnknownHostException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Returns the host as written in a URI authority (IPv6 in brackets). */
    String uriText();

    /** Literal IP address, IPv4 or IPv6. */
    record Ip(InetAddress address) implements HostAddr {

        public Ip {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public String uriText() {
            return InetAddresses.toUriString(address);
        }

        @Override
        public String toString() {
            return InetAddresses.toAddrString(address);
        }
    }

    /** Domain name, kept verbatim. No syntax validation beyond non-blank. */
    record Domain(String name) implements HostAddr {

        public Domain {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("domain name must not be blank");
            }
        }

        @Override
        public String uriText() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
