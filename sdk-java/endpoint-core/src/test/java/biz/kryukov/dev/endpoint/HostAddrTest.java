package biz.kryukov.dev.endpoint;

import com.google.common.net.InetAddresses;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.Inet6Address;

import static org.junit.jupiter.api.Assertions.*;

class HostAddrTest {

    @Test
    void ipv4Literal() {
        HostAddr host = HostAddr.of("127.0.0.1");
        assertEquals(new HostAddr.Ip(InetAddresses.forString("127.0.0.1")), host);
        assertEquals("127.0.0.1", host.uriText());
        assertEquals("127.0.0.1", host.toString());
    }

    @Test
    void ipv6LiteralWithAndWithoutBrackets() {
        HostAddr bare = HostAddr.of("0:0:0:0:0:0:0:1");
        HostAddr bracketed = HostAddr.of("[::1]");
        assertEquals(bare, bracketed);
        HostAddr.Ip ip = assertInstanceOf(HostAddr.Ip.class, bare);
        assertInstanceOf(Inet6Address.class, ip.address());
        assertEquals("[::1]", bare.uriText());
        assertEquals("::1", bare.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"::ffff:1.2.3.4", "[::ffff:1.2.3.4]", "::ffff:102:304"})
    void ipv4MappedLiteralStaysIpv6(String literal) {
        HostAddr.Ip ip = assertInstanceOf(HostAddr.Ip.class, HostAddr.of(literal));
        assertInstanceOf(Inet6Address.class, ip.address());
        assertArrayEquals(
                new byte[]{0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 0xff, (byte) 0xff, 1, 2, 3, 4},
                ip.address().getAddress());
        assertNotEquals(HostAddr.of("1.2.3.4"), ip);
        assertEquals(ip, HostAddr.of(ip.uriText()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.com", "localhost", "broker.local", "my_cache", "1.2.3", "256.1.1.1"})
    void domainNamesKeptVerbatim(String name) {
        HostAddr host = HostAddr.of(name);
        assertEquals(new HostAddr.Domain(name), host);
        assertEquals(name, host.uriText());
    }

    @Test
    void domainKeepsCase() {
        assertEquals("Example.COM", HostAddr.of("Example.COM").toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    void blankDomainRejected(String name) {
        assertThrows(IllegalArgumentException.class, () -> new HostAddr.Domain(name));
        assertThrows(IllegalArgumentException.class, () -> HostAddr.of(name));
    }

    @Test
    void nullRejected() {
        assertThrows(NullPointerException.class, () -> HostAddr.of(null));
        assertThrows(NullPointerException.class, () -> new HostAddr.Ip(null));
    }
}
