package biz.kryukov.dev.endpoint.resolver;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Blocking host name lookup. The default implementation is {@link InetAddress#getAllByName}.
 */
@FunctionalInterface
public interface HostLookup {

    HostLookup SYSTEM = InetAddress::getAllByName;

    /**
     * Resolves a host name to its addresses, in the order the name service returns them.
     *
     * @throws UnknownHostException if the name cannot be resolved
     */
    InetAddress[] lookup(String host) throws UnknownHostException;
}
