package io.github.hotbrkm.smtpsinkhole.smtp.util;

import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.server.Session;
import org.xbill.DNS.Address;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Utility class for IP address operations.
 * <p>
 * Provides IP literal parsing without DNS, CIDR matching for IPv4 and IPv6,
 * reversed-octet names for DNS blocklists and reserved range checks.
 */
public final class IpAddressUtil {

    private static final Netblock[] RESERVED_RANGES = {
            Netblock.parse("10.0.0.0/8"),
            Netblock.parse("172.16.0.0/12"),
            Netblock.parse("192.168.0.0/16"),
            Netblock.parse("fc00::/7"),
            Netblock.parse("fec0::/10")
    };

    private IpAddressUtil() {
        // Prevent instantiation
    }

    /**
     * Extracts the remote IP address from MessageContext.
     *
     * @param mc SMTP message context
     * @return IP address string, or null if extraction fails
     */
    public static String getRemoteIp(MessageContext mc) {
        try {
            InetSocketAddress remote = (InetSocketAddress) mc.getRemoteAddress();
            return remote.getAddress().getHostAddress();
        } catch (Throwable t) {
            return null;
        }
    }

    /**
     * Extracts the local IP address the client connected to.
     *
     * @param mc SMTP message context
     * @return IP address string, or null if the context is not a live session
     */
    public static String getLocalIp(MessageContext mc) {
        if (!(mc instanceof Session session)) {
            return null;
        }
        try {
            return session.getSocket().getLocalAddress().getHostAddress();
        } catch (Throwable t) {
            return null;
        }
    }

    /**
     * Checks whether STARTTLS has completed on the session.
     *
     * @param mc SMTP message context
     * @return true if TLS is active
     */
    public static boolean isTlsStarted(MessageContext mc) {
        return mc instanceof Session session && session.isTLSStarted();
    }

    /**
     * Parses an IPv4 or IPv6 literal without consulting DNS.
     *
     * @param text Address text (e.g. "192.168.1.1" or "1::")
     * @return the address, or null if the text is not an IP literal
     */
    public static InetAddress parseLiteral(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        int family = text.indexOf(':') >= 0 ? Address.IPv6 : Address.IPv4;
        byte[] bytes = Address.toByteArray(text, family);
        if (bytes == null) {
            return null;
        }
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    /**
     * Checks if an IP address matches a single address or a CIDR netblock.
     *
     * @param ip    IP address to check
     * @param entry Address or netblock (e.g. "192.168.1.0/24", "2001:db8::/32")
     * @return true if matched
     */
    public static boolean matchesIp(String ip, String entry) {
        InetAddress address = parseLiteral(ip);
        if (address == null || entry == null) {
            return false;
        }
        String trimmed = entry.trim();
        if (trimmed.contains("/")) {
            Netblock netblock = Netblock.parse(trimmed);
            return netblock != null && netblock.contains(address);
        }
        InetAddress other = parseLiteral(trimmed);
        return address.equals(other);
    }

    /**
     * Reverses the octets of an IPv4 address for DNS blocklist queries.
     *
     * @param ip IPv4 address (e.g. "192.168.1.2")
     * @return reversed form (e.g. "2.1.168.192"), or null if not IPv4
     */
    public static String reverseIpv4(String ip) {
        InetAddress address = parseLiteral(ip);
        if (!(address instanceof Inet4Address)) {
            return null;
        }
        byte[] octets = address.getAddress();
        return (octets[3] & 0xff) + "." + (octets[2] & 0xff) + "." + (octets[1] & 0xff) + "." + (octets[0] & 0xff);
    }

    /**
     * Checks if an address is a routable unicast address: not unspecified,
     * loopback, multicast, link-local or the IPv4 broadcast address.
     *
     * @param address Address to check
     * @return true if global unicast
     */
    public static boolean isGlobalUnicast(InetAddress address) {
        if (address.isAnyLocalAddress() || address.isLoopbackAddress()
                || address.isMulticastAddress() || address.isLinkLocalAddress()) {
            return false;
        }
        if (address instanceof Inet4Address) {
            for (byte b : address.getAddress()) {
                if (b != (byte) 0xff) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    /**
     * Checks if an address is in private or site-local space
     * (10/8, 172.16/12, 192.168/16, fc00::/7, fec0::/10).
     *
     * @param address Address to check
     * @return true if reserved
     */
    public static boolean isReservedRange(InetAddress address) {
        for (Netblock netblock : RESERVED_RANGES) {
            if (netblock.contains(address)) {
                return true;
            }
        }
        return false;
    }

    private record Netblock(byte[] base, int prefix) {

        static Netblock parse(String cidr) {
            int slash = cidr.indexOf('/');
            InetAddress base = parseLiteral(cidr.substring(0, slash));
            if (base == null) {
                return null;
            }
            int prefix;
            try {
                prefix = Integer.parseInt(cidr.substring(slash + 1));
            } catch (NumberFormatException e) {
                return null;
            }
            if (prefix < 0 || prefix > base.getAddress().length * 8) {
                return null;
            }
            return new Netblock(base.getAddress(), prefix);
        }

        boolean contains(InetAddress address) {
            byte[] bytes = address.getAddress();
            if (bytes.length != base.length) {
                return false;
            }
            int full = prefix / 8;
            for (int i = 0; i < full; i++) {
                if (bytes[i] != base[i]) {
                    return false;
                }
            }
            int rest = prefix % 8;
            if (rest == 0) {
                return true;
            }
            int mask = (0xff << (8 - rest)) & 0xff;
            return (bytes[full] & mask) == (base[full] & mask);
        }
    }
}
