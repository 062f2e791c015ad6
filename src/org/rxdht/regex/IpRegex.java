/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.net.Inet4Address;
import java.net.Inet6Address;

/**
 * Regexes over the binary spelling of IP addresses, for announcing and
 * looking up address ranges. An address is written as its bits, most
 * significant first; a network is its prefix followed by
 * <code>(0|1)+</code>.
 */
public final class IpRegex {

    private IpRegex() {
    }

    public static String ipv4ToRegex(Inet4Address ip, String netmask) {
        return toRegex(ip.getAddress(), netmaskToPrefixLength(netmask));
    }

    public static String ipv6ToRegex(Inet6Address ip, int prefixLength) {
        if (prefixLength < 0 || prefixLength > 128) {
            throw new IllegalArgumentException("bad IPv6 prefix length: " + prefixLength);
        }
        return toRegex(ip.getAddress(), prefixLength);
    }

    /**
     * The binary spelling of an address: one <code>'0'</code> or
     * <code>'1'</code> per bit.
     */
    public static String toBinaryString(byte[] address) {
        StringBuilder sb = new StringBuilder(address.length * 8);
        for (byte b : address) {
            for (int bit = 7; bit >= 0; --bit) {
                sb.append((b >> bit & 1) == 0 ? '0' : '1');
            }
        }
        return sb.toString();
    }

    private static String toRegex(byte[] address, int prefixLength) {
        String bits = toBinaryString(address);
        if (prefixLength < bits.length()) {
            return bits.substring(0, prefixLength) + "(0|1)+";
        }
        return bits;
    }

    /**
     * Number of leading bits covered by a dotted quad netmask; 0 if it does
     * not parse.
     */
    static int netmaskToPrefixLength(String netmask) {
        if (netmask == null) return 0;
        String[] parts = netmask.trim().split("\\.", -1);
        if (parts.length != 4) return 0;
        int mask = 0;
        for (String part : parts) {
            int octet;
            try {
                octet = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return 0;
            }
            if (octet < 0 || octet > 255 || part.startsWith("+")) return 0;
            mask = mask << 8 | octet;
        }
        int len = 32;
        for (int t = ~mask; t != 0; t >>>= 1) {
            len--;
        }
        return len;
    }
}
