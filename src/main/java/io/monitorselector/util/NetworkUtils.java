package io.monitorselector.util;

import com.google.common.net.InetAddresses;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Optional;

/**
 * IP address helpers for the subnet and diversity constraints.
 */
public final class NetworkUtils {

    private NetworkUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Parse a literal IPv4 or IPv6 address without any name resolution.
     *
     * @return the address, or empty when the value is blank or not an IP literal
     */
    public static Optional<InetAddress> parse(String ip) {
        if (ip == null || ip.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddresses.forString(ip.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isIpv4(InetAddress address) {
        return address instanceof Inet4Address;
    }

    public static boolean sameFamily(InetAddress a, InetAddress b) {
        return isIpv4(a) == isIpv4(b);
    }

    /**
     * Whether both addresses fall in the same network of the given prefix length.
     * Addresses of different families never share a prefix.
     */
    public static boolean samePrefix(InetAddress a, InetAddress b, int prefixLength) {
        if (!sameFamily(a, b)) {
            return false;
        }
        byte[] left = a.getAddress();
        byte[] right = b.getAddress();
        if (prefixLength < 0 || prefixLength > left.length * 8) {
            throw new IllegalArgumentException("Invalid prefix length " + prefixLength);
        }

        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (left[i] != right[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (left[fullBytes] & mask) == (right[fullBytes] & mask);
    }

    /**
     * Network of {@code address} at {@code prefixLength} in CIDR notation, e.g. {@code 192.0.16.0/20}.
     */
    public static String toCidr(InetAddress address, int prefixLength) {
        byte[] bytes = address.getAddress();
        for (int bit = prefixLength; bit < bytes.length * 8; bit++) {
            bytes[bit / 8] &= (byte) ~(1 << (7 - bit % 8));
        }
        try {
            return InetAddresses.toAddrString(InetAddress.getByAddress(bytes)) + "/" + prefixLength;
        } catch (java.net.UnknownHostException e) {
            // only thrown for illegal lengths, which cannot happen for a copied address
            throw new IllegalStateException("Unexpected address length " + bytes.length, e);
        }
    }
}
