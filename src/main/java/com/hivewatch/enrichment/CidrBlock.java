package com.hivewatch.enrichment;

import com.google.common.net.InetAddresses;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;

/**
 * An IPv4 or IPv6 network in CIDR notation. A bare address is a /32 or /128.
 */
public final class CidrBlock {

    private final String notation;
    private final int bits;
    private final BigInteger network;
    private final int prefix;

    private CidrBlock(String notation, int bits, BigInteger network, int prefix) {
        this.notation = notation;
        this.bits = bits;
        this.network = network;
        this.prefix = prefix;
    }

    /**
     * @throws IllegalArgumentException if the text is not an address or CIDR block
     */
    public static CidrBlock parse(String text) {
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        InetAddress address = InetAddresses.forString(slash >= 0 ? trimmed.substring(0, slash) : trimmed);
        int bits = address instanceof Inet4Address ? 32 : 128;
        int prefix = slash >= 0 ? Integer.parseInt(trimmed.substring(slash + 1)) : bits;
        if (prefix < 0 || prefix > bits) {
            throw new IllegalArgumentException("Invalid prefix length in " + text);
        }
        return new CidrBlock(trimmed, bits, mask(InetAddresses.toBigInteger(address), bits, prefix), prefix);
    }

    public static boolean isAddress(String text) {
        return InetAddresses.isInetAddress(text.trim());
    }

    public boolean contains(String ip) {
        if (ip == null || !InetAddresses.isInetAddress(ip)) {
            return false;
        }
        InetAddress address = InetAddresses.forString(ip);
        int addressBits = address instanceof Inet4Address ? 32 : 128;
        if (addressBits != bits) {
            return false;
        }
        return mask(InetAddresses.toBigInteger(address), bits, prefix).equals(network);
    }

    public boolean isSingleAddress() {
        return prefix == bits;
    }

    private static BigInteger mask(BigInteger value, int bits, int prefix) {
        return value.shiftRight(bits - prefix);
    }

    @Override
    public String toString() {
        return notation;
    }
}
