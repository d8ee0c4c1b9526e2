package com.lingshield.core.sandbox;

import com.lingshield.api.exception.InvalidArgumentException;

import java.util.regex.Pattern;

/**
 * IPv4 网段
 */
final class Cidr {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final long network;
    private final long mask;

    private Cidr(long network, long mask) {
        this.network = network;
        this.mask = mask;
    }

    static Cidr parse(String cidr) {
        int slash = cidr.indexOf('/');
        String address = cidr.substring(0, slash);
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("cidr", "Invalid prefix: " + cidr);
        }
        if (prefix < 0 || prefix > 32 || !IPV4.matcher(address).matches()) {
            throw new InvalidArgumentException("cidr", "Invalid CIDR: " + cidr);
        }
        long mask = prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return new Cidr(toLong(address) & mask, mask);
    }

    /**
     * 仅匹配 IPv4 字面量，主机名一律不匹配（不做 DNS 解析）
     */
    boolean contains(String host) {
        if (!IPV4.matcher(host).matches()) {
            return false;
        }
        return (toLong(host) & mask) == network;
    }

    private static long toLong(String address) {
        long value = 0;
        for (String octet : address.split("\\.")) {
            int part = Integer.parseInt(octet);
            if (part > 255) {
                throw new InvalidArgumentException("cidr", "Invalid address: " + address);
            }
            value = (value << 8) | part;
        }
        return value;
    }
}
