package com.entity.reconciliation.core.model;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives an asset class from its name and DNS value without any network lookups.
 */
final class AddressClassifier {

    static final String AWS = "aws";
    static final String S3 = "s3";
    static final String IPV4 = "ipv4";
    static final String IPV6 = "ipv6";
    static final String CIDR = "cidr";
    static final String TLD = "tld";
    static final String DOMAIN = "domain";

    private static final Pattern AWS_ARN = Pattern.compile("^arn:aws:");
    private static final Pattern S3_BUCKET = Pattern.compile("^(s3://)([^/]+)/?$");
    private static final Pattern DOMAIN_NAME = Pattern.compile(
            "^(https?://)?((xn--[a-zA-Z0-9-]+|[a-zA-Z0-9-]+)\\.)+([a-zA-Z]{2,})$");

    private AddressClassifier() {
    }

    /**
     * Name-based classes take precedence over DNS-based ones. Returns the empty string
     * when nothing matches.
     */
    static String classify(String dns, String name) {
        if (name != null) {
            if (AWS_ARN.matcher(name).find()) {
                return AWS;
            }
            if (S3_BUCKET.matcher(name).matches()) {
                return S3;
            }
            Optional<InetAddress> address = parseAddress(name);
            if (address.isPresent()) {
                return address.get() instanceof Inet4Address ? IPV4 : IPV6;
            }
        }
        if (dns != null) {
            if (parseCidr(dns).isPresent()) {
                return CIDR;
            }
            if (DOMAIN_NAME.matcher(dns).matches()) {
                return isRegistrableDomain(dns) ? TLD : DOMAIN;
            }
        }
        return "";
    }

    static Optional<InetAddress> parseAddress(String value) {
        if (value == null || !InetAddresses.isInetAddress(value)) {
            return Optional.empty();
        }
        return Optional.of(InetAddresses.forString(value));
    }

    /**
     * Network address of a CIDR block, if the value is one.
     */
    static Optional<InetAddress> parseCidr(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1) {
            return Optional.empty();
        }
        Optional<InetAddress> address = parseAddress(value.substring(0, slash));
        if (address.isEmpty()) {
            return Optional.empty();
        }
        int bits;
        try {
            bits = Integer.parseInt(value.substring(slash + 1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        int max = address.get() instanceof Inet4Address ? 32 : 128;
        return bits < 0 || bits > max ? Optional.empty() : address;
    }

    /**
     * RFC 1918 IPv4 ranges and IPv6 unique local addresses.
     */
    static boolean isPrivate(InetAddress address) {
        if (address instanceof Inet4Address) {
            return address.isSiteLocalAddress();
        }
        if (address instanceof Inet6Address) {
            return (address.getAddress()[0] & 0xfe) == 0xfc;
        }
        return false;
    }

    private static boolean isRegistrableDomain(String value) {
        if (value.contains("/")) {
            return false;
        }
        try {
            return InternetDomainName.from(value).isTopDomainUnderRegistrySuffix();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
