package io.xrelay.gateway;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects targets that must never be fetched on a caller's behalf: non-HTTP(S) schemes,
 * loopback, private and link-local addresses, and localhost names.
 */
public final class UrlValidator {
    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    // Hosts made only of numeric parts are IPv4 literals to the resolver, in any radix.
    private static final Pattern NUMERIC_HOST = Pattern.compile("^(0[xX][0-9a-fA-F]*|[0-9]+)(\\.(0[xX][0-9a-fA-F]*|[0-9]+)){0,3}$");

    private final List<String> allowedDomains;

    public UrlValidator() {
        this(List.of());
    }

    /** @param allowedDomains exact host names to accept; empty accepts any public host */
    public UrlValidator(List<String> allowedDomains) {
        this.allowedDomains = allowedDomains.stream()
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .filter(d -> !d.isEmpty())
                .toList();
    }

    public Validation validate(String url) {
        if (url == null || url.isBlank()) {
            return Validation.rejected("URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Validation.rejected("Malformed URL: " + e.getReason());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            return Validation.rejected("Protocol not allowed: " + (scheme.isEmpty() ? "none" : scheme));
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return Validation.rejected("URL has no host");
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (!allowedDomains.isEmpty() && !allowedDomains.contains(host)) {
            return Validation.rejected("Domain not allowed: " + host);
        }
        String addressReason = checkAddress(host);
        if (addressReason != null) {
            return Validation.rejected(addressReason);
        }
        if (host.equals("localhost") || host.endsWith(".localhost")) {
            return Validation.rejected("Localhost not allowed");
        }
        return Validation.ok();
    }

    static String checkAddress(String host) {
        if (host.contains(":")) {
            return checkIpv6(host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host);
        }
        if (!NUMERIC_HOST.matcher(host).matches()) {
            return null;
        }
        byte[] v4 = parseIpv4(host);
        if (v4 == null) {
            return "Invalid IPv4 address";
        }
        return checkIpv4(v4);
    }

    private static String checkIpv4(byte[] v4) {
        InetAddress address = literal(v4);
        if ((v4[0] & 0xff) == 0 || address.isAnyLocalAddress()) {
            return "Unspecified address not allowed";
        }
        if (address.isLoopbackAddress()) {
            return "Loopback address not allowed";
        }
        if (address.isSiteLocalAddress()) {
            return "Private network not allowed";
        }
        if (address.isLinkLocalAddress()) {
            return "Link-local address not allowed";
        }
        return null;
    }

    private static String checkIpv6(String literal) {
        InetAddress address;
        try {
            // Bracketed literals are parsed locally and never sent to the resolver.
            address = InetAddress.getByName("[" + literal + "]");
        } catch (UnknownHostException e) {
            return "Invalid IPv6 address";
        }
        byte[] raw = address.getAddress();
        if (raw.length == 4) {
            // ::ffff:a.b.c.d comes back as an IPv4 address
            return checkIpv4(raw);
        }
        if (address.isAnyLocalAddress()) {
            return "IPv6 unspecified address not allowed";
        }
        if (address.isLoopbackAddress()) {
            return "IPv6 loopback not allowed";
        }
        if (((Inet6Address) address).isIPv4CompatibleAddress()) {
            return checkIpv4(Arrays.copyOfRange(raw, 12, 16));
        }
        if ((raw[0] & 0xfe) == 0xfc || address.isSiteLocalAddress()) {
            return "IPv6 private network not allowed";
        }
        if (address.isLinkLocalAddress()) {
            return "IPv6 link-local not allowed";
        }
        return null;
    }

    /**
     * Parses the numeric IPv4 forms resolvers accept: one to four dot-separated parts, each
     * decimal, octal (leading 0) or hex (0x), the last part filling the remaining bytes.
     */
    static byte[] parseIpv4(String host) {
        String[] parts = host.split("\\.", -1);
        if (parts.length > 4) {
            return null;
        }
        long[] values = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            long value = parsePart(parts[i]);
            if (value < 0L) {
                return null;
            }
            values[i] = value;
        }
        long last = values[values.length - 1];
        int lastBytes = 5 - values.length;
        if (last >= 1L << (8 * lastBytes)) {
            return null;
        }
        long packed = 0L;
        for (int i = 0; i < values.length - 1; i++) {
            if (values[i] > 255L) {
                return null;
            }
            packed |= values[i] << (8 * (3 - i));
        }
        packed |= last;
        return new byte[]{(byte) (packed >>> 24), (byte) (packed >>> 16), (byte) (packed >>> 8), (byte) packed};
    }

    private static long parsePart(String part) {
        if (part.isEmpty() || part.length() > 12) {
            return -1L;
        }
        try {
            if (part.startsWith("0x") || part.startsWith("0X")) {
                return part.length() == 2 ? 0L : Long.parseLong(part.substring(2), 16);
            }
            if (part.length() > 1 && part.charAt(0) == '0') {
                return Long.parseLong(part.substring(1), 8);
            }
            return Long.parseLong(part);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static InetAddress literal(byte[] v4) {
        try {
            return InetAddress.getByAddress(v4);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("4-byte address rejected", e);
        }
    }

    public record Validation(boolean valid, String reason) {
        public static Validation ok() {
            return new Validation(true, null);
        }

        public static Validation rejected(String reason) {
            return new Validation(false, reason);
        }
    }
}
