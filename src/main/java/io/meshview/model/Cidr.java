package io.meshview.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Route canonicalization.
 *
 * <p>The same route can arrive with different host bits from different sources
 * ({@code 192.168.1.5/24} from one, {@code 192.168.1.0/24} from another), so every
 * CIDR is reduced to its network address before it is compared or deduplicated.
 * Parsing is purely textual; no name resolution ever happens here.
 */
public final class Cidr {
    public static final String DEFAULT_ROUTE_V4 = "0.0.0.0/0";
    public static final String DEFAULT_ROUTE_V6 = "::/0";
    public static final Set<String> DEFAULT_ROUTES = Set.of(DEFAULT_ROUTE_V4, DEFAULT_ROUTE_V6);

    private Cidr() {
    }

    public static String canonical(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("CIDR cannot be empty");
        }
        String value = raw.trim();
        int slash = value.indexOf('/');
        String addressPart = slash < 0 ? value : value.substring(0, slash);
        boolean v6 = addressPart.indexOf(':') >= 0;
        byte[] bytes = v6 ? parseV6(addressPart, raw) : parseV4(addressPart, raw);
        int maxPrefix = bytes.length * 8;
        int prefix = slash < 0 ? maxPrefix : parsePrefix(value.substring(slash + 1), maxPrefix, raw);
        clearHostBits(bytes, prefix);
        return (v6 ? formatV6(bytes) : formatV4(bytes)) + "/" + prefix;
    }

    public static boolean isValid(String raw) {
        try {
            canonical(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static Set<String> canonicalSet(Collection<String> routes) {
        if (routes == null || routes.isEmpty()) {
            return Set.of();
        }
        TreeSet<String> out = new TreeSet<>();
        for (String route : routes) {
            out.add(canonical(route));
        }
        return Collections.unmodifiableSet(out);
    }

    public static boolean isDefaultRoute(String canonical) {
        return DEFAULT_ROUTES.contains(canonical);
    }

    private static int parsePrefix(String raw, int maxPrefix, String original) {
        if (raw.isEmpty() || raw.length() > 3 || !raw.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Invalid prefix length in CIDR: " + original);
        }
        int prefix = Integer.parseInt(raw);
        if (prefix > maxPrefix) {
            throw new IllegalArgumentException("Prefix length out of range in CIDR: " + original);
        }
        return prefix;
    }

    private static byte[] parseV4(String address, String original) {
        String[] parts = address.split("\\.", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid IPv4 address in CIDR: " + original);
        }
        byte[] out = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Invalid IPv4 address in CIDR: " + original);
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                throw new IllegalArgumentException("Invalid IPv4 octet in CIDR: " + original);
            }
            out[i] = (byte) octet;
        }
        return out;
    }

    private static byte[] parseV6(String address, String original) {
        if (address.indexOf('%') >= 0) {
            throw new IllegalArgumentException("Zoned IPv6 address not allowed in CIDR: " + original);
        }
        int gap = address.indexOf("::");
        if (gap >= 0 && address.indexOf("::", gap + 1) >= 0) {
            throw new IllegalArgumentException("Invalid IPv6 address in CIDR: " + original);
        }
        int[] head = gap < 0 ? parseGroups(address, original) : parseGroups(address.substring(0, gap), original);
        int[] tail = gap < 0 ? new int[0] : parseGroups(address.substring(gap + 2), original);
        int total = head.length + tail.length;
        if ((gap < 0 && total != 8) || (gap >= 0 && total > 7)) {
            throw new IllegalArgumentException("Invalid IPv6 address in CIDR: " + original);
        }
        int[] groups = new int[8];
        System.arraycopy(head, 0, groups, 0, head.length);
        System.arraycopy(tail, 0, groups, 8 - tail.length, tail.length);
        byte[] out = new byte[16];
        for (int i = 0; i < 8; i++) {
            out[i * 2] = (byte) (groups[i] >>> 8);
            out[i * 2 + 1] = (byte) groups[i];
        }
        return out;
    }

    private static int[] parseGroups(String part, String original) {
        if (part.isEmpty()) {
            return new int[0];
        }
        String[] tokens = part.split(":", -1);
        boolean dottedTail = tokens[tokens.length - 1].indexOf('.') >= 0;
        int[] out = new int[tokens.length + (dottedTail ? 1 : 0)];
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (dottedTail && i == tokens.length - 1) {
                byte[] v4 = parseV4(token, original);
                out[i] = ((v4[0] & 0xff) << 8) | (v4[1] & 0xff);
                out[i + 1] = ((v4[2] & 0xff) << 8) | (v4[3] & 0xff);
                continue;
            }
            if (token.isEmpty() || token.length() > 4) {
                throw new IllegalArgumentException("Invalid IPv6 group in CIDR: " + original);
            }
            int group = 0;
            for (int c = 0; c < token.length(); c++) {
                int digit = Character.digit(token.charAt(c), 16);
                if (digit < 0) {
                    throw new IllegalArgumentException("Invalid IPv6 group in CIDR: " + original);
                }
                group = (group << 4) | digit;
            }
            out[i] = group;
        }
        return out;
    }

    private static void clearHostBits(byte[] bytes, int prefix) {
        for (int i = 0; i < bytes.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            int mask = bitsInByte == 0 ? 0 : (0xff << (8 - bitsInByte)) & 0xff;
            bytes[i] = (byte) (bytes[i] & mask);
        }
    }

    private static String formatV4(byte[] bytes) {
        return (bytes[0] & 0xff) + "." + (bytes[1] & 0xff) + "." + (bytes[2] & 0xff) + "." + (bytes[3] & 0xff);
    }

    private static String formatV6(byte[] bytes) {
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[i * 2] & 0xff) << 8) | (bytes[i * 2 + 1] & 0xff);
        }
        // Longest run of zero groups (length >= 2, first one wins a tie) collapses to "::".
        int bestStart = -1;
        int bestLen = 0;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int start = i;
            while (i < 8 && groups[i] == 0) {
                i++;
            }
            int len = i - start;
            if (len > bestLen && len >= 2) {
                bestStart = start;
                bestLen = len;
            }
        }
        StringBuilder sb = new StringBuilder(39);
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLen - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }
}
