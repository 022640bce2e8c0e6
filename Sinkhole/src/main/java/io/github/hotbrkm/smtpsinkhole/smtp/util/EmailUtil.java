package io.github.hotbrkm.smtpsinkhole.smtp.util;

import java.util.Locale;

/**
 * Utility class for email address and host name operations.
 */
public final class EmailUtil {

    private static final String NULL_SENDER_PATTERN = "<>";

    private EmailUtil() {
        // Prevent instantiation
    }

    /**
     * Extracts the domain part from an email address.
     *
     * @param address Email address (e.g. user@example.com)
     * @return Domain part (lowercase), or null if invalid
     */
    public static String extractDomain(String address) {
        if (address == null) {
            return null;
        }
        int at = address.lastIndexOf('@');
        if (at < 0 || at == address.length() - 1) {
            return null;
        }
        return address.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Matches an address against an address pattern.
     * <p>
     * Supported patterns are {@code <>} (the null sender only), {@code a@b}
     * (literal), {@code a@} (local part in any domain), {@code @b} (exact domain),
     * {@code @.b} (domain or any subdomain) and {@code @} (any address with both
     * a local part and a domain). Both sides are compared in lower case.
     *
     * @param address Address to test, empty for the null sender
     * @param pattern Address pattern
     * @return true if matched
     */
    public static boolean matchAddress(String address, String pattern) {
        if (address == null || pattern == null) {
            return false;
        }
        String addr = address.toLowerCase(Locale.ROOT);
        String pat = pattern.toLowerCase(Locale.ROOT);

        if (pat.equals(NULL_SENDER_PATTERN)) {
            return addr.isEmpty();
        }
        if (addr.isEmpty() || addr.startsWith("@") || addr.endsWith("@")) {
            return !addr.isEmpty() && addr.equals(pat);
        }

        int at = addr.lastIndexOf('@');
        if (pat.equals("@")) {
            return at > 0;
        }
        if (pat.length() > 1 && pat.endsWith("@") && pat.indexOf('@') == pat.length() - 1) {
            String local = pat.substring(0, pat.length() - 1);
            return at < 0 ? addr.equals(local) : addr.substring(0, at).equals(local);
        }
        if (pat.startsWith("@.")) {
            if (at < 0) {
                return false;
            }
            String domain = addr.substring(at + 1);
            String suffix = pat.substring(2);
            return domain.equals(suffix) || domain.endsWith(pat.substring(1));
        }
        if (pat.startsWith("@")) {
            return at >= 0 && addr.substring(at + 1).equals(pat.substring(1));
        }
        return addr.equals(pat);
    }

    /**
     * Matches a host name against a host pattern.
     * <p>
     * {@code b} matches exactly, {@code .b} matches {@code b} itself and anything
     * ending in {@code .b}. A trailing root dot on the host is ignored.
     *
     * @param host    Host name, possibly ending in a dot
     * @param pattern Host pattern
     * @return true if matched
     */
    public static boolean matchHost(String host, String pattern) {
        if (host == null || pattern == null) {
            return false;
        }
        String name = host.toLowerCase(Locale.ROOT);
        String pat = pattern.toLowerCase(Locale.ROOT);
        if (name.length() > 1 && name.endsWith(".")) {
            name = name.substring(0, name.length() - 1);
        }
        if (pat.length() > 1 && pat.startsWith(".")) {
            return name.equals(pat.substring(1)) || name.endsWith(pat);
        }
        return name.equals(pat);
    }
}
