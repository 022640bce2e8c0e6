package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import java.util.Set;

/**
 * Reserved words of the rule language and quoting of free-form arguments.
 */
public final class RuleKeywords {

    public static final String NOT = "not";
    public static final String OR = "or";
    public static final String WITH = "with";
    public static final String INCLUDE = "include";

    /**
     * Words that cannot appear unquoted where a pattern or domain is expected.
     */
    public static final Set<String> RESERVED = Set.of(
            "all", "tls", "dnsbl", "dbl", "source",
            "helo", "ehlo", "host", "from", "to", "ip",
            "from-has", "to-has", "helo-has", "dns",
            NOT, OR, WITH,
            "accept", "reject", "stall", "set-with");

    private RuleKeywords() {
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(word);
    }

    /**
     * Renders an argument bare when it would lex back as the same single word,
     * quoted and escaped otherwise.
     */
    public static String renderArgument(String argument) {
        if (isBareWord(argument)) {
            return argument;
        }
        return quote(argument);
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    private static boolean isBareWord(String argument) {
        if (argument.isEmpty() || isReserved(argument) || argument.charAt(0) == '#') {
            return false;
        }
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ';' || c == '"' || c == '\\') {
                return false;
            }
        }
        return true;
    }
}
