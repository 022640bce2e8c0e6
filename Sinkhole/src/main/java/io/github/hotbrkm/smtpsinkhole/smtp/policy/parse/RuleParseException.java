package io.github.hotbrkm.smtpsinkhole.smtp.policy.parse;

import lombok.Getter;

/**
 * A rule file could not be used: a lexical, grammar or semantic error, a broken
 * or cyclic include, or an unreadable file.
 * <p>
 * The message has the form {@code <source>:<line>: <reason>}.
 * </p>
 */
@Getter
public class RuleParseException extends Exception {

    private final String source;
    private final int line;
    private final String reason;

    public RuleParseException(String source, int line, String reason) {
        super(format(source, line, reason));
        this.source = source;
        this.line = line;
        this.reason = reason;
    }

    public RuleParseException(String source, int line, String reason, Throwable cause) {
        super(format(source, line, reason), cause);
        this.source = source;
        this.line = line;
        this.reason = reason;
    }

    private static String format(String source, int line, String reason) {
        return line > 0 ? source + ":" + line + ": " + reason : source + ": " + reason;
    }
}
