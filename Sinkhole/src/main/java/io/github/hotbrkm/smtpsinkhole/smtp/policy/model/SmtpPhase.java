package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import java.util.Locale;

/**
 * Enumeration of SMTP conversation phases.
 * <p>
 * Phases are ordered; a rule that needs data from a phase can only be checked
 * at that phase or a later one. {@link #ANY} is the unset value and sorts first.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
public enum SmtpPhase {
    /** No explicit phase. */
    ANY("@any"),
    /** Initial connection, before the greeting banner. */
    CONNECT("@connect"),
    /** After EHLO/HELO. */
    HELO("@helo"),
    /** After MAIL FROM. */
    MAIL_FROM("@from"),
    /** After each RCPT TO. */
    RCPT_TO("@to"),
    /** DATA command received, before the message is transferred. */
    DATA("@data"),
    /** After the message has been received. */
    MESSAGE("@message");

    private final String keyword;

    SmtpPhase(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isAtLeast(SmtpPhase other) {
        return compareTo(other) >= 0;
    }

    public static SmtpPhase later(SmtpPhase a, SmtpPhase b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Converts a rule file phase keyword such as {@code @from} to a phase.
     * {@code @any} is not accepted since it only renders "unset".
     * @param value the keyword
     * @return the phase, or null if the keyword is unknown
     */
    public static SmtpPhase fromKeyword(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SmtpPhase phase : values()) {
            if (phase != ANY && phase.keyword.equals(normalized)) {
                return phase;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
