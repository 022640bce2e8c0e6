package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

/**
 * Whether a domain looks like a mail domain. Constants are ordered from worst
 * to best; {@link #UNDEFINED} is only a starting value.
 */
public enum DnsResult {
    UNDEFINED,
    BAD,
    TEMPFAIL,
    GOOD;

    public boolean isBetterThan(DnsResult other) {
        return compareTo(other) > 0;
    }
}
