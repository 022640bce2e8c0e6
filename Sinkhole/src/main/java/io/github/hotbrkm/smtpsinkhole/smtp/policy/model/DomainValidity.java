package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

/**
 * A domain validity classification and the reason behind it, if any.
 */
public record DomainValidity(DnsResult result, String detail) {

    public static DomainValidity good() {
        return new DomainValidity(DnsResult.GOOD, null);
    }

    public static DomainValidity bad(String detail) {
        return new DomainValidity(DnsResult.BAD, detail);
    }

    public static DomainValidity tempfail(String detail) {
        return new DomainValidity(DnsResult.TEMPFAIL, detail);
    }
}
