package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;

/**
 * {@code dnsbl DOMAIN}: the remote IP is listed in an IP blocklist zone.
 * Only IPv4 clients can be listed.
 */
public record DnsblExpr(String domain) implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        String reversed = IpAddressUtil.reverseIpv4(context.getRemoteIp());
        if (reversed == null) {
            return false;
        }
        if (context.isListed(reversed + "." + domain)) {
            context.recordDnsblHit(domain);
            return true;
        }
        return false;
    }

    @Override
    public String render() {
        return "dnsbl " + RuleKeywords.renderArgument(domain);
    }

    @Override
    public SmtpPhase requires() {
        return SmtpPhase.CONNECT;
    }
}
