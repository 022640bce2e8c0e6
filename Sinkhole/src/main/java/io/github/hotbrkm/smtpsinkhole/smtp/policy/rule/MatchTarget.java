package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.util.EmailUtil;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;

import java.util.List;

/**
 * What a pattern matcher reads from the context and how it compares.
 */
public enum MatchTarget {
    HELO("helo", SmtpPhase.HELO),
    HOST("host", SmtpPhase.CONNECT),
    FROM("from", SmtpPhase.MAIL_FROM),
    TO("to", SmtpPhase.RCPT_TO),
    IP("ip", SmtpPhase.CONNECT);

    private final String keyword;
    private final SmtpPhase requires;

    MatchTarget(String keyword, SmtpPhase requires) {
        this.keyword = keyword;
        this.requires = requires;
    }

    public String keyword() {
        return keyword;
    }

    public SmtpPhase requires() {
        return requires;
    }

    List<String> values(RuleContext context) {
        return switch (this) {
            case HELO -> List.of(context.getHeloName());
            case HOST -> context.getRemoteDns().verified();
            case FROM -> List.of(context.getMailFrom());
            case TO -> List.of(context.getCurrentRecipient());
            case IP -> List.of(context.getRemoteIp());
        };
    }

    boolean matches(String value, String pattern) {
        return switch (this) {
            case HELO, HOST -> EmailUtil.matchHost(value, pattern);
            case FROM, TO -> EmailUtil.matchAddress(value, pattern);
            case IP -> IpAddressUtil.matchesIp(value, pattern);
        };
    }

    public static MatchTarget fromKeyword(String value) {
        if ("ehlo".equals(value)) {
            return HELO;
        }
        for (MatchTarget target : values()) {
            if (target.keyword.equals(value)) {
                return target;
            }
        }
        return null;
    }
}
