package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

/**
 * {@code tls on|off}: compares against the connection's TLS state.
 */
public record TlsExpr(boolean on) implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        return context.isTlsOn() == on;
    }

    @Override
    public String render() {
        return on ? "tls on" : "tls off";
    }

    @Override
    public SmtpPhase requires() {
        return SmtpPhase.MAIL_FROM;
    }
}
