package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

/**
 * {@code all}: always matches.
 */
public record AllExpr() implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        return true;
    }

    @Override
    public String render() {
        return "all";
    }

    @Override
    public SmtpPhase requires() {
        return SmtpPhase.CONNECT;
    }
}
