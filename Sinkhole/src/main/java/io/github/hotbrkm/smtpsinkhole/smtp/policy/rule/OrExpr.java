package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

/**
 * {@code a or b}. The right side is not evaluated when the left side matches.
 */
public record OrExpr(RuleExpr left, RuleExpr right) implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        return left.evaluate(context) || right.evaluate(context);
    }

    @Override
    public String render() {
        return "( " + left.render() + " or " + right.render() + " )";
    }

    @Override
    public SmtpPhase requires() {
        return SmtpPhase.later(left.requires(), right.requires());
    }
}
