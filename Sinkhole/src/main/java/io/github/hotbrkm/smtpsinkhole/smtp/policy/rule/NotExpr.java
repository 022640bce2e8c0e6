package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

/**
 * {@code not X}. Negation does not clear a data-unavailable mark raised by X.
 */
public record NotExpr(RuleExpr operand) implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        return !operand.evaluate(context);
    }

    @Override
    public String render() {
        return "not " + operand.render();
    }

    @Override
    public SmtpPhase requires() {
        return operand.requires();
    }
}
