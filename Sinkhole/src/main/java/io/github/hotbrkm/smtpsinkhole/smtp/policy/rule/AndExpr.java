package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of terms that must all match. Stops at the first false term.
 */
public record AndExpr(List<RuleExpr> terms) implements RuleExpr {

    public AndExpr {
        terms = List.copyOf(terms);
    }

    @Override
    public boolean evaluate(RuleContext context) {
        for (RuleExpr term : terms) {
            if (!term.evaluate(context)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String render() {
        return "( " + renderTerms() + " )";
    }

    /**
     * @return the terms without surrounding parentheses, as written at the top of a clause
     */
    public String renderTerms() {
        return terms.stream().map(RuleExpr::render).collect(Collectors.joining(" "));
    }

    @Override
    public SmtpPhase requires() {
        SmtpPhase phase = SmtpPhase.CONNECT;
        for (RuleExpr term : terms) {
            phase = SmtpPhase.later(phase, term.requires());
        }
        return phase;
    }
}
