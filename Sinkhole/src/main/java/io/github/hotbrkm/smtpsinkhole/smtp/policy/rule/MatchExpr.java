package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

import java.util.List;

/**
 * {@code helo|host|from|to|ip PATTERN}: a context value matches a literal
 * pattern or any pattern from a pattern file.
 * <p>
 * An empty pattern list marks the context data-unavailable.
 * </p>
 */
public record MatchExpr(MatchTarget target, String argument) implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        List<String> patterns = context.patterns(argument);
        if (patterns.isEmpty()) {
            context.markDataUnavailable();
            return false;
        }
        for (String value : target.values(context)) {
            for (String pattern : patterns) {
                if (target.matches(value, pattern)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String render() {
        return target.keyword() + " " + RuleKeywords.renderArgument(argument);
    }

    @Override
    public SmtpPhase requires() {
        return target.requires();
    }
}
