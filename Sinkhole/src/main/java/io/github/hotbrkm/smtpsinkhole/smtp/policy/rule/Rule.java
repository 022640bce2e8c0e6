package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleAction;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A parsed rule: clauses tried in order, the action they produce and when the
 * rule may be checked.
 *
 * @param clauses  clauses in file order
 * @param action   action of the rule
 * @param requires earliest phase at which every matcher has its data
 * @param deferTo  the only phase the rule is checked in, or {@link SmtpPhase#ANY}
 */
public record Rule(List<RuleClause> clauses, RuleAction action, SmtpPhase requires, SmtpPhase deferTo) {

    public Rule {
        clauses = List.copyOf(clauses);
    }

    /**
     * A rule without an explicit phase is checked at every phase from
     * {@code requires} on; one with an explicit phase only at that phase.
     */
    public boolean isEligible(SmtpPhase phase) {
        if (!phase.isAtLeast(requires)) {
            return false;
        }
        return deferTo == SmtpPhase.ANY || deferTo == phase;
    }

    /**
     * Checks the clauses in order and merges the with options of the first
     * one that matches into the context.
     * <p>
     * If any clause evaluated so far marked the context data-unavailable the
     * whole rule fails, including clauses after it that might have matched.
     * </p>
     *
     * @param context connection state
     * @return the matching clause, if any
     */
    public Optional<RuleClause> check(RuleContext context) {
        context.resetDataUnavailable();
        for (RuleClause clause : clauses) {
            boolean matched = clause.expression().evaluate(context);
            if (context.isDataUnavailable()) {
                return Optional.empty();
            }
            if (matched) {
                context.mergeWithProperties(clause.withOptions());
                return Optional.of(clause);
            }
        }
        return Optional.empty();
    }

    public String render() {
        String prefix = deferTo == SmtpPhase.ANY ? "" : deferTo.keyword() + " ";
        return prefix + action.keyword() + " "
                + clauses.stream().map(RuleClause::render).collect(Collectors.joining("; "));
    }
}
