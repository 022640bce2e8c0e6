package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleAction;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.WithOption;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The ordered rules in force for one connection.
 * <p>
 * A scan walks the rules eligible at a phase in order. The first matching rule
 * with a real action decides; matching {@code set-with} rules only add their
 * with options and the scan goes on. With no deciding rule the result is
 * accept with whatever options were set.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Slf4j
public final class Ruleset {

    private static final Ruleset EMPTY = new Ruleset(List.of());

    private final List<Rule> rules;

    private Ruleset(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Ruleset of(List<Rule> rules) {
        return new Ruleset(rules);
    }

    public static Ruleset empty() {
        return EMPTY;
    }

    /**
     * @return a ruleset that stalls everything, used when the rule files are broken
     */
    public static Ruleset failSafe() {
        RuleClause all = new RuleClause(new AllExpr(), Map.of());
        return new Ruleset(List.of(new Rule(List.of(all), RuleAction.STALL, SmtpPhase.CONNECT, SmtpPhase.ANY)));
    }

    /**
     * @return this ruleset followed by the rules of another, which have lower priority
     */
    public Ruleset plus(Ruleset other) {
        List<Rule> combined = new ArrayList<>(rules);
        combined.addAll(other.rules);
        return new Ruleset(combined);
    }

    public RuleDecision scan(SmtpPhase phase, RuleContext context) {
        for (Rule rule : rules) {
            if (!rule.isEligible(phase)) {
                continue;
            }
            Optional<RuleClause> matched = rule.check(context);
            if (matched.isEmpty()) {
                continue;
            }
            String note = matched.get().withOptions().get(WithOption.NOTE.keyword());
            if (note != null) {
                log.info("rule-note sessionId={} phase={} note={}", context.getSessionId(), phase, note);
            }
            if (rule.action() == RuleAction.SET_WITH) {
                continue;
            }
            return new RuleDecision(rule.action(), context.snapshotWithProperties(), rule.render());
        }
        return RuleDecision.defaultAccept(context.snapshotWithProperties());
    }

    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public String render() {
        return rules.stream().map(Rule::render).collect(Collectors.joining("\n"));
    }
}
