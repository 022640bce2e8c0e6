package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import java.util.Map;
import java.util.TreeMap;

/**
 * One alternative of a rule: an expression plus the with options it sets when it matches.
 * An empty option value is a flag.
 */
public record RuleClause(RuleExpr expression, Map<String, String> withOptions) {

    public RuleClause {
        withOptions = withOptions == null ? Map.of() : Map.copyOf(withOptions);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        if (expression instanceof AndExpr and) {
            sb.append(and.renderTerms());
        } else {
            sb.append(expression.render());
        }
        if (!withOptions.isEmpty()) {
            sb.append(' ').append(RuleKeywords.WITH);
            for (Map.Entry<String, String> option : new TreeMap<>(withOptions).entrySet()) {
                sb.append(' ').append(option.getKey());
                if (!option.getValue().isEmpty()) {
                    sb.append(' ').append(RuleKeywords.quote(option.getValue()));
                }
            }
        }
        return sb.toString();
    }
}
