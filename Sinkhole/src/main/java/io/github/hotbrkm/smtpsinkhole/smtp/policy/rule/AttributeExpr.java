package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

import java.util.Set;

/**
 * {@code from-has|to-has|helo-has|dns ATTR[,ATTR...]}: the classified value has
 * at least one of the listed attributes.
 */
public record AttributeExpr(AttributeTarget target, Set<Attribute> attributes) implements RuleExpr {

    public AttributeExpr {
        attributes = Set.copyOf(attributes);
    }

    @Override
    public boolean evaluate(RuleContext context) {
        return Attribute.intersects(target.classify(context), attributes);
    }

    @Override
    public String render() {
        return target.keyword() + " " + Attribute.render(attributes);
    }

    @Override
    public SmtpPhase requires() {
        return target.requires();
    }
}
