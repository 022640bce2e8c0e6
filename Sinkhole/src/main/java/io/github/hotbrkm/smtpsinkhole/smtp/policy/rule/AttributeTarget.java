package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.classify.AddressClassifier;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.classify.HeloClassifier;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.classify.ReverseDnsClassifier;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.AttributeVocabulary;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

import java.util.Set;

/**
 * What an attribute matcher classifies.
 */
public enum AttributeTarget {
    FROM_HAS("from-has", SmtpPhase.MAIL_FROM, AttributeVocabulary.ADDRESS),
    TO_HAS("to-has", SmtpPhase.RCPT_TO, AttributeVocabulary.ADDRESS),
    HELO_HAS("helo-has", SmtpPhase.HELO, AttributeVocabulary.HELO),
    DNS("dns", SmtpPhase.CONNECT, AttributeVocabulary.DNS);

    private final String keyword;
    private final SmtpPhase requires;
    private final AttributeVocabulary vocabulary;

    AttributeTarget(String keyword, SmtpPhase requires, AttributeVocabulary vocabulary) {
        this.keyword = keyword;
        this.requires = requires;
        this.vocabulary = vocabulary;
    }

    public String keyword() {
        return keyword;
    }

    public SmtpPhase requires() {
        return requires;
    }

    public AttributeVocabulary vocabulary() {
        return vocabulary;
    }

    Set<Attribute> classify(RuleContext context) {
        return switch (this) {
            case FROM_HAS -> AddressClassifier.classify(context.getMailFrom(), context::domainValidity);
            case TO_HAS -> AddressClassifier.classify(context.getCurrentRecipient(), context::domainValidity);
            case HELO_HAS -> {
                Set<Attribute> attributes = HeloClassifier.classify(
                        context.getHeloName(), context.getLocalIp(), context.getRemoteIp());
                context.getGreetingVerb().attribute().ifPresent(attributes::add);
                yield attributes;
            }
            case DNS -> ReverseDnsClassifier.classify(context.getRemoteDns());
        };
    }

    public static AttributeTarget fromKeyword(String value) {
        for (AttributeTarget target : values()) {
            if (target.keyword.equals(value)) {
                return target;
            }
        }
        return null;
    }
}
