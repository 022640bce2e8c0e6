package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import java.util.Optional;

/**
 * The command a client introduced itself with.
 */
public enum GreetingVerb {
    /** The protocol layer does not report the verb. */
    UNKNOWN(null),
    HELO(Attribute.HELO),
    EHLO(Attribute.EHLO);

    private final Attribute attribute;

    GreetingVerb(Attribute attribute) {
        this.attribute = attribute;
    }

    /**
     * @return the {@code helo-has} attribute for this verb, empty when unknown
     */
    public Optional<Attribute> attribute() {
        return Optional.ofNullable(attribute);
    }
}
