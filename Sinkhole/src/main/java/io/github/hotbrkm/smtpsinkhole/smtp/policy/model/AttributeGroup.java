package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import java.util.EnumSet;
import java.util.Set;

import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.BAREIP;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.EHLO;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.FROM;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.GARBAGE;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.HOST;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.NOAT;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.PROPERIP;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.ROUTE;
import static io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute.UNQUALIFIED;

/**
 * Named shorthands for several attributes at once.
 */
public enum AttributeGroup {
    BAD("bad", EnumSet.of(UNQUALIFIED, ROUTE, NOAT, GARBAGE)),
    IP("ip", EnumSet.of(BAREIP, PROPERIP)),
    ANY("any", EnumSet.of(HOST, EHLO, FROM));

    private final String keyword;
    private final Set<Attribute> members;

    AttributeGroup(String keyword, Set<Attribute> members) {
        this.keyword = keyword;
        this.members = members;
    }

    public String keyword() {
        return keyword;
    }

    public Set<Attribute> members() {
        return EnumSet.copyOf(members);
    }
}
