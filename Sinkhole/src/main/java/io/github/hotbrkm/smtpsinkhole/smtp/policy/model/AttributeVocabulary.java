package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The attribute names each attribute matcher accepts in a rule file.
 */
public enum AttributeVocabulary {
    ADDRESS(Map.of(
            "route", EnumSet.of(Attribute.ROUTE),
            "noat", EnumSet.of(Attribute.NOAT),
            "quoted", EnumSet.of(Attribute.QUOTED),
            "unqualified", EnumSet.of(Attribute.UNQUALIFIED),
            "garbage", EnumSet.of(Attribute.GARBAGE),
            "resolves", EnumSet.of(Attribute.DOMAIN_VALID),
            "unknown", EnumSet.of(Attribute.DOMAIN_TEMPFAIL),
            "baddom", EnumSet.of(Attribute.DOMAIN_INVALID),
            "bad", AttributeGroup.BAD.members())),
    HELO(Map.ofEntries(
            Map.entry("none", EnumSet.of(Attribute.NONE)),
            Map.entry("bogus", EnumSet.of(Attribute.BOGUS)),
            Map.entry("helo", EnumSet.of(Attribute.HELO)),
            Map.entry("ehlo", EnumSet.of(Attribute.EHLO)),
            Map.entry("nodots", EnumSet.of(Attribute.NODOTS)),
            Map.entry("bareip", EnumSet.of(Attribute.BAREIP)),
            Map.entry("properip", EnumSet.of(Attribute.PROPERIP)),
            Map.entry("myip", EnumSet.of(Attribute.MYIP)),
            Map.entry("remoteip", EnumSet.of(Attribute.REMOTEIP)),
            Map.entry("otherip", EnumSet.of(Attribute.OTHERIP)),
            Map.entry("ip", AttributeGroup.IP.members()))),
    DNS(Map.of(
            "nodns", EnumSet.of(Attribute.NODNS),
            "noforward", EnumSet.of(Attribute.NOFORWARD),
            "inconsistent", EnumSet.of(Attribute.INCONSISTENT),
            "exists", EnumSet.of(Attribute.EXISTS),
            "good", EnumSet.of(Attribute.GOOD))),
    // helo and ehlo select the same source
    DBL_SOURCE(Map.of(
            "host", EnumSet.of(Attribute.HOST),
            "helo", EnumSet.of(Attribute.EHLO),
            "ehlo", EnumSet.of(Attribute.EHLO),
            "from", EnumSet.of(Attribute.FROM),
            "any", AttributeGroup.ANY.members()));

    private final Map<String, Set<Attribute>> names;

    AttributeVocabulary(Map<String, Set<Attribute>> names) {
        this.names = names;
    }

    /**
     * Parses a comma separated attribute list such as {@code bad,route}.
     * @param list the list text
     * @return the union of the named attributes
     * @throws IllegalArgumentException if the list is empty or names something unknown
     */
    public Set<Attribute> parse(String list) {
        if (list == null || list.isEmpty()) {
            throw new IllegalArgumentException("empty attribute list");
        }
        Set<Attribute> result = EnumSet.noneOf(Attribute.class);
        for (String name : list.split(",", -1)) {
            Set<Attribute> attributes = names.get(name);
            if (attributes == null) {
                throw new IllegalArgumentException("unknown attribute '" + name + "'");
            }
            result.addAll(attributes);
        }
        return result;
    }
}
