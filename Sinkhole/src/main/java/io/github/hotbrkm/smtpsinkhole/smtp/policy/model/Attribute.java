package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Classified properties of a HELO name, of reverse DNS results, of an address,
 * and the DBL source selectors.
 * <p>
 * All four families share this one type so that sets of them render and compare
 * uniformly; a matcher only ever tests the members of its own family.
 * {@link #EHLO} doubles as the HELO-name DBL source.
 * </p>
 */
public enum Attribute {
    // EHLO/HELO
    HELO("helo"),
    EHLO("ehlo"),
    NONE("none"),
    BOGUS("bogus"),
    NODOTS("nodots"),
    BAREIP("bareip"),
    PROPERIP("properip"),
    MYIP("myip"),
    REMOTEIP("remoteip"),
    OTHERIP("otherip"),

    // reverse DNS
    NODNS("nodns"),
    INCONSISTENT("inconsistent"),
    NOFORWARD("noforward"),
    GOOD("good"),
    EXISTS("exists"),

    // addresses
    UNQUALIFIED("unqualified"),
    ROUTE("route"),
    QUOTED("quoted"),
    NOAT("noat"),
    GARBAGE("garbage"),
    DOMAIN_VALID("resolves"),
    DOMAIN_INVALID("baddom"),
    DOMAIN_TEMPFAIL("unknown"),

    // DBL sources
    HOST("host"),
    FROM("from");

    private final String keyword;

    Attribute(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Set<Attribute> none() {
        return EnumSet.noneOf(Attribute.class);
    }

    public static boolean intersects(Set<Attribute> a, Set<Attribute> b) {
        for (Attribute attribute : a) {
            if (b.contains(attribute)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders a set as a sorted comma separated list, using group names
     * wherever every member of a group is present.
     * @param attributes the set to render
     * @return canonical text, empty for an empty set
     */
    public static String render(Set<Attribute> attributes) {
        Set<Attribute> remaining = EnumSet.noneOf(Attribute.class);
        remaining.addAll(attributes);
        List<String> names = new ArrayList<>();
        for (AttributeGroup group : AttributeGroup.values()) {
            Set<Attribute> members = group.members();
            if (remaining.containsAll(members)) {
                names.add(group.keyword());
                remaining.removeAll(members);
            }
        }
        for (Attribute attribute : remaining) {
            names.add(attribute.keyword);
        }
        Collections.sort(names);
        return String.join(",", names);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
