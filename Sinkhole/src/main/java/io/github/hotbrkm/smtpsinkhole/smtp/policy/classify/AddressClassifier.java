package io.github.hotbrkm.smtpsinkhole.smtp.policy.classify;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.DnsResult;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Heuristic classification of MAIL FROM and RCPT TO addresses.
 * <p>
 * This is not an RFC 5321 parser; it looks for the shapes of address that
 * matter to rules (route addresses, quoted local parts, missing or
 * unqualified domains, stray brackets and similar garbage). Only plain
 * addresses get their domain checked in DNS.
 * </p>
 */
public final class AddressClassifier {

    private static final Set<Attribute> NOT_PLAIN = EnumSet.of(
            Attribute.ROUTE, Attribute.UNQUALIFIED, Attribute.GARBAGE, Attribute.NOAT);

    private AddressClassifier() {
    }

    /**
     * @param address        the address, empty for the null sender
     * @param domainValidity DNS validity check used for plain addresses
     * @return the address attributes
     */
    public static Set<Attribute> classify(String address, Function<String, DnsResult> domainValidity) {
        Set<Attribute> attributes = Attribute.none();
        if (address == null || address.isEmpty()) {
            return attributes;
        }
        int lastAt = address.lastIndexOf('@');
        if (lastAt < 0) {
            attributes.add(Attribute.NOAT);
            return attributes;
        }

        String local;
        String domain = address.substring(lastAt + 1);
        boolean quoted = false;
        if (address.charAt(0) == '@') {
            int colon = address.indexOf(':');
            if (colon > 0 && colon < lastAt) {
                attributes.add(Attribute.ROUTE);
                local = address.substring(colon + 1, lastAt);
            } else {
                attributes.add(Attribute.GARBAGE);
                local = "";
            }
        } else if (address.charAt(0) == '"') {
            attributes.add(Attribute.QUOTED);
            quoted = true;
            int close = closingQuote(address);
            if (close < 0 || close + 1 >= address.length() || address.charAt(close + 1) != '@') {
                attributes.add(Attribute.GARBAGE);
                local = close < 0 ? address : address.substring(0, close + 1);
            } else {
                local = address.substring(0, close + 1);
                domain = address.substring(close + 2);
            }
        } else {
            local = address.substring(0, lastAt);
        }

        if (address.indexOf('<') >= 0 || address.indexOf('>') >= 0
                || local.isEmpty() || local.contains("..")
                || (!quoted && (local.indexOf('@') >= 0 || local.indexOf('"') >= 0))
                || domain.isEmpty() || domain.indexOf('@') >= 0 || domain.indexOf('"') >= 0) {
            attributes.add(Attribute.GARBAGE);
        }
        if (domain.indexOf('.') < 0) {
            attributes.add(Attribute.UNQUALIFIED);
        }

        if (!Attribute.intersects(attributes, NOT_PLAIN)) {
            DnsResult result = domainValidity.apply(domain.toLowerCase(Locale.ROOT));
            switch (result) {
                case GOOD -> attributes.add(Attribute.DOMAIN_VALID);
                case BAD -> attributes.add(Attribute.DOMAIN_INVALID);
                case TEMPFAIL -> attributes.add(Attribute.DOMAIN_TEMPFAIL);
                default -> {
                    // no answer at all; leave the domain unclassified
                }
            }
        }
        return attributes;
    }

    private static int closingQuote(String address) {
        for (int i = 1; i < address.length(); i++) {
            char c = address.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }
}
