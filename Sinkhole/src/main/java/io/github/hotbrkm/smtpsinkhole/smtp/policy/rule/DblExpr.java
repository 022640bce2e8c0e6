package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.classify.AddressClassifier;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.util.EmailUtil;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@code dbl SOURCES DOMAIN}: a domain name from one of the selected sources is
 * listed in a domain blocklist zone.
 * <p>
 * Sources are the HELO name ({@link Attribute#EHLO}), every reverse DNS name of
 * the remote IP ({@link Attribute#HOST}) and the MAIL FROM domain of a plain
 * address ({@link Attribute#FROM}).
 * </p>
 */
public record DblExpr(Set<Attribute> sources, String domain) implements RuleExpr {

    private static final Set<Attribute> DOMAIN_CHECKED = EnumSet.of(
            Attribute.DOMAIN_VALID, Attribute.DOMAIN_INVALID, Attribute.DOMAIN_TEMPFAIL);

    public DblExpr {
        sources = Set.copyOf(sources);
    }

    /**
     * Looks up every candidate name, including those after the first hit, so each
     * listing is recorded.
     */
    @Override
    public boolean evaluate(RuleContext context) {
        boolean listed = false;
        for (String name : candidateNames(context)) {
            if (context.isListed(name + "." + domain)) {
                context.recordDnsblHit(domain);
                listed = true;
            }
        }
        return listed;
    }

    Set<String> candidateNames(RuleContext context) {
        Set<String> names = new TreeSet<>();
        if (sources.contains(Attribute.EHLO) && !context.getHeloName().isEmpty()) {
            names.add(context.getHeloName().toLowerCase(Locale.ROOT));
        }
        if (sources.contains(Attribute.HOST)) {
            addHostNames(names, context.getRemoteDns().verified());
            addHostNames(names, context.getRemoteDns().noForward());
            addHostNames(names, context.getRemoteDns().inconsistent());
        }
        if (sources.contains(Attribute.FROM)) {
            String from = context.getMailFrom();
            Set<Attribute> attributes = AddressClassifier.classify(from, context::domainValidity);
            if (Attribute.intersects(attributes, DOMAIN_CHECKED)) {
                names.add(EmailUtil.extractDomain(from));
            }
        }
        return names;
    }

    private static void addHostNames(Set<String> names, List<String> hosts) {
        for (String host : hosts) {
            String name = host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
            if (!name.isEmpty()) {
                names.add(name.toLowerCase(Locale.ROOT));
            }
        }
    }

    @Override
    public String render() {
        return "dbl " + Attribute.render(sources) + " " + RuleKeywords.renderArgument(domain);
    }

    @Override
    public SmtpPhase requires() {
        SmtpPhase phase = SmtpPhase.CONNECT;
        if (sources.contains(Attribute.EHLO)) {
            phase = SmtpPhase.later(phase, SmtpPhase.HELO);
        }
        if (sources.contains(Attribute.FROM)) {
            phase = SmtpPhase.later(phase, SmtpPhase.MAIL_FROM);
        }
        return phase;
    }
}
