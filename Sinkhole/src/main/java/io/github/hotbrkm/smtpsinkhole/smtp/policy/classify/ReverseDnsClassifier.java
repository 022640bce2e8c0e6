package io.github.hotbrkm.smtpsinkhole.smtp.policy.classify;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RemoteDns;

import java.util.Set;

/**
 * Classifies the reverse DNS state of the remote IP.
 * {@code good} requires verified names and no unconfirmed ones.
 */
public final class ReverseDnsClassifier {

    private ReverseDnsClassifier() {
    }

    public static Set<Attribute> classify(RemoteDns remoteDns) {
        Set<Attribute> attributes = Attribute.none();
        boolean exists = !remoteDns.verified().isEmpty();
        attributes.add(exists ? Attribute.EXISTS : Attribute.NODNS);
        if (!remoteDns.noForward().isEmpty()) {
            attributes.add(Attribute.NOFORWARD);
        }
        if (!remoteDns.inconsistent().isEmpty()) {
            attributes.add(Attribute.INCONSISTENT);
        }
        if (exists && remoteDns.noForward().isEmpty() && remoteDns.inconsistent().isEmpty()) {
            attributes.add(Attribute.GOOD);
        }
        return attributes;
    }
}
