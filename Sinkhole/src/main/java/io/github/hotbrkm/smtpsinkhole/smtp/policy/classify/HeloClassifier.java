package io.github.hotbrkm.smtpsinkhole.smtp.policy.classify;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;

import java.net.InetAddress;
import java.util.Set;

/**
 * Classifies the name given in EHLO or HELO. Which verb was used is added by the caller.
 */
public final class HeloClassifier {

    private static final String IPV6_TAG = "ipv6:";

    private HeloClassifier() {
    }

    public static Set<Attribute> classify(String helo, String localIp, String remoteIp) {
        Set<Attribute> attributes = Attribute.none();
        if (helo == null || helo.isEmpty()) {
            attributes.add(Attribute.NONE);
            attributes.add(Attribute.NODOTS);
            return attributes;
        }
        if (helo.equals(".")) {
            attributes.add(Attribute.BOGUS);
            attributes.add(Attribute.NODOTS);
            return attributes;
        }

        InetAddress ip;
        if (helo.length() > 2 && helo.startsWith("[") && helo.endsWith("]")) {
            String literal = helo.substring(1, helo.length() - 1);
            if (literal.regionMatches(true, 0, IPV6_TAG, 0, IPV6_TAG.length())) {
                literal = literal.substring(IPV6_TAG.length());
            }
            ip = IpAddressUtil.parseLiteral(literal);
            if (ip != null) {
                attributes.add(Attribute.PROPERIP);
            }
        } else {
            ip = IpAddressUtil.parseLiteral(helo);
            if (ip != null) {
                attributes.add(Attribute.BAREIP);
            }
        }

        if (ip == null) {
            if (helo.indexOf('.') < 0 && helo.indexOf(':') < 0) {
                attributes.add(Attribute.NODOTS);
            }
            return attributes;
        }

        boolean mine = ip.equals(IpAddressUtil.parseLiteral(localIp));
        boolean remote = ip.equals(IpAddressUtil.parseLiteral(remoteIp));
        if (mine) {
            attributes.add(Attribute.MYIP);
        }
        if (remote) {
            attributes.add(Attribute.REMOTEIP);
        }
        if (!mine && !remote) {
            attributes.add(Attribute.OTHERIP);
        }
        return attributes;
    }
}
