package io.github.hotbrkm.smtpsinkhole.smtp.policy;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics.RuleMetricsRecorder;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.parse.RuleParseException;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.parse.RuleParser;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.RuleKeywords;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.Ruleset;
import io.github.hotbrkm.smtpsinkhole.smtp.properties.SinkholeSmtpProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the ruleset for a new connection.
 * <p>
 * Rules are rebuilt from the configured files for every connection. Built-in
 * rules from configuration come first. If anything fails to load the connection
 * gets a ruleset that stalls everything; each distinct error is logged once.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Slf4j
public class RulesetLoader {

    static final String BUILT_IN_SOURCE = "<built-in rules>";

    private final SinkholeSmtpProperties.Rules rules;
    private final RuleMetricsRecorder metricsRecorder;
    private final Set<String> reportedErrors = ConcurrentHashMap.newKeySet();

    public RulesetLoader(SinkholeSmtpProperties.Rules rules, RuleMetricsRecorder metricsRecorder) {
        this.rules = rules;
        this.metricsRecorder = metricsRecorder;
    }

    public Ruleset load() {
        try {
            Ruleset builtIn = RuleParser.parse(BUILT_IN_SOURCE, builtInRuleText());
            List<Path> files = rules.getFiles().stream()
                    .filter(StringUtils::hasText)
                    .map(Paths::get)
                    .toList();
            return builtIn.plus(RuleParser.parseFiles(files));
        } catch (RuleParseException e) {
            metricsRecorder.recordLoadFailure();
            if (reportedErrors.add(e.getMessage())) {
                log.warn("Rule loading failed, stalling all connections until fixed: {}", e.getMessage());
            }
            return Ruleset.failSafe();
        }
    }

    String builtInRuleText() {
        StringBuilder sb = new StringBuilder();
        if (rules.isStandardRules()) {
            sb.append("reject from-has bad,route\n");
            sb.append("reject to-has bad,route\n");
            sb.append("reject helo-has none\n");
        }
        if (rules.isRejectAllMessages()) {
            sb.append("@message reject all\n");
        }
        if (StringUtils.hasText(rules.getFromRejectFile())) {
            sb.append("reject from ").append(fileArgument(rules.getFromRejectFile())).append('\n');
        }
        if (StringUtils.hasText(rules.getToAcceptFile())) {
            sb.append("reject not to ").append(fileArgument(rules.getToAcceptFile())).append('\n');
        }
        if (StringUtils.hasText(rules.getHeloRejectFile())) {
            sb.append("@from reject helo ").append(fileArgument(rules.getHeloRejectFile())).append('\n');
        }
        return sb.toString();
    }

    private static String fileArgument(String file) {
        return RuleKeywords.quote("file:" + file);
    }
}
