package io.github.hotbrkm.smtpsinkhole.config;

import io.github.hotbrkm.smtpsinkhole.smtp.handler.SinkholeMessageHandlerFactory;
import io.github.hotbrkm.smtpsinkhole.smtp.handler.SmtpSessionRegistry;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.PolicySessionHandler;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.RuleDecider;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.RulesetLoader;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.DomainValidator;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.ReverseDnsLookup;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics.RuleMetricsRecorder;
import io.github.hotbrkm.smtpsinkhole.smtp.properties.SinkholeSmtpProperties;
import io.github.hotbrkm.smtpsinkhole.smtp.service.SmtpMessageStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.subethamail.smtp.server.SMTPServer;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Slf4j
@Configuration
@EnableConfigurationProperties(SinkholeSmtpProperties.class)
public class SmtpServerConfig {

    private static final String PROPERTY_PREFIX = "sinkhole.smtp";

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public SMTPServer smtpServer(SinkholeSmtpProperties properties,
                                 SinkholeMessageHandlerFactory handlerFactory,
                                 PolicySessionHandler policySessionHandler) {
        SMTPServer.Builder builder = new SMTPServer.Builder()
                .messageHandlerFactory(handlerFactory)
                .sessionHandler(policySessionHandler)
                .port(properties.getPort());

        if (properties.getMaxConnections() != null) {
            builder.maxConnections(properties.getMaxConnections());
        }

        if (properties.getMaxMessageSize() != null) {
            builder.maxMessageSize(properties.getMaxMessageSize());
        }

        if (StringUtils.hasText(properties.getHostName())) {
            builder.hostName(properties.getHostName());
        }

        if (StringUtils.hasText(properties.getBindAddress())) {
            builder.bindAddress(resolveBindAddress(properties.getBindAddress()));
        }

        SMTPServer smtpServer = builder.build();
        log.info("SMTP sinkhole is configured to listen on {} with rule files {}.",
                smtpServer.getDisplayableLocalSocketAddress(), properties.getRules().getFiles());
        return smtpServer;
    }

    @Bean
    @ConditionalOnMissingBean(DnsResolver.class)
    public DnsResolver dnsResolver(SinkholeSmtpProperties properties) {
        if (properties.getDns().getTimeout() != null) {
            return new DnsResolver(properties.getDns().getTimeout());
        }
        return new DnsResolver();
    }

    @Bean
    public DomainValidator domainValidator(DnsResolver dnsResolver) {
        return new DomainValidator(dnsResolver);
    }

    @Bean
    public ReverseDnsLookup reverseDnsLookup(DnsResolver dnsResolver) {
        return new ReverseDnsLookup(dnsResolver);
    }

    @Bean
    public RulesetLoader rulesetLoader(SinkholeSmtpProperties properties, RuleMetricsRecorder metricsRecorder) {
        return new RulesetLoader(properties.getRules(), metricsRecorder);
    }

    @Bean
    public RuleDecider ruleDecider(RuleMetricsRecorder metricsRecorder) {
        return new RuleDecider(metricsRecorder);
    }

    @Bean
    public SmtpSessionRegistry smtpSessionRegistry(RulesetLoader rulesetLoader,
                                                   DnsResolver dnsResolver,
                                                   DomainValidator domainValidator,
                                                   ReverseDnsLookup reverseDnsLookup) {
        return new SmtpSessionRegistry(rulesetLoader, dnsResolver, domainValidator, reverseDnsLookup);
    }

    @Bean
    public PolicySessionHandler policySessionHandler(SmtpSessionRegistry sessionRegistry,
                                                     RuleDecider ruleDecider,
                                                     RuleMetricsRecorder metricsRecorder) {
        return new PolicySessionHandler(sessionRegistry, ruleDecider, metricsRecorder);
    }

    @Bean
    public SinkholeMessageHandlerFactory sinkholeMessageHandlerFactory(SinkholeSmtpProperties properties,
                                                                       SmtpMessageStore messageStore,
                                                                       RuleDecider ruleDecider,
                                                                       SmtpSessionRegistry sessionRegistry) {
        return new SinkholeMessageHandlerFactory(properties, messageStore, ruleDecider, sessionRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public RuleMetricsRecorder ruleMetricsRecorder(MeterRegistry meterRegistry) {
        return new RuleMetricsRecorder(meterRegistry);
    }

    private static InetAddress resolveBindAddress(String bindAddress) {
        try {
            return InetAddress.getByName(bindAddress);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid SMTP bind address: " + bindAddress, e);
        }
    }
}
