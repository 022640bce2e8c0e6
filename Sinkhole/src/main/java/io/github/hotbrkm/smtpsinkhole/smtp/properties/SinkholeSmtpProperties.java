package io.github.hotbrkm.smtpsinkhole.smtp.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the SMTP sinkhole server.
 * <p>
 * These properties are loaded from the {@code sinkhole.smtp} prefix in application.yml.
 * </p>
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * sinkhole:
 *   smtp:
 *     port: 2525
 *     inbox-directory: ./inbox
 *     rules:
 *       files:
 *         - /etc/sinkhole/rules
 *       from-reject-file: /etc/sinkhole/bad-senders
 * </pre>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "sinkhole.smtp")
public class SinkholeSmtpProperties {

    /**
     * Whether the SMTP server is enabled.
     */
    private boolean enabled = true;

    /**
     * Port number for the SMTP server to listen on.
     */
    private int port = 2525;

    /**
     * Host name to use for the SMTP server.
     */
    private String hostName;

    /**
     * Address to bind the SMTP server to.
     */
    private String bindAddress;

    /**
     * Maximum number of concurrent connections allowed.
     */
    private Integer maxConnections;

    /**
     * Maximum message size in bytes.
     */
    private Integer maxMessageSize;

    /**
     * Directory path for storing received messages.
     */
    private String inboxDirectory;

    /**
     * Whether to store received messages to disk.
     */
    private boolean storeMessages = true;

    /**
     * Accept messages even when they are neither stored nor rejected by rules.
     */
    private boolean forceReceive;

    /**
     * Control rule configuration.
     */
    @NestedConfigurationProperty
    private Rules rules = new Rules();

    /**
     * DNS resolver configuration.
     */
    @NestedConfigurationProperty
    private Dns dns = new Dns();

    /**
     * Control rule sources. Built-in rules come first, then the files in order.
     */
    @Getter
    @Setter
    public static class Rules {

        /**
         * Rule files; rules in earlier files take priority.
         */
        private List<String> files = new ArrayList<>();

        /**
         * Whether to prepend the standard rules rejecting a missing HELO name and bad addresses.
         */
        private boolean standardRules = true;

        /**
         * Reject every message after it has been received.
         */
        private boolean rejectAllMessages;

        /**
         * Address list file; a matching MAIL FROM is rejected.
         */
        private String fromRejectFile;

        /**
         * Address list file; only matching RCPT TO addresses are accepted when it is non-empty.
         */
        private String toAcceptFile;

        /**
         * Host list file; a matching EHLO/HELO name is rejected at MAIL FROM.
         */
        private String heloRejectFile;
    }

    /**
     * DNS resolver configuration.
     */
    @Getter
    @Setter
    public static class Dns {

        /**
         * Per-query timeout. Unset keeps the dnsjava default.
         */
        private Duration timeout;
    }
}
