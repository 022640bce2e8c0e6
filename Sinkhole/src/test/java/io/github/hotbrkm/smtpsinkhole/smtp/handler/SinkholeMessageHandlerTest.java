package io.github.hotbrkm.smtpsinkhole.smtp.handler;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.RuleDecider;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.TestRuleContexts;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.TestDnsResolver;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics.RuleMetricsRecorder;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.GreetingVerb;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.parse.RuleParseException;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.parse.RuleParser;
import io.github.hotbrkm.smtpsinkhole.smtp.properties.SinkholeSmtpProperties;
import io.github.hotbrkm.smtpsinkhole.smtp.service.SmtpMessageStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SinkholeMessageHandler Test")
class SinkholeMessageHandlerTest {

    private static final String MESSAGE = "Subject: test\r\n\r\nhello\r\n";

    @TempDir
    Path tempDir;

    private SinkholeSmtpProperties properties;
    private MessageContext context;
    private SmtpSessionState state;

    @BeforeEach
    void setUp() {
        properties = new SinkholeSmtpProperties();
        properties.setInboxDirectory(tempDir.resolve("inbox").toString());
        context = mock(MessageContext.class);
        when(context.getSessionId()).thenReturn("session-1");
        when(context.getHelo()).thenReturn(Optional.of("mail.example.com"));
    }

    private SinkholeMessageHandler handler(String ruleText) throws RuleParseException {
        state = new SmtpSessionState(RuleParser.parse("test", ruleText),
                TestRuleContexts.builder(new TestDnsResolver()).build());
        RuleDecider decider = new RuleDecider(new RuleMetricsRecorder(new SimpleMeterRegistry()));
        return new SinkholeMessageHandler(context, properties, new SmtpMessageStore(properties), decider, state);
    }

    private static InputStream message() {
        return new ByteArrayInputStream(MESSAGE.getBytes(StandardCharsets.US_ASCII));
    }

    private List<Path> files(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.toList();
        }
    }

    @Nested
    @DisplayName("Accepted mail")
    class Accepted {

        @Test
        @DisplayName("Stores one copy per accepted recipient")
        void storesPerRecipient() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("");

            // when
            handler.from("sender@example.com");
            handler.recipient("user1@example.com");
            handler.recipient("user2@example.com");
            String reply = handler.data(message());
            handler.done();

            // then
            assertThat(reply).isEqualTo("OK");
            List<Path> stored = files(tempDir.resolve("inbox"));
            assertThat(stored).hasSize(2);
            assertThat(Files.readString(stored.get(0))).isEqualTo(MESSAGE);
        }

        @Test
        @DisplayName("Passes the HELO name and sender to the rules")
        void fillsContext() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("");

            // when
            handler.from("sender@example.com");

            // then
            assertThat(state.getRuleContext().getHeloName()).isEqualTo("mail.example.com");
            assertThat(state.getRuleContext().getMailFrom()).isEqualTo("sender@example.com");
            assertThat(state.isHeloChecked()).isTrue();
        }

        @Test
        @DisplayName("A session without a greeting gives an empty HELO name")
        void missingHelo() throws Exception {
            // given
            when(context.getHelo()).thenReturn(Optional.empty());
            SinkholeMessageHandler handler = handler("");

            // when
            handler.from("sender@example.com");

            // then
            assertThat(state.getRuleContext().getHeloName()).isEmpty();
        }

        @Test
        @DisplayName("Rules on the greeting verb never match because the verb is not reported")
        void greetingVerbUnknown() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("@helo stall helo-has ehlo\n@helo stall helo-has helo");

            // when
            handler.from("sender@example.com");

            // then
            assertThat(state.getRuleContext().getGreetingVerb()).isEqualTo(GreetingVerb.UNKNOWN);
            assertThat(state.isHeloChecked()).isTrue();
        }
    }

    @Nested
    @DisplayName("Refused commands")
    class Refused {

        @Test
        @DisplayName("MAIL FROM is rejected with 550 and the rule's message")
        void rejectsSender() throws RuleParseException {
            // given
            SinkholeMessageHandler handler = handler("reject from @spam.example with message \"5.7.1 no spam\"");

            // when & then
            assertThatThrownBy(() -> handler.from("joe@spam.example"))
                    .isInstanceOf(RejectException.class)
                    .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(550))
                    .hasMessageContaining("5.7.1 no spam");
        }

        @Test
        @DisplayName("A refused HELO name fails the first MAIL FROM only")
        void heloCheckedOnce() throws Exception {
            // given
            when(context.getHelo()).thenReturn(Optional.of("localhost"));
            SinkholeMessageHandler handler = handler("@helo stall helo-has nodots");

            // when & then
            assertThatThrownBy(() -> handler.from("joe@example.com"))
                    .isInstanceOf(RejectException.class)
                    .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(451));
            handler.from("joe@example.com");
        }

        @Test
        @DisplayName("Refusal of the null sender is given at RCPT TO")
        void nullSenderDeferred() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("reject from <> with message \"5.7.1 no bounces\"");

            // when
            handler.from("");

            // then
            assertThat(state.hasDeferredDecision()).isTrue();
            assertThatThrownBy(() -> handler.recipient("user@example.com"))
                    .isInstanceOf(RejectException.class)
                    .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(550))
                    .hasMessageContaining("no bounces");
            assertThat(state.hasAcceptedRecipients()).isFalse();
        }

        @Test
        @DisplayName("RCPT TO is rejected without adding the recipient")
        void rejectsRecipient() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("reject to spamtrap@");
            handler.from("sender@example.com");

            // when & then
            assertThatThrownBy(() -> handler.recipient("spamtrap@example.com"))
                    .isInstanceOf(RejectException.class);
            handler.recipient("user@example.com");
            assertThat(state.getAcceptedRecipients()).containsExactly("user@example.com");
        }

        @Test
        @DisplayName("A DATA stall answers 451 and stores nothing")
        void stallsData() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("@data stall to user@");
            handler.from("sender@example.com");
            handler.recipient("user@example.com");

            // when & then
            assertThatThrownBy(() -> handler.data(message()))
                    .isInstanceOf(RejectException.class)
                    .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(451));
            assertThat(files(tempDir.resolve("inbox"))).isEmpty();
        }

        @Test
        @DisplayName("A message rejected after receipt is still saved")
        void rejectsMessageAfterSaving() throws Exception {
            // given
            Path trap = tempDir.resolve("trap");
            SinkholeMessageHandler handler = handler("@message reject all with savedir \"" + trap + "\"");
            handler.from("sender@example.com");
            handler.recipient("user@example.com");

            // when & then
            assertThatThrownBy(() -> handler.data(message()))
                    .isInstanceOf(RejectException.class)
                    .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(554));
            assertThat(files(trap)).hasSize(1);
            assertThat(files(tempDir.resolve("inbox"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Without storage")
    class WithoutStorage {

        @BeforeEach
        void disableStorage() {
            properties.setStoreMessages(false);
        }

        @Test
        @DisplayName("Messages are refused unless receiving is forced")
        void refusesWithoutForce() throws Exception {
            // given
            SinkholeMessageHandler handler = handler("");
            handler.from("sender@example.com");
            handler.recipient("user@example.com");

            // when & then
            assertThatThrownBy(() -> handler.data(message()))
                    .isInstanceOf(RejectException.class)
                    .satisfies(e -> assertThat(((RejectException) e).getCode()).isEqualTo(554));
        }

        @Test
        @DisplayName("Forced receiving accepts and discards the message")
        void acceptsWithForce() throws Exception {
            // given
            properties.setForceReceive(true);
            SinkholeMessageHandler handler = handler("");
            handler.from("sender@example.com");
            handler.recipient("user@example.com");

            // when
            String reply = handler.data(message());

            // then
            assertThat(reply).isEqualTo("OK");
            assertThat(files(tempDir.resolve("inbox"))).isEmpty();
        }

        @Test
        @DisplayName("A savedir option stores the message anyway")
        void savedirStillStores() throws Exception {
            // given
            Path trap = tempDir.resolve("trap");
            SinkholeMessageHandler handler = handler("set-with from @example.com with savedir \"" + trap + "\"");
            handler.from("sender@example.com");
            handler.recipient("user@example.com");

            // when
            String reply = handler.data(message());

            // then
            assertThat(reply).isEqualTo("OK");
            assertThat(files(trap)).hasSize(1);
        }
    }
}
