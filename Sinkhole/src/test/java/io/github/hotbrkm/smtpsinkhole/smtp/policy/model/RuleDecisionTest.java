package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.subethamail.smtp.RejectException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleDecision Test")
class RuleDecisionTest {

    @Test
    @DisplayName("Reject uses the reject code and the message option")
    void toRejectException_reject() {
        // given
        RuleDecision decision = new RuleDecision(RuleAction.REJECT, Map.of("message", "go away"), "reject all");

        // when
        RejectException exception = decision.toRejectException(550, 451);

        // then
        assertThat(exception.getCode()).isEqualTo(550);
        assertThat(exception.getMessage()).contains("go away");
    }

    @Test
    @DisplayName("Stall uses the stall code and a default message")
    void toRejectException_stall() {
        // given
        RuleDecision decision = new RuleDecision(RuleAction.STALL, Map.of(), "stall all");

        // when
        RejectException exception = decision.toRejectException(550, 451);

        // then
        assertThat(exception.getCode()).isEqualTo(451);
        assertThat(exception.getMessage()).contains("4.7.1 Temporarily refused by policy");
    }

    @Test
    @DisplayName("Accept has no exception")
    void toRejectException_accept() {
        assertThat(RuleDecision.defaultAccept(null).toRejectException(550, 451)).isNull();
    }

    @Test
    @DisplayName("An empty message option falls back to the default text")
    void replyText_emptyMessage() {
        RuleDecision decision = new RuleDecision(RuleAction.REJECT, Map.of("message", ""), "reject all");

        assertThat(decision.replyText("default")).isEqualTo("default");
    }

    @Test
    @DisplayName("Options are read by name")
    void options() {
        // given
        RuleDecision decision = RuleDecision.defaultAccept(Map.of(
                "note", "n", "savedir", "/tmp/s", "tls-opt", "off", "make-yakker", ""));

        // when & then
        assertThat(decision.isAccept()).isTrue();
        assertThat(decision.note()).isEqualTo("n");
        assertThat(decision.savedir()).isEqualTo("/tmp/s");
        assertThat(decision.tlsOpt()).isEqualTo("off");
        assertThat(decision.makeYakker()).isTrue();
        assertThat(decision.message()).isNull();
    }
}
