package io.github.hotbrkm.smtpsinkhole.smtp.policy.classify;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RemoteDns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReverseDnsClassifier Test")
class ReverseDnsClassifierTest {

    static Stream<Arguments> dnsStates() {
        return Stream.of(
                Arguments.of(true, false, false, EnumSet.of(Attribute.GOOD, Attribute.EXISTS)),
                Arguments.of(false, true, false, EnumSet.of(Attribute.NOFORWARD, Attribute.NODNS)),
                Arguments.of(false, false, true, EnumSet.of(Attribute.INCONSISTENT, Attribute.NODNS)),
                Arguments.of(false, false, false, EnumSet.of(Attribute.NODNS)),
                Arguments.of(true, true, true, EnumSet.of(Attribute.EXISTS, Attribute.NOFORWARD, Attribute.INCONSISTENT)),
                Arguments.of(false, true, true, EnumSet.of(Attribute.NODNS, Attribute.NOFORWARD, Attribute.INCONSISTENT))
        );
    }

    @ParameterizedTest(name = "[{index}] verified={0}, noForward={1}, inconsistent={2} -> {3}")
    @MethodSource("dnsStates")
    @DisplayName("Classifies reverse DNS outcomes")
    void classify_dnsStates(boolean verified, boolean noForward, boolean inconsistent, Set<Attribute> expected) {
        // given
        RemoteDns remoteDns = new RemoteDns(names(verified), names(noForward), names(inconsistent));

        // when & then
        assertThat(ReverseDnsClassifier.classify(remoteDns)).isEqualTo(expected);
    }

    private static List<String> names(boolean present) {
        return present ? List.of("a.c.") : List.of();
    }
}
