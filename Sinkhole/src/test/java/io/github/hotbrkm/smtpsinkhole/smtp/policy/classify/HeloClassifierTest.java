package io.github.hotbrkm.smtpsinkhole.smtp.policy.classify;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeloClassifier Test")
class HeloClassifierTest {

    private static final String LOCAL_IP = "127.0.0.1";
    private static final String REMOTE_IP = "192.168.10.3";

    static Stream<Arguments> heloNames() {
        return Stream.of(
                Arguments.of("", EnumSet.of(Attribute.NONE, Attribute.NODOTS)),
                Arguments.of("abc.def", EnumSet.noneOf(Attribute.class)),
                Arguments.of("abcdef", EnumSet.of(Attribute.NODOTS)),
                Arguments.of(".", EnumSet.of(Attribute.BOGUS, Attribute.NODOTS)),
                Arguments.of("127.0.0.1", EnumSet.of(Attribute.BAREIP, Attribute.MYIP)),
                Arguments.of("[127.0.0.1]", EnumSet.of(Attribute.PROPERIP, Attribute.MYIP)),
                Arguments.of("[127.100.100.100]", EnumSet.of(Attribute.PROPERIP, Attribute.OTHERIP)),
                Arguments.of("[192.168.10.3]", EnumSet.of(Attribute.PROPERIP, Attribute.REMOTEIP)),
                Arguments.of("1::", EnumSet.of(Attribute.BAREIP, Attribute.OTHERIP))
        );
    }

    @ParameterizedTest(name = "[{index}] ''{0}'' -> {1}")
    @MethodSource("heloNames")
    @DisplayName("Classifies HELO names")
    void classify_heloNames(String helo, Set<Attribute> expected) {
        assertThat(HeloClassifier.classify(helo, LOCAL_IP, REMOTE_IP)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Accepts the IPv6: tag inside brackets")
    void classify_ipv6Tag_isProperIp() {
        assertThat(HeloClassifier.classify("[IPv6:2001:db8::1]", LOCAL_IP, "2001:db8::1"))
                .containsExactlyInAnyOrder(Attribute.PROPERIP, Attribute.REMOTEIP);
    }

    @Test
    @DisplayName("A bracketed name that is not an IP is treated as a plain name")
    void classify_bracketedName_isNotIp() {
        assertThat(HeloClassifier.classify("[mailhost]", LOCAL_IP, REMOTE_IP))
                .containsExactly(Attribute.NODOTS);
    }

    @Test
    @DisplayName("Null HELO counts as missing")
    void classify_null_isNone() {
        assertThat(HeloClassifier.classify(null, LOCAL_IP, REMOTE_IP))
                .containsExactlyInAnyOrder(Attribute.NONE, Attribute.NODOTS);
    }
}
