package io.github.hotbrkm.smtpsinkhole.smtp.policy.classify;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.DnsResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AddressClassifier Test")
class AddressClassifierTest {

    private static final Function<String, DnsResult> NO_DNS = domain -> DnsResult.UNDEFINED;

    static Stream<Arguments> addresses() {
        return Stream.of(
                Arguments.of("", EnumSet.noneOf(Attribute.class)),
                Arguments.of("noat", EnumSet.of(Attribute.NOAT)),
                Arguments.of("\"fred\"@jones", EnumSet.of(Attribute.QUOTED, Attribute.UNQUALIFIED)),
                Arguments.of("jim@jones", EnumSet.of(Attribute.UNQUALIFIED)),
                Arguments.of("@jones:user@jim.bob", EnumSet.of(Attribute.ROUTE)),
                Arguments.of("@j:user@jim", EnumSet.of(Attribute.ROUTE, Attribute.UNQUALIFIED)),
                Arguments.of("@garbage", EnumSet.of(Attribute.GARBAGE, Attribute.UNQUALIFIED)),
                Arguments.of("garbage@", EnumSet.of(Attribute.GARBAGE, Attribute.UNQUALIFIED)),
                Arguments.of("<job@jim.bob", EnumSet.of(Attribute.GARBAGE)),
                Arguments.of("joe..@jim.bob", EnumSet.of(Attribute.GARBAGE)),
                Arguments.of("joe@@jim.bob", EnumSet.of(Attribute.GARBAGE)),
                Arguments.of("joe@jim.bob\"", EnumSet.of(Attribute.GARBAGE)),
                Arguments.of("joe@jim.bob>", EnumSet.of(Attribute.GARBAGE)),
                Arguments.of("\"joe..bob\"@jim.bob", EnumSet.of(Attribute.QUOTED, Attribute.GARBAGE))
        );
    }

    @ParameterizedTest(name = "[{index}] ''{0}'' -> {1}")
    @MethodSource("addresses")
    @DisplayName("Classifies address shapes")
    void classify_addressShapes(String address, Set<Attribute> expected) {
        assertThat(AddressClassifier.classify(address, NO_DNS)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Plain addresses get their domain validity")
    void classify_plainAddress_addsDomainValidity() {
        // given
        Function<String, DnsResult> dns = domain -> switch (domain) {
            case "good.example" -> DnsResult.GOOD;
            case "bad.example" -> DnsResult.BAD;
            case "slow.example" -> DnsResult.TEMPFAIL;
            default -> DnsResult.UNDEFINED;
        };

        // when & then
        assertThat(AddressClassifier.classify("joe@good.example", dns)).containsExactly(Attribute.DOMAIN_VALID);
        assertThat(AddressClassifier.classify("joe@bad.example", dns)).containsExactly(Attribute.DOMAIN_INVALID);
        assertThat(AddressClassifier.classify("joe@slow.example", dns)).containsExactly(Attribute.DOMAIN_TEMPFAIL);
        assertThat(AddressClassifier.classify("joe@other.example", dns)).isEmpty();
    }

    @Test
    @DisplayName("Domain is looked up in lower case")
    void classify_plainAddress_lowercasesDomain() {
        // given
        List<String> asked = new ArrayList<>();

        // when
        AddressClassifier.classify("Joe@Example.COM", domain -> {
            asked.add(domain);
            return DnsResult.GOOD;
        });

        // then
        assertThat(asked).containsExactly("example.com");
    }

    @Test
    @DisplayName("Addresses that are not plain are never looked up")
    void classify_notPlain_skipsDns() {
        // given
        List<String> asked = new ArrayList<>();
        Function<String, DnsResult> dns = domain -> {
            asked.add(domain);
            return DnsResult.GOOD;
        };

        // when
        AddressClassifier.classify("@relay.example:joe@example.com", dns);
        AddressClassifier.classify("joe@localhost", dns);
        AddressClassifier.classify("<joe@example.com>", dns);
        AddressClassifier.classify("joe", dns);

        // then
        assertThat(asked).isEmpty();
    }

    @Test
    @DisplayName("Quoted local parts with a qualified domain are still checked")
    void classify_quotedLocalPart_checksDomain() {
        assertThat(AddressClassifier.classify("\"joe bob\"@example.com", domain -> DnsResult.GOOD))
                .containsExactlyInAnyOrder(Attribute.QUOTED, Attribute.DOMAIN_VALID);
    }
}
