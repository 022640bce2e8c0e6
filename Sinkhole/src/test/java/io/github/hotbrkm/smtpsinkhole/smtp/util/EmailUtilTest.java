package io.github.hotbrkm.smtpsinkhole.smtp.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailUtil Test")
class EmailUtilTest {

    @Nested
    @DisplayName("extractDomain()")
    class ExtractDomainTest {

        @Test
        @DisplayName("Extracts domain from valid email address")
        void extractDomain_validEmail_returnsDomain() {
            // given
            String email = "user@example.com";

            // when
            String domain = EmailUtil.extractDomain(email);

            // then
            assertThat(domain).isEqualTo("example.com");
        }

        @Test
        @DisplayName("Converts uppercase domain to lowercase")
        void extractDomain_uppercaseDomain_returnsLowercase() {
            assertThat(EmailUtil.extractDomain("user@EXAMPLE.COM")).isEqualTo("example.com");
        }

        @Test
        @DisplayName("Uses the last @ for route addresses")
        void extractDomain_routeAddress_usesLastAt() {
            assertThat(EmailUtil.extractDomain("@relay.example:user@final.example")).isEqualTo("final.example");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"userexample.com", "user@", "@"})
        @DisplayName("Returns null when there is no domain")
        void extractDomain_noDomain_returnsNull(String email) {
            assertThat(EmailUtil.extractDomain(email)).isNull();
        }
    }

    @Nested
    @DisplayName("matchAddress()")
    class MatchAddressTest {

        @ParameterizedTest(name = "[{index}] ''{0}'' matches ''{1}''")
        @CsvSource({
                "abc@def, abc@def",
                "'', <>",
                "abc@def, abc@",
                "abc@def, @def",
                "abc, abc@",
                "abc@def.ghi, @.ghi",
                "abc@def.ghi, @.def.ghi",
                "anything@anything, @",
                "ABC@DEF, abc@",
                "ABC@DEF, @def",
                "joe@example.com, JOE@EXAMPLE.COM"
        })
        @DisplayName("Matching address patterns")
        void matchAddress_matches(String address, String pattern) {
            assertThat(EmailUtil.matchAddress(address, pattern)).isTrue();
        }

        @ParameterizedTest(name = "[{index}] ''{0}'' does not match ''{1}''")
        @CsvSource({
                "abc@def, not",
                "abc@def, @ghi",
                "abc@def, def@",
                "anything, <>",
                "noat, @",
                "abc@zamdef.ghi, @.def.ghi",
                "'', @",
                "@route, @",
                "broken@, @"
        })
        @DisplayName("Non-matching address patterns")
        void matchAddress_doesNotMatch(String address, String pattern) {
            assertThat(EmailUtil.matchAddress(address, pattern)).isFalse();
        }

        @Test
        @DisplayName("Null sender only matches <>")
        void matchAddress_nullSender_onlyMatchesNullPattern() {
            assertThat(EmailUtil.matchAddress("", "")).isFalse();
            assertThat(EmailUtil.matchAddress("", "abc@")).isFalse();
            assertThat(EmailUtil.matchAddress("", "@.example.com")).isFalse();
        }

        @Test
        @DisplayName("Broken addresses still match themselves literally")
        void matchAddress_brokenAddress_matchesLiterally() {
            assertThat(EmailUtil.matchAddress("broken@", "broken@")).isTrue();
            assertThat(EmailUtil.matchAddress("@route", "@route")).isTrue();
        }
    }

    @Nested
    @DisplayName("matchHost()")
    class MatchHostTest {

        @ParameterizedTest(name = "[{index}] ''{0}'' matches ''{1}''")
        @CsvSource({
                "abc, abc",
                "abc, .abc",
                "abc.def, .def",
                "abc.def.ghi, .ghi",
                "., .",
                "mail.friend.com., .friend.com",
                "MAIL.Friend.COM, mail.friend.com"
        })
        @DisplayName("Matching host patterns")
        void matchHost_matches(String host, String pattern) {
            assertThat(EmailUtil.matchHost(host, pattern)).isTrue();
        }

        @ParameterizedTest(name = "[{index}] ''{0}'' does not match ''{1}''")
        @CsvSource({
                "abc, not",
                "abc, .not",
                "prefabc, .abc",
                "., not",
                "., .not"
        })
        @DisplayName("Non-matching host patterns")
        void matchHost_doesNotMatch(String host, String pattern) {
            assertThat(EmailUtil.matchHost(host, pattern)).isFalse();
        }
    }
}
