package com.linkdeck.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogRedactor")
class LogRedactorTest {

    @Nested
    @DisplayName("truncate()")
    class Truncate {

        @Test
        @DisplayName("keeps the first eight characters of a long identifier")
        void truncatesLongIdentifier() {
            assertThat(LogRedactor.truncate("5f1d3c7a-90ab-4cde-8f01-23456789abcd")).isEqualTo("5f1d3c7a…");
        }

        @Test
        @DisplayName("returns short identifiers unchanged")
        void keepsShortIdentifier() {
            assertThat(LogRedactor.truncate("u1")).isEqualTo("u1");
        }

        @Test
        @DisplayName("renders null as a dash")
        void nullBecomesDash() {
            assertThat(LogRedactor.truncate(null)).isEqualTo("-");
        }
    }

    @Nested
    @DisplayName("maskEmail()")
    class MaskEmail {

        @Test
        @DisplayName("masks the local part and keeps the domain")
        void masksLocalPart() {
            assertThat(LogRedactor.maskEmail("jane.doe@example.com")).isEqualTo("ja***@example.com");
        }

        @Test
        @DisplayName("handles one-character local parts")
        void shortLocalPart() {
            assertThat(LogRedactor.maskEmail("j@example.com")).isEqualTo("j***@example.com");
        }

        @Test
        @DisplayName("falls back to truncation when there is no @")
        void noAtSign() {
            assertThat(LogRedactor.maskEmail("not-an-email-address")).isEqualTo("not-an-e…");
        }
    }

    @Nested
    @DisplayName("maskEmails()")
    class MaskEmails {

        @Test
        @DisplayName("masks every address inside a message")
        void masksAddressesInText() {
            assertThat(LogRedactor.maskEmails("No user found with email: jane.doe@example.com"))
                    .isEqualTo("No user found with email: ja***@example.com");
            assertThat(LogRedactor.maskEmails("bob@a.io, carol@b.io"))
                    .isEqualTo("bo***@a.io, ca***@b.io");
        }

        @Test
        @DisplayName("leaves text without addresses alone")
        void plainText() {
            assertThat(LogRedactor.maskEmails("No user found with userId: u1")).isEqualTo("No user found with userId: u1");
        }

        @Test
        @DisplayName("renders null as a dash")
        void nullBecomesDash() {
            assertThat(LogRedactor.maskEmails(null)).isEqualTo("-");
        }
    }
}
