package com.mailrules.runtime.fields;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AddressParserTest {

    private final AddressParser parser = new AddressParser();

    @Test
    @DisplayName("Should strip the display name")
    void stripsDisplayName() {
        assertThat(parser.bareAddress("HR Team <hr@tenmiles.com>")).isEqualTo("hr@tenmiles.com");
        assertThat(parser.bareAddress("\"Doe, Jane\" <jane@example.com>")).isEqualTo("jane@example.com");
    }

    @Test
    @DisplayName("Should keep plain addresses unchanged")
    void keepsPlainAddress() {
        assertThat(parser.bareAddress("user1@test.com")).isEqualTo("user1@test.com");
    }

    @Test
    @DisplayName("Should fall back to the raw value when parsing fails")
    void fallsBackToRaw() {
        assertThat(parser.bareAddress("Broken <unterminated")).isEqualTo("Broken <unterminated");
    }

    @Test
    @DisplayName("Should map empty and null input to empty string")
    void handlesEmptyInput() {
        assertThat(parser.bareAddress(null)).isEmpty();
        assertThat(parser.bareAddress("")).isEmpty();
    }

    @Test
    @DisplayName("Should parse each element of a list")
    void parsesLists() {
        assertThat(parser.bareAddresses(List.of("A <a@x.com>", "b@y.com")))
                .containsExactly("a@x.com", "b@y.com");
    }
}
