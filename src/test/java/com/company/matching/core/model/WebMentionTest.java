package com.company.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebMentionTest {

    @Test
    @DisplayName("Absent attributes become empty strings")
    void testNullsNormalized() {
        WebMention mention = WebMention.builder().id("981").build();

        assertEquals("", mention.url());
        assertEquals("", mention.domain());
        assertEquals("", mention.nameNorm());
        assertFalse(mention.hasName());
    }

    @Test
    @DisplayName("Display name falls back to the raw name")
    void testDisplayName() {
        assertEquals("acme", WebMention.builder().id("1").nameNorm("acme").nameRaw("ACME").build().displayName());
        assertEquals("ACME", WebMention.builder().id("1").nameRaw("ACME").build().displayName());
    }

    @Test
    @DisplayName("Id is required")
    void testIdRequired() {
        assertThrows(NullPointerException.class, () -> WebMention.builder().build());
        assertThrows(IllegalArgumentException.class, () -> WebMention.builder().id("").build());
    }
}
