package com.company.matching.oracle;

import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.MatchMethod;
import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdjudicationPromptBuilderTest {

    private final AdjudicationPromptBuilder builder = new AdjudicationPromptBuilder();

    private static MatchCandidate acme() {
        WebMention web = WebMention.builder()
                .id("w1")
                .url("https://www.acme.com.au/about")
                .domain("acme.com.au")
                .nameNorm("acme pty ltd")
                .nameRaw("ACME Pty Ltd")
                .build();
        RegistryEntity registry = RegistryEntity.builder()
                .registryNumber("51824753556")
                .nameNorm("acme pty ltd")
                .nameRaw("ACME PTY LTD")
                .entityType("Australian Private Company")
                .entityStatus("ACT")
                .addressFull("1 George St")
                .suburb("Sydney")
                .postcode("2000")
                .state("NSW")
                .build();
        return new MatchCandidate(web, registry, 100.0, MatchMethod.FUZZY_NAME_AMBIGUOUS);
    }

    @Test
    @DisplayName("Prompt describes both records and asks for the verdict JSON")
    void testUserPrompt() {
        String prompt = builder.build(acme()).userPrompt();

        assertTrue(prompt.contains("- Normalised name: acme pty ltd"));
        assertTrue(prompt.contains("- URL: https://www.acme.com.au/about"));
        assertTrue(prompt.contains("- Domain: acme.com.au"));
        assertTrue(prompt.contains("- Registry number: 51824753556"));
        assertTrue(prompt.contains("- Entity name (raw): ACME PTY LTD"));
        assertTrue(prompt.contains("- Status: ACT"));
        assertTrue(prompt.contains("- Address: 1 George St, Sydney, NSW 2000"));
        assertTrue(prompt.contains("\"is_match\""));
        assertTrue(prompt.contains("\"confidence\": \"low\" | \"medium\" | \"high\""));
    }

    @Test
    @DisplayName("System prompt requires a JSON-only answer")
    void testSystemPrompt() {
        OraclePrompt prompt = builder.build(acme());
        assertEquals(AdjudicationPromptBuilder.SYSTEM_PROMPT, prompt.systemPrompt());
        assertTrue(prompt.systemPrompt().contains("JSON"));
    }

    @Test
    @DisplayName("Raw web name is used when the normalized name is empty")
    void testDisplayNameFallback() {
        MatchCandidate base = acme();
        WebMention rawOnly = WebMention.builder().id("w2").nameRaw("Acme Online").build();
        MatchCandidate candidate = new MatchCandidate(rawOnly, base.registryEntity(), 40.0, MatchMethod.FUZZY_NAME);

        assertTrue(builder.build(candidate).userPrompt().contains("- Normalised name: Acme Online"));
    }

    @Test
    @DisplayName("Same candidate always yields the same prompt")
    void testDeterministic() {
        assertEquals(builder.build(acme()), builder.build(acme()));
    }
}
