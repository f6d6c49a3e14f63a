package com.company.matching.oracle;

import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;

/**
 * Builds the disambiguation prompt for one web mention / registry entity pair.
 */
public class AdjudicationPromptBuilder {

    static final String SYSTEM_PROMPT = "You are an assistant that matches companies between website data "
            + "and business registry records. Respond ONLY with JSON.";

    public OraclePrompt build(MatchCandidate candidate) {
        return new OraclePrompt(SYSTEM_PROMPT, buildUserPrompt(candidate));
    }

    String buildUserPrompt(MatchCandidate candidate) {
        WebMention web = candidate.webMention();
        RegistryEntity registry = candidate.registryEntity();

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are matching companies between a website (web crawl) and a business registry record.\n\n");

        prompt.append("Web company:\n");
        prompt.append("- Normalised name: ").append(web.displayName()).append("\n");
        prompt.append("- URL: ").append(web.url()).append("\n");
        prompt.append("- Domain: ").append(web.domain()).append("\n\n");

        prompt.append("Registry candidate:\n");
        prompt.append("- Registry number: ").append(registry.registryNumber()).append("\n");
        prompt.append("- Entity name (normalised): ").append(registry.nameNorm()).append("\n");
        prompt.append("- Entity name (raw): ").append(registry.nameRaw()).append("\n");
        prompt.append("- Entity type: ").append(registry.entityType()).append("\n");
        prompt.append("- Status: ").append(registry.entityStatus()).append("\n");
        prompt.append("- Address: ").append(registry.addressFull())
                .append(", ").append(registry.suburb())
                .append(", ").append(registry.state())
                .append(" ").append(registry.postcode()).append("\n\n");

        prompt.append("Question:\n");
        prompt.append("Are these records referring to the same underlying company?\n\n");

        prompt.append("Respond **only** with a JSON object with the following shape:\n");
        prompt.append("{\n");
        prompt.append("  \"is_match\": true or false,\n");
        prompt.append("  \"confidence\": \"low\" | \"medium\" | \"high\",\n");
        prompt.append("  \"reason\": \"short explanation here\"\n");
        prompt.append("}");

        return prompt.toString();
    }
}
