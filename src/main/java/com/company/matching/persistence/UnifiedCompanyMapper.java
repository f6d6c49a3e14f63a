package com.company.matching.persistence;

import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.SourceLink;
import com.company.matching.core.model.SourceSystem;
import com.company.matching.core.model.UnifiedCompany;
import com.company.matching.core.model.WebMention;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Derives the merged attribute set of a unified company from an accepted candidate.
 */
public class UnifiedCompanyMapper {

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    public UnifiedCompany toUnifiedCompany(MatchCandidate candidate) {
        RegistryEntity registry = candidate.registryEntity();
        WebMention web = candidate.webMention();

        String unifiedName = registry.nameRaw().isEmpty() ? registry.nameNorm() : registry.nameRaw();

        return new UnifiedCompany(
                registry.registryNumber(),
                unifiedName,
                registry.nameNorm(),
                web.domain(),
                web.url(),
                web.industry(),
                registry.entityType(),
                registry.entityStatus(),
                registry.addressFull(),
                registry.suburb(),
                registry.postcode(),
                registry.state(),
                parseStartDate(registry.startDateRaw()),
                candidate.score(),
                candidate.method(),
                List.of(
                        new SourceLink(SourceSystem.REGISTRY, registry.registryNumber()),
                        new SourceLink(SourceSystem.WEB, web.id())
                )
        );
    }

    /**
     * Parses a raw registry date in {@code yyyyMMdd} or {@code yyyy-MM-dd} form.
     *
     * @return the date, or null when the value is empty or in any other form
     */
    static LocalDate parseStartDate(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            if (raw.length() == 8 && raw.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(raw, COMPACT_DATE);
            }
            if (raw.length() == 10 && raw.indexOf('-') >= 0) {
                return LocalDate.parse(raw, ISO_DATE);
            }
        } catch (DateTimeParseException e) {
            return null;
        }
        return null;
    }
}
