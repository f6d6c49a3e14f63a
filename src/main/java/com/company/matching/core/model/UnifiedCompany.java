package com.company.matching.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Terminal, merged identity created from one accepted {@link MatchCandidate}.
 * Registry fields supply the legal and address attributes; the web mention supplies
 * domain, URL and industry. Every unified company carries exactly two source links.
 *
 * @param startDate parsed registration start date, or null when the raw value was unusable
 */
public record UnifiedCompany(
        String registryNumber,
        String unifiedName,
        String unifiedNameNorm,
        String websiteDomain,
        String websiteUrlSample,
        String industry,
        String entityType,
        String entityStatus,
        String addressFull,
        String suburb,
        String postcode,
        String state,
        LocalDate startDate,
        double matchConfidence,
        MatchMethod matchMethod,
        List<SourceLink> sourceLinks
) {
    public UnifiedCompany {
        Objects.requireNonNull(registryNumber, "registryNumber is required");
        Objects.requireNonNull(unifiedName, "unifiedName is required");
        Objects.requireNonNull(matchMethod, "matchMethod is required");
        sourceLinks = sourceLinks != null ? List.copyOf(sourceLinks) : List.of();
        if (sourceLinks.size() != 2) {
            throw new IllegalArgumentException("A unified company needs exactly 2 source links, got "
                    + sourceLinks.size());
        }
    }
}
