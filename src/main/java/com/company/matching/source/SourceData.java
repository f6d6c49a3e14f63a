package com.company.matching.source;

import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;

import java.util.List;

/**
 * The two ordered record collections fed to the matcher.
 */
public record SourceData(List<RegistryEntity> registryEntities, List<WebMention> webMentions) {
    public SourceData {
        registryEntities = registryEntities != null ? List.copyOf(registryEntities) : List.of();
        webMentions = webMentions != null ? List.copyOf(webMentions) : List.of();
    }
}
