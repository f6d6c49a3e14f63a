package com.company.matching.core.model;

import java.util.Objects;

/**
 * Company-like record derived from crawled web content.
 * An empty normalized name makes the mention unmatchable.
 */
public record WebMention(
        String id,
        String crawlId,
        String url,
        String domain,
        String tld,
        String htmlTitle,
        String nameNorm,
        String nameRaw,
        String industry,
        String fetchedAt
) {
    public WebMention {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        crawlId = orEmpty(crawlId);
        url = orEmpty(url);
        domain = orEmpty(domain);
        tld = orEmpty(tld);
        htmlTitle = orEmpty(htmlTitle);
        nameNorm = orEmpty(nameNorm);
        nameRaw = orEmpty(nameRaw);
        industry = orEmpty(industry);
        fetchedAt = orEmpty(fetchedAt);
    }

    public boolean hasName() {
        return !nameNorm.isBlank();
    }

    /**
     * Name shown to the oracle: the normalized name, or the raw one when normalization left nothing.
     */
    public String displayName() {
        return nameNorm.isBlank() ? nameRaw : nameNorm;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String crawlId;
        private String url;
        private String domain;
        private String tld;
        private String htmlTitle;
        private String nameNorm;
        private String nameRaw;
        private String industry;
        private String fetchedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder crawlId(String crawlId) {
            this.crawlId = crawlId;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder tld(String tld) {
            this.tld = tld;
            return this;
        }

        public Builder htmlTitle(String htmlTitle) {
            this.htmlTitle = htmlTitle;
            return this;
        }

        public Builder nameNorm(String nameNorm) {
            this.nameNorm = nameNorm;
            return this;
        }

        public Builder nameRaw(String nameRaw) {
            this.nameRaw = nameRaw;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder fetchedAt(String fetchedAt) {
            this.fetchedAt = fetchedAt;
            return this;
        }

        public WebMention build() {
            return new WebMention(id, crawlId, url, domain, tld, htmlTitle, nameNorm, nameRaw,
                    industry, fetchedAt);
        }
    }
}
