package com.company.matching.core.model;

/**
 * Origin of a record linked to a unified company.
 */
public enum SourceSystem {
    REGISTRY("ABR"),
    WEB("COMMONCRAWL");

    private final String code;

    SourceSystem(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
