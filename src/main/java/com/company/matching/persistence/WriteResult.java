package com.company.matching.persistence;

/**
 * Rows written by one unification write.
 */
public record WriteResult(int companiesWritten, int linksWritten) {

    public static WriteResult empty() {
        return new WriteResult(0, 0);
    }
}
