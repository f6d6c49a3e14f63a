package com.company.matching.source;

/**
 * Supplies registry entities and web mentions for one matching run.
 * Implementations normalize absent values to the empty string.
 */
public interface SourceFeed {

    /**
     * Loads both collections.
     *
     * @throws SourceFeedException if the records cannot be read
     */
    SourceData load();
}
