package com.company.matching.api;

/**
 * Counts per bucket for one pipeline run.
 *
 * @param registryEntities registry entities loaded
 * @param webMentions      web mentions loaded
 * @param autoAccepted     candidates accepted on score alone
 * @param oracleAccepted   candidates accepted by the decision oracle
 * @param stillAmbiguous   candidates left for later review (rejected or deferred)
 * @param discarded        candidates dropped under the low threshold
 * @param unmatched        web mentions with no candidate
 * @param totalWritten     unified companies written
 */
public record RunSummary(
        int registryEntities,
        int webMentions,
        int autoAccepted,
        int oracleAccepted,
        int stillAmbiguous,
        int discarded,
        int unmatched,
        int totalWritten
) {
    @Override
    public String toString() {
        return "RunSummary{registryEntities=" + registryEntities +
                ", webMentions=" + webMentions +
                ", autoAccepted=" + autoAccepted +
                ", oracleAccepted=" + oracleAccepted +
                ", stillAmbiguous=" + stillAmbiguous +
                ", discarded=" + discarded +
                ", unmatched=" + unmatched +
                ", totalWritten=" + totalWritten + '}';
    }
}
