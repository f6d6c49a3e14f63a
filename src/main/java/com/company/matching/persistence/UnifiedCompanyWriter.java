package com.company.matching.persistence;

import com.company.matching.core.model.MatchCandidate;

import java.util.List;

/**
 * Persists accepted candidates as unified companies plus their source links.
 *
 * <p>Each call replaces the whole unified set in one transaction: existing rows are removed,
 * then one unified company and two source links are inserted per candidate. On failure
 * nothing from the call is committed and callers should treat the unified data as empty.</p>
 */
public interface UnifiedCompanyWriter {

    /**
     * Replaces the unified set with the given accepted candidates.
     *
     * @throws UnificationWriteException if the write failed and was rolled back
     */
    WriteResult write(List<MatchCandidate> accepted);
}
