package com.company.matching.oracle;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of constructing a decision oracle: either a usable oracle or the reason none is available.
 * An unavailable oracle is a normal run-level condition, not an error.
 */
public final class OracleAvailability {

    private final DecisionOracle oracle;
    private final String reason;

    private OracleAvailability(DecisionOracle oracle, String reason) {
        this.oracle = oracle;
        this.reason = reason;
    }

    public static OracleAvailability available(DecisionOracle oracle) {
        return new OracleAvailability(Objects.requireNonNull(oracle, "oracle is required"), null);
    }

    public static OracleAvailability unavailable(String reason) {
        return new OracleAvailability(null, Objects.requireNonNull(reason, "reason is required"));
    }

    public boolean isAvailable() {
        return oracle != null;
    }

    public Optional<DecisionOracle> oracle() {
        return Optional.ofNullable(oracle);
    }

    /**
     * Why the oracle is unavailable; empty when it is available.
     */
    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return isAvailable()
                ? "OracleAvailability{available, provider=" + oracle.getProviderName() + '}'
                : "OracleAvailability{unavailable, reason='" + reason + "'}";
    }
}
