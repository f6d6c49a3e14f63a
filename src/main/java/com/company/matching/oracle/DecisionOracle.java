package com.company.matching.oracle;

/**
 * External judgment service (a language model) deciding whether a candidate pair
 * refers to the same company.
 *
 * <p>Calls are synchronous and bounded by the implementation's timeout. The raw response
 * text is returned unparsed so it can be audited before validation.</p>
 */
public interface DecisionOracle {

    /**
     * Sends one prompt to the oracle.
     *
     * @param prompt the system instruction and user prompt
     * @return the raw response text
     * @throws OracleException if the call fails or the response envelope is unusable
     */
    String complete(OraclePrompt prompt) throws OracleException;

    /**
     * Returns the name/identifier of this oracle, including the model.
     */
    String getProviderName();
}
