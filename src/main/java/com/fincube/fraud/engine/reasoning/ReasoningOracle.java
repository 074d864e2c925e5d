package com.fincube.fraud.engine.reasoning;

import com.fincube.fraud.model.ReasoningRequest;

/**
 * External natural-language judgment. Implementations return raw, untrusted
 * text; parsing and fallback belong to {@link ReasoningAdapter}.
 */
public interface ReasoningOracle {

    /**
     * @throws com.fincube.fraud.exception.OracleTransportException when the oracle cannot be reached
     */
    String judge(ReasoningRequest request);
}
