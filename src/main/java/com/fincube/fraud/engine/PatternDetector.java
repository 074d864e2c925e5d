package com.fincube.fraud.engine;

import com.fincube.fraud.model.AccountActivity;
import com.fincube.fraud.model.PatternDimension;
import com.fincube.fraud.model.PatternFinding;

/**
 * Interface for all pattern detectors.
 * Each implementation covers one {@link PatternDimension} and is stateless.
 */
public interface PatternDetector {

    /**
     * The dimension this detector reports on.
     */
    PatternDimension getDimension();

    /**
     * Inspect the account's transfer history.
     *
     * @param activity raw sent/received transfers and balance
     * @return triggered indicators with the clamped sum of their weights as risk level
     */
    PatternFinding detect(AccountActivity activity);
}
