package com.fincube.fraud.service;

import com.fincube.fraud.model.AccountActivity;

/**
 * Source of raw account activity. An account with no history yields an empty
 * {@link AccountActivity}, not an error.
 */
public interface LedgerDataSource {

    AccountActivity fetchActivity(String address);
}
