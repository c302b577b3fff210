package com.websubrelay.repository;

import com.websubrelay.model.InterestedAccount;

import java.util.List;

/**
 * Read-only view of the account and feed tables owned by the account
 * management service.
 */
public interface AccountDirectory {

    /**
     * @return the accounts that track {@code sourceId}, each with its targets;
     *         empty when nobody watches the source
     */
    List<InterestedAccount> accountsWatching(String sourceId);
}
