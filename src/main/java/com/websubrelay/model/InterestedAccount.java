package com.websubrelay.model;

import java.util.List;

/**
 * An account watching a source, with the messaging targets it wants notified.
 */
public record InterestedAccount(String accountId, String displayName, List<String> targets) {

    public InterestedAccount {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
