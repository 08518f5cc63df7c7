package com.adorsys.credentialanchor.service;

import com.adorsys.credentialanchor.ledger.AccountState;

import java.util.List;

/**
 * Outcome of a successful account check. Warnings do not block the operation.
 */
public record AccountValidationResult(AccountState account, List<String> warnings) {

    public AccountValidationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
