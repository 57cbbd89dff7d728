package com.flagship.banking_ledger.reference;

/**
 * Allocates identifiers for new accounts and loans. Ids are unique and opaque; callers
 * must not infer anything from their values beyond ordering of account ids, which the
 * lock protocol relies on.
 */
public interface IdentifierGenerator {

    long nextAccountId();

    /**
     * Human-facing account number for a freshly allocated account id.
     */
    String accountNumberFor(long accountId);

    long nextLoanId();
}
