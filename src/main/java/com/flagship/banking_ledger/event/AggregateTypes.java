package com.flagship.banking_ledger.event;

public final class AggregateTypes {

    public static final String ACCOUNT = "Account";
    public static final String ACCOUNT_TYPE = "AccountType";
    public static final String LOAN = "Loan";

    private AggregateTypes() {
    }
}
