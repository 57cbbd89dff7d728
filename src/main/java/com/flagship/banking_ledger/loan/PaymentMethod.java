package com.flagship.banking_ledger.loan;

/**
 * How a loan payment reached the bank. Informational; every payment is collected by a
 * withdrawal from the funding account whatever the method.
 */
public enum PaymentMethod {
    CASH,
    TRANSFER,
    CARD,
    UPI,
    CHEQUE
}
