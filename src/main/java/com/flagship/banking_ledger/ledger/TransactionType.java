package com.flagship.banking_ledger.ledger;

/**
 * Kind of a transaction record. The amount on a record is always positive; the type
 * gives the direction.
 */
public enum TransactionType {
    DEPOSIT(1),
    WITHDRAWAL(-1),
    TRANSFER_IN(1),
    TRANSFER_OUT(-1),
    INTEREST(1),
    FEE(-1);

    private final int sign;

    TransactionType(int sign) {
        this.sign = sign;
    }

    public boolean isCredit() {
        return sign > 0;
    }

    public long signed(long amount) {
        return sign * amount;
    }
}
