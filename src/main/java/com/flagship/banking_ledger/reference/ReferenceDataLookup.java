package com.flagship.banking_ledger.reference;

import java.util.Optional;

/**
 * Read access to master data owned by other services: account types and loan products.
 * The ledger only ever resolves codes to ids; it never writes reference data.
 */
public interface ReferenceDataLookup {

    /**
     * @throws com.flagship.banking_ledger.ledger.exception.NotFoundException for an unknown code
     */
    long resolveAccountTypeId(String accountTypeCode);

    /**
     * @throws com.flagship.banking_ledger.ledger.exception.NotFoundException for an unknown code
     */
    long resolveProductId(String productCode);

    Optional<LoanProduct> findProduct(long productId);
}
