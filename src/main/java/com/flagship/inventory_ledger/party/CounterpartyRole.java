package com.flagship.inventory_ledger.party;

import com.flagship.inventory_ledger.common.CodePrefix;

public enum CounterpartyRole {
    OWNER(CodePrefix.OWNER),
    SUPPLIER(CodePrefix.SUPPLIER),
    CUSTOMER(CodePrefix.CUSTOMER);

    private final CodePrefix codePrefix;

    CounterpartyRole(CodePrefix codePrefix) {
        this.codePrefix = codePrefix;
    }

    public CodePrefix codePrefix() {
        return codePrefix;
    }
}
