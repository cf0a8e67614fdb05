package com.gpufleet.governor.model;

/**
 * The two independent dimensions cost is attributed to.
 */
public enum LedgerScope {
    KEY("key_costs", "ssh_key"),
    ACCOUNT("account_costs", "account");

    private final String ledgerTable;
    private final String identityColumn;

    LedgerScope(String ledgerTable, String identityColumn) {
        this.ledgerTable = ledgerTable;
        this.identityColumn = identityColumn;
    }

    public String ledgerTable() {
        return ledgerTable;
    }

    public String identityColumn() {
        return identityColumn;
    }
}
