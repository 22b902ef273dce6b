package org.javai.result.transaction;

/**
 * The step that closes a transaction once its bounded operation has produced a result.
 */
public enum TransactionPhase {

    /** The bounded operation succeeded and the transaction is committed. */
    COMMIT("commit"),

    /** The bounded operation failed and the transaction is rolled back. */
    ROLLBACK("rollback");

    private final String label;

    TransactionPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
