package com.flagship.fec_diligence.qoe;

/**
 * Families of Quality-of-Earnings restatements.
 */
public enum AdjustmentType {
    ACCOUNTING_METHOD_CHANGE("Changements de méthodes comptables"),
    NON_RECURRING("Éléments non récurrents"),
    RELATED_PARTY("Transactions avec parties liées"),
    OWNER_COMPENSATION("Rémunération du dirigeant"),
    BAD_DEBT("Provisions pour créances douteuses"),
    PROVISION_RELEASE("Reprises de provisions"),
    TIMING_DIFFERENCE("Décalages temporels"),
    OTHER("Autres ajustements");

    private final String label;

    AdjustmentType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
