package com.flagship.fec_diligence.cashflow;

import lombok.Value;

import java.util.List;

final class CashFlowStructure {

    @Value
    static class LineDefinition {
        String code;
        String label;
        boolean subtotal;
        boolean total;
        int indent;
    }

    static final List<LineDefinition> LINES = List.of(
        line("EBITDA", "EBITDA"),
        detail("VAR_STOCKS", "Variation des stocks"),
        detail("VAR_CLIENTS", "Variation clients et comptes rattachés"),
        detail("VAR_FAE", "Variation FAE et avances fournisseurs"),
        detail("VAR_FRS", "Variation fournisseurs et comptes rattachés"),
        subtotal("VAR_BFR_OP", "Variation du BFR opérationnel"),
        detail("VAR_AUTRES_CR", "Variation autres créances"),
        detail("VAR_DETTES_FS", "Variation dettes fiscales et sociales"),
        detail("VAR_AUTRES_DETTES", "Variation autres dettes"),
        subtotal("VAR_BFR_NON_OP", "Variation du BFR non opérationnel"),
        subtotal("FLUX_EXPL", "Flux de trésorerie d'exploitation"),

        detail("CAPEX", "Investissements (CAPEX)"),
        detail("CESSIONS", "Cessions d'actifs"),
        detail("VAR_IMMO_FIN", "Variation immobilisations financières"),
        subtotal("FLUX_INVEST", "Flux de trésorerie d'investissement"),

        subtotal("FCF_AVANT_IS", "FCF avant impôt"),
        detail("IS_PAYE", "Impôt sur les sociétés payé"),
        subtotal("FCF_APRES_IS", "FCF après impôt"),

        detail("DIVIDENDES", "Dividendes versés"),
        detail("VAR_EMPRUNTS", "Variation emprunts"),
        detail("VAR_CC", "Variation comptes courants associés"),
        detail("ECART_RECONCILIATION", "Écart de réconciliation"),
        subtotal("FLUX_FIN", "Flux de trésorerie de financement"),

        subtotal("VAR_TRESO", "Variation de trésorerie"),
        line("TRESO_OUVERTURE", "Trésorerie d'ouverture"),
        new LineDefinition("TRESO_CLOTURE", "Trésorerie de clôture", false, true, 0)
    );

    private CashFlowStructure() {
    }

    private static LineDefinition line(String code, String label) {
        return new LineDefinition(code, label, false, false, 0);
    }

    private static LineDefinition detail(String code, String label) {
        return new LineDefinition(code, label, false, false, 1);
    }

    private static LineDefinition subtotal(String code, String label) {
        return new LineDefinition(code, label, true, false, 0);
    }
}
