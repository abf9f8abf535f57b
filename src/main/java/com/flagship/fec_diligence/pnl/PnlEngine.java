package com.flagship.fec_diligence.pnl;

import com.flagship.fec_diligence.classification.AccountGroups;
import com.flagship.fec_diligence.classification.PnlSection;
import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.ledger.LedgerAggregations;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Derives P&L statements from ledger entries.
 *
 * Direct lines are prefix sums, three sections are netted through {@link NettingRule}s,
 * and every subtotal is recomputed from its components in a fixed order:
 * production, marge sur coûts directs, EBITDA, résultat d'exploitation, résultat
 * financier, résultat courant, résultat exceptionnel, résultat net.
 *
 * Pure function of its inputs: no state is kept between calls.
 */
@Slf4j
@Service
public class PnlEngine {

    private static final BigDecimal BRIDGE_ROUNDING_GUARD = Amounts.CENT;

    private final String currency;

    @Autowired
    public PnlEngine(@Value("${fec.derivation.currency:EUR}") String currency) {
        this.currency = currency;
    }

    public PnlEngine() {
        this("EUR");
    }

    /**
     * Builds the P&L of a period. Entries are expected to be already restricted to it.
     */
    public PnlStatement generate(List<LedgerEntry> entries, String fiscalYear, LocalDate startDate, LocalDate endDate) {
        Map<PnlSection, BigDecimal> amounts = new EnumMap<>(PnlSection.class);

        for (PnlLineDefinition definition : PnlStructure.LINES) {
            if (definition.isCalculated()) {
                continue;
            }
            Optional<NettingRule> netting = PnlStructure.nettingRuleOf(definition.getSection());
            BigDecimal amount = netting.isPresent()
                ? netting.get().apply(entries)
                : directAmount(entries, definition);
            amounts.put(definition.getSection(), amount);
        }

        BigDecimal production = amounts.get(PnlSection.CHIFFRE_AFFAIRES)
            .add(amounts.get(PnlSection.VARIATION_ENCOURS));
        amounts.put(PnlSection.PRODUCTION, production);

        BigDecimal marge = production
            .subtract(amounts.get(PnlSection.ACHATS_CONSOMMES))
            .subtract(amounts.get(PnlSection.SOUS_TRAITANCE));
        amounts.put(PnlSection.MARGE_COUTS_DIRECTS, marge);

        BigDecimal ebitda = marge
            .subtract(amounts.get(PnlSection.AUTRES_ACHATS))
            .subtract(amounts.get(PnlSection.IMPOTS_TAXES))
            .subtract(amounts.get(PnlSection.CHARGES_PERSONNEL))
            .subtract(amounts.get(PnlSection.AUTRES_CHARGES_GESTION));
        amounts.put(PnlSection.EBITDA, ebitda);

        BigDecimal resultatExploitation = ebitda.subtract(amounts.get(PnlSection.DOTATIONS_AMORTISSEMENTS));
        amounts.put(PnlSection.RESULTAT_EXPLOITATION, resultatExploitation);

        BigDecimal resultatFinancier = amounts.get(PnlSection.PRODUITS_FINANCIERS)
            .subtract(amounts.get(PnlSection.CHARGES_FINANCIERES));
        amounts.put(PnlSection.RESULTAT_FINANCIER, resultatFinancier);

        BigDecimal resultatCourant = resultatExploitation.add(resultatFinancier);
        amounts.put(PnlSection.RESULTAT_COURANT, resultatCourant);

        BigDecimal resultatExceptionnel = amounts.get(PnlSection.PRODUITS_EXCEPTIONNELS)
            .subtract(amounts.get(PnlSection.CHARGES_EXCEPTIONNELLES));
        amounts.put(PnlSection.RESULTAT_EXCEPTIONNEL, resultatExceptionnel);

        BigDecimal resultatNet = resultatCourant
            .add(resultatExceptionnel)
            .subtract(amounts.get(PnlSection.PARTICIPATION_SALARIES))
            .subtract(amounts.get(PnlSection.IMPOT_SOCIETES));
        amounts.put(PnlSection.RESULTAT_NET, resultatNet);

        List<PnlLine> lines = new ArrayList<>();
        for (PnlLineDefinition definition : PnlStructure.LINES) {
            BigDecimal amount = amounts.get(definition.getSection());
            lines.add(PnlLine.builder()
                .code(definition.getCode())
                .label(definition.getLabel())
                .section(definition.getSection())
                .amount(amount)
                .marginPercent(definition.isCalculated()
                    ? Amounts.ratioOrNull(amount, production, Amounts.HUNDRED)
                    : null)
                .subtotal(definition.isSubtotal())
                .total(definition.isTotal())
                .indent(definition.getIndent())
                .build());
        }

        BigDecimal cessions = LedgerAggregations.sumCreditByPrefix(entries, AccountGroups.PRODUITS_CESSIONS_ACTIFS)
            .subtract(LedgerAggregations.sumDebitByPrefix(entries, AccountGroups.PRODUITS_CESSIONS_ACTIFS));

        log.debug("P&L {} derived from {} entries: production={}, ebitda={}", fiscalYear, entries.size(),
            production, ebitda);

        return PnlStatement.builder()
            .fiscalYear(fiscalYear)
            .startDate(startDate)
            .endDate(endDate)
            .currency(currency)
            .lines(List.copyOf(lines))
            .chiffreAffaires(amounts.get(PnlSection.CHIFFRE_AFFAIRES))
            .production(production)
            .achatsConsommes(amounts.get(PnlSection.ACHATS_CONSOMMES))
            .margeCoutsDirects(marge)
            .ebitda(ebitda)
            .ebitdaMargin(Amounts.percentOf(ebitda, production))
            .resultatExploitation(resultatExploitation)
            .resultatNet(resultatNet)
            .produitsCessionsActifs(cessions)
            .build();
    }

    /**
     * Re-runs the full derivation for each calendar month present in the entries.
     */
    public List<MonthlyPnl> generateMonthly(List<LedgerEntry> entries, String fiscalYear) {
        Map<YearMonth, List<LedgerEntry>> byMonth = new TreeMap<>();
        for (LedgerEntry entry : entries) {
            byMonth.computeIfAbsent(YearMonth.from(entry.getEntryDate()), month -> new ArrayList<>()).add(entry);
        }

        List<MonthlyPnl> result = new ArrayList<>();
        byMonth.forEach((month, monthEntries) -> {
            PnlStatement pnl = generate(monthEntries, fiscalYear, month.atDay(1), month.atEndOfMonth());
            result.add(new MonthlyPnl(month, pnl.getChiffreAffaires(), pnl.getAchatsConsommes(),
                pnl.getProduction(), pnl.getEbitda(), pnl.getEbitdaMargin()));
        });
        return result;
    }

    /**
     * Last twelve months ending at asOfDate (inclusive).
     */
    public PnlStatement generateLtm(List<LedgerEntry> entries, LocalDate asOfDate) {
        LocalDate startDate = asOfDate.minusYears(1).plusDays(1);
        List<LedgerEntry> ltmEntries = LedgerAggregations.filterByDateRange(entries, startDate, asOfDate);
        return generate(ltmEntries, "LTM " + YearMonth.from(asOfDate), startDate, asOfDate);
    }

    /**
     * Compares the last two statements of a chronologically ordered list.
     */
    public PnlComparison compare(List<PnlStatement> statements) {
        if (statements.size() < 2) {
            return new PnlComparison(List.copyOf(statements), List.of());
        }

        List<PnlVariation> variations = new ArrayList<>();
        for (PnlLineDefinition definition : PnlStructure.LINES) {
            List<BigDecimal> amounts = statements.stream()
                .map(statement -> statement.amountOf(definition.getSection()))
                .toList();
            BigDecimal current = amounts.get(amounts.size() - 1);
            BigDecimal previous = amounts.get(amounts.size() - 2);
            BigDecimal absolute = current.subtract(previous);
            variations.add(new PnlVariation(definition.getSection(), definition.getLabel(), amounts, absolute,
                Amounts.ratio(absolute, previous.abs(), Amounts.HUNDRED)));
        }
        return new PnlComparison(List.copyOf(statements), variations);
    }

    /**
     * Per-account breakdown of one section, largest absolute amount first.
     * Calculated sections have no breakdown.
     */
    public List<SectionDetailLine> sectionDetail(List<LedgerEntry> entries, PnlSection section) {
        Optional<PnlLineDefinition> definition = PnlStructure.definitionOf(section);
        if (definition.isEmpty() || definition.get().isCalculated()) {
            return List.of();
        }
        Optional<NettingRule> netting = PnlStructure.nettingRuleOf(section);

        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        Map<String, String> labels = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            BigDecimal contribution;
            if (netting.isPresent()) {
                if (!netting.get().appliesTo(entry) || netting.get().isCarvedOut(entry)) {
                    continue;
                }
                contribution = netting.get().contribution(entry);
            } else {
                if (!LedgerAggregations.matchesAny(entry, definition.get().getAccountPrefixes())) {
                    continue;
                }
                contribution = definition.get().isCreditNormal() ? entry.netAmount().negate() : entry.netAmount();
            }
            totals.merge(entry.getAccountNumber(), contribution, BigDecimal::add);
            labels.putIfAbsent(entry.getAccountNumber(), entry.getAccountLabel());
        }

        List<SectionDetailLine> detail = new ArrayList<>();
        totals.forEach((account, amount) -> detail.add(new SectionDetailLine(account, labels.get(account), amount)));
        detail.sort(Comparator.comparing((SectionDetailLine line) -> line.getAmount().abs()).reversed());
        return detail;
    }

    /**
     * EBITDA waterfall from the previous period to the current one. A step is emitted
     * whenever its absolute value exceeds one cent; the steps always add up from the
     * start value to the end value.
     */
    public List<EbitdaBridgeItem> ebitdaBridge(PnlStatement current, PnlStatement previous) {
        List<EbitdaBridgeItem> bridge = new ArrayList<>();
        bridge.add(new EbitdaBridgeItem("EBITDA " + previous.getFiscalYear(), previous.getEbitda(),
            EbitdaBridgeItem.Type.START));

        addStep(bridge, "Δ Production", current.getProduction().subtract(previous.getProduction()));
        addStep(bridge, "Δ Achats", costVariation(current, previous, PnlSection.ACHATS_CONSOMMES));
        addStep(bridge, "Δ Sous-traitance", costVariation(current, previous, PnlSection.SOUS_TRAITANCE));
        addStep(bridge, "Δ Personnel", costVariation(current, previous, PnlSection.CHARGES_PERSONNEL));
        addStep(bridge, "Δ Autres charges", costVariation(current, previous,
            PnlSection.AUTRES_ACHATS, PnlSection.IMPOTS_TAXES, PnlSection.AUTRES_CHARGES_GESTION));

        bridge.add(new EbitdaBridgeItem("EBITDA " + current.getFiscalYear(), current.getEbitda(),
            EbitdaBridgeItem.Type.END));
        return bridge;
    }

    private static void addStep(List<EbitdaBridgeItem> bridge, String label, BigDecimal value) {
        if (Amounts.exceeds(value, BRIDGE_ROUNDING_GUARD)) {
            bridge.add(EbitdaBridgeItem.step(label, value));
        }
    }

    /**
     * A cost increase lowers EBITDA, so the variation is negated.
     */
    private static BigDecimal costVariation(PnlStatement current, PnlStatement previous, PnlSection... sections) {
        BigDecimal variation = BigDecimal.ZERO;
        for (PnlSection section : sections) {
            variation = variation.add(current.amountOf(section).subtract(previous.amountOf(section)));
        }
        return variation.negate();
    }

    private static BigDecimal directAmount(List<LedgerEntry> entries, PnlLineDefinition definition) {
        BigDecimal debit = LedgerAggregations.sumDebitByPrefixes(entries, definition.getAccountPrefixes());
        BigDecimal credit = LedgerAggregations.sumCreditByPrefixes(entries, definition.getAccountPrefixes());
        return definition.isCreditNormal() ? credit.subtract(debit) : debit.subtract(credit);
    }
}
