package com.flagship.fec_diligence.balance;

import com.flagship.fec_diligence.classification.BalanceSheetSection;
import com.flagship.fec_diligence.classification.AccountClassificationTable;
import com.flagship.fec_diligence.common.Amounts;
import com.flagship.fec_diligence.ledger.AccountBalance;
import com.flagship.fec_diligence.ledger.LedgerAggregations;
import com.flagship.fec_diligence.ledger.LedgerEntry;
import com.flagship.fec_diligence.pnl.MonthlyPnl;
import com.flagship.fec_diligence.pnl.PnlStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds point-in-time balance sheets and the working-capital reports derived from them.
 *
 * A balance sheet is a snapshot: only entries dated on or before the as-of date count.
 */
@Slf4j
@Service
public class BalanceSheetEngine {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final AccountClassificationTable classification;
    private final String currency;
    private final BigDecimal vatRate;
    private final List<Integer> agedBalanceBuckets;

    @Autowired
    public BalanceSheetEngine(AccountClassificationTable classification,
                              @Value("${fec.derivation.currency:EUR}") String currency,
                              @Value("${fec.kpi.vat-rate:1.20}") BigDecimal vatRate,
                              @Value("${fec.aged-balance.buckets:0,30,60,90,120}") List<Integer> agedBalanceBuckets) {
        if (agedBalanceBuckets.isEmpty()) {
            throw new IllegalArgumentException("At least one aged balance bucket is required");
        }
        this.classification = classification;
        this.currency = currency;
        this.vatRate = vatRate;
        this.agedBalanceBuckets = List.copyOf(agedBalanceBuckets);
    }

    public BalanceSheetEngine() {
        this(new AccountClassificationTable(), "EUR", new BigDecimal("1.20"), List.of(0, 30, 60, 90, 120));
    }

    public BalanceSheet generate(List<LedgerEntry> entries, LocalDate asOfDate, String fiscalYear) {
        List<LedgerEntry> snapshot = LedgerAggregations.filterUpTo(entries, asOfDate);

        Map<BalanceSheetSection, BigDecimal> amounts = new EnumMap<>(BalanceSheetSection.class);
        Map<BalanceSheetSection, BigDecimal> grossAmounts = new EnumMap<>(BalanceSheetSection.class);
        Map<BalanceSheetSection, BigDecimal> amortAmounts = new EnumMap<>(BalanceSheetSection.class);

        for (BalanceSheetLineDefinition definition : BalanceSheetStructure.LINES) {
            if (definition.isCalculated()) {
                continue;
            }
            BigDecimal balance = LedgerAggregations.netBalance(snapshot, definition.getAccountPrefixes(),
                definition.getExcludePrefixes());
            BigDecimal net = definition.isDebitNormal() ? balance : balance.negate();

            if (definition.isGrossAmortization()) {
                // Contra accounts are credit-normal
                BigDecimal amortization = LedgerAggregations.netBalance(snapshot,
                    FixedAssetPairing.contraPrefixesOf(definition.getAccountPrefixes()), List.of()).negate();
                grossAmounts.put(definition.getSection(), net);
                amortAmounts.put(definition.getSection(), amortization);
                net = net.subtract(amortization);
            }
            amounts.put(definition.getSection(), net);
        }

        BigDecimal stocks = sum(amounts, BalanceSheetSection.STOCKS_MATIERES, BalanceSheetSection.STOCKS_ENCOURS,
            BalanceSheetSection.STOCKS_PRODUITS, BalanceSheetSection.STOCKS_MARCHANDISES);
        amounts.put(BalanceSheetSection.STOCKS_TOTAL, stocks);

        BigDecimal actifImmobilise = sum(amounts, BalanceSheetSection.IMMOBILISATIONS_INCORPORELLES_NET,
            BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET, BalanceSheetSection.IMMOBILISATIONS_FINANCIERES);
        amounts.put(BalanceSheetSection.ACTIF_IMMOBILISE_TOTAL, actifImmobilise);

        BigDecimal actifCirculant = stocks.add(sum(amounts, BalanceSheetSection.CLIENTS_NET,
            BalanceSheetSection.FAE_AVANCES, BalanceSheetSection.AUTRES_CREANCES,
            BalanceSheetSection.CHARGES_CONSTATEES_AVANCE));
        amounts.put(BalanceSheetSection.ACTIF_CIRCULANT_EXPLOITATION, actifCirculant);

        BigDecimal tresorerieActif = sum(amounts, BalanceSheetSection.VALEURS_MOBILIERES,
            BalanceSheetSection.DISPONIBILITES);
        amounts.put(BalanceSheetSection.TRESORERIE_ACTIF, tresorerieActif);

        BigDecimal totalActif = actifImmobilise.add(actifCirculant).add(tresorerieActif);
        amounts.put(BalanceSheetSection.TOTAL_ACTIF, totalActif);

        BigDecimal capitauxPropres = sum(amounts, BalanceSheetSection.CAPITAL_SOCIAL, BalanceSheetSection.RESERVES,
            BalanceSheetSection.REPORT_NOUVEAU, BalanceSheetSection.RESULTAT_EXERCICE);
        amounts.put(BalanceSheetSection.CAPITAUX_PROPRES, capitauxPropres);

        BigDecimal dettesFinancieres = sum(amounts, BalanceSheetSection.EMPRUNTS_ETABLISSEMENTS,
            BalanceSheetSection.EMPRUNTS_ASSOCIES, BalanceSheetSection.AUTRES_DETTES_FINANCIERES);
        amounts.put(BalanceSheetSection.DETTES_FINANCIERES_TOTAL, dettesFinancieres);

        BigDecimal passifCirculant = sum(amounts, BalanceSheetSection.FOURNISSEURS,
            BalanceSheetSection.DETTES_FISCALES_SOCIALES, BalanceSheetSection.AUTRES_DETTES,
            BalanceSheetSection.PRODUITS_CONSTATES_AVANCE);
        amounts.put(BalanceSheetSection.PASSIF_CIRCULANT_EXPLOITATION, passifCirculant);

        BigDecimal tresoreriePassif = amounts.get(BalanceSheetSection.TRESORERIE_PASSIF);
        BigDecimal totalPassif = capitauxPropres
            .add(amounts.get(BalanceSheetSection.PROVISIONS_RISQUES))
            .add(dettesFinancieres)
            .add(passifCirculant)
            .add(tresoreriePassif);
        amounts.put(BalanceSheetSection.TOTAL_PASSIF, totalPassif);

        List<BalanceSheetLine> lines = new ArrayList<>();
        for (BalanceSheetLineDefinition definition : BalanceSheetStructure.LINES) {
            lines.add(BalanceSheetLine.builder()
                .code(definition.getCode())
                .label(definition.getLabel())
                .section(definition.getSection())
                .gross(grossAmounts.get(definition.getSection()))
                .amortization(amortAmounts.get(definition.getSection()))
                .net(amounts.get(definition.getSection()))
                .subtotal(definition.isSubtotal())
                .total(definition.isTotal())
                .indent(definition.getIndent())
                .build());
        }

        BigDecimal clientsNet = amounts.get(BalanceSheetSection.CLIENTS_NET);
        BigDecimal faeAvances = amounts.get(BalanceSheetSection.FAE_AVANCES);
        BigDecimal fournisseurs = amounts.get(BalanceSheetSection.FOURNISSEURS);
        BigDecimal autresCreances = amounts.get(BalanceSheetSection.AUTRES_CREANCES);
        BigDecimal cca = amounts.get(BalanceSheetSection.CHARGES_CONSTATEES_AVANCE);
        BigDecimal dettesFiscalesSociales = amounts.get(BalanceSheetSection.DETTES_FISCALES_SOCIALES);
        BigDecimal autresDettes = amounts.get(BalanceSheetSection.AUTRES_DETTES);
        BigDecimal pca = amounts.get(BalanceSheetSection.PRODUITS_CONSTATES_AVANCE);

        BigDecimal bfrOperationnel = stocks.add(clientsNet).add(faeAvances).subtract(fournisseurs);
        BigDecimal bfrNonOperationnel = autresCreances.add(cca)
            .subtract(dettesFiscalesSociales).subtract(autresDettes).subtract(pca);
        BigDecimal endettementNet = dettesFinancieres.add(tresoreriePassif).subtract(tresorerieActif);

        log.debug("Balance sheet at {} from {} entries: totalActif={}, totalPassif={}", asOfDate, snapshot.size(),
            totalActif, totalPassif);
        if (log.isDebugEnabled()) {
            List<String> outside = snapshot.stream()
                .map(LedgerEntry::getAccountNumber)
                .filter(account -> account != null && !account.isEmpty())
                .filter(account -> account.charAt(0) >= '1' && account.charAt(0) <= '5')
                .filter(account -> BalanceSheetStructure.sectionOf(account).isEmpty())
                .distinct()
                .sorted()
                .toList();
            if (!outside.isEmpty()) {
                log.debug("Accounts outside the restated balance sheet at {}: {}", asOfDate, outside);
            }
        }

        return BalanceSheet.builder()
            .asOfDate(asOfDate)
            .fiscalYear(fiscalYear)
            .currency(currency)
            .lines(List.copyOf(lines))
            .immobilisationsIncorporellesBrutes(grossAmounts.get(BalanceSheetSection.IMMOBILISATIONS_INCORPORELLES_NET))
            .immobilisationsCorporellesBrutes(grossAmounts.get(BalanceSheetSection.IMMOBILISATIONS_CORPORELLES_NET))
            .immobilisationsFinancieres(amounts.get(BalanceSheetSection.IMMOBILISATIONS_FINANCIERES))
            .actifImmobilise(actifImmobilise)
            .stocks(stocks)
            .clientsNet(clientsNet)
            .faeAvances(faeAvances)
            .autresCreances(autresCreances)
            .chargesConstateesAvance(cca)
            .actifCirculantExploitation(actifCirculant)
            .tresorerieActif(tresorerieActif)
            .totalActif(totalActif)
            .capitalSocial(amounts.get(BalanceSheetSection.CAPITAL_SOCIAL))
            .reserves(amounts.get(BalanceSheetSection.RESERVES))
            .reportANouveau(amounts.get(BalanceSheetSection.REPORT_NOUVEAU))
            .resultatExercice(amounts.get(BalanceSheetSection.RESULTAT_EXERCICE))
            .capitauxPropres(capitauxPropres)
            .provisionsRisques(amounts.get(BalanceSheetSection.PROVISIONS_RISQUES))
            .empruntsEtablissements(amounts.get(BalanceSheetSection.EMPRUNTS_ETABLISSEMENTS))
            .empruntsAssocies(amounts.get(BalanceSheetSection.EMPRUNTS_ASSOCIES))
            .autresDettesFinancieres(amounts.get(BalanceSheetSection.AUTRES_DETTES_FINANCIERES))
            .dettesFinancieres(dettesFinancieres)
            .fournisseurs(fournisseurs)
            .dettesFiscalesSociales(dettesFiscalesSociales)
            .autresDettes(autresDettes)
            .produitsConstatesAvance(pca)
            .passifCirculantExploitation(passifCirculant)
            .tresoreriePassif(tresoreriePassif)
            .totalPassif(totalPassif)
            .bfrOperationnel(bfrOperationnel)
            .bfrNonOperationnel(bfrNonOperationnel)
            .bfrTotal(bfrOperationnel.add(bfrNonOperationnel))
            .endettementNet(endettementNet)
            .build();
    }

    /**
     * DSO = clients / CA TTC x 365, DPO = fournisseurs / achats TTC x 365,
     * DIO = stocks / coût des ventes x 365, CCC = DSO + DIO - DPO.
     */
    public WorkingCapitalMetrics workingCapitalMetrics(BalanceSheet balanceSheet, BigDecimal chiffreAffairesTtc,
                                                       BigDecimal achatsTtc, BigDecimal coutDesVentes) {
        BigDecimal dso = Amounts.ratio(balanceSheet.getClientsNet(), chiffreAffairesTtc, Amounts.DAYS_PER_YEAR);
        BigDecimal dpo = Amounts.ratio(balanceSheet.getFournisseurs(), achatsTtc, Amounts.DAYS_PER_YEAR);
        BigDecimal dio = Amounts.ratio(balanceSheet.getStocks(), coutDesVentes, Amounts.DAYS_PER_YEAR);

        return WorkingCapitalMetrics.builder()
            .date(balanceSheet.getAsOfDate())
            .clientsBalance(balanceSheet.getClientsNet())
            .chiffreAffairesTtc(chiffreAffairesTtc)
            .dso(dso)
            .fournisseursBalance(balanceSheet.getFournisseurs())
            .achatsTtc(achatsTtc)
            .dpo(dpo)
            .stocksBalance(balanceSheet.getStocks())
            .coutDesVentes(coutDesVentes)
            .dio(dio)
            .ccc(dso.add(dio).subtract(dpo))
            .build();
    }

    /**
     * Same metrics with turnovers taken from the period's P&L, grossed up by the VAT rate.
     */
    public WorkingCapitalMetrics workingCapitalMetrics(BalanceSheet balanceSheet, PnlStatement pnl) {
        return workingCapitalMetrics(balanceSheet,
            pnl.getChiffreAffaires().multiply(vatRate),
            pnl.getAchatsConsommes().multiply(vatRate),
            pnl.getAchatsConsommes());
    }

    /**
     * DSO and DPO at each month-end, against the month's revenue and purchases annualized
     * (x 12) and grossed up by the VAT rate.
     */
    public List<MonthlyWorkingCapital> monthlyWorkingCapital(List<LedgerEntry> entries, List<MonthlyPnl> months) {
        List<MonthlyWorkingCapital> result = new ArrayList<>();
        for (MonthlyPnl month : months) {
            BalanceSheet balanceSheet = generate(entries, month.getMonth().atEndOfMonth(), "");
            BigDecimal annualizedCa = month.getChiffreAffaires().multiply(MONTHS_PER_YEAR).multiply(vatRate);
            BigDecimal annualizedAchats = month.getAchatsConsommes().multiply(MONTHS_PER_YEAR).multiply(vatRate);
            result.add(new MonthlyWorkingCapital(month.getMonth(),
                Amounts.ratio(balanceSheet.getClientsNet(), annualizedCa, Amounts.DAYS_PER_YEAR),
                Amounts.ratio(balanceSheet.getFournisseurs(), annualizedAchats, Amounts.DAYS_PER_YEAR)));
        }
        return result;
    }

    public List<AgedBalance> agedBalances(List<LedgerEntry> entries, LocalDate asOfDate, AgedBalanceSide side) {
        return agedBalances(entries, asOfDate, side, agedBalanceBuckets);
    }

    /**
     * Spreads each auxiliary account's movements over age buckets. An entry aged d days
     * falls in bucket i when buckets[i] <= d < buckets[i+1]; an age matching no interval
     * lands in the last bucket.
     * Accounts whose total is within one cent of zero are left out.
     */
    public List<AgedBalance> agedBalances(List<LedgerEntry> entries, LocalDate asOfDate, AgedBalanceSide side,
                                          List<Integer> buckets) {
        Map<String, List<LedgerEntry>> byAuxiliary = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            if (entry.isOnAccount(side.getAccountPrefix()) && entry.hasAuxiliaryAccount()
                    && !entry.getEntryDate().isAfter(asOfDate)) {
                byAuxiliary.computeIfAbsent(entry.getAuxiliaryAccountNumber(), key -> new ArrayList<>()).add(entry);
            }
        }

        List<AgedBalance> result = new ArrayList<>();
        byAuxiliary.forEach((auxiliary, auxiliaryEntries) -> {
            List<BigDecimal> bucketAmounts = new ArrayList<>(Collections.nCopies(buckets.size(), BigDecimal.ZERO));
            BigDecimal total = BigDecimal.ZERO;
            for (LedgerEntry entry : auxiliaryEntries) {
                long age = ChronoUnit.DAYS.between(entry.getEntryDate(), asOfDate);
                int bucket = bucketIndex(age, buckets);
                BigDecimal amount = side.signedAmount(entry);
                bucketAmounts.set(bucket, bucketAmounts.get(bucket).add(amount));
                total = total.add(amount);
            }
            if (Amounts.exceeds(total, Amounts.CENT)) {
                String label = auxiliaryEntries.get(0).getAuxiliaryAccountLabel();
                result.add(new AgedBalance(auxiliary, label != null ? label : "", List.copyOf(bucketAmounts), total));
            }
        });
        result.sort(Comparator.comparing((AgedBalance balance) -> balance.getTotal().abs()).reversed());
        return result;
    }

    /**
     * Gross, amortization and net value of each fixed-asset account at the as-of date.
     * A contra account is matched to the gross account sharing the same suffix under a
     * declared pairing (281830 amortizes 218300). Lines with a net value within one cent
     * of zero are dropped; the rest is sorted by net value, largest first.
     */
    public List<FixedAssetDetail> fixedAssetsDetail(List<LedgerEntry> entries, LocalDate asOfDate) {
        List<AccountBalance> balances = LedgerAggregations.accountBalances(
            LedgerAggregations.filterUpTo(entries, asOfDate), classification);

        Map<String, AccountBalance> grossAccounts = new LinkedHashMap<>();
        Map<String, BigDecimal> amortization = new LinkedHashMap<>();
        for (AccountBalance balance : balances) {
            for (FixedAssetPairing pairing : FixedAssetPairing.PCG_PAIRINGS) {
                if (balance.getAccountNumber().startsWith(pairing.getGrossPrefix())) {
                    grossAccounts.put(balance.getAccountNumber(), balance);
                    amortization.put(balance.getAccountNumber(), BigDecimal.ZERO);
                }
            }
        }

        for (AccountBalance balance : balances) {
            for (FixedAssetPairing pairing : FixedAssetPairing.PCG_PAIRINGS) {
                for (String contraPrefix : pairing.getContraPrefixes()) {
                    if (!balance.getAccountNumber().startsWith(contraPrefix)) {
                        continue;
                    }
                    String suffix = FixedAssetPairing.suffixOf(balance.getAccountNumber(), contraPrefix);
                    grossAccounts.keySet().stream()
                        .filter(gross -> gross.startsWith(pairing.getGrossPrefix())
                            && FixedAssetPairing.suffixOf(gross, pairing.getGrossPrefix()).equals(suffix))
                        .findFirst()
                        .ifPresent(gross -> amortization.merge(gross, balance.getBalance().negate(), BigDecimal::add));
                }
            }
        }

        List<FixedAssetDetail> detail = new ArrayList<>();
        grossAccounts.forEach((account, balance) -> {
            BigDecimal amort = amortization.get(account);
            BigDecimal net = balance.getBalance().subtract(amort);
            if (Amounts.exceeds(net, Amounts.CENT)) {
                detail.add(new FixedAssetDetail(account, balance.getAccountLabel(), balance.getBalance(), amort, net));
            }
        });
        detail.sort(Comparator.comparing(FixedAssetDetail::getNet).reversed());
        return detail;
    }

    private static int bucketIndex(long age, List<Integer> buckets) {
        for (int i = 0; i < buckets.size() - 1; i++) {
            if (age >= buckets.get(i) && age < buckets.get(i + 1)) {
                return i;
            }
        }
        return buckets.size() - 1;
    }

    private static BigDecimal sum(Map<BalanceSheetSection, BigDecimal> amounts, BalanceSheetSection... sections) {
        BigDecimal total = BigDecimal.ZERO;
        for (BalanceSheetSection section : sections) {
            total = total.add(amounts.get(section));
        }
        return total;
    }
}
