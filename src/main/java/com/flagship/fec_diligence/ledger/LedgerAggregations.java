package com.flagship.fec_diligence.ledger;

import com.flagship.fec_diligence.classification.AccountClassificationTable;
import com.flagship.fec_diligence.classification.AccountMapping;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Aggregation helpers over ledger entries, used by every statement engine.
 * Balances are always debit minus credit; callers flip the sign for credit-normal accounts.
 */
public final class LedgerAggregations {

    private LedgerAggregations() {
    }

    public static BigDecimal sumDebitByPrefix(Collection<LedgerEntry> entries, String prefix) {
        return sum(entries, prefix, LedgerEntry::getDebit);
    }

    public static BigDecimal sumCreditByPrefix(Collection<LedgerEntry> entries, String prefix) {
        return sum(entries, prefix, LedgerEntry::getCredit);
    }

    public static BigDecimal netBalanceByPrefix(Collection<LedgerEntry> entries, String prefix) {
        return sum(entries, prefix, LedgerEntry::netAmount);
    }

    /**
     * Entries matching several of the prefixes are counted once.
     */
    public static BigDecimal sumDebitByPrefixes(Collection<LedgerEntry> entries, Collection<String> prefixes) {
        return sumMatching(entries, prefixes, LedgerEntry::getDebit);
    }

    public static BigDecimal sumCreditByPrefixes(Collection<LedgerEntry> entries, Collection<String> prefixes) {
        return sumMatching(entries, prefixes, LedgerEntry::getCredit);
    }

    /**
     * Net balance over several prefixes. Each entry is counted once even when it matches
     * more than one prefix, and entries matching an exclusion prefix are skipped.
     */
    public static BigDecimal netBalance(Collection<LedgerEntry> entries, Collection<String> prefixes,
                                        Collection<String> exclusions) {
        BigDecimal total = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            if (matchesAny(entry, prefixes) && !matchesAny(entry, exclusions)) {
                total = total.add(entry.netAmount());
            }
        }
        return total;
    }

    public static List<LedgerEntry> filterByPrefix(Collection<LedgerEntry> entries, String prefix) {
        return entries.stream().filter(entry -> entry.isOnAccount(prefix)).toList();
    }

    public static List<LedgerEntry> filterByPrefixes(Collection<LedgerEntry> entries, Collection<String> prefixes) {
        return entries.stream().filter(entry -> matchesAny(entry, prefixes)).toList();
    }

    /**
     * Entries dated within [startDate, endDate], both bounds inclusive.
     */
    public static List<LedgerEntry> filterByDateRange(Collection<LedgerEntry> entries,
                                                      LocalDate startDate, LocalDate endDate) {
        return entries.stream()
            .filter(entry -> !entry.getEntryDate().isBefore(startDate) && !entry.getEntryDate().isAfter(endDate))
            .toList();
    }

    public static List<LedgerEntry> filterUpTo(Collection<LedgerEntry> entries, LocalDate asOfDate) {
        return entries.stream().filter(entry -> !entry.getEntryDate().isAfter(asOfDate)).toList();
    }

    /**
     * One balance per account number, sorted by account number.
     */
    public static List<AccountBalance> accountBalances(Collection<LedgerEntry> entries,
                                                       AccountClassificationTable classification) {
        Map<String, List<LedgerEntry>> byAccount = new TreeMap<>();
        for (LedgerEntry entry : entries) {
            byAccount.computeIfAbsent(entry.getAccountNumber(), key -> new ArrayList<>()).add(entry);
        }

        List<AccountBalance> balances = new ArrayList<>();
        byAccount.forEach((accountNumber, accountEntries) -> {
            BigDecimal debit = sum(accountEntries, null, LedgerEntry::getDebit);
            BigDecimal credit = sum(accountEntries, null, LedgerEntry::getCredit);
            balances.add(new AccountBalance(
                accountNumber,
                accountEntries.get(0).getAccountLabel(),
                classification.classify(accountNumber).map(AccountMapping::getCategory).orElse(null),
                debit,
                credit,
                debit.subtract(credit),
                accountEntries.size()));
        });
        return balances;
    }

    /**
     * Balances per (account, auxiliary account) under a prefix, largest absolute balance first.
     * Entries without an auxiliary account are ignored.
     */
    public static List<AuxiliaryBalance> auxiliaryBalances(Collection<LedgerEntry> entries, String prefix) {
        Map<String, List<LedgerEntry>> byAuxiliary = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            if (entry.isOnAccount(prefix) && entry.hasAuxiliaryAccount()) {
                String key = entry.getAccountNumber() + "|" + entry.getAuxiliaryAccountNumber();
                byAuxiliary.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
            }
        }

        List<AuxiliaryBalance> balances = new ArrayList<>();
        for (List<LedgerEntry> group : byAuxiliary.values()) {
            LedgerEntry first = group.get(0);
            BigDecimal debit = sum(group, null, LedgerEntry::getDebit);
            BigDecimal credit = sum(group, null, LedgerEntry::getCredit);
            String label = group.stream()
                .map(LedgerEntry::getAuxiliaryAccountLabel)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse("");
            balances.add(new AuxiliaryBalance(first.getAccountNumber(), first.getAuxiliaryAccountNumber(),
                label, debit, credit, debit.subtract(credit)));
        }
        balances.sort(Comparator.comparing((AuxiliaryBalance b) -> b.getBalance().abs()).reversed());
        return balances;
    }

    /**
     * Month-by-month movements of a prefix with running opening and closing balances.
     */
    public static List<MonthlyBalance> monthlyBalances(Collection<LedgerEntry> entries, String prefix) {
        Map<YearMonth, BigDecimal[]> byMonth = new TreeMap<>();
        for (LedgerEntry entry : entries) {
            if (entry.isOnAccount(prefix)) {
                BigDecimal[] movements = byMonth.computeIfAbsent(YearMonth.from(entry.getEntryDate()),
                    month -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
                movements[0] = movements[0].add(entry.getDebit());
                movements[1] = movements[1].add(entry.getCredit());
            }
        }

        List<MonthlyBalance> result = new ArrayList<>();
        BigDecimal running = BigDecimal.ZERO;
        for (Map.Entry<YearMonth, BigDecimal[]> month : byMonth.entrySet()) {
            BigDecimal opening = running;
            BigDecimal debit = month.getValue()[0];
            BigDecimal credit = month.getValue()[1];
            running = running.add(debit).subtract(credit);
            result.add(new MonthlyBalance(month.getKey(), prefix, opening, debit, credit, running));
        }
        return result;
    }

    public static boolean matchesAny(LedgerEntry entry, Collection<String> prefixes) {
        for (String prefix : prefixes) {
            if (entry.isOnAccount(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal sumMatching(Collection<LedgerEntry> entries, Collection<String> prefixes,
                                          Function<LedgerEntry, BigDecimal> amount) {
        BigDecimal total = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            if (matchesAny(entry, prefixes)) {
                total = total.add(amount.apply(entry));
            }
        }
        return total;
    }

    private static BigDecimal sum(Collection<LedgerEntry> entries, String prefix,
                                  Function<LedgerEntry, BigDecimal> amount) {
        BigDecimal total = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            if (prefix == null || entry.isOnAccount(prefix)) {
                total = total.add(amount.apply(entry));
            }
        }
        return total;
    }
}
