package com.flagship.fec_diligence.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Cycle-time metrics in days over a 365-day year; a zero turnover gives zero days.
 */
@Value
@Builder
public class WorkingCapitalMetrics {
    LocalDate date;
    BigDecimal clientsBalance;
    BigDecimal chiffreAffairesTtc;
    BigDecimal dso;
    BigDecimal fournisseursBalance;
    BigDecimal achatsTtc;
    BigDecimal dpo;
    BigDecimal stocksBalance;
    BigDecimal coutDesVentes;
    BigDecimal dio;
    BigDecimal ccc;
}
