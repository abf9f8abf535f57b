package com.flagship.fec_diligence.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Open amount of one auxiliary account spread over age buckets; bucketAmounts follows
 * the order of the configured bucket bounds.
 */
@Value
public class AgedBalance {
    String auxiliaryAccountNumber;
    String auxiliaryAccountLabel;
    List<BigDecimal> bucketAmounts;
    BigDecimal total;
}
