package com.flagship.fec_diligence.balance;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class FixedAssetDetail {
    String accountNumber;
    String accountLabel;
    BigDecimal gross;
    BigDecimal amortization;
    BigDecimal net;
}
