package com.optionscope.moneyness;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MoneynessSummary {
    public final String scope;
    public final int sampleCount;
    public final double avgMoneyness;
    public final double medianMoneyness;
    public final double profitableRatePct;
}
