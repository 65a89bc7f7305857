package com.optionscope.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MoneynessRecord {
    public final String contractId;
    public final ContractType contractType;
    public final double strikePrice;
    public final String underlyingId;
    public final LocalDate expiryDate;
    public final Double closeOnExpiry;
    public final Double volumeOnExpiry;
    public final StreamAggregate streamAggregate;
    public final double moneyness;
}
