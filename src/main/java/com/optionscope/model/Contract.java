package com.optionscope.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Canonical option contract. {@code contractType} keeps the extract's label as-is; use
 * {@link #type()} for the parsed kind.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Contract {
    public final String id;
    public final String description;
    public final String exerciseStyle;
    public final String exchangeId;
    public final LocalDate expiryDate;
    public final String contractType;
    public final Double strikePrice;
    public final String underlyingId;
    public final String sourceFile;

    public ContractType type() {
        return ContractType.fromLabel(contractType);
    }
}
