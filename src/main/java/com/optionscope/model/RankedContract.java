package com.optionscope.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Contract with its strike and expiry position relative to the median of its peer group.
 * A rank is null when the contract lacks the grouping keys or the ranked value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RankedContract {
    public final String contractId;
    public final String underlyingId;
    public final String contractType;
    public final LocalDate expiryDate;
    public final Double strikePrice;
    public final Integer strikeRank;
    public final Integer expiryRank;
}
