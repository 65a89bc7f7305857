package com.optionscope.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-contract reduction of the stream join. {@code observationCount} counts ticks that carried
 * neither an ask nor a bid; the means skip nulls and stay null when nothing was priced.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class StreamAggregate {
    public final String contractId;
    public final int observationCount;
    public final Double meanAskSize;
    public final Double meanBidSize;
    public final Double meanAsk;
    public final Double meanBid;

    public static StreamAggregate empty(String contractId) {
        return new StreamAggregate(contractId, 0, null, null, null, null);
    }
}
