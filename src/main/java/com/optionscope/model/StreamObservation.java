package com.optionscope.model;

import java.time.LocalDateTime;

/**
 * One streamed quote tick. Price and size fields are null when the tick did not carry them.
 */
public final class StreamObservation {
    public final String contractId;
    public final LocalDateTime observedAt;
    public final Double ask;
    public final Double askSize;
    public final Double bid;
    public final Double bidSize;
    public final Double mid;
    public final String sourceFile;

    public StreamObservation(
            String contractId,
            LocalDateTime observedAt,
            Double ask,
            Double askSize,
            Double bid,
            Double bidSize,
            Double mid,
            String sourceFile
    ) {
        this.contractId = contractId;
        this.observedAt = observedAt;
        this.ask = ask;
        this.askSize = askSize;
        this.bid = bid;
        this.bidSize = bidSize;
        this.mid = mid;
        this.sourceFile = sourceFile;
    }

    public boolean isUnpriced() {
        return ask == null && bid == null;
    }
}
