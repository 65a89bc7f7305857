package com.optionscope.rank;

/**
 * Stream activity of the contracts sharing one rank value.
 */
public final class RankActivity {
    public final int rank;
    public final int contractCount;
    public final int streamedContractCount;
    public final int observationCount;

    public RankActivity(int rank, int contractCount, int streamedContractCount, int observationCount) {
        this.rank = rank;
        this.contractCount = contractCount;
        this.streamedContractCount = streamedContractCount;
        this.observationCount = observationCount;
    }

    public double streamedPct() {
        return contractCount <= 0 ? 0.0 : streamedContractCount * 100.0 / contractCount;
    }
}
