package com.optionscope.join;

import com.optionscope.model.Contract;
import com.optionscope.model.StreamObservation;

/**
 * A stream tick with its canonical contract, or with {@code contract == null} when the tick
 * references an id the universe does not know.
 */
public final class JoinedStream {
    public final StreamObservation observation;
    public final Contract contract;

    public JoinedStream(StreamObservation observation, Contract contract) {
        this.observation = observation;
        this.contract = contract;
    }

    public boolean matched() {
        return contract != null;
    }

    public String contractId() {
        return observation.contractId;
    }
}
