package com.optionscope.join;

import com.optionscope.model.Contract;
import com.optionscope.model.SnapshotObservation;

public final class JoinedSnapshot {
    public final SnapshotObservation observation;
    public final Contract contract;

    public JoinedSnapshot(SnapshotObservation observation, Contract contract) {
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
