package com.optionscope.moneyness;

import com.optionscope.model.MoneynessRecord;

import java.util.List;

/**
 * Moneyness records plus the number of universe contracts excluded at each step.
 */
public final class MoneynessTable {
    public final List<MoneynessRecord> records;
    public final int missingPrice;
    public final int missingStrike;
    public final int unknownType;

    public MoneynessTable(List<MoneynessRecord> records, int missingPrice, int missingStrike, int unknownType) {
        this.records = records == null ? List.of() : List.copyOf(records);
        this.missingPrice = missingPrice;
        this.missingStrike = missingStrike;
        this.unknownType = unknownType;
    }

    public int size() {
        return records.size();
    }

    public int excluded() {
        return missingPrice + missingStrike + unknownType;
    }
}
