package com.optionscope.aggregate;

import com.optionscope.model.StreamAggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class StreamAggregateTable {
    private final List<StreamAggregate> rows;
    private final Map<String, StreamAggregate> byContract;

    public StreamAggregateTable(List<StreamAggregate> rows) {
        Map<String, StreamAggregate> index = new LinkedHashMap<>();
        for (StreamAggregate row : rows) {
            index.putIfAbsent(row.contractId, row);
        }
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.byContract = Collections.unmodifiableMap(index);
    }

    public StreamAggregate find(String contractId) {
        return contractId == null ? null : byContract.get(contractId);
    }

    /**
     * The contract's aggregate, or an empty one (count 0, null means) if it has none.
     */
    public StreamAggregate findOrEmpty(String contractId) {
        StreamAggregate found = find(contractId);
        return found == null ? StreamAggregate.empty(contractId) : found;
    }

    public int size() {
        return rows.size();
    }
}
