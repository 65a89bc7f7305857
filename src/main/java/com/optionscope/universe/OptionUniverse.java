package com.optionscope.universe;

import com.optionscope.model.Contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The canonical contract set: one contract per id, in first-seen order.
 */
public final class OptionUniverse {
    private final List<Contract> contracts;
    private final Map<String, Contract> byId;
    private final int skippedRows;

    OptionUniverse(List<Contract> contracts, int skippedRows) {
        Map<String, Contract> index = new LinkedHashMap<>();
        for (Contract contract : contracts) {
            if (index.putIfAbsent(contract.id, contract) != null) {
                throw new IllegalArgumentException("duplicate contract id " + contract.id);
            }
        }
        this.contracts = Collections.unmodifiableList(new ArrayList<>(contracts));
        this.byId = Collections.unmodifiableMap(index);
        this.skippedRows = skippedRows;
    }

    public List<Contract> contracts() {
        return contracts;
    }

    public Contract find(String id) {
        return id == null ? null : byId.get(id);
    }

    public int size() {
        return contracts.size();
    }

    /**
     * Raw rows dropped because they carried no contract id.
     */
    public int skippedRows() {
        return skippedRows;
    }
}
