package com.optionscope.universe;

import com.optionscope.loader.DatasetCategory.Columns;
import com.optionscope.loader.RawRow;
import com.optionscope.loader.RawTable;
import com.optionscope.model.Contract;
import com.optionscope.utils.Values;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the canonical universe from option-space rows. Expiry cells are normalized to calendar
 * dates and the first sighting of each id wins; later sightings are dropped.
 */
public final class OptionUniverseBuilder {
    private static final Logger LOG = LogManager.getLogger(OptionUniverseBuilder.class);

    public OptionUniverse build(RawTable optionSpace) {
        List<Contract> parsed = new ArrayList<>(optionSpace.size());
        int skipped = 0;
        for (RawRow row : optionSpace.rows()) {
            Contract contract = toContract(row);
            if (contract == null) {
                skipped++;
                continue;
            }
            parsed.add(contract);
        }
        List<Contract> unique = dedupe(parsed);
        LOG.info("Option universe: raw={} unique={} duplicates={} skipped_without_id={}",
                optionSpace.size(), unique.size(), parsed.size() - unique.size(), skipped);
        return new OptionUniverse(unique, skipped);
    }

    /**
     * First occurrence per id, order preserved. Applying it to its own output changes nothing.
     */
    public static List<Contract> dedupe(List<Contract> contracts) {
        Set<String> seen = new HashSet<>();
        List<Contract> out = new ArrayList<>(contracts.size());
        for (Contract contract : contracts) {
            if (seen.add(contract.id)) {
                out.add(contract);
            }
        }
        return out;
    }

    static Contract toContract(RawRow row) {
        String id = Values.text(row.get(Columns.ID));
        if (id == null) {
            return null;
        }
        return Contract.builder()
                .id(id)
                .description(Values.text(row.get(Columns.DESCRIPTION)))
                .exerciseStyle(Values.text(row.get(Columns.EXERCISE_STYLE)))
                .exchangeId(Values.text(row.get(Columns.EXCHANGE_ID)))
                .expiryDate(Values.parseDate(row.get(Columns.EXPIRY)))
                .contractType(Values.text(row.get(Columns.CONTRACT_TYPE)))
                .strikePrice(Values.parseDouble(row.get(Columns.STRIKE_PRICE)))
                .underlyingId(Values.text(row.get(Columns.UNDERLYING_ID)))
                .sourceFile(row.sourceFile)
                .build();
    }
}
