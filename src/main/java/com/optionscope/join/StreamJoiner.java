package com.optionscope.join;

import com.optionscope.loader.DatasetCategory.Columns;
import com.optionscope.loader.RawRow;
import com.optionscope.loader.RawTable;
import com.optionscope.model.StreamObservation;
import com.optionscope.universe.OptionUniverse;
import com.optionscope.utils.Values;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Left-joins stream ticks onto the universe by contract id. Orphan ticks are kept.
 */
public final class StreamJoiner {
    private static final Logger LOG = LogManager.getLogger(StreamJoiner.class);

    public List<JoinedStream> join(RawTable stream, OptionUniverse universe) {
        List<JoinedStream> out = new ArrayList<>(stream.size());
        int orphans = 0;
        for (RawRow row : stream.rows()) {
            StreamObservation observation = toObservation(row);
            JoinedStream joined = new JoinedStream(observation, universe.find(observation.contractId));
            if (!joined.matched()) {
                orphans++;
            }
            out.add(joined);
        }
        LOG.info("Stream join: rows={} matched={} orphans={}", out.size(), out.size() - orphans, orphans);
        return out;
    }

    static StreamObservation toObservation(RawRow row) {
        return new StreamObservation(
                Values.text(row.get(Columns.CONTRACT_ID)),
                Values.parseDateTime(row.get(Columns.OBSERVED_AT)),
                Values.parseDouble(row.get(Columns.ASK)),
                Values.parseDouble(row.get(Columns.ASK_SIZE)),
                Values.parseDouble(row.get(Columns.BID)),
                Values.parseDouble(row.get(Columns.BID_SIZE)),
                Values.parseDouble(row.get(Columns.MID)),
                row.sourceFile
        );
    }
}
