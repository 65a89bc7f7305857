package com.optionscope.join;

import com.optionscope.loader.DatasetCategory.Columns;
import com.optionscope.loader.RawRow;
import com.optionscope.loader.RawTable;
import com.optionscope.model.SnapshotObservation;
import com.optionscope.universe.OptionUniverse;
import com.optionscope.utils.Values;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

public final class SnapshotJoiner {
    private static final Logger LOG = LogManager.getLogger(SnapshotJoiner.class);

    public List<JoinedSnapshot> join(RawTable snapshots, OptionUniverse universe) {
        List<JoinedSnapshot> out = new ArrayList<>(snapshots.size());
        int orphans = 0;
        for (RawRow row : snapshots.rows()) {
            SnapshotObservation observation = new SnapshotObservation(
                    Values.text(row.get(Columns.CONTRACT_ID)),
                    Values.parseDouble(row.get(Columns.MID_PRICE)),
                    Values.text(row.get(Columns.ASSET_TYPE)),
                    row.sourceFile
            );
            JoinedSnapshot joined = new JoinedSnapshot(observation, universe.find(observation.contractId));
            if (!joined.matched()) {
                orphans++;
            }
            out.add(joined);
        }
        LOG.info("Snapshot join: rows={} matched={} orphans={}", out.size(), out.size() - orphans, orphans);
        return out;
    }
}
