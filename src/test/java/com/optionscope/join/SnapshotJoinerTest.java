package com.optionscope.join;

import com.optionscope.loader.DatasetCategory;
import com.optionscope.testing.Fixtures;
import com.optionscope.universe.OptionUniverse;
import com.optionscope.universe.OptionUniverseBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotJoinerTest {

    @Test
    void join_shouldKeepRepeatedSnapshotsAndOrphans() {
        OptionUniverse universe = new OptionUniverseBuilder().build(Fixtures.optionSpace(
                "O1,AAPL 150 C,,,2024-01-19,Call,150,S1"));

        List<JoinedSnapshot> joined = new SnapshotJoiner().join(Fixtures.table(DatasetCategory.SNAPSHOT,
                "snapshot_1.csv",
                "contract_id,mid_price,asset_type",
                "O1,1.05,OPTION",
                "O1,1.10,OPTION",
                "O7,0.20,OPTION",
                "O1,,"), universe);

        assertEquals(4, joined.size());
        assertTrue(joined.get(0).matched());
        assertTrue(joined.get(1).matched());
        assertFalse(joined.get(2).matched());
        assertEquals("O7", joined.get(2).contractId());
        assertEquals(1.10, joined.get(1).observation.midPrice, 1e-9);
        assertEquals("OPTION", joined.get(0).observation.assetType);
        assertNull(joined.get(3).observation.midPrice);
        assertEquals("snapshot_1.csv", joined.get(3).observation.sourceFile);
    }
}
