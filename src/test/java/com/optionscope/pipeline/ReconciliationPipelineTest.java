package com.optionscope.pipeline;

import com.optionscope.config.Config;
import com.optionscope.core.diagnostics.PipelineDiagnostics;
import com.optionscope.loader.DatasetCategory;
import com.optionscope.loader.LoadedDataSet;
import com.optionscope.model.MoneynessRecord;
import com.optionscope.model.RankedContract;
import com.optionscope.testing.Fixtures;
import com.optionscope.testing.SampleDataSet;
import com.optionscope.universe.IdentityViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationPipelineTest {

    @TempDir
    Path dir;

    @Test
    void runFromDirectory_shouldReconcileEveryCategory() throws Exception {
        SampleDataSet.write(dir);

        ReconciliationResult result = new ReconciliationPipeline(settings(Map.of())).runFromDirectory();

        assertEquals(5, result.universe.size());
        assertTrue(result.identityReport.isClean());
        assertEquals(4, result.joinedStreams.size());
        assertEquals(1, result.diagnostics.counter("stream.orphans"));
        assertEquals(1, result.diagnostics.counter("snapshot.orphans"));
        assertEquals(6, result.diagnostics.categoryRows.get("option_space"));
        assertEquals(2, result.diagnostics.categoryFiles.get("option_space"));

        assertEquals(6, result.streamAggregates.size());
        assertEquals(1, result.streamAggregates.find("C150").observationCount);
        assertEquals(0, result.streamAggregates.find("GHOST").observationCount);
        assertEquals(0, result.streamAggregates.find("P140").observationCount);

        assertEquals(4, result.moneyness.size());
        assertEquals(1, result.moneyness.missingPrice);
        Map<String, MoneynessRecord> moneyness = new HashMap<>();
        for (MoneynessRecord record : result.moneyness.records) {
            moneyness.put(record.contractId, record);
        }
        assertEquals(10.0, moneyness.get("C140").moneyness, 1e-9);
        assertEquals(0.0, moneyness.get("C150").moneyness, 1e-9);
        assertEquals(-10.0, moneyness.get("C160").moneyness, 1e-9);
        assertEquals(-10.0, moneyness.get("P140").moneyness, 1e-9);
        assertEquals(1, result.moneyness.records.get(0).streamAggregate.observationCount);

        Map<String, RankedContract> ranked = new HashMap<>();
        for (RankedContract contract : result.rankedContracts) {
            ranked.put(contract.contractId, contract);
        }
        assertEquals(-1, ranked.get("C140").strikeRank);
        assertEquals(1, ranked.get("C160").strikeRank);
        assertEquals(0, ranked.get("N1").strikeRank);

        assertEquals(1, result.expiryPrices.size());
        assertEquals(1, result.expiryPrices.duplicateRows());
        assertEquals(2, result.stockPrices.size());
        assertEquals(4, result.moneynessSummaries.get(0).sampleCount);
        assertFalse(result.diagnostics.stepMillis.isEmpty());
    }

    @Test
    void run_shouldFailOnUnstableDescriptionInStrictMode() throws Exception {
        SampleDataSet.write(dir);
        Fixtures.write(dir, "stock_option_2.csv",
                "id,description",
                "C150,AAPL 150 CALL WEEKLY");

        ReconciliationResult lenient = new ReconciliationPipeline(settings(Map.of())).runFromDirectory();
        assertEquals(1, lenient.identityReport.violationCount());
        assertEquals(1, lenient.diagnostics.notes.size());

        ReconciliationPipeline strict = new ReconciliationPipeline(
                settings(Map.of("identity.fail_on_violation", "true")));
        IdentityViolationException error = assertThrows(IdentityViolationException.class, strict::runFromDirectory);
        assertEquals("C150", error.report().violations.get(0).contractId());
    }

    @Test
    void run_shouldHandleEmptyDataSet() {
        ReconciliationResult result = new ReconciliationPipeline(settings(Map.of())).run(new LoadedDataSet(Map.of()));

        assertEquals(0, result.universe.size());
        assertEquals(0, result.moneyness.size());
        assertTrue(result.rankedContracts.isEmpty());
        assertEquals(0, result.diagnostics.categoryRows.get(DatasetCategory.STREAM.key()));
        assertEquals(0.0, result.diagnostics.coverages.get("moneyness").pct, 1e-9);
        assertEquals(1, result.diagnostics.notes.size());
    }

    @Test
    void run_shouldRecordConfigSnapshotIntoReadOnlyDiagnostics() {
        ReconciliationPipeline pipeline = new ReconciliationPipeline(settings(Map.of()), List.of(
                new PipelineDiagnostics.ConfigItem("rank.tie_break", "FIRST", "override")));

        PipelineDiagnostics diagnostics = pipeline.run(new LoadedDataSet(Map.of())).diagnostics;

        assertEquals("FIRST", diagnostics.configSnapshot.get("rank.tie_break").value);
        assertEquals("override", diagnostics.configSnapshot.get("rank.tie_break").source);
        assertThrows(UnsupportedOperationException.class, () -> diagnostics.counters.put("stream.orphans", 0));
        assertThrows(UnsupportedOperationException.class, () -> diagnostics.notes.add("late"));
    }

    private PipelineSettings settings(Map<String, String> extra) {
        Map<String, String> values = new HashMap<>(extra);
        values.put("data.dir", dir.toString());
        return PipelineSettings.fromConfig(Config.fromMap(dir, values));
    }
}
