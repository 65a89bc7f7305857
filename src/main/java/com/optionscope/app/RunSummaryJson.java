package com.optionscope.app;

import com.optionscope.core.diagnostics.PipelineDiagnostics;
import com.optionscope.moneyness.MoneynessSummary;
import com.optionscope.pipeline.ReconciliationResult;
import com.optionscope.rank.RankActivity;
import com.optionscope.universe.IdentityViolation;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * JSON digest of one run for downstream reporting: counts, coverages, identity violations,
 * moneyness summary and activity by rank. Row-level tables are not included.
 */
public final class RunSummaryJson {

    public JSONObject build(ReconciliationResult result) {
        PipelineDiagnostics diagnostics = result.diagnostics;
        JSONObject root = new JSONObject();
        root.put("data_dir", diagnostics.runLabel);

        JSONObject config = new JSONObject();
        for (PipelineDiagnostics.ConfigItem item : diagnostics.configSnapshot.values()) {
            config.put(item.key, new JSONObject().put("value", item.value).put("source", item.source));
        }
        root.put("config", config);

        JSONObject categories = new JSONObject();
        for (Map.Entry<String, Integer> entry : diagnostics.categoryRows.entrySet()) {
            JSONObject category = new JSONObject();
            category.put("rows", entry.getValue());
            category.put("files", diagnostics.categoryFiles.getOrDefault(entry.getKey(), 0));
            categories.put(entry.getKey(), category);
        }
        root.put("categories", categories);
        root.put("counters", new JSONObject(diagnostics.counters));

        JSONObject coverages = new JSONObject();
        for (PipelineDiagnostics.CoverageMetric metric : diagnostics.coverages.values()) {
            JSONObject item = new JSONObject();
            item.put("numerator", metric.numerator);
            item.put("denominator", metric.denominator);
            item.put("pct", round2(metric.pct));
            coverages.put(metric.key, item);
        }
        root.put("coverages", coverages);

        JSONArray violations = new JSONArray();
        for (IdentityViolation violation : result.identityReport.violations) {
            JSONObject item = new JSONObject();
            item.put("contract_id", violation.contractId());
            item.put("descriptions", new JSONArray(violation.descriptions()));
            item.put("source_files", new JSONArray(violation.sourceFiles()));
            violations.put(item);
        }
        root.put("identity_violations", violations);

        JSONArray moneyness = new JSONArray();
        for (MoneynessSummary summary : result.moneynessSummaries) {
            JSONObject item = new JSONObject();
            item.put("scope", summary.scope);
            item.put("samples", summary.sampleCount);
            item.put("avg", summary.avgMoneyness);
            item.put("median", summary.medianMoneyness);
            item.put("profitable_pct", summary.profitableRatePct);
            moneyness.put(item);
        }
        root.put("moneyness", moneyness);

        JSONObject activity = new JSONObject();
        activity.put("strike_rank", toJson(result.rankActivity.byStrikeRank));
        activity.put("expiry_rank", toJson(result.rankActivity.byExpiryRank));
        root.put("activity_by_rank", activity);
        root.put("step_ms", new JSONObject(diagnostics.stepMillis));
        root.put("notes", new JSONArray(diagnostics.notes));
        return root;
    }

    private static JSONArray toJson(List<RankActivity> rows) {
        JSONArray out = new JSONArray();
        for (RankActivity row : rows) {
            JSONObject item = new JSONObject();
            item.put("rank", row.rank);
            item.put("contracts", row.contractCount);
            item.put("streamed_contracts", row.streamedContractCount);
            item.put("observations", row.observationCount);
            item.put("streamed_pct", round2(row.streamedPct()));
            out.put(item);
        }
        return out;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
