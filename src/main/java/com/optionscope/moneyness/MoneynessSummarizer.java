package com.optionscope.moneyness;

import com.optionscope.model.ContractType;
import com.optionscope.model.MoneynessRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Sample count, mean, median and share of in-the-money contracts, overall and per type.
 */
public final class MoneynessSummarizer {
    public static final String SCOPE_ALL = "ALL";

    public List<MoneynessSummary> summarize(MoneynessTable table) {
        List<MoneynessSummary> out = new ArrayList<>();
        out.add(summarize(SCOPE_ALL, table.records, null));
        for (ContractType type : ContractType.values()) {
            out.add(summarize(type.label(), table.records, type));
        }
        return out;
    }

    MoneynessSummary summarize(String scope, List<MoneynessRecord> records, ContractType type) {
        List<Double> values = new ArrayList<>();
        for (MoneynessRecord record : records) {
            if (type == null || record.contractType == type) {
                values.add(record.moneyness);
            }
        }
        if (values.isEmpty()) {
            return new MoneynessSummary(scope, 0, 0.0, 0.0, 0.0);
        }

        Collections.sort(values);
        double sum = 0.0;
        int profitable = 0;
        for (double value : values) {
            sum += value;
            if (value > 0.0) {
                profitable++;
            }
        }
        double avg = sum / values.size();
        double median;
        if (values.size() % 2 == 0) {
            int right = values.size() / 2;
            median = (values.get(right - 1) + values.get(right)) / 2.0;
        } else {
            median = values.get(values.size() / 2);
        }
        double rate = profitable * 100.0 / values.size();
        return new MoneynessSummary(scope, values.size(), round2(avg), round2(median), round2(rate));
    }

    public String toSummaryText(MoneynessSummary summary) {
        return String.format(
                Locale.US,
                "MONEYNESS[%s] samples=%d avg=%.2f median=%.2f profitable=%.2f%%",
                summary.scope,
                summary.sampleCount,
                summary.avgMoneyness,
                summary.medianMoneyness,
                summary.profitableRatePct
        );
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
