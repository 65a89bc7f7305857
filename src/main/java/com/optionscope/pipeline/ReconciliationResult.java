package com.optionscope.pipeline;

import com.optionscope.aggregate.StreamAggregateTable;
import com.optionscope.core.diagnostics.PipelineDiagnostics;
import com.optionscope.join.JoinedSnapshot;
import com.optionscope.join.JoinedStream;
import com.optionscope.model.RankedContract;
import com.optionscope.moneyness.MoneynessSummary;
import com.optionscope.moneyness.MoneynessTable;
import com.optionscope.price.StockPriceRegistry;
import com.optionscope.rank.RankActivityProfile;
import com.optionscope.universe.IdentityReport;
import com.optionscope.universe.OptionUniverse;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Every table one run derives. Each is computed once from its inputs and never changed after.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ReconciliationResult {
    public final OptionUniverse universe;
    public final IdentityReport identityReport;
    public final List<JoinedStream> joinedStreams;
    public final List<JoinedSnapshot> joinedSnapshots;
    public final StockPriceRegistry stockPrices;
    public final StockPriceRegistry expiryPrices;
    public final StreamAggregateTable streamAggregates;
    public final MoneynessTable moneyness;
    public final List<MoneynessSummary> moneynessSummaries;
    public final List<RankedContract> rankedContracts;
    public final RankActivityProfile rankActivity;
    public final PipelineDiagnostics diagnostics;
}
