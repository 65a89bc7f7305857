package com.optionscope.pipeline;

import com.optionscope.aggregate.StreamAggregateTable;
import com.optionscope.aggregate.StreamAggregator;
import com.optionscope.core.diagnostics.PipelineDiagnostics;
import com.optionscope.join.JoinedSnapshot;
import com.optionscope.join.JoinedStream;
import com.optionscope.join.SnapshotJoiner;
import com.optionscope.join.StreamJoiner;
import com.optionscope.loader.DatasetCategory;
import com.optionscope.loader.DelimitedFileReader;
import com.optionscope.loader.FileSetLoader;
import com.optionscope.loader.LoadedDataSet;
import com.optionscope.loader.RawTable;
import com.optionscope.model.RankedContract;
import com.optionscope.moneyness.MoneynessEngine;
import com.optionscope.moneyness.MoneynessSummarizer;
import com.optionscope.moneyness.MoneynessSummary;
import com.optionscope.moneyness.MoneynessTable;
import com.optionscope.price.StockPriceRegistry;
import com.optionscope.rank.RankActivityProfile;
import com.optionscope.rank.RankActivityProfiler;
import com.optionscope.rank.RankNormalizer;
import com.optionscope.universe.ContractIdentityIndex;
import com.optionscope.universe.IdentityReport;
import com.optionscope.universe.IdentityViolationException;
import com.optionscope.universe.OptionUniverse;
import com.optionscope.universe.OptionUniverseBuilder;
import com.optionscope.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Composes the reconciliation stages. Each stage takes the tables it needs and returns new ones;
 * there is no shared state between runs.
 */
public final class ReconciliationPipeline {
    private static final Logger LOG = LogManager.getLogger(ReconciliationPipeline.class);

    public static final String STEP_LOAD = "LOAD";
    public static final String STEP_UNIVERSE = "UNIVERSE";
    public static final String STEP_IDENTITY = "IDENTITY";
    public static final String STEP_JOIN = "JOIN";
    public static final String STEP_PRICES = "PRICES";
    public static final String STEP_AGGREGATE = "AGGREGATE";
    public static final String STEP_MONEYNESS = "MONEYNESS";
    public static final String STEP_RANK = "RANK";

    private final PipelineSettings settings;
    private final List<PipelineDiagnostics.ConfigItem> configSnapshot;
    private final OptionUniverseBuilder universeBuilder = new OptionUniverseBuilder();
    private final ContractIdentityIndex identityIndex = new ContractIdentityIndex();
    private final StreamJoiner streamJoiner = new StreamJoiner();
    private final SnapshotJoiner snapshotJoiner = new SnapshotJoiner();
    private final StreamAggregator aggregator = new StreamAggregator();
    private final MoneynessEngine moneynessEngine = new MoneynessEngine();
    private final MoneynessSummarizer summarizer = new MoneynessSummarizer();
    private final RankNormalizer rankNormalizer;
    private final RankActivityProfiler activityProfiler = new RankActivityProfiler();

    public ReconciliationPipeline(PipelineSettings settings) {
        this(settings, List.of());
    }

    /**
     * @param configSnapshot effective configuration recorded into the run's diagnostics
     */
    public ReconciliationPipeline(PipelineSettings settings, List<PipelineDiagnostics.ConfigItem> configSnapshot) {
        this.settings = settings;
        this.configSnapshot = configSnapshot == null ? List.of() : List.copyOf(configSnapshot);
        this.rankNormalizer = new RankNormalizer(settings.tieBreak);
    }

    public ReconciliationResult runFromDirectory() {
        StepTimer timer = new StepTimer();
        timer.start(STEP_LOAD);
        FileSetLoader loader = new FileSetLoader(new DelimitedFileReader(settings.delimiter), settings.loaderThreads);
        LoadedDataSet data = loader.load(settings.dataDir, settings.patterns);
        timer.end(STEP_LOAD);
        return run(data, timer);
    }

    public ReconciliationResult run(LoadedDataSet data) {
        return run(data, new StepTimer());
    }

    private ReconciliationResult run(LoadedDataSet data, StepTimer timer) {
        PipelineDiagnostics diagnostics = new PipelineDiagnostics(settings.dataDir == null ? "" : settings.dataDir.toString());
        for (PipelineDiagnostics.ConfigItem item : configSnapshot) {
            diagnostics.addConfig(item);
        }
        for (DatasetCategory category : DatasetCategory.values()) {
            RawTable table = data.table(category);
            diagnostics.addCategory(category.key(), table.size(), table.sourceFiles().size());
        }

        timer.start(STEP_UNIVERSE);
        RawTable optionSpace = data.table(DatasetCategory.OPTION_SPACE);
        OptionUniverse universe = universeBuilder.build(optionSpace);
        timer.end(STEP_UNIVERSE);

        timer.start(STEP_IDENTITY);
        IdentityReport identity = identityIndex.check(List.of(optionSpace, data.table(DatasetCategory.STOCK_OPTION)));
        timer.end(STEP_IDENTITY);
        if (!identity.isClean() && settings.failOnIdentityViolation) {
            throw new IdentityViolationException(identity);
        }

        timer.start(STEP_JOIN);
        List<JoinedStream> streams = streamJoiner.join(data.table(DatasetCategory.STREAM), universe);
        List<JoinedSnapshot> snapshots = snapshotJoiner.join(data.table(DatasetCategory.SNAPSHOT), universe);
        timer.end(STEP_JOIN);

        timer.start(STEP_PRICES);
        StockPriceRegistry expiryPrices = StockPriceRegistry.build(data.table(DatasetCategory.MONEYNESS_PRICE));
        StockPriceRegistry stockPrices = StockPriceRegistry.build(data.table(DatasetCategory.STOCK_PRICE));
        timer.end(STEP_PRICES);

        timer.start(STEP_AGGREGATE);
        StreamAggregateTable aggregates = aggregator.aggregateAndBackfill(streams, universe);
        timer.end(STEP_AGGREGATE);

        timer.start(STEP_MONEYNESS);
        MoneynessTable moneyness = moneynessEngine.compute(universe, expiryPrices, aggregates);
        List<MoneynessSummary> summaries = summarizer.summarize(moneyness);
        timer.end(STEP_MONEYNESS);

        timer.start(STEP_RANK);
        List<RankedContract> ranked = rankNormalizer.normalize(universe);
        RankActivityProfile activity = activityProfiler.profile(ranked, streams);
        timer.end(STEP_RANK);

        int streamMatched = countMatchedStreams(streams);
        int snapshotMatched = countMatchedSnapshots(snapshots);
        diagnostics.addCounter("universe.contracts", universe.size());
        diagnostics.addCounter("universe.skipped_without_id", universe.skippedRows());
        diagnostics.addCounter("identity.checked_ids", identity.checkedIds);
        diagnostics.addCounter("identity.violations", identity.violationCount());
        diagnostics.addCounter("stream.orphans", streams.size() - streamMatched);
        diagnostics.addCounter("snapshot.orphans", snapshots.size() - snapshotMatched);
        diagnostics.addCounter("prices.expiry.duplicates", expiryPrices.duplicateRows());
        diagnostics.addCounter("prices.expiry.dropped", expiryPrices.droppedRows());
        diagnostics.addCounter("prices.stock.duplicates", stockPrices.duplicateRows());
        diagnostics.addCounter("prices.stock.dropped", stockPrices.droppedRows());
        diagnostics.addCounter("moneyness.no_price_on_expiry", moneyness.missingPrice);
        diagnostics.addCounter("moneyness.unknown_type", moneyness.unknownType);
        diagnostics.addCounter("moneyness.no_strike", moneyness.missingStrike);
        diagnostics.addCoverage("stream.join", streamMatched, streams.size());
        diagnostics.addCoverage("snapshot.join", snapshotMatched, snapshots.size());
        diagnostics.addCoverage("moneyness", moneyness.size(), universe.size());
        if (optionSpace.isEmpty()) {
            diagnostics.addNote("no option_space rows; every stream and snapshot row is an orphan");
        }
        if (!identity.isClean()) {
            diagnostics.addNote(identity.violationCount() + " contract id(s) carry more than one description");
        }
        diagnostics.addStepTimes(timer.snapshot());

        LOG.info("Reconciliation done: contracts={} moneyness={} ranked={} aggregates={}",
                universe.size(), moneyness.size(), ranked.size(), aggregates.size());
        LOG.debug(timer.summaryText());

        return ReconciliationResult.builder()
                .universe(universe)
                .identityReport(identity)
                .joinedStreams(List.copyOf(streams))
                .joinedSnapshots(List.copyOf(snapshots))
                .stockPrices(stockPrices)
                .expiryPrices(expiryPrices)
                .streamAggregates(aggregates)
                .moneyness(moneyness)
                .moneynessSummaries(List.copyOf(summaries))
                .rankedContracts(List.copyOf(ranked))
                .rankActivity(activity)
                .diagnostics(diagnostics)
                .build();
    }

    private static int countMatchedStreams(List<JoinedStream> rows) {
        int matched = 0;
        for (JoinedStream row : rows) {
            if (row.matched()) {
                matched++;
            }
        }
        return matched;
    }

    private static int countMatchedSnapshots(List<JoinedSnapshot> rows) {
        int matched = 0;
        for (JoinedSnapshot row : rows) {
            if (row.matched()) {
                matched++;
            }
        }
        return matched;
    }
}
