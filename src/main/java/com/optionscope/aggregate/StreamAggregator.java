package com.optionscope.aggregate;

import com.optionscope.join.JoinedStream;
import com.optionscope.model.Contract;
import com.optionscope.model.StreamAggregate;
import com.optionscope.model.StreamObservation;
import com.optionscope.universe.OptionUniverse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces joined stream ticks to one {@link StreamAggregate} per contract id.
 * <p>
 * The count is of ticks with neither ask nor bid, i.e. keep-alive updates rather than priced
 * quotes. Means skip null cells; a mean over no values is null.
 */
public final class StreamAggregator {
    private static final Logger LOG = LogManager.getLogger(StreamAggregator.class);

    /**
     * One row per contract id present in the join, orphans included, in first-seen order.
     */
    public List<StreamAggregate> aggregate(List<JoinedStream> joined) {
        Map<String, Accumulator> groups = new LinkedHashMap<>();
        for (JoinedStream row : joined) {
            String contractId = row.contractId();
            if (contractId == null) {
                continue;
            }
            groups.computeIfAbsent(contractId, Accumulator::new).add(row.observation);
        }
        List<StreamAggregate> out = new ArrayList<>(groups.size());
        for (Accumulator accumulator : groups.values()) {
            out.add(accumulator.toAggregate());
        }
        return out;
    }

    /**
     * Appends an empty aggregate for every universe contract without one.
     */
    public StreamAggregateTable backfill(List<StreamAggregate> aggregates, OptionUniverse universe) {
        List<StreamAggregate> rows = new ArrayList<>(aggregates);
        StreamAggregateTable existing = new StreamAggregateTable(aggregates);
        int added = 0;
        for (Contract contract : universe.contracts()) {
            if (existing.find(contract.id) == null) {
                rows.add(StreamAggregate.empty(contract.id));
                added++;
            }
        }
        LOG.info("Stream aggregates: observed_contracts={} backfilled={}", aggregates.size(), added);
        return new StreamAggregateTable(rows);
    }

    public StreamAggregateTable aggregateAndBackfill(List<JoinedStream> joined, OptionUniverse universe) {
        return backfill(aggregate(joined), universe);
    }

    private static final class Accumulator {
        private final String contractId;
        private int unpricedCount;
        private final Mean ask = new Mean();
        private final Mean bid = new Mean();
        private final Mean askSize = new Mean();
        private final Mean bidSize = new Mean();

        private Accumulator(String contractId) {
            this.contractId = contractId;
        }

        private void add(StreamObservation observation) {
            if (observation.isUnpriced()) {
                unpricedCount++;
            }
            ask.add(observation.ask);
            bid.add(observation.bid);
            askSize.add(observation.askSize);
            bidSize.add(observation.bidSize);
        }

        private StreamAggregate toAggregate() {
            return StreamAggregate.builder()
                    .contractId(contractId)
                    .observationCount(unpricedCount)
                    .meanAsk(ask.value())
                    .meanBid(bid.value())
                    .meanAskSize(askSize.value())
                    .meanBidSize(bidSize.value())
                    .build();
        }
    }

    private static final class Mean {
        private double sum;
        private int count;

        private void add(Double value) {
            if (value == null) {
                return;
            }
            sum += value;
            count++;
        }

        private Double value() {
            return count == 0 ? null : sum / count;
        }
    }
}
