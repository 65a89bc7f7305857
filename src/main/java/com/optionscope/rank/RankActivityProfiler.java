package com.optionscope.rank;

import com.optionscope.join.JoinedStream;
import com.optionscope.model.RankedContract;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Counts matched stream ticks per strike rank and per expiry rank. Orphan ticks have no rank and
 * are ignored; unranked contracts are left out of the profile.
 */
public final class RankActivityProfiler {

    public RankActivityProfile profile(List<RankedContract> ranked, List<JoinedStream> joined) {
        Map<String, Integer> ticksPerContract = new HashMap<>();
        for (JoinedStream row : joined) {
            if (row.matched()) {
                ticksPerContract.merge(row.contractId(), 1, Integer::sum);
            }
        }
        return new RankActivityProfile(
                byRank(ranked, ticksPerContract, c -> c.strikeRank),
                byRank(ranked, ticksPerContract, c -> c.expiryRank)
        );
    }

    private static List<RankActivity> byRank(
            List<RankedContract> ranked,
            Map<String, Integer> ticksPerContract,
            Function<RankedContract, Integer> rankOf
    ) {
        Map<Integer, int[]> buckets = new TreeMap<>();
        for (RankedContract contract : ranked) {
            Integer rank = rankOf.apply(contract);
            if (rank == null) {
                continue;
            }
            int[] bucket = buckets.computeIfAbsent(rank, ignored -> new int[3]);
            int ticks = ticksPerContract.getOrDefault(contract.contractId, 0);
            bucket[0]++;
            if (ticks > 0) {
                bucket[1]++;
            }
            bucket[2] += ticks;
        }
        List<RankActivity> out = new ArrayList<>(buckets.size());
        for (Map.Entry<Integer, int[]> entry : buckets.entrySet()) {
            int[] bucket = entry.getValue();
            out.add(new RankActivity(entry.getKey(), bucket[0], bucket[1], bucket[2]));
        }
        return out;
    }
}
