package com.optionscope.rank;

import com.optionscope.model.Contract;
import com.optionscope.model.ContractType;
import com.optionscope.model.RankedContract;
import com.optionscope.universe.OptionUniverse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Group-relative ranks of the universe.
 * <p>
 * Strike rank: within (underlying, type, expiry), rank of the strike ascending minus the floor
 * of the group's median rank. Expiry rank: the same over expiry dates within (underlying, type).
 * So the median element of a group sits at 0, cheaper strikes and nearer expiries below it.
 */
public final class RankNormalizer {
    private static final Logger LOG = LogManager.getLogger(RankNormalizer.class);

    private final TieBreak tieBreak;

    public RankNormalizer(TieBreak tieBreak) {
        this.tieBreak = tieBreak == null ? TieBreak.DENSE : tieBreak;
    }

    public List<RankedContract> normalize(OptionUniverse universe) {
        List<Contract> contracts = universe.contracts();
        Integer[] strikeRanks = centeredRanks(
                contracts,
                c -> Arrays.asList(c.underlyingId, typeKey(c), c.expiryDate),
                c -> c.strikePrice,
                tieBreak
        );
        Integer[] expiryRanks = centeredRanks(
                contracts,
                c -> Arrays.asList(c.underlyingId, typeKey(c)),
                c -> c.expiryDate,
                tieBreak
        );

        List<RankedContract> out = new ArrayList<>(contracts.size());
        int unranked = 0;
        for (int i = 0; i < contracts.size(); i++) {
            Contract contract = contracts.get(i);
            if (strikeRanks[i] == null || expiryRanks[i] == null) {
                unranked++;
            }
            out.add(RankedContract.builder()
                    .contractId(contract.id)
                    .underlyingId(contract.underlyingId)
                    .contractType(contract.contractType)
                    .expiryDate(contract.expiryDate)
                    .strikePrice(contract.strikePrice)
                    .strikeRank(strikeRanks[i])
                    .expiryRank(expiryRanks[i])
                    .build());
        }
        LOG.info("Rank normalize: contracts={} partially_unranked={} tie_break={}", out.size(), unranked, tieBreak);
        return out;
    }

    /**
     * Median-centered ascending rank of {@code value} within groups of {@code groupKey}, aligned
     * with {@code items}. Items with a null key component or null value get a null rank.
     */
    static <T, V extends Comparable<? super V>> Integer[] centeredRanks(
            List<T> items,
            Function<T, List<Object>> groupKey,
            Function<T, V> value,
            TieBreak tieBreak
    ) {
        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            List<Object> key = groupKey.apply(item);
            if (hasNull(key) || value.apply(item) == null) {
                continue;
            }
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(i);
        }

        Integer[] out = new Integer[items.size()];
        for (List<Integer> members : groups.values()) {
            // List.sort is stable, so ties keep their order of appearance
            members.sort((a, b) -> value.apply(items.get(a)).compareTo(value.apply(items.get(b))));
            int[] ranks = new int[members.size()];
            for (int pos = 0; pos < members.size(); pos++) {
                if (tieBreak == TieBreak.FIRST || pos == 0) {
                    ranks[pos] = pos + 1;
                    continue;
                }
                V current = value.apply(items.get(members.get(pos)));
                V previous = value.apply(items.get(members.get(pos - 1)));
                ranks[pos] = current.compareTo(previous) == 0 ? ranks[pos - 1] : ranks[pos - 1] + 1;
            }
            int center = (int) Math.floor(median(ranks));
            for (int pos = 0; pos < members.size(); pos++) {
                out[members.get(pos)] = ranks[pos] - center;
            }
        }
        return out;
    }

    /**
     * Call/Put group together whatever their spelling; any other label groups by its raw text.
     */
    static String typeKey(Contract contract) {
        ContractType type = contract.type();
        return type != null ? type.label() : contract.contractType;
    }

    private static boolean hasNull(List<Object> key) {
        if (key == null) {
            return true;
        }
        for (Object part : key) {
            if (part == null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Median of non-decreasing ranks; mean of the two middle values for an even count.
     */
    static double median(int[] sortedRanks) {
        int n = sortedRanks.length;
        if (n == 0) {
            return 0.0;
        }
        if (n % 2 == 1) {
            return sortedRanks[n / 2];
        }
        return (sortedRanks[n / 2 - 1] + sortedRanks[n / 2]) / 2.0;
    }
}
