package com.optionscope.rank;

import java.util.List;

public final class RankActivityProfile {
    public final List<RankActivity> byStrikeRank;
    public final List<RankActivity> byExpiryRank;

    public RankActivityProfile(List<RankActivity> byStrikeRank, List<RankActivity> byExpiryRank) {
        this.byStrikeRank = byStrikeRank == null ? List.of() : List.copyOf(byStrikeRank);
        this.byExpiryRank = byExpiryRank == null ? List.of() : List.copyOf(byExpiryRank);
    }
}
