package com.optionscope.pipeline;

import com.optionscope.config.Config;
import com.optionscope.loader.CategoryPattern;
import com.optionscope.loader.DatasetCategory;
import com.optionscope.rank.TieBreak;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineSettings {
    public final Path dataDir;
    public final char delimiter;
    public final int loaderThreads;
    public final List<CategoryPattern> patterns;
    public final TieBreak tieBreak;
    public final boolean failOnIdentityViolation;

    public static PipelineSettings fromConfig(Config config) {
        String delimiter = config.getRawString("data.delimiter", ",");
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException("data.delimiter must be a single character, got: '" + delimiter + "'");
        }
        return PipelineSettings.builder()
                .dataDir(config.getPath("data.dir"))
                .delimiter(delimiter.charAt(0))
                .loaderThreads(Math.max(1, config.getInt("loader.threads", 4)))
                .patterns(readPatterns(config))
                .tieBreak(TieBreak.parse(config.getString("rank.tie_break")))
                .failOnIdentityViolation(config.getBoolean("identity.fail_on_violation", false))
                .build();
    }

    static List<CategoryPattern> readPatterns(Config config) {
        List<String> order = config.getList("category.order");
        if (order.isEmpty()) {
            throw new IllegalArgumentException("category.order must list at least one category");
        }
        List<CategoryPattern> out = new ArrayList<>(order.size());
        for (String name : order) {
            DatasetCategory category = DatasetCategory.fromKey(name);
            for (CategoryPattern existing : out) {
                if (existing.category() == category) {
                    throw new IllegalArgumentException("category listed twice in category.order: " + name);
                }
            }
            out.add(new CategoryPattern(category, config.requireString("category." + category.key() + ".pattern")));
        }
        return List.copyOf(out);
    }
}
