package com.optionscope.loader;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;

/**
 * Routes files to a category by matching the file name against a glob.
 */
public final class CategoryPattern {
    private final DatasetCategory category;
    private final String glob;
    private final PathMatcher matcher;

    public CategoryPattern(DatasetCategory category, String glob) {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (glob == null || glob.trim().isEmpty()) {
            throw new IllegalArgumentException("pattern must not be empty for category " + category.key());
        }
        this.category = category;
        this.glob = glob.trim();
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + this.glob);
    }

    public DatasetCategory category() {
        return category;
    }

    public String glob() {
        return glob;
    }

    public boolean matches(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return false;
        }
        return matcher.matches(Path.of(fileName));
    }

    @Override
    public String toString() {
        return category.key() + "=" + glob;
    }
}
