package com.optionscope.loader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Discovers the extracts in a data directory and loads one concatenated table per category.
 * <p>
 * Every pattern is evaluated against every file, so a file may feed several categories. Files
 * within a category are concatenated in file-name order. Categories load in parallel; the first
 * failing category aborts the whole load.
 */
public final class FileSetLoader {
    private static final Logger LOG = LogManager.getLogger(FileSetLoader.class);

    private final DelimitedFileReader reader;
    private final int threads;

    public FileSetLoader(DelimitedFileReader reader, int threads) {
        this.reader = reader;
        this.threads = Math.max(1, threads);
    }

    public LoadedDataSet load(Path dataDir, List<CategoryPattern> patterns) {
        validatePatterns(patterns);
        List<Path> files = listFiles(dataDir);
        LOG.info("Scanning {} file(s) in {} for {} categories", files.size(), dataDir, patterns.size());

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, patterns.size())));
        Map<CategoryPattern, Future<RawTable>> pending = new LinkedHashMap<>();
        try {
            for (CategoryPattern pattern : patterns) {
                List<Path> matched = match(files, pattern);
                pending.put(pattern, pool.submit(() -> loadCategory(pattern, matched)));
            }

            Map<DatasetCategory, RawTable> tables = new EnumMap<>(DatasetCategory.class);
            for (Map.Entry<CategoryPattern, Future<RawTable>> entry : pending.entrySet()) {
                DatasetCategory category = entry.getKey().category();
                try {
                    tables.put(category, entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof DataLoadException) {
                        LOG.error(cause.getMessage());
                        throw (DataLoadException) cause;
                    }
                    throw new DataLoadException(category, null, String.valueOf(cause), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DataLoadException(category, null, "interrupted", e);
                }
            }
            return new LoadedDataSet(tables);
        } finally {
            pool.shutdownNow();
        }
    }

    RawTable loadCategory(CategoryPattern pattern, List<Path> matched) {
        DatasetCategory category = pattern.category();
        if (matched.isEmpty()) {
            LOG.info("Category {} matched no files for pattern {}", category.key(), pattern.glob());
            return RawTable.empty(category);
        }
        List<RawTable> parts = new ArrayList<>(matched.size());
        for (Path file : matched) {
            parts.add(reader.read(file, category));
        }
        RawTable table = RawTable.concat(category, parts);
        LOG.info("Category {} loaded rows={} files={}", category.key(), table.size(), matched.size());
        return table;
    }

    static List<Path> match(List<Path> files, CategoryPattern pattern) {
        List<Path> out = new ArrayList<>();
        for (Path file : files) {
            if (pattern.matches(file.getFileName().toString())) {
                out.add(file);
            }
        }
        return out;
    }

    private static List<Path> listFiles(Path dataDir) {
        if (dataDir == null || !Files.isDirectory(dataDir)) {
            throw new DataLoadException(null, null, "data directory not found: " + dataDir);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new DataLoadException(null, null, "cannot list " + dataDir + ": " + e.getMessage(), e);
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return files;
    }

    private static void validatePatterns(List<CategoryPattern> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("at least one category pattern is required");
        }
        Set<DatasetCategory> seen = EnumSet.noneOf(DatasetCategory.class);
        for (CategoryPattern pattern : patterns) {
            if (!seen.add(pattern.category())) {
                throw new IllegalArgumentException("category configured twice: " + pattern.category().key());
            }
        }
    }
}
