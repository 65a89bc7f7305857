package com.optionscope.loader;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads one header-first delimited extract into a {@link RawTable}. Any structural problem fails
 * the file with a {@link DataLoadException}; nothing is skipped silently.
 */
public final class DelimitedFileReader {
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private final char delimiter;

    public DelimitedFileReader(char delimiter) {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("unsupported delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    public RawTable read(Path file, DatasetCategory category) {
        String fileName = file.getFileName().toString();
        List<String> lines;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (CharacterCodingException e) {
            throw new DataLoadException(category, fileName, "not valid UTF-8 text", e);
        } catch (IOException e) {
            throw new DataLoadException(category, fileName, "unreadable: " + e.getMessage(), e);
        }

        List<Record> records = assemble(lines, category, fileName);
        int headerIndex = firstNonBlank(records);
        if (headerIndex < 0) {
            throw new DataLoadException(category, fileName, "no header row");
        }
        Record headerRecord = records.get(headerIndex);
        String headerLine = stripBom(headerRecord.text);
        List<String> rawHeader = split(headerLine, category, fileName, headerRecord.lineNo);
        boolean dropLeadingIndex = !rawHeader.isEmpty() && isIndexColumn(rawHeader.get(0));
        int offset = dropLeadingIndex ? 1 : 0;

        List<String> header = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int c = offset; c < rawHeader.size(); c++) {
            String name = normalizeHeader(rawHeader.get(c));
            if (name.isEmpty()) {
                name = "unnamed_" + c;
            }
            if (!seen.add(name)) {
                throw new DataLoadException(category, fileName, "duplicate column '" + name + "'");
            }
            header.add(name);
        }
        List<String> missing = category.schema().missingRequired(header);
        if (!missing.isEmpty()) {
            throw new DataLoadException(category, fileName, "missing required columns " + missing);
        }

        List<RawRow> rows = new ArrayList<>(Math.max(16, records.size() - headerIndex));
        for (int i = headerIndex + 1; i < records.size(); i++) {
            Record record = records.get(i);
            if (record.text.trim().isEmpty()) {
                continue;
            }
            List<String> cells = split(record.text, category, fileName, record.lineNo);
            if (cells.size() > rawHeader.size()) {
                throw new DataLoadException(category, fileName,
                        "line " + record.lineNo + " has " + cells.size() + " fields, header has " + rawHeader.size());
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                int cellIndex = c + offset;
                String cell = cellIndex < cells.size() ? cells.get(cellIndex).trim() : "";
                values.put(header.get(c), cell.isEmpty() ? null : cell);
            }
            rows.add(new RawRow(fileName, values));
        }
        return new RawTable(category, header, rows);
    }

    /**
     * Joins physical lines into logical records: a line break inside an open quote belongs to
     * the field, so the record continues on the next line.
     */
    static List<Record> assemble(List<String> lines, DatasetCategory category, String fileName) {
        List<Record> out = new ArrayList<>(lines.size());
        StringBuilder pending = null;
        int pendingStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (pending == null) {
                if (quoteOpenAfter(line, false)) {
                    pending = new StringBuilder(line);
                    pendingStart = i + 1;
                } else {
                    out.add(new Record(i + 1, line));
                }
                continue;
            }
            pending.append('\n').append(line);
            if (!quoteOpenAfter(line, true)) {
                out.add(new Record(pendingStart, pending.toString()));
                pending = null;
            }
        }
        if (pending != null) {
            throw new DataLoadException(category, fileName, "unterminated quote on line " + pendingStart);
        }
        return out;
    }

    private static boolean quoteOpenAfter(String line, boolean openAtStart) {
        boolean open = openAtStart;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == QUOTE) {
                open = !open;
            }
        }
        return open;
    }

    List<String> split(String line, DatasetCategory category, String fileName, int lineNo) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == QUOTE) {
                if (inQuote && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    current.append(QUOTE);
                    i++;
                } else {
                    inQuote = !inQuote;
                }
            } else if (ch == delimiter && !inQuote) {
                out.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        if (inQuote) {
            throw new DataLoadException(category, fileName, "unterminated quote on line " + lineNo);
        }
        out.add(current.toString());
        return out;
    }

    private static int firstNonBlank(List<Record> records) {
        for (int i = 0; i < records.size(); i++) {
            if (!stripBom(records.get(i).text).trim().isEmpty()) {
                return i;
            }
        }
        return -1;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == BOM ? line.substring(1) : line;
    }

    private static boolean isIndexColumn(String raw) {
        String name = normalizeHeader(raw);
        return name.isEmpty() || name.equals("index") || name.startsWith("unnamed: 0");
    }

    private static String normalizeHeader(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    static final class Record {
        final int lineNo;
        final String text;

        Record(int lineNo, String text) {
            this.lineNo = lineNo;
            this.text = text;
        }
    }
}
