package com.optionscope.testing;

import com.optionscope.loader.DatasetCategory;
import com.optionscope.loader.RawRow;
import com.optionscope.loader.RawTable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Fixtures {

    private Fixtures() {
    }

    /**
     * In-memory table from comma-separated lines; empty cells read as null.
     */
    public static RawTable table(DatasetCategory category, String sourceFile, String header, String... lines) {
        List<String> columns = Arrays.asList(header.split(",", -1));
        List<RawRow> rows = new ArrayList<>();
        for (String line : lines) {
            String[] cells = line.split(",", -1);
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                String cell = i < cells.length ? cells[i].trim() : "";
                values.put(columns.get(i), cell.isEmpty() ? null : cell);
            }
            rows.add(new RawRow(sourceFile, values));
        }
        return new RawTable(category, columns, rows);
    }

    public static Path write(Path dir, String fileName, String... lines) throws IOException {
        Path file = dir.resolve(fileName);
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    public static RawTable optionSpace(String... lines) {
        return table(DatasetCategory.OPTION_SPACE, "option_space_1.csv",
                "id,description,exercise_style,exchange_id,expiry,contract_type,strike_price,underlying_id",
                lines);
    }

    public static RawTable stream(String... lines) {
        return table(DatasetCategory.STREAM, "stream_1.csv",
                "contract_id,observed_at,ask,ask_size,bid,bid_size,mid",
                lines);
    }

    public static RawTable prices(String... lines) {
        return table(DatasetCategory.MONEYNESS_PRICE, "moneyness_1.csv",
                "underlying_id,date,close,volume",
                lines);
    }
}
