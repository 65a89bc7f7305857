package com.optionscope.loader;

import com.optionscope.testing.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSetLoaderTest {

    private final FileSetLoader loader = new FileSetLoader(new DelimitedFileReader(','), 3);

    @TempDir
    Path dir;

    @Test
    void load_shouldConcatenateAllFilesOfCategoryAndAttributeSource() throws Exception {
        Fixtures.write(dir, "stream_day1.csv",
                "contract_id,ask,bid",
                "C1,1.0,0.9",
                "C2,2.0,1.9",
                "C3,3.0,2.9");
        Fixtures.write(dir, "stream_day2.csv",
                "contract_id,ask,bid",
                "C4,4.0,3.9",
                "C5,5.0,4.9");

        LoadedDataSet data = loader.load(dir, List.of(new CategoryPattern(DatasetCategory.STREAM, "*stream*.csv")));
        RawTable stream = data.table(DatasetCategory.STREAM);

        assertEquals(5, stream.size());
        assertEquals(Set.of("stream_day1.csv", "stream_day2.csv"), stream.sourceFiles());
        for (RawRow row : stream.rows()) {
            int n = Integer.parseInt(row.get("contract_id").substring(1));
            assertEquals(n <= 3 ? "stream_day1.csv" : "stream_day2.csv", row.sourceFile);
        }
    }

    @Test
    void load_shouldFillColumnsMissingFromOneFileWithNull() throws Exception {
        Fixtures.write(dir, "stream_a.csv",
                "contract_id,ask",
                "C1,1.0");
        Fixtures.write(dir, "stream_b.csv",
                "contract_id,ask,mid",
                "C2,2.0,1.95");

        RawTable stream = loader.load(dir, List.of(new CategoryPattern(DatasetCategory.STREAM, "stream_*.csv")))
                .table(DatasetCategory.STREAM);

        assertEquals(List.of("contract_id", "ask", "mid"), stream.columns());
        assertNull(stream.rows().get(0).get("mid"));
        assertEquals("1.95", stream.rows().get(1).get("mid"));
    }

    @Test
    void load_shouldReturnEmptyTableWhenNothingMatches() throws Exception {
        Fixtures.write(dir, "stream_a.csv", "contract_id", "C1");

        LoadedDataSet data = loader.load(dir, List.of(
                new CategoryPattern(DatasetCategory.STREAM, "*stream*.csv"),
                new CategoryPattern(DatasetCategory.SNAPSHOT, "*snapshot*.csv")));

        assertTrue(data.table(DatasetCategory.SNAPSHOT).isEmpty());
        assertEquals(1, data.table(DatasetCategory.STREAM).size());
        assertTrue(data.table(DatasetCategory.STOCK_PRICE).isEmpty());
    }

    @Test
    void load_shouldRouteOneFileIntoEveryMatchingCategory() throws Exception {
        Fixtures.write(dir, "stock_option_space.csv",
                "id,description,expiry,contract_type,strike_price,underlying_id",
                "O1,AAPL 150 C,2024-01-19,Call,150,S1");

        LoadedDataSet data = loader.load(dir, List.of(
                new CategoryPattern(DatasetCategory.OPTION_SPACE, "*option_space*.csv"),
                new CategoryPattern(DatasetCategory.STOCK_OPTION, "*stock_option*.csv")));

        assertEquals(1, data.table(DatasetCategory.OPTION_SPACE).size());
        assertEquals(1, data.table(DatasetCategory.STOCK_OPTION).size());
    }

    @Test
    void load_shouldFailWholeLoadWhenAnyFileIsMalformed() throws Exception {
        Fixtures.write(dir, "stream_ok.csv", "contract_id,ask", "C1,1.0");
        Fixtures.write(dir, "snapshot_ok.csv", "contract_id,mid_price", "C1,1.0");
        Fixtures.write(dir, "stream_broken.csv", "contract_id,ask", "C2,1.0,9,9");

        DataLoadException e = assertThrows(DataLoadException.class, () -> loader.load(dir, List.of(
                new CategoryPattern(DatasetCategory.SNAPSHOT, "*snapshot*.csv"),
                new CategoryPattern(DatasetCategory.STREAM, "*stream*.csv"))));

        assertEquals(DatasetCategory.STREAM, e.category());
        assertEquals("stream_broken.csv", e.fileName());
    }

    @Test
    void load_shouldFailWhenDirectoryIsMissing() {
        assertThrows(DataLoadException.class, () -> loader.load(dir.resolve("absent"),
                List.of(new CategoryPattern(DatasetCategory.STREAM, "*.csv"))));
    }

    @Test
    void load_shouldRejectCategoryConfiguredTwice() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(dir, List.of(
                new CategoryPattern(DatasetCategory.STREAM, "a*.csv"),
                new CategoryPattern(DatasetCategory.STREAM, "b*.csv"))));
    }

    @Test
    void categoryPattern_shouldMatchFileNameGlob() {
        CategoryPattern pattern = new CategoryPattern(DatasetCategory.STREAM, "*stream*.csv");

        assertTrue(pattern.matches("option_stream_2024.csv"));
        assertTrue(!pattern.matches("option_stream_2024.txt"));
        assertTrue(!pattern.matches(null));
    }
}
