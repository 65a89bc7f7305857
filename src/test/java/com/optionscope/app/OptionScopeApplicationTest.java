package com.optionscope.app;

import com.optionscope.testing.SampleDataSet;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptionScopeApplicationTest {

    private final OptionScopeApplication app = new OptionScopeApplication(false);

    @TempDir
    Path dir;

    @Test
    void run_shouldReturnZeroForHelp() {
        assertEquals(0, app.run(new String[]{"--help"}));
    }

    @Test
    void run_shouldReturnTwoForUnknownOption() {
        assertEquals(2, app.run(new String[]{"--no-such-option"}));
    }

    @Test
    void run_shouldReturnTwoForInvalidConfig() throws Exception {
        Path config = dir.resolve("bad.properties");
        Files.writeString(config, "rank.tie_break=average\n", StandardCharsets.UTF_8);

        assertEquals(2, app.run(new String[]{"--config", config.toString()}));
    }

    @Test
    void run_shouldReturnTwoForMissingConfigFile() {
        assertEquals(2, app.run(new String[]{"--config", dir.resolve("absent.properties").toString()}));
    }

    @Test
    void run_shouldReturnOneWhenDataDirectoryIsMissing() {
        assertEquals(1, app.run(new String[]{"--data-dir", dir.resolve("absent").toString()}));
    }

    @Test
    void run_shouldReturnOneForMalformedExtract() throws Exception {
        SampleDataSet.write(dir);
        Files.writeString(dir.resolve("stream_2.csv"), "ask,bid\n1,2\n", StandardCharsets.UTF_8);

        assertEquals(1, app.run(new String[]{"--data-dir", dir.toString()}));
    }

    @Test
    void run_shouldWriteJsonSummary() throws Exception {
        SampleDataSet.write(dir);
        Path out = dir.resolve("reports/summary.json");

        int exit = app.run(new String[]{"--data-dir", dir.toString(), "--summary-out", out.toString()});

        assertEquals(0, exit);
        assertTrue(Files.exists(out));
        JSONObject summary = new JSONObject(Files.readString(out, StandardCharsets.UTF_8));
        assertEquals(5, summary.getJSONObject("counters").getInt("universe.contracts"));
        assertEquals(6, summary.getJSONObject("categories").getJSONObject("option_space").getInt("rows"));
        assertEquals(75.0, summary.getJSONObject("coverages").getJSONObject("stream.join").getDouble("pct"), 1e-9);
        assertEquals(3, summary.getJSONArray("moneyness").length());
        assertEquals("cli", summary.getJSONObject("config").getJSONObject("data.dir").getString("source"));
        assertFalse(summary.getJSONObject("activity_by_rank").getJSONArray("strike_rank").isEmpty());
        assertEquals(0, summary.getJSONArray("identity_violations").length());
        assertEquals("resource", summary.getJSONObject("config").getJSONObject("rank.tie_break").getString("source"));
    }

    @Test
    void run_shouldReturnOneForIdentityViolationInStrictMode() throws Exception {
        SampleDataSet.write(dir);
        Files.writeString(dir.resolve("stock_option_2.csv"), "id,description\nC150,renamed\n", StandardCharsets.UTF_8);

        assertEquals(0, app.run(new String[]{"--data-dir", dir.toString()}));
        assertEquals(1, app.run(new String[]{"--data-dir", dir.toString(), "--strict-identity"}));
    }
}
