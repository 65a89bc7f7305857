package com.optionscope.app;

import com.optionscope.config.Config;
import com.optionscope.core.diagnostics.PipelineDiagnostics;
import com.optionscope.loader.DataLoadException;
import com.optionscope.moneyness.MoneynessSummarizer;
import com.optionscope.moneyness.MoneynessSummary;
import com.optionscope.pipeline.PipelineSettings;
import com.optionscope.pipeline.ReconciliationPipeline;
import com.optionscope.pipeline.ReconciliationResult;
import com.optionscope.universe.IdentityViolationException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class OptionScopeApplication {
    private static final String CLI_SOURCE = "cli";

    private final boolean routeStdStreams;

    public OptionScopeApplication() {
        this(true);
    }

    OptionScopeApplication(boolean routeStdStreams) {
        this.routeStdStreams = routeStdStreams;
    }

    public static void main(String[] args) {
        int exit = new OptionScopeApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("optionscope", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("optionscope", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        PipelineSettings settings;
        Config config;
        try {
            config = cmd.hasOption("config")
                    ? Config.load(workingDir, workingDir.resolve(cmd.getOptionValue("config")).normalize())
                    : Config.load(workingDir);
            settings = PipelineSettings.fromConfig(config);
            if (cmd.hasOption("data-dir")) {
                settings = settings.toBuilder()
                        .dataDir(workingDir.resolve(cmd.getOptionValue("data-dir")).normalize())
                        .build();
            }
            if (cmd.hasOption("strict-identity")) {
                settings = settings.toBuilder().failOnIdentityViolation(true).build();
            }
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (routeStdStreams) {
            LogRouting.install(config.getPath("outputs.dir").resolve("log"));
        }

        try {
            System.out.println("Reconciling extracts in " + settings.dataDir
                    + " patterns=" + settings.patterns
                    + " tie_break=" + settings.tieBreak);
            ReconciliationResult result = new ReconciliationPipeline(settings, configSnapshot(config, cmd))
                    .runFromDirectory();
            printSummary(result);
            if (cmd.hasOption("summary-out")) {
                Path out = workingDir.resolve(cmd.getOptionValue("summary-out")).normalize();
                writeSummary(out, result);
                System.out.println("Run summary written to " + out);
            }
            return 0;
        } catch (DataLoadException | IdentityViolationException e) {
            System.err.println("FATAL: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    static List<PipelineDiagnostics.ConfigItem> configSnapshot(Config config, CommandLine cmd) {
        Map<String, PipelineDiagnostics.ConfigItem> items = new LinkedHashMap<>();
        for (String key : config.defaults().keySet()) {
            items.put(key, new PipelineDiagnostics.ConfigItem(key, config.getString(key), config.sourceOf(key)));
        }
        if (cmd.hasOption("data-dir")) {
            items.put("data.dir", new PipelineDiagnostics.ConfigItem("data.dir", cmd.getOptionValue("data-dir"), CLI_SOURCE));
        }
        if (cmd.hasOption("strict-identity")) {
            items.put("identity.fail_on_violation",
                    new PipelineDiagnostics.ConfigItem("identity.fail_on_violation", "true", CLI_SOURCE));
        }
        return new ArrayList<>(items.values());
    }

    private void printSummary(ReconciliationResult result) {
        PipelineDiagnostics diagnostics = result.diagnostics;
        for (Map.Entry<String, Integer> entry : diagnostics.categoryRows.entrySet()) {
            System.out.println("category " + entry.getKey()
                    + " rows=" + entry.getValue()
                    + " files=" + diagnostics.categoryFiles.getOrDefault(entry.getKey(), 0));
        }
        for (PipelineDiagnostics.CoverageMetric metric : diagnostics.coverages.values()) {
            System.out.println(String.format(Locale.US, "coverage %s %d/%d (%.2f%%)",
                    metric.key, metric.numerator, metric.denominator, metric.pct));
        }
        System.out.println("identity violations=" + result.identityReport.violationCount()
                + " stream orphans=" + diagnostics.counter("stream.orphans")
                + " snapshot orphans=" + diagnostics.counter("snapshot.orphans"));
        MoneynessSummarizer summarizer = new MoneynessSummarizer();
        for (MoneynessSummary summary : result.moneynessSummaries) {
            System.out.println(summarizer.toSummaryText(summary));
        }
    }

    void writeSummary(Path out, ReconciliationResult result) throws IOException {
        Path parent = out.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = new RunSummaryJson().build(result).toString(2);
        Files.writeString(out, json, StandardCharsets.UTF_8);
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("data-dir").hasArg().argName("dir")
                .desc("Directory holding the extracts (overrides data.dir)").build());
        options.addOption(Option.builder().longOpt("config").hasArg().argName("file")
                .desc("Properties file layered over the defaults").build());
        options.addOption(Option.builder().longOpt("summary-out").hasArg().argName("file")
                .desc("Write a JSON run summary to this file").build());
        options.addOption(Option.builder().longOpt("strict-identity")
                .desc("Fail the run when a contract id carries more than one description").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }
}
