package com.optionscope.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Properties configuration resolved through three layers, highest first: an override file (or
 * in-memory values), the classpath {@code config.properties}, then built-in defaults. A blank
 * value in a higher layer falls through to the next one.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final String FILE_NAME = "config.properties";
    private static final Map<String, String> DEFAULTS = buildDefaults();

    /** Where a resolved value came from, reported in the run summary. */
    public enum Layer {
        OVERRIDE("override"),
        RESOURCE("resource"),
        DEFAULT("default");

        private final String label;

        Layer(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Map<Layer, Properties> layers = new EnumMap<>(Layer.class);
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
        layers.put(Layer.OVERRIDE, new Properties());
        layers.put(Layer.RESOURCE, new Properties());
        Properties defaults = new Properties();
        defaults.putAll(DEFAULTS);
        layers.put(Layer.DEFAULT, defaults);
    }

    /**
     * Classpath resource plus {@code config.properties} in the working directory when present.
     */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);
        config.readResource();
        Path local = workingDir.resolve(FILE_NAME);
        if (Files.isRegularFile(local)) {
            config.readOverride(local);
        }
        return config;
    }

    /**
     * Classpath resource plus an explicitly named override file, which must exist.
     */
    public static Config load(Path workingDir, Path overrideFile) {
        if (overrideFile == null || !Files.isRegularFile(overrideFile)) {
            throw new IllegalArgumentException("config file not found: " + overrideFile);
        }
        Config config = new Config(workingDir);
        config.readResource();
        config.readOverride(overrideFile);
        return config;
    }

    public static Config fromMap(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && !key.trim().isEmpty()) {
                    config.layers.get(Layer.OVERRIDE).setProperty(key.trim(), value == null ? "" : value);
                }
            });
        }
        return config;
    }

    private void readResource() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                layers.get(Layer.RESOURCE).load(in);
            }
        } catch (IOException e) {
            LOG.warn("classpath {} unreadable, using built-in defaults: {}", FILE_NAME, e.getMessage());
        }
    }

    private void readOverride(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            layers.get(Layer.OVERRIDE).load(in);
            LOG.info("config override loaded from {}", file);
        } catch (IOException e) {
            throw new IllegalArgumentException("config file unreadable: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Highest layer holding a non-blank value for {@code key}, or null when none does.
     */
    public Layer layerOf(String key) {
        if (key == null) {
            return null;
        }
        for (Layer layer : Layer.values()) {
            String raw = layers.get(layer).getProperty(key);
            if (raw != null && !raw.trim().isEmpty()) {
                return layer;
            }
        }
        return null;
    }

    /**
     * Label of {@link #layerOf(String)}; unknown keys report {@code default}.
     */
    public String sourceOf(String key) {
        Layer layer = layerOf(key);
        return (layer == null ? Layer.DEFAULT : layer).label();
    }

    /**
     * Trimmed value, or an empty string when no layer sets the key.
     */
    public String getString(String key) {
        String raw = untrimmed(key);
        return raw == null ? "" : raw.trim();
    }

    /**
     * Untrimmed value, so that a tab or space delimiter survives.
     */
    public String getRawString(String key, String fallback) {
        if (key == null) {
            return fallback;
        }
        for (Layer layer : Layer.values()) {
            String raw = layers.get(layer).getProperty(key);
            if (raw != null && !raw.isEmpty()) {
                return raw;
            }
        }
        return fallback;
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "y":
            case "1":
                return true;
            default:
                return false;
        }
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        try {
            return value.isEmpty() ? fallback : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warn("config {}='{}' is not an integer, using {}", key, value, fallback);
            return fallback;
        }
    }

    /**
     * Value resolved against the working directory; the working directory itself when unset.
     */
    public Path getPath(String key) {
        String value = getString(key);
        return value.isEmpty() ? workingDir : workingDir.resolve(value).normalize();
    }

    /**
     * Comma- or semicolon-separated tokens, blanks removed.
     */
    public List<String> getList(String key) {
        List<String> out = new ArrayList<>();
        for (String token : getString(key).split("[,;]")) {
            if (!token.trim().isEmpty()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Every key with a built-in default, in declaration order.
     */
    public Map<String, String> defaults() {
        return Collections.unmodifiableMap(DEFAULTS);
    }

    private String untrimmed(String key) {
        Layer layer = layerOf(key);
        return layer == null ? null : layers.get(layer).getProperty(key);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("data.dir", "data");
        defaults.put("data.delimiter", ",");
        defaults.put("loader.threads", "4");

        defaults.put("category.order", "stream,snapshot,option_space,stock_price,stock_option,moneyness_price");
        defaults.put("category.stream.pattern", "*stream*.csv");
        defaults.put("category.snapshot.pattern", "*snapshot*.csv");
        defaults.put("category.option_space.pattern", "*option_space*.csv");
        defaults.put("category.stock_price.pattern", "*stock_price*.csv");
        defaults.put("category.stock_option.pattern", "*stock_option*.csv");
        defaults.put("category.moneyness_price.pattern", "*moneyness*.csv");

        defaults.put("rank.tie_break", "DENSE");
        defaults.put("identity.fail_on_violation", "false");
        return defaults;
    }
}
