package io.expandcheck;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine settings loaded from a YAML file.
 * Keys missing from a file fall back to the bundled defaults.
 */
public class EngineConfig {

    private static final String DEFAULT_CONFIG = "/expand-check-defaults.yaml";

    private final boolean reportAllViolations;
    private final boolean cacheCatalogs;
    private final int parallelism;
    private final boolean failOnTypeMismatch;

    private EngineConfig(boolean reportAllViolations,
                         boolean cacheCatalogs,
                         int parallelism,
                         boolean failOnTypeMismatch) {
        this.reportAllViolations = reportAllViolations;
        this.cacheCatalogs = cacheCatalogs;
        this.parallelism = parallelism;
        this.failOnTypeMismatch = failOnTypeMismatch;
    }

    public static EngineConfig of(boolean reportAllViolations,
                                  boolean cacheCatalogs,
                                  int parallelism,
                                  boolean failOnTypeMismatch) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        return new EngineConfig(reportAllViolations, cacheCatalogs, parallelism, failOnTypeMismatch);
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static EngineConfig loadDefault() {
        try {
            return fromMap(readDefaults(), DEFAULT_CONFIG);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default config", e);
        }
    }

    /**
     * Load configuration from a YAML file, on top of the defaults.
     */
    @SuppressWarnings("unchecked")
    public static EngineConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object loaded;
            try {
                loaded = yaml.load(in);
            } catch (YAMLException e) {
                throw new IOException("Invalid YAML in config file " + configPath + ": " + e.getMessage(), e);
            }
            if (loaded == null) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }
            if (!(loaded instanceof Map)) {
                throw new IOException("Config file must be a mapping at the top level: " + configPath);
            }
            Map<String, Object> merged = new LinkedHashMap<>(readDefaults());
            merged.putAll((Map<String, Object>) loaded);
            return fromMap(merged, configPath.toString());
        }
    }

    private static Map<String, Object> readDefaults() throws IOException {
        try (InputStream is = EngineConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IOException("Default config not found on classpath: " + DEFAULT_CONFIG);
            }
            Map<String, Object> data = new Yaml().load(is);
            return data != null ? data : Map.of();
        }
    }

    private static EngineConfig fromMap(Map<String, Object> data, String source) throws IOException {
        boolean reportAll = getBoolean(data, "reportAllViolations", true, source);
        boolean cache = getBoolean(data, "cacheCatalogs", true, source);
        int parallelism = getInt(data, "parallelism", 1, source);
        boolean failOnMismatch = getBoolean(data, "failOnTypeMismatch", true, source);

        if (parallelism < 1) {
            throw new IOException("'parallelism' must be at least 1 in " + source + ": " + parallelism);
        }
        return new EngineConfig(reportAll, cache, parallelism, failOnMismatch);
    }

    private static boolean getBoolean(Map<String, Object> data, String key, boolean fallback, String source)
            throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IOException("'" + key + "' must be true or false in " + source + ", got: " + value);
    }

    private static int getInt(Map<String, Object> data, String key, int fallback, String source) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Integer i) {
            return i;
        }
        throw new IOException("'" + key + "' must be an integer in " + source + ", got: " + value);
    }

    /**
     * Whether the validator reports every violation instead of stopping at the first.
     */
    public boolean reportAllViolations() {
        return reportAllViolations;
    }

    public boolean cacheCatalogs() {
        return cacheCatalogs;
    }

    /**
     * Number of worker threads used to resolve independent call sites.
     */
    public int parallelism() {
        return parallelism;
    }

    /**
     * Whether argument type mismatches count as errors for the exit code.
     */
    public boolean failOnTypeMismatch() {
        return failOnTypeMismatch;
    }

    public EngineConfig withParallelism(int parallelism) {
        return of(reportAllViolations, cacheCatalogs, parallelism, failOnTypeMismatch);
    }
}
