package org.tilegen.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Fills {@link SolverSettings} from an optional local properties file, then from
 * {@code -Dtilegen.*} system properties.
 */
public final class SolverConfigLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "solver.local.properties");

    static final String SEED = "tilegen.seed";
    static final String WORKERS = "tilegen.workers";
    static final String MAX_ATTEMPTS = "tilegen.maxAttempts";
    static final String RETRY_POLICY = "tilegen.retryPolicy";
    static final String SNAPSHOT_INTERVAL = "tilegen.snapshotInterval";
    static final String MAX_SNAPSHOTS = "tilegen.maxSnapshots";
    static final String MAX_BACKTRACKS = "tilegen.maxBacktracks";
    static final String COLLAPSES_PER_ROUND = "tilegen.collapsesPerRound";
    static final String VALIDATE = "tilegen.validate";
    static final String PERIODIC = "tilegen.periodic";

    private SolverConfigLoader() {
    }

    public static SolverSettings load(long defaultSeed) {
        SolverSettings settings = new SolverSettings(defaultSeed);
        Path path = resolvePath();
        if (Files.exists(path)) {
            apply(settings, readProperties(path));
        }
        apply(settings, System.getProperties());
        settings.validate();
        return settings;
    }

    public static Properties readProperties(Path path) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read solver config: " + path.toAbsolutePath(), e);
        }
        return props;
    }

    public static void apply(SolverSettings cfg, Properties props) {
        String v;
        if ((v = pick(props.getProperty(SEED))) != null) cfg.seed = parseLong(SEED, v);
        if ((v = pick(props.getProperty(WORKERS))) != null) cfg.workerCount = parseInt(WORKERS, v);
        if ((v = pick(props.getProperty(MAX_ATTEMPTS))) != null) cfg.maxAttempts = parseInt(MAX_ATTEMPTS, v);
        if ((v = pick(props.getProperty(SNAPSHOT_INTERVAL))) != null) cfg.snapshotInterval = parseInt(SNAPSHOT_INTERVAL, v);
        if ((v = pick(props.getProperty(MAX_SNAPSHOTS))) != null) cfg.maxSnapshots = parseInt(MAX_SNAPSHOTS, v);
        if ((v = pick(props.getProperty(MAX_BACKTRACKS))) != null) cfg.maxBacktracksPerAttempt = parseInt(MAX_BACKTRACKS, v);
        if ((v = pick(props.getProperty(COLLAPSES_PER_ROUND))) != null) cfg.collapsesPerRound = parseInt(COLLAPSES_PER_ROUND, v);
        if ((v = pick(props.getProperty(VALIDATE))) != null) cfg.validateResult = Boolean.parseBoolean(v);
        if ((v = pick(props.getProperty(PERIODIC))) != null) cfg.periodic = Boolean.parseBoolean(v);
        if ((v = pick(props.getProperty(RETRY_POLICY))) != null) {
            try {
                cfg.retryPolicy = RetryPolicy.valueOf(v.toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Bad value for " + RETRY_POLICY + ": " + v, e);
            }
        }
    }

    private static Path resolvePath() {
        String override = pick(
                System.getProperty("tilegen.config.path"),
                System.getenv("TILEGEN_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Bad value for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Bad value for " + key + ": " + value, e);
        }
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
