package ember;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import ember.persistence.PersistenceMode;
import ember.utils.Log;

import java.io.File;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class Config {
    private static final Log log = Log.named("config");

    public static final List<String> DEFAULT_APPEND_ONLY_CMDS = Arrays.asList(
            "SET", "DELETE", "EXPIRE", "INCR", "DECR", "LPUSH", "RPUSH", "LPOP", "RPOP");

    public String host = "127.0.0.1";
    public int port = 6379;

    // Persistence
    public boolean snapshot = false;
    public boolean appendOnly = false;
    public long snapshotIntervalMs = 60000;
    public Set<String> appendOnlyCmds = new LinkedHashSet<>(DEFAULT_APPEND_ONLY_CMDS);
    public String snapshotFile = "snapshot.json";
    public String appendOnlyFile = "appendonly.aof";

    public Config() {
        // Default constructor for Jackson
    }

    /**
     * The single active durability mode. The append-only log wins if both flags are set.
     */
    public PersistenceMode persistenceMode() {
        if (appendOnly) return PersistenceMode.APPEND_ONLY;
        if (snapshot) return PersistenceMode.SNAPSHOT;
        return PersistenceMode.NONE;
    }

    public boolean isAppendable(String command) {
        if (appendOnlyCmds == null) return false;
        String upper = command.toUpperCase(Locale.ROOT);
        for (String c : appendOnlyCmds) {
            if (c != null && c.toUpperCase(Locale.ROOT).equals(upper)) return true;
        }
        return false;
    }

    public static Config load(String filename) {
        return load(new File(filename));
    }

    public static Config load(File f) {
        Config config = new Config();

        if (!f.exists()) {
            log.warn("Config file not found: " + f + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                Config loaded = mapper.readValue(f, Config.class);
                if (loaded != null) config = loaded;
                if (config.appendOnlyCmds == null) config.appendOnlyCmds = new LinkedHashSet<>();
                log.info("Loaded config from " + f);
            } catch (Exception e) {
                log.error("Failed to load config (" + e.getMessage() + "). Using defaults.");
                config = new Config();
            }
        }

        config.applyEnvironment(System.getenv());
        config.validate();
        return config;
    }

    void applyEnvironment(Map<String, String> env) {
        String envHost = env.get("EMBER_HOST");
        if (envHost != null && !envHost.trim().isEmpty()) {
            host = envHost.trim();
        }
        String envPort = env.get("EMBER_PORT");
        if (envPort != null) {
            try {
                port = Integer.parseInt(envPort.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring EMBER_PORT=" + envPort + ": not a number");
            }
        }
    }

    void validate() {
        if (snapshot && appendOnly) {
            log.warn("Both snapshot and appendOnly are enabled; using the append-only log only.");
        }
        if (snapshotIntervalMs <= 0) {
            log.warn("snapshotIntervalMs must be positive, got " + snapshotIntervalMs + ". Using 60000.");
            snapshotIntervalMs = 60000;
        }
    }
}
