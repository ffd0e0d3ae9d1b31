package kestrel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import kestrel.utils.Log;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Server settings plus the parameter registry answered by {@code CONFIG GET}.
 * Loaded from an optional YAML file and then overridden by command-line flags.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "kestrel.yaml";

    public static final String DIR = "dir";
    public static final String DBFILENAME = "dbfilename";

    public static final String FRAMING_READ = "read";
    public static final String FRAMING_STREAM = "stream";

    public int port = 6379;
    public int backlog = 5;
    public int readBufferSize = 1024;
    public String framing = FRAMING_READ;
    public long activeExpireIntervalMs = 100;

    // Seeds the registry; kept as fields so the YAML file can set them.
    public String dir = "./";
    public String dbfilename = "dump.rdb";

    private final Map<String, String> params = new HashMap<>();
    private final ReentrantReadWriteLock paramsLock = new ReentrantReadWriteLock();

    public Config() {
        // Default constructor for Jackson
    }

    /** Copies {@link #dir} and {@link #dbfilename} into the registry. */
    void seedParams() {
        set(DIR, dir);
        set(DBFILENAME, dbfilename);
    }

    public static Config defaults() {
        Config config = new Config();
        config.seedParams();
        return config;
    }

    public Optional<String> get(String name) {
        paramsLock.readLock().lock();
        try {
            return Optional.ofNullable(params.get(name));
        } finally {
            paramsLock.readLock().unlock();
        }
    }

    public void set(String name, String value) {
        paramsLock.writeLock().lock();
        try {
            params.put(name, value);
        } finally {
            paramsLock.writeLock().unlock();
        }
    }

    public boolean isStreamFraming() {
        return FRAMING_STREAM.equalsIgnoreCase(framing);
    }

    public static Config load(String filename) {
        File f = new File(filename);
        Config config = new Config();

        if (!f.exists()) {
            Log.info("Config file not found: " + filename + ". Using defaults.");
            config.seedParams();
            return config;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            Config loaded = mapper.readValue(f, Config.class);
            if (loaded != null) config = loaded;
            Log.info("Loaded config from " + f.getPath());
        } catch (Exception e) {
            Log.warn("Failed to load config " + f.getPath() + " (" + e.getMessage() + "). Using defaults.");
            config = new Config();
        }

        config.validate();
        config.seedParams();
        return config;
    }

    private void validate() {
        if (dir == null) dir = "./";
        if (dbfilename == null) dbfilename = "dump.rdb";
        if (framing == null || !(framing.equalsIgnoreCase(FRAMING_READ) || framing.equalsIgnoreCase(FRAMING_STREAM))) {
            Log.warn("Unknown framing mode '" + framing + "', using '" + FRAMING_READ + "'");
            framing = FRAMING_READ;
        }
        if (readBufferSize <= 0) readBufferSize = 1024;
        if (backlog <= 0) backlog = 5;
    }

    /**
     * Builds the configuration from flag/value pairs: {@code --config}, {@code --dir},
     * {@code --dbfilename} and {@code --port}. A flag without a value is ignored.
     */
    public static Config fromArgs(String[] args) {
        Map<String, String> flags = new HashMap<>();
        for (int i = 0; i + 1 < args.length; i += 2) {
            flags.put(args[i], args[i + 1]);
        }

        Config config = load(flags.getOrDefault("--config", DEFAULT_FILE));

        for (Map.Entry<String, String> flag : flags.entrySet()) {
            String value = flag.getValue();
            switch (flag.getKey()) {
                case "--config":
                    break;
                case "--dir":
                    config.dir = value;
                    config.set(DIR, value);
                    break;
                case "--dbfilename":
                    config.dbfilename = value;
                    config.set(DBFILENAME, value);
                    break;
                case "--port":
                    try {
                        config.port = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        Log.warn("Ignoring invalid --port value: " + value);
                    }
                    break;
                default:
                    Log.warn("Ignoring unknown option: " + flag.getKey());
            }
        }
        return config;
    }
}
