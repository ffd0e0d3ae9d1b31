package kestrel;

import kestrel.db.KeyValueStore;

public class KestrelServerContext implements ServerContext {
    private final KeyValueStore store;
    private final Config config;

    public KestrelServerContext(KeyValueStore store, Config config) {
        this.store = store;
        this.config = config;
    }

    @Override
    public KeyValueStore getStore() {
        return store;
    }

    @Override
    public Config getConfig() {
        return config;
    }
}
