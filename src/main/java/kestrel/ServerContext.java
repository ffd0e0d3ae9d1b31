package kestrel;

import kestrel.db.KeyValueStore;

/**
 * What commands may touch: the shared key space and the configuration.
 */
public interface ServerContext {
    KeyValueStore getStore();

    Config getConfig();
}
