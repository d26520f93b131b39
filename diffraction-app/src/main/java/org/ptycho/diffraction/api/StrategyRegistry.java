package org.ptycho.diffraction.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ptycho.diffraction.DiffractionDataException;

/**
 * Ordered registry of strategies (file readers, writers, ...) keyed by a stable identifier.
 * Each entry also has a display name for user interfaces.
 *
 * @param  <T>  strategy type.
 *
 * @author Diffraction Assembly Developers
 */
public class StrategyRegistry<T> {

    /**
     * A registered strategy.
     */
    public static class Entry<T> {

        private final String key;
        private final String displayName;
        private final T strategy;

        public Entry(final String key,
                     final String displayName,
                     final T strategy) {
            this.key = key;
            this.displayName = displayName;
            this.strategy = strategy;
        }

        public String getKey() {
            return key;
        }

        public String getDisplayName() {
            return displayName;
        }

        public T getStrategy() {
            return strategy;
        }

        @Override
        public String toString() {
            return key;
        }
    }

    private final Map<String, Entry<T>> entries;
    private String defaultKey;

    public StrategyRegistry() {
        this.entries = new LinkedHashMap<>();
        this.defaultKey = null;
    }

    /**
     * Registers a strategy. The first registered strategy becomes the default.
     *
     * @throws IllegalArgumentException
     *   if the key is already registered.
     */
    public synchronized StrategyRegistry<T> register(final String key,
                                                     final String displayName,
                                                     final T strategy)
            throws IllegalArgumentException {
        if (entries.containsKey(key)) {
            throw new IllegalArgumentException("strategy '" + key + "' is already registered");
        }
        entries.put(key, new Entry<>(key, displayName, strategy));
        if (defaultKey == null) {
            defaultKey = key;
        }
        return this;
    }

    public synchronized void setDefaultKey(final String key)
            throws IllegalArgumentException {
        if (! entries.containsKey(key)) {
            throw new IllegalArgumentException("strategy '" + key + "' is not registered");
        }
        this.defaultKey = key;
    }

    public synchronized String getDefaultKey() {
        return defaultKey;
    }

    /**
     * @return keys in registration order.
     */
    public synchronized List<String> getKeys() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public synchronized List<Entry<T>> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    public synchronized String getDisplayName(final String key)
            throws DiffractionDataException {
        return getEntry(key).getDisplayName();
    }

    /**
     * @param  key  strategy key or null for the default strategy.
     *
     * @throws DiffractionDataException
     *   if no strategy is registered for the key.
     */
    public synchronized T get(final String key)
            throws DiffractionDataException {
        return getEntry(key).getStrategy();
    }

    private Entry<T> getEntry(final String key)
            throws DiffractionDataException {
        final String resolvedKey = key == null ? defaultKey : key;
        final Entry<T> entry = resolvedKey == null ? null : entries.get(resolvedKey);
        if (entry == null) {
            throw DiffractionDataException.unknownFileType(resolvedKey, entries.keySet());
        }
        return entry;
    }
}
