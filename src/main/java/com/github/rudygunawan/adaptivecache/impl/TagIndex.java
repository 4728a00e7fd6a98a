package com.github.rudygunawan.adaptivecache.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-way index between tags and keys.
 *
 * <p>Not thread-safe; callers hold the cache lock.
 */
final class TagIndex {
    private final Map<String, Set<String>> keysByTag = new LinkedHashMap<>();
    private final Map<String, Set<String>> tagsByKey = new HashMap<>();

    /**
     * Registers {@code key} under every tag in {@code tags}.
     */
    void add(String key, Collection<String> tags) {
        for (String tag : tags) {
            keysByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(key);
            tagsByKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(tag);
        }
    }

    /**
     * Removes {@code key} from every tag, dropping tags left without keys.
     *
     * @return the tags the key was registered under
     */
    Set<String> removeKey(String key) {
        Set<String> tags = tagsByKey.remove(key);
        if (tags == null) {
            return Collections.emptySet();
        }
        for (String tag : tags) {
            Set<String> keys = keysByTag.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    keysByTag.remove(tag);
                }
            }
        }
        return tags;
    }

    List<String> keysFor(String tag) {
        Set<String> keys = keysByTag.get(tag);
        return keys == null ? Collections.emptyList() : new ArrayList<>(keys);
    }

    Set<String> tags() {
        return new LinkedHashSet<>(keysByTag.keySet());
    }

    int tagCount() {
        return keysByTag.size();
    }

    void clear() {
        keysByTag.clear();
        tagsByKey.clear();
    }
}
