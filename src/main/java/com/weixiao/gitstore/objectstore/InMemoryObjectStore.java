package com.weixiao.gitstore.objectstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存对象存储，用于测试与本地开发。
 * 基于 ConcurrentSkipListMap，单 key 强一致，按前缀列出时天然有序。
 */
public final class InMemoryObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStore.class);

    private final ConcurrentNavigableMap<String, StoredObject> objects = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryObjectStore() {
        this(Clock.systemUTC());
    }

    public InMemoryObjectStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String key, byte[] data, Map<String, String> metadata) {
        Map<String, String> normalized = new TreeMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        ObjectInfo info = new ObjectInfo(key, data.length, clock.millis(), Collections.unmodifiableMap(normalized));
        objects.put(key, new StoredObject(info, data.clone()));
        log.debug("put {} size={}", key, data.length);
    }

    @Override
    public Optional<StoredObject> get(String key) {
        StoredObject stored = objects.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(new StoredObject(stored.getInfo(), stored.getData().clone()));
    }

    @Override
    public Optional<ObjectInfo> head(String key) {
        StoredObject stored = objects.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.getInfo());
    }

    @Override
    public List<ObjectInfo> list(String prefix) {
        List<ObjectInfo> result = new ArrayList<>();
        for (Map.Entry<String, StoredObject> e : objects.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            result.add(e.getValue().getInfo());
        }
        return result;
    }

    @Override
    public boolean anyWithPrefix(String prefix) {
        String first = objects.ceilingKey(prefix);
        return first != null && first.startsWith(prefix);
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
        log.debug("delete {}", key);
    }

    /** 当前对象数量。 */
    public int size() {
        return objects.size();
    }
}
