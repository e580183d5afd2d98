package com.ceiling.quota;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Insertion-ordered map from {@link Tag} to a count, used both for limits and for usage.
 * <p>
 * For limits the value means: negative = unlimited, zero = blocked, positive = ceiling. For usage
 * it is the current count.
 * <p>
 * Thread-safety: all operations are guarded by a read/write lock. {@link #merge(QuotaMap)} may be
 * called concurrently by several writers, which is how the usage aggregator combines reports from
 * parallel reporters into one instance. {@link #entries()} returns a snapshot, so iteration order is
 * stable within a call even while other threads merge.
 */
public final class QuotaMap {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Tag, Long> values = new LinkedHashMap<>();

    public QuotaMap() {
    }

    /**
     * Creates a map holding the given entries, in the source map's iteration order.
     */
    public static QuotaMap of(Map<Tag, Long> entries) {
        QuotaMap map = new QuotaMap();
        entries.forEach(map::put);
        return map;
    }

    /**
     * Sets the value for a tag, replacing any previous value.
     *
     * @return this map, for chaining
     */
    public QuotaMap put(Tag tag, long value) {
        if (tag == null) {
            throw new IllegalArgumentException("tag must not be null");
        }
        lock.writeLock().lock();
        try {
            values.put(tag, value);
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    /**
     * Returns the value for a tag, or empty if the tag is absent.
     */
    public OptionalLong get(Tag tag) {
        lock.readLock().lock();
        try {
            Long value = values.get(tag);
            return value == null ? OptionalLong.empty() : OptionalLong.of(value);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies every entry of {@code other} into this map. Entries of {@code other} win on collision.
     * Safe to call from several threads at once, including with maps that are themselves being
     * merged into.
     */
    public void merge(QuotaMap other) {
        if (other == null || other == this) {
            return;
        }
        // Snapshot first so the two maps' locks are never held together.
        List<Map.Entry<Tag, Long>> incoming = other.entries();
        lock.writeLock().lock();
        try {
            for (Map.Entry<Tag, Long> entry : incoming) {
                values.put(entry.getKey(), entry.getValue());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a snapshot of the entries in insertion order.
     */
    public List<Map.Entry<Tag, Long>> entries() {
        lock.readLock().lock();
        try {
            List<Map.Entry<Tag, Long>> snapshot = new ArrayList<>(values.size());
            values.forEach((tag, value) -> snapshot.add(Map.entry(tag, value)));
            return Collections.unmodifiableList(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the target resources of all tags, in first-seen order.
     */
    public Set<String> targets() {
        Set<String> targets = new LinkedHashSet<>();
        for (Map.Entry<Tag, Long> entry : entries()) {
            targets.add(entry.getKey().target());
        }
        return targets;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return values.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return "QuotaMap" + values;
        } finally {
            lock.readLock().unlock();
        }
    }
}
