package com.ember.script.vars;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread-safe key/value namespace.
 *
 * Computed keys are registered once through {@link #registerComputed} and ignore later writes.
 * Listeners are notified after the lock is released, only when a value actually changes.
 */
public class VariableStore implements VariableLookup {

    /** Change notification; {@code value} is null when the key was removed. */
    @FunctionalInterface
    public interface ChangeListener {
        void variableChanged(String key, String value);
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, DynamicValue> values = new HashMap<>();
    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();

    protected void registerComputed(String key, Supplier<String> supplier) {
        lock.writeLock().lock();
        try {
            values.put(key, DynamicValue.computed(supplier));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String get(String key) {
        if (key == null) return null;
        lock.readLock().lock();
        try {
            DynamicValue value = values.get(key);
            return value == null ? null : value.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String lookup(String key) {
        return get(key);
    }

    public boolean has(String key) {
        lock.readLock().lock();
        try {
            return values.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(String key, String value) {
        if (key == null) throw new IllegalArgumentException("variable name must not be null");
        String newValue = value == null ? "" : value;
        lock.writeLock().lock();
        try {
            DynamicValue existing = values.get(key);
            if (existing != null && (existing.isComputed() || Objects.equals(existing.get(), newValue))) {
                return;
            }
            values.put(key, DynamicValue.literal(newValue));
        } finally {
            lock.writeLock().unlock();
        }
        notifyChanged(key, newValue);
    }

    public void remove(String key) {
        lock.writeLock().lock();
        try {
            DynamicValue existing = values.get(key);
            if (existing == null || existing.isComputed()) return;
            values.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
        notifyChanged(key, null);
    }

    /** Removes every literal value; computed keys stay. */
    public void removeAll() {
        List<String> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            values.entrySet().removeIf(e -> {
                if (e.getValue().isComputed()) return false;
                removed.add(e.getKey());
                return true;
            });
        } finally {
            lock.writeLock().unlock();
        }
        for (String key : removed) notifyChanged(key, null);
    }

    public int count() {
        lock.readLock().lock();
        try {
            return values.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Sorted copy of every key and its current value. */
    public Map<String, String> snapshot() {
        Map<String, String> copy = new TreeMap<>();
        lock.readLock().lock();
        try {
            for (Map.Entry<String, DynamicValue> e : values.entrySet()) {
                String value = e.getValue().get();
                copy.put(e.getKey(), value == null ? "" : value);
            }
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableMap(copy);
    }

    public List<String> keys() {
        return new ArrayList<>(snapshot().keySet());
    }

    public void addListener(ChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyChanged(String key, String value) {
        for (ChangeListener listener : listeners) {
            listener.variableChanged(key, value);
        }
    }
}
