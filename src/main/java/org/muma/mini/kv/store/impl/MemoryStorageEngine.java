package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 内存存储引擎
 * <p>
 * 一把读写锁保护整张表：读操作拿共享锁，写操作拿独占锁。
 * 读到过期 Key 时先释放共享锁，再在一个独占临界区内"重新检查 + 删除"，
 * 这样并发写入方在两次加锁之间复活的 Key 不会被误删。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // Key -> Data
    private final Map<String, RedisData<?>> memoryDb = new HashMap<>();

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Lock readLock = rwLock.readLock();
    private final Lock writeLock = rwLock.writeLock();

    // 毫秒时钟，测试可以替换
    private final LongSupplier clock;

    public MemoryStorageEngine() {
        this(System::currentTimeMillis);
    }

    public MemoryStorageEngine(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public byte[] getString(String key) {
        RedisData<?> data = get(key);
        if (data == null || !(data.getData() instanceof byte[] value)) {
            return null;
        }
        return value;
    }

    @Override
    public RedisData<?> get(String key) {
        RedisData<?> data;
        readLock.lock();
        try {
            data = memoryDb.get(key);
            if (data == null) return null;
            if (!data.isExpired(clock.getAsLong())) return data;
        } finally {
            readLock.unlock();
        }

        // 惰性删除: 在独占锁内重新检查
        expireIfNeeded(key);
        return null;
    }

    private void expireIfNeeded(String key) {
        writeLock.lock();
        try {
            RedisData<?> current = memoryDb.get(key);
            if (current != null && current.isExpired(clock.getAsLong())) {
                memoryDb.remove(key);
                log.debug("Lazy expired key: {}", key);
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void putString(String key, byte[] value) {
        put(key, RedisData.ofString(value));
    }

    @Override
    public void put(String key, RedisData<?> data) {
        writeLock.lock();
        try {
            memoryDb.put(key, data);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean remove(String key) {
        writeLock.lock();
        try {
            return memoryDb.remove(key) != null;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public <T> T atomically(Supplier<T> action) {
        // 可重入: action 内部的 get/put/remove 会在同一线程上再次加锁
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        readLock.lock();
        try {
            return memoryDb.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Set<String> keys() {
        readLock.lock();
        try {
            return new HashSet<>(memoryDb.keySet());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long now() {
        return clock.getAsLong();
    }

    @Override
    public void flush() {
        writeLock.lock();
        try {
            memoryDb.clear();
        } finally {
            writeLock.unlock();
        }
    }
}
