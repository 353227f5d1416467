package com.certmanager.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One mutex per category of mutating workflow. Workflows of the same category run one at a time,
 * different categories may overlap.
 */
@Slf4j
@Component
public class OperationLocks {

    public enum Category {
        CERTIFICATE_CREATE,
        CERTIFICATE_UPDATE,
        CERTIFICATE_DELETE,
        ACME_RENEWAL
    }

    private final Map<Category, ReentrantLock> locks = new EnumMap<>(Category.class);

    public OperationLocks() {
        for (Category category : Category.values()) {
            locks.put(category, new ReentrantLock());
        }
    }

    /**
     * Blocks until the category is free.
     */
    public Guard acquire(Category category) {
        ReentrantLock lock = locks.get(category);
        lock.lock();
        return new Guard(category, lock);
    }

    /**
     * Takes the category lock only if nobody holds it.
     */
    public Optional<Guard> tryAcquire(Category category) {
        ReentrantLock lock = locks.get(category);
        if (!lock.tryLock()) {
            log.debug("{} already in progress", category);
            return Optional.empty();
        }
        return Optional.of(new Guard(category, lock));
    }

    public boolean isHeld(Category category) {
        return locks.get(category).isLocked();
    }

    /**
     * Releases the category lock on close. Closing twice is a no-op.
     */
    public static final class Guard implements AutoCloseable {
        private final Category category;
        private final ReentrantLock lock;
        private boolean released;

        private Guard(Category category, ReentrantLock lock) {
            this.category = category;
            this.lock = lock;
        }

        public Category getCategory() {
            return category;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
