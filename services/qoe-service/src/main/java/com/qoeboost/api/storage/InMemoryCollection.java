package com.qoeboost.api.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * One record collection of the fallback store.
 *
 * Every access goes through a single lock: id assignment, the optional
 * precondition of an insert, and the append happen as one step, and readers
 * copy the backing list under the same lock. Stored instances are never
 * mutated in place (updates replace the element), and every record handed
 * out is a fresh copy.
 *
 * @param <T> record type
 */
class InMemoryCollection<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<T> records = new ArrayList<>();
    private final BiFunction<T, Long, T> withId;
    private final Function<T, Long> idOf;
    private final UnaryOperator<T> copy;
    private long nextId = 1;

    InMemoryCollection(BiFunction<T, Long, T> withId, Function<T, Long> idOf, UnaryOperator<T> copy) {
        this.withId = withId;
        this.idOf = idOf;
        this.copy = copy;
    }

    T insert(T record) {
        return insert(record, existing -> { });
    }

    /**
     * @param precondition runs under the lock against the current records and
     *                     may throw to reject the insert; no id is consumed then
     */
    T insert(T record, Consumer<List<T>> precondition) {
        lock.lock();
        try {
            precondition.accept(records);
            T stored = withId.apply(record, nextId);
            nextId++;
            records.add(stored);
            return copy.apply(stored);
        } finally {
            lock.unlock();
        }
    }

    Optional<T> findFirst(Predicate<T> filter) {
        lock.lock();
        try {
            return records.stream().filter(filter).findFirst().map(copy);
        } finally {
            lock.unlock();
        }
    }

    Optional<T> replace(Long id, UnaryOperator<T> change) {
        lock.lock();
        try {
            for (int i = 0; i < records.size(); i++) {
                T current = records.get(i);
                if (idOf.apply(current).equals(id)) {
                    T updated = change.apply(copy.apply(current));
                    records.set(i, updated);
                    return Optional.of(copy.apply(updated));
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    List<T> select(Predicate<T> filter, long offset, long limit) {
        List<T> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(records);
        } finally {
            lock.unlock();
        }
        return snapshot.stream()
                .filter(filter)
                .skip(offset)
                .limit(limit)
                .map(copy)
                .collect(Collectors.toList());
    }

    List<T> selectAll(Predicate<T> filter) {
        return select(filter, 0, Long.MAX_VALUE);
    }
}
