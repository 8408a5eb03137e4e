/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoy.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Pending work ordered by a switchable {@link QueueMode}.
 * <p>
 * All operations are synchronized on the queue, so a dispatcher and a retry timer may both
 * add items. In random mode {@link #peek()} picks the item that the following {@link #next()}
 * returns, unless the queue changes in between.
 *
 * @param <T> the payload type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class ExecutionQueue<T> {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionQueue.class);

    private final List<Entry<T>> entries = new ArrayList<>();
    private final Function<T, String> payloadKey;
    private final Random random;
    private QueueMode mode;
    private long nextSequence;
    private int randomPick = -1;

    public ExecutionQueue() {
        this(QueueMode.FIFO);
    }

    public ExecutionQueue(QueueMode mode) {
        this(mode, Object::toString);
    }

    /**
     * @param mode initial ordering mode
     * @param payloadKey extracts the key matched by {@link #removeByPayloadKey(String)}
     */
    public ExecutionQueue(QueueMode mode, Function<T, String> payloadKey) {
        this(mode, payloadKey, new Random());
    }

    public ExecutionQueue(QueueMode mode, Function<T, String> payloadKey, Random random) {
        this.mode = Objects.requireNonNull(mode, "Queue mode cannot be null");
        this.payloadKey = Objects.requireNonNull(payloadKey, "Payload key function cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    /**
     * Add an item according to the current mode. The stored item is stamped with the current time.
     *
     * @return the item as stored
     */
    public synchronized QueueItem<T> add(QueueItem<T> item) {
        Objects.requireNonNull(item, "Queue item cannot be null");
        QueueItem<T> stamped = item.withAddedAt(Instant.now());
        Entry<T> entry = new Entry<>(stamped, nextSequence++);

        switch (mode) {
            case LIFO:
                entries.add(0, entry);
                break;
            case PRIORITY:
                entries.add(priorityInsertIndex(stamped.getPriority()), entry);
                break;
            case FIFO:
            case RANDOM:
            default:
                entries.add(entry);
                break;
        }
        randomPick = -1;
        logger.debug("Queued item {} ({}), size now {}", stamped.getId(), stamped.getPriority().getValue(), entries.size());
        return stamped;
    }

    public QueueItem<T> add(String id, T payload, QueuePriority priority) {
        return add(QueueItem.of(id, payload, priority));
    }

    public synchronized void addAll(List<QueueItem<T>> items) {
        items.forEach(this::add);
    }

    /**
     * Remove and return the next item per the current mode.
     */
    public synchronized Optional<QueueItem<T>> next() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        int index = mode == QueueMode.RANDOM ? randomIndex() : 0;
        randomPick = -1;
        return Optional.of(entries.remove(index).item());
    }

    /**
     * The item {@link #next()} would return, without removing it.
     */
    public synchronized Optional<QueueItem<T>> peek() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        int index = mode == QueueMode.RANDOM ? randomIndex() : 0;
        return Optional.of(entries.get(index).item());
    }

    public synchronized boolean remove(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        entries.remove(index);
        randomPick = -1;
        return true;
    }

    /**
     * Remove every item whose payload key equals {@code key}.
     *
     * @return number of items removed
     */
    public synchronized int removeByPayloadKey(String key) {
        int removed = 0;
        Iterator<Entry<T>> iterator = entries.iterator();
        while (iterator.hasNext()) {
            if (Objects.equals(payloadKey.apply(iterator.next().item().getPayload()), key)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            randomPick = -1;
        }
        return removed;
    }

    public synchronized boolean moveToFront(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        entries.add(0, entries.remove(index));
        randomPick = -1;
        return true;
    }

    public synchronized boolean moveToBack(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        entries.add(entries.remove(index));
        randomPick = -1;
        return true;
    }

    /**
     * Change an item's priority, re-sorting when in priority mode.
     */
    public synchronized boolean updatePriority(String id, QueuePriority priority) {
        Objects.requireNonNull(priority, "Priority cannot be null");
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        Entry<T> entry = entries.get(index);
        entries.set(index, new Entry<>(entry.item().withPriority(priority), entry.sequence()));
        if (mode == QueueMode.PRIORITY) {
            sortByPriority();
        }
        randomPick = -1;
        return true;
    }

    /**
     * Switch mode and re-order existing items to match it. Random mode keeps the current order.
     */
    public synchronized void setMode(QueueMode newMode) {
        this.mode = Objects.requireNonNull(newMode, "Queue mode cannot be null");
        switch (newMode) {
            case FIFO:
                entries.sort(Comparator.comparingLong(Entry<T>::sequence));
                break;
            case LIFO:
                entries.sort(Comparator.comparingLong(Entry<T>::sequence).reversed());
                break;
            case PRIORITY:
                sortByPriority();
                break;
            case RANDOM:
            default:
                break;
        }
        randomPick = -1;
        logger.debug("Queue mode set to {}", newMode.getValue());
    }

    public synchronized QueueMode getMode() {
        return mode;
    }

    public synchronized void shuffle() {
        Collections.shuffle(entries, random);
        randomPick = -1;
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Snapshot of all pending items in dispatch order (random mode: storage order).
     */
    public synchronized List<QueueItem<T>> getAll() {
        return entries.stream().map(Entry::item).toList();
    }

    public synchronized List<QueueItem<T>> filter(Predicate<QueueItem<T>> predicate) {
        return entries.stream().map(Entry::item).filter(predicate).toList();
    }

    public synchronized Optional<QueueItem<T>> find(Predicate<QueueItem<T>> predicate) {
        return entries.stream().map(Entry::item).filter(predicate).findFirst();
    }

    public synchronized void clear() {
        entries.clear();
        randomPick = -1;
    }

    public synchronized QueueStats getStats() {
        Map<QueuePriority, Integer> byPriority = new EnumMap<>(QueuePriority.class);
        for (QueuePriority priority : QueuePriority.values()) {
            byPriority.put(priority, 0);
        }
        long now = Instant.now().toEpochMilli();
        long oldestAge = 0;
        for (Entry<T> entry : entries) {
            byPriority.merge(entry.item().getPriority(), 1, Integer::sum);
            oldestAge = Math.max(oldestAge, now - entry.item().getAddedAt().toEpochMilli());
        }
        return new QueueStats(entries.size(), mode, byPriority, oldestAge);
    }

    private int priorityInsertIndex(QueuePriority priority) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).item().getPriority().getRank() > priority.getRank()) {
                return i;
            }
        }
        return entries.size();
    }

    private void sortByPriority() {
        entries.sort(Comparator.<Entry<T>>comparingInt(e -> e.item().getPriority().getRank())
                .thenComparingLong(Entry::sequence));
    }

    private int randomIndex() {
        if (randomPick < 0 || randomPick >= entries.size()) {
            randomPick = random.nextInt(entries.size());
        }
        return randomPick;
    }

    private int indexOf(String id) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).item().getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private record Entry<T>(QueueItem<T> item, long sequence) {
    }

    @Override
    public synchronized String toString() {
        return "ExecutionQueue{" +
                "mode=" + mode +
                ", size=" + entries.size() +
                '}';
    }
}
