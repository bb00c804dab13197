package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.config.ScannerProperties;
import com.architecture.memory.workflowscan.dto.ScanProgressSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hand-off of progress snapshots from scanning threads to whoever polls for them. Each scan has
 * a bounded queue (oldest snapshot dropped when full) plus its last known snapshot, so a late
 * reader still sees the current state.
 */
@Component
@Slf4j
public class ScanProgressChannel {

    private final Map<String, ScanChannel> channels = new ConcurrentHashMap<>();
    private final int capacity;
    private final Clock clock;

    @Autowired
    public ScanProgressChannel(ScannerProperties properties) {
        this(properties.getProgress().getChannelCapacity(), Clock.systemUTC());
    }

    public ScanProgressChannel(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be at least 1");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public void open(String scanId) {
        channels.putIfAbsent(scanId, new ScanChannel());
    }

    /**
     * Never blocks. Snapshots published after {@link #complete} are still recorded as latest.
     */
    public void publish(ScanProgressSnapshot snapshot) {
        ScanProgressSnapshot stamped = snapshot.getTimestamp() != null
                ? snapshot
                : snapshot.toBuilder().timestamp(clock.instant()).build();
        ScanChannel channel = channels.computeIfAbsent(stamped.getScanId(), id -> new ScanChannel());
        int dropped = channel.offer(stamped, capacity);
        if (dropped > 0) {
            log.debug("[{}] Progress queue full, dropped oldest snapshot", stamped.getScanId());
        }
    }

    /**
     * Queued snapshots in publication order; the queue is empty afterwards.
     */
    public List<ScanProgressSnapshot> drain(String scanId) {
        ScanChannel channel = channels.get(scanId);
        return channel != null ? channel.drain() : List.of();
    }

    public Optional<ScanProgressSnapshot> latest(String scanId) {
        ScanChannel channel = channels.get(scanId);
        return channel != null ? Optional.ofNullable(channel.latest) : Optional.empty();
    }

    public void complete(String scanId) {
        ScanChannel channel = channels.get(scanId);
        if (channel != null) {
            channel.completedAt = clock.instant();
        }
    }

    public boolean isOpen(String scanId) {
        ScanChannel channel = channels.get(scanId);
        return channel != null && channel.completedAt == null;
    }

    /**
     * Remove channels of scans that finished before {@code cutoff}.
     *
     * @return number of channels removed
     */
    public int evictCompletedBefore(Instant cutoff) {
        int removed = 0;
        Iterator<Map.Entry<String, ScanChannel>> it = channels.entrySet().iterator();
        while (it.hasNext()) {
            Instant completedAt = it.next().getValue().completedAt;
            if (completedAt != null && completedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private static final class ScanChannel {
        private final Deque<ScanProgressSnapshot> queue = new ArrayDeque<>();
        private volatile ScanProgressSnapshot latest;
        private volatile Instant completedAt;

        synchronized int offer(ScanProgressSnapshot snapshot, int capacity) {
            int dropped = 0;
            while (queue.size() >= capacity) {
                queue.pollFirst();
                dropped++;
            }
            queue.addLast(snapshot);
            latest = snapshot;
            return dropped;
        }

        synchronized List<ScanProgressSnapshot> drain() {
            List<ScanProgressSnapshot> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        }
    }
}
