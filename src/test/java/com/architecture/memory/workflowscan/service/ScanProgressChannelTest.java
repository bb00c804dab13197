package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.dto.ScanProgressSnapshot;
import com.architecture.memory.workflowscan.model.ScanStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanProgressChannelTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private static ScanProgressSnapshot snapshot(String scanId, String message) {
        return ScanProgressSnapshot.builder()
                .scanId(scanId)
                .status(ScanStatus.SCANNING)
                .message(message)
                .build();
    }

    @Test
    void publish_dropsOldestWhenFull() {
        ScanProgressChannel channel = new ScanProgressChannel(2, clock);
        channel.open("s1");

        channel.publish(snapshot("s1", "one"));
        channel.publish(snapshot("s1", "two"));
        channel.publish(snapshot("s1", "three"));

        assertThat(channel.drain("s1")).extracting(ScanProgressSnapshot::getMessage).containsExactly("two", "three");
        assertThat(channel.drain("s1")).isEmpty();
        assertThat(channel.latest("s1")).map(ScanProgressSnapshot::getMessage).contains("three");
    }

    @Test
    void publish_stampsMissingTimestamp() {
        ScanProgressChannel channel = new ScanProgressChannel(4, clock);

        channel.publish(snapshot("s1", "one"));

        assertThat(channel.latest("s1")).map(ScanProgressSnapshot::getTimestamp).contains(NOW);
    }

    @Test
    void unknownScanHasNoState() {
        ScanProgressChannel channel = new ScanProgressChannel(4, clock);

        assertThat(channel.latest("nope")).isEmpty();
        assertThat(channel.drain("nope")).isEmpty();
        assertThat(channel.isOpen("nope")).isFalse();
    }

    @Test
    void evictCompletedBefore_removesOnlyFinishedChannels() {
        ScanProgressChannel channel = new ScanProgressChannel(4, clock);
        channel.open("done");
        channel.open("running");
        channel.complete("done");

        assertThat(channel.isOpen("done")).isFalse();
        assertThat(channel.evictCompletedBefore(NOW)).isZero();
        assertThat(channel.evictCompletedBefore(NOW.plus(Duration.ofMinutes(1)))).isEqualTo(1);
        assertThat(channel.isOpen("running")).isTrue();
    }

    @Test
    void publish_isSafeFromManyThreads() throws Exception {
        ScanProgressChannel channel = new ScanProgressChannel(10_000, clock);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            int thread = t;
            pool.execute(() -> {
                for (int i = 0; i < 500; i++) {
                    channel.publish(snapshot("s1", thread + ":" + i));
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        List<ScanProgressSnapshot> drained = channel.drain("s1");
        assertThat(drained).hasSize(2000);
    }

    @Test
    void rejectsZeroCapacity() {
        assertThatThrownBy(() -> new ScanProgressChannel(0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
