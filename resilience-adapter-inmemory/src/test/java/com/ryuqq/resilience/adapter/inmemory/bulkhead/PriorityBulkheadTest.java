package com.ryuqq.resilience.adapter.inmemory.bulkhead;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.PriorityLevel;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PriorityBulkhead 대기열 순서/인터럽트 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class PriorityBulkheadTest {

    private static final DependencyName NAME = DependencyName.of("postgres");

    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        callers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    @Test
    void priorityEnabled_높은_우선순위가_먼저_permit을_받음() throws Exception {
        // given: permit 1개를 점유
        PriorityBulkhead bulkhead = new PriorityBulkhead(NAME, new BulkheadConfig(1, 10, 5000, true));
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = hold(bulkhead, release);
        List<String> order = new CopyOnWriteArrayList<>();

        // when: LOW, NORMAL, CRITICAL 순으로 도착
        Future<?> low = enqueue(bulkhead, PriorityLevel.LOW, "LOW", order, 1);
        Future<?> normal = enqueue(bulkhead, PriorityLevel.NORMAL, "NORMAL", order, 2);
        Future<?> critical = enqueue(bulkhead, PriorityLevel.CRITICAL, "CRITICAL", order, 3);
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        low.get(5, TimeUnit.SECONDS);
        normal.get(5, TimeUnit.SECONDS);
        critical.get(5, TimeUnit.SECONDS);

        // then
        assertThat(order).containsExactly("CRITICAL", "NORMAL", "LOW");
    }

    @Test
    void 같은_우선순위는_도착순() throws Exception {
        // given
        PriorityBulkhead bulkhead = new PriorityBulkhead(NAME, new BulkheadConfig(1, 10, 5000, true));
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = hold(bulkhead, release);
        List<String> order = new CopyOnWriteArrayList<>();

        // when
        Future<?> first = enqueue(bulkhead, PriorityLevel.HIGH, "first", order, 1);
        Future<?> second = enqueue(bulkhead, PriorityLevel.HIGH, "second", order, 2);
        Future<?> third = enqueue(bulkhead, PriorityLevel.HIGH, "third", order, 3);
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        third.get(5, TimeUnit.SECONDS);

        // then
        assertThat(order).containsExactly("first", "second", "third");
    }

    @Test
    void priorityDisabled_우선순위_무시하고_도착순() throws Exception {
        // given
        PriorityBulkhead bulkhead = new PriorityBulkhead(NAME, new BulkheadConfig(1, 10, 5000, false));
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = hold(bulkhead, release);
        List<String> order = new CopyOnWriteArrayList<>();

        // when
        Future<?> low = enqueue(bulkhead, PriorityLevel.LOW, "LOW", order, 1);
        Future<?> critical = enqueue(bulkhead, PriorityLevel.CRITICAL, "CRITICAL", order, 2);
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        low.get(5, TimeUnit.SECONDS);
        critical.get(5, TimeUnit.SECONDS);

        // then
        assertThat(order).containsExactly("LOW", "CRITICAL");
    }

    @Test
    void 대기_중_인터럽트되면_대기열에서_제거되고_플래그_복원() throws Exception {
        // given
        PriorityBulkhead bulkhead = new PriorityBulkhead(NAME, new BulkheadConfig(1, 10, 10_000, true));
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = hold(bulkhead, release);
        AtomicBoolean interruptFlag = new AtomicBoolean();
        AtomicBoolean workRan = new AtomicBoolean();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread waiter = new Thread(() -> {
            try {
                bulkhead.execute(() -> {
                    workRan.set(true);
                    return "never";
                });
            } catch (Exception e) {
                failure.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        awaitQueued(bulkhead, 1);

        // when
        waiter.interrupt();
        waiter.join(5000);

        // then
        assertThat(failure.get()).isInstanceOf(InterruptedException.class);
        assertThat(interruptFlag).isTrue();
        assertThat(workRan).isFalse();
        assertThat(bulkhead.getQueuedCalls()).isZero();
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertThat(bulkhead.getCurrentConcurrency()).isZero();
        assertThat(bulkhead.execute(() -> "after")).isEqualTo("after");
    }

    @Test
    void 큐_크기_0이면_permit_부족시_즉시_거부() throws Exception {
        // given
        PriorityBulkhead bulkhead = new PriorityBulkhead(NAME, new BulkheadConfig(1, 0, 5000, true));
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = hold(bulkhead, release);

        // when & then
        assertThatThrownBy(() -> bulkhead.execute(() -> "x", PriorityLevel.CRITICAL))
            .hasMessageContaining("postgres");
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertThat(bulkhead.getStats().rejectionRatePercent()).isEqualTo(50.0);
    }

    private Future<String> hold(PriorityBulkhead bulkhead, CountDownLatch release) throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        Future<String> holder = callers.submit(() -> bulkhead.execute(() -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return "held";
        }));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        return holder;
    }

    private Future<?> enqueue(PriorityBulkhead bulkhead, PriorityLevel priority, String label,
                              List<String> order, int expectedQueued) throws InterruptedException {
        Future<?> future = callers.submit(() -> bulkhead.execute(() -> {
            order.add(label);
            return null;
        }, priority));
        awaitQueued(bulkhead, expectedQueued);
        return future;
    }

    private void awaitQueued(PriorityBulkhead bulkhead, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (bulkhead.getQueuedCalls() != expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Expected " + expected + " queued calls but was " + bulkhead.getQueuedCalls());
            }
            Thread.sleep(2);
        }
    }
}
