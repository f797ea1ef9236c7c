/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.opentelemetry.sdk.extension.taskpool.ShutdownMode;
import io.opentelemetry.sdk.extension.taskpool.TaskPoolStatus;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskQueueTest {

  private TaskQueue queue;

  @BeforeEach
  void setUp() {
    queue = new TaskQueue();
    queue.open();
  }

  private static PoolTask<String> task(String value) {
    return new PoolTask<>(() -> value);
  }

  @Test
  void openIsIdempotent() {
    assertThat(queue.isRunning()).isTrue();
    assertThat(queue.open()).isFalse();
  }

  @Test
  void offerRejectedWhenClosed() {
    queue.close(ShutdownMode.WAIT_FOR_ALL_TASKS);

    assertThat(queue.offer(task("a"))).isFalse();
    assertThat(queue.size()).isZero();
  }

  @Test
  void takeReturnsTasksInInsertionOrder() {
    PoolTask<String> first = task("first");
    PoolTask<String> second = task("second");
    PoolTask<String> third = task("third");
    queue.offer(first);
    queue.offer(second);
    queue.offer(third);

    assertThat(queue.take()).isSameAs(first);
    assertThat(queue.take()).isSameAs(second);
    assertThat(queue.take()).isSameAs(third);
  }

  @Test
  void takeTracksBusyAndPendingCounts() {
    queue.offer(task("a"));
    queue.offer(task("b"));
    assertThat(queue.size()).isEqualTo(2);
    assertThat(queue.getBusyCount()).isZero();

    queue.take();
    assertThat(queue.size()).isEqualTo(1);
    assertThat(queue.getBusyCount()).isEqualTo(1);

    assertThat(queue.taskFinished()).isZero();
    assertThat(queue.getBusyCount()).isZero();
  }

  @Test
  void isDrainedOnlyWhenEmptyAndIdle() {
    assertThat(queue.isDrained()).isTrue();

    queue.offer(task("a"));
    assertThat(queue.isDrained()).isFalse();

    queue.take();
    assertThat(queue.isDrained()).isFalse();

    queue.taskFinished();
    assertThat(queue.isDrained()).isTrue();
  }

  @Test
  void closeInWaitModeKeepsPendingTasks() {
    PoolTask<String> pending = task("a");
    queue.offer(pending);

    List<PoolTask<?>> discarded = queue.close(ShutdownMode.WAIT_FOR_ALL_TASKS);

    assertThat(discarded).isEmpty();
    assertThat(queue.isRunning()).isFalse();
    assertThat(queue.take()).isSameAs(pending);
    queue.taskFinished();
    assertThat(queue.take()).isNull();
  }

  @Test
  void closeInDiscardModeSwapsOutPendingTasks() {
    PoolTask<String> first = task("a");
    PoolTask<String> second = task("b");
    queue.offer(first);
    queue.offer(second);

    List<PoolTask<?>> discarded = queue.close(ShutdownMode.DISCARD_PENDING_TASKS);

    assertThat(discarded).containsExactly(first, second);
    assertThat(queue.size()).isZero();
    assertThat(queue.take()).isNull();
  }

  @Test
  void closeInDiscardModeLeavesTakenTasksBusy() {
    queue.offer(task("a"));
    queue.offer(task("b"));
    queue.take();

    List<PoolTask<?>> discarded = queue.close(ShutdownMode.DISCARD_PENDING_TASKS);

    assertThat(discarded).hasSize(1);
    assertThat(queue.getBusyCount()).isEqualTo(1);
    assertThat(queue.isDrained()).isFalse();
  }

  @Test
  void blockedTakeIsWokenByOffer() throws InterruptedException {
    AtomicReference<PoolTask<?>> taken = new AtomicReference<>();
    Thread consumer = new Thread(() -> taken.set(queue.take()), "queue-consumer");
    consumer.start();

    await().atMost(Duration.ofSeconds(5)).until(() -> consumer.getState() == Thread.State.WAITING);
    PoolTask<String> offered = task("a");
    queue.offer(offered);

    consumer.join(5_000);
    assertThat(consumer.isAlive()).isFalse();
    assertThat(taken.get()).isSameAs(offered);
  }

  @Test
  void blockedTakeReturnsNullOnClose() throws InterruptedException {
    AtomicReference<PoolTask<?>> taken = new AtomicReference<>(task("sentinel"));
    Thread consumer = new Thread(() -> taken.set(queue.take()), "queue-consumer");
    consumer.start();

    await().atMost(Duration.ofSeconds(5)).until(() -> consumer.getState() == Thread.State.WAITING);
    queue.close(ShutdownMode.WAIT_FOR_ALL_TASKS);

    consumer.join(5_000);
    assertThat(consumer.isAlive()).isFalse();
    assertThat(taken.get()).isNull();
  }

  @Test
  void snapshotReflectsQueueState() {
    queue.offer(task("a"));
    queue.offer(task("b"));
    queue.take();

    TaskPoolStatus status = queue.snapshot(4);

    assertThat(status.getTotalThreads()).isEqualTo(4);
    assertThat(status.getBusyThreads()).isEqualTo(1);
    assertThat(status.getIdleThreads()).isEqualTo(3);
    assertThat(status.getPendingTasks()).isEqualTo(1);
    assertThat(status.isRunning()).isTrue();
  }
}
