/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import io.opentelemetry.sdk.extension.taskpool.ShutdownMode;
import io.opentelemetry.sdk.extension.taskpool.TaskPoolStatus;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * 任务队列
 *
 * <p>FIFO 队列及其同步状态：
 *
 * <ul>
 *   <li>队列本身和运行标志由同一把锁保护
 *   <li>待执行数和忙碌线程数为原子计数，可无锁读取，但只在持锁时随队列结构一起变更（忙碌数的递减除外）
 *   <li>"有任务可取"条件变量用于唤醒工作线程
 * </ul>
 *
 * <p>取出任务时先递增忙碌数、再递减待执行数，因此按"先待执行数、后忙碌数"的顺序无锁读取时，
 * 不会在任务从队列转移到工作线程的间隙误判为已排空。
 */
public final class TaskQueue {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition workAvailable = lock.newCondition();

  private Deque<PoolTask<?>> tasks = new ArrayDeque<>();
  private volatile boolean running;

  private final AtomicInteger pendingCount = new AtomicInteger(0);
  private final AtomicInteger busyCount = new AtomicInteger(0);

  /**
   * 打开队列，开始接受任务
   *
   * @return 调用前是否处于关闭状态
   */
  public boolean open() {
    lock.lock();
    try {
      if (running) {
        return false;
      }
      running = true;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 入队并唤醒一个等待中的工作线程
   *
   * @param task 任务
   * @return 队列已关闭时返回 false，任务不会入队
   */
  public boolean offer(PoolTask<?> task) {
    lock.lock();
    try {
      if (!running) {
        return false;
      }
      tasks.addLast(task);
      pendingCount.incrementAndGet();
      workAvailable.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 取出下一个任务，队列为空时阻塞
   *
   * <p>成功取出时忙碌数加一，调用方执行完毕后必须调用 {@link #taskFinished()}。
   * 线程中断不会打断等待。
   *
   * @return 下一个任务；队列已关闭且为空时返回 null，工作线程应退出
   */
  @Nullable
  public PoolTask<?> take() {
    lock.lock();
    try {
      while (running && tasks.isEmpty()) {
        workAvailable.awaitUninterruptibly();
      }
      PoolTask<?> task = tasks.pollFirst();
      if (task == null) {
        return null;
      }
      busyCount.incrementAndGet();
      pendingCount.decrementAndGet();
      return task;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 标记一个任务执行完毕
   *
   * @return 剩余忙碌线程数
   */
  public int taskFinished() {
    return busyCount.decrementAndGet();
  }

  /**
   * 关闭队列并唤醒所有工作线程
   *
   * <p>可重复调用。{@link ShutdownMode#DISCARD_PENDING_TASKS} 模式下原子地换入空队列，
   * 已被取出的任务不受影响。
   *
   * @param mode 关闭模式
   * @return 被丢弃的任务（按入队顺序），未丢弃时为空列表
   */
  public List<PoolTask<?>> close(ShutdownMode mode) {
    List<PoolTask<?>> discarded = Collections.emptyList();
    lock.lock();
    try {
      running = false;
      if (mode == ShutdownMode.DISCARD_PENDING_TASKS && !tasks.isEmpty()) {
        discarded = new ArrayList<>(tasks);
        tasks = new ArrayDeque<>();
        pendingCount.addAndGet(-discarded.size());
      }
      workAvailable.signalAll();
    } finally {
      lock.unlock();
    }
    return discarded;
  }

  /**
   * 是否已排空：队列为空且没有线程在执行任务
   *
   * @return 是否已排空
   */
  public boolean isDrained() {
    // 读取顺序与 take() 中的更新顺序相反
    return pendingCount.get() == 0 && busyCount.get() == 0;
  }

  public boolean isRunning() {
    return running;
  }

  public int size() {
    return pendingCount.get();
  }

  public int getBusyCount() {
    return busyCount.get();
  }

  /**
   * 在队列锁内生成状态快照
   *
   * @param totalThreads 当前工作线程总数
   * @return 状态快照
   */
  public TaskPoolStatus snapshot(int totalThreads) {
    lock.lock();
    try {
      return TaskPoolStatus.create(totalThreads, busyCount.get(), tasks.size(), running);
    } finally {
      lock.unlock();
    }
  }
}
