/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * 完成跟踪器
 *
 * <p>仅供 waitAll 使用的等待/通知机制，与"有任务可取"信号分离。使用独立的锁，
 * 调用方不得在持有队列锁时进入本类方法。
 */
public final class CompletionTracker {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition drained = lock.newCondition();
  private final BooleanSupplier drainedCondition;

  /**
   * 创建完成跟踪器
   *
   * @param drainedCondition 排空条件，必须可无锁求值
   */
  public CompletionTracker(BooleanSupplier drainedCondition) {
    this.drainedCondition = drainedCondition;
  }

  /**
   * 若已排空则唤醒所有等待者
   *
   * <p>锁外的检查只是快速路径；持锁后的二次检查才决定是否通知，
   * 以排除两次检查之间其他线程取走任务的情况。
   */
  public void signalIfDrained() {
    if (!drainedCondition.getAsBoolean()) {
      return;
    }
    lock.lock();
    try {
      if (drainedCondition.getAsBoolean()) {
        drained.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * 阻塞直到排空
   *
   * <p>不响应中断；若等待期间被中断，返回前恢复中断标记。
   */
  public void awaitDrained() {
    if (drainedCondition.getAsBoolean()) {
      return;
    }
    lock.lock();
    try {
      while (!drainedCondition.getAsBoolean()) {
        drained.awaitUninterruptibly();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * 阻塞直到排空或超时
   *
   * @param timeout 超时时间
   * @param unit 时间单位
   * @return 是否已排空
   * @throws InterruptedException 等待期间被中断
   */
  public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
    if (drainedCondition.getAsBoolean()) {
      return true;
    }
    long remainingNanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (!drainedCondition.getAsBoolean()) {
        if (remainingNanos <= 0L) {
          return false;
        }
        remainingNanos = drained.awaitNanos(remainingNanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }
}
