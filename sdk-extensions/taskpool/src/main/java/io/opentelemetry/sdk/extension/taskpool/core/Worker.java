/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import io.opentelemetry.sdk.extension.taskpool.TaskPoolStatus;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 工作线程主循环
 *
 * <p>状态：Idle → Dequeuing → Executing → Idle，终态 Retired。仅当队列已关闭且为空时退出，
 * 因此关闭前入队的任务在等待模式下都会被执行。执行任务体时不持有队列锁，任务内可以再次提交任务。
 */
public final class Worker implements Runnable {

  private static final Logger logger = Logger.getLogger(Worker.class.getName());

  /** 当前线程所属的任务池，非工作线程为 null */
  private static final ThreadLocal<Object> currentOwner = new ThreadLocal<>();

  private final Object owner;
  private final TaskQueue queue;
  private final CompletionTracker completionTracker;
  private final TaskPoolStatistics statistics;
  private final Supplier<TaskPoolStatus> statusSupplier;

  /**
   * 创建工作线程主循环
   *
   * @param owner 所属任务池
   * @param queue 任务队列
   * @param completionTracker 完成跟踪器
   * @param statistics 统计信息
   * @param statusSupplier 状态快照来源（用于周期日志）
   */
  public Worker(
      Object owner,
      TaskQueue queue,
      CompletionTracker completionTracker,
      TaskPoolStatistics statistics,
      Supplier<TaskPoolStatus> statusSupplier) {
    this.owner = owner;
    this.queue = queue;
    this.completionTracker = completionTracker;
    this.statistics = statistics;
    this.statusSupplier = statusSupplier;
  }

  /**
   * 当前线程是否为指定任务池的工作线程
   *
   * @param owner 任务池
   * @return 是否为其工作线程
   */
  public static boolean isWorkerOf(@Nullable Object owner) {
    return owner != null && currentOwner.get() == owner;
  }

  @Override
  public void run() {
    currentOwner.set(owner);
    try {
      PoolTask<?> task;
      while ((task = queue.take()) != null) {
        // 清除上一个任务遗留的中断标记
        Thread.interrupted();
        runTask(task);
        statistics.logPeriodicStatusIfNeeded(statusSupplier);
      }
    } finally {
      currentOwner.remove();
      logger.log(Level.FINE, "Worker {0} retired", Thread.currentThread().getName());
    }
  }

  private void runTask(PoolTask<?> task) {
    try {
      statistics.recordOutcome(task.execute());
    } finally {
      if (queue.taskFinished() == 0) {
        completionTracker.signalIfDrained();
      }
    }
  }
}
