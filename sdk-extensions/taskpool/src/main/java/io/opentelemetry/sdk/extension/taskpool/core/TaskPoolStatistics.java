/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import io.opentelemetry.sdk.extension.taskpool.TaskPoolStatus;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务池统计信息。
 *
 * <p>负责任务计数和周期性状态日志，包括：
 *
 * <ul>
 *   <li>提交 / 拒绝计数
 *   <li>完成 / 失败 / 取消 / 丢弃计数
 *   <li>周期性状态日志
 * </ul>
 *
 * <p>计数单调递增，重启任务池后不清零。
 */
public final class TaskPoolStatistics {

  private static final Logger logger = Logger.getLogger(TaskPoolStatistics.class.getName());

  /** 默认状态日志输出间隔（毫秒） */
  public static final long DEFAULT_STATUS_LOG_INTERVAL_MS = 60_000;

  private final AtomicLong submittedCount = new AtomicLong(0);
  private final AtomicLong rejectedCount = new AtomicLong(0);
  private final AtomicLong completedCount = new AtomicLong(0);
  private final AtomicLong failedCount = new AtomicLong(0);
  private final AtomicLong cancelledCount = new AtomicLong(0);
  private final AtomicLong discardedCount = new AtomicLong(0);
  private final AtomicLong lastStatusLogTime;
  private final long statusLogIntervalMs;

  /** 创建统计信息（默认日志间隔） */
  public TaskPoolStatistics() {
    this(DEFAULT_STATUS_LOG_INTERVAL_MS);
  }

  /**
   * 创建统计信息（自定义日志间隔）
   *
   * @param statusLogIntervalMs 状态日志间隔（毫秒），不大于 0 时关闭周期日志
   */
  public TaskPoolStatistics(long statusLogIntervalMs) {
    this.statusLogIntervalMs = statusLogIntervalMs;
    this.lastStatusLogTime = new AtomicLong(System.currentTimeMillis());
  }

  public void recordSubmitted() {
    submittedCount.incrementAndGet();
  }

  public void recordRejected() {
    rejectedCount.incrementAndGet();
  }

  /**
   * 记录被丢弃的任务
   *
   * @param count 丢弃数量
   */
  public void recordDiscarded(int count) {
    discardedCount.addAndGet(count);
  }

  /**
   * 记录任务执行结果
   *
   * @param outcome 执行结果
   */
  public void recordOutcome(PoolTask.Outcome outcome) {
    switch (outcome) {
      case SUCCEEDED:
        completedCount.incrementAndGet();
        break;
      case FAILED:
        completedCount.incrementAndGet();
        failedCount.incrementAndGet();
        break;
      case SKIPPED:
      default:
        cancelledCount.incrementAndGet();
        break;
    }
  }

  public long getSubmittedCount() {
    return submittedCount.get();
  }

  public long getRejectedCount() {
    return rejectedCount.get();
  }

  /**
   * 获取已执行完毕的任务数（含失败）
   *
   * @return 计数
   */
  public long getCompletedCount() {
    return completedCount.get();
  }

  public long getFailedCount() {
    return failedCount.get();
  }

  /**
   * 获取开始执行前即被调用方取消、因而跳过的任务数
   *
   * @return 计数
   */
  public long getCancelledCount() {
    return cancelledCount.get();
  }

  public long getDiscardedCount() {
    return discardedCount.get();
  }

  /**
   * 周期性输出状态日志（如果满足时间间隔条件）
   *
   * @param statusSupplier 状态快照来源，仅在需要输出时调用
   */
  public void logPeriodicStatusIfNeeded(Supplier<TaskPoolStatus> statusSupplier) {
    if (statusLogIntervalMs <= 0) {
      return;
    }
    long now = System.currentTimeMillis();
    long lastLog = lastStatusLogTime.get();
    if (now - lastLog >= statusLogIntervalMs && lastStatusLogTime.compareAndSet(lastLog, now)) {
      logStatus(statusSupplier.get());
    }
  }

  /**
   * 强制输出状态日志
   *
   * @param status 状态快照
   */
  public void logStatus(TaskPoolStatus status) {
    logger.log(
        Level.INFO,
        "Task pool status - {0}, submitted: {1}, completed: {2}, failed: {3}, cancelled: {4}, discarded: {5}, rejected: {6}",
        new Object[] {
          status,
          submittedCount.get(),
          completedCount.get(),
          failedCount.get(),
          cancelledCount.get(),
          discardedCount.get(),
          rejectedCount.get()
        });
  }
}
