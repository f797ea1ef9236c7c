/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.sdk.extension.taskpool.TaskPool;
import io.opentelemetry.sdk.extension.taskpool.TaskPoolStatus;
import io.opentelemetry.sdk.extension.taskpool.core.TaskPoolStatistics;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务池指标
 *
 * <p>以异步 instrument 的形式把任务池状态和统计信息暴露给 OpenTelemetry：
 *
 * <ul>
 *   <li>{@code taskpool.threads}：工作线程数，按 {@code state}（busy / idle）区分
 *   <li>{@code taskpool.tasks.pending}：等待执行的任务数
 *   <li>{@code taskpool.tasks.completed}：已执行完毕的任务数，按 {@code outcome}（success / failure）区分
 *   <li>{@code taskpool.tasks.discarded}：关闭时丢弃的任务数
 *   <li>{@code taskpool.tasks.rejected}：被拒绝的提交数
 * </ul>
 *
 * <p>回调只读取状态快照和统计计数，不参与任务池的生命周期加锁。
 */
public final class TaskPoolMetrics implements Closeable {

  private static final Logger logger = Logger.getLogger(TaskPoolMetrics.class.getName());

  /** Instrumentation scope 名称 */
  public static final String INSTRUMENTATION_SCOPE_NAME = "io.opentelemetry.sdk.extension.taskpool";

  public static final AttributeKey<String> POOL_NAME = AttributeKey.stringKey("pool.name");
  public static final AttributeKey<String> THREAD_STATE = AttributeKey.stringKey("state");
  public static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");

  private final List<AutoCloseable> instruments;

  private TaskPoolMetrics(List<AutoCloseable> instruments) {
    this.instruments = instruments;
  }

  /**
   * 通过 MeterProvider 注册指标
   *
   * @param pool 任务池
   * @param meterProvider MeterProvider
   * @param poolName 任务池名称（pool.name 属性）
   * @return 指标注册句柄，关闭后不再上报
   */
  public static TaskPoolMetrics register(
      TaskPool pool, MeterProvider meterProvider, String poolName) {
    return register(pool, meterProvider.get(INSTRUMENTATION_SCOPE_NAME), poolName);
  }

  /**
   * 注册指标
   *
   * @param pool 任务池
   * @param meter Meter
   * @param poolName 任务池名称（pool.name 属性）
   * @return 指标注册句柄，关闭后不再上报
   */
  public static TaskPoolMetrics register(TaskPool pool, Meter meter, String poolName) {
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(meter, "meter");
    Objects.requireNonNull(poolName, "poolName");

    Attributes poolAttributes = Attributes.of(POOL_NAME, poolName);
    Attributes busyAttributes = Attributes.of(POOL_NAME, poolName, THREAD_STATE, "busy");
    Attributes idleAttributes = Attributes.of(POOL_NAME, poolName, THREAD_STATE, "idle");
    Attributes successAttributes = Attributes.of(POOL_NAME, poolName, OUTCOME, "success");
    Attributes failureAttributes = Attributes.of(POOL_NAME, poolName, OUTCOME, "failure");
    TaskPoolStatistics statistics = pool.getStatistics();

    List<AutoCloseable> instruments = new ArrayList<>();
    instruments.add(
        meter
            .gaugeBuilder("taskpool.threads")
            .ofLongs()
            .setDescription("Number of task pool worker threads by state")
            .setUnit("{thread}")
            .buildWithCallback(
                measurement -> {
                  TaskPoolStatus status = pool.getStatus();
                  measurement.record(status.getBusyThreads(), busyAttributes);
                  measurement.record(status.getIdleThreads(), idleAttributes);
                }));
    instruments.add(
        meter
            .gaugeBuilder("taskpool.tasks.pending")
            .ofLongs()
            .setDescription("Number of tasks waiting in the queue")
            .setUnit("{task}")
            .buildWithCallback(
                measurement -> measurement.record(pool.getPendingTasks(), poolAttributes)));
    instruments.add(
        meter
            .counterBuilder("taskpool.tasks.completed")
            .setDescription("Number of tasks that finished executing")
            .setUnit("{task}")
            .buildWithCallback(
                measurement -> {
                  long failed = statistics.getFailedCount();
                  long completed = statistics.getCompletedCount();
                  measurement.record(Math.max(0, completed - failed), successAttributes);
                  measurement.record(failed, failureAttributes);
                }));
    instruments.add(
        meter
            .counterBuilder("taskpool.tasks.discarded")
            .setDescription("Number of pending tasks discarded at shutdown")
            .setUnit("{task}")
            .buildWithCallback(
                measurement -> measurement.record(statistics.getDiscardedCount(), poolAttributes)));
    instruments.add(
        meter
            .counterBuilder("taskpool.tasks.rejected")
            .setDescription("Number of task submissions rejected because the pool was not running")
            .setUnit("{task}")
            .buildWithCallback(
                measurement -> measurement.record(statistics.getRejectedCount(), poolAttributes)));

    logger.log(Level.FINE, "Registered task pool metrics for pool: {0}", poolName);
    return new TaskPoolMetrics(instruments);
  }

  @Override
  public void close() {
    for (AutoCloseable instrument : instruments) {
      try {
        instrument.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close task pool instrument: {0}", e.getMessage());
      }
    }
    instruments.clear();
  }
}
