/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 任务池状态快照
 *
 * <p>某一时刻的只读拷贝，不随任务池后续变化而更新。
 */
public final class TaskPoolStatus {

  private final int totalThreads;
  private final int busyThreads;
  private final int pendingTasks;
  private final boolean running;

  private TaskPoolStatus(int totalThreads, int busyThreads, int pendingTasks, boolean running) {
    this.totalThreads = totalThreads;
    this.busyThreads = busyThreads;
    this.pendingTasks = pendingTasks;
    this.running = running;
  }

  /**
   * 创建状态快照
   *
   * @param totalThreads 工作线程总数
   * @param busyThreads 正在执行任务的线程数
   * @param pendingTasks 等待执行的任务数
   * @param running 是否运行中
   * @return 状态快照
   */
  public static TaskPoolStatus create(
      int totalThreads, int busyThreads, int pendingTasks, boolean running) {
    return new TaskPoolStatus(totalThreads, busyThreads, pendingTasks, running);
  }

  public int getTotalThreads() {
    return totalThreads;
  }

  public int getBusyThreads() {
    return busyThreads;
  }

  /**
   * 获取空闲线程数
   *
   * @return totalThreads - busyThreads（不小于 0）
   */
  public int getIdleThreads() {
    return Math.max(0, totalThreads - busyThreads);
  }

  public int getPendingTasks() {
    return pendingTasks;
  }

  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaskPoolStatus)) {
      return false;
    }
    TaskPoolStatus that = (TaskPoolStatus) o;
    return totalThreads == that.totalThreads
        && busyThreads == that.busyThreads
        && pendingTasks == that.pendingTasks
        && running == that.running;
  }

  @Override
  public int hashCode() {
    return Objects.hash(totalThreads, busyThreads, pendingTasks, running);
  }

  @Override
  public String toString() {
    return "TaskPoolStatus{"
        + "running="
        + running
        + ", totalThreads="
        + totalThreads
        + ", busyThreads="
        + busyThreads
        + ", idleThreads="
        + getIdleThreads()
        + ", pendingTasks="
        + pendingTasks
        + '}';
  }
}
