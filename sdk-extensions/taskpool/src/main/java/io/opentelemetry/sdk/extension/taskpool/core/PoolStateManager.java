/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import io.opentelemetry.sdk.extension.taskpool.PoolState;
import io.opentelemetry.sdk.extension.taskpool.ShutdownMode;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务池生命周期状态。
 *
 * <p>只允许三种转换，每种对应任务池的一个生命周期动作，并输出对应的 INFO 日志：
 *
 * <ul>
 *   <li>{@link #markRunning}：STOPPED → RUNNING，工作线程已全部启动
 *   <li>{@link #markShuttingDown}：RUNNING → SHUTTING_DOWN，队列已关闭
 *   <li>{@link #markStopped}：任意状态 → STOPPED，工作线程已全部 join（或启动失败后回滚）
 * </ul>
 *
 * <p>状态真正变化时按注册顺序通知监听器，同一状态的重复标记不通知。
 */
public final class PoolStateManager {

  private static final Logger logger = Logger.getLogger(PoolStateManager.class.getName());

  /** 状态变更监听器 */
  @FunctionalInterface
  public interface StateChangeListener {
    /**
     * 状态变更回调，在触发转换的线程中同步调用
     *
     * @param previousState 变更前状态
     * @param newState 变更后状态
     */
    void onStateChanged(PoolState previousState, PoolState newState);
  }

  private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.STOPPED);
  private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

  public PoolState getState() {
    return state.get();
  }

  public boolean isStopped() {
    return state.get() == PoolState.STOPPED;
  }

  /**
   * 标记工作线程已启动
   *
   * @param threadCount 工作线程数
   * @param threadNamePrefix 线程名前缀
   */
  public void markRunning(int threadCount, String threadNamePrefix) {
    PoolState previous = state.getAndSet(PoolState.RUNNING);
    logger.log(
        Level.INFO,
        "Task pool launched, threads: {0}, prefix: {1}",
        new Object[] {threadCount, threadNamePrefix});
    fireIfChanged(previous, PoolState.RUNNING);
  }

  /**
   * 标记开始关闭
   *
   * @param mode 关闭模式
   * @return 仅当本次调用完成了 RUNNING → SHUTTING_DOWN 转换时返回 true
   */
  public boolean markShuttingDown(ShutdownMode mode) {
    if (!state.compareAndSet(PoolState.RUNNING, PoolState.SHUTTING_DOWN)) {
      return false;
    }
    logger.log(Level.INFO, "Shutting down task pool, mode: {0}", mode);
    fireIfChanged(PoolState.RUNNING, PoolState.SHUTTING_DOWN);
    return true;
  }

  /** 标记已停止，已是 STOPPED 时不做任何事 */
  public void markStopped() {
    PoolState previous = state.getAndSet(PoolState.STOPPED);
    if (previous != PoolState.STOPPED) {
      logger.log(Level.INFO, "Task pool stopped, previous state: {0}", previous);
    }
    fireIfChanged(previous, PoolState.STOPPED);
  }

  public void addListener(StateChangeListener listener) {
    if (listener != null) {
      listeners.add(listener);
    }
  }

  public void removeListener(StateChangeListener listener) {
    listeners.remove(listener);
  }

  private void fireIfChanged(PoolState previous, PoolState current) {
    if (previous == current) {
      return;
    }
    for (StateChangeListener listener : listeners) {
      try {
        listener.onStateChanged(previous, current);
      } catch (RuntimeException e) {
        // 监听器异常不影响状态转换本身
        logger.log(
            Level.WARNING,
            "Pool state listener failed on transition {0} -> {1}: {2}",
            new Object[] {previous, current, e.toString()});
      }
    }
  }
}
