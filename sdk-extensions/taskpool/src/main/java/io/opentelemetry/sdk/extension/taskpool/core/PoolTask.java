/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.core;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 任务池中的一个任务
 *
 * <p>由无参任务体和与之绑定的结果通道（{@link CompletableFuture}）组成。任务从提交方转移到队列，
 * 再转移到唯一取出它的工作线程；结果通道由该工作线程写入、提交方读取。
 *
 * @param <T> 任务返回值类型
 */
public final class PoolTask<T> {

  private static final Logger logger = Logger.getLogger(PoolTask.class.getName());

  /** 执行结果 */
  public enum Outcome {
    /** 任务体正常返回 */
    SUCCEEDED,
    /** 任务体抛出异常，异常已写入 Future */
    FAILED,
    /** Future 在开始执行前已完成（通常是被调用方取消），任务体未执行 */
    SKIPPED
  }

  private final Callable<T> body;
  private final CompletableFuture<T> future;

  /**
   * 创建任务
   *
   * @param body 任务体
   */
  public PoolTask(Callable<T> body) {
    this.body = Objects.requireNonNull(body, "body");
    this.future = new CompletableFuture<>();
  }

  /**
   * 获取结果通道
   *
   * @return 任务结果 Future
   */
  public CompletableFuture<T> getFuture() {
    return future;
  }

  /**
   * 执行任务体并把结果写入 Future
   *
   * <p>任务体抛出的任何异常都被捕获到 Future 中，不会传播给调用线程。
   *
   * @return 执行结果
   */
  public Outcome execute() {
    if (future.isDone()) {
      return Outcome.SKIPPED;
    }
    try {
      future.complete(body.call());
      return Outcome.SUCCEEDED;
    } catch (Throwable t) {
      logger.log(Level.FINE, "Task failed, failure delivered to its future", t);
      future.completeExceptionally(t);
      return Outcome.FAILED;
    }
  }

  /**
   * 丢弃任务（关闭时未开始执行）
   *
   * <p>Future 被取消，读取方会得到 {@link java.util.concurrent.CancellationException}。
   *
   * @return 是否由本次调用取消
   */
  public boolean discard() {
    return future.cancel(false);
  }
}
