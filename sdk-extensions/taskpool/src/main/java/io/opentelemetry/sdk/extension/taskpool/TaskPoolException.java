/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool;

import javax.annotation.Nullable;

/**
 * 任务池异常
 *
 * <p>同步抛给发起调用的线程。任务体内部抛出的异常不会以该类型出现，而是写入对应任务的 Future。
 */
public class TaskPoolException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** 异常类型 */
  public enum Type {
    /** 参数非法（如线程数超出范围） */
    INVALID_ARGUMENT,
    /** 任务池未运行，拒绝提交 */
    NOT_RUNNING,
    /** 当前调用上下文不允许该操作 */
    ILLEGAL_STATE
  }

  private final Type type;

  /**
   * 创建任务池异常
   *
   * @param type 异常类型
   * @param message 异常消息
   */
  public TaskPoolException(Type type, String message) {
    this(type, message, null);
  }

  /**
   * 创建任务池异常
   *
   * @param type 异常类型
   * @param message 异常消息
   * @param cause 原始异常
   */
  public TaskPoolException(Type type, String message, @Nullable Throwable cause) {
    super(formatMessage(type, message), cause);
    this.type = type;
  }

  /**
   * 获取异常类型
   *
   * @return 异常类型
   */
  public Type getType() {
    return type;
  }

  private static String formatMessage(Type type, String message) {
    return "[" + type.name() + "] " + message;
  }

  // ===== 便捷工厂方法 =====

  public static TaskPoolException invalidArgument(String message) {
    return new TaskPoolException(Type.INVALID_ARGUMENT, message);
  }

  public static TaskPoolException invalidArgument(String message, @Nullable Throwable cause) {
    return new TaskPoolException(Type.INVALID_ARGUMENT, message, cause);
  }

  public static TaskPoolException notRunning() {
    return new TaskPoolException(Type.NOT_RUNNING, "submit on stopped task pool");
  }

  public static TaskPoolException illegalState(String message) {
    return new TaskPoolException(Type.ILLEGAL_STATE, message);
  }
}
