/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool;

import java.util.Locale;

/** 关闭模式 */
public enum ShutdownMode {
  /** 等待队列中所有任务执行完毕后再退出工作线程 */
  WAIT_FOR_ALL_TASKS("wait"),
  /** 丢弃尚未开始的任务，仅等待正在执行的任务 */
  DISCARD_PENDING_TASKS("discard");

  private final String configValue;

  ShutdownMode(String configValue) {
    this.configValue = configValue;
  }

  /**
   * 获取配置值
   *
   * @return 配置中使用的取值（wait / discard）
   */
  public String getConfigValue() {
    return configValue;
  }

  /**
   * 从配置值解析关闭模式
   *
   * <p>同时接受枚举名（大小写不敏感）和配置值。
   *
   * @param value 配置值
   * @return 关闭模式
   * @throws TaskPoolException 无法识别的取值
   */
  public static ShutdownMode fromConfigValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ShutdownMode mode : values()) {
      if (mode.configValue.equals(normalized)
          || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return mode;
      }
    }
    throw TaskPoolException.invalidArgument("Unknown shutdown mode: " + value);
  }
}
