/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.config;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigurationException;
import io.opentelemetry.sdk.extension.taskpool.ShutdownMode;
import io.opentelemetry.sdk.extension.taskpool.TaskPoolException;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 任务池配置
 *
 * <p>可通过构建器直接创建，也可以从 OpenTelemetry autoconfigure 的 {@link ConfigProperties} 加载。
 */
public final class TaskPoolConfig {

  /** 工作线程数上限 */
  public static final int MAX_THREADS = 4096;

  // ===== 配置键常量 =====
  private static final String THREAD_COUNT = "otel.taskpool.thread.count";
  private static final String THREAD_NAME_PREFIX = "otel.taskpool.thread.name.prefix";
  private static final String THREAD_DAEMON = "otel.taskpool.thread.daemon";
  private static final String SHUTDOWN_MODE = "otel.taskpool.shutdown.mode";
  private static final String STATUS_LOG_INTERVAL = "otel.taskpool.status.log.interval";

  // ===== 默认值常量 =====
  private static final int FALLBACK_THREAD_COUNT = 4;
  private static final String DEFAULT_THREAD_NAME_PREFIX = "otel-taskpool";
  private static final boolean DEFAULT_THREAD_DAEMON = true;
  private static final ShutdownMode DEFAULT_SHUTDOWN_MODE = ShutdownMode.WAIT_FOR_ALL_TASKS;
  private static final Duration DEFAULT_STATUS_LOG_INTERVAL = Duration.ofSeconds(60);

  // ===== 配置字段 =====
  private final int threadCount;
  private final String threadNamePrefix;
  private final boolean daemon;
  private final ShutdownMode closeShutdownMode;
  private final Duration statusLogInterval;

  private TaskPoolConfig(Builder builder) {
    this.threadCount = builder.threadCount;
    this.threadNamePrefix = builder.threadNamePrefix;
    this.daemon = builder.daemon;
    this.closeShutdownMode = builder.closeShutdownMode;
    this.statusLogInterval = builder.statusLogInterval;
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 任务池配置
   */
  public static TaskPoolConfig create(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  /**
   * 创建构建器
   *
   * @return 构建器实例
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * 默认线程数：可用处理器数，无法获取时为 4
   *
   * @return 默认线程数
   */
  public static int defaultThreadCount() {
    int processors = Runtime.getRuntime().availableProcessors();
    return processors > 0 ? Math.min(processors, MAX_THREADS) : FALLBACK_THREAD_COUNT;
  }

  /**
   * 校验线程数
   *
   * @param threadCount 线程数
   * @return 原值
   * @throws TaskPoolException 线程数不在 [1, {@value #MAX_THREADS}] 范围内
   */
  public static int checkThreadCount(int threadCount) {
    if (threadCount <= 0 || threadCount > MAX_THREADS) {
      throw TaskPoolException.invalidArgument(
          "threadCount must be in [1, " + MAX_THREADS + "], got " + threadCount);
    }
    return threadCount;
  }

  // ===== Getters =====

  public int getThreadCount() {
    return threadCount;
  }

  public String getThreadNamePrefix() {
    return threadNamePrefix;
  }

  public boolean isDaemon() {
    return daemon;
  }

  /**
   * 获取 close() 使用的关闭模式
   *
   * @return 关闭模式
   */
  public ShutdownMode getCloseShutdownMode() {
    return closeShutdownMode;
  }

  public Duration getStatusLogInterval() {
    return statusLogInterval;
  }

  @Override
  public String toString() {
    return "TaskPoolConfig{"
        + "threadCount="
        + threadCount
        + ", threadNamePrefix='"
        + threadNamePrefix
        + '\''
        + ", daemon="
        + daemon
        + ", closeShutdownMode="
        + closeShutdownMode
        + ", statusLogInterval="
        + statusLogInterval
        + '}';
  }

  /** 构建器 */
  public static final class Builder {
    private int threadCount = defaultThreadCount();
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    private boolean daemon = DEFAULT_THREAD_DAEMON;
    private ShutdownMode closeShutdownMode = DEFAULT_SHUTDOWN_MODE;
    private Duration statusLogInterval = DEFAULT_STATUS_LOG_INTERVAL;

    private Builder() {}

    /**
     * 从 ConfigProperties 加载配置
     *
     * @param properties 配置属性
     * @return 构建器
     * @throws TaskPoolException 配置值无法解析
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      try {
        Integer count = properties.getInt(THREAD_COUNT);
        if (count != null) {
          this.threadCount = count;
        }

        String prefix = properties.getString(THREAD_NAME_PREFIX);
        if (prefix != null && !prefix.trim().isEmpty()) {
          this.threadNamePrefix = prefix.trim();
        }

        this.daemon = properties.getBoolean(THREAD_DAEMON, DEFAULT_THREAD_DAEMON);

        String mode = properties.getString(SHUTDOWN_MODE);
        if (mode != null && !mode.trim().isEmpty()) {
          this.closeShutdownMode = ShutdownMode.fromConfigValue(mode);
        }

        Duration interval = properties.getDuration(STATUS_LOG_INTERVAL);
        if (interval != null) {
          this.statusLogInterval = interval;
        }
      } catch (ConfigurationException e) {
        throw TaskPoolException.invalidArgument("Invalid task pool configuration", e);
      }
      return this;
    }

    public Builder setThreadCount(int threadCount) {
      this.threadCount = threadCount;
      return this;
    }

    public Builder setThreadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
      return this;
    }

    public Builder setDaemon(boolean daemon) {
      this.daemon = daemon;
      return this;
    }

    public Builder setCloseShutdownMode(ShutdownMode closeShutdownMode) {
      this.closeShutdownMode = Objects.requireNonNull(closeShutdownMode, "closeShutdownMode");
      return this;
    }

    /**
     * 设置状态日志间隔
     *
     * @param statusLogInterval 间隔，{@link Duration#ZERO} 表示关闭周期日志
     * @return 构建器
     */
    public Builder setStatusLogInterval(@Nullable Duration statusLogInterval) {
      this.statusLogInterval = statusLogInterval != null ? statusLogInterval : Duration.ZERO;
      return this;
    }

    /**
     * 构建配置实例
     *
     * @return 配置实例
     * @throws TaskPoolException 配置不合法
     */
    public TaskPoolConfig build() {
      validate();
      return new TaskPoolConfig(this);
    }

    private void validate() {
      checkThreadCount(threadCount);
      if (threadNamePrefix.isEmpty()) {
        throw TaskPoolException.invalidArgument("threadNamePrefix must not be empty");
      }
      if (statusLogInterval.isNegative()) {
        throw TaskPoolException.invalidArgument("statusLogInterval must not be negative");
      }
    }
  }
}
