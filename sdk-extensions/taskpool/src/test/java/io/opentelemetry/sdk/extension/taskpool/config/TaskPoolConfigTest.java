/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.sdk.autoconfigure.spi.internal.DefaultConfigProperties;
import io.opentelemetry.sdk.extension.taskpool.ShutdownMode;
import io.opentelemetry.sdk.extension.taskpool.TaskPoolException;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TaskPoolConfigTest {

  @Test
  void defaultValues() {
    TaskPoolConfig config = TaskPoolConfig.builder().build();

    assertThat(config.getThreadCount()).isEqualTo(TaskPoolConfig.defaultThreadCount());
    assertThat(config.getThreadNamePrefix()).isEqualTo("otel-taskpool");
    assertThat(config.isDaemon()).isTrue();
    assertThat(config.getCloseShutdownMode()).isEqualTo(ShutdownMode.WAIT_FOR_ALL_TASKS);
    assertThat(config.getStatusLogInterval()).isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void defaultThreadCountWithinRange() {
    assertThat(TaskPoolConfig.defaultThreadCount()).isBetween(1, TaskPoolConfig.MAX_THREADS);
  }

  @Test
  void builderOverridesDefaults() {
    TaskPoolConfig config =
        TaskPoolConfig.builder()
            .setThreadCount(8)
            .setThreadNamePrefix("render")
            .setDaemon(false)
            .setCloseShutdownMode(ShutdownMode.DISCARD_PENDING_TASKS)
            .setStatusLogInterval(null)
            .build();

    assertThat(config.getThreadCount()).isEqualTo(8);
    assertThat(config.getThreadNamePrefix()).isEqualTo("render");
    assertThat(config.isDaemon()).isFalse();
    assertThat(config.getCloseShutdownMode()).isEqualTo(ShutdownMode.DISCARD_PENDING_TASKS);
    assertThat(config.getStatusLogInterval()).isEqualTo(Duration.ZERO);
  }

  @Test
  void threadCountBoundaries() {
    assertThat(TaskPoolConfig.builder().setThreadCount(1).build().getThreadCount()).isEqualTo(1);
    assertThat(TaskPoolConfig.builder().setThreadCount(4096).build().getThreadCount())
        .isEqualTo(4096);

    assertThatThrownBy(() -> TaskPoolConfig.builder().setThreadCount(0).build())
        .isInstanceOfSatisfying(
            TaskPoolException.class,
            e -> assertThat(e.getType()).isEqualTo(TaskPoolException.Type.INVALID_ARGUMENT));
    assertThatThrownBy(() -> TaskPoolConfig.builder().setThreadCount(4097).build())
        .isInstanceOf(TaskPoolException.class)
        .hasMessageContaining("4097");
    assertThatThrownBy(() -> TaskPoolConfig.checkThreadCount(-1))
        .isInstanceOf(TaskPoolException.class);
  }

  @Test
  void emptyPrefixRejected() {
    assertThatThrownBy(() -> TaskPoolConfig.builder().setThreadNamePrefix("").build())
        .isInstanceOf(TaskPoolException.class)
        .hasMessageContaining("threadNamePrefix");
  }

  @Test
  void negativeIntervalRejected() {
    assertThatThrownBy(
            () -> TaskPoolConfig.builder().setStatusLogInterval(Duration.ofSeconds(-1)).build())
        .isInstanceOf(TaskPoolException.class)
        .hasMessageContaining("statusLogInterval");
  }

  @Test
  void createFromEmptyProperties() {
    TaskPoolConfig config =
        TaskPoolConfig.create(DefaultConfigProperties.createFromMap(Collections.emptyMap()));

    assertThat(config.getThreadCount()).isEqualTo(TaskPoolConfig.defaultThreadCount());
    assertThat(config.getThreadNamePrefix()).isEqualTo("otel-taskpool");
    assertThat(config.getCloseShutdownMode()).isEqualTo(ShutdownMode.WAIT_FOR_ALL_TASKS);
  }

  @Test
  void createFromProperties() {
    Map<String, String> properties = new HashMap<>();
    properties.put("otel.taskpool.thread.count", "3");
    properties.put("otel.taskpool.thread.name.prefix", " batch ");
    properties.put("otel.taskpool.thread.daemon", "false");
    properties.put("otel.taskpool.shutdown.mode", "discard");
    properties.put("otel.taskpool.status.log.interval", "30s");

    TaskPoolConfig config = TaskPoolConfig.create(DefaultConfigProperties.createFromMap(properties));

    assertThat(config.getThreadCount()).isEqualTo(3);
    assertThat(config.getThreadNamePrefix()).isEqualTo("batch");
    assertThat(config.isDaemon()).isFalse();
    assertThat(config.getCloseShutdownMode()).isEqualTo(ShutdownMode.DISCARD_PENDING_TASKS);
    assertThat(config.getStatusLogInterval()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void blankPrefixFallsBackToDefault() {
    TaskPoolConfig config =
        TaskPoolConfig.create(
            DefaultConfigProperties.createFromMap(
                Collections.singletonMap("otel.taskpool.thread.name.prefix", "  ")));

    assertThat(config.getThreadNamePrefix()).isEqualTo("otel-taskpool");
  }

  @Test
  void malformedNumberReportedAsInvalidArgument() {
    assertThatThrownBy(
            () ->
                TaskPoolConfig.create(
                    DefaultConfigProperties.createFromMap(
                        Collections.singletonMap("otel.taskpool.thread.count", "many"))))
        .isInstanceOfSatisfying(
            TaskPoolException.class,
            e -> assertThat(e.getType()).isEqualTo(TaskPoolException.Type.INVALID_ARGUMENT))
        .hasMessageContaining("Invalid task pool configuration");
  }

  @Test
  void outOfRangeThreadCountFromPropertiesRejected() {
    assertThatThrownBy(
            () ->
                TaskPoolConfig.create(
                    DefaultConfigProperties.createFromMap(
                        Collections.singletonMap("otel.taskpool.thread.count", "0"))))
        .isInstanceOf(TaskPoolException.class)
        .hasMessageContaining("threadCount");
  }

  @Test
  void unknownShutdownModeRejected() {
    assertThatThrownBy(
            () ->
                TaskPoolConfig.create(
                    DefaultConfigProperties.createFromMap(
                        Collections.singletonMap("otel.taskpool.shutdown.mode", "later"))))
        .isInstanceOf(TaskPoolException.class)
        .hasMessageContaining("Unknown shutdown mode");
  }

  @Test
  void shutdownModeAcceptsEnumNames() {
    assertThat(ShutdownMode.fromConfigValue("WAIT")).isEqualTo(ShutdownMode.WAIT_FOR_ALL_TASKS);
    assertThat(ShutdownMode.fromConfigValue("discard_pending_tasks"))
        .isEqualTo(ShutdownMode.DISCARD_PENDING_TASKS);
  }

  @Test
  void toStringContainsFields() {
    String text = TaskPoolConfig.builder().setThreadCount(2).build().toString();

    assertThat(text).contains("threadCount=2").contains("threadNamePrefix='otel-taskpool'");
  }
}
