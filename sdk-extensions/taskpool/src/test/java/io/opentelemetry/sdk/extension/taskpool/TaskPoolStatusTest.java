/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskPoolStatusTest {

  @Test
  void idleThreadsNeverNegative() {
    // 停止后线程集合已清空，但快照可能仍记录着正在退出的忙碌线程
    TaskPoolStatus status = TaskPoolStatus.create(0, 1, 0, false);

    assertThat(status.getIdleThreads()).isZero();
  }

  @Test
  void equalSnapshots() {
    assertThat(TaskPoolStatus.create(4, 1, 2, true))
        .isEqualTo(TaskPoolStatus.create(4, 1, 2, true))
        .hasSameHashCodeAs(TaskPoolStatus.create(4, 1, 2, true))
        .isNotEqualTo(TaskPoolStatus.create(4, 1, 2, false));
  }

  @Test
  void toStringListsCounts() {
    assertThat(TaskPoolStatus.create(4, 1, 2, true).toString())
        .contains("running=true")
        .contains("busyThreads=1")
        .contains("idleThreads=3")
        .contains("pendingTasks=2");
  }
}
