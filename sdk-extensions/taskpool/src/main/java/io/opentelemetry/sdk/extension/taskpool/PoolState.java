/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.taskpool;

/** 任务池生命周期状态 */
public enum PoolState {
  /** Running - accepting and executing tasks. */
  RUNNING,
  /** Shutting down - no longer accepting tasks, workers are draining or being joined. */
  SHUTTING_DOWN,
  /** Stopped - all workers have been joined; the pool may be rebooted. */
  STOPPED
}
