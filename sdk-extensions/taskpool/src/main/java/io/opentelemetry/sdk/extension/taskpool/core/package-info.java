/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 任务池同步核心。
 *
 * <p>包含任务池内部使用的组件：
 *
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.core.TaskQueue} - 任务队列与同步状态
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.core.Worker} - 工作线程主循环
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.core.CompletionTracker} - waitAll 等待/通知
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.core.PoolStateManager} - 生命周期状态
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.core.TaskPoolStatistics} - 统计信息
 * </ul>
 *
 * <p>锁顺序：生命周期锁 → 队列锁；队列锁与完成跟踪锁从不嵌套。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.taskpool.core;

import javax.annotation.ParametersAreNonnullByDefault;
