/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 有界并发任务池。
 *
 * <p>入口为 {@link io.opentelemetry.sdk.extension.taskpool.TaskPool}：
 *
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.TaskPool} - 提交、等待、关闭、重启、状态查询
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.ShutdownMode} - 关闭模式
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.TaskPoolStatus} - 状态快照
 *   <li>{@link io.opentelemetry.sdk.extension.taskpool.TaskPoolException} - 同步错误
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.taskpool;

import javax.annotation.ParametersAreNonnullByDefault;
