/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 任务池 OpenTelemetry 指标。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.taskpool.metrics;

import javax.annotation.ParametersAreNonnullByDefault;
