/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 任务池配置。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.taskpool.config;

import javax.annotation.ParametersAreNonnullByDefault;
