/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import org.lazyframe.executor.ExecutionPlan;

/** Runs the stages of one plan kind, writing output rows as they become final. */
interface StageRunner {

  void run(ExecutionPlan plan, CsvOutputWriter writer);
}
