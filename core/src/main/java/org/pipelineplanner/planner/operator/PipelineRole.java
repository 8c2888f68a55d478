/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

/** How an operator relates to the stream of tuples flowing through a pipeline. */
public enum PipelineRole {

  /** Produces a stream from storage. Always the first operator of a leaf pipeline. */
  SOURCE,

  /** Applied tuple-at-a-time on a single stream, no materialization required. */
  STREAMING,

  /** Requires its inputs to be materialized or grouped before producing output. */
  BLOCKING
}
