/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.segment;

/**
 * The visitor of segment plans.
 *
 * @param <R> return type
 * @param <C> context type
 */
public abstract class SegmentPlanVisitor<R, C> {

  public R visitNode(SegmentPlan plan, C context) {
    return null;
  }

  public R visitPipeline(PipelineSegment plan, C context) {
    return visitNode(plan, context);
  }

  public R visitBreak(BreakSegment plan, C context) {
    return visitNode(plan, context);
  }
}
