/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.segment;

import java.util.List;
import org.pipelineplanner.planner.operator.Operator;
import org.pipelineplanner.planner.operator.PipelineRole;

/** Factory methods for segment plans. */
public final class SegmentPlans {

  private SegmentPlans() {}

  /** Leaf pipeline reading from the given source operator, named after it. */
  public static PipelineSegment newPipeline(Operator source) {
    return new PipelineSegment(source, List.of(), source.getName(), List.of());
  }

  /**
   * Pipeline over at most one child. A leading {@link PipelineRole#SOURCE} operator becomes the
   * source of a leaf pipeline; all other operators must be streaming.
   */
  public static PipelineSegment newPipeline(
      List<Operator> operators, String name, List<SegmentPlan> children) {
    if (!operators.isEmpty() && operators.get(0).getRole() == PipelineRole.SOURCE) {
      return new PipelineSegment(
          operators.get(0), operators.subList(1, operators.size()), name, children);
    }
    return new PipelineSegment(null, operators, name, children);
  }

  /**
   * Pipeline break over the given input subplans, named after them.
   *
   * @throws org.pipelineplanner.common.exception.InvalidBreakArityException if children is empty
   */
  public static BreakSegment newBreak(Operator operator, List<SegmentPlan> children) {
    return new BreakSegment(operator, children);
  }

  /**
   * Seals a finished root segment so that it can no longer be extended or become the child of
   * another segment.
   *
   * @throws IllegalStateException if the segment is already attached
   */
  public static SegmentPlan seal(SegmentPlan root) {
    root.attach();
    return root;
  }
}
