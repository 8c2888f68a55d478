/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.segment;

import com.google.common.base.Joiner;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.pipelineplanner.common.exception.InvalidBreakArityException;
import org.pipelineplanner.planner.operator.Operator;
import org.pipelineplanner.planner.operator.PipelineRole;

/**
 * A pipeline break: one blocking operator whose input subplans must be materialized or grouped
 * before it produces output.
 *
 * <p>The name is the names of the children joined with {@code .}, in child order.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class BreakSegment extends SegmentPlan {

  private static final Joiner NAME_JOINER = Joiner.on('.');

  private final Operator operator;

  BreakSegment(Operator operator, List<SegmentPlan> children) {
    super(nameOf(operator, children), children);
    this.operator = operator;
  }

  private static String nameOf(Operator operator, List<SegmentPlan> children) {
    if (operator.getRole() != PipelineRole.BLOCKING) {
      throw new IllegalArgumentException("Not a blocking operator: " + operator.describe());
    }
    if (children.isEmpty()) {
      throw new InvalidBreakArityException(operator.describe());
    }
    return NAME_JOINER.join(children.stream().map(SegmentPlan::getName).iterator());
  }

  @Override
  public <R, C> R accept(SegmentPlanVisitor<R, C> visitor, C context) {
    return visitor.visitBreak(this, context);
  }

  @Override
  public String describe() {
    return String.format("BreakSegment(%s) <%s>", getName(), operator.describe());
  }
}
