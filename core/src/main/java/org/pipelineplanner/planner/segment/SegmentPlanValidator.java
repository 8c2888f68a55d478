/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.segment;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.pipelineplanner.planner.operator.Operator;
import org.pipelineplanner.planner.operator.PipelineRole;

/**
 * Checks that a segment tree keeps pipelines and breaks apart: no blocking operator inside a
 * pipeline, no streaming or source operator as the operator of a break, leaves are pipelines
 * reading from a source, and break names are derived from their children.
 */
public class SegmentPlanValidator extends SegmentPlanVisitor<Void, List<String>> {

  /**
   * Validates the tree rooted at the given segment.
   *
   * @param root root segment
   * @return list of violations, empty if the tree is valid
   */
  public static List<String> validate(SegmentPlan root) {
    List<String> errors = new ArrayList<>();
    root.accept(new SegmentPlanValidator(), errors);
    return errors;
  }

  @Override
  public Void visitPipeline(PipelineSegment plan, List<String> errors) {
    if (plan.getChildren().size() > 1) {
      errors.add("Pipeline '" + plan.getName() + "' has more than one upstream subplan");
    }
    if (plan.hasSource() != plan.isLeaf()) {
      errors.add("Pipeline '" + plan.getName() + "' must have a source exactly when it is a leaf");
    }
    if (plan.hasSource() && plan.getSource().getRole() != PipelineRole.SOURCE) {
      errors.add("Pipeline '" + plan.getName() + "' starts at non-source " + plan.getSource());
    }
    if (!plan.hasSource() && plan.getChildren().size() == 1) {
      String childName = plan.getChildren().get(0).getName();
      if (!childName.equals(plan.getName())) {
        errors.add(
            "Pipeline '" + plan.getName() + "' is not named after its subplan '" + childName + "'");
      }
    }
    for (Operator operator : plan.getOperators()) {
      if (operator.getRole() != PipelineRole.STREAMING) {
        errors.add("Pipeline '" + plan.getName() + "' contains non-streaming " + operator);
      }
    }
    return visitChildren(plan, errors);
  }

  @Override
  public Void visitBreak(BreakSegment plan, List<String> errors) {
    if (plan.getOperator().getRole() != PipelineRole.BLOCKING) {
      errors.add("Break '" + plan.getName() + "' holds non-blocking " + plan.getOperator());
    }
    if (plan.isLeaf()) {
      errors.add("Break '" + plan.getName() + "' has no input subplan");
    }
    String expectedName =
        Joiner.on('.')
            .join(
                plan.getChildren().stream()
                    .map(SegmentPlan::getName)
                    .collect(Collectors.toList()));
    if (!expectedName.equals(plan.getName())) {
      errors.add("Break '" + plan.getName() + "' should be named '" + expectedName + "'");
    }
    return visitChildren(plan, errors);
  }

  private Void visitChildren(SegmentPlan plan, List<String> errors) {
    plan.getChildren().forEach(child -> child.accept(this, errors));
    return null;
  }
}
