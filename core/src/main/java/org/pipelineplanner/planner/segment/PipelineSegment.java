/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import org.pipelineplanner.planner.operator.Operator;
import org.pipelineplanner.planner.operator.PipelineRole;

/**
 * An ordered chain of operators applied consecutively on one logical stream.
 *
 * <p>A leaf pipeline starts at a {@link PipelineRole#SOURCE} operator and has no children. A
 * pipeline that pulls from an upstream subplan has no source and exactly one child. In both cases
 * the streaming operators follow in application order, scan side first.
 */
@EqualsAndHashCode(callSuper = true)
public class PipelineSegment extends SegmentPlan {

  private final Operator source;

  private final List<Operator> operators;

  PipelineSegment(
      Operator source, List<Operator> operators, String name, List<SegmentPlan> children) {
    super(checkShape(source, operators, name, children), children);
    this.source = source;
    this.operators = new ArrayList<>(operators);
  }

  private static String checkShape(
      Operator source, List<Operator> operators, String name, List<SegmentPlan> children) {
    if (children.size() > 1) {
      throw new IllegalArgumentException(
          "Pipeline " + name + " can pull from at most one subplan, got " + children.size());
    }
    if ((source == null) == children.isEmpty()) {
      throw new IllegalArgumentException(
          "Pipeline " + name + " needs either a source operator or an upstream subplan");
    }
    if (source != null && source.getRole() != PipelineRole.SOURCE) {
      throw new IllegalArgumentException("Not a source operator: " + source.describe());
    }
    operators.forEach(PipelineSegment::checkStreaming);
    return name;
  }

  private static void checkStreaming(Operator operator) {
    if (operator.getRole() != PipelineRole.STREAMING) {
      throw new IllegalArgumentException(
          "Only streaming operators can extend a pipeline: " + operator.describe());
    }
  }

  /** Returns the source operator of a leaf pipeline, or null if this pipeline has a child. */
  public Operator getSource() {
    return source;
  }

  public boolean hasSource() {
    return source != null;
  }

  /** Returns the streaming operators in application order. */
  public List<Operator> getOperators() {
    return Collections.unmodifiableList(operators);
  }

  /** Returns the total number of operators (source, if any, plus streaming operators). */
  public int getOperatorCount() {
    return operators.size() + (hasSource() ? 1 : 0);
  }

  /**
   * Adds a streaming operator to the end of this pipeline. Only allowed while the pipeline is being
   * built, i.e. before it is attached to a parent segment or sealed as the root of a query plan.
   *
   * @param operator a {@link PipelineRole#STREAMING} operator
   * @return this pipeline
   */
  public PipelineSegment append(Operator operator) {
    if (isAttached()) {
      throw new IllegalStateException("Pipeline " + getName() + " is attached and can't change");
    }
    checkStreaming(operator);
    operators.add(operator);
    return this;
  }

  @Override
  public <R, C> R accept(SegmentPlanVisitor<R, C> visitor, C context) {
    return visitor.visitPipeline(this, context);
  }

  @Override
  public String describe() {
    String chain =
        operators.stream().map(Operator::describe).collect(Collectors.joining(", ", "[", "]"));
    if (hasSource()) {
      return String.format("PipelineSegment(%s) <%s> %s", getName(), source.describe(), chain);
    }
    return String.format("PipelineSegment(%s) %s", getName(), chain);
  }
}
