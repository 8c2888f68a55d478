/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.AggregateRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a grouping aggregation. Breaks the pipeline it sits on. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class AggregationOperator extends Operator {

  private final AggregateRel relation;

  public int getGroupingCount() {
    return relation.getGroupingsCount();
  }

  public int getMeasureCount() {
    return relation.getMeasuresCount();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.AGGREGATION;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getInput());
  }

  @Override
  public String describe() {
    return "Aggregation()";
  }
}
