/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.Expression;
import io.substrait.proto.FilterRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a filter (WHERE clause) over a single input. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class FilterOperator extends Operator {

  private final FilterRel relation;

  /** Filter condition as a Substrait expression. */
  public Expression getCondition() {
    return relation.getCondition();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.FILTER;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getInput());
  }

  @Override
  public String describe() {
    return "Filter()";
  }
}
