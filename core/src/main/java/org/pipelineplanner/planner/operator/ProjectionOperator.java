/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.Expression;
import io.substrait.proto.ProjectRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a projection, appending computed expressions to each input row. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class ProjectionOperator extends Operator {

  private final ProjectRel relation;

  public List<Expression> getExpressions() {
    return relation.getExpressionsList();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.PROJECTION;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getInput());
  }

  @Override
  public String describe() {
    return "Projection()";
  }
}
