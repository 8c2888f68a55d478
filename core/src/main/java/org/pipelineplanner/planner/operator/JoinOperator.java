/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.Expression;
import io.substrait.proto.JoinRel;
import io.substrait.proto.Rel;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Operator representing a logical join of a left and a right input. The join type and condition
 * stay available to downstream consumers through the wrapped relation.
 *
 * <p>A join has no name of its own: the break segment built over it is named after its inputs.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class JoinOperator extends Operator {

  private final JoinRel relation;

  public JoinRel.JoinType getJoinType() {
    return relation.getType();
  }

  /** Returns the join condition, empty for joins without an expression (cross products). */
  public Optional<Expression> getCondition() {
    return relation.hasExpression() ? Optional.of(relation.getExpression()) : Optional.empty();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.JOIN;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getLeft(), relation.getRight());
  }

  @Override
  public String describe() {
    return String.format("Join(%s)", getJoinType());
  }
}
