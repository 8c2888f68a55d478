/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.FetchRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a Substrait fetch relation (LIMIT with an optional offset). */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class LimitOperator extends Operator {

  private final FetchRel relation;

  @Override
  public OperatorType getType() {
    return OperatorType.LIMIT;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getInput());
  }

  @Override
  public String describe() {
    return "Limit()";
  }
}
