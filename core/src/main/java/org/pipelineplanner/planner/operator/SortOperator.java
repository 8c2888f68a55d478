/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.Rel;
import io.substrait.proto.SortField;
import io.substrait.proto.SortRel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing an ORDER BY over a single input. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class SortOperator extends Operator {

  private final SortRel relation;

  public List<SortField> getSortFields() {
    return relation.getSortsList();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.SORT;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getInput());
  }

  @Override
  public String describe() {
    return "Sort()";
  }
}
