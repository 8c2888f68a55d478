/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.Rel;
import io.substrait.proto.SetRel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a set operation (union, intersection, difference) over n inputs. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class SetOperator extends Operator {

  private final SetRel relation;

  public SetRel.SetOp getSetOp() {
    return relation.getOp();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.SET_OPERATION;
  }

  @Override
  public List<Rel> getInputs() {
    return relation.getInputsList();
  }

  @Override
  public String describe() {
    return String.format("SetOperation(%s)", getSetOp());
  }
}
