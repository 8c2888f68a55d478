/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.MergeJoinRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a physical merge join over two sorted inputs. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class MergeJoinOperator extends Operator {

  private final MergeJoinRel relation;

  public MergeJoinRel.JoinType getJoinType() {
    return relation.getType();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.MERGE_JOIN;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getLeft(), relation.getRight());
  }

  @Override
  public String describe() {
    return String.format("MergeJoin(%s)", getJoinType());
  }
}
