/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.HashJoinRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator representing a physical hash join. The build side is materialized into a hash table. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class HashJoinOperator extends Operator {

  private final HashJoinRel relation;

  public HashJoinRel.JoinType getJoinType() {
    return relation.getType();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.HASH_JOIN;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of(relation.getLeft(), relation.getRight());
  }

  @Override
  public String describe() {
    return String.format("HashJoin(%s)", getJoinType());
  }
}
