/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import io.substrait.proto.ExtensionLeafRel;
import io.substrait.proto.Rel;
import org.pipelineplanner.common.exception.MalformedPlanException;
import org.pipelineplanner.common.exception.UnsupportedOperatorException;
import org.pipelineplanner.common.setting.PlannerSettings;
import org.pipelineplanner.proto.PartitionSourceRel;

/**
 * Creates the operator matching the relation kind of a Substrait relation.
 *
 * <p>Dispatch is on {@link Rel.RelTypeCase}. Relation kinds without an operator counterpart
 * (extension single/multi relations, cross products, references, writes, DDL, ...) are rejected
 * with {@link UnsupportedOperatorException}.
 */
public class OperatorFactory {

  private final boolean setOperationsEnabled;

  /** Takes a snapshot of the settings; later changes to them don't affect this factory. */
  public OperatorFactory(PlannerSettings settings) {
    this.setOperationsEnabled = settings.isSetOperationsEnabled();
  }

  /**
   * Creates the operator wrapping the given relation.
   *
   * @param relation a relation whose kind tag is set
   * @return the matching operator
   * @throws UnsupportedOperatorException if the relation kind has no operator
   * @throws MalformedPlanException if a partition source detail cannot be decoded
   */
  public Operator create(Rel relation) {
    Rel.RelTypeCase kind = relation.getRelTypeCase();
    switch (kind) {
      case READ:
        return new ReadOperator(relation.getRead());
      case EXTENSION_LEAF:
        return createPartitionSource(relation.getExtensionLeaf());
      case FILTER:
        return new FilterOperator(relation.getFilter());
      case PROJECT:
        return new ProjectionOperator(relation.getProject());
      case FETCH:
        return new LimitOperator(relation.getFetch());
      case SORT:
        return new SortOperator(relation.getSort());
      case AGGREGATE:
        return new AggregationOperator(relation.getAggregate());
      case JOIN:
        return new JoinOperator(relation.getJoin());
      case HASH_JOIN:
        return new HashJoinOperator(relation.getHashJoin());
      case MERGE_JOIN:
        return new MergeJoinOperator(relation.getMergeJoin());
      case SET:
        if (!setOperationsEnabled) {
          throw new UnsupportedOperatorException(
              kind.name(), "Set operations are disabled by planner settings");
        }
        return new SetOperator(relation.getSet());
      default:
        throw new UnsupportedOperatorException(kind.name());
    }
  }

  private Operator createPartitionSource(ExtensionLeafRel relation) {
    Any detail = relation.getDetail();
    if (!relation.hasDetail() || !detail.is(PartitionSourceRel.class)) {
      throw new UnsupportedOperatorException(
          Rel.RelTypeCase.EXTENSION_LEAF.name(),
          "Extension leaf relation is not a partition source: " + detail.getTypeUrl());
    }

    try {
      return new PartitionSourceOperator(relation, detail.unpack(PartitionSourceRel.class));
    } catch (InvalidProtocolBufferException e) {
      throw new MalformedPlanException("Cannot decode partition source " + detail.getTypeUrl(), e);
    }
  }
}
