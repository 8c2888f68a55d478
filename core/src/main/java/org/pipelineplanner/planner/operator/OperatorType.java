/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Types of operators a Substrait relation can translate to.
 *
 * <p>Each type carries its {@link PipelineRole}, which is what the translator uses to decide
 * whether an operator extends a pipeline or breaks it.
 */
@Getter
@RequiredArgsConstructor
public enum OperatorType {

  /** Table scan - reads a named table or an inline/virtual source. */
  READ(PipelineRole.SOURCE),

  /** Reads one partition of a domain. */
  PARTITION_SOURCE(PipelineRole.SOURCE),

  FILTER(PipelineRole.STREAMING),

  PROJECTION(PipelineRole.STREAMING),

  /** Substrait fetch relation (offset and count). */
  LIMIT(PipelineRole.STREAMING),

  SORT(PipelineRole.STREAMING),

  AGGREGATION(PipelineRole.BLOCKING),

  JOIN(PipelineRole.BLOCKING),

  HASH_JOIN(PipelineRole.BLOCKING),

  MERGE_JOIN(PipelineRole.BLOCKING),

  /** Union, intersection or difference over two or more inputs. */
  SET_OPERATION(PipelineRole.BLOCKING);

  private final PipelineRole role;
}
