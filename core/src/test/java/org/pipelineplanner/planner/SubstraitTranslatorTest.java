/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.pipelineplanner.planner.RelFixtures.aggregate;
import static org.pipelineplanner.planner.RelFixtures.extensionMulti;
import static org.pipelineplanner.planner.RelFixtures.filter;
import static org.pipelineplanner.planner.RelFixtures.hashJoin;
import static org.pipelineplanner.planner.RelFixtures.join;
import static org.pipelineplanner.planner.RelFixtures.limit;
import static org.pipelineplanner.planner.RelFixtures.mergeJoin;
import static org.pipelineplanner.planner.RelFixtures.partition;
import static org.pipelineplanner.planner.RelFixtures.project;
import static org.pipelineplanner.planner.RelFixtures.scan;
import static org.pipelineplanner.planner.RelFixtures.sort;
import static org.pipelineplanner.planner.RelFixtures.union;

import io.substrait.proto.Rel;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.pipelineplanner.common.exception.MalformedPlanException;
import org.pipelineplanner.common.exception.UnsupportedOperatorException;
import org.pipelineplanner.common.setting.PlannerSettings;
import org.pipelineplanner.planner.operator.AggregationOperator;
import org.pipelineplanner.planner.operator.JoinOperator;
import org.pipelineplanner.planner.operator.Operator;
import org.pipelineplanner.planner.operator.OperatorFactory;
import org.pipelineplanner.planner.operator.OperatorType;
import org.pipelineplanner.planner.operator.ReadOperator;
import org.pipelineplanner.planner.segment.BreakSegment;
import org.pipelineplanner.planner.segment.PipelineSegment;
import org.pipelineplanner.planner.segment.SegmentPlan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubstraitTranslatorTest {

  private final SubstraitTranslator translator = new SubstraitTranslator();

  @Test
  void should_translate_scan_to_leaf_pipeline() {
    PipelineSegment pipeline =
        assertInstanceOf(PipelineSegment.class, translator.translate(scan("db", "orders")));

    assertEquals("db/orders", pipeline.getName());
    assertInstanceOf(ReadOperator.class, pipeline.getSource());
    assertTrue(pipeline.getOperators().isEmpty());
    assertTrue(pipeline.getChildren().isEmpty());
  }

  @Test
  void should_translate_partition_source_to_leaf_pipeline() {
    SegmentPlan plan = translator.translate(partition("d1", "p7"));

    assertInstanceOf(PipelineSegment.class, plan);
    assertEquals("d1/p7", plan.getName());
    assertTrue(plan.isLeaf());
  }

  @Test
  void should_accumulate_streaming_operators_into_one_pipeline() {
    PipelineSegment pipeline =
        assertInstanceOf(
            PipelineSegment.class, translator.translate(limit(project(filter(scan("t"))))));

    assertEquals("t", pipeline.getName());
    assertEquals(
        List.of(OperatorType.FILTER, OperatorType.PROJECTION, OperatorType.LIMIT),
        types(pipeline.getOperators()));
    assertTrue(pipeline.getChildren().isEmpty());
  }

  @Test
  void should_keep_sort_in_pipeline() {
    PipelineSegment pipeline =
        assertInstanceOf(PipelineSegment.class, translator.translate(sort(filter(scan("t")))));

    assertEquals(List.of(OperatorType.FILTER, OperatorType.SORT), types(pipeline.getOperators()));
  }

  @Test
  void should_break_pipeline_at_aggregation() {
    BreakSegment aggregation =
        assertInstanceOf(BreakSegment.class, translator.translate(aggregate(scan("t"))));

    assertEquals("t", aggregation.getName());
    assertInstanceOf(AggregationOperator.class, aggregation.getOperator());
    assertEquals(1, aggregation.getChildren().size());
    assertEquals(translator.translate(scan("t")), aggregation.getChildren().get(0));
  }

  @Test
  void should_break_pipeline_at_join_with_left_then_right_children() {
    BreakSegment join =
        assertInstanceOf(BreakSegment.class, translator.translate(join(scan("a"), scan("b"))));

    assertEquals("a.b", join.getName());
    assertInstanceOf(JoinOperator.class, join.getOperator());
    assertNull(join.getOperator().getName());
    assertEquals(
        List.of("a", "b"),
        join.getChildren().stream().map(SegmentPlan::getName).collect(Collectors.toList()));
  }

  @Test
  void should_start_new_pipeline_above_break() {
    PipelineSegment pipeline =
        assertInstanceOf(
            PipelineSegment.class,
            translator.translate(limit(filter(aggregate(filter(scan("t")))))));

    assertEquals("t", pipeline.getName());
    assertNull(pipeline.getSource());
    assertEquals(List.of(OperatorType.FILTER, OperatorType.LIMIT), types(pipeline.getOperators()));

    BreakSegment aggregation = assertInstanceOf(BreakSegment.class, pipeline.getChildren().get(0));
    PipelineSegment scanSide =
        assertInstanceOf(PipelineSegment.class, aggregation.getChildren().get(0));
    assertEquals(List.of(OperatorType.FILTER), types(scanSide.getOperators()));
  }

  @Test
  void should_name_nested_breaks_after_all_leaves() {
    SegmentPlan plan =
        translator.translate(join(join(scan("a"), partition("d", "p")), aggregate(scan("c"))));

    assertEquals("a.d/p.c", plan.getName());
  }

  @Test
  void should_break_pipeline_at_physical_joins_and_set_operations() {
    assertEquals(
        OperatorType.HASH_JOIN,
        ((BreakSegment) translator.translate(hashJoin(scan("a"), scan("b"))))
            .getOperator()
            .getType());
    assertEquals(
        OperatorType.MERGE_JOIN,
        ((BreakSegment) translator.translate(mergeJoin(scan("a"), scan("b"))))
            .getOperator()
            .getType());

    BreakSegment union =
        assertInstanceOf(
            BreakSegment.class, translator.translate(union(scan("a"), scan("b"), scan("c"))));
    assertEquals("a.b.c", union.getName());
    assertEquals(3, union.getChildren().size());
  }

  @Test
  void should_explain_translated_tree() {
    SegmentPlan plan = translator.translate(aggregate(join(filter(scan("a")), scan("b"))));

    assertEquals(
        "BreakSegment(a.b) <Aggregation()>\n"
            + "  BreakSegment(a.b) <Join(JOIN_TYPE_INNER)>\n"
            + "    PipelineSegment(a) <Read(named_table)> [Filter()]\n"
            + "    PipelineSegment(b) <Read(named_table)> []",
        plan.explain());
  }

  @Test
  void should_fail_on_unsupported_relation_anywhere_in_tree() {
    UnsupportedOperatorException exception =
        assertThrows(
            UnsupportedOperatorException.class,
            () -> translator.translate(join(scan("a"), filter(extensionMulti(scan("b"))))));

    assertEquals("EXTENSION_MULTI", exception.getRelationKind());
  }

  @Test
  void should_reject_plans_deeper_than_allowed() {
    PlannerSettings settings = PlannerSettings.defaults();
    settings.setMaxPlanDepth(3);
    SubstraitTranslator shallow = new SubstraitTranslator(settings);

    assertEquals("t", shallow.translate(limit(filter(scan("t")))).getName());
    assertThrows(
        MalformedPlanException.class, () -> shallow.translate(sort(limit(filter(scan("t"))))));
  }

  @Test
  void should_create_one_operator_per_relation() {
    OperatorFactory factory = spy(new OperatorFactory(PlannerSettings.defaults()));
    SubstraitTranslator counting = new SubstraitTranslator(factory, 100);
    Rel left = filter(scan("a"));

    counting.translate(join(left, aggregate(scan("b"))));

    verify(factory, times(5)).create(any(Rel.class));
    verify(factory).create(left);
  }

  @Test
  void should_translate_sibling_subtrees_independently() {
    Rel shared = filter(scan("a"));

    BreakSegment join = (BreakSegment) translator.translate(join(shared, shared));

    SegmentPlan left = join.getChildren().get(0);
    SegmentPlan right = join.getChildren().get(1);
    assertEquals(left, right);
    assertNotSame(left, right);
  }

  private static List<OperatorType> types(List<Operator> operators) {
    return operators.stream().map(Operator::getType).collect(Collectors.toList());
  }
}
