/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.pipelineplanner.common.exception.PlanTranslationException;
import org.pipelineplanner.common.setting.PlannerSettings;
import org.pipelineplanner.planner.QueryPlan;
import org.pipelineplanner.planner.SubstraitTranslator;

/**
 * Reads a serialized Substrait plan from a file, translates it and prints the segment tree.
 *
 * <pre>
 * PlanExplainCommand &lt;plan-file&gt; [settings.json]
 * </pre>
 *
 * <p>Without a settings argument, {@code planner-settings.json} is read from the classpath.
 */
@Log4j2
@RequiredArgsConstructor
public class PlanExplainCommand {

  private final SubstraitTranslator translator;

  public static void main(String[] args) {
    if (args.length < 1 || args.length > 2) {
      System.err.println("Usage: PlanExplainCommand <plan-file> [settings.json]");
      System.exit(2);
    }

    try {
      PlannerSettings settings =
          args.length == 2
              ? PlannerSettings.load(Path.of(args[1]))
              : PlannerSettings.fromClasspath(PlanExplainCommand.class.getClassLoader());
      log.debug("Planner settings: {}", settings);

      PlanExplainCommand command = new PlanExplainCommand(new SubstraitTranslator(settings));
      System.out.println(command.run(Path.of(args[0])));
    } catch (IOException | PlanTranslationException | IllegalArgumentException e) {
      log.error("Failed to translate plan {}", args[0], e);
      System.exit(1);
    }
  }

  /**
   * Translates the plan stored in the given file.
   *
   * @param planFile file holding a serialized Substrait plan
   * @return the translated plan
   * @throws IOException if the file can't be read
   */
  public QueryPlan load(Path planFile) throws IOException {
    byte[] planBytes = Files.readAllBytes(planFile);
    log.info("Read {} bytes of Substrait plan from {}", planBytes.length, planFile);
    return QueryPlan.fromBytes(planBytes, translator);
  }

  /** Translates the plan stored in the given file and returns its explanation. */
  public String run(Path planFile) throws IOException {
    QueryPlan queryPlan = load(planFile);
    String explanation = queryPlan.explain();
    log.debug("Segment plan of {}:\n{}", planFile, explanation);
    return explanation;
  }
}
