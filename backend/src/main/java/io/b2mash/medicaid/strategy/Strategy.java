package io.b2mash.medicaid.strategy;

import java.util.List;

/**
 * A mitigation candidate for a human planner to review. Created per request and never mutated.
 *
 * @param id stable identifier, unique within one result
 * @param category strategy category
 * @param description what the strategy does
 * @param pros supporting considerations, never empty
 * @param cons opposing considerations, never empty
 * @param effectiveness how much the strategy is expected to help
 * @param priority ordering key; results are sorted by descending priority
 * @param effort how much work implementation takes
 * @param estimatedImpact estimated cost or benefit in plain words
 * @param specificActions ordered implementation steps
 */
public record Strategy(
    String id,
    StrategyCategory category,
    String description,
    List<String> pros,
    List<String> cons,
    StrategyRating effectiveness,
    StrategyRating priority,
    StrategyRating effort,
    String estimatedImpact,
    List<String> specificActions) {

  public Strategy {
    if (pros == null || pros.isEmpty() || cons == null || cons.isEmpty()) {
      throw new IllegalArgumentException("Strategy " + id + " must list both pros and cons");
    }
    pros = List.copyOf(pros);
    cons = List.copyOf(cons);
    specificActions = specificActions != null ? List.copyOf(specificActions) : List.of();
  }
}
