package io.intellixity.vigil.advisor.scenario;

import io.intellixity.vigil.advisor.ast.AstNode;

/** A rule of an iteration; {@code formula} is null for a rule that has not been written yet. */
public record ScenarioRule(String id, String name, AstNode formula) {}
