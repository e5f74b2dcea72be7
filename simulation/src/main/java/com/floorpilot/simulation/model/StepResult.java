package com.floorpilot.simulation.model;

public record StepResult(DecisionState state, double reward, boolean terminal, StepInfo info) {
}
