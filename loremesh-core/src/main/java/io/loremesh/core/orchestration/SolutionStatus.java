package io.loremesh.core.orchestration;

public enum SolutionStatus {
    SOLVED,
    FAILED
}
