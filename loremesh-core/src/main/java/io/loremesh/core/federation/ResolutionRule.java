package io.loremesh.core.federation;

public enum ResolutionRule {
    HIGHER_CONFIDENCE,
    MORE_RECENT,
    TIE_DEFAULT
}
