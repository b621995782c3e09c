package com.bridgesentinel.core.scoring;

import java.util.Objects;

/**
 * A fitted model together with the diagnostics computed while fitting it.
 *
 * @since 1.0.0
 */
public final class TrainingResult {

    private final FittedScoringModel model;
    private final TrainingDiagnostics diagnostics;

    public TrainingResult(FittedScoringModel model, TrainingDiagnostics diagnostics) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    public FittedScoringModel getModel() {
        return model;
    }

    public TrainingDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
