package com.herzen.morphius.generation;

import com.herzen.morphius.generation.GenerationModels.RenderError;

public class GenerationException extends RuntimeException {
    private final RenderError error;

    public GenerationException(RenderError error, Throwable cause) {
        super("Test " + error.testIndex() + ", question " + error.questionIndex() + ": " + error.message(), cause);
        this.error = error;
    }

    public RenderError getError() {
        return error;
    }
}
