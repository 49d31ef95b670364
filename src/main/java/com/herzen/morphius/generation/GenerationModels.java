package com.herzen.morphius.generation;

import com.herzen.morphius.domain.DomainModels.GeneratedTest;

import java.util.List;
import java.util.Objects;

public class GenerationModels {
    public record GenerationOptions(Integer numQuestions, LayoutMode layoutMode, boolean failFast, boolean parallel) {
        public GenerationOptions {
            if (numQuestions != null && numQuestions < 0) {
                throw new IllegalArgumentException("numQuestions must be >= 0, got " + numQuestions);
            }
            layoutMode = layoutMode == null ? LayoutMode.POSITIONAL : layoutMode;
        }

        public static GenerationOptions allInOrder() {
            return new GenerationOptions(null, LayoutMode.POSITIONAL, false, false);
        }

        public static GenerationOptions select(int numQuestions) {
            return new GenerationOptions(numQuestions, LayoutMode.POSITIONAL, false, false);
        }
    }

    public record RenderError(int testIndex, int questionIndex, String code, String message, String expression) {}

    public record TestOutcome(int index, List<Integer> questionOrder, GeneratedTest test, List<RenderError> errors) {
        public TestOutcome {
            questionOrder = List.copyOf(questionOrder);
            errors = List.copyOf(errors);
        }

        public boolean ok() {
            return errors.isEmpty();
        }
    }

    public record GenerationResult(List<TestOutcome> outcomes) {
        public GenerationResult {
            outcomes = List.copyOf(outcomes);
        }

        public boolean valid() {
            return outcomes.stream().allMatch(TestOutcome::ok);
        }

        public List<GeneratedTest> tests() {
            return outcomes.stream().map(TestOutcome::test).filter(Objects::nonNull).toList();
        }

        public List<RenderError> errors() {
            return outcomes.stream().flatMap(o -> o.errors().stream()).toList();
        }
    }

    public record RenderedQuestion(String content, String answer) {}
}
