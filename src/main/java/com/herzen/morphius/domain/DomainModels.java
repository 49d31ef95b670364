package com.herzen.morphius.domain;

import java.util.*;

public class DomainModels {
    public static final String NO_ANSWERS = "No Answers Provided";

    // layout.get(i) precedes questions.get(i); the last segment is trailing text
    public record Document(List<Question> questions, List<String> layout) {
        public Document {
            questions = List.copyOf(questions);
            layout = List.copyOf(layout);
            if (layout.size() != questions.size() + 1) {
                throw new IllegalArgumentException("Document layout must have " + (questions.size() + 1)
                        + " segments, got " + layout.size());
            }
        }
    }

    public record Question(Map<String, Var> vars, List<Expression> expressions, List<String> layout, Answer answer,
                           int line) {
        public Question {
            vars = Collections.unmodifiableMap(new LinkedHashMap<>(vars));
            expressions = List.copyOf(expressions);
            layout = List.copyOf(layout);
            requireInterleave(expressions, layout, "Question");
        }

        public Optional<Answer> answerOptional() {
            return Optional.ofNullable(answer);
        }

        public String template() {
            return replay(layout, expressions);
        }
    }

    public record Answer(List<Expression> expressions, List<String> layout) {
        public Answer {
            expressions = List.copyOf(expressions);
            layout = List.copyOf(layout);
            requireInterleave(expressions, layout, "Answer");
        }

        public String template() {
            return replay(layout, expressions);
        }
    }

    public record Var(String name, VarKind kind, int min, int max) {
        public static Var defaultFor(String name) {
            return new Var(name, VarKind.INT, 0, 99);
        }
    }

    public enum VarKind {
        INT, REAL;

        public static Optional<VarKind> of(String keyword) {
            return switch (keyword) {
                case "int" -> Optional.of(INT);
                case "real" -> Optional.of(REAL);
                default -> Optional.empty();
            };
        }
    }

    public record Expression(List<Fragment> fragments) {
        public Expression {
            fragments = List.copyOf(fragments);
        }

        public String source() {
            StringBuilder sb = new StringBuilder();
            for (Fragment fragment : fragments) {
                if (fragment instanceof Literal literal) {
                    sb.append(literal.text());
                } else if (fragment instanceof VarRef ref) {
                    sb.append(ref.name());
                }
            }
            return sb.toString();
        }
    }

    public sealed interface Fragment permits Literal, VarRef {}

    public record Literal(String text) implements Fragment {}

    public record VarRef(String name) implements Fragment {}

    // fraction is in thousandths, null for ints
    public record BoundValue(long whole, Integer fraction) {
        public static BoundValue ofInt(long value) {
            return new BoundValue(value, null);
        }

        public static BoundValue ofReal(long whole, int thousandths) {
            return new BoundValue(whole, thousandths);
        }

        public boolean real() {
            return fraction != null;
        }
    }

    public record Scope(Map<String, BoundValue> values) {
        public Scope {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Optional<BoundValue> get(String name) {
            return Optional.ofNullable(values.get(name));
        }
    }

    public record GeneratedTest(String content, String answers) {}

    private static void requireInterleave(List<Expression> expressions, List<String> layout, String owner) {
        if (layout.size() != expressions.size() + 1) {
            throw new IllegalArgumentException(owner + " layout must have " + (expressions.size() + 1)
                    + " segments, got " + layout.size());
        }
    }

    private static String replay(List<String> layout, List<Expression> expressions) {
        StringBuilder sb = new StringBuilder(layout.get(0));
        for (int i = 0; i < expressions.size(); i++) {
            sb.append("|<e>").append(expressions.get(i).source()).append("</e>|").append(layout.get(i + 1));
        }
        return sb.toString();
    }
}
