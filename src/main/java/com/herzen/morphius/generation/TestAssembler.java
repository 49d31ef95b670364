package com.herzen.morphius.generation;

import com.herzen.morphius.domain.DomainModels.*;
import com.herzen.morphius.expression.ExpressionEvaluator;
import com.herzen.morphius.generation.GenerationModels.RenderedQuestion;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.random.RandomGenerator;

import static com.herzen.morphius.domain.DomainModels.NO_ANSWERS;

@Component
public class TestAssembler {
    private final VariableBinder binder;
    private final ExpressionEvaluator evaluator;

    public TestAssembler(VariableBinder binder, ExpressionEvaluator evaluator) {
        this.binder = binder;
        this.evaluator = evaluator;
    }

    public RenderedQuestion render(Question question, RandomGenerator random) {
        Scope scope = binder.bind(question, random);
        String content = render(question.layout(), question.expressions(), scope);
        String answer = question.answerOptional()
                .map(a -> render(a.layout(), a.expressions(), scope))
                .orElse(NO_ANSWERS);
        return new RenderedQuestion(content, answer);
    }

    public GeneratedTest assemble(Document doc, List<Integer> order, List<RenderedQuestion> rendered, LayoutMode mode) {
        List<String> contents = rendered.stream().map(RenderedQuestion::content).toList();
        List<String> answers = rendered.stream().map(RenderedQuestion::answer).toList();
        return new GeneratedTest(
                interleave(doc.layout(), order, contents, mode),
                interleave(doc.layout(), order, answers, mode));
    }

    String interleave(List<String> layout, List<Integer> order, List<String> rendered, LayoutMode mode) {
        StringBuilder sb = new StringBuilder();
        if (mode == LayoutMode.SOURCE_ANCHORED) {
            for (int j = 0; j < rendered.size(); j++) {
                sb.append(layout.get(order.get(j))).append(rendered.get(j));
            }
            sb.append(layout.get(layout.size() - 1));
        } else {
            for (int i = 0; i < layout.size(); i++) {
                sb.append(layout.get(i));
                if (i < rendered.size()) sb.append(rendered.get(i));
            }
        }
        return sb.toString();
    }

    private String render(List<String> layout, List<Expression> expressions, Scope scope) {
        StringBuilder sb = new StringBuilder(layout.get(0));
        for (int i = 0; i < expressions.size(); i++) {
            sb.append(evaluator.render(expressions.get(i), scope)).append(layout.get(i + 1));
        }
        return sb.toString();
    }
}
