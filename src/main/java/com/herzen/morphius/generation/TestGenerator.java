package com.herzen.morphius.generation;

import com.herzen.morphius.domain.DomainModels.Document;
import com.herzen.morphius.expression.EvaluationException;
import com.herzen.morphius.generation.GenerationModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.random.RandomGenerator.SplittableGenerator;
import java.util.stream.IntStream;

/**
 * Generates test variants from a parsed document. Each requested test gets its own generator split
 * off the caller's, in request order, so a seeded run is reproducible whether or not tests are
 * rendered in parallel.
 */
@Component
public class TestGenerator {
    private static final Logger log = LoggerFactory.getLogger(TestGenerator.class);

    private final PermutationSelector selector;
    private final TestAssembler assembler;

    public TestGenerator(PermutationSelector selector, TestAssembler assembler) {
        this.selector = selector;
        this.assembler = assembler;
    }

    // numQuestions null means every question in template order
    public GenerationResult generate(Document doc, int numResults, Integer numQuestions, SplittableGenerator random) {
        GenerationOptions options = numQuestions == null
                ? GenerationOptions.allInOrder()
                : GenerationOptions.select(numQuestions);
        return generateWith(doc, numResults, options, random);
    }

    public GenerationResult generateWith(Document doc, int numResults, GenerationOptions options, SplittableGenerator random) {
        if (numResults < 0) {
            throw new IllegalArgumentException("numResults must be >= 0, got " + numResults);
        }
        List<RandomGenerator> perTest = new ArrayList<>(numResults);
        for (int i = 0; i < numResults; i++) {
            perTest.add(random.split());
        }

        IntStream indexes = IntStream.range(0, numResults);
        if (options.parallel()) indexes = indexes.parallel();
        List<TestOutcome> outcomes = indexes
                .mapToObj(i -> generateOne(doc, i, options, perTest.get(i)))
                .toList();

        long failed = outcomes.stream().filter(o -> !o.ok()).count();
        log.debug("Generated {} tests ({} failed) from {} questions", numResults, failed, doc.questions().size());
        return new GenerationResult(outcomes);
    }

    private TestOutcome generateOne(Document doc, int testIndex, GenerationOptions options, RandomGenerator random) {
        int total = doc.questions().size();
        List<Integer> order = options.numQuestions() == null
                ? selector.originalOrder(total)
                : selector.select(total, options.numQuestions(), random);

        List<RenderedQuestion> rendered = new ArrayList<>(order.size());
        List<RenderError> errors = new ArrayList<>();
        for (int questionIndex : order) {
            try {
                rendered.add(assembler.render(doc.questions().get(questionIndex), random));
            } catch (EvaluationException e) {
                RenderError error = new RenderError(testIndex, questionIndex, e.getCode(), e.getMessage(), e.getExpression());
                if (options.failFast()) {
                    throw new GenerationException(error, e);
                }
                log.debug("Test {} question {} failed: {}", testIndex, questionIndex, e.getMessage());
                errors.add(error);
            }
        }

        if (!errors.isEmpty()) {
            return new TestOutcome(testIndex, order, null, errors);
        }
        return new TestOutcome(testIndex, order, assembler.assemble(doc, order, rendered, options.layoutMode()), List.of());
    }
}
