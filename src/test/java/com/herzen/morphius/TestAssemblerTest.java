package com.herzen.morphius;

import com.herzen.morphius.domain.DomainModels.Document;
import com.herzen.morphius.domain.DomainModels.GeneratedTest;
import com.herzen.morphius.expression.ExpressionEvaluator;
import com.herzen.morphius.expression.ExpressionTokenizer;
import com.herzen.morphius.generation.GenerationModels.RenderedQuestion;
import com.herzen.morphius.generation.LayoutMode;
import com.herzen.morphius.generation.TestAssembler;
import com.herzen.morphius.generation.VariableBinder;
import com.herzen.morphius.parser.TemplateParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class TestAssemblerTest {
    private static final String NUMBERED = "|<q>1</q>|Middle 1|<q>2</q>|Middle 2|<q>3</q>|";

    private final TemplateParser parser = new TemplateParser(new ExpressionTokenizer());
    private final TestAssembler assembler = new TestAssembler(new VariableBinder(), new ExpressionEvaluator());
    private final SplittableRandom random = new SplittableRandom(3);

    private String content(Document doc, List<Integer> order, LayoutMode mode) {
        List<RenderedQuestion> rendered = order.stream()
                .map(i -> assembler.render(doc.questions().get(i), random))
                .toList();
        return assembler.assemble(doc, order, rendered, mode).content();
    }

    @Test
    void positionalLayoutStaysInPlaceWhenQuestionsMove() {
        Document doc = parser.parse(NUMBERED).document();

        assertEquals("2Middle 13Middle 21", content(doc, List.of(1, 2, 0), LayoutMode.POSITIONAL));
        assertEquals("3Middle 12Middle 21", content(doc, List.of(2, 1, 0), LayoutMode.POSITIONAL));
        assertEquals("1Middle 12Middle 23", content(doc, List.of(0, 1, 2), LayoutMode.POSITIONAL));
    }

    @Test
    void positionalLayoutKeepsUnfilledSlots() {
        Document doc = parser.parse(NUMBERED).document();

        assertEquals("3Middle 1Middle 2", content(doc, List.of(2), LayoutMode.POSITIONAL));
    }

    @Test
    void sourceAnchoredLayoutFollowsItsQuestion() {
        Document doc = parser.parse(NUMBERED).document();

        assertEquals("Middle 12Middle 231", content(doc, List.of(1, 2, 0), LayoutMode.SOURCE_ANCHORED));
        assertEquals("Middle 23", content(doc, List.of(2), LayoutMode.SOURCE_ANCHORED));
        assertEquals("1Middle 12Middle 23", content(doc, List.of(0, 1, 2), LayoutMode.SOURCE_ANCHORED));
    }

    @Test
    void questionsWithoutAnswersGetPlaceholder() {
        Document doc = parser.parse("Beginning|<q>Question 1</q>|Middle|<q>Question 2</q>|End").document();
        List<RenderedQuestion> rendered = List.of(
                assembler.render(doc.questions().get(0), random),
                assembler.render(doc.questions().get(1), random));

        GeneratedTest test = assembler.assemble(doc, List.of(0, 1), rendered, LayoutMode.POSITIONAL);

        assertEquals("BeginningQuestion 1MiddleQuestion 2End", test.content());
        assertEquals("BeginningNo Answers ProvidedMiddleNo Answers ProvidedEnd", test.answers());
    }

    @Test
    void answerUsesTheQuestionScope() {
        Document doc = parser.parseWithAnswers("|<q>a=|<e>a</e>|, b=|<e>b</e>|</q>||<a>|<e>a</e>|+|<e>b</e>|</a>|").document();

        for (int i = 0; i < 20; i++) {
            RenderedQuestion rendered = assembler.render(doc.questions().get(0), random);
            String[] parts = rendered.content().replace("a=", "").replace(" b=", "").split(",");
            assertEquals(parts[0] + "+" + parts[1], rendered.answer());
        }
    }
}
