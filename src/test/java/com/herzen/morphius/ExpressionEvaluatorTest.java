package com.herzen.morphius;

import com.herzen.morphius.domain.DomainModels.BoundValue;
import com.herzen.morphius.domain.DomainModels.Expression;
import com.herzen.morphius.domain.DomainModels.Scope;
import com.herzen.morphius.expression.EvaluationException;
import com.herzen.morphius.expression.ExpressionEvaluator;
import com.herzen.morphius.expression.ExpressionTokenizer;
import com.herzen.morphius.expression.NumberFormatting;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {
    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private String render(String source, Map<String, BoundValue> values) {
        return evaluator.render(expression(source), new Scope(values));
    }

    private Expression expression(String source) {
        return tokenizer.tokenize(source).expression();
    }

    @Test
    void roundsLongDecimalsToThreePlaces() {
        assertEquals("0.333", render("1/3", Map.of()));
        assertEquals("0.667", render("2/3", Map.of()));
    }

    @Test
    void roundsTheStoredValueRatherThanItsDecimalForm() {
        // 2.001 / 2 is stored just below 1.0005
        assertEquals("1.000", render("x/2", Map.of("x", BoundValue.ofReal(2, 1))));
        assertEquals("1.000", NumberFormatting.rounded(1.0005));
    }

    @Test
    void negativeZeroRendersAsZero() {
        assertEquals("0", render("0*-1", Map.of()));
    }

    @Test
    void keepsIntegersAndShortDecimalsExact() {
        assertEquals("1024", render("2^10", Map.of()));
        assertEquals("2.5", render("5/2", Map.of()));
        assertEquals("-0.125", render("-1/8", Map.of()));
    }

    @Test
    void substitutesBoundValues() {
        Map<String, BoundValue> values = Map.of("a", BoundValue.ofInt(2), "b", BoundValue.ofInt(3));

        assertEquals("5", render("a+b", values));
        assertEquals("-1", render("(a-b)", values));
        assertEquals("2+3", evaluator.substitute(expression("a+b"), new Scope(values)));
    }

    @Test
    void substitutesNegativeValues() {
        Map<String, BoundValue> values = Map.of("a", BoundValue.ofInt(5), "b", BoundValue.ofInt(-3));

        assertEquals("5--3", evaluator.substitute(expression("a-b"), new Scope(values)));
        assertEquals("8", render("a-b", values));
    }

    @Test
    void realValuesRenderInThousandths() {
        assertEquals("12.345", evaluator.format(BoundValue.ofReal(12, 345)));
        assertEquals("5.007", evaluator.format(BoundValue.ofReal(5, 7)));
        assertEquals("5", evaluator.format(BoundValue.ofReal(5, 0)));
        assertEquals("-2.5", evaluator.format(BoundValue.ofReal(-3, 500)));
        assertEquals("1", render("x/x", Map.of("x", BoundValue.ofReal(12, 345))));
    }

    @Test
    void divisionByZeroIsAnEvaluationError() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> render("10/d", Map.of("d", BoundValue.ofInt(0))));

        assertEquals(EvaluationException.ARITHMETIC_FAULT, e.getCode());
        assertEquals("10/0", e.getExpression());
    }

    @Test
    void malformedExpressionsAreEvaluationErrors() {
        assertEquals(EvaluationException.MALFORMED_EXPRESSION,
                assertThrows(EvaluationException.class, () -> render("", Map.of())).getCode());
        assertEquals(EvaluationException.MALFORMED_EXPRESSION,
                assertThrows(EvaluationException.class, () -> render("(1+2", Map.of())).getCode());
    }

    @Test
    void unboundVariableIsReported() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> render("q+1", Map.of()));

        assertEquals(EvaluationException.UNBOUND_VARIABLE, e.getCode());
    }

    @Test
    void formatsByComparingNaturalAndRoundedLength() {
        assertEquals("1", NumberFormatting.result(1.0));
        assertEquals("0.1", NumberFormatting.result(0.1));
        assertEquals("1234.568", NumberFormatting.result(1234.5678));
        assertEquals("100000000000000000000", NumberFormatting.result(1e20));
        assertEquals("1.000", NumberFormatting.rounded(1.0));
        assertEquals("0.3333333333333333", NumberFormatting.natural(1.0 / 3));
    }
}
