package com.herzen.morphius;

import com.herzen.morphius.domain.DomainModels.Literal;
import com.herzen.morphius.domain.DomainModels.VarRef;
import com.herzen.morphius.expression.ExpressionTokenizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTokenizerTest {
    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

    @Test
    void alternatesLiteralAndVariableFragments() {
        var tokens = tokenizer.tokenize("(a+b1)*2");

        assertEquals(List.of(new Literal("("), new VarRef("a"), new Literal("+"), new VarRef("b1"), new Literal(")*2")),
                tokens.expression().fragments());
        assertEquals(List.of("a", "b1"), tokens.identifiers());
    }

    @Test
    void isLossless() {
        for (String source : List.of("", "1/3", "x", " x_1 ^ 2 - -y ", "3.5*(rate+0.25)")) {
            assertEquals(source, tokenizer.tokenize(source).expression().source());
        }
    }

    @Test
    void registersEachIdentifierOnce() {
        var tokens = tokenizer.tokenize("x*x + y - x");

        assertEquals(List.of("x", "y"), tokens.identifiers());
    }

    @Test
    void digitsCannotStartAnIdentifier() {
        var tokens = tokenizer.tokenize("2x");

        assertEquals(List.of(new Literal("2"), new VarRef("x"), new Literal("")), tokens.expression().fragments());
    }
}
