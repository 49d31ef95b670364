package com.herzen.morphius.expression;

import com.herzen.morphius.domain.DomainModels.*;
import net.objecthunter.exp4j.ExpressionBuilder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class ExpressionEvaluator {

    public String render(Expression expression, Scope scope) {
        return NumberFormatting.result(evaluate(expression, scope));
    }

    public double evaluate(Expression expression, Scope scope) {
        String text = substitute(expression, scope);
        double value;
        try {
            value = new ExpressionBuilder(text).build().evaluate();
        } catch (ArithmeticException e) {
            throw new EvaluationException(EvaluationException.ARITHMETIC_FAULT,
                    "Arithmetic fault in '" + text + "': " + e.getMessage(), text, e);
        } catch (RuntimeException e) {
            throw new EvaluationException(EvaluationException.MALFORMED_EXPRESSION,
                    "Cannot evaluate '" + text + "': " + e.getMessage(), text, e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new EvaluationException(EvaluationException.ARITHMETIC_FAULT,
                    "Expression '" + text + "' has no finite value", text);
        }
        return value;
    }

    public String substitute(Expression expression, Scope scope) {
        StringBuilder sb = new StringBuilder();
        for (Fragment fragment : expression.fragments()) {
            if (fragment instanceof Literal literal) {
                sb.append(literal.text());
            } else if (fragment instanceof VarRef ref) {
                BoundValue bound = scope.get(ref.name())
                        .orElseThrow(() -> new EvaluationException(EvaluationException.UNBOUND_VARIABLE,
                                "No value bound for variable " + ref.name(), null));
                sb.append(format(bound));
            }
        }
        return sb.toString();
    }

    public String format(BoundValue bound) {
        if (!bound.real()) return Long.toString(bound.whole());
        return BigDecimal.valueOf(bound.whole())
                .add(BigDecimal.valueOf(bound.fraction(), 3))
                .stripTrailingZeros()
                .toPlainString();
    }
}
