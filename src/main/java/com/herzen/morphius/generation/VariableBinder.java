package com.herzen.morphius.generation;

import com.herzen.morphius.domain.DomainModels.BoundValue;
import com.herzen.morphius.domain.DomainModels.Question;
import com.herzen.morphius.domain.DomainModels.Scope;
import com.herzen.morphius.domain.DomainModels.Var;
import com.herzen.morphius.expression.EvaluationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.random.RandomGenerator;

@Component
public class VariableBinder {

    public Scope bind(Question question, RandomGenerator random) {
        Map<String, BoundValue> values = new LinkedHashMap<>();
        question.vars().values().forEach(v -> values.put(v.name(), draw(v, random)));
        return new Scope(values);
    }

    public BoundValue draw(Var v, RandomGenerator random) {
        return switch (v.kind()) {
            case INT -> drawInt(v, random);
            case REAL -> drawReal(v, random);
        };
    }

    private BoundValue drawInt(Var v, RandomGenerator random) {
        if (v.min() > v.max()) throw emptyRange(v);
        return BoundValue.ofInt(random.nextLong(v.min(), (long) v.max() + 1));
    }

    // whole part from [min, max), fraction in thousandths
    private BoundValue drawReal(Var v, RandomGenerator random) {
        if (v.min() >= v.max()) throw emptyRange(v);
        long whole = random.nextLong(v.min(), v.max());
        return BoundValue.ofReal(whole, random.nextInt(0, 1000));
    }

    private EvaluationException emptyRange(Var v) {
        return new EvaluationException(EvaluationException.EMPTY_RANGE,
                "No value can be drawn for " + v.name() + " " + v.kind().name().toLowerCase(Locale.ROOT) + " [" + v.min() + "," + v.max() + "]",
                null);
    }
}
