package com.herzen.morphius.validation;

import com.herzen.morphius.domain.DomainModels.Document;
import com.herzen.morphius.domain.DomainModels.Question;
import com.herzen.morphius.domain.DomainModels.Var;
import com.herzen.morphius.domain.DomainModels.VarKind;
import com.herzen.morphius.parser.ParserDtos.Codes;
import com.herzen.morphius.parser.ParserDtos.ParseError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TemplateValidator {
    public List<ParseError> validate(Document doc) {
        List<ParseError> errors = new ArrayList<>();
        for (Question question : doc.questions()) {
            question.vars().values().forEach(v -> checkRange(v, question.line(), errors));
        }
        return errors;
    }

    private void checkRange(Var v, int line, List<ParseError> errors) {
        if (v.min() > v.max()) {
            errors.add(new ParseError(Codes.INVALID_BOUNDS,
                    "Lower bound exceeds upper bound for " + v.name() + ": [" + v.min() + "," + v.max() + "]",
                    line, "variable", v.name()));
        } else if (v.kind() == VarKind.REAL && v.min() == v.max()) {
            errors.add(new ParseError(Codes.EMPTY_RANGE,
                    "Real variable " + v.name() + " needs min < max, whole part is drawn from [min, max)",
                    line, "variable", v.name()));
        }
    }
}
