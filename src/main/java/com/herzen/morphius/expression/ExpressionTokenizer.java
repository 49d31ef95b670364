package com.herzen.morphius.expression;

import com.herzen.morphius.domain.DomainModels.Expression;
import com.herzen.morphius.domain.DomainModels.Fragment;
import com.herzen.morphius.domain.DomainModels.Literal;
import com.herzen.morphius.domain.DomainModels.VarRef;
import com.herzen.morphius.parser.TemplateMarkers;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;

@Component
public class ExpressionTokenizer {

    public Tokens tokenize(String source) {
        List<Fragment> fragments = new ArrayList<>();
        LinkedHashSet<String> identifiers = new LinkedHashSet<>();
        Matcher matcher = TemplateMarkers.IDENTIFIER_PATTERN.matcher(source);
        int last = 0;
        while (matcher.find()) {
            fragments.add(new Literal(source.substring(last, matcher.start())));
            fragments.add(new VarRef(matcher.group()));
            identifiers.add(matcher.group());
            last = matcher.end();
        }
        fragments.add(new Literal(source.substring(last)));
        return new Tokens(new Expression(fragments), List.copyOf(identifiers));
    }

    public record Tokens(Expression expression, List<String> identifiers) {}
}
