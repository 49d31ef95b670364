package com.herzen.morphius.parser;

import com.herzen.morphius.domain.DomainModels.*;
import com.herzen.morphius.expression.ExpressionTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.herzen.morphius.parser.ParserDtos.*;
import static com.herzen.morphius.parser.TemplateMarkers.*;

@Component
public class TemplateParser {
    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    private final ExpressionTokenizer tokenizer;

    public TemplateParser(ExpressionTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public ParseResult parse(String content) {
        return parse(content, false);
    }

    // a question without a trailing answer block stays in the layout and is reported as a warning
    public ParseResult parseWithAnswers(String content) {
        return parse(content, true);
    }

    private ParseResult parse(String content, boolean withAnswers) {
        List<ParseError> errors = new ArrayList<>();
        List<ParseError> warnings = new ArrayList<>();
        List<Question> questions = new ArrayList<>();
        List<String> layout = new ArrayList<>();

        Pattern pattern = withAnswers ? QUESTION_WITH_ANSWER : QUESTION;
        Matcher matcher = pattern.matcher(content);
        int last = 0;
        while (matcher.find()) {
            addLayout(content, last, matcher.start(), withAnswers, layout, warnings);
            int line = lineOf(content, matcher.start());
            Body answerBody = withAnswers ? body(matcher.group(2)) : null;
            questions.add(question(content, matcher.start(1), matcher.group(1), answerBody, line, errors, warnings));
            last = matcher.end();
        }
        addLayout(content, last, content.length(), withAnswers, layout, warnings);

        log.debug("Parsed template: {} questions, {} errors, {} warnings", questions.size(), errors.size(), warnings.size());
        return new ParseResult(new Document(questions, layout), errors, warnings);
    }

    private void addLayout(String content, int from, int to, boolean withAnswers,
                           List<String> layout, List<ParseError> warnings) {
        String segment = content.substring(from, to);
        layout.add(segment);
        if (!withAnswers) return;

        Matcher orphan = QUESTION.matcher(segment);
        while (orphan.find()) {
            warnings.add(new ParseError(Codes.QUESTION_WITHOUT_ANSWER,
                    "Question is not followed by an answer block and was skipped",
                    lineOf(content, from + orphan.start()), "question", null));
        }
    }

    private Question question(String content, int offset, String source, Body answerBody, int line,
                              List<ParseError> errors, List<ParseError> warnings) {
        Map<String, Var> declared = new LinkedHashMap<>();
        StringBuilder stripped = new StringBuilder();
        Matcher decl = DECLARATION.matcher(source);
        int last = 0;
        while (decl.find()) {
            stripped.append(source, last, decl.start());
            last = decl.end();
            int declLine = lineOf(content, offset + decl.start());
            declare(decl, declLine, errors).ifPresent(v -> {
                if (declared.put(v.name(), v) != null) {
                    warnings.add(new ParseError(Codes.DUPLICATE_DECLARATION,
                            "Variable declared more than once, last declaration wins: " + v.name(),
                            declLine, "variable", v.name()));
                }
            });
        }
        stripped.append(source.substring(last));

        Matcher malformed = ANY_DECLARATION.matcher(stripped);
        while (malformed.find()) {
            warnings.add(new ParseError(Codes.MALFORMED_DECLARATION,
                    "Cannot parse variable declaration: " + malformed.group(1), line, "variable", null));
        }

        Body body = body(stripped.toString());
        Map<String, Var> vars = new LinkedHashMap<>();
        body.identifiers().forEach(name -> vars.put(name, Var.defaultFor(name)));
        if (answerBody != null) {
            answerBody.identifiers().forEach(name -> vars.putIfAbsent(name, Var.defaultFor(name)));
        }

        declared.forEach((name, v) -> {
            if (!vars.containsKey(name)) {
                warnings.add(new ParseError(Codes.UNUSED_DECLARATION,
                        "Variable is declared but never used: " + name, line, "variable", name));
            }
            vars.put(name, v);
        });

        Answer answer = answerBody == null ? null : new Answer(answerBody.expressions(), answerBody.layout());
        return new Question(vars, body.expressions(), body.layout(), answer, line);
    }

    private Optional<Var> declare(Matcher decl, int line, List<ParseError> errors) {
        String name = decl.group(1);
        Optional<VarKind> kind = VarKind.of(decl.group(2));
        if (kind.isEmpty()) {
            errors.add(new ParseError(Codes.UNKNOWN_VAR_KIND,
                    "Variable kind must be int or real, got '" + decl.group(2) + "'", line, "variable", name));
            return Optional.empty();
        }
        try {
            int min = Integer.parseInt(decl.group(3));
            int max = Integer.parseInt(decl.group(4));
            return Optional.of(new Var(name, kind.get(), min, max));
        } catch (NumberFormatException e) {
            errors.add(new ParseError(Codes.INVALID_BOUNDS,
                    "Bounds must be 32-bit integers: [" + decl.group(3) + "," + decl.group(4) + "]", line, "variable", name));
            return Optional.empty();
        }
    }

    private Body body(String text) {
        List<Expression> expressions = new ArrayList<>();
        LinkedHashSet<String> identifiers = new LinkedHashSet<>();
        Matcher matcher = EXPRESSION.matcher(text);
        while (matcher.find()) {
            ExpressionTokenizer.Tokens tokens = tokenizer.tokenize(matcher.group(1));
            expressions.add(tokens.expression());
            identifiers.addAll(tokens.identifiers());
        }
        return new Body(expressions, split(EXPRESSION, text), identifiers);
    }

    private record Body(List<Expression> expressions, List<String> layout, Set<String> identifiers) {}
}
