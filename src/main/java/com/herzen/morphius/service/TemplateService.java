package com.herzen.morphius.service;

import com.herzen.morphius.config.GenerationProperties;
import com.herzen.morphius.domain.DomainModels.Document;
import com.herzen.morphius.generation.GenerationModels.GenerationOptions;
import com.herzen.morphius.generation.GenerationModels.GenerationResult;
import com.herzen.morphius.generation.LayoutMode;
import com.herzen.morphius.generation.TestGenerator;
import com.herzen.morphius.parser.ParserDtos.ParseError;
import com.herzen.morphius.parser.ParserDtos.ParseResult;
import com.herzen.morphius.parser.TemplateParser;
import com.herzen.morphius.validation.TemplateValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

@Service
public class TemplateService {
    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final TemplateParser parser;
    private final TemplateValidator validator;
    private final TestGenerator generator;
    private final GenerationProperties properties;

    public TemplateService(TemplateParser parser,
                           TemplateValidator validator,
                           TestGenerator generator,
                           GenerationProperties properties) {
        this.parser = parser;
        this.validator = validator;
        this.generator = generator;
        this.properties = properties;
    }

    public ParseResult parse(String content, boolean withAnswers) {
        if (content == null) {
            throw new IllegalArgumentException("Template content is required");
        }
        ParseResult parsed = withAnswers ? parser.parseWithAnswers(content) : parser.parse(content);
        List<ParseError> errors = new ArrayList<>(parsed.errors());
        errors.addAll(validator.validate(parsed.document()));
        return new ParseResult(parsed.document(), errors, parsed.warnings());
    }

    public GenerateOutcome generate(GenerateCommand command) {
        if (command.numResults() < 0 || command.numResults() > properties.getMaxResults()) {
            throw new IllegalArgumentException("numResults must be between 0 and " + properties.getMaxResults()
                    + ", got " + command.numResults());
        }
        ParseResult parsed = parse(command.content(), command.withAnswers());
        if (!parsed.valid()) {
            log.info("Template rejected with {} errors", parsed.errors().size());
            return new GenerateOutcome(false, parsed, null);
        }

        LayoutMode layoutMode = command.layoutMode() == null ? properties.getLayoutMode() : command.layoutMode();
        GenerationOptions options = new GenerationOptions(command.numQuestions(), layoutMode,
                properties.isFailFast(), properties.isParallel());
        Long seed = command.seed() != null ? command.seed() : properties.getSeed();
        SplittableRandom random = seed == null ? new SplittableRandom() : new SplittableRandom(seed);

        Document doc = parsed.document();
        GenerationResult result = generator.generateWith(doc, command.numResults(), options, random);
        log.info("Generated {} tests from {} questions, {} render errors",
                result.outcomes().size(), doc.questions().size(), result.errors().size());
        return new GenerateOutcome(result.valid(), parsed, result);
    }

    public record GenerateCommand(String content,
                                  boolean withAnswers,
                                  int numResults,
                                  Integer numQuestions,
                                  Long seed,
                                  LayoutMode layoutMode) {}

    public record GenerateOutcome(boolean valid, ParseResult parse, GenerationResult generation) {}
}
