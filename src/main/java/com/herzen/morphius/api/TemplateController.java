package com.herzen.morphius.api;

import com.herzen.morphius.domain.DomainModels.Question;
import com.herzen.morphius.domain.DomainModels.Var;
import com.herzen.morphius.generation.GenerationModels.TestOutcome;
import com.herzen.morphius.generation.LayoutMode;
import com.herzen.morphius.parser.ParserDtos.ParseError;
import com.herzen.morphius.parser.ParserDtos.ParseResult;
import com.herzen.morphius.service.TemplateService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/templates")
public class TemplateController {
    private final TemplateService templateService;

    public TemplateController(TemplateService templateService) {
        this.templateService = templateService;
    }

    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(@RequestBody ParseRequest request) {
        ParseResult result = templateService.parse(request.content(), request.withAnswers());
        List<QuestionSummary> questions = result.document().questions().stream()
                .map(TemplateController::summary)
                .toList();
        return ResponseEntity.ok(new ParseResponse(result.valid(), questions, result.errors(), result.warnings()));
    }

    @PostMapping("/generate")
    public ResponseEntity<GenerationResponse> generate(@RequestBody GenerateRequest request) {
        var outcome = templateService.generate(new TemplateService.GenerateCommand(
                request.content(), request.withAnswers(), request.numResults(),
                request.numQuestions(), request.seed(), request.layoutMode()));
        List<TestOutcome> tests = outcome.generation() == null ? List.of() : outcome.generation().outcomes();
        return ResponseEntity.ok(new GenerationResponse(outcome.valid(),
                outcome.parse().errors(), outcome.parse().warnings(), tests));
    }

    private static QuestionSummary summary(Question q) {
        return new QuestionSummary(q.line(), List.copyOf(q.vars().values()),
                q.expressions().stream().map(e -> e.source()).toList(),
                q.answer() != null);
    }

    public record ParseRequest(String content, boolean withAnswers) {}

    public record GenerateRequest(String content,
                                  boolean withAnswers,
                                  int numResults,
                                  Integer numQuestions,
                                  Long seed,
                                  LayoutMode layoutMode) {}

    public record QuestionSummary(int line, List<Var> variables, List<String> expressions, boolean hasAnswer) {}

    public record ParseResponse(boolean valid, List<QuestionSummary> questions,
                                List<ParseError> errors, List<ParseError> warnings) {}

    public record GenerationResponse(boolean valid, List<ParseError> errors, List<ParseError> warnings,
                                     List<TestOutcome> tests) {}
}
