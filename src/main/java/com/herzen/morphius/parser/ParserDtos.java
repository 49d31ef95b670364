package com.herzen.morphius.parser;

import com.herzen.morphius.domain.DomainModels.Document;

import java.util.List;

public class ParserDtos {
    public record ParseError(String code, String message, int line, String block, String name) {}

    public record ParseResult(Document document, List<ParseError> errors, List<ParseError> warnings) {
        public ParseResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public static final class Codes {
        public static final String INVALID_BOUNDS = "INVALID_BOUNDS";
        public static final String EMPTY_RANGE = "EMPTY_RANGE";
        public static final String UNKNOWN_VAR_KIND = "UNKNOWN_VAR_KIND";
        public static final String QUESTION_WITHOUT_ANSWER = "QUESTION_WITHOUT_ANSWER";
        public static final String MALFORMED_DECLARATION = "MALFORMED_DECLARATION";
        public static final String DUPLICATE_DECLARATION = "DUPLICATE_DECLARATION";
        public static final String UNUSED_DECLARATION = "UNUSED_DECLARATION";

        private Codes() {}
    }
}
