package domain.cst;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link StatementParser#parseStatement(String, int)}.
 *
 * <p>Grammar problems never fail a parse; they come back inside {@link Parsed} as
 * diagnostics. Only text the classifier cannot tokenize yields {@link UnsupportedInput},
 * and then there is no tree at all.</p>
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.UnsupportedInput {

    boolean isParsed();

    /**
     * The parsed statement, or an {@link UnsupportedInputException} for unsupported input.
     */
    Parsed orElseThrow();

    record Parsed(SyntaxTree tree, List<ParseDiagnostic> diagnostics) implements ParseOutcome {

        public Parsed {
            Objects.requireNonNull(tree, "tree");
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }

        @Override
        public boolean isParsed() {
            return true;
        }

        @Override
        public Parsed orElseThrow() {
            return this;
        }
    }

    record UnsupportedInput(String message, SourceSpan span) implements ParseOutcome {

        public UnsupportedInput {
            message = message == null ? "" : message;
            Objects.requireNonNull(span, "span");
        }

        @Override
        public boolean isParsed() {
            return false;
        }

        @Override
        public Parsed orElseThrow() {
            throw new UnsupportedInputException(message, span);
        }
    }
}
