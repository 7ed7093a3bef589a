package domain.source;

import domain.cst.ParseOutcome;

import java.util.Objects;

/** A statement slice together with what parsing it produced. */
public final class StatementParseResult {

    private final StatementSlice slice;
    private final ParseOutcome outcome;

    public StatementParseResult(StatementSlice slice, ParseOutcome outcome) {
        this.slice = Objects.requireNonNull(slice, "slice");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public StatementSlice getSlice() {
        return slice;
    }

    public ParseOutcome getOutcome() {
        return outcome;
    }

    public boolean isParsed() {
        return outcome.isParsed();
    }
}
