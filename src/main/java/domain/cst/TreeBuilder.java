package domain.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable tree construction over an explicit stack of open frames.
 *
 * <p>The top level acts as an implicit frame of depth 0 that is never closed, so no call
 * sequence can fail: leaves appended with nothing open and nodes closed from an empty
 * stack simply land at the top level.</p>
 *
 * <p>Offsets passed in and tracked here are relative to the statement; {@code baseOffset}
 * is added once when nodes, leaves and diagnostics are materialized.</p>
 */
public final class TreeBuilder {

    private static final class Frame {
        final SyntaxKind kind;
        final int depth;
        final int start;
        final List<SyntaxElement> children = new ArrayList<>();

        Frame(SyntaxKind kind, int depth, int start) {
            this.kind = kind;
            this.depth = depth;
            this.start = start;
        }
    }

    private final int baseOffset;
    private final List<Frame> stack = new ArrayList<>();
    private final List<SyntaxElement> topLevel = new ArrayList<>();
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private int offset = 0;

    public TreeBuilder() {
        this(0);
    }

    public TreeBuilder(int baseOffset) {
        if (baseOffset < 0) throw new IllegalArgumentException("baseOffset must be >= 0: " + baseOffset);
        this.baseOffset = baseOffset;
    }

    /** Closes open frames at {@code depth} or deeper, then opens a new one. */
    public void open(SyntaxKind kind, int depth) {
        closeTo(depth);
        stack.add(new Frame(kind, depth, offset));
    }

    public void appendLeaf(SyntaxKind kind, String text) {
        String t = text == null ? "" : text;
        SourceSpan span = SourceSpan.of(offset, offset + t.length()).shift(baseOffset);
        currentChildren().add(new SyntaxLeaf(kind, t, span));
        offset += t.length();
    }

    /** Closes frames until the innermost open frame is shallower than {@code depth}. */
    public void closeTo(int depth) {
        while (!stack.isEmpty() && top().depth >= depth) {
            closeTop();
        }
    }

    public void recordError(DiagnosticCode code, String message, SourceSpan span) {
        SourceSpan s = span == null ? SourceSpan.empty(offset) : span;
        diagnostics.add(new ParseDiagnostic(code, message, s).shift(baseOffset));
    }

    /** Depth of the innermost open frame, 0 at the top level. */
    public int currentDepth() {
        return stack.isEmpty() ? 0 : top().depth;
    }

    public int openFrames() {
        return stack.size();
    }

    /** Closes everything still open and returns the tree built so far. */
    public SyntaxTree finish() {
        while (!stack.isEmpty()) {
            closeTop();
        }
        return new SyntaxTree(topLevel, SourceSpan.of(0, offset).shift(baseOffset));
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    private Frame top() {
        return stack.get(stack.size() - 1);
    }

    private List<SyntaxElement> currentChildren() {
        return stack.isEmpty() ? topLevel : top().children;
    }

    private void closeTop() {
        Frame f = stack.remove(stack.size() - 1);
        SourceSpan span = SourceSpan.of(f.start, offset).shift(baseOffset);
        currentChildren().add(new SyntaxNode(f.kind, f.depth, span, f.children));
    }
}
