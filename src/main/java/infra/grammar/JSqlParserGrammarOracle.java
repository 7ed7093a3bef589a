package infra.grammar;

import domain.cst.SourceSpan;
import domain.grammar.AstNode;
import domain.grammar.GrammarOracle;
import domain.grammar.GrammarOracleException;
import domain.grammar.GrammarToken;
import net.sf.jsqlparser.parser.CCJSqlParser;
import net.sf.jsqlparser.parser.CCJSqlParserConstants;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.parser.Node;
import net.sf.jsqlparser.parser.ParseException;
import net.sf.jsqlparser.parser.SimpleNode;
import net.sf.jsqlparser.parser.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link GrammarOracle} backed by JSqlParser.
 *
 * <p>{@link #scan} drains the JavaCC token manager; whitespace and comments are skipped by
 * the grammar and never show up. {@link #parse} walks the {@link SimpleNode} tree JSqlParser
 * builds for the statement in pre-order, reporting each node with the offset of its first
 * token. Only productions JSqlParser materializes as tree nodes (Statement, PlainSelect,
 * Column, Table, Function, ...) appear.</p>
 *
 * <p>Parsing runs with complex parsing off first. Its backtracking grows exponentially with
 * parenthesis nesting, so the retry with complex parsing on is only made for statements
 * nested at most {@link CCJSqlParserUtil#ALLOWED_NESTING_DEPTH} deep, and is bounded by a
 * timeout.</p>
 */
public final class JSqlParserGrammarOracle implements GrammarOracle {

    public static final long DEFAULT_COMPLEX_PARSE_TIMEOUT_MS = 6_000L;

    private static final ThreadFactory COMPLEX_PARSE_THREADS = r -> {
        Thread t = new Thread(r, "jsqlparser-complex-parse");
        t.setDaemon(true);
        return t;
    };

    private static final class Frame {
        final Node node;
        final int depth;

        Frame(Node node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    private final long complexParseTimeoutMs;

    public JSqlParserGrammarOracle() {
        this(DEFAULT_COMPLEX_PARSE_TIMEOUT_MS);
    }

    public JSqlParserGrammarOracle(long complexParseTimeoutMs) {
        if (complexParseTimeoutMs <= 0) {
            throw new IllegalArgumentException("complexParseTimeoutMs must be > 0: " + complexParseTimeoutMs);
        }
        this.complexParseTimeoutMs = complexParseTimeoutMs;
    }

    @Override
    public List<GrammarToken> scan(String text) throws GrammarOracleException {
        String s = text == null ? "" : text;
        List<GrammarToken> out = new ArrayList<>();
        TokenOffsetResolver offsets = new TokenOffsetResolver(s);

        try {
            CCJSqlParser parser = CCJSqlParserUtil.newParser(s);
            for (Token t = parser.getNextToken(); t != null && t.kind != CCJSqlParserConstants.EOF; t = parser.getNextToken()) {
                int start = offsets.next(t.beginLine, t.beginColumn, t.image);
                if (start < 0) continue;
                int end = start + (t.image == null ? 0 : t.image.length());
                out.add(new GrammarToken(tokenKindName(t.kind), SourceSpan.of(start, end)));
            }
        } catch (RuntimeException e) {
            throw new GrammarOracleException(firstLine(e.getMessage(), "lexical error"), e);
        }
        return out;
    }

    @Override
    public List<AstNode> parse(String text) throws GrammarOracleException {
        String s = text == null ? "" : text;
        if (isBlank(s)) return Collections.emptyList();

        Node root = parseRoot(s);
        if (root == null) return Collections.emptyList();

        Map<Token, Integer> tokenOffsets = resolveTokenOffsets(s, root);
        return flatten(root, tokenOffsets);
    }

    // no grammar token at all (blank or comment-only text): nothing to parse
    private static boolean isBlank(String s) {
        try {
            Token first = CCJSqlParserUtil.newParser(s).getNextToken();
            return first == null || first.kind == CCJSqlParserConstants.EOF;
        } catch (RuntimeException e) {
            // lexical error: let the parser report it
            return false;
        }
    }

    private Node parseRoot(String s) throws GrammarOracleException {
        try {
            return parseWith(s, false);
        } catch (ParseException | RuntimeException e) {
            if (CCJSqlParserUtil.getNestingDepth(s) > CCJSqlParserUtil.ALLOWED_NESTING_DEPTH) {
                throw new GrammarOracleException(firstLine(e.getMessage(), "parse error"), e);
            }
        }
        return parseComplex(s);
    }

    private Node parseComplex(String s) throws GrammarOracleException {
        ExecutorService executor = Executors.newSingleThreadExecutor(COMPLEX_PARSE_THREADS);
        Future<Node> future = executor.submit(() -> parseWith(s, true));
        try {
            return future.get(complexParseTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GrammarOracleException("parse timed out after " + complexParseTimeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new GrammarOracleException(firstLine(cause.getMessage(), "parse error"), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GrammarOracleException("parse interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Node parseWith(String s, boolean allowComplexParsing) throws ParseException {
        CCJSqlParser parser = CCJSqlParserUtil.newParser(s).withAllowComplexParsing(allowComplexParsing);
        parser.Statement();
        return parser.getASTRoot();
    }

    private static Map<Token, Integer> resolveTokenOffsets(String s, Node root) {
        Map<Token, Integer> out = new IdentityHashMap<>();
        Token first = (root instanceof SimpleNode) ? ((SimpleNode) root).jjtGetFirstToken() : null;
        TokenOffsetResolver offsets = new TokenOffsetResolver(s);
        for (Token t = first; t != null && t.kind != CCJSqlParserConstants.EOF; t = t.next) {
            int offset = offsets.next(t.beginLine, t.beginColumn, t.image);
            if (offset >= 0) out.put(t, offset);
        }
        return out;
    }

    private static List<AstNode> flatten(Node root, Map<Token, Integer> tokenOffsets) {
        List<AstNode> out = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));

        while (!stack.isEmpty()) {
            Frame top = stack.pop();
            Node node = top.node;

            Integer position = null;
            if (node instanceof SimpleNode) {
                Token first = ((SimpleNode) node).jjtGetFirstToken();
                if (first != null) position = tokenOffsets.get(first);
            }

            // nodes without a located first token are skipped; their children take their depth
            int childDepth = top.depth;
            if (position != null) {
                out.add(new AstNode(nodeName(node), position, top.depth));
                childDepth = top.depth + 1;
            }

            for (int i = node.jjtGetNumChildren() - 1; i >= 0; i--) {
                stack.push(new Frame(node.jjtGetChild(i), childDepth));
            }
        }
        return out;
    }

    static String tokenKindName(int kind) {
        if (kind < 0 || kind >= CCJSqlParserConstants.tokenImage.length) return "TOKEN_" + kind;
        String image = CCJSqlParserConstants.tokenImage[kind];
        if (image.length() >= 2
                && ((image.startsWith("\"") && image.endsWith("\""))
                || (image.startsWith("<") && image.endsWith(">")))) {
            image = image.substring(1, image.length() - 1);
        }
        return image.isEmpty() ? "TOKEN_" + kind : image;
    }

    private static String nodeName(Node node) {
        String name = node.toString();
        return (name == null || name.isBlank()) ? node.getClass().getSimpleName() : name;
    }

    private static String firstLine(String message, String fallback) {
        if (message == null || message.isBlank()) return fallback;
        String m = message.trim();
        int nl = m.indexOf('\n');
        return (nl > 0 ? m.substring(0, nl) : m).trim();
    }
}
