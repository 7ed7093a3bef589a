package infra.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns JavaCC (line, column) token positions into character offsets.
 *
 * <p>JavaCC columns are 1-based and may count a tab as several columns. A computed offset
 * is accepted only when the token image really sits there; otherwise the image is searched
 * forward from the previous token's end.</p>
 */
final class TokenOffsetResolver {

    private final String text;
    private final int[] lineStarts;
    private int cursor = 0;

    TokenOffsetResolver(String text) {
        this.text = text == null ? "" : text;
        this.lineStarts = computeLineStarts(this.text);
    }

    private static int[] computeLineStarts(String s) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\r') {
                if (i + 1 < s.length() && s.charAt(i + 1) == '\n') i++;
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        int[] out = new int[starts.size()];
        for (int i = 0; i < out.length; i++) out[i] = starts.get(i);
        return out;
    }

    /**
     * Offset of the next token in document order, or -1 when its image cannot be found.
     * Calls must follow token order.
     */
    int next(int beginLine, int beginColumn, String image) {
        String img = image == null ? "" : image;
        int offset = -1;

        int computed = fromLineColumn(beginLine, beginColumn);
        if (computed >= cursor && text.startsWith(img, computed)) {
            offset = computed;
        } else if (!img.isEmpty()) {
            offset = text.indexOf(img, cursor);
        }

        if (offset >= 0) cursor = offset + img.length();
        return offset;
    }

    private int fromLineColumn(int line, int column) {
        if (line < 1 || line > lineStarts.length || column < 1) return -1;
        int offset = lineStarts[line - 1] + column - 1;
        return offset <= text.length() ? offset : -1;
    }
}
