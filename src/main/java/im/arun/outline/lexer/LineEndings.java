package im.arun.outline.lexer;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line splitting and dominant line-ending detection.
 */
public final class LineEndings {
    public static final String DEFAULT = "\n";
    public static final String CRLF = "\r\n";
    public static final String CR = "\r";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private LineEndings() {}

    /**
     * Split on any line break. A trailing break yields a trailing empty line, so
     * joining the result with the original ending restores the text.
     */
    public static List<String> splitLines(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.asList(LINE_BREAK.split(text, -1));
    }

    /**
     * Most frequent line ending in {@code text}; ties prefer LF, then CRLF.
     */
    public static String detect(String text) {
        if (text == null || text.isEmpty()) {
            return DEFAULT;
        }

        int crlf = 0;
        int lf = 0;
        int cr = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    crlf++;
                    i++;
                } else {
                    cr++;
                }
            } else if (c == '\n') {
                lf++;
            }
        }

        if (lf >= crlf && lf >= cr) {
            return DEFAULT;
        }
        return crlf >= cr ? CRLF : CR;
    }
}
