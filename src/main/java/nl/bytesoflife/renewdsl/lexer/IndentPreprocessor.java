package nl.bytesoflife.renewdsl.lexer;

import nl.bytesoflife.renewdsl.DslSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rewrites significant indentation into explicit block markers.
 * <p>
 * A line indented deeper than the enclosing level is prefixed with one {@link #INDENT}
 * marker, however far it jumps. A shallower line is prefixed with one {@link #DEDENT}
 * marker per level closed. Markers share the line they belong to, so line numbers stay
 * aligned with the source. Levels still open at the end are closed on one extra
 * trailing line.
 * <p>
 * Dedents are lenient by default: levels are popped until the top is no deeper than
 * the line, even if that width was never opened.
 */
public class IndentPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(IndentPreprocessor.class);

    public static final String INDENT = "<INDENT>";
    public static final String DEDENT = "<DEDENT>";

    private final int tabWidth;
    private final boolean strictDedent;

    public IndentPreprocessor() {
        this(4, false);
    }

    public IndentPreprocessor(int tabWidth, boolean strictDedent) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be >= 1");
        }
        this.tabWidth = tabWidth;
        this.strictDedent = strictDedent;
    }

    public String process(String text) {
        Deque<Integer> levels = new ArrayDeque<>();
        levels.push(0);

        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length() + 32);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) out.append('\n');

            if (isBlank(line)) {
                out.append(line);
                continue;
            }

            int contentStart = leadingWhitespaceEnd(line);
            int width = measureIndent(line, contentStart);

            if (width > levels.peek()) {
                log.trace("line {}: indent {} -> {}", i + 1, levels.peek(), width);
                levels.push(width);
                out.append(INDENT).append(line);
            } else if (width < levels.peek()) {
                StringBuilder markers = new StringBuilder();
                while (width < levels.peek()) {
                    levels.pop();
                    markers.append(DEDENT);
                }
                log.trace("line {}: dedent to {} (top now {})", i + 1, width, levels.peek());
                if (strictDedent && width != levels.peek()) {
                    throw new DslSyntaxException("Dedent to width " + width
                            + " does not match any enclosing indentation level", i + 1, contentStart + 1);
                }
                out.append(markers).append(line);
            } else {
                out.append(line);
            }
        }

        if (levels.size() > 1) {
            out.append('\n');
            while (levels.size() > 1) {
                levels.pop();
                out.append(DEDENT);
            }
        }

        return out.toString();
    }

    /**
     * Blank, whitespace-only and comment-only lines do not take part in indentation.
     */
    static boolean isBlank(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() || stripped.startsWith("#");
    }

    private static int leadingWhitespaceEnd(String line) {
        int pos = 0;
        while (pos < line.length() && (line.charAt(pos) == ' ' || line.charAt(pos) == '\t')) {
            pos++;
        }
        return pos;
    }

    int measureIndent(String line, int contentStart) {
        int width = 0;
        for (int i = 0; i < contentStart; i++) {
            if (line.charAt(i) == '\t') {
                width = (width / tabWidth + 1) * tabWidth;
            } else {
                width++;
            }
        }
        return width;
    }
}
