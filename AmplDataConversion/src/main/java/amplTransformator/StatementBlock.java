package amplTransformator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The physical lines of one statement, as gathered by {@link DatBlockScanner}.
 * The first line is already comment-stripped; following lines are raw.
 */
public class StatementBlock {

    private final StatementKind kind;
    private final int firstLineNumber;
    private final List<String> lines;

    public StatementBlock(StatementKind kind, int firstLineNumber, List<String> lines) {
        this.kind = kind;
        this.firstLineNumber = firstLineNumber;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public StatementKind getKind() {
        return kind;
    }

    /** 1-based line number of the statement's first line. */
    public int getFirstLineNumber() {
        return firstLineNumber;
    }

    public List<String> getLines() {
        return lines;
    }

    public String getHeader() {
        return lines.get(0);
    }

    /** Lines after the header, still carrying their comments. */
    public List<String> getDataLines() {
        return lines.subList(1, lines.size());
    }

    /** Comment-free text of the whole block, joined with single spaces. */
    public String joinedText() {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(DatLineNormalizer.stripComment(line));
        }
        return sb.toString();
    }
}
