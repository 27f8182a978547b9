package amplTransformator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Walks the raw lines of a .dat file once and cuts them into statements.
 *
 * <p>A scalar param is always a single line. Set and indexed statements run until the
 * first line containing ';'. Lines that start no known statement are skipped.
 */
public class DatBlockScanner {

    static final Pattern SCALAR_PARAM = Pattern.compile("^param\\s+([A-Za-z_]\\w*)\\s*=\\s*([^;]+)\\s*;\\s*$");

    private final List<String> rawLines;
    private final String fileName;
    private final ParseDiagnostics diagnostics;
    private int cursor;

    public DatBlockScanner(List<String> rawLines, String fileName, ParseDiagnostics diagnostics) {
        this.rawLines = rawLines;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
        this.cursor = 0;
    }

    /**
     * @return the next statement, or {@code null} once the input is exhausted
     */
    public StatementBlock next() {
        while (cursor < rawLines.size()) {
            int lineNumber = cursor + 1;
            String line = DatLineNormalizer.stripComment(rawLines.get(cursor));
            if (line.isEmpty()) {
                cursor++;
                continue;
            }

            StatementKind kind = classify(line);
            if (kind == StatementKind.SCALAR_PARAM) {
                cursor++;
                return new StatementBlock(kind, lineNumber, List.of(line));
            }
            if (kind != null) {
                return new StatementBlock(kind, lineNumber, collectUntilTerminator(line));
            }

            diagnostics.skip(fileName, lineNumber, line, ParseDiagnostics.SkipReason.UNRECOGNIZED_STATEMENT);
            cursor++;
        }
        return null;
    }

    /**
     * Decides the statement kind from the comment-free first line.
     *
     * @return the kind, or {@code null} if the line starts no supported statement
     */
    static StatementKind classify(String line) {
        if (SCALAR_PARAM.matcher(line).matches()) {
            return StatementKind.SCALAR_PARAM;
        }
        if (line.startsWith("set ")) {
            return StatementKind.SET;
        }
        if (line.startsWith("param ") && line.contains(":=")) {
            String beforeAssign = line.substring(0, line.indexOf(":="));
            return beforeAssign.contains(":") ? StatementKind.TABLE_PARAM : StatementKind.INDEXED_PARAM;
        }
        return null;
    }

    // The ';' test runs on the raw line, so a ';' inside a trailing comment also ends the block.
    private List<String> collectUntilTerminator(String header) {
        List<String> block = new ArrayList<>();
        block.add(header);
        cursor++;
        while (cursor < rawLines.size() && !block.get(block.size() - 1).contains(";")) {
            block.add(rawLines.get(cursor));
            cursor++;
        }
        return block;
    }
}
