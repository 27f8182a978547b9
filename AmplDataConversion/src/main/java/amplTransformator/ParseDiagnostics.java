package amplTransformator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the lines the parser chose to skip. Skipping is part of the format
 * (unknown statements, short data lines, table rows with the wrong width), so
 * nothing here is an error; callers that care can inspect the list after parsing.
 */
public class ParseDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(ParseDiagnostics.class);

    public enum SkipReason {
        UNRECOGNIZED_STATEMENT,
        SHORT_LINE,
        ROW_SHAPE_MISMATCH
    }

    /**
     * One skipped physical line.
     */
    public static class SkippedLine {
        private final String fileName;
        private final int lineNumber;
        private final String text;
        private final SkipReason reason;

        public SkippedLine(String fileName, int lineNumber, String text, SkipReason reason) {
            this.fileName = fileName;
            this.lineNumber = lineNumber;
            this.text = text;
            this.reason = reason;
        }

        public String getFileName() {
            return fileName;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getText() {
            return text;
        }

        public SkipReason getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return fileName + ":" + lineNumber + " " + reason + " [" + text + "]";
        }
    }

    private final List<SkippedLine> skipped = new ArrayList<>();

    void skip(String fileName, int lineNumber, String text, SkipReason reason) {
        SkippedLine entry = new SkippedLine(fileName, lineNumber, text, reason);
        logger.debug("Skipped {}", entry);
        skipped.add(entry);
    }

    public List<SkippedLine> getSkippedLines() {
        return Collections.unmodifiableList(skipped);
    }

    public int count(SkipReason reason) {
        int n = 0;
        for (SkippedLine line : skipped) {
            if (line.getReason() == reason) {
                n++;
            }
        }
        return n;
    }
}
