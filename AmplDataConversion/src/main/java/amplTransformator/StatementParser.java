package amplTransformator;

import models.AmplDataDocument;

/**
 * Reads one kind of statement block into the document. One instance serves one file.
 */
public abstract class StatementParser {

    protected final String fileName;
    protected final ParseDiagnostics diagnostics;

    protected StatementParser(String fileName, ParseDiagnostics diagnostics) {
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    public abstract void parse(StatementBlock block, AmplDataDocument document);

    /**
     * Parses a value that must be numeric; anything else rejects the statement.
     */
    protected double requireNumber(String token, String statementName, StatementBlock block) {
        Double value = DatNumbers.tryParse(token);
        if (value == null) {
            throw new MalformedBlockException("Value '" + token + "' of param " + statementName + " is not a number",
                    fileName, statementName, block.joinedText());
        }
        return value;
    }

    /** Data line without comment, with ';' turned into whitespace. */
    protected static String dataContent(String rawLine) {
        return DatLineNormalizer.stripComment(rawLine).replace(";", " ");
    }
}
