package amplTransformator;

/**
 * Thrown when a recognized statement (set, indexed param or table param) cannot be
 * read: the {@code :=} delimiter is missing or a value is not a number.
 * The whole file is rejected; no partial document is handed out.
 */
public class MalformedBlockException extends AmplDataException {

    private static final long serialVersionUID = 1L;

    static final int MESSAGE_TEXT_LIMIT = 200;

    private final String fileName;
    private final String statementName;
    private final String blockText;

    public MalformedBlockException(String reason, String fileName, String statementName, String blockText) {
        super(reason + " in " + fileName + ": " + abbreviate(blockText));
        this.fileName = fileName;
        this.statementName = statementName;
        this.blockText = blockText;
    }

    // The message carries at most MESSAGE_TEXT_LIMIT characters of the block; getBlockText() has all of it.
    static String abbreviate(String text) {
        if (text == null || text.length() <= MESSAGE_TEXT_LIMIT) {
            return text;
        }
        return text.substring(0, MESSAGE_TEXT_LIMIT) + "... (" + text.length() + " chars)";
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * @return the declared name of the offending statement, or {@code null} if it
     *         could not be determined
     */
    public String getStatementName() {
        return statementName;
    }

    public String getBlockText() {
        return blockText;
    }
}
