package amplTransformator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import models.AmplDataDocument;

/**
 * {@code param NAME := key value key value ... ;} indexed by a single set.
 * A repeated key keeps the last value.
 */
public class IndexedParamParser extends StatementParser {

    public IndexedParamParser(String fileName, ParseDiagnostics diagnostics) {
        super(fileName, diagnostics);
    }

    @Override
    public void parse(StatementBlock block, AmplDataDocument document) {
        String header = block.getHeader();
        String name = statementName(header);
        if (name.isEmpty()) {
            throw new MalformedBlockException("Malformed param block (missing name)", fileName, null,
                    block.joinedText());
        }

        Map<String, Double> values = new LinkedHashMap<>();
        String afterAssign = header.substring(header.indexOf(":=") + 2).replace(";", " ");
        readPairs(DatLineNormalizer.tokenize(afterAssign), name, block, values);

        List<String> dataLines = block.getDataLines();
        for (int i = 0; i < dataLines.size(); i++) {
            String content = dataContent(dataLines.get(i));
            if (content.trim().isEmpty()) {
                continue;
            }
            List<String> tokens = DatLineNormalizer.tokenize(content);
            if (tokens.size() < 2) {
                diagnostics.skip(fileName, block.getFirstLineNumber() + 1 + i, content.trim(),
                        ParseDiagnostics.SkipReason.SHORT_LINE);
                continue;
            }
            readPairs(tokens, name, block, values);
        }

        document.putIndexedParam(name, values);
    }

    /** Token after "param", with a glued ":=" removed ("NAME:=" is allowed). */
    static String statementName(String header) {
        List<String> tokens = DatLineNormalizer.tokenize(header);
        if (tokens.size() < 2) {
            return "";
        }
        String token = tokens.get(1);
        int assign = token.indexOf(":=");
        return (assign >= 0 ? token.substring(0, assign) : token).trim();
    }

    // An odd token at the end of a line has no value and is ignored.
    private void readPairs(List<String> tokens, String name, StatementBlock block, Map<String, Double> values) {
        for (int k = 0; k + 1 < tokens.size(); k += 2) {
            values.put(tokens.get(k), requireNumber(tokens.get(k + 1), name, block));
        }
    }
}
