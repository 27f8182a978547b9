package amplTransformator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import models.AmplDataDocument;

/**
 * Two-dimensional table:
 *
 * <pre>
 * param DemandaPPA: C1 C2 :=
 * H01 10 20
 * H02 7 8 ;
 * </pre>
 *
 * The header fixes column order and width. Each row is its own line; a row that
 * does not supply one value per column is left out of the table.
 */
public class TableParamParser extends StatementParser {

    private static final String KEYWORD = "param ";

    public TableParamParser(String fileName, ParseDiagnostics diagnostics) {
        super(fileName, diagnostics);
    }

    @Override
    public void parse(StatementBlock block, AmplDataDocument document) {
        String afterKeyword = block.getHeader().substring(KEYWORD.length());
        int colon = afterKeyword.indexOf(':');
        String name = afterKeyword.substring(0, colon).trim();
        if (name.isEmpty()) {
            throw new MalformedBlockException("Malformed param block (missing name)", fileName, null,
                    block.joinedText());
        }
        String columnPart = afterKeyword.substring(colon + 1);
        List<String> columns = DatLineNormalizer.tokenize(columnPart.substring(0, columnPart.indexOf(":=")));

        Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
        List<String> dataLines = block.getDataLines();
        for (int i = 0; i < dataLines.size(); i++) {
            List<String> tokens = DatLineNormalizer.tokenize(dataContent(dataLines.get(i)));
            if (tokens.isEmpty()) {
                continue;
            }
            Map<String, Double> row = readRow(tokens, columns, name, block);
            if (row == null) {
                diagnostics.skip(fileName, block.getFirstLineNumber() + 1 + i, String.join(" ", tokens),
                        ParseDiagnostics.SkipReason.ROW_SHAPE_MISMATCH);
                continue;
            }
            rows.put(tokens.get(0), row);
        }

        document.putTable(name, rows);
    }

    /**
     * @return the row's values by column, or {@code null} to skip a row that is too short
     */
    private Map<String, Double> readRow(List<String> tokens, List<String> columns, String name,
            StatementBlock block) {
        List<String> values = tokens.subList(1, Math.min(tokens.size(), 1 + columns.size()));
        if (values.size() != columns.size()) {
            return null;
        }
        Map<String, Double> row = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            row.put(columns.get(c), requireNumber(values.get(c), name, block));
        }
        return row;
    }
}
