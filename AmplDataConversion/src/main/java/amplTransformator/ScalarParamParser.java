package amplTransformator;

import java.util.regex.Matcher;

import models.AmplDataDocument;

/**
 * {@code param NAME = value;}. Non-numeric values are kept as text (labels are valid data).
 */
public class ScalarParamParser extends StatementParser {

    public ScalarParamParser(String fileName, ParseDiagnostics diagnostics) {
        super(fileName, diagnostics);
    }

    @Override
    public void parse(StatementBlock block, AmplDataDocument document) {
        Matcher matcher = DatBlockScanner.SCALAR_PARAM.matcher(block.getHeader());
        if (!matcher.matches()) {
            throw new MalformedBlockException("Not a scalar param", fileName, null, block.joinedText());
        }
        String name = matcher.group(1);
        String literal = matcher.group(2).trim();
        Double number = DatNumbers.tryParse(literal);
        document.putScalar(name, number != null ? number : literal);
    }
}
