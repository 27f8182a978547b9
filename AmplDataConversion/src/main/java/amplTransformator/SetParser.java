package amplTransformator;

import java.util.List;

import models.AmplDataDocument;

/**
 * {@code set NAME := e1 e2 ... ;}, possibly spread over several lines. Elements keep
 * their spelling and order; they are never converted to numbers.
 */
public class SetParser extends StatementParser {

    public SetParser(String fileName, ParseDiagnostics diagnostics) {
        super(fileName, diagnostics);
    }

    @Override
    public void parse(StatementBlock block, AmplDataDocument document) {
        String joined = block.joinedText();
        List<String> tokens = DatLineNormalizer.tokenize(joined.replace(":=", " := ").replace(";", " ; "));
        // tokens: set NAME := e1 ... ;
        String name = tokens.size() > 1 ? tokens.get(1) : null;

        int assign = tokens.indexOf(":=");
        if (assign < 0) {
            throw new MalformedBlockException("Malformed set block (missing ':=')", fileName, name, joined);
        }
        if (assign < 2) {
            throw new MalformedBlockException("Malformed set block (missing name)", fileName, null, joined);
        }

        int end = tokens.subList(assign + 1, tokens.size()).indexOf(";");
        end = end < 0 ? tokens.size() : assign + 1 + end;
        document.putSet(name, tokens.subList(assign + 1, end));
    }
}
