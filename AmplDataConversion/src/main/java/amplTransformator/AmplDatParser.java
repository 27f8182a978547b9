package amplTransformator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import models.AmplDataDocument;

/**
 * Reads AMPL-style .dat files into an {@link AmplDataDocument}.
 *
 * <p>Supported statements:
 * <ul>
 * <li>{@code set NAME := ... ;}</li>
 * <li>{@code param NAME := (key value)* ;}</li>
 * <li>{@code param NAME: col1 col2 ... := (row v1 v2 ...)* ;}</li>
 * <li>{@code param NAME = scalar;}</li>
 * </ul>
 * Everything after '#' is a comment. Each call works on its own document, so one
 * parser may be used for many files, also from several threads.
 */
public class AmplDatParser {

    private static final Logger logger = LoggerFactory.getLogger(AmplDatParser.class);

    public AmplDataDocument parse(Path datFile) throws IOException {
        return parse(datFile, new ParseDiagnostics());
    }

    public AmplDataDocument parse(Path datFile, ParseDiagnostics diagnostics) throws IOException {
        List<String> lines = DatLineNormalizer.readLines(datFile);
        logger.info("Parsing {} ({} lines)", datFile, lines.size());
        return parseLines(lines, datFile.getFileName().toString(), diagnostics);
    }

    public AmplDataDocument parseText(String text, String fileName) {
        return parseLines(DatLineNormalizer.splitLines(text), fileName, new ParseDiagnostics());
    }

    public AmplDataDocument parseText(String text, String fileName, ParseDiagnostics diagnostics) {
        return parseLines(DatLineNormalizer.splitLines(text), fileName, diagnostics);
    }

    /**
     * Runs the single pass over the lines of one file.
     *
     * @throws MalformedBlockException if a statement cannot be read; no document is returned then
     */
    public AmplDataDocument parseLines(List<String> rawLines, String fileName, ParseDiagnostics diagnostics) {
        Map<StatementKind, StatementParser> parsers = new EnumMap<>(StatementKind.class);
        parsers.put(StatementKind.SCALAR_PARAM, new ScalarParamParser(fileName, diagnostics));
        parsers.put(StatementKind.SET, new SetParser(fileName, diagnostics));
        parsers.put(StatementKind.INDEXED_PARAM, new IndexedParamParser(fileName, diagnostics));
        parsers.put(StatementKind.TABLE_PARAM, new TableParamParser(fileName, diagnostics));

        AmplDataDocument document = new AmplDataDocument();
        DatBlockScanner scanner = new DatBlockScanner(rawLines, fileName, diagnostics);
        StatementBlock block;
        while ((block = scanner.next()) != null) {
            parsers.get(block.getKind()).parse(block, document);
        }

        logger.debug("{}: {} sets, {} params, {} skipped lines", fileName, document.getSets().size(),
                document.getParams().size(), diagnostics.getSkippedLines().size());
        return document;
    }
}
