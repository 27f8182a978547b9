package caseRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import amplTransformator.AmplDatParser;
import amplTransformator.MalformedBlockException;
import amplTransformator.ParseDiagnostics;
import dataExchange.CaseSummaryWorkbookWriter;
import dataExchange.DocumentJsonSerializer;
import models.AmplDataDocument;
import models.CaseResult;
import solverPreparation.DatSanitizer;

/**
 * Converts a .dat file or every .dat file of a directory and writes a summary workbook.
 *
 * <pre>
 * java caseRunner.RunCases --data data/ampl_dat [--out results.xlsx] [--json-dir json] [--sanitize]
 * </pre>
 *
 * A malformed case is recorded in the summary and the run goes on; the exit code is
 * then 1.
 */
public class RunCases {

    private static final Logger logger = LoggerFactory.getLogger(RunCases.class);

    private final RunSettings settings;
    private final AmplDatParser parser = new AmplDatParser();
    private final DocumentJsonSerializer serializer = new DocumentJsonSerializer();
    private final DatSanitizer sanitizer;

    public RunCases(RunSettings settings) {
        this(settings, new DatSanitizer());
    }

    public RunCases(RunSettings settings, DatSanitizer sanitizer) {
        this.settings = settings;
        this.sanitizer = sanitizer;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        RunSettings settings;
        try {
            settings = RunSettings.fromArgs(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            printUsage();
            return DatToJson.EXIT_USAGE;
        }
        if (settings.getDataPath() == null) {
            printUsage();
            return DatToJson.EXIT_USAGE;
        }

        try {
            List<CaseResult> results = new RunCases(settings).runAll();
            boolean allOk = results.stream().allMatch(CaseResult::isOk);
            return allOk ? DatToJson.EXIT_OK : DatToJson.EXIT_FAILED;
        } catch (IOException e) {
            logger.error("Run failed for {}", settings.getDataPath(), e);
            return DatToJson.EXIT_FAILED;
        }
    }

    /**
     * Converts all cases and writes the summary workbook.
     */
    public List<CaseResult> runAll() throws IOException {
        List<Path> cases = listCases(settings.getDataPath());
        logger.info("Found {} case(s) in {}", cases.size(), settings.getDataPath());

        List<CaseResult> results = new ArrayList<>();
        for (Path datFile : cases) {
            results.add(runCase(datFile));
        }
        new CaseSummaryWorkbookWriter().write(results, settings.getSummaryFile());
        return results;
    }

    CaseResult runCase(Path datFile) {
        String caseName = datFile.getFileName().toString();
        try {
            ParseDiagnostics diagnostics = new ParseDiagnostics();
            AmplDataDocument document = parser.parse(datFile, diagnostics);
            Path jsonFile = jsonTarget(datFile);
            serializer.write(document, jsonFile);
            if (settings.isSanitize()) {
                sanitizer.sanitize(datFile);
            }
            return CaseResult.converted(caseName, document, diagnostics.getSkippedLines().size(),
                    jsonFile.toString());
        } catch (MalformedBlockException e) {
            logger.error("Case {} is malformed: {}", caseName, e.getMessage());
            return CaseResult.failed(caseName, CaseResult.Status.MALFORMED, e.getMessage());
        } catch (IOException e) {
            logger.error("Case {} could not be read or written", caseName, e);
            return CaseResult.failed(caseName, CaseResult.Status.IO_ERROR, String.valueOf(e.getMessage()));
        }
    }

    Path jsonTarget(Path datFile) {
        String fileName = datFile.getFileName().toString();
        String baseName = fileName.endsWith(".dat") ? fileName.substring(0, fileName.length() - 4) : fileName;
        Path dir = settings.getJsonDir() != null ? settings.getJsonDir() : datFile.toAbsolutePath().getParent();
        return dir.resolve(baseName + ".json");
    }

    /**
     * A directory yields its *.dat files sorted by name; a file yields itself.
     */
    static List<Path> listCases(Path dataPath) throws IOException {
        if (!Files.isDirectory(dataPath)) {
            if (!Files.exists(dataPath)) {
                throw new IOException("No such file or directory: " + dataPath);
            }
            return Collections.singletonList(dataPath);
        }
        try (Stream<Path> entries = Files.list(dataPath)) {
            return entries.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".dat"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: RunCases --data <.dat file or directory> [--out results.xlsx] [--json-dir dir] [--sanitize]");
    }
}
