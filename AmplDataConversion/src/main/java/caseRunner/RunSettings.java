package caseRunner;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line options shared by {@link DatToJson} and {@link RunCases}.
 */
public class RunSettings {

    static final String DEFAULT_SUMMARY = "results.xlsx";

    /** Single input file (DatToJson). */
    private final Path datFile;

    /** Single output file (DatToJson). */
    private final Path jsonFile;

    /** A .dat file or a directory of .dat files (RunCases). */
    private final Path dataPath;

    /** Summary workbook (RunCases). */
    private final Path summaryFile;

    /** Where RunCases puts the JSON files; null means next to each input. */
    private final Path jsonDir;

    /** Also write a solver-friendly copy of every case. */
    private final boolean sanitize;

    public RunSettings(Path datFile, Path jsonFile, Path dataPath, Path summaryFile, Path jsonDir,
            boolean sanitize) {
        this.datFile = datFile;
        this.jsonFile = jsonFile;
        this.dataPath = dataPath;
        this.summaryFile = summaryFile;
        this.jsonDir = jsonDir;
        this.sanitize = sanitize;
    }

    /**
     * Parses {@code --name value} options and the {@code --sanitize} flag.
     *
     * @throws IllegalArgumentException for unknown options or a missing value
     */
    public static RunSettings fromArgs(String[] args) {
        Path datFile = null;
        Path jsonFile = null;
        Path dataPath = null;
        Path summaryFile = Paths.get(DEFAULT_SUMMARY);
        Path jsonDir = null;
        boolean sanitize = false;

        for (int i = 0; i < args.length; i++) {
            String option = args[i];
            if ("--sanitize".equals(option)) {
                sanitize = true;
                continue;
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            String value = args[++i];
            switch (option) {
                case "--dat":
                    datFile = Paths.get(value);
                    break;
                case "--json":
                    jsonFile = Paths.get(value);
                    break;
                case "--data":
                    dataPath = Paths.get(value);
                    break;
                case "--out":
                    summaryFile = Paths.get(value);
                    break;
                case "--json-dir":
                    jsonDir = Paths.get(value);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option " + option);
            }
        }
        return new RunSettings(datFile, jsonFile, dataPath, summaryFile, jsonDir, sanitize);
    }

    public Path getDatFile() {
        return datFile;
    }

    public Path getJsonFile() {
        return jsonFile;
    }

    public Path getDataPath() {
        return dataPath;
    }

    public Path getSummaryFile() {
        return summaryFile;
    }

    public Path getJsonDir() {
        return jsonDir;
    }

    public boolean isSanitize() {
        return sanitize;
    }
}
