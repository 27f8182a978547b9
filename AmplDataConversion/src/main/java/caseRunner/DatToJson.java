package caseRunner;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import amplTransformator.AmplDatParser;
import amplTransformator.MalformedBlockException;
import dataExchange.DocumentJsonSerializer;
import models.AmplDataDocument;

/**
 * Converts one .dat file to JSON.
 *
 * <pre>
 * java caseRunner.DatToJson --dat case.dat --json case.json
 * </pre>
 */
public class DatToJson {

    private static final Logger logger = LoggerFactory.getLogger(DatToJson.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

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
            return EXIT_USAGE;
        }
        if (settings.getDatFile() == null || settings.getJsonFile() == null) {
            printUsage();
            return EXIT_USAGE;
        }

        try {
            AmplDataDocument document = new AmplDatParser().parse(settings.getDatFile());
            new DocumentJsonSerializer().write(document, settings.getJsonFile());
            return EXIT_OK;
        } catch (MalformedBlockException e) {
            logger.error("Cannot convert {}: {}", e.getFileName(), e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            logger.error("I/O error converting {}", settings.getDatFile(), e);
            return EXIT_FAILED;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: DatToJson --dat <input .dat file> --json <output .json file>");
    }
}
