package solverPreparation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import amplTransformator.DatLineNormalizer;

/**
 * Produces a solver-friendly copy of a .dat file: {@code param X = v;} becomes
 * {@code param X := v;} and blanks between a final ';' and the line break are removed.
 *
 * <p>The copy goes to a separate directory (by default
 * {@code <java.io.tmpdir>/ampl_dat_sanitized}, overridable with the system property
 * {@value #OUTPUT_DIR_PROPERTY}); the input file is never touched. The parser itself
 * reads both spellings and does not need this step.
 */
public class DatSanitizer {

    private static final Logger logger = LoggerFactory.getLogger(DatSanitizer.class);

    public static final String OUTPUT_DIR_PROPERTY = "ampl.sanitizedDir";
    static final String DEFAULT_DIR_NAME = "ampl_dat_sanitized";

    private static final Pattern TRAILING_BLANKS_AFTER_SEMICOLON = Pattern.compile(";[ \\t]+(\\r?\\n)");
    private static final Pattern SCALAR_ASSIGNMENT = Pattern.compile("(^\\s*param\\s+\\w+)\\s*=\\s*([^;]+);",
            Pattern.MULTILINE);

    private final Path outputDir;

    public DatSanitizer() {
        this(defaultOutputDir());
    }

    public DatSanitizer(Path outputDir) {
        this.outputDir = outputDir;
    }

    public static Path defaultOutputDir() {
        String configured = System.getProperty(OUTPUT_DIR_PROPERTY);
        if (configured != null && !configured.trim().isEmpty()) {
            return Paths.get(configured.trim());
        }
        return Paths.get(System.getProperty("java.io.tmpdir"), DEFAULT_DIR_NAME);
    }

    /**
     * @return the path of the sanitized copy, same file name inside the output directory
     */
    public Path sanitize(Path datFile) throws IOException {
        String sanitized = sanitizeText(DatLineNormalizer.readText(datFile));
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(datFile.getFileName().toString());
        Files.writeString(target, sanitized);
        logger.info("Sanitized {} -> {}", datFile, target);
        return target;
    }

    public String sanitizeText(String raw) {
        String text = TRAILING_BLANKS_AFTER_SEMICOLON.matcher(raw).replaceAll(";$1");
        return SCALAR_ASSIGNMENT.matcher(text).replaceAll("$1 := $2;");
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
