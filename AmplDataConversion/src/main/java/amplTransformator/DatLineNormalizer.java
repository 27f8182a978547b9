package amplTransformator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Line level helpers shared by the scanner and the statement parsers:
 * comment stripping, tokenizing and permissive file reading.
 */
public final class DatLineNormalizer {

    private DatLineNormalizer() {
    }

    /**
     * Removes everything from the first '#' to the end of the line and trims the rest.
     * An empty result means the line carries no data.
     */
    public static String stripComment(String line) {
        int hash = line.indexOf('#');
        String content = hash >= 0 ? line.substring(0, hash) : line;
        return content.trim();
    }

    /**
     * Splits on spaces and tabs. Never returns empty tokens.
     */
    public static List<String> tokenize(String text) {
        String normalized = text.replace('\t', ' ').trim();
        if (normalized.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Reads a whole file as UTF-8. Undecodable bytes become U+FFFD instead of failing.
     * The file is closed before this method returns.
     */
    public static List<String> readLines(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, permissiveUtf8()))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return lines;
        }
    }

    /**
     * Same decoding as {@link #readLines(Path)} but keeps the original line endings.
     */
    public static String readText(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return permissiveUtf8().decode(ByteBuffer.wrap(bytes)).toString();
    }

    public static List<String> splitLines(String text) {
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            return reader.lines().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static CharsetDecoder permissiveUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }
}
