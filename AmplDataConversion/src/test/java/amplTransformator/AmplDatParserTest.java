package amplTransformator;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import models.AmplDataDocument;

public class AmplDatParserTest {

    private final AmplDatParser parser = new AmplDatParser();

    private AmplDataDocument parse(String text) {
        return parser.parseText(text, "test.dat");
    }

    @Test
    void testSetOnOneLine() {
        AmplDataDocument doc = parse("set HORAS := H01 H02 H03 ;");
        assertEquals(Arrays.asList("H01", "H02", "H03"), doc.getSets().get("HORAS"));
        assertTrue(doc.getParams().isEmpty());
    }

    @Test
    void testSetAcrossLinesWithGluedAssign() {
        AmplDataDocument doc = parse("set HORAS:= H01 H02\n  H03   # third\n\tH04;\n");
        assertEquals(Arrays.asList("H01", "H02", "H03", "H04"), doc.getSet("HORAS"));
    }

    @Test
    void testSetElementsAreNotCoerced() {
        AmplDataDocument doc = parse("set T := 01 1.0 1e3 ;");
        assertEquals(Arrays.asList("01", "1.0", "1e3"), doc.getSet("T"));
    }

    @Test
    void testEmptySet() {
        AmplDataDocument doc = parse("set EMPTY := ;");
        assertTrue(doc.getSet("EMPTY").isEmpty());
    }

    @Test
    void testSetWithoutAssignIsMalformed() {
        MalformedBlockException e = assertThrows(MalformedBlockException.class, () -> parse("set BAD H1 H2 ;"));
        assertEquals("test.dat", e.getFileName());
        assertEquals("BAD", e.getStatementName());
        assertTrue(e.getMessage().contains("BAD"));
        assertTrue(e.getMessage().contains("test.dat"));
        assertEquals("set BAD H1 H2 ;", e.getBlockText());
    }

    @Test
    void testMalformedBlockRejectsWholeFile() {
        assertThrows(MalformedBlockException.class,
                () -> parse("set OK := a b ;\nparam X = 1;\nset BAD a b ;\nset LATER := c ;"));
    }

    @Test
    void testNumericScalar() {
        AmplDataDocument doc = parse("param HedgeRate=0.8;");
        assertEquals(0.8, doc.getScalar("HedgeRate"));
        assertEquals(0.8, doc.getNumericScalar("HedgeRate"));
    }

    @Test
    void testScalarWithSpacesAndExponent() {
        AmplDataDocument doc = parse("param  Big  =  -1.5E3 ;  ");
        assertEquals(-1500.0, doc.getScalar("Big"));
    }

    @Test
    void testNonNumericScalarKeepsText() {
        AmplDataDocument doc = parse("param Label = Caso Base ;");
        assertEquals("Caso Base", doc.getScalar("Label"));
    }

    @Test
    void testScalarRejectsJavaOnlyNumberSyntax() {
        AmplDataDocument doc = parse("param A = 1d;\nparam B = 0x10;");
        assertEquals("1d", doc.getScalar("A"));
        assertEquals("0x10", doc.getScalar("B"));
    }

    @Test
    void testIndexedParamOnSeveralLines() {
        AmplDataDocument doc = parse("param PrecioSpot :=\nH01 30.5\nH02\t28\nH03 31 ;\n");
        Map<String, Double> expected = new LinkedHashMap<>();
        expected.put("H01", 30.5);
        expected.put("H02", 28.0);
        expected.put("H03", 31.0);
        assertEquals(expected, doc.getIndexedParam("PrecioSpot"));
    }

    @Test
    void testIndexedParamOnOneLine() {
        AmplDataDocument doc = parse("param P := k1 1 k2 2;");
        Map<String, Double> p = doc.getIndexedParam("P");
        assertEquals(2, p.size());
        assertEquals(1.0, p.get("k1"));
        assertEquals(2.0, p.get("k2"));
    }

    @Test
    void testIndexedParamSeveralPairsPerLine() {
        AmplDataDocument doc = parse("param P:=\nk1 1 k2 2\nk3 3 ;");
        assertEquals(Arrays.asList("k1", "k2", "k3"), List.copyOf(doc.getIndexedParam("P").keySet()));
    }

    @Test
    void testIndexedParamDuplicateKeyKeepsLast() {
        AmplDataDocument doc = parse("param P :=\nH01 1\nH02 2\nH01 3 ;");
        Map<String, Double> p = doc.getIndexedParam("P");
        assertEquals(2, p.size());
        assertEquals(3.0, p.get("H01"));
    }

    @Test
    void testIndexedParamShortLineIsSkipped() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        AmplDataDocument doc = parser.parseText("param P :=\nH01 1\nH02\nH03 3\n;", "test.dat", diagnostics);
        Map<String, Double> p = doc.getIndexedParam("P");
        assertEquals(2, p.size());
        assertFalse(p.containsKey("H02"));
        assertEquals(1, diagnostics.count(ParseDiagnostics.SkipReason.SHORT_LINE));
        assertEquals(3, diagnostics.getSkippedLines().get(0).getLineNumber());
    }

    @Test
    void testIndexedParamBadValueIsMalformed() {
        MalformedBlockException e = assertThrows(MalformedBlockException.class,
                () -> parse("param P :=\nH01 abc\n;"));
        assertEquals("P", e.getStatementName());
    }

    @Test
    void testTableScenario() {
        AmplDataDocument doc = parse("param DemandaPPA: C1 C2 :=\nH01 10 20\nH02 5\nH03 7 8 ;\n");
        Map<String, Map<String, Double>> table = doc.getTable("DemandaPPA");
        assertEquals(2, table.size());
        assertEquals(Arrays.asList("H01", "H03"), List.copyOf(table.keySet()));
        assertEquals(10.0, table.get("H01").get("C1"));
        assertEquals(20.0, table.get("H01").get("C2"));
        assertEquals(7.0, table.get("H03").get("C1"));
        assertEquals(8.0, table.get("H03").get("C2"));
        assertFalse(table.containsKey("H02"));
    }

    @Test
    void testTableKeepsColumnOrder() {
        AmplDataDocument doc = parse("param T: Z A M :=\nr 1 2 3 ;");
        assertEquals(Arrays.asList("Z", "A", "M"), List.copyOf(doc.getTable("T").get("r").keySet()));
    }

    @Test
    void testTableRowDropIsPerRowAndReported() {
        StringBuilder text = new StringBuilder("param T: a b :=\n");
        for (int i = 1; i <= 9; i++) {
            text.append("r").append(i).append(" 1 2\n");
        }
        text.append("r10 1\n;");
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        AmplDataDocument doc = parser.parseText(text.toString(), "test.dat", diagnostics);
        assertEquals(9, doc.getTable("T").size());
        assertEquals(1, diagnostics.count(ParseDiagnostics.SkipReason.ROW_SHAPE_MISMATCH));
        assertEquals("r10 1", diagnostics.getSkippedLines().get(0).getText());
    }

    @Test
    void testTableBadValueIsMalformed() {
        assertThrows(MalformedBlockException.class, () -> parse("param T: a b :=\nr1 1 x ;"));
    }

    @Test
    void testTableLongRowIsTruncated() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        AmplDataDocument doc = parser.parseText("param T: a b :=\nr 1 2 3\ns 4 5 ;", "test.dat", diagnostics);
        Map<String, Map<String, Double>> table = doc.getTable("T");
        assertEquals(Arrays.asList("r", "s"), List.copyOf(table.keySet()));
        assertEquals(Arrays.asList("a", "b"), List.copyOf(table.get("r").keySet()));
        assertEquals(1.0, table.get("r").get("a"));
        assertEquals(2.0, table.get("r").get("b"));
        assertEquals(4.0, table.get("s").get("a"));
        assertEquals(5.0, table.get("s").get("b"));
        assertEquals(0, diagnostics.count(ParseDiagnostics.SkipReason.ROW_SHAPE_MISMATCH));
    }

    @Test
    void testTableWithoutNameIsMalformed() {
        MalformedBlockException e = assertThrows(MalformedBlockException.class,
                () -> parse("param : a b :=\nr 1 2 ;"));
        assertNull(e.getStatementName());
        assertEquals("test.dat", e.getFileName());
    }

    @Test
    void testMalformedMessageIsAbbreviated() {
        StringBuilder text = new StringBuilder("param T: a b :=\n");
        for (int i = 1; i <= 500; i++) {
            text.append("r").append(i).append(" 1 2\n");
        }
        text.append("bad 1 x ;");
        MalformedBlockException e = assertThrows(MalformedBlockException.class, () -> parse(text.toString()));
        assertTrue(e.getBlockText().contains("bad 1 x"));
        assertTrue(e.getMessage().length() < 300);
        assertTrue(e.getMessage().contains("chars)"));
    }

    @Test
    void testUnrecognizedStatementsAreSkipped() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        AmplDataDocument doc = parser.parseText("data;\nvar x;\nset S := a ;\nend;", "test.dat", diagnostics);
        assertEquals(1, doc.getSets().size());
        assertEquals(3, diagnostics.count(ParseDiagnostics.SkipReason.UNRECOGNIZED_STATEMENT));
    }

    @Test
    void testSameNameInSetsAndParams() {
        AmplDataDocument doc = parse("set X := a b ;\nparam X = 2;");
        assertEquals(Arrays.asList("a", "b"), doc.getSet("X"));
        assertEquals(2.0, doc.getScalar("X"));
    }

    @Test
    void testEmptyInput() {
        AmplDataDocument doc = parse("# only a comment\n\n   \n");
        assertTrue(doc.getSets().isEmpty());
        assertTrue(doc.getParams().isEmpty());
    }

    @Test
    void testCaseFile() throws IOException, URISyntaxException {
        Path file = Paths.get(getClass().getResource("/cases/Modelo_Optimiza_PPAs_HCR_Dia_E01.dat").toURI());
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        AmplDataDocument doc = parser.parse(file, diagnostics);

        assertEquals(Arrays.asList("HORAS", "CONTRATOS", "PRY_RER"), List.copyOf(doc.getSets().keySet()));
        assertEquals(Arrays.asList("Solar1", "Eolico1"), doc.getSet("PRY_RER"));
        assertEquals(0.8, doc.getNumericScalar("HedgeRate"));
        assertEquals("Base", doc.getScalar("Escenario"));
        assertEquals(110.25, doc.getIndexedParam("DemandaPortafolioActual").get("H03"));
        assertEquals(44.75, doc.getIndexedParam("PrecioPPA").get("NewPPA3"));
        assertEquals(Arrays.asList("H01", "H02", "H04"), List.copyOf(doc.getTable("DemandaPPA").keySet()));
        assertEquals(4, doc.getTable("Produccion_RER").size());
        assertEquals(36.2, doc.getTable("Produccion_RER").get("H04").get("Eolico1"));
        assertEquals(2, diagnostics.getSkippedLines().size());
    }

    @Test
    void testInvalidBytesAreReplaced(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("latin1.dat");
        byte[] prefix = "set S := a b".getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[prefix.length + 4];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0xE9;
        content[prefix.length + 1] = ' ';
        content[prefix.length + 2] = ';';
        content[prefix.length + 3] = '\n';
        Files.write(file, content);

        AmplDataDocument doc = parser.parse(file);
        assertEquals(Arrays.asList("a", "b\uFFFD"), doc.getSet("S"));
    }
}
