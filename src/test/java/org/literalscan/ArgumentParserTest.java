package org.literalscan;

import org.junit.jupiter.api.Test;
import org.literalscan.astnode.Node;
import org.literalscan.astnode.StringNode;
import org.literalscan.lexer.ScanState;
import org.literalscan.parser.EscapeTable;
import org.literalscan.parser.Literals;
import org.literalscan.parser.Whitespace;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentParserTest {

    @Test
    public void testDefaults() {
        ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(new String[]{"-e", "\"x\""});
        assertEquals("\"x\"", options.code);
        assertEquals("-e", options.fileName);
        assertEquals(LiteralKind.UNICODE, options.kind);
        assertSame(Whitespace.ASCII, options.whitespace);
        assertFalse(options.jsonOutput);
        assertFalse(options.debugEnabled);
    }

    @Test
    public void testSwitches() {
        ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(
                new String[]{"--kind", "replace", "--ws", "none", "--quotes", "'", "--json", "--debug", "-e", "/a/b/"});
        assertEquals(LiteralKind.REPLACE, options.kind);
        assertSame(Whitespace.NONE, options.whitespace);
        assertEquals("'", options.quotes);
        assertTrue(options.jsonOutput);
        assertTrue(options.debugEnabled);
    }

    @Test
    public void testConfigThenOverride() throws Exception {
        String config = ScannerConfigTest.fixture().toString();
        ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(
                new String[]{"--quotes", "\"", "--config", config, "--kind", "number", "-e", "1"});
        // --quotes came before --config, --kind after it
        assertEquals("'`", options.quotes);
        assertEquals(LiteralKind.NUMBER, options.kind);
        assertEquals(config, options.configFile);
    }

    @Test
    public void testFileArgument() throws Exception {
        String config = ScannerConfigTest.fixture().toString();
        ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(new String[]{"--", config});
        assertEquals(config, options.fileName);
        assertTrue(options.code.startsWith("# Scanner settings"));
    }

    @Test
    public void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"--kind"}));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"--kind", "char"}));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"no-such-file.txt"}));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"-e", "1", "extra"}));
    }

    @Test
    public void testHelp() {
        assertTrue(ArgumentParser.parseArguments(new String[]{"-h"}).helpRequested);
        assertTrue(ArgumentParser.helpText().contains("--kind KIND"));
    }

    @Test
    public void testNamesDoNotDependOnDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(
                    new String[]{"--kind", "string", "--ws", "UNICODE", "-e", "'x'"});
            assertEquals(LiteralKind.STRING, options.kind);
            assertSame(Whitespace.UNICODE, options.whitespace);
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testStringKindWithCustomEscapesReportsQuoteSet() {
        ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(new String[]{"--kind", "string", "--quotes", "'`", "-e", "\"x\""});
        options.escapes = EscapeTable.DEFAULT.with('e', 27);

        ScanState state = new ScanState(options.code);
        assertNull(options.kind.parser(options).parse(state));
        assertEquals("'`", state.getError().getExpected());
        assertEquals(0, state.getError().getPos());
    }

    @Test
    public void testStringKindUsesCustomEscapes() {
        ArgumentParser.ScannerOptions options = ArgumentParser.parseArguments(new String[]{"--kind", "string", "-e", "'\\e'"});
        options.escapes = EscapeTable.DEFAULT.with('e', 27);

        Node node = Literals.run(options.kind.parser(options), options.code);
        assertEquals("\u001B", ((StringNode) node).getValue());
    }
}
