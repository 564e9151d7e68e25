package org.literalscan;

import org.literalscan.astnode.Node;
import org.literalscan.parser.DelimiterTables;
import org.literalscan.parser.LiteralParser;
import org.literalscan.parser.NumberParser;
import org.literalscan.parser.RegexLiteralParser;
import org.literalscan.parser.StringParser;

import java.util.Locale;

/**
 * The literal kinds selectable from the command line.
 */
public enum LiteralKind {
    STRING,
    UNICODE,
    NUMBER,
    MATCH,
    REPLACE;

    public static LiteralKind forName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown literal kind: " + name, e);
        }
    }

    /**
     * Builds the parser for this kind. The escape table applies to the string forms and
     * to the pattern of regexp literals.
     */
    public LiteralParser<? extends Node> parser(ArgumentParser.ScannerOptions options) {
        return switch (this) {
            case STRING -> StringParser.stringLiteral(options.quotes, options.escapes);
            case UNICODE -> StringParser.customStringLiteral(DelimiterTables.UNICODE, options.escapes);
            case NUMBER -> NumberParser.numberLiteral();
            case MATCH -> RegexLiteralParser.regexpMatchLiteral(DelimiterTables.UNICODE, options.escapes);
            case REPLACE -> RegexLiteralParser.regexpReplaceLiteral(DelimiterTables.UNICODE, options.escapes);
        };
    }
}
