package org.literalscan;

import org.literalscan.astnode.Node;
import org.literalscan.lexer.ScanState;
import org.literalscan.parser.LiteralParser;
import org.literalscan.parser.Literals;
import org.literalscan.runtime.LiteralSyntaxException;

/**
 * Scans the literal described by a set of {@link ArgumentParser.ScannerOptions}.
 */
public class LiteralScanner {

    /**
     * Parses {@code options.code} as exactly one literal of {@code options.kind}.
     *
     * @throws LiteralSyntaxException if the code is not a single well formed literal
     */
    public static Node scan(ArgumentParser.ScannerOptions options) {
        if (options.code == null) {
            throw new IllegalArgumentException("No input: use -e CODE or give a file name");
        }
        ScanState state = new ScanState(options.code, options.whitespace);
        state.setDebugEnabled(options.debugEnabled);
        if (options.debugEnabled) {
            state.logDebug(options.toString());
        }

        LiteralParser<? extends Node> parser = options.kind.parser(options);
        String fileName = options.fileName != null ? options.fileName : "-e";
        return Literals.run(parser, state, fileName);
    }
}
