package org.literalscan.parser;

import org.literalscan.astnode.Node;
import org.literalscan.lexer.ScanState;
import org.literalscan.runtime.ErrorMessageUtil;
import org.literalscan.runtime.LiteralSyntaxException;

/**
 * Runs a single literal parser over a complete input.
 */
public class Literals {

    public static final String END_OF_INPUT = "end of input";

    public static <T extends Node> T run(LiteralParser<T> parser, String input) {
        return run(parser, new ScanState(input), "-e");
    }

    /**
     * Parses exactly one literal from the state's input.
     * <p>
     * Trailing whitespace is allowed; anything else after the literal is an error.
     *
     * @param parser   the literal parser
     * @param state    fresh scan state over the input
     * @param fileName name used in error messages
     * @return the parsed node
     * @throws LiteralSyntaxException if the parser fails or input remains
     */
    public static <T extends Node> T run(LiteralParser<T> parser, ScanState state, String fileName) {
        T node = parser.parse(state);
        if (node != null) {
            state.skipWhitespace();
            if (state.isAtEnd()) {
                return node;
            }
            state.errorHere(END_OF_INPUT);
        }
        state.logDebug(parser.name() + " failed: " + state.getError());
        throw new LiteralSyntaxException(state.getError(), new ErrorMessageUtil(fileName, state.input));
    }
}
