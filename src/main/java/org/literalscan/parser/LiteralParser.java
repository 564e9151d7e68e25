package org.literalscan.parser;

import org.literalscan.astnode.Node;
import org.literalscan.lexer.ScanState;

import java.util.function.Function;

/**
 * A leaf parser recognizing one literal at the cursor of a {@link ScanState}.
 * <p>
 * On success the parser returns a fresh node and advances the cursor past the literal.
 * On failure it returns null and records the failure in the state's error sink. Parsers
 * hold no mutable state and may be shared between threads; the ScanState may not.
 *
 * @param <T> the node type produced
 */
public interface LiteralParser<T extends Node> {

    T parse(ScanState state);

    /**
     * Name of the literal kind, e.g. "string literal".
     */
    String name();

    static <T extends Node> LiteralParser<T> of(String name, Function<ScanState, T> body) {
        return new LiteralParser<>() {
            @Override
            public T parse(ScanState state) {
                return body.apply(state);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
