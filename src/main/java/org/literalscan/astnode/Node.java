package org.literalscan.astnode;

import org.literalscan.astvisitor.Visitor;

/**
 * A literal recognized in the source text.
 * <p>
 * {@link #getStart()} and {@link #getEnd()} delimit the literal's content in the source;
 * for delimited literals the range excludes the delimiters.
 */
public interface Node {

    void accept(Visitor visitor);

    int getStart();

    int getEnd();
}
