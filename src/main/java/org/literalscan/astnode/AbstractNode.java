package org.literalscan.astnode;

import org.literalscan.astvisitor.PrintVisitor;

/**
 * Base class for literal nodes. Holds the source range and renders the node
 * tree through {@link PrintVisitor}.
 */
public abstract class AbstractNode implements Node {
    public final int start;
    public final int end;

    protected AbstractNode(int start, int end) {
        this.start = start;
        this.end = end;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
