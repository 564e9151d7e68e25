package org.literalscan.astvisitor;

import org.literalscan.astnode.NumberNode;
import org.literalscan.astnode.RegexReplaceNode;
import org.literalscan.astnode.StringNode;

import static org.literalscan.runtime.ScalarUtils.printable;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {
    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    private void appendRange(int start, int end) {
        sb.append("  pos:").append(start).append("..").append(end).append("\n");
    }

    public String getResult() {
        return sb.toString();
    }

    @Override
    public void visit(StringNode node) {
        appendIndent();
        sb.append("StringNode: ").append(printable(node.getValue()));
        if (!node.isRawSlice()) {
            sb.append("  decoded");
        }
        appendRange(node.start, node.end);
    }

    @Override
    public void visit(NumberNode node) {
        appendIndent();
        sb.append("NumberNode: ").append(node.kind).append(' ').append(node.getValue());
        appendRange(node.start, node.end);
    }

    @Override
    public void visit(RegexReplaceNode node) {
        appendIndent();
        sb.append("RegexReplaceNode:");
        appendRange(node.start, node.end);
        indentLevel++;

        appendIndent();
        sb.append("Pattern:\n");
        indentLevel++;
        node.pattern.accept(this);
        indentLevel--;

        appendIndent();
        sb.append("Replacement:\n");
        indentLevel++;
        node.replacement.accept(this);
        indentLevel--;

        indentLevel--;
    }
}
