package org.literalscan.astnode;

import org.literalscan.astvisitor.Visitor;

/**
 * The StringNode class holds the decoded text of a delimited segment.
 * <p>
 * When the segment contained no escape, the node keeps only the source range and
 * {@link #getValue()} copies the slice out of the source on request. Otherwise the
 * decoded text is stored as built by the scanner.
 */
public class StringNode extends AbstractNode {
    private final String source;
    // Decoded text, or null when the value is the raw source slice
    private final String decoded;

    /**
     * Constructs a node whose value is the source slice {@code [start, end)}.
     */
    public StringNode(String source, int start, int end) {
        this(source, start, end, null);
    }

    /**
     * Constructs a node with escape-decoded text.
     *
     * @param source  the source text the range refers to
     * @param start   offset of the first content character
     * @param end     offset of the closing delimiter
     * @param decoded the decoded text, or null to use the raw slice
     */
    public StringNode(String source, int start, int end, String decoded) {
        super(start, end);
        this.source = source;
        this.decoded = decoded;
    }

    public String getValue() {
        return decoded != null ? decoded : source.substring(start, end);
    }

    /**
     * True if no escape was decoded and the value is a view of the source text.
     */
    public boolean isRawSlice() {
        return decoded == null;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
