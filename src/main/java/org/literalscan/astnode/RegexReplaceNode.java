package org.literalscan.astnode;

import org.literalscan.astvisitor.Visitor;

/**
 * A regular expression replace literal: the pattern segment followed by the
 * replacement segment. The range spans from the pattern's first character to the
 * replacement's closing delimiter.
 */
public class RegexReplaceNode extends AbstractNode {
    public final StringNode pattern;
    public final StringNode replacement;

    public RegexReplaceNode(StringNode pattern, StringNode replacement) {
        super(pattern.start, replacement.end);
        this.pattern = pattern;
        this.replacement = replacement;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
