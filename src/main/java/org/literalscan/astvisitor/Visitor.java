package org.literalscan.astvisitor;

import org.literalscan.astnode.NumberNode;
import org.literalscan.astnode.RegexReplaceNode;
import org.literalscan.astnode.StringNode;

public interface Visitor {
    void visit(StringNode node);

    void visit(NumberNode node);

    void visit(RegexReplaceNode node);
}
