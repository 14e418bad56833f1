package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A level-sensitive process without an explicit sensitivity list: it re-evaluates
 * whenever anything it reads changes.
 *
 * @param keyword The process flavor.
 * @param statements The body.
 * @param source The position of the process.
 */
public record AlwaysNode(AlwaysKeyword keyword, List<AstNode> statements, SourceInfo source) implements AstNode, SourceLocatable {

    public AlwaysNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new AlwaysNode(keyword, newChildren, source);
    }
}
