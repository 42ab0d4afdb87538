package org.astrewrite.ast;

/**
 * A declaration in a statement list.
 */
public class DeclStmtNode extends AbstractNode implements Statement {

    private Declaration decl;

    public DeclStmtNode(Declaration decl) {
        this.decl = decl;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECL_STMT;
    }

    public Declaration getDecl() {
        return decl;
    }

    public void setDecl(Declaration decl) {
        this.decl = decl;
    }
}
