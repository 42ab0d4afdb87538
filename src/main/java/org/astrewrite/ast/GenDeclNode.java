package org.astrewrite.ast;

import java.util.List;

/**
 * A generic declaration: an import, constant, type or variable declaration with one or more entries.
 */
public class GenDeclNode extends AbstractNode implements Declaration {

    private final DeclKeyword keyword;
    private CommentGroupNode doc;
    private List<Specification> specs;

    public GenDeclNode(DeclKeyword keyword, CommentGroupNode doc, List<Specification> specs) {
        this.keyword = keyword;
        this.doc = doc;
        this.specs = NodeLists.copyOf(specs);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GEN_DECL;
    }

    public DeclKeyword getKeyword() {
        return keyword;
    }

    public CommentGroupNode getDoc() {
        return doc;
    }

    public void setDoc(CommentGroupNode doc) {
        this.doc = doc;
    }

    /**
     * Returns the entries of this declaration. An import declaration holds only
     * {@link ImportSpecNode}s, a type declaration only {@link TypeSpecNode}s and constant or
     * variable declarations only {@link ValueSpecNode}s.
     *
     * @return The mutable list of entries.
     */
    public List<Specification> getSpecs() {
        return specs;
    }

    public void setSpecs(List<Specification> specs) {
        this.specs = NodeLists.copyOf(specs);
    }

    @Override
    public String describe() {
        return "GenDecl(keyword=" + keyword + ")";
    }
}
