package org.astrewrite.ast;

/**
 * The closed set of node kinds. Each constant names the node class that carries it and the
 * family it belongs to.
 */
public enum NodeKind {
    // region Comments and fields
    COMMENT("Comment", CommentNode.class, NodeFamily.COMMENT),
    COMMENT_GROUP("CommentGroup", CommentGroupNode.class, NodeFamily.COMMENT),
    FIELD("Field", FieldNode.class, NodeFamily.FIELD),
    FIELD_LIST("FieldList", FieldListNode.class, NodeFamily.FIELD),
    // endregion
    // region Expressions
    BAD_EXPR("BadExpr", BadExprNode.class, NodeFamily.EXPRESSION),
    IDENT("Ident", IdentifierNode.class, NodeFamily.EXPRESSION),
    BASIC_LIT("BasicLit", BasicLiteralNode.class, NodeFamily.EXPRESSION),
    ELLIPSIS("Ellipsis", EllipsisNode.class, NodeFamily.EXPRESSION),
    FUNC_LIT("FuncLit", FuncLiteralNode.class, NodeFamily.EXPRESSION),
    COMPOSITE_LIT("CompositeLit", CompositeLiteralNode.class, NodeFamily.EXPRESSION),
    PAREN_EXPR("ParenExpr", ParenExprNode.class, NodeFamily.EXPRESSION),
    SELECTOR_EXPR("SelectorExpr", SelectorExprNode.class, NodeFamily.EXPRESSION),
    INDEX_EXPR("IndexExpr", IndexExprNode.class, NodeFamily.EXPRESSION),
    SLICE_EXPR("SliceExpr", SliceExprNode.class, NodeFamily.EXPRESSION),
    TYPE_ASSERT_EXPR("TypeAssertExpr", TypeAssertExprNode.class, NodeFamily.EXPRESSION),
    CALL_EXPR("CallExpr", CallExprNode.class, NodeFamily.EXPRESSION),
    STAR_EXPR("StarExpr", StarExprNode.class, NodeFamily.EXPRESSION),
    UNARY_EXPR("UnaryExpr", UnaryExprNode.class, NodeFamily.EXPRESSION),
    BINARY_EXPR("BinaryExpr", BinaryExprNode.class, NodeFamily.EXPRESSION),
    KEY_VALUE_EXPR("KeyValueExpr", KeyValueExprNode.class, NodeFamily.EXPRESSION),
    // endregion
    // region Types
    ARRAY_TYPE("ArrayType", ArrayTypeNode.class, NodeFamily.TYPE),
    STRUCT_TYPE("StructType", StructTypeNode.class, NodeFamily.TYPE),
    FUNC_TYPE("FuncType", FuncTypeNode.class, NodeFamily.TYPE),
    INTERFACE_TYPE("InterfaceType", InterfaceTypeNode.class, NodeFamily.TYPE),
    MAP_TYPE("MapType", MapTypeNode.class, NodeFamily.TYPE),
    CHAN_TYPE("ChanType", ChanTypeNode.class, NodeFamily.TYPE),
    // endregion
    // region Statements
    BAD_STMT("BadStmt", BadStmtNode.class, NodeFamily.STATEMENT),
    DECL_STMT("DeclStmt", DeclStmtNode.class, NodeFamily.STATEMENT),
    EMPTY_STMT("EmptyStmt", EmptyStmtNode.class, NodeFamily.STATEMENT),
    LABELED_STMT("LabeledStmt", LabeledStmtNode.class, NodeFamily.STATEMENT),
    EXPR_STMT("ExprStmt", ExprStmtNode.class, NodeFamily.STATEMENT),
    SEND_STMT("SendStmt", SendStmtNode.class, NodeFamily.STATEMENT),
    INC_DEC_STMT("IncDecStmt", IncDecStmtNode.class, NodeFamily.STATEMENT),
    ASSIGN_STMT("AssignStmt", AssignStmtNode.class, NodeFamily.STATEMENT),
    GO_STMT("GoStmt", GoStmtNode.class, NodeFamily.STATEMENT),
    DEFER_STMT("DeferStmt", DeferStmtNode.class, NodeFamily.STATEMENT),
    RETURN_STMT("ReturnStmt", ReturnStmtNode.class, NodeFamily.STATEMENT),
    BRANCH_STMT("BranchStmt", BranchStmtNode.class, NodeFamily.STATEMENT),
    BLOCK_STMT("BlockStmt", BlockStmtNode.class, NodeFamily.STATEMENT),
    IF_STMT("IfStmt", IfStmtNode.class, NodeFamily.STATEMENT),
    CASE_CLAUSE("CaseClause", CaseClauseNode.class, NodeFamily.STATEMENT),
    SWITCH_STMT("SwitchStmt", SwitchStmtNode.class, NodeFamily.STATEMENT),
    TYPE_SWITCH_STMT("TypeSwitchStmt", TypeSwitchStmtNode.class, NodeFamily.STATEMENT),
    COMM_CLAUSE("CommClause", CommClauseNode.class, NodeFamily.STATEMENT),
    SELECT_STMT("SelectStmt", SelectStmtNode.class, NodeFamily.STATEMENT),
    FOR_STMT("ForStmt", ForStmtNode.class, NodeFamily.STATEMENT),
    RANGE_STMT("RangeStmt", RangeStmtNode.class, NodeFamily.STATEMENT),
    // endregion
    // region Specifications
    IMPORT_SPEC("ImportSpec", ImportSpecNode.class, NodeFamily.SPECIFICATION),
    VALUE_SPEC("ValueSpec", ValueSpecNode.class, NodeFamily.SPECIFICATION),
    TYPE_SPEC("TypeSpec", TypeSpecNode.class, NodeFamily.SPECIFICATION),
    // endregion
    // region Declarations
    BAD_DECL("BadDecl", BadDeclNode.class, NodeFamily.DECLARATION),
    GEN_DECL("GenDecl", GenDeclNode.class, NodeFamily.DECLARATION),
    FUNC_DECL("FuncDecl", FuncDeclNode.class, NodeFamily.DECLARATION),
    // endregion
    // region Files and packages
    FILE("File", FileNode.class, NodeFamily.FILE),
    PACKAGE("Package", PackageNode.class, NodeFamily.FILE);
    // endregion

    private final String displayName;
    private final Class<? extends AstNode> nodeType;
    private final NodeFamily family;

    NodeKind(String displayName, Class<? extends AstNode> nodeType, NodeFamily family) {
        this.displayName = displayName;
        this.nodeType = nodeType;
        this.family = family;
    }

    /**
     * @return The name used when describing nodes of this kind.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return The node class that carries this kind.
     */
    public Class<? extends AstNode> nodeType() {
        return nodeType;
    }

    public NodeFamily family() {
        return family;
    }
}
