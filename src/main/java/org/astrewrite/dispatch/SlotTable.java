package org.astrewrite.dispatch;

import org.astrewrite.api.RewriteErrorCode;
import org.astrewrite.api.RewriteException;
import org.astrewrite.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.astrewrite.dispatch.ListSlot.tolerant;
import static org.astrewrite.dispatch.ListSlot.triggering;
import static org.astrewrite.dispatch.SingleSlot.annotation;
import static org.astrewrite.dispatch.SingleSlot.optional;
import static org.astrewrite.dispatch.SingleSlot.required;

/**
 * The static mapping from node kind to its ordered list of child slots.
 * <p>
 * The table is built from an exhaustive switch over {@link NodeKind}, so adding a kind without
 * describing its slots does not compile. Slots are listed in source order, which is also the
 * order in which traversals visit them.
 * <p>
 * Which collections are {@link EmptyPolicy#REMOVAL_TRIGGERING} is a deliberate per-kind decision:
 * a collection triggers removal only when its owner cannot exist without elements (a field list,
 * the entries of a generic declaration, the names of a value entry, either side of an assignment,
 * the comments of a comment group).
 * <p>
 * A required slot may be absent from the start ({@code [...]T}, a function without receiver);
 * it is then skipped. Only losing a child that was present removes the owner.
 * <p>
 * A generic declaration lists {@code doc} before {@code specs}: the visitor sees the doc comment
 * even when the declaration is removed afterwards because its specs were emptied.
 */
public final class SlotTable {

    private static final Map<NodeKind, List<Slot<?, ?>>> SLOTS = build();

    private SlotTable() {}

    /**
     * Returns the slots of {@code kind}, in declared order.
     *
     * @param kind The node kind.
     * @return An unmodifiable list of slots; empty for leaf kinds.
     * @throws RewriteException with {@link RewriteErrorCode#UNKNOWN_KIND} if {@code kind} is {@code null}.
     */
    public static List<Slot<?, ?>> slotsOf(NodeKind kind) {
        List<Slot<?, ?>> slots = kind == null ? null : SLOTS.get(kind);
        if (slots == null) {
            throw new RewriteException(RewriteErrorCode.UNKNOWN_KIND, "No slot table entry for kind " + kind);
        }
        return slots;
    }

    /**
     * Returns the slots of {@code node}'s kind after checking that the node really is an instance
     * of the class carrying that kind.
     *
     * @param node The node.
     * @return An unmodifiable list of slots; empty for leaf kinds.
     * @throws RewriteException with {@link RewriteErrorCode#UNKNOWN_KIND} if the node's kind is unknown
     *         or is claimed by a foreign class.
     */
    public static List<Slot<?, ?>> slotsOf(AstNode node) {
        NodeKind kind = node.kind();
        if (kind != null && !kind.nodeType().isInstance(node)) {
            throw new RewriteException(RewriteErrorCode.UNKNOWN_KIND, String.format(
                    "%s claims kind %s, which belongs to %s",
                    node.getClass().getName(), kind, kind.nodeType().getSimpleName()));
        }
        return slotsOf(kind);
    }

    /**
     * Returns the current non-{@code null} children of {@code node}, slot by slot, in declared order.
     */
    public static List<AstNode> childrenOf(AstNode node) {
        List<AstNode> children = new ArrayList<>();
        for (Slot<?, ?> slot : slotsOf(node)) {
            children.addAll(slot.children(node));
        }
        return children;
    }

    private static Map<NodeKind, List<Slot<?, ?>>> build() {
        Map<NodeKind, List<Slot<?, ?>>> table = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            table.put(kind, Collections.unmodifiableList(slotsFor(kind)));
        }
        return table;
    }

    private static List<Slot<?, ?>> slotsFor(NodeKind kind) {
        return switch (kind) {
            // Leaves
            case COMMENT, BAD_EXPR, IDENT, BASIC_LIT, BAD_STMT, EMPTY_STMT, BAD_DECL -> List.of();

            // Comments and fields
            case COMMENT_GROUP -> List.of(
                    triggering("comments", CommentGroupNode.class, CommentNode.class, CommentGroupNode::getComments, CommentGroupNode::setComments));
            case FIELD -> List.of(
                    annotation("doc", FieldNode.class, FieldNode::getDoc, FieldNode::setDoc),
                    tolerant("names", FieldNode.class, IdentifierNode.class, FieldNode::getNames, FieldNode::setNames),
                    required("type", FieldNode.class, Expression.class, FieldNode::getType, FieldNode::setType),
                    optional("tag", FieldNode.class, BasicLiteralNode.class, FieldNode::getTag, FieldNode::setTag),
                    annotation("comment", FieldNode.class, FieldNode::getComment, FieldNode::setComment));
            case FIELD_LIST -> List.of(
                    triggering("fields", FieldListNode.class, FieldNode.class, FieldListNode::getFields, FieldListNode::setFields));

            // Expressions
            case ELLIPSIS -> List.of(
                    required("elt", EllipsisNode.class, Expression.class, EllipsisNode::getElt, EllipsisNode::setElt));
            case FUNC_LIT -> List.of(
                    required("type", FuncLiteralNode.class, FuncTypeNode.class, FuncLiteralNode::getType, FuncLiteralNode::setType),
                    required("body", FuncLiteralNode.class, BlockStmtNode.class, FuncLiteralNode::getBody, FuncLiteralNode::setBody));
            case COMPOSITE_LIT -> List.of(
                    optional("type", CompositeLiteralNode.class, Expression.class, CompositeLiteralNode::getType, CompositeLiteralNode::setType),
                    tolerant("elts", CompositeLiteralNode.class, Expression.class, CompositeLiteralNode::getElts, CompositeLiteralNode::setElts));
            case PAREN_EXPR -> List.of(
                    required("x", ParenExprNode.class, Expression.class, ParenExprNode::getX, ParenExprNode::setX));
            case SELECTOR_EXPR -> List.of(
                    required("x", SelectorExprNode.class, Expression.class, SelectorExprNode::getX, SelectorExprNode::setX),
                    required("sel", SelectorExprNode.class, IdentifierNode.class, SelectorExprNode::getSel, SelectorExprNode::setSel));
            case INDEX_EXPR -> List.of(
                    required("x", IndexExprNode.class, Expression.class, IndexExprNode::getX, IndexExprNode::setX),
                    required("index", IndexExprNode.class, Expression.class, IndexExprNode::getIndex, IndexExprNode::setIndex));
            case SLICE_EXPR -> List.of(
                    required("x", SliceExprNode.class, Expression.class, SliceExprNode::getX, SliceExprNode::setX),
                    optional("low", SliceExprNode.class, Expression.class, SliceExprNode::getLow, SliceExprNode::setLow),
                    optional("high", SliceExprNode.class, Expression.class, SliceExprNode::getHigh, SliceExprNode::setHigh),
                    optional("max", SliceExprNode.class, Expression.class, SliceExprNode::getMax, SliceExprNode::setMax));
            case TYPE_ASSERT_EXPR -> List.of(
                    required("x", TypeAssertExprNode.class, Expression.class, TypeAssertExprNode::getX, TypeAssertExprNode::setX),
                    optional("type", TypeAssertExprNode.class, Expression.class, TypeAssertExprNode::getType, TypeAssertExprNode::setType));
            case CALL_EXPR -> List.of(
                    required("fun", CallExprNode.class, Expression.class, CallExprNode::getFun, CallExprNode::setFun),
                    tolerant("args", CallExprNode.class, Expression.class, CallExprNode::getArgs, CallExprNode::setArgs));
            case STAR_EXPR -> List.of(
                    required("x", StarExprNode.class, Expression.class, StarExprNode::getX, StarExprNode::setX));
            case UNARY_EXPR -> List.of(
                    required("x", UnaryExprNode.class, Expression.class, UnaryExprNode::getX, UnaryExprNode::setX));
            case BINARY_EXPR -> List.of(
                    required("x", BinaryExprNode.class, Expression.class, BinaryExprNode::getX, BinaryExprNode::setX),
                    required("y", BinaryExprNode.class, Expression.class, BinaryExprNode::getY, BinaryExprNode::setY));
            case KEY_VALUE_EXPR -> List.of(
                    required("key", KeyValueExprNode.class, Expression.class, KeyValueExprNode::getKey, KeyValueExprNode::setKey),
                    required("value", KeyValueExprNode.class, Expression.class, KeyValueExprNode::getValue, KeyValueExprNode::setValue));

            // Types
            case ARRAY_TYPE -> List.of(
                    optional("len", ArrayTypeNode.class, Expression.class, ArrayTypeNode::getLen, ArrayTypeNode::setLen),
                    required("elt", ArrayTypeNode.class, Expression.class, ArrayTypeNode::getElt, ArrayTypeNode::setElt));
            case STRUCT_TYPE -> List.of(
                    required("fields", StructTypeNode.class, FieldListNode.class, StructTypeNode::getFields, StructTypeNode::setFields));
            case FUNC_TYPE -> List.of(
                    optional("params", FuncTypeNode.class, FieldListNode.class, FuncTypeNode::getParams, FuncTypeNode::setParams),
                    optional("results", FuncTypeNode.class, FieldListNode.class, FuncTypeNode::getResults, FuncTypeNode::setResults));
            case INTERFACE_TYPE -> List.of(
                    optional("methods", InterfaceTypeNode.class, FieldListNode.class, InterfaceTypeNode::getMethods, InterfaceTypeNode::setMethods));
            case MAP_TYPE -> List.of(
                    required("key", MapTypeNode.class, Expression.class, MapTypeNode::getKey, MapTypeNode::setKey),
                    required("value", MapTypeNode.class, Expression.class, MapTypeNode::getValue, MapTypeNode::setValue));
            case CHAN_TYPE -> List.of(
                    required("value", ChanTypeNode.class, Expression.class, ChanTypeNode::getValue, ChanTypeNode::setValue));

            // Statements
            case DECL_STMT -> List.of(
                    required("decl", DeclStmtNode.class, Declaration.class, DeclStmtNode::getDecl, DeclStmtNode::setDecl));
            case LABELED_STMT -> List.of(
                    required("label", LabeledStmtNode.class, IdentifierNode.class, LabeledStmtNode::getLabel, LabeledStmtNode::setLabel),
                    required("stmt", LabeledStmtNode.class, Statement.class, LabeledStmtNode::getStmt, LabeledStmtNode::setStmt));
            case EXPR_STMT -> List.of(
                    required("x", ExprStmtNode.class, Expression.class, ExprStmtNode::getX, ExprStmtNode::setX));
            case SEND_STMT -> List.of(
                    required("chan", SendStmtNode.class, Expression.class, SendStmtNode::getChan, SendStmtNode::setChan),
                    required("value", SendStmtNode.class, Expression.class, SendStmtNode::getValue, SendStmtNode::setValue));
            case INC_DEC_STMT -> List.of(
                    required("x", IncDecStmtNode.class, Expression.class, IncDecStmtNode::getX, IncDecStmtNode::setX));
            case ASSIGN_STMT -> List.of(
                    triggering("lhs", AssignStmtNode.class, Expression.class, AssignStmtNode::getLhs, AssignStmtNode::setLhs),
                    triggering("rhs", AssignStmtNode.class, Expression.class, AssignStmtNode::getRhs, AssignStmtNode::setRhs));
            case GO_STMT -> List.of(
                    required("call", GoStmtNode.class, CallExprNode.class, GoStmtNode::getCall, GoStmtNode::setCall));
            case DEFER_STMT -> List.of(
                    required("call", DeferStmtNode.class, CallExprNode.class, DeferStmtNode::getCall, DeferStmtNode::setCall));
            case RETURN_STMT -> List.of(
                    tolerant("results", ReturnStmtNode.class, Expression.class, ReturnStmtNode::getResults, ReturnStmtNode::setResults));
            case BRANCH_STMT -> List.of(
                    optional("label", BranchStmtNode.class, IdentifierNode.class, BranchStmtNode::getLabel, BranchStmtNode::setLabel));
            case BLOCK_STMT -> List.of(
                    tolerant("stmts", BlockStmtNode.class, Statement.class, BlockStmtNode::getStmts, BlockStmtNode::setStmts));
            case IF_STMT -> List.of(
                    optional("init", IfStmtNode.class, Statement.class, IfStmtNode::getInit, IfStmtNode::setInit),
                    required("cond", IfStmtNode.class, Expression.class, IfStmtNode::getCond, IfStmtNode::setCond),
                    required("body", IfStmtNode.class, BlockStmtNode.class, IfStmtNode::getBody, IfStmtNode::setBody),
                    optional("else", IfStmtNode.class, Statement.class, IfStmtNode::getElseBranch, IfStmtNode::setElseBranch));
            case CASE_CLAUSE -> List.of(
                    tolerant("list", CaseClauseNode.class, Expression.class, CaseClauseNode::getList, CaseClauseNode::setList),
                    tolerant("body", CaseClauseNode.class, Statement.class, CaseClauseNode::getBody, CaseClauseNode::setBody));
            case SWITCH_STMT -> List.of(
                    optional("init", SwitchStmtNode.class, Statement.class, SwitchStmtNode::getInit, SwitchStmtNode::setInit),
                    optional("tag", SwitchStmtNode.class, Expression.class, SwitchStmtNode::getTag, SwitchStmtNode::setTag),
                    required("body", SwitchStmtNode.class, BlockStmtNode.class, SwitchStmtNode::getBody, SwitchStmtNode::setBody));
            case TYPE_SWITCH_STMT -> List.of(
                    optional("init", TypeSwitchStmtNode.class, Statement.class, TypeSwitchStmtNode::getInit, TypeSwitchStmtNode::setInit),
                    required("assign", TypeSwitchStmtNode.class, Statement.class, TypeSwitchStmtNode::getAssign, TypeSwitchStmtNode::setAssign),
                    required("body", TypeSwitchStmtNode.class, BlockStmtNode.class, TypeSwitchStmtNode::getBody, TypeSwitchStmtNode::setBody));
            case COMM_CLAUSE -> List.of(
                    optional("comm", CommClauseNode.class, Statement.class, CommClauseNode::getComm, CommClauseNode::setComm),
                    tolerant("body", CommClauseNode.class, Statement.class, CommClauseNode::getBody, CommClauseNode::setBody));
            case SELECT_STMT -> List.of(
                    required("body", SelectStmtNode.class, BlockStmtNode.class, SelectStmtNode::getBody, SelectStmtNode::setBody));
            case FOR_STMT -> List.of(
                    optional("init", ForStmtNode.class, Statement.class, ForStmtNode::getInit, ForStmtNode::setInit),
                    optional("cond", ForStmtNode.class, Expression.class, ForStmtNode::getCond, ForStmtNode::setCond),
                    optional("post", ForStmtNode.class, Statement.class, ForStmtNode::getPost, ForStmtNode::setPost),
                    required("body", ForStmtNode.class, BlockStmtNode.class, ForStmtNode::getBody, ForStmtNode::setBody));
            case RANGE_STMT -> List.of(
                    optional("key", RangeStmtNode.class, Expression.class, RangeStmtNode::getKey, RangeStmtNode::setKey),
                    optional("value", RangeStmtNode.class, Expression.class, RangeStmtNode::getValue, RangeStmtNode::setValue),
                    required("x", RangeStmtNode.class, Expression.class, RangeStmtNode::getX, RangeStmtNode::setX),
                    required("body", RangeStmtNode.class, BlockStmtNode.class, RangeStmtNode::getBody, RangeStmtNode::setBody));

            // Specifications
            case IMPORT_SPEC -> List.of(
                    annotation("doc", ImportSpecNode.class, ImportSpecNode::getDoc, ImportSpecNode::setDoc),
                    optional("name", ImportSpecNode.class, IdentifierNode.class, ImportSpecNode::getName, ImportSpecNode::setName),
                    required("path", ImportSpecNode.class, BasicLiteralNode.class, ImportSpecNode::getPath, ImportSpecNode::setPath),
                    annotation("comment", ImportSpecNode.class, ImportSpecNode::getComment, ImportSpecNode::setComment));
            case VALUE_SPEC -> List.of(
                    annotation("doc", ValueSpecNode.class, ValueSpecNode::getDoc, ValueSpecNode::setDoc),
                    triggering("names", ValueSpecNode.class, IdentifierNode.class, ValueSpecNode::getNames, ValueSpecNode::setNames),
                    optional("type", ValueSpecNode.class, Expression.class, ValueSpecNode::getType, ValueSpecNode::setType),
                    tolerant("values", ValueSpecNode.class, Expression.class, ValueSpecNode::getValues, ValueSpecNode::setValues),
                    annotation("comment", ValueSpecNode.class, ValueSpecNode::getComment, ValueSpecNode::setComment));
            case TYPE_SPEC -> List.of(
                    annotation("doc", TypeSpecNode.class, TypeSpecNode::getDoc, TypeSpecNode::setDoc),
                    required("name", TypeSpecNode.class, IdentifierNode.class, TypeSpecNode::getName, TypeSpecNode::setName),
                    required("type", TypeSpecNode.class, Expression.class, TypeSpecNode::getType, TypeSpecNode::setType),
                    annotation("comment", TypeSpecNode.class, TypeSpecNode::getComment, TypeSpecNode::setComment));

            // Declarations
            case GEN_DECL -> List.of(
                    annotation("doc", GenDeclNode.class, GenDeclNode::getDoc, GenDeclNode::setDoc),
                    triggering("specs", GenDeclNode.class, Specification.class, GenDeclNode::getSpecs, GenDeclNode::setSpecs));
            case FUNC_DECL -> List.of(
                    annotation("doc", FuncDeclNode.class, FuncDeclNode::getDoc, FuncDeclNode::setDoc),
                    required("recv", FuncDeclNode.class, FieldListNode.class, FuncDeclNode::getRecv, FuncDeclNode::setRecv),
                    required("name", FuncDeclNode.class, IdentifierNode.class, FuncDeclNode::getName, FuncDeclNode::setName),
                    required("type", FuncDeclNode.class, FuncTypeNode.class, FuncDeclNode::getType, FuncDeclNode::setType),
                    optional("body", FuncDeclNode.class, BlockStmtNode.class, FuncDeclNode::getBody, FuncDeclNode::setBody));

            // Files and packages. The comment index of a file is not a slot: its groups are
            // reached through the nodes they are attached to.
            case FILE -> List.of(
                    annotation("doc", FileNode.class, FileNode::getDoc, FileNode::setDoc),
                    required("name", FileNode.class, IdentifierNode.class, FileNode::getName, FileNode::setName),
                    tolerant("decls", FileNode.class, Declaration.class, FileNode::getDecls, FileNode::setDecls));
            case PACKAGE -> List.of(
                    tolerant("files", PackageNode.class, FileNode.class, PackageNode::getFiles, PackageNode::setFiles));
        };
    }
}
