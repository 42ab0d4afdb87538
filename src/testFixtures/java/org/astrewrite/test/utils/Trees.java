package org.astrewrite.test.utils;

import org.astrewrite.ast.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for small trees used across the tests.
 */
public final class Trees {

    private Trees() {}

    public static IdentifierNode ident(String name) {
        return new IdentifierNode(name);
    }

    public static BasicLiteralNode intLit(String value) {
        return new BasicLiteralNode(LiteralKind.INT, value);
    }

    public static BasicLiteralNode stringLit(String value) {
        return new BasicLiteralNode(LiteralKind.STRING, "\"" + value + "\"");
    }

    public static CommentGroupNode comments(String... texts) {
        List<CommentNode> list = new ArrayList<>();
        for (String text : texts) {
            list.add(new CommentNode(text));
        }
        return new CommentGroupNode(list);
    }

    public static BinaryExprNode binary(Expression x, String operator, Expression y) {
        return new BinaryExprNode(operator, x, y);
    }

    public static CallExprNode call(Expression fun, Expression... args) {
        return new CallExprNode(fun, Arrays.asList(args));
    }

    public static SelectorExprNode selector(String x, String sel) {
        return new SelectorExprNode(ident(x), ident(sel));
    }

    public static ExprStmtNode exprStmt(Expression x) {
        return new ExprStmtNode(x);
    }

    public static AssignStmtNode define(String name, Expression value) {
        return new AssignStmtNode(":=", List.of(ident(name)), List.of(value));
    }

    public static ReturnStmtNode ret(Expression... results) {
        return new ReturnStmtNode(Arrays.asList(results));
    }

    public static BlockStmtNode block(Statement... stmts) {
        return new BlockStmtNode(Arrays.asList(stmts));
    }

    public static FieldNode field(String name, Expression type) {
        return new FieldNode(null, List.of(ident(name)), type, null, null);
    }

    public static FieldListNode fields(FieldNode... fields) {
        return new FieldListNode(Arrays.asList(fields));
    }

    public static FuncTypeNode funcType(FieldListNode params, FieldListNode results) {
        return new FuncTypeNode(params, results);
    }

    public static ValueSpecNode valueSpec(String name, Expression value) {
        return new ValueSpecNode(null, List.of(ident(name)), null, List.of(value), null);
    }

    public static GenDeclNode varDecl(Specification... specs) {
        return new GenDeclNode(DeclKeyword.VAR, null, Arrays.asList(specs));
    }

    public static ImportSpecNode importSpec(String path) {
        return new ImportSpecNode(null, null, stringLit(path), null);
    }

    public static FuncDeclNode func(String name, FuncTypeNode type, BlockStmtNode body) {
        return new FuncDeclNode(null, null, ident(name), type, body);
    }

    public static FileNode file(String name, Declaration... decls) {
        return new FileNode(null, ident(name), Arrays.asList(decls), List.of());
    }

    /**
     * Builds a file that exercises most node families, with comments attached at several levels
     * and registered in the file's comment index:
     *
     * <pre>
     * // Package main is a sample.
     * package main
     *
     * import "fmt" // printing
     *
     * // Point is a point.
     * type Point struct {
     *     // X coordinate.
     *     X int `json:"x"`
     *     Y int // vertical
     * }
     *
     * // Limit caps the loop.
     * var limit = 10
     *
     * func main() {
     *     p := Point{X: 1, Y: 2}
     *     for i := 0; i &lt; limit; i++ {
     *         if i == p.X {
     *             continue
     *         }
     *         fmt.Println(i)
     *     }
     *     return
     * }
     * </pre>
     */
    public static FileNode sampleFile() {
        CommentGroupNode fileDoc = comments("// Package main is a sample.");
        CommentGroupNode importComment = comments("// printing");
        CommentGroupNode pointDoc = comments("// Point is a point.");
        CommentGroupNode xDoc = comments("// X coordinate.");
        CommentGroupNode yComment = comments("// vertical");
        CommentGroupNode limitDoc = comments("// Limit caps the loop.");

        GenDeclNode imports = new GenDeclNode(DeclKeyword.IMPORT, null,
                List.of(new ImportSpecNode(null, null, stringLit("fmt"), importComment)));

        FieldNode x = new FieldNode(xDoc, List.of(ident("X")), ident("int"), stringLit("json:\\\"x\\\""), null);
        FieldNode y = new FieldNode(null, List.of(ident("Y")), ident("int"), null, yComment);
        GenDeclNode point = new GenDeclNode(DeclKeyword.TYPE, pointDoc, List.of(
                new TypeSpecNode(null, ident("Point"), new StructTypeNode(fields(x, y)), null)));

        GenDeclNode limit = new GenDeclNode(DeclKeyword.VAR, limitDoc, List.of(valueSpec("limit", intLit("10"))));

        CompositeLiteralNode pointValue = new CompositeLiteralNode(ident("Point"), List.of(
                new KeyValueExprNode(ident("X"), intLit("1")),
                new KeyValueExprNode(ident("Y"), intLit("2"))));
        IfStmtNode skip = new IfStmtNode(null, binary(ident("i"), "==", selector("p", "X")),
                block(new BranchStmtNode("continue", null)), null);
        ForStmtNode loop = new ForStmtNode(
                define("i", intLit("0")),
                binary(ident("i"), "<", ident("limit")),
                new IncDecStmtNode(true, ident("i")),
                block(skip, exprStmt(call(selector("fmt", "Println"), ident("i")))));
        FuncDeclNode main = func("main", funcType(fields(), null),
                block(define("p", pointValue), loop, ret()));

        return new FileNode(fileDoc, ident("main"), List.of(imports, point, limit, main),
                List.of(fileDoc, importComment, pointDoc, xDoc, yComment, limitDoc));
    }
}
