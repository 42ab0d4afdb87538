package org.astrewrite.inspect;

import org.astrewrite.ast.AstNode;
import org.astrewrite.ast.CommentNode;
import org.astrewrite.ast.FileNode;
import org.astrewrite.ast.FuncDeclNode;
import org.astrewrite.ast.IdentifierNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.astrewrite.test.utils.Trees.*;

@Tag("unit")
class AstInspectorTest {

    @Test
    void collectReturnsMatchesInPreOrder() {
        List<IdentifierNode> idents = AstInspector.collect(sampleFile(), IdentifierNode.class);

        assertThat(idents).hasSize(22);
        assertThat(idents).extracting(IdentifierNode::getName)
                .startsWith("main", "Point", "X", "int", "Y", "int", "limit", "main", "p")
                .endsWith("fmt", "Println", "i");
    }

    @Test
    void attachedCommentsAreReachedButTheIndexIsNot() {
        FileNode file = sampleFile();

        List<CommentNode> comments = AstInspector.collect(file, CommentNode.class);

        assertThat(comments).extracting(CommentNode::getText).containsExactly(
                "// Package main is a sample.",
                "// printing",
                "// Point is a point.",
                "// X coordinate.",
                "// vertical",
                "// Limit caps the loop.");
    }

    @Test
    void returningFalseSkipsTheChildren() {
        List<String> visited = new ArrayList<>();

        AstInspector.inspect(sampleFile(), node -> {
            visited.add(node.describe());
            return !(node instanceof FuncDeclNode);
        });

        assertThat(visited).contains("FuncDecl", "GenDecl(keyword=VAR)");
        assertThat(visited).doesNotContain("ForStmt", "BlockStmt");
        assertThat(visited.get(visited.size() - 1)).isEqualTo("FuncDecl");
    }

    @Test
    void absentRootIsIgnored() {
        List<AstNode> visited = new ArrayList<>();

        AstInspector.inspect(null, visited::add);

        assertThat(visited).isEmpty();
        assertThat(AstInspector.collect(null, IdentifierNode.class)).isEmpty();
    }

    @Test
    void inspectionDoesNotModifyTheTree() {
        FileNode file = file("main", varDecl(valueSpec("x", intLit("1"))));
        String before = AstDumper.dump(file);

        AstInspector.inspect(file, node -> true);

        assertThat(AstDumper.dump(file)).isEqualTo(before);
    }
}
