package org.astrewrite.inspect;

import org.astrewrite.ast.FileNode;
import org.astrewrite.ast.GenDeclNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.astrewrite.test.utils.Trees.*;

@Tag("unit")
class AstDumperTest {

    @Test
    void dumpsSlotsWithIndentation() {
        GenDeclNode decl = varDecl(valueSpec("x", intLit("1")));

        assertThat(AstDumper.dump(decl)).isEqualTo("""
                GenDecl(keyword=VAR)
                  specs[0]: ValueSpec
                    names[0]: Ident(name=x)
                    values[0]: BasicLit(literalKind=INT, value=1)
                """);
    }

    @Test
    void dumpsEmptyCollectionsAndCommentIndex() {
        FileNode file = file("main");

        assertThat(AstDumper.dump(file)).isEqualTo("""
                File
                  name: Ident(name=main)
                  decls: []
                  comment index: 0 group(s)
                """);
    }

    @Test
    void dumpsCommentIndexGroups() {
        FileNode file = new FileNode(comments("// a", "// b"), ident("p"), List.of(), List.of(comments("// a", "// b"), comments("// c")));

        assertThat(AstDumper.dump(file)).isEqualTo("""
                File
                  doc: CommentGroup
                    comments[0]: Comment(text=// a)
                    comments[1]: Comment(text=// b)
                  name: Ident(name=p)
                  decls: []
                  comment index: 2 group(s)
                    [// a | // b]
                    [// c]
                """);
    }

    @Test
    void absentRoot() {
        assertThat(AstDumper.dump(null)).isEqualTo("<absent>\n");
    }

    @Test
    void equalTreesHaveEqualDumps() {
        assertThat(AstDumper.dump(sampleFile())).isEqualTo(AstDumper.dump(sampleFile()));
    }
}
