package org.astrewrite;

import org.astrewrite.api.RewriteException;
import org.astrewrite.api.RewriteResult;
import org.astrewrite.ast.AstNode;
import org.astrewrite.ast.BlockStmtNode;
import org.astrewrite.ast.CallExprNode;
import org.astrewrite.ast.ExprStmtNode;
import org.astrewrite.ast.IdentifierNode;
import org.astrewrite.ast.ReturnStmtNode;
import org.astrewrite.config.RewriteOptions;
import org.astrewrite.junit.extensions.logging.ExpectLog;
import org.astrewrite.junit.extensions.logging.LogLevel;
import org.astrewrite.junit.extensions.logging.LogWatchExtension;
import org.astrewrite.rewrite.RewriteVisitor;
import org.astrewrite.rewrite.VisitResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.astrewrite.test.utils.Trees.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class AstRewriterTest {

    @Mock
    private RewriteVisitor visitor;

    private final AstRewriter rewriter = new AstRewriter(RewriteOptions.defaults());

    @Test
    void callsEnterBeforeChildrenAndLeaveAfterThem() {
        IdentifierNode fun = ident("f");
        CallExprNode call = call(fun);
        when(visitor.enter(any())).thenAnswer(invocation -> VisitResult.descend(invocation.getArgument(0)));

        RewriteResult result = rewriter.rewrite(call, visitor);

        assertThat(result.root()).isSameAs(call);
        InOrder order = inOrder(visitor);
        order.verify(visitor).enter(call);
        order.verify(visitor).enter(fun);
        order.verify(visitor).leave(fun);
        order.verify(visitor).leave(call);
        order.verifyNoMoreInteractions();
    }

    @Test
    void removedNodeIsNeverLeft() {
        IdentifierNode gone = ident("gone");
        ExprStmtNode stmt = exprStmt(gone);
        ReturnStmtNode ret = ret();
        BlockStmtNode body = block(stmt, ret);
        when(visitor.enter(any())).thenAnswer(invocation -> {
            AstNode node = invocation.getArgument(0);
            return node == gone ? VisitResult.remove() : VisitResult.descend(node);
        });

        rewriter.rewrite(body, visitor);

        verify(visitor, never()).leave(gone);
        verify(visitor, never()).leave(stmt);
        verify(visitor).leave(ret);
        verify(visitor).leave(body);
        assertThat(body.getStmts()).containsExactly(ret);
    }

    @Test
    void removedRootYieldsNoTree() {
        RewriteResult result = rewriter.rewrite(varDecl(valueSpec("x", intLit("1"))),
                node -> node instanceof IdentifierNode ? VisitResult.remove() : VisitResult.descend(node));

        assertThat(result.removed()).isTrue();
        assertThat(result.root()).isNull();
    }

    @Test
    void walkReturnsTheNewRoot() {
        IdentifierNode replacement = ident("new");

        AstNode root = rewriter.walk(ident("old"), node -> VisitResult.descend(replacement));

        assertThat(root).isSameAs(replacement);
    }

    @Test
    void rewriterCanBeReused() {
        RewriteVisitor identity = VisitResult::descend;

        assertThat(rewriter.rewrite(sampleFile(), identity).removed()).isFalse();
        assertThat(rewriter.rewrite(sampleFile(), identity).removed()).isFalse();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*AstRewriter", messagePattern = "Rewrite aborted: \\[KIND_MISMATCH\\].*")
    void kindMismatchIsLoggedAndRethrown() {
        ExprStmtNode stmt = exprStmt(ident("x"));

        assertThatThrownBy(() -> rewriter.rewrite(stmt,
                node -> node instanceof IdentifierNode ? VisitResult.descend(ret()) : VisitResult.descend(node)))
                .isInstanceOf(RewriteException.class)
                .hasMessageStartingWith("[KIND_MISMATCH]");
    }

    @Test
    void missingVisitorIsRejected() {
        assertThatThrownBy(() -> rewriter.rewrite(ident("x"), null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void defaultConstructorUsesConfiguredOptions() {
        assertThat(new AstRewriter().getOptions()).isEqualTo(RewriteOptions.defaults());
    }
}
