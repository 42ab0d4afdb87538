package org.astrewrite.test.utils;

import org.astrewrite.ast.AstNode;
import org.astrewrite.rewrite.RewriteVisitor;
import org.astrewrite.rewrite.VisitResult;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A visitor that records every call it receives as {@code "enter <node>"} / {@code "leave <node>"}
 * and delegates the decision to a function.
 */
public class RecordingVisitor implements RewriteVisitor {

    private final Function<AstNode, VisitResult> decision;
    private final List<String> events = new ArrayList<>();

    public RecordingVisitor(Function<AstNode, VisitResult> decision) {
        this.decision = decision;
    }

    /**
     * @return A visitor that keeps every node and descends everywhere.
     */
    public static RecordingVisitor identity() {
        return new RecordingVisitor(VisitResult::descend);
    }

    @Override
    public VisitResult enter(AstNode node) {
        events.add("enter " + node.describe());
        return decision.apply(node);
    }

    @Override
    public void leave(AstNode node) {
        events.add("leave " + node.describe());
    }

    public List<String> events() {
        return events;
    }

    public List<String> entered() {
        return events.stream().filter(e -> e.startsWith("enter ")).map(e -> e.substring(6)).toList();
    }
}
