package org.astrewrite;

import org.astrewrite.api.IAstRewriter;
import org.astrewrite.api.RewriteException;
import org.astrewrite.api.RewriteResult;
import org.astrewrite.ast.AstNode;
import org.astrewrite.config.ConfigLoader;
import org.astrewrite.config.RewriteOptions;
import org.astrewrite.rewrite.RewriteVisitor;
import org.astrewrite.rewrite.RewriteWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The main rewrite engine implementation. Each call to {@link #rewrite(AstNode, RewriteVisitor)}
 * runs a fresh {@link RewriteWalker}; the rewriter itself keeps no per-walk state and may be reused.
 * <p>
 * Trees are rewritten in place. Callers must not rewrite the same tree, or overlapping subtrees,
 * from several threads at once.
 */
public class AstRewriter implements IAstRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(AstRewriter.class);

    private final RewriteOptions options;

    /**
     * Creates a rewriter configured from the default configuration sources, see {@link ConfigLoader}.
     */
    public AstRewriter() {
        this(RewriteOptions.fromConfig(ConfigLoader.load()));
    }

    /**
     * @param options The rewrite options.
     */
    public AstRewriter(RewriteOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public RewriteResult rewrite(AstNode root, RewriteVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor");
        try {
            return new RewriteWalker(visitor, options).run(root);
        } catch (RewriteException e) {
            LOG.error("Rewrite aborted: {}", e.getMessage());
            throw e;
        }
    }

    public RewriteOptions getOptions() {
        return options;
    }
}
