package org.astrewrite.rewrite;

import org.astrewrite.api.RewriteErrorCode;
import org.astrewrite.api.RewriteException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.astrewrite.test.utils.Trees.ident;

@Tag("unit")
class VisitResultTest {

    @Test
    void descendKeepsTheNodeAndContinues() {
        VisitResult result = VisitResult.descend(ident("x"));

        assertThat(result.isRemoval()).isFalse();
        assertThat(result.shouldDescend()).isTrue();
        assertThat(result.node().describe()).isEqualTo("Ident(name=x)");
    }

    @Test
    void skipKeepsTheNodeAndStops() {
        VisitResult result = VisitResult.skip(ident("x"));

        assertThat(result.isRemoval()).isFalse();
        assertThat(result.shouldDescend()).isFalse();
    }

    @Test
    void removeHasNoNode() {
        assertThat(VisitResult.remove().isRemoval()).isTrue();
        assertThat(VisitResult.remove().node()).isNull();
        assertThat(VisitResult.remove()).isSameAs(VisitResult.remove());
    }

    @Test
    void absentNodeMustBeExpressedAsRemoval() {
        assertThatThrownBy(() -> VisitResult.descend(null))
                .isInstanceOf(RewriteException.class)
                .satisfies(e -> assertThat(((RewriteException) e).getErrorCode()).isEqualTo(RewriteErrorCode.INVALID_VISIT_RESULT));
        assertThatThrownBy(() -> VisitResult.skip(null))
                .isInstanceOf(RewriteException.class)
                .hasMessageContaining("INVALID_VISIT_RESULT");
    }
}
