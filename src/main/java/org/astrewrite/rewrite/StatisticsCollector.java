package org.astrewrite.rewrite;

import org.astrewrite.api.RewriteStatistics;

/**
 * Mutable counters of a single walk.
 */
final class StatisticsCollector {

    private long nodesEntered;
    private long replacements;
    private long explicitRemovals;
    private long cascadeRemovals;
    private long elementsDropped;
    private long commentsPruned;

    void nodeEntered() {
        nodesEntered++;
    }

    void replacement() {
        replacements++;
    }

    void explicitRemoval() {
        explicitRemovals++;
    }

    void cascadeRemoval() {
        cascadeRemovals++;
    }

    void elementDropped() {
        elementsDropped++;
    }

    void commentsPruned(int count) {
        commentsPruned += count;
    }

    RewriteStatistics snapshot() {
        return new RewriteStatistics(nodesEntered, replacements, explicitRemovals,
                cascadeRemovals, elementsDropped, commentsPruned);
    }
}
