package org.astrewrite.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Options of the rewrite engine, read from the {@code astrewrite.rewrite} block.
 *
 * @param compactFileComments Whether comment groups emptied by pruning are dropped from the comment index of retained files.
 * @param logSummary Whether a statistics summary is logged at DEBUG level after each rewrite.
 */
public record RewriteOptions(
        boolean compactFileComments,
        boolean logSummary
) {
    /** The configuration path of the options block. */
    public static final String CONFIG_PATH = "astrewrite.rewrite";

    /**
     * Reads the options from a configuration. Missing keys fall back to {@code reference.conf}.
     *
     * @param config The configuration, usually obtained from {@link ConfigLoader#load()}.
     * @return The options.
     */
    public static RewriteOptions fromConfig(Config config) {
        Config block = config.withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve()
                .getConfig(CONFIG_PATH);
        return new RewriteOptions(
                block.getBoolean("compact-file-comments"),
                block.getBoolean("log-summary"));
    }

    /**
     * @return The options defined by {@code reference.conf}.
     */
    public static RewriteOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }
}
