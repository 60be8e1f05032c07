package org.simplelang.compiler.api;

import com.typesafe.config.Config;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.simplelang.compiler.frontend.parser.Parser;

/**
 * Immutable settings of one {@link org.simplelang.compiler.Compiler}.
 *
 * @param maxNestingDepth The deepest statement/expression nesting the parser accepts.
 * @param mode Whether to report every fault or stop at the first error.
 */
public record FrontendConfig(int maxNestingDepth, AnalysisMode mode) {

    /** The settings used when nothing is configured. */
    public static final FrontendConfig DEFAULT = new FrontendConfig(Parser.DEFAULT_MAX_NESTING_DEPTH, AnalysisMode.BATCH);

    private static final String MAX_NESTING_DEPTH_KEY = "max-nesting-depth";
    private static final String MODE_KEY = "mode";

    public FrontendConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("max-nesting-depth must be positive, got " + maxNestingDepth);
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
    }

    /**
     * Reads the settings from a {@code simplelang.frontend}-style block. Missing keys keep their
     * {@link #DEFAULT} values.
     * @param config The configuration block.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key holds a value of the wrong type.
     */
    public static FrontendConfig fromConfig(Config config) {
        int depth = config.hasPath(MAX_NESTING_DEPTH_KEY)
                ? config.getInt(MAX_NESTING_DEPTH_KEY)
                : DEFAULT.maxNestingDepth();
        AnalysisMode mode = config.hasPath(MODE_KEY)
                ? config.getEnum(AnalysisMode.class, MODE_KEY)
                : DEFAULT.mode();
        return new FrontendConfig(depth, mode);
    }

    /**
     * @param newMode The reporting policy.
     * @return A copy of these settings with another mode.
     */
    public FrontendConfig withMode(AnalysisMode newMode) {
        return new FrontendConfig(maxNestingDepth, newMode);
    }
}
