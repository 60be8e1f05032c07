package org.simplelang.compiler.api;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.simplelang.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FrontendConfigTest {

    @Test
    @Tag("unit")
    void testFromConfigReadsAllKeys() {
        // Act
        FrontendConfig config = FrontendConfig.fromConfig(
                ConfigFactory.parseString("max-nesting-depth = 12\nmode = FIRST_ERROR"));

        // Assert
        assertThat(config).isEqualTo(new FrontendConfig(12, AnalysisMode.FIRST_ERROR));
    }

    @Test
    @Tag("unit")
    void testMissingKeysKeepDefaults() {
        // Act
        FrontendConfig config = FrontendConfig.fromConfig(ConfigFactory.empty());

        // Assert
        assertThat(config).isEqualTo(FrontendConfig.DEFAULT);
        assertThat(config.maxNestingDepth()).isEqualTo(Parser.DEFAULT_MAX_NESTING_DEPTH);
        assertThat(config.mode()).isEqualTo(AnalysisMode.BATCH);
    }

    @Test
    @Tag("unit")
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> new FrontendConfig(0, AnalysisMode.BATCH))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FrontendConfig.fromConfig(ConfigFactory.parseString("mode = SOMETIMES")))
                .isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    @Tag("unit")
    void testWithModeKeepsDepth() {
        // Act
        FrontendConfig config = new FrontendConfig(40, AnalysisMode.BATCH).withMode(AnalysisMode.FIRST_ERROR);

        // Assert
        assertThat(config.maxNestingDepth()).isEqualTo(40);
        assertThat(config.mode()).isEqualTo(AnalysisMode.FIRST_ERROR);
    }
}
