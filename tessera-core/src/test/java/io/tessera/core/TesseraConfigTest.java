package io.tessera.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tessera.core.model.PoolMergeStrategy;
import org.junit.jupiter.api.Test;

public class TesseraConfigTest {

    @Test
    void shouldUseDefaults() {
        var config = new TesseraConfig();

        assertThat(config.getMaxDiscoveryDepth())
                .isEqualTo(TesseraConfig.DEFAULT_MAX_DISCOVERY_DEPTH);
        assertThat(config.getPoolMergeStrategy()).isEqualTo(PoolMergeStrategy.SUM);
        assertThat(config.getWorkflowsDirectory()).isEqualTo("dags");
        assertThat(config.getRequirementsFileName()).isEqualTo("requirements.txt");
        assertThat(config.getPackagesFileName()).isEqualTo("packages.txt");
        assertThat(config.getSettingsFileName()).isEqualTo("airflow_settings.yaml");
        assertThat(config.getSettingsRootKey()).isEqualTo("airflow");
        assertThat(config.getEnvFileName()).isEqualTo(".env");
    }

    @Test
    void shouldApplyBuilderValues() {
        var config =
                TesseraConfig.builder()
                        .maxDiscoveryDepth(8)
                        .poolMergeStrategy(PoolMergeStrategy.REPLACE)
                        .workflowsDirectory("workflows")
                        .envFileName("local.env")
                        .build();

        assertThat(config.getMaxDiscoveryDepth()).isEqualTo(8);
        assertThat(config.getPoolMergeStrategy()).isEqualTo(PoolMergeStrategy.REPLACE);
        assertThat(config.getWorkflowsDirectory()).isEqualTo("workflows");
        assertThat(config.getEnvFileName()).isEqualTo("local.env");
    }

    @Test
    void shouldRejectNonPositiveDepth() {
        assertThatThrownBy(() -> TesseraConfig.builder().maxDiscoveryDepth(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
