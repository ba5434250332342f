package io.tessera.core;

import io.tessera.core.model.PoolMergeStrategy;

/// Configuration options for project aggregation and rendering.
///
/// Controls the dependency discovery bound, the pool merge combinator and the
/// names of the artifacts written by the renderer. Use the {@link Builder} for
/// fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `maxDiscoveryDepth`: `64`
/// - `poolMergeStrategy`: {@link PoolMergeStrategy#SUM}
/// - `workflowsDirectory`: `"dags"`
/// - `requirementsFileName`: `"requirements.txt"`
/// - `packagesFileName`: `"packages.txt"`
/// - `settingsFileName`: `"airflow_settings.yaml"`
/// - `settingsRootKey`: `"airflow"`
/// - `envFileName`: `".env"`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before it is handed to a project or renderer.
/// Do not modify it afterward.
///
/// @see Builder
public class TesseraConfig {
    public static final int DEFAULT_MAX_DISCOVERY_DEPTH = 64;

    private int maxDiscoveryDepth = DEFAULT_MAX_DISCOVERY_DEPTH;
    private PoolMergeStrategy poolMergeStrategy = PoolMergeStrategy.SUM;
    private String workflowsDirectory = "dags";
    private String requirementsFileName = "requirements.txt";
    private String packagesFileName = "packages.txt";
    private String settingsFileName = "airflow_settings.yaml";
    private String settingsRootKey = "airflow";
    private String envFileName = ".env";

    /// Creates a configuration with default values.
    public TesseraConfig() {}

    /// Returns the maximum nesting depth explored by dependency discovery.
    ///
    /// @return depth bound, always positive
    public int getMaxDiscoveryDepth() {
        return maxDiscoveryDepth;
    }

    /// Sets the maximum nesting depth explored by dependency discovery.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxDiscoveryDepth` must be positive
    ///
    /// @param maxDiscoveryDepth depth bound
    /// @throws IllegalArgumentException if `maxDiscoveryDepth` is not positive
    public void setMaxDiscoveryDepth(int maxDiscoveryDepth) {
        if (maxDiscoveryDepth <= 0) {
            throw new IllegalArgumentException(
                    "maxDiscoveryDepth must be positive, was " + maxDiscoveryDepth);
        }
        this.maxDiscoveryDepth = maxDiscoveryDepth;
    }

    /// Returns the combinator applied when two pools share a name.
    ///
    /// @return pool merge strategy, never null
    public PoolMergeStrategy getPoolMergeStrategy() {
        return poolMergeStrategy;
    }

    public void setPoolMergeStrategy(PoolMergeStrategy poolMergeStrategy) {
        if (poolMergeStrategy == null) {
            throw new IllegalArgumentException("poolMergeStrategy must not be null");
        }
        this.poolMergeStrategy = poolMergeStrategy;
    }

    /// Returns the output subdirectory that receives workflow files.
    ///
    /// @return directory name relative to the output directory, never null
    public String getWorkflowsDirectory() {
        return workflowsDirectory;
    }

    public void setWorkflowsDirectory(String workflowsDirectory) {
        this.workflowsDirectory = workflowsDirectory;
    }

    public String getRequirementsFileName() {
        return requirementsFileName;
    }

    public void setRequirementsFileName(String requirementsFileName) {
        this.requirementsFileName = requirementsFileName;
    }

    public String getPackagesFileName() {
        return packagesFileName;
    }

    public void setPackagesFileName(String packagesFileName) {
        this.packagesFileName = packagesFileName;
    }

    public String getSettingsFileName() {
        return settingsFileName;
    }

    public void setSettingsFileName(String settingsFileName) {
        this.settingsFileName = settingsFileName;
    }

    /// Returns the key under which the pools, variables and connections
    /// sections are nested in the settings document.
    ///
    /// @return root key, never null
    public String getSettingsRootKey() {
        return settingsRootKey;
    }

    public void setSettingsRootKey(String settingsRootKey) {
        this.settingsRootKey = settingsRootKey;
    }

    public String getEnvFileName() {
        return envFileName;
    }

    public void setEnvFileName(String envFileName) {
        this.envFileName = envFileName;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link TesseraConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}. The returned config can still be modified
    /// via setters after building.
    public static class Builder {
        private final TesseraConfig config = new TesseraConfig();

        /// Sets the maximum nesting depth explored by dependency discovery.
        ///
        /// @param maxDiscoveryDepth depth bound, must be positive
        /// @return this builder for chaining, never null
        public Builder maxDiscoveryDepth(int maxDiscoveryDepth) {
            config.setMaxDiscoveryDepth(maxDiscoveryDepth);
            return this;
        }

        /// Sets the combinator applied when two pools share a name.
        ///
        /// @param poolMergeStrategy merge strategy, not null
        /// @return this builder for chaining, never null
        public Builder poolMergeStrategy(PoolMergeStrategy poolMergeStrategy) {
            config.setPoolMergeStrategy(poolMergeStrategy);
            return this;
        }

        public Builder workflowsDirectory(String workflowsDirectory) {
            config.workflowsDirectory = workflowsDirectory;
            return this;
        }

        public Builder requirementsFileName(String requirementsFileName) {
            config.requirementsFileName = requirementsFileName;
            return this;
        }

        public Builder packagesFileName(String packagesFileName) {
            config.packagesFileName = packagesFileName;
            return this;
        }

        public Builder settingsFileName(String settingsFileName) {
            config.settingsFileName = settingsFileName;
            return this;
        }

        public Builder settingsRootKey(String settingsRootKey) {
            config.settingsRootKey = settingsRootKey;
            return this;
        }

        public Builder envFileName(String envFileName) {
            config.envFileName = envFileName;
            return this;
        }

        /// Builds and returns the configured {@link TesseraConfig} instance.
        ///
        /// @return the configured instance, never null
        public TesseraConfig build() {
            return config;
        }
    }
}
