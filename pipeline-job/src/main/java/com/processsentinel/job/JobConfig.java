package com.processsentinel.job;

import java.util.Objects;

/**
 * Typed, immutable configuration object for the Process Sentinel job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be configured from a container environment or a shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_DATA_PATH = "DATA_PATH";
    public static final String ENV_ARTIFACT_PATH = "ARTIFACT_PATH";
    public static final String ENV_PIPELINE_CONFIG_PATH = "PIPELINE_CONFIG_PATH";
    public static final String ENV_SERVER_PORT = "SERVER_PORT";

    public static final String DEFAULT_ARTIFACT_PATH = "models/cascade-model.json";
    public static final int DEFAULT_SERVER_PORT = 5000;

    // ---------------------------------------------------------------
    // Training input
    // ---------------------------------------------------------------
    private final String dataPath;
    private final String pipelineConfigPath;

    // ---------------------------------------------------------------
    // Model
    // ---------------------------------------------------------------
    private final String artifactPath;

    // ---------------------------------------------------------------
    // Scoring server
    // ---------------------------------------------------------------
    private final int serverPort;

    private JobConfig(Builder b) {
        this.dataPath = b.dataPath;
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.artifactPath = b.artifactPath;
        this.serverPort = b.serverPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .dataPath(env(ENV_DATA_PATH, ""))
                    .pipelineConfigPath(env(ENV_PIPELINE_CONFIG_PATH, ""))
                    .artifactPath(env(ENV_ARTIFACT_PATH, DEFAULT_ARTIFACT_PATH))
                    .serverPort(Integer.parseInt(env(ENV_SERVER_PORT, String.valueOf(DEFAULT_SERVER_PORT))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return CSV file with labelled runs; blank when only serving
     */
    public String getDataPath() {
        return dataPath;
    }

    /**
     * @return pipeline YAML file; blank means environment / classpath lookup
     */
    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public String getArtifactPath() {
        return artifactPath;
    }

    public int getServerPort() {
        return serverPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the artifact path is not
     * blank and that the port is in [0, 65535]; port 0 binds an ephemeral
     * port.
     * </p>
     */
    public static class Builder {
        private String dataPath = "";
        private String pipelineConfigPath = "";
        private String artifactPath = DEFAULT_ARTIFACT_PATH;
        private int serverPort = DEFAULT_SERVER_PORT;

        public Builder dataPath(String v) {
            this.dataPath = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder artifactPath(String v) {
            this.artifactPath = v;
            return this;
        }

        public Builder serverPort(int v) {
            this.serverPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(dataPath, "dataPath must not be null");
            Objects.requireNonNull(pipelineConfigPath, "pipelineConfigPath must not be null");
            if (artifactPath == null || artifactPath.isBlank()) {
                throw new IllegalArgumentException("artifactPath must not be null or blank");
            }
            if (serverPort < 0 || serverPort > 65_535) {
                throw new IllegalArgumentException(
                        "serverPort must be in [0, 65535], got: " + serverPort);
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "dataPath='" + dataPath + '\'' +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", artifactPath='" + artifactPath + '\'' +
                ", serverPort=" + serverPort +
                '}';
    }
}
