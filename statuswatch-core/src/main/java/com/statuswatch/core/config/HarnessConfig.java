package com.statuswatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.statuswatch.core.status.ErrorClassifier;
import com.statuswatch.core.wait.PollSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Root configuration for StatusWatch.
 *
 * <p>Loaded from {@code statuswatch.yaml}. Every setting is optional; absent values fall
 * back to the defaults of the component they configure.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * cli:
 *   path: /usr/bin/juju
 *   controller: lxd-controller
 *   model: default
 *   dataDir: /home/ci/.local/share/juju
 *
 * polling:
 *   statusBudgetSeconds: 60
 *   intervalSeconds: 5
 *   retryDelaySeconds: 1
 *   agentGraceSeconds: 300
 *   reporterWidth: 79
 *
 * deadline:
 *   softDeadline: "2026-10-19T18:00:00Z"
 *   haSettleSeconds: 300
 * }</pre>
 *
 * @param cli      how to reach the real command-line tool
 * @param polling  poll loop timing
 * @param deadline soft deadline and settle times
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HarnessConfig(
    @JsonProperty("cli") CliConfig cli,
    @JsonProperty("polling") PollingConfig polling,
    @JsonProperty("deadline") DeadlineConfig deadline
) {
    public HarnessConfig {
        cli = cli != null ? cli : CliConfig.defaults();
        polling = polling != null ? polling : PollingConfig.defaults();
        deadline = deadline != null ? deadline : DeadlineConfig.defaults();
    }

    /**
     * Creates the configuration used when no file is available.
     *
     * @return default configuration
     */
    public static HarnessConfig defaults() {
        return new HarnessConfig(CliConfig.defaults(), PollingConfig.defaults(), DeadlineConfig.defaults());
    }

    /**
     * Command-line tool settings.
     *
     * @param path       executable to run
     * @param controller controller name
     * @param model      model name
     * @param dataDir    optional data directory, exported as {@code JUJU_DATA}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CliConfig(
        @JsonProperty("path") String path,
        @JsonProperty("controller") String controller,
        @JsonProperty("model") String model,
        @JsonProperty("dataDir") String dataDir
    ) {
        public CliConfig {
            path = path != null ? path : "juju";
            model = model != null ? model : "default";
        }

        public static CliConfig defaults() {
            return new CliConfig("juju", null, "default", null);
        }
    }

    /**
     * Poll loop settings, in seconds.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PollingConfig(
        @JsonProperty("statusBudgetSeconds") Long statusBudgetSeconds,
        @JsonProperty("intervalSeconds") Long intervalSeconds,
        @JsonProperty("retryDelaySeconds") Long retryDelaySeconds,
        @JsonProperty("agentGraceSeconds") Long agentGraceSeconds,
        @JsonProperty("reporterWidth") Integer reporterWidth
    ) {
        public static PollingConfig defaults() {
            return new PollingConfig(null, null, null, null, null);
        }

        public PollSettings toPollSettings() {
            PollSettings defaults = PollSettings.defaults();
            return new PollSettings(
                seconds(statusBudgetSeconds, defaults.statusBudget()),
                seconds(intervalSeconds, defaults.pollInterval()),
                seconds(retryDelaySeconds, defaults.retryDelay()),
                reporterWidth != null ? reporterWidth : defaults.reporterWidth());
        }

        public Duration agentGracePeriod() {
            return seconds(agentGraceSeconds, ErrorClassifier.DEFAULT_AGENT_GRACE_PERIOD);
        }
    }

    /**
     * Deadline settings.
     *
     * @param softDeadline    ISO-8601 instant after which client calls fail, or null for none
     * @param haSettleSeconds pause after HA is reported enabled
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeadlineConfig(
        @JsonProperty("softDeadline") String softDeadline,
        @JsonProperty("haSettleSeconds") Long haSettleSeconds
    ) {
        public static final Duration DEFAULT_HA_SETTLE_TIME = Duration.ofSeconds(300);

        public static DeadlineConfig defaults() {
            return new DeadlineConfig(null, null);
        }

        /**
         * @throws java.time.format.DateTimeParseException if the deadline is not an ISO-8601 instant
         */
        public Optional<Instant> softDeadlineInstant() {
            return Optional.ofNullable(softDeadline).map(Instant::parse);
        }

        public Duration haSettleTime() {
            return seconds(haSettleSeconds, DEFAULT_HA_SETTLE_TIME);
        }
    }

    private static Duration seconds(Long value, Duration fallback) {
        return value != null ? Duration.ofSeconds(value) : fallback;
    }
}
