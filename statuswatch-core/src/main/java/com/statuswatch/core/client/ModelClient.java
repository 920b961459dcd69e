package com.statuswatch.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.statuswatch.core.config.HarnessConfig;
import com.statuswatch.core.process.CommandResult;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.ErrorClassifier;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.wait.CommandComplete;
import com.statuswatch.core.wait.PollSettings;
import com.statuswatch.core.wait.Sleeper;
import com.statuswatch.core.wait.StatusPoller;
import com.statuswatch.core.wait.WaitAgentsStarted;
import com.statuswatch.core.wait.WaitApplicationNotPresent;
import com.statuswatch.core.wait.WaitCondition;
import com.statuswatch.core.wait.WaitDeployStarted;
import com.statuswatch.core.wait.WaitHaEnabled;
import com.statuswatch.core.wait.WaitMachineNotPresent;
import com.statuswatch.core.wait.WaitSubordinateUnits;
import com.statuswatch.core.wait.WaitVersion;
import com.statuswatch.core.wait.WaitWorkloadsReady;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drives one model of a controller through a {@link Backend}.
 *
 * <p>Commands and waits run the same over the real tool and the simulator. Every call checks
 * the soft deadline when it returns, except inside waits and
 * {@link #ignoringSoftDeadline(Supplier)} sections.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelClient client = ModelClient.builder(new FakeBackend(new ControllerState()))
 *     .controllerName("ctl")
 *     .modelName("default")
 *     .build();
 * client.bootstrap("lxd", null, null);
 * client.deploy("dummy-source");
 * client.waitForStarted();
 * }</pre>
 */
public class ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ModelClient.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern ACTION_ID = Pattern.compile("Action queued with id: ([\\w-]+)");
    private static final Pattern REGISTER_TOKEN = Pattern.compile("juju register (\\S+)");

    public static final Duration REMOVE_MACHINE_TIMEOUT = Duration.ofSeconds(600);
    public static final Duration SSH_RETRY_PAUSE = Duration.ofSeconds(30);

    private final Backend backend;
    private final String controllerName;
    private final String modelName;
    private final String controllerModelName;
    private final Clock clock;
    private final StatusPoller poller;
    private final Instant softDeadline;
    private final Duration haSettleTime;
    private final Builder settings;
    private boolean ignoreSoftDeadline;

    private ModelClient(Builder builder) {
        this.backend = Objects.requireNonNull(builder.backend, "backend must not be null");
        this.modelName = Objects.requireNonNull(builder.modelName, "modelName must not be null");
        this.controllerName = builder.controllerName;
        this.controllerModelName = builder.controllerModelName;
        this.clock = builder.clock;
        this.softDeadline = builder.softDeadline;
        this.haSettleTime = builder.haSettleTime;
        ErrorClassifier classifier = new ErrorClassifier(builder.clock, builder.agentGracePeriod);
        this.poller = new StatusPoller(this::fetchStatusOnce, builder.clock, builder.sleeper,
            builder.pollSettings, classifier, builder.out);
        this.settings = builder.copy();
    }

    public static Builder builder(Backend backend) {
        return new Builder(backend);
    }

    /**
     * Creates a client for the configured model, running the real tool.
     *
     * @param config harness configuration
     * @return client over a {@link ProcessBackend}
     */
    public static ModelClient fromConfig(HarnessConfig config) {
        return configure(builder(ProcessBackend.fromConfig(config.cli())), config).build();
    }

    /**
     * Applies controller, model, timing and deadline settings from {@code config}.
     */
    public static Builder configure(Builder builder, HarnessConfig config) {
        builder.controllerName(config.cli().controller())
            .modelName(config.cli().model())
            .pollSettings(config.polling().toPollSettings())
            .agentGracePeriod(config.polling().agentGracePeriod())
            .haSettleTime(config.deadline().haSettleTime());
        config.deadline().softDeadlineInstant().ifPresent(builder::softDeadline);
        return builder;
    }

    /**
     * Returns a client for another model of the same controller, sharing the backend and settings.
     */
    public ModelClient forModel(String otherModel) {
        return settings.copy().modelName(otherModel).build();
    }

    /**
     * Returns a client for the controller model.
     */
    public ModelClient controllerClient() {
        return forModel(controllerModelName);
    }

    public String modelName() {
        return modelName;
    }

    public String controllerName() {
        return controllerName;
    }

    public Backend backend() {
        return backend;
    }

    // ==================== Soft Deadline ====================

    /**
     * Runs {@code action} without checking the soft deadline, e.g. for cleanup.
     */
    public <T> T ignoringSoftDeadline(Supplier<T> action) {
        boolean previous = ignoreSoftDeadline;
        ignoreSoftDeadline = true;
        try {
            return action.get();
        } finally {
            ignoreSoftDeadline = previous;
        }
    }

    private <T> T checkingTimeouts(Supplier<T> action) {
        T result = action.get();
        if (softDeadline != null && !ignoreSoftDeadline && clock.instant().isAfter(softDeadline)) {
            throw new SoftDeadlineExceededException(softDeadline);
        }
        return result;
    }

    // ==================== Raw Commands ====================

    /**
     * Runs a command against this client's model.
     *
     * @throws ProcessFailedException        if the command fails
     * @throws SoftDeadlineExceededException if the soft deadline has passed
     */
    public CommandResult juju(String command, List<String> args) {
        return checkingTimeouts(() -> backend.run(command, args, modelName, null));
    }

    /**
     * Runs a controller command, without a model.
     */
    public CommandResult controllerJuju(String command, List<String> args) {
        return checkingTimeouts(() -> backend.run(command, args, null, null));
    }

    public String getOutput(String command, List<String> args) {
        return juju(command, args).output();
    }

    // ==================== Status ====================

    private StatusDocument fetchStatusOnce() {
        CommandResult result = backend.run("show-status", List.of("--format", "yaml"), modelName,
            poller.settings().statusBudget());
        return StatusDocument.fromText(result.output());
    }

    /**
     * Fetches the current status, retrying failed calls within the status budget.
     *
     * @throws com.statuswatch.core.wait.StatusTimeoutException if no call succeeded in time
     */
    public StatusDocument getStatus() {
        return checkingTimeouts(poller::fetchStatus);
    }

    // ==================== Waits ====================

    public StatusDocument waitFor(WaitCondition condition) {
        return waitFor(condition, false);
    }

    /**
     * Waits until {@code condition} is met. The soft deadline is checked only once the wait returns.
     *
     * @param quiet whether to suppress progress output
     * @return status in which the condition was met
     */
    public StatusDocument waitFor(WaitCondition condition, boolean quiet) {
        return checkingTimeouts(() -> ignoringSoftDeadline(() -> poller.waitFor(condition, modelName, quiet)));
    }

    public StatusDocument waitForStarted() {
        return waitFor(new WaitAgentsStarted());
    }

    public StatusDocument waitForStarted(Duration timeout) {
        return waitFor(new WaitAgentsStarted(timeout));
    }

    public StatusDocument waitForWorkloads() {
        return waitFor(new WaitWorkloadsReady());
    }

    public StatusDocument waitForVersion(String version) {
        return waitFor(new WaitVersion(version));
    }

    public StatusDocument waitForSubordinateUnits(String application, String unitPrefix) {
        return waitFor(new WaitSubordinateUnits(application, unitPrefix));
    }

    public StatusDocument waitForDeployStarted(int applicationCount) {
        return waitFor(new WaitDeployStarted(applicationCount));
    }

    /**
     * Waits for controller HA voting, then pauses for the HA settle time.
     *
     * @throws IllegalStateException if this is not a controller-model client
     */
    public StatusDocument waitForHa() {
        if (!modelName.equals(controllerModelName)) {
            throw new IllegalStateException("waitForHa requires a controller client.");
        }
        StatusDocument status = waitFor(new WaitHaEnabled());
        backend.pause(haSettleTime);
        return status;
    }

    // ==================== Controller Lifecycle ====================

    /**
     * Bootstraps the controller with this client's model as the default model.
     *
     * @param cloudRegion     cloud, optionally {@code cloud/region}
     * @param configFile      model config file, or null
     * @param bootstrapSeries default series, or null
     */
    public CommandResult bootstrap(String cloudRegion, Path configFile, String bootstrapSeries) {
        List<String> args = new ArrayList<>(List.of(cloudRegion, requireControllerName(), "--default-model", modelName));
        if (configFile != null) {
            args.add("--config");
            args.add(configFile.toString());
        }
        if (bootstrapSeries != null) {
            args.add("--bootstrap-series");
            args.add(bootstrapSeries);
        }
        return controllerJuju("bootstrap", args);
    }

    public CommandResult enableHa() {
        List<String> args = new ArrayList<>(List.of("-n", "3"));
        if (controllerName != null) {
            args.add("-c");
            args.add(controllerName);
        }
        return controllerJuju("enable-ha", args);
    }

    public ModelClient addModel(String newModel) {
        controllerJuju("add-model", List.of("-c", requireControllerName(), newModel));
        return forModel(newModel);
    }

    /**
     * @return return code of {@code destroy-model}
     */
    public int destroyModel() {
        return ignoringSoftDeadline(() ->
            controllerJuju("destroy-model", List.of(requireControllerName() + ":" + modelName, "-y")).returnCode());
    }

    /**
     * Kills the controller; failures are logged and returned, not thrown.
     *
     * @return return code of {@code kill-controller}
     */
    public int killController() {
        try {
            CommandResult result = ignoringSoftDeadline(() ->
                controllerJuju("kill-controller", List.of(requireControllerName(), "-y")));
            result.time().actualCompletion();
            return result.returnCode();
        } catch (ProcessFailedException e) {
            log.warn("kill-controller failed with {}: {}", e.returnCode(), e.stderr());
            return e.returnCode();
        }
    }

    /**
     * @throws ProcessFailedException if the controller cannot be destroyed
     */
    public int destroyController(boolean allModels) {
        List<String> args = new ArrayList<>(List.of(requireControllerName(), "-y"));
        if (allModels) {
            args.add("--destroy-all-models");
        }
        CommandResult result = ignoringSoftDeadline(() -> controllerJuju("destroy-controller", args));
        result.time().actualCompletion();
        return result.returnCode();
    }

    /**
     * Destroys the controller, falling back to a kill, which is followed by rethrowing the
     * destroy failure.
     */
    public void tearDown() {
        try {
            destroyController(true);
        } catch (ProcessFailedException e) {
            log.warn("tearDown destroy-controller failed");
            int returnCode = killController();
            if (returnCode == 0) {
                log.info("tearDown kill-controller result={}", returnCode);
            } else {
                log.warn("tearDown kill-controller result={}", returnCode);
            }
            throw e;
        }
    }

    private String requireControllerName() {
        if (controllerName == null) {
            throw new IllegalStateException("No controller name configured for model " + modelName);
        }
        return controllerName;
    }

    // ==================== Deployment ====================

    public CommandComplete deploy(String charm) {
        return deploy(charm, null, 1, null);
    }

    /**
     * Deploys a charm.
     *
     * @param application application name, or null to derive it from the charm
     * @param placement   machine to place the units on, or null for new machines
     * @return condition completing the deploy once all agents have started
     */
    public CommandComplete deploy(String charm, String application, int numUnits, String placement) {
        List<String> args = new ArrayList<>();
        args.add(charm);
        if (application != null) {
            args.add(application);
        }
        if (numUnits != 1) {
            args.add("-n");
            args.add(String.valueOf(numUnits));
        }
        if (placement != null) {
            args.add("--to");
            args.add(placement);
        }
        CommandResult result = juju("deploy", args);
        return new CommandComplete(new WaitAgentsStarted(), result.time());
    }

    public CommandResult addUnit(String application, int count) {
        return juju("add-unit", List.of(application, "-n", String.valueOf(count)));
    }

    public CommandResult removeUnit(String unit) {
        return juju("remove-unit", List.of(unit));
    }

    public WaitApplicationNotPresent removeApplication(String application) {
        juju("remove-application", List.of(application));
        return new WaitApplicationNotPresent(application);
    }

    public CommandResult addRelation(String first, String second) {
        return juju("add-relation", List.of(first, second));
    }

    public CommandResult expose(String application) {
        return juju("expose", List.of(application));
    }

    public CommandResult setConfig(String application, Map<String, String> options) {
        List<String> args = new ArrayList<>();
        args.add(application);
        options.forEach((key, value) -> args.add(key + "=" + value));
        return juju("config", args);
    }

    // ==================== Machines ====================

    public String addMachine(String... args) {
        return getOutput("add-machine", List.of(args));
    }

    /**
     * Adds manual machines over ssh. The first machine is retried once after a pause.
     */
    public void addSshMachines(List<String> hosts) {
        for (int i = 0; i < hosts.size(); i++) {
            List<String> args = List.of("ssh:" + hosts.get(i));
            try {
                juju("add-machine", args);
            } catch (ProcessFailedException e) {
                if (i != 0) {
                    throw e;
                }
                log.warn("add-machine failed. Will retry.");
                backend.pause(SSH_RETRY_PAUSE);
                juju("add-machine", args);
            }
        }
    }

    /**
     * Removes a machine or container.
     *
     * @return condition for waiting until the machine is gone
     */
    public WaitMachineNotPresent removeMachine(String machineId, boolean force) {
        List<String> args = new ArrayList<>();
        if (force) {
            args.add("--force");
        }
        args.add(machineId);
        juju("remove-machine", args);
        return new WaitMachineNotPresent(machineId, REMOVE_MACHINE_TIMEOUT);
    }

    // ==================== Backups, Users and Actions ====================

    public String createBackup() {
        return getOutput("create-backup", List.of()).trim();
    }

    public CommandResult restoreBackup(String backupFile) {
        return juju("restore-backup", List.of("-b", "--file", backupFile));
    }

    /**
     * Adds a user and returns their registration token.
     */
    public String addUser(String username, String permission) {
        String output = controllerJuju("add-user", List.of(username, "--acl", permission, "-c", requireControllerName()))
            .output();
        Matcher matcher = REGISTER_TOKEN.matcher(output);
        if (!matcher.find()) {
            throw new IllegalStateException("Register command not found in output: " + output);
        }
        return matcher.group(1);
    }

    public CommandResult grant(String username, String permission) {
        return controllerJuju("grant", List.of(username, permission));
    }

    /**
     * Queues an action and returns its id.
     */
    public String runAction(String unit, String action) {
        String output = getOutput("run-action", List.of(unit, action));
        Matcher matcher = ACTION_ID.matcher(output);
        if (!matcher.find()) {
            throw new IllegalStateException("Action id not found in output: " + output);
        }
        return matcher.group(1);
    }

    public String showActionOutput(String actionId) {
        return getOutput("show-action-output", List.of(actionId));
    }

    // ==================== Queries ====================

    public JsonNode modelConfig() {
        return parseYaml(getOutput("model-config", List.of("--format", "yaml")));
    }

    public List<String> listModelNames() {
        JsonNode models = parseYaml(controllerJuju("list-models", List.of("--format", "yaml")).output()).path("models");
        List<String> names = new ArrayList<>();
        models.forEach(model -> names.add(model.path("name").asText()));
        return names;
    }

    public JsonNode showController() {
        return parseYaml(controllerJuju("show-controller", List.of(requireControllerName(), "--format", "yaml"))
            .output());
    }

    private static JsonNode parseYaml(String text) {
        try {
            return YAML_MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unparseable command output: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "ModelClient[controller=" + controllerName + ", model=" + modelName + "]";
    }

    /**
     * Builder for {@link ModelClient}.
     */
    public static class Builder {
        private final Backend backend;
        private String controllerName;
        private String modelName = "default";
        private String controllerModelName = "controller";
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private PollSettings pollSettings = PollSettings.defaults();
        private Duration agentGracePeriod = ErrorClassifier.DEFAULT_AGENT_GRACE_PERIOD;
        private Appendable out = System.out;
        private Instant softDeadline;
        private Duration haSettleTime = HarnessConfig.DeadlineConfig.DEFAULT_HA_SETTLE_TIME;

        private Builder(Backend backend) {
            this.backend = backend;
        }

        public Builder controllerName(String controllerName) {
            this.controllerName = controllerName;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder controllerModelName(String controllerModelName) {
            this.controllerModelName = controllerModelName;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder pollSettings(PollSettings pollSettings) {
            this.pollSettings = pollSettings;
            return this;
        }

        public Builder agentGracePeriod(Duration agentGracePeriod) {
            this.agentGracePeriod = agentGracePeriod;
            return this;
        }

        public Builder out(Appendable out) {
            this.out = out;
            return this;
        }

        public Builder softDeadline(Instant softDeadline) {
            this.softDeadline = softDeadline;
            return this;
        }

        public Builder haSettleTime(Duration haSettleTime) {
            this.haSettleTime = haSettleTime;
            return this;
        }

        Builder copy() {
            Builder copy = new Builder(backend);
            copy.controllerName = controllerName;
            copy.modelName = modelName;
            copy.controllerModelName = controllerModelName;
            copy.clock = clock;
            copy.sleeper = sleeper;
            copy.pollSettings = pollSettings;
            copy.agentGracePeriod = agentGracePeriod;
            copy.out = out;
            copy.softDeadline = softDeadline;
            copy.haSettleTime = haSettleTime;
            return copy;
        }

        public ModelClient build() {
            return new ModelClient(this);
        }
    }
}
