package com.statuswatch.core.fake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.statuswatch.core.process.CommandResult;
import com.statuswatch.core.process.CommandTime;
import com.statuswatch.core.process.ProcessFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs command-line style commands against a simulated controller.
 *
 * <p>Each {@link SimulatorCommand} maps to one handler. Unknown command names are rejected
 * with {@link UnsupportedCommandException}; simulated failures throw
 * {@link ProcessFailedException} as the real tool would exit non-zero.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CommandDispatcher dispatcher = new CommandDispatcher(new ControllerState());
 * dispatcher.dispatch("bootstrap", List.of("lxd", "ctl", "--default-model", "default"), null);
 * dispatcher.dispatch("deploy", List.of("dummy-source"), "default");
 * String status = dispatcher.dispatch("show-status", List.of(), "default").output();
 * }</pre>
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    static final String CONTROLLER_UUID = "b74b0e9a-81cb-4161-8396-bd5149e2a3cc";

    private static final Set<SimulatorCommand> QUERIES = EnumSet.of(
        SimulatorCommand.SHOW_STATUS, SimulatorCommand.MODEL_CONFIG, SimulatorCommand.LIST_MODELS,
        SimulatorCommand.SHOW_CONTROLLER, SimulatorCommand.LIST_USERS, SimulatorCommand.SHOW_USER,
        SimulatorCommand.SHOW_MODEL, SimulatorCommand.SSH_KEYS, SimulatorCommand.SHOW_ACTION_OUTPUT);

    @FunctionalInterface
    private interface CommandHandler {
        String handle(ParsedArgs args, EnvironmentState model);
    }

    private final ControllerState controller;
    private final Clock clock;
    private final Map<SimulatorCommand, CommandHandler> handlers = new EnumMap<>(SimulatorCommand.class);
    private final Map<String, Map<String, String>> actionResults = new HashMap<>();
    private final Map<String, String> actionQueue = new LinkedHashMap<>();

    public CommandDispatcher(ControllerState controller) {
        this(controller, Clock.systemUTC());
    }

    public CommandDispatcher(ControllerState controller, Clock clock) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        registerHandlers();
    }

    public ControllerState controller() {
        return controller;
    }

    /**
     * Sets the result a later {@code run-action} of {@code action} on {@code unit} queues.
     */
    public void setActionResult(String unit, String action, String result) {
        actionResults.computeIfAbsent(unit, key -> new HashMap<>()).put(action, result);
    }

    /**
     * Runs one command.
     *
     * @param command command name, e.g. {@code add-machine}
     * @param args    command arguments
     * @param model   target model, optionally {@code controller:model}; ignored by controller commands
     * @return result with return code 0, the command output and its timing
     * @throws UnsupportedCommandException if the command is unknown
     * @throws ProcessFailedException      if the simulated command fails
     */
    public CommandResult dispatch(String command, List<String> args, String model) {
        SimulatorCommand simulated = SimulatorCommand.fromName(command)
            .orElseThrow(() -> new UnsupportedCommandException(command));
        List<String> fullArgs = fullArgs(simulated, args, model);
        if (QUERIES.contains(simulated)) {
            log.debug("{}", String.join(" ", fullArgs));
        } else {
            log.info("{}", String.join(" ", fullArgs));
        }

        ParsedArgs parsed = ParsedArgs.parse(simulated, args);
        EnvironmentState state = null;
        if (simulated.scope() == CommandScope.MODEL) {
            if (model == null) {
                throw new ProcessFailedException(1, fullArgs, "", "error: no model specified");
            }
            state = controller.model(stripController(model));
        }
        CommandTime time = new CommandTime(command, fullArgs, Map.of(), clock, null);
        String output = handlers.get(simulated).handle(parsed, state);
        return new CommandResult(0, output, time);
    }

    private static List<String> fullArgs(SimulatorCommand command, List<String> args, String model) {
        List<String> full = new ArrayList<>();
        full.add("juju");
        full.add(command.commandName());
        if (model != null && command.scope() == CommandScope.MODEL) {
            full.add("-m");
            full.add(model);
        }
        full.addAll(args);
        return full;
    }

    private static String stripController(String model) {
        int colon = model.indexOf(':');
        return colon >= 0 ? model.substring(colon + 1) : model;
    }

    private void registerHandlers() {
        handlers.put(SimulatorCommand.BOOTSTRAP, (args, model) -> bootstrap(args));
        handlers.put(SimulatorCommand.DESTROY_CONTROLLER, (args, model) -> destroyController(args));
        handlers.put(SimulatorCommand.KILL_CONTROLLER, (args, model) -> killController());
        handlers.put(SimulatorCommand.ENABLE_HA, (args, model) -> enableHa(args));
        handlers.put(SimulatorCommand.ADD_MODEL, (args, model) -> addModel(args));
        handlers.put(SimulatorCommand.DESTROY_MODEL, (args, model) -> destroyModel(args));
        handlers.put(SimulatorCommand.ADD_USER, (args, model) -> addUser(args));
        handlers.put(SimulatorCommand.REMOVE_USER, (args, model) -> {
            controller.removeUser(args.positional(0));
            return "";
        });
        handlers.put(SimulatorCommand.GRANT, (args, model) -> {
            controller.grant(args.positional(0), args.positional(1));
            return "";
        });
        handlers.put(SimulatorCommand.REVOKE, (args, model) -> {
            controller.revoke(args.positional(0), args.positional(1));
            return "";
        });

        handlers.put(SimulatorCommand.DEPLOY, this::deploy);
        handlers.put(SimulatorCommand.ADD_UNIT, (args, model) -> String.join("\n",
            model.addUnit(args.positional(0), args.intOption("-n", 1), args.option("--to").orElse(null))));
        handlers.put(SimulatorCommand.REMOVE_UNIT, (args, model) -> {
            args.positional(0);
            args.positionals().forEach(model::removeUnit);
            return "";
        });
        handlers.put(SimulatorCommand.REMOVE_APPLICATION, (args, model) -> {
            model.removeApplication(args.positional(0));
            return "";
        });
        handlers.put(SimulatorCommand.ADD_RELATION, (args, model) -> {
            model.addRelation(args.positional(1), args.positional(0));
            return "";
        });
        handlers.put(SimulatorCommand.EXPOSE, (args, model) -> {
            model.expose(args.positional(0));
            return "";
        });
        handlers.put(SimulatorCommand.UNEXPOSE, (args, model) -> {
            model.unexpose(args.positional(0));
            return "";
        });
        handlers.put(SimulatorCommand.CONFIG, this::config);
        handlers.put(SimulatorCommand.ADD_MACHINE, this::addMachine);
        handlers.put(SimulatorCommand.REMOVE_MACHINE, this::removeMachine);
        handlers.put(SimulatorCommand.RUN_ACTION, this::runAction);
        handlers.put(SimulatorCommand.SHOW_ACTION_OUTPUT,
            (args, model) -> actionQueue.getOrDefault(args.positional(0), ""));
        handlers.put(SimulatorCommand.SSH, this::ssh);

        handlers.put(SimulatorCommand.CREATE_BACKUP, (args, model) -> {
            controller.requireController("backup", model.name());
            return "juju-backup-0.tar.gz";
        });
        handlers.put(SimulatorCommand.RESTORE_BACKUP, (args, model) -> {
            model.restoreBackup();
            return "";
        });
        handlers.put(SimulatorCommand.SSH_KEYS, this::sshKeys);
        handlers.put(SimulatorCommand.ADD_SSH_KEY, (args, model) -> model.addSshKeys(args.positionals()));
        handlers.put(SimulatorCommand.REMOVE_SSH_KEY, (args, model) -> model.removeSshKeys(args.positionals()));
        handlers.put(SimulatorCommand.IMPORT_SSH_KEY, (args, model) -> model.importSshKeys(args.positionals()));

        handlers.put(SimulatorCommand.SHOW_STATUS, (args, model) -> toJson(model.statusTree()));
        handlers.put(SimulatorCommand.MODEL_CONFIG, (args, model) -> toYaml(model.modelConfig()));
        handlers.put(SimulatorCommand.LIST_MODELS, (args, model) -> listModels());
        handlers.put(SimulatorCommand.SHOW_CONTROLLER, (args, model) -> showController(args));
        handlers.put(SimulatorCommand.LIST_USERS, (args, model) -> listUsers());
        handlers.put(SimulatorCommand.SHOW_USER, (args, model) -> showUser(args));
        handlers.put(SimulatorCommand.SHOW_MODEL, (args, model) -> showModel(args));

        CommandHandler noop = (args, model) -> "";
        handlers.put(SimulatorCommand.SET_MODEL_CONSTRAINTS, noop);
        handlers.put(SimulatorCommand.UPGRADE_CHARM, noop);
        handlers.put(SimulatorCommand.SWITCH, noop);
        handlers.put(SimulatorCommand.SYNC_TOOLS, noop);
    }

    // ==================== Controller Lifecycle ====================

    private String bootstrap(ParsedArgs args) {
        String cloudRegion = args.positional(0);
        String controllerName = args.positional(1);
        if (controller.lifecycle() == ControllerLifecycle.BOOTSTRAPPED) {
            throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                "ERROR controller \"" + controller.name() + "\" already exists");
        }
        Map<String, Object> config = args.option("--config")
            .map(file -> readConfig(args, file))
            .orElseGet(LinkedHashMap::new);
        String[] split = cloudRegion.split("/", 2);
        config.put("type", split[0]);
        if (split.length > 1) {
            config.put("region", split[1]);
        }
        String defaultModel = args.option("--default-model").orElse("default");
        config.put("name", defaultModel);
        args.option("--bootstrap-series").ifPresent(series -> config.put("default-series", series));
        controller.bootstrap(controllerName, defaultModel, config);
        return "";
    }

    private static Map<String, Object> readConfig(ParsedArgs args, String file) {
        try {
            Map<String, Object> config = YAML_MAPPER.readValue(Path.of(file).toFile(),
                new TypeReference<LinkedHashMap<String, Object>>() { });
            return config != null ? config : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                "ERROR cannot read config file " + file + ": " + e.getMessage());
        }
    }

    private String destroyController(ParsedArgs args) {
        if (!controller.lifecycle().isDestroyable()) {
            throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                "Not bootstrapped.");
        }
        controller.destroy(false);
        return "";
    }

    private String killController() {
        if (controller.lifecycle() == ControllerLifecycle.NOT_BOOTSTRAPPED) {
            log.debug("kill-controller on a controller that was never bootstrapped");
            return "";
        }
        controller.destroy(true);
        return "";
    }

    private String enableHa(ParsedArgs args) {
        args.option("-c").ifPresent(name -> {
            if (!name.equals(controller.name())) {
                throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                    "ERROR controller " + name + " not found");
            }
        });
        EnvironmentState controllerModel = controller.findModel(ControllerState.CONTROLLER_MODEL)
            .orElseThrow(() -> new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()),
                "", "Not bootstrapped."));
        controllerModel.enableHa(args.intOption("-n", 3));
        return "";
    }

    // ==================== Models and Users ====================

    private String addModel(ParsedArgs args) {
        EnvironmentState model = controller.addModel(args.positional(0));
        args.option("--config").ifPresent(file -> model.setModelConfig(readConfig(args, file)));
        return "";
    }

    private String destroyModel(ParsedArgs args) {
        String modelName = stripController(args.positional(0));
        EnvironmentState model = controller.findModel(modelName)
            .orElseThrow(() -> new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()),
                "", "No such model"));
        model.destroyModel();
        return "";
    }

    private String addUser(ParsedArgs args) {
        String username = args.positional(0);
        String permission = args.option("--acl").filter("write"::equals).orElse("read");
        controller.addUser(username, permission);
        return "User \"" + username + "\" added\n"
            + "Please send this command to " + username + "\n    juju register " + registerToken(username);
    }

    /**
     * Returns the registration token the simulator hands out for a user.
     *
     * @return base64 of the SHA-512 digest of the user name
     */
    static String registerToken(String username) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-512").digest(username.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 is not available", e);
        }
    }

    // ==================== Deployment ====================

    private String deploy(ParsedArgs args, EnvironmentState model) {
        String charm = args.positional(0);
        String application = args.optionalPositional(1).orElseGet(() -> applicationName(charm));
        model.deploy(application, args.intOption("-n", 1), args.option("--to").orElse(null));
        return "";
    }

    static String applicationName(String charm) {
        String[] byColon = charm.split(":");
        String[] bySlash = byColon[byColon.length - 1].split("/");
        return bySlash[bySlash.length - 1];
    }

    private String config(ParsedArgs args, EnvironmentState model) {
        args.positional(0);
        for (String setting : args.positionals().subList(1, args.positionals().size())) {
            String[] pair = setting.split("=", 2);
            if (pair.length == 2 && pair[0].equals("token")) {
                model.setToken(pair[1]);
            }
        }
        return "";
    }

    private String addMachine(ParsedArgs args, EnvironmentState model) {
        List<String> placements = args.positionals();
        if (placements.isEmpty() && args.raw().isEmpty()) {
            return "created machine " + model.addMachine();
        }
        List<String> sshHosts = placements.stream()
            .filter(placement -> placement.startsWith("ssh:"))
            .map(placement -> placement.substring("ssh:".length()))
            .toList();
        if (!sshHosts.isEmpty() && sshHosts.size() == args.raw().size()) {
            return created("machine", model.addSshMachines(sshHosts));
        }
        int count = args.intOption("-n", 1);
        if (!placements.isEmpty() && count != 1) {
            throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                "cannot use -n when specifying a placement directive.");
        }
        if (placements.size() > 1) {
            throw args.usageError("expected at most one placement directive, got " + placements);
        }
        List<String> created = new ArrayList<>();
        if (placements.size() == 1) {
            String[] split = placements.get(0).split(":", 2);
            String host = split.length > 1 ? split[1] : null;
            if (host != null && !model.machines().contains(host)) {
                throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                    "machine " + host + " not found");
            }
            created.add(model.addContainer(split[0], host));
            return created("container", created);
        }
        for (int i = 0; i < count; i++) {
            created.add(model.addMachine());
        }
        return created("machine", created);
    }

    private static String created(String kind, List<String> ids) {
        return String.join("\n", ids.stream().map(id -> "created " + kind + " " + id).toList());
    }

    private String removeMachine(ParsedArgs args, EnvironmentState model) {
        args.positional(0);
        for (String machineId : args.positionals()) {
            if (machineId.contains("/")) {
                model.removeContainer(machineId);
            } else {
                model.removeMachine(machineId, args.flag("--force"));
            }
        }
        return "";
    }

    private String runAction(ParsedArgs args, EnvironmentState model) {
        String unit = args.positional(0);
        String action = args.positional(1);
        String result = actionResults.getOrDefault(unit, Map.of()).get(action);
        if (result == null) {
            throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                "No such action \"" + action + "\" specified for unit " + unit + ".");
        }
        String actionId = UUID.randomUUID().toString();
        actionQueue.put(actionId, result);
        return "Action queued with id: " + actionId;
    }

    private String ssh(ParsedArgs args, EnvironmentState model) {
        List<String> raw = args.raw();
        if (raw.equals(List.of("dummy-sink/0", "cat", "/var/run/dummy-sink/token"))) {
            return model.token() == null ? "" : model.token();
        }
        if (raw.equals(List.of("0", "lsb_release", "-c"))) {
            return "Codename:\t" + model.modelConfig().getOrDefault("default-series", "") + "\n";
        }
        throw new ProcessFailedException(255, ParsedArgs.fullCommand(args.command(), raw), "",
            "ssh: the simulator cannot run " + String.join(" ", raw));
    }

    private String sshKeys(ParsedArgs args, EnvironmentState model) {
        List<String> lines = new ArrayList<>();
        lines.add("Keys used in model: " + model.name());
        for (String key : model.sshKeys()) {
            if (args.flag("--full")) {
                lines.add(key);
            } else {
                String[] parts = key.split(" ", 3);
                lines.add(":fake:fingerprint: (" + parts[parts.length - 1] + ")");
            }
        }
        return String.join("\n", lines);
    }

    // ==================== Queries ====================

    private String listModels() {
        List<Map<String, String>> models = controller.modelNames().stream()
            .map(name -> Map.of("name", name))
            .toList();
        return toYaml(Map.of("models", models));
    }

    private String showController(ParsedArgs args) {
        String controllerName = args.optionalPositional(0).orElse(controller.name());
        EnvironmentState controllerModel = controller.findModel(ControllerState.CONTROLLER_MODEL)
            .orElseThrow(() -> new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()),
                "", "ERROR controller " + controllerName + " not found"));
        if (controllerModel.stateServers().isEmpty()) {
            throw new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()), "",
                "ERROR controller " + controllerName + " has no API endpoints");
        }
        String server = controllerModel.stateServers().get(0);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("api-endpoints", List.of(controllerModel.hostName(server) + ":23"));
        details.put("uuid", CONTROLLER_UUID);
        return toYaml(Map.of(controllerName, Map.of("details", details)));
    }

    private String listUsers() {
        List<Map<String, String>> users = new ArrayList<>();
        for (String username : controller.userNames()) {
            Map<String, String> user = new LinkedHashMap<>();
            if (username.equals("admin")) {
                user.put("access", "superuser");
                user.put("user-name", username);
                user.put("display-name", username);
            } else {
                user.put("access", controller.access(username));
                user.put("user-name", username);
            }
            users.add(user);
        }
        return toJson(users);
    }

    private String showUser(ParsedArgs args) {
        String username = args.optionalPositional(0)
            .orElseThrow(() -> new ProcessFailedException(1, ParsedArgs.fullCommand(args.command(), args.raw()),
                "", "No user specified"));
        Map<String, String> user = new LinkedHashMap<>();
        if (username.equals("admin")) {
            user.put("access", "superuser");
            user.put("user-name", username);
            user.put("display-name", username);
        } else {
            user.put("user-name", username);
            user.put("display-name", "");
        }
        return toJson(user);
    }

    private String showModel(ParsedArgs args) {
        String modelName = args.optionalPositional(0).map(CommandDispatcher::stripController)
            .or(controller::activeModel)
            .orElse("name");
        Map<String, Object> shares = new LinkedHashMap<>();
        for (String username : controller.shares()) {
            if (username.equals("admin")) {
                shares.put(username, Map.of("display-name", username, "access", "admin"));
            } else {
                shares.put(username, Map.of("access", controller.permission(username)));
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", modelName);
        data.put("owner", "admin");
        data.put("life", "alive");
        data.put("status", Map.of("current", "available", "since", "15 minutes ago"));
        data.put("users", shares);
        return toJson(Map.of(modelName, data));
    }

    private static String toJson(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize simulator output", e);
        }
    }

    private static String toYaml(Object value) {
        try {
            return YAML_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize simulator output", e);
        }
    }
}
