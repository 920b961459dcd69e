package com.statuswatch.core.fake;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.statuswatch.core.fake.ArgumentMode.LENIENT;
import static com.statuswatch.core.fake.ArgumentMode.RAW;
import static com.statuswatch.core.fake.ArgumentMode.STRICT;
import static com.statuswatch.core.fake.CommandScope.CONTROLLER;
import static com.statuswatch.core.fake.CommandScope.MODEL;

/**
 * Every command the simulator understands, with its argument syntax.
 *
 * <p>Value options take one argument; flags take none. Aliases are separated by {@code |},
 * e.g. {@code -n|--num-units}. Commands marked as no-ops are accepted and do nothing.
 *
 * @see CommandDispatcher
 */
public enum SimulatorCommand {

    // ==================== Controller Lifecycle ====================

    BOOTSTRAP("bootstrap", CONTROLLER, STRICT,
        options("--default-model", "--config", "--bootstrap-series", "--constraints", "--agent-version"),
        flags("--upload-tools")),
    DESTROY_CONTROLLER("destroy-controller", CONTROLLER, STRICT, options(), flags("-y", "--destroy-all-models")),
    KILL_CONTROLLER("kill-controller", CONTROLLER, STRICT, options(), flags("-y")),
    ENABLE_HA("enable-ha", CONTROLLER, STRICT, options("-n|--number", "-c|--controller"), flags()),

    // ==================== Models and Users ====================

    ADD_MODEL("add-model", CONTROLLER, STRICT, options("-c|--controller", "--config", "--credential"), flags()),
    DESTROY_MODEL("destroy-model", CONTROLLER, STRICT, options(), flags("-y")),
    ADD_USER("add-user", CONTROLLER, STRICT, options("-c|--controller", "--acl"), flags()),
    REMOVE_USER("remove-user", CONTROLLER, STRICT, options("-c|--controller"), flags("-y")),
    GRANT("grant", CONTROLLER, STRICT, options("-c|--controller"), flags()),
    REVOKE("revoke", CONTROLLER, STRICT, options("-c|--controller"), flags()),

    // ==================== Deployment ====================

    DEPLOY("deploy", MODEL, STRICT,
        options("--to", "--series", "-n|--num-units", "--constraints", "--config"), flags()),
    ADD_UNIT("add-unit", MODEL, STRICT, options("-n|--num-units", "--to"), flags()),
    REMOVE_UNIT("remove-unit", MODEL, STRICT, options(), flags()),
    REMOVE_APPLICATION("remove-application", MODEL, STRICT, options(), flags()),
    ADD_RELATION("add-relation", MODEL, STRICT, options(), flags()),
    EXPOSE("expose", MODEL, STRICT, options(), flags()),
    UNEXPOSE("unexpose", MODEL, STRICT, options(), flags()),
    CONFIG("config", MODEL, STRICT, options(), flags()),
    ADD_MACHINE("add-machine", MODEL, STRICT, options("-n", "--series", "--constraints"), flags()),
    REMOVE_MACHINE("remove-machine", MODEL, STRICT, options(), flags("--force")),
    RUN_ACTION("run-action", MODEL, LENIENT, options(), flags()),
    SHOW_ACTION_OUTPUT("show-action-output", MODEL, LENIENT, options(), flags()),
    SSH("ssh", MODEL, RAW, options(), flags()),

    // ==================== Backups and Keys ====================

    CREATE_BACKUP("create-backup", MODEL, LENIENT, options(), flags()),
    RESTORE_BACKUP("restore-backup", MODEL, LENIENT, options(), flags()),
    SSH_KEYS("ssh-keys", MODEL, STRICT, options(), flags("--full")),
    ADD_SSH_KEY("add-ssh-key", MODEL, RAW, options(), flags()),
    REMOVE_SSH_KEY("remove-ssh-key", MODEL, RAW, options(), flags()),
    IMPORT_SSH_KEY("import-ssh-key", MODEL, RAW, options(), flags()),

    // ==================== Queries ====================

    SHOW_STATUS("show-status", MODEL, STRICT, options("--format"), flags()),
    MODEL_CONFIG("model-config", MODEL, STRICT, options("--format"), flags()),
    LIST_MODELS("list-models", CONTROLLER, STRICT, options("-c|--controller", "--format"), flags()),
    SHOW_CONTROLLER("show-controller", CONTROLLER, STRICT, options("--format"), flags()),
    LIST_USERS("list-users", CONTROLLER, STRICT, options("-c|--controller", "--format"), flags()),
    SHOW_USER("show-user", CONTROLLER, STRICT, options("-c|--controller", "--format"), flags()),
    SHOW_MODEL("show-model", CONTROLLER, STRICT, options("--format"), flags()),

    // ==================== Accepted No-ops ====================

    SET_MODEL_CONSTRAINTS("set-model-constraints", MODEL, LENIENT, options(), flags()),
    UPGRADE_CHARM("upgrade-charm", MODEL, LENIENT, options(), flags()),
    SWITCH("switch", CONTROLLER, LENIENT, options(), flags()),
    SYNC_TOOLS("sync-tools", CONTROLLER, LENIENT, options(), flags());

    private static final Map<String, SimulatorCommand> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(SimulatorCommand::commandName, Function.identity()));

    private final String commandName;
    private final CommandScope scope;
    private final ArgumentMode argumentMode;
    private final List<String> valueOptions;
    private final List<String> flagOptions;

    SimulatorCommand(String commandName, CommandScope scope, ArgumentMode argumentMode,
                     List<String> valueOptions, List<String> flagOptions) {
        this.commandName = commandName;
        this.scope = scope;
        this.argumentMode = argumentMode;
        this.valueOptions = valueOptions;
        this.flagOptions = flagOptions;
    }

    private static List<String> options(String... names) {
        return List.of(names);
    }

    private static List<String> flags(String... names) {
        return List.of(names);
    }

    /**
     * Looks up a command by the name used on the command line.
     *
     * @param name command name, e.g. {@code add-machine}
     * @return the command, or empty if the simulator does not know it
     */
    public static Optional<SimulatorCommand> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String commandName() {
        return commandName;
    }

    public CommandScope scope() {
        return scope;
    }

    public ArgumentMode argumentMode() {
        return argumentMode;
    }

    public List<String> valueOptions() {
        return valueOptions;
    }

    public List<String> flagOptions() {
        return flagOptions;
    }
}
