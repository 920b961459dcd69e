package com.statuswatch.core.fake;

import com.statuswatch.core.process.ProcessFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory state of a simulated controller: its lifecycle, its models and its users.
 *
 * <p>Models live in an arena keyed by name; each {@link EnvironmentState} points back to
 * this controller. Several backends may share one controller state, in which case the last
 * writer wins.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ControllerState controller = new ControllerState();
 * EnvironmentState model = controller.bootstrap("name", "default", Map.of());
 * model.deploy("dummy-source", 1, null);
 * }</pre>
 */
public class ControllerState {

    private static final Logger log = LoggerFactory.getLogger(ControllerState.class);

    public static final String CONTROLLER_MODEL = "controller";

    private static final Set<String> MODEL_PERMISSIONS = Set.of("read", "write", "admin");

    private String name = "name";
    private ControllerLifecycle lifecycle = ControllerLifecycle.NOT_BOOTSTRAPPED;
    private final Map<String, EnvironmentState> models = new LinkedHashMap<>();
    private final Map<String, UserAccount> users = new LinkedHashMap<>();
    private final List<String> shares = new ArrayList<>();
    private EnvironmentState controllerModel;
    private String activeModel;

    public ControllerState() {
        users.put("admin", new UserAccount("write"));
        shares.add("admin");
    }

    public String name() {
        return name;
    }

    public ControllerLifecycle lifecycle() {
        return lifecycle;
    }

    void setLifecycle(ControllerLifecycle lifecycle) {
        log.debug("Controller {} is now {}", name, lifecycle.label());
        this.lifecycle = lifecycle;
    }

    public Optional<String> activeModel() {
        return Optional.ofNullable(activeModel);
    }

    // ==================== Models ====================

    /**
     * Creates and registers a model; the controller becomes {@code CREATED}.
     *
     * @param modelName model name
     * @return the new model
     */
    public EnvironmentState addModel(String modelName) {
        EnvironmentState model = new EnvironmentState(this, modelName);
        models.put(modelName, model);
        setLifecycle(ControllerLifecycle.CREATED);
        return model;
    }

    /**
     * Returns a registered model.
     *
     * @throws ProcessFailedException if no model has this name
     */
    public EnvironmentState model(String modelName) {
        EnvironmentState model = models.get(modelName);
        if (model == null) {
            throw new ProcessFailedException(1, "juju -m " + modelName, "model \"" + modelName + "\" not found");
        }
        return model;
    }

    public Optional<EnvironmentState> findModel(String modelName) {
        return Optional.ofNullable(models.get(modelName));
    }

    public List<String> modelNames() {
        return List.copyOf(models.keySet());
    }

    void unregister(String modelName) {
        EnvironmentState removed = models.remove(modelName);
        if (removed != null && removed == controllerModel) {
            controllerModel = null;
        }
        if (modelName.equals(activeModel)) {
            activeModel = null;
        }
    }

    /**
     * Returns the controller model.
     *
     * @throws IllegalStateException if the controller was never bootstrapped
     */
    public EnvironmentState controllerModel() {
        if (controllerModel == null) {
            throw new IllegalStateException("Controller " + name + " has no controller model");
        }
        return controllerModel;
    }

    /**
     * @throws ControllerOperationException if {@code modelName} is not the controller model
     */
    public void requireController(String operation, String modelName) {
        if (controllerModel == null || !controllerModel.name().equals(modelName)) {
            throw new ControllerOperationException(operation);
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Bootstraps the controller: creates the default model with {@code config}, and the
     * controller model with one state server.
     *
     * @return the default model
     */
    public EnvironmentState bootstrap(String controllerName, String defaultModel, Map<String, Object> config) {
        this.name = Objects.requireNonNull(controllerName, "controllerName must not be null");
        EnvironmentState model = addModel(defaultModel);
        controllerModel = addModel(CONTROLLER_MODEL);
        controllerModel.addStateServer();
        model.setModelConfig(config);
        activeModel = defaultModel;
        setLifecycle(ControllerLifecycle.BOOTSTRAPPED);
        log.info("Bootstrapped controller {} with model {}", controllerName, defaultModel);
        return model;
    }

    /**
     * Registers this controller under a new name for a user with the given email.
     */
    public void register(String controllerName, String email) {
        this.name = Objects.requireNonNull(controllerName, "controllerName must not be null");
        addUser("jrandom@external", "write");
        users.get("jrandom@external").email = email;
        setLifecycle(ControllerLifecycle.REGISTERED);
    }

    /**
     * Destroys every model, then the controller.
     *
     * @param kill whether this is a hard kill
     */
    public void destroy(boolean kill) {
        for (EnvironmentState model : new ArrayList<>(models.values())) {
            model.destroyModel();
        }
        models.clear();
        controllerModel = null;
        activeModel = null;
        setLifecycle(kill ? ControllerLifecycle.CONTROLLER_KILLED : ControllerLifecycle.CONTROLLER_DESTROYED);
    }

    // ==================== Users ====================

    public void addUser(String username, String permission) {
        users.put(username, new UserAccount(permission));
        if (!shares.contains(username)) {
            shares.add(username);
        }
    }

    /**
     * Grants a permission; model-level permissions map to controller {@code login} access.
     *
     * @throws ProcessFailedException if the user does not exist
     */
    public void grant(String username, String permission) {
        String access = MODEL_PERMISSIONS.contains(permission) ? "login" : permission;
        user(username, "grant").access = access;
    }

    /**
     * Revokes a permission: {@code read} withdraws the model share, anything else drops
     * the user back to {@code read}.
     *
     * @throws ProcessFailedException if the user does not exist
     */
    public void revoke(String username, String permission) {
        UserAccount account = user(username, "revoke");
        if (!permission.equals(account.permission)) {
            return;
        }
        if ("read".equals(permission)) {
            shares.remove(username);
            account.permission = "";
        } else {
            account.permission = "read";
        }
    }

    public void removeUser(String username) {
        user(username, "remove-user");
        users.remove(username);
        shares.remove(username);
    }

    public List<String> userNames() {
        return List.copyOf(users.keySet());
    }

    public List<String> shares() {
        return Collections.unmodifiableList(shares);
    }

    public String permission(String username) {
        return user(username, "show-user").permission;
    }

    public String access(String username) {
        return user(username, "show-user").access;
    }

    public Optional<String> email(String username) {
        return Optional.ofNullable(user(username, "show-user").email);
    }

    private UserAccount user(String username, String command) {
        UserAccount account = users.get(username);
        if (account == null) {
            throw new ProcessFailedException(1, "juju " + command + " " + username,
                "user \"" + username + "\" not found");
        }
        return account;
    }

    private static final class UserAccount {
        private String permission;
        private String access = "";
        private String email;

        private UserAccount(String permission) {
            this.permission = permission;
        }
    }

    @Override
    public String toString() {
        return "ControllerState[name=" + name + ", lifecycle=" + lifecycle.label() + ", models=" + models.keySet() + "]";
    }
}
