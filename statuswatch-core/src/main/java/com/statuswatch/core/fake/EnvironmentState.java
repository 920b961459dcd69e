package com.statuswatch.core.fake;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.StatusDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory state of one simulated model.
 *
 * <p>Machines get ids from a per-model counter; containers are named
 * {@code host/type/index}. Units map to the machine they run on; the machine reference is
 * cleared when that machine is force-removed. The controller is referenced, not owned.
 *
 * <p>Not thread-safe.
 */
public class EnvironmentState {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentState.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ControllerState controller;
    private final String name;
    private int nextMachineId;
    private final Set<String> machines = new LinkedHashSet<>();
    private final Map<String, Set<String>> containers = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> applications = new LinkedHashMap<>();
    private final Map<String, Integer> nextUnitIndex = new HashMap<>();
    private final Map<String, Map<String, List<String>>> relations = new LinkedHashMap<>();
    private final Set<String> exposed = new HashSet<>();
    private final List<String> sshKeys = new ArrayList<>();
    private final List<String> stateServers = new ArrayList<>();
    private final Map<String, String> machineHostNames = new HashMap<>();
    private Map<String, Object> modelConfig = new LinkedHashMap<>();
    private String token;

    EnvironmentState(ControllerState controller, String name) {
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    public ControllerState controller() {
        return controller;
    }

    public ControllerLifecycle lifecycle() {
        return controller.lifecycle();
    }

    // ==================== Machines ====================

    /**
     * Adds a machine with the next id and the host name {@code <id>.example.com}.
     *
     * @return new machine id
     */
    public String addMachine() {
        return addMachine(null);
    }

    public String addMachine(String hostName) {
        String machineId = String.valueOf(nextMachineId++);
        machines.add(machineId);
        machineHostNames.put(machineId, hostName != null ? hostName : machineId + ".example.com");
        return machineId;
    }

    /**
     * Adds one machine per ssh host. Host names are not kept.
     */
    public List<String> addSshMachines(List<String> hosts) {
        List<String> added = new ArrayList<>();
        for (String host : hosts) {
            log.debug("Adding manual machine for {}", host);
            added.add(addMachine());
        }
        return added;
    }

    /**
     * Adds a container, creating a host machine first when {@code host} is null.
     *
     * @param containerType container type, e.g. {@code lxd}
     * @param host          host machine id, or null for a new machine
     * @return container id {@code host/type/index}
     */
    public String addContainer(String containerType, String host) {
        String hostId = host != null ? host : addMachine();
        Set<String> hostContainers = containers.computeIfAbsent(hostId, key -> new LinkedHashSet<>());
        long sameType = hostContainers.stream().filter(id -> id.contains(containerType)).count();
        String containerId = hostId + "/" + containerType + "/" + sameType;
        hostContainers.add(containerId);
        machineHostNames.put(containerId, containerId + ".example.com");
        return containerId;
    }

    public void removeContainer(String containerId) {
        for (Set<String> hostContainers : containers.values()) {
            hostContainers.remove(containerId);
        }
        machineHostNames.remove(containerId);
    }

    /**
     * Removes a machine and its containers.
     *
     * @param machineId machine id
     * @param force     remove even if units are assigned; their machine reference is cleared
     * @throws ProcessFailedException if a unit is assigned and {@code force} is false, or
     *                                the machine does not exist
     */
    public void removeMachine(String machineId, boolean force) {
        if (!machines.contains(machineId)) {
            throw new ProcessFailedException(1, "juju remove-machine " + machineId,
                "machine " + machineId + " not found");
        }
        for (Map<String, String> units : applications.values()) {
            for (Map.Entry<String, String> unit : units.entrySet()) {
                if (!machineId.equals(unit.getValue())) {
                    continue;
                }
                if (!force) {
                    log.error("no machines were destroyed: machine {} has unit \"{}\" assigned",
                        machineId, unit.getKey());
                    throw new ProcessFailedException(1, "juju remove-machine " + machineId, "machine assigned.");
                }
                unit.setValue(null);
            }
        }
        machines.remove(machineId);
        stateServers.remove(machineId);
        Set<String> removedContainers = containers.remove(machineId);
        if (removedContainers != null) {
            removedContainers.forEach(machineHostNames::remove);
        }
        machineHostNames.remove(machineId);
    }

    public SortedSet<String> machines() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(machines));
    }

    public SortedSet<String> containers(String host) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(containers.getOrDefault(host, Set.of())));
    }

    public String hostName(String machineId) {
        return machineHostNames.get(machineId);
    }

    // ==================== Controller Operations ====================

    public List<String> stateServers() {
        return Collections.unmodifiableList(stateServers);
    }

    void addStateServer() {
        stateServers.add(addMachine());
    }

    /**
     * Adds state-server machines until at least {@code count} exist.
     *
     * @throws ControllerOperationException if this is not the controller model
     */
    public void enableHa(int count) {
        controller.requireController("enable-ha", name);
        while (stateServers.size() < count) {
            addStateServer();
        }
    }

    /**
     * Restores a controller from backup, which adds one state server.
     *
     * @throws ControllerOperationException if this is not the controller model
     * @throws ProcessFailedException       if a state server still exists
     */
    public void restoreBackup() {
        controller.requireController("restore", name);
        if (!stateServers.isEmpty()) {
            throw new ProcessFailedException(1, List.of("juju"), "", "Operation not permitted");
        }
        addStateServer();
    }

    // ==================== Applications ====================

    /**
     * Deploys {@code count} units of an application.
     *
     * @param placement existing machine id to place every unit on, or null for new machines
     */
    public void deploy(String application, int count, String placement) {
        applications.computeIfAbsent(application, key -> new LinkedHashMap<>());
        addUnit(application, count, placement);
    }

    /**
     * Adds {@code count} units; each gets a new machine unless {@code placement} names one.
     *
     * @throws ProcessFailedException if the application or placement machine does not exist
     */
    public List<String> addUnit(String application, int count, String placement) {
        Map<String, String> units = applications.get(application);
        if (units == null) {
            throw new ProcessFailedException(1, "juju add-unit " + application,
                "application \"" + application + "\" not found");
        }
        if (placement != null && !machines.contains(placement)) {
            throw new ProcessFailedException(1, "juju add-unit " + application,
                "machine " + placement + " not found");
        }
        List<String> added = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int index = nextUnitIndex.merge(application, 1, Integer::sum) - 1;
            String unitId = application + "/" + index;
            units.put(unitId, placement != null ? placement : addMachine());
            added.add(unitId);
        }
        return added;
    }

    /**
     * Removes a unit, and its machine when no other unit remains there.
     *
     * @throws ProcessFailedException if the unit does not exist
     */
    public void removeUnit(String unitId) {
        for (Map<String, String> units : applications.values()) {
            if (units.containsKey(unitId)) {
                String machineId = units.remove(unitId);
                releaseMachine(machineId);
                return;
            }
        }
        throw new ProcessFailedException(1, "juju remove-unit " + unitId, "unit \"" + unitId + "\" not found");
    }

    /**
     * Removes an application, its units, and every machine left without units.
     */
    public void removeApplication(String application) {
        Map<String, String> units = applications.remove(application);
        if (units == null) {
            throw new ProcessFailedException(1, "juju remove-application " + application,
                "application \"" + application + "\" not found");
        }
        relations.remove(application);
        exposed.remove(application);
        for (String machineId : new LinkedHashSet<>(units.values())) {
            releaseMachine(machineId);
        }
    }

    private void releaseMachine(String machineId) {
        if (machineId == null || stateServers.contains(machineId) || !machines.contains(machineId)) {
            return;
        }
        boolean inUse = applications.values().stream().anyMatch(units -> units.containsValue(machineId));
        if (!inUse) {
            removeMachine(machineId, false);
        }
    }

    /**
     * Returns units by application, each mapped to its machine id (null once force-removed).
     */
    public SortedMap<String, SortedMap<String, String>> applications() {
        SortedMap<String, SortedMap<String, String>> copy = new TreeMap<>();
        applications.forEach((application, units) -> copy.put(application, new TreeMap<>(units)));
        return copy;
    }

    public void addRelation(String application, String source) {
        relations.put(application, Map.of("source", List.of(source)));
    }

    public void expose(String application) {
        exposed.add(application);
    }

    public void unexpose(String application) {
        if (!exposed.remove(application)) {
            throw new ProcessFailedException(1, "juju unexpose " + application,
                "application \"" + application + "\" is not exposed");
        }
    }

    public boolean isExposed(String application) {
        return exposed.contains(application);
    }

    public String token() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Map<String, Object> modelConfig() {
        return Collections.unmodifiableMap(modelConfig);
    }

    void setModelConfig(Map<String, Object> config) {
        this.modelConfig = new LinkedHashMap<>(config);
    }

    // ==================== SSH Keys ====================

    /**
     * Adds keys; invalid and duplicate keys are reported, not thrown.
     *
     * @return one error line per rejected key, empty if all were added
     */
    public String addSshKeys(List<String> keys) {
        List<String> errors = new ArrayList<>();
        for (String key : keys) {
            if (!key.startsWith("ssh-rsa ")) {
                errors.add(String.format("cannot add key \"%1$s\": invalid ssh key: %1$s", key));
            } else if (sshKeys.contains(key)) {
                errors.add(String.format("cannot add key \"%1$s\": duplicate ssh key: %1$s", key));
            } else {
                sshKeys.add(key);
            }
        }
        return String.join("\n", errors);
    }

    /**
     * Removes keys; internal and unknown keys are reported, not thrown.
     *
     * @return one error line per key that was not removed, empty if all were removed
     */
    public String removeSshKeys(List<String> keys) {
        List<String> errors = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String key : keys) {
            if (key.equals("juju-client-key") || key.equals("juju-system-key")) {
                errors.add(String.format("cannot remove key id \"%1$s\": may not delete internal key: %1$s", key));
            } else if (!sshKeys.remove(key)) {
                unknown.add(key);
            }
        }
        for (String key : unknown) {
            errors.add(String.format("cannot remove key id \"%1$s\": invalid ssh key: %1$s", key));
        }
        return String.join("\n", errors);
    }

    public String importSshKeys(List<String> names) {
        for (String keyName : names) {
            sshKeys.add("ssh-rsa FAKE_KEY a key " + keyName);
        }
        return "";
    }

    public List<String> sshKeys() {
        return Collections.unmodifiableList(sshKeys);
    }

    // ==================== Status ====================

    /**
     * Builds the status tree the real tool would report for this model.
     *
     * @return status tree with {@code machines}, {@code applications} and {@code model}
     */
    public ObjectNode statusTree() {
        ObjectNode root = NODES.objectNode();
        ObjectNode machineNodes = root.putObject("machines");
        for (String machineId : machines()) {
            ObjectNode machine = machineNodes.putObject(machineId);
            machine.putObject("juju-status").put("current", "idle");
            machine.put("series", "angsty");
            machine.put("instance-id", machineId);
            String hostName = machineHostNames.get(machineId);
            if (hostName != null) {
                machine.put("dns-name", hostName);
            }
            if (stateServers.contains(machineId)) {
                machine.put("controller-member-status", "has-vote");
            }
            SortedSet<String> hosted = containers(machineId);
            if (!hosted.isEmpty()) {
                ObjectNode containerNodes = machine.putObject("containers");
                for (String containerId : hosted) {
                    ObjectNode container = containerNodes.putObject(containerId);
                    container.put("series", "angsty");
                    container.putObject("juju-status").put("current", "idle");
                    String containerHost = machineHostNames.get(containerId);
                    if (containerHost != null) {
                        container.put("dns-name", containerHost);
                    }
                }
            }
        }
        ObjectNode applicationNodes = root.putObject("applications");
        applications().forEach((application, units) -> {
            ObjectNode applicationNode = applicationNodes.putObject(application);
            ObjectNode unitNodes = applicationNode.putObject("units");
            units.forEach((unitId, machineId) -> {
                ObjectNode unit = unitNodes.putObject(unitId);
                if (machineId != null) {
                    unit.put("machine", machineId);
                }
                unit.putObject("juju-status").put("current", "idle");
            });
            ObjectNode relationNode = applicationNode.putObject("relations");
            relations.getOrDefault(application, Map.of()).forEach((endpoint, targets) -> {
                targets.forEach(relationNode.putArray(endpoint)::add);
            });
            applicationNode.put("exposed", exposed.contains(application));
        });
        root.putObject("model").put("name", name);
        return root;
    }

    public StatusDocument statusDocument() {
        return new StatusDocument(statusTree(), null);
    }

    // ==================== Teardown ====================

    /**
     * Clears this model and unregisters it from its controller.
     */
    public void destroyModel() {
        controller.unregister(name);
        clear();
        controller.setLifecycle(ControllerLifecycle.MODEL_DESTROYED);
    }

    private void clear() {
        nextMachineId = 0;
        machines.clear();
        containers.clear();
        applications.clear();
        nextUnitIndex.clear();
        relations.clear();
        exposed.clear();
        sshKeys.clear();
        stateServers.clear();
        machineHostNames.clear();
        modelConfig = new LinkedHashMap<>();
        token = null;
    }

    @Override
    public String toString() {
        return "EnvironmentState[name=" + name + ", machines=" + machines.size()
            + ", applications=" + applications.size() + "]";
    }
}
