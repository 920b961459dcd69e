package com.statuswatch.core.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A parsed snapshot of a controller model's status.
 *
 * <p>The document wraps the status tree and the text it was parsed from. All walks are
 * re-derived from the immutable tree on each call, so they are finite and restartable.
 *
 * <p><b>Walk order:</b>
 * <ul>
 *   <li>Machines are sorted by id; each machine's containers follow it directly.</li>
 *   <li>Applications and units are sorted by name; subordinates follow their principal.</li>
 *   <li>For one entity, the machine or workload status precedes the agent status.</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StatusDocument status = StatusDocument.fromText(output);
 * for (StatusEntry machine : status.machines(true)) {
 *     log.info("{} -> {}", machine.name(), machine.text("dns-name"));
 * }
 * status.raiseHighestError(true);
 * }</pre>
 */
public class StatusDocument {

    private static final Logger log = LoggerFactory.getLogger(StatusDocument.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private static final Set<String> AGENTS_READY = Set.of("started", "idle");
    private static final Pattern BAD_STATE_INFO =
        Pattern.compile("(.*error|^(cannot set up groups|cannot run instance)).*");

    private final JsonNode status;
    private final String statusText;

    public StatusDocument(JsonNode status, String statusText) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.statusText = statusText;
    }

    /**
     * Parses status text.
     *
     * <p>JSON is tried first since it is much cheaper to parse; YAML is the fallback.
     *
     * @param text status output in JSON or YAML
     * @return parsed document
     * @throws IllegalArgumentException if the text is neither valid JSON nor valid YAML
     */
    public static StatusDocument fromText(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return new StatusDocument(JSON_MAPPER.readTree(text), text);
        } catch (JsonProcessingException jsonError) {
            log.trace("Status is not JSON, parsing as YAML");
        }
        try {
            JsonNode tree = YAML_MAPPER.readTree(text);
            return new StatusDocument(tree == null ? MissingNode.getInstance() : tree, text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Status text is neither JSON nor YAML: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Emits the tree as YAML; {@code fromText(doc.toText())} walks identically to {@code doc}.
     *
     * @return YAML text
     */
    public String toText() {
        try {
            return YAML_MAPPER.writeValueAsString(status);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize status tree", e);
        }
    }

    public JsonNode status() {
        return status;
    }

    /**
     * Returns the raw text this document was parsed from (kept for diagnostics).
     *
     * @return status text, or null for documents built directly from a tree
     */
    public String statusText() {
        return statusText;
    }

    public String modelName() {
        JsonNode name = status.path("model").path("name");
        return name.isMissingNode() || name.isNull() ? null : name.asText();
    }

    /**
     * Returns the applications mapping, accepting the legacy {@code services} name.
     *
     * @return applications node (possibly missing)
     */
    public JsonNode applications() {
        JsonNode applications = status.get("applications");
        if (applications == null) {
            applications = status.get("services");
        }
        return applications == null ? MissingNode.getInstance() : applications;
    }

    // ==================== Tree Walks ====================

    /**
     * Lists machines, optionally followed each by its containers.
     *
     * @param includeContainers whether to list containers after their host
     * @return machine and container entries
     */
    public List<StatusEntry> machines(boolean includeContainers) {
        List<StatusEntry> entries = new ArrayList<>();
        for (Map.Entry<String, JsonNode> machine : sortedFields(status.path("machines")).entrySet()) {
            entries.add(new StatusEntry(machine.getKey(), machine.getValue()));
            if (includeContainers) {
                for (Map.Entry<String, JsonNode> container : sortedFields(machine.getValue().path("containers")).entrySet()) {
                    entries.add(new StatusEntry(container.getKey(), container.getValue()));
                }
            }
        }
        return entries;
    }

    /**
     * Lists machines that are not present in an older document.
     *
     * @param old earlier status
     * @param includeContainers whether to consider containers
     * @return entries new since {@code old}
     */
    public List<StatusEntry> newMachines(StatusDocument old, boolean includeContainers) {
        Set<String> known = old.machines(includeContainers).stream()
            .map(StatusEntry::name)
            .collect(Collectors.toSet());
        return machines(includeContainers).stream()
            .filter(entry -> !known.contains(entry.name()))
            .toList();
    }

    /**
     * Lists every unit of every application, each followed by its subordinates.
     *
     * @return unit entries
     */
    public List<StatusEntry> units() {
        List<StatusEntry> entries = new ArrayList<>();
        for (JsonNode application : sortedFields(applications()).values()) {
            entries.addAll(unitsInApplication(application));
        }
        return entries;
    }

    /**
     * Lists every entity that runs an agent: machines, containers, units and subordinates.
     *
     * @return agent-bearing entries
     */
    public List<StatusEntry> agentItems() {
        List<StatusEntry> entries = new ArrayList<>(machines(true));
        entries.addAll(units());
        return entries;
    }

    /**
     * Lists one {@link StatusItem} per observable sub-status.
     *
     * @return status items in walk order
     */
    public List<StatusItem> statusItems() {
        List<StatusItem> items = new ArrayList<>();
        for (StatusEntry machine : machines(true)) {
            items.add(StatusItem.of(StatusKind.MACHINE, machine.name(), machine.data()));
            items.add(StatusItem.of(StatusKind.AGENT, machine.name(), machine.data()));
        }
        for (Map.Entry<String, JsonNode> application : sortedFields(applications()).entrySet()) {
            items.add(StatusItem.of(StatusKind.APPLICATION, application.getKey(), application.getValue()));
            for (StatusEntry unit : unitsInApplication(application.getValue())) {
                items.add(StatusItem.of(StatusKind.WORKLOAD, unit.name(), unit.data()));
                items.add(StatusItem.of(StatusKind.AGENT, unit.name(), unit.data()));
            }
        }
        return items;
    }

    private List<StatusEntry> unitsInApplication(JsonNode application) {
        List<StatusEntry> entries = new ArrayList<>();
        for (Map.Entry<String, JsonNode> unit : sortedFields(application.path("units")).entrySet()) {
            entries.add(new StatusEntry(unit.getKey(), unit.getValue()));
            for (Map.Entry<String, JsonNode> sub : sortedFields(unit.getValue().path("subordinates")).entrySet()) {
                entries.add(new StatusEntry(sub.getKey(), sub.getValue()));
            }
        }
        return entries;
    }

    // ==================== Errors ====================

    /**
     * Classifies every status item with the default classifier.
     *
     * @param ignoreRecoverable drop recoverable errors
     * @return errors sorted by severity
     */
    public List<StatusError> checkForErrors(boolean ignoreRecoverable) {
        return checkForErrors(ignoreRecoverable, ErrorClassifier.defaults());
    }

    /**
     * Classifies every status item.
     *
     * @param ignoreRecoverable drop recoverable errors
     * @param classifier classifier to apply
     * @return errors stably sorted by severity, most severe first
     */
    public List<StatusError> checkForErrors(boolean ignoreRecoverable, ErrorClassifier classifier) {
        return statusItems().stream()
            .map(classifier::classify)
            .flatMap(Optional::stream)
            .filter(error -> !(ignoreRecoverable && error.recoverable()))
            .sorted(StatusError.BY_SEVERITY)
            .toList();
    }

    /**
     * Throws the most severe error, if any.
     *
     * @param ignoreRecoverable skip recoverable errors
     * @throws StatusError the most severe error found
     */
    public void raiseHighestError(boolean ignoreRecoverable) {
        raiseHighestError(ignoreRecoverable, ErrorClassifier.defaults());
    }

    /**
     * Throws the most severe error, if any.
     *
     * @param ignoreRecoverable skip recoverable errors
     * @param classifier classifier to apply
     * @throws StatusError the most severe error found
     */
    public void raiseHighestError(boolean ignoreRecoverable, ErrorClassifier classifier) {
        List<StatusError> errors = checkForErrors(ignoreRecoverable, classifier);
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
    }

    // ==================== Agent States ====================

    /**
     * Returns the machine agent-state, or the unit agent status, of an entity record.
     *
     * @param record machine or unit record
     * @return agent state, {@code no-agent} when none is reported
     */
    public static String coalesceAgentStatus(JsonNode record) {
        JsonNode state = record.get("agent-state");
        if (state != null && !state.isNull()) {
            return state.asText();
        }
        for (String field : List.of("agent-status", "juju-status")) {
            JsonNode current = record.path(field).get("current");
            if (current != null && !current.isNull()) {
                return current.asText();
            }
        }
        return "no-agent";
    }

    /**
     * Groups units by agent state; units of a dying application are grouped as {@code dying}.
     *
     * @return state to unit names
     */
    public SortedMap<String, List<String>> unitAgentStates() {
        SortedMap<String, List<String>> states = new TreeMap<>();
        addUnitAgentStates(states);
        return states;
    }

    /**
     * Groups machines, containers and units by agent state.
     *
     * @return state to entity names
     */
    public SortedMap<String, List<String>> agentStates() {
        SortedMap<String, List<String>> states = new TreeMap<>();
        for (StatusEntry machine : machines(true)) {
            states.computeIfAbsent(coalesceAgentStatus(machine.data()), key -> new ArrayList<>()).add(machine.name());
        }
        addUnitAgentStates(states);
        return states;
    }

    private void addUnitAgentStates(Map<String, List<String>> states) {
        for (JsonNode application : sortedFields(applications()).values()) {
            boolean dying = "dying".equals(application.path("life").asText(null));
            for (StatusEntry unit : unitsInApplication(application)) {
                String state = dying ? "dying" : coalesceAgentStatus(unit.data());
                states.computeIfAbsent(state, key -> new ArrayList<>()).add(unit.name());
            }
        }
    }

    /**
     * Checks whether every agent is started or idle.
     *
     * @return empty when all agents are ready, otherwise the agent states
     * @throws ErroredUnitException if an agent reports an error
     */
    public Optional<SortedMap<String, List<String>>> checkAgentsStarted() {
        for (StatusEntry item : agentItems()) {
            String stateInfo = item.data().path("agent-state-info").asText("");
            if (BAD_STATE_INFO.matcher(stateInfo).lookingAt()) {
                throw new ErroredUnitException(item.name(), stateInfo);
            }
        }
        SortedMap<String, List<String>> states = agentStates();
        if (AGENTS_READY.containsAll(states.keySet())) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> entry : states.entrySet()) {
            String state = entry.getKey();
            if (state.contains("error")) {
                String first = entry.getValue().get(0);
                String message = agentRecord(first).path("juju-status").path("message").asText("");
                throw new ErroredUnitException(first, message.isEmpty() ? state : message);
            }
        }
        return Optional.of(states);
    }

    private JsonNode agentRecord(String name) {
        return agentItems().stream()
            .filter(entry -> entry.name().equals(name))
            .map(StatusEntry::data)
            .findFirst()
            .orElse(MissingNode.getInstance());
    }

    /**
     * Groups agents by reported agent version.
     *
     * @return version to entity names; {@code unknown} when an agent reports none
     */
    public SortedMap<String, Set<String>> agentVersions() {
        SortedMap<String, Set<String>> versions = new TreeMap<>();
        for (StatusEntry item : agentItems()) {
            JsonNode agent = item.data().get("juju-status");
            String version = agent != null && agent.isObject()
                ? agent.path("version").asText("unknown")
                : item.data().path("agent-version").asText("unknown");
            versions.computeIfAbsent(version, key -> new TreeSet<>()).add(item.name());
        }
        return versions;
    }

    // ==================== Projections ====================

    public int applicationCount() {
        return applications().size();
    }

    public boolean hasApplication(String application) {
        return applications().has(application);
    }

    /**
     * Counts an application's principal units.
     *
     * @throws NoSuchEntityException if the application is absent
     */
    public int applicationUnitCount(String application) {
        return application(application).path("units").size();
    }

    /**
     * Returns a unit's record.
     *
     * @param unitName unit name, e.g. {@code wordpress/0}
     * @return unit record
     * @throws NoSuchEntityException if no application has this unit
     */
    public JsonNode getUnit(String unitName) {
        for (JsonNode application : sortedFields(applications()).values()) {
            JsonNode unit = application.path("units").get(unitName);
            if (unit != null) {
                return unit;
            }
        }
        throw new NoSuchEntityException(unitName);
    }

    /**
     * Lists the subordinate units of every unit of an application.
     *
     * @param application application name
     * @return subordinate entries, in unit order
     * @throws NoSuchEntityException if the application is absent
     */
    public List<StatusEntry> subordinateUnits(String application) {
        List<StatusEntry> entries = new ArrayList<>();
        for (JsonNode unit : sortedFields(application(application).path("units")).values()) {
            for (Map.Entry<String, JsonNode> sub : sortedFields(unit.path("subordinates")).entrySet()) {
                entries.add(new StatusEntry(sub.getKey(), sub.getValue()));
            }
        }
        return entries;
    }

    private JsonNode application(String application) {
        JsonNode record = applications().get(application);
        if (record == null) {
            throw new NoSuchEntityException(application);
        }
        return record;
    }

    /**
     * Lists the open ports of a unit.
     *
     * @param unitName unit name
     * @return ports, empty if the unit lists none
     * @throws NoSuchEntityException if no application has this unit
     */
    public List<String> openPorts(String unitName) {
        List<String> ports = new ArrayList<>();
        getUnit(unitName).path("open-ports").forEach(port -> ports.add(port.asText()));
        return ports;
    }

    public String instanceId(String machineId) {
        return machine(machineId).path("instance-id").asText(null);
    }

    public String machineDnsName(String machineId) {
        String host = machine(machineId).path("dns-name").asText(null);
        if (host != null && host.contains(":")) {
            log.warn("Selected IPv6 address for machine {}: {}", machineId, host);
        }
        return host;
    }

    private JsonNode machine(String machineId) {
        JsonNode machine = status.path("machines").get(machineId);
        if (machine == null) {
            throw new NoSuchEntityException(machineId);
        }
        return machine;
    }

    /**
     * Returns the HA voting status of a machine record.
     *
     * @param machine machine record
     * @return {@code controller-member-status}, or null for non-members
     */
    public static String controllerMemberStatus(JsonNode machine) {
        JsonNode member = machine.get("controller-member-status");
        return member == null || member.isNull() ? null : member.asText();
    }

    private static SortedMap<String, JsonNode> sortedFields(JsonNode node) {
        SortedMap<String, JsonNode> fields = new TreeMap<>();
        if (node != null && node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> field = iterator.next();
                fields.put(field.getKey(), field.getValue());
            }
        }
        return fields;
    }

    @Override
    public String toString() {
        return "StatusDocument[model=" + modelName() + "]";
    }
}
