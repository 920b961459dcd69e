package com.statuswatch.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.statuswatch.core.config.HarnessConfig;
import com.statuswatch.core.fake.CommandDispatcher;
import com.statuswatch.core.fake.ControllerLifecycle;
import com.statuswatch.core.fake.ControllerState;
import com.statuswatch.core.process.CommandResult;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusEntry;
import com.statuswatch.core.wait.ApplicationsNotStartedException;
import com.statuswatch.core.wait.CommandComplete;
import com.statuswatch.core.wait.ManualClock;
import com.statuswatch.core.wait.StatusTimeoutException;
import com.statuswatch.core.wait.WaitApplicationNotPresent;
import com.statuswatch.core.wait.WaitDeployStarted;
import com.statuswatch.core.wait.WaitMachineNotPresent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ModelClient} running against the in-memory simulator.
 */
class ModelClientTest {

    private ManualClock clock;
    private ControllerState controller;
    private RecordingBackend backend;
    private StringBuilder out;
    private ModelClient client;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        controller = new ControllerState();
        backend = new RecordingBackend(new CommandDispatcher(controller, clock));
        out = new StringBuilder();
        client = newBuilder().build();
    }

    private ModelClient.Builder newBuilder() {
        return ModelClient.builder(backend)
            .controllerName("ctl")
            .clock(clock)
            .sleeper(clock.sleeper())
            .out(out);
    }

    private void bootstrap() {
        client.bootstrap("lxd", null, null);
    }

    // ==================== Lifecycle ====================

    @Test
    void bootstrap_createsDefaultAndControllerModels() {
        bootstrap();

        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.BOOTSTRAPPED);
        assertThat(controller.name()).isEqualTo("ctl");
        assertThat(client.listModelNames()).containsExactly("default", "controller");
        assertThat(client.modelConfig().path("type").asText()).isEqualTo("lxd");
    }

    @Test
    void bootstrap_withSeries_setsDefaultSeries() {
        client.bootstrap("lxd/localhost", null, "jammy");

        JsonNode config = client.modelConfig();
        assertThat(config.path("region").asText()).isEqualTo("localhost");
        assertThat(config.path("default-series").asText()).isEqualTo("jammy");
    }

    @Test
    void bootstrap_withoutControllerName_throws() {
        ModelClient unnamed = ModelClient.builder(backend).clock(clock).sleeper(clock.sleeper()).out(out).build();

        assertThatThrownBy(() -> unnamed.bootstrap("lxd", null, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No controller name");
    }

    @Test
    void addModel_returnsClientForNewModelSharingBackend() {
        bootstrap();

        ModelClient second = client.addModel("second");
        second.deploy("dummy-sink");

        assertThat(second.modelName()).isEqualTo("second");
        assertThat(second.backend()).isSameAs(client.backend());
        assertThat(second.getStatus().applicationCount()).isEqualTo(1);
        assertThat(client.getStatus().applicationCount()).isZero();
    }

    @Test
    void destroyModel_removesModel() {
        bootstrap();
        ModelClient second = client.addModel("second");

        assertThat(second.destroyModel()).isZero();

        assertThat(client.listModelNames()).containsExactly("default", "controller");
    }

    @Test
    void tearDown_afterBootstrap_destroysController() {
        bootstrap();

        client.tearDown();

        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.CONTROLLER_DESTROYED);
    }

    @Test
    void tearDown_whenDestroyFails_killsAndRethrows() {
        assertThatThrownBy(client::tearDown)
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("destroy-controller");

        assertThat(backend.commands).containsExactly("destroy-controller", "kill-controller");
    }

    @Test
    void killController_returnsZero() {
        bootstrap();

        assertThat(client.killController()).isZero();
        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.CONTROLLER_KILLED);
    }

    @Test
    void showController_listsControllerDetails() {
        bootstrap();

        JsonNode details = client.showController();

        assertThat(details.has("ctl")).isTrue();
    }

    // ==================== Waits ====================

    @Test
    void waitFor_deployCompletes() {
        bootstrap();

        CommandComplete complete = client.deploy("cs:xenial/dummy-source");
        StatusDocument status = client.waitFor(complete);

        assertThat(status.units()).extracting(StatusEntry::name).containsExactly("dummy-source/0");
        assertThat(complete.commandTime().end()).isPresent();
    }

    @Test
    void waitForStarted_afterAddUnit_returnsAllUnits() {
        bootstrap();
        client.deploy("dummy-sink", null, 2, null);
        client.addUnit("dummy-sink", 1);

        StatusDocument status = client.waitForStarted();

        assertThat(status.applicationUnitCount("dummy-sink")).isEqualTo(3);
    }

    @Test
    void waitFor_neverMet_raisesConditionException() {
        bootstrap();

        assertThatThrownBy(() -> client.waitFor(new WaitDeployStarted(5, Duration.ofSeconds(30)), true))
            .isInstanceOf(ApplicationsNotStartedException.class);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void waitForHa_onControllerClient_pausesForSettleTime() {
        bootstrap();
        ModelClient controllerClient = client.controllerClient();

        controllerClient.enableHa();
        StatusDocument status = controllerClient.waitForHa();

        assertThat(status.machines(false)).hasSize(3);
        assertThat(backend.pauses).containsExactly(Duration.ofSeconds(300));
    }

    @Test
    void waitForHa_onOrdinaryModel_throws() {
        bootstrap();

        assertThatThrownBy(client::waitForHa)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("controller client");
    }

    @Test
    void getStatus_missingModel_timesOutWithLastFailure() {
        bootstrap();
        ModelClient missing = client.forModel("missing");

        assertThatThrownBy(missing::getStatus)
            .isInstanceOf(StatusTimeoutException.class)
            .hasCauseInstanceOf(ProcessFailedException.class);
    }

    // ==================== Soft Deadline ====================

    @Test
    void juju_afterSoftDeadline_throwsOnceCommandHasRun() {
        ModelClient limited = newBuilder().softDeadline(clock.instant().plusSeconds(10)).build();
        limited.bootstrap("lxd", null, null);
        clock.advance(Duration.ofSeconds(20));

        assertThatThrownBy(() -> limited.addMachine())
            .isInstanceOf(SoftDeadlineExceededException.class);
        assertThat(controller.model("default").machines()).containsExactly("0");
    }

    @Test
    void ignoringSoftDeadline_suppressesCheck() {
        ModelClient limited = newBuilder().softDeadline(clock.instant().plusSeconds(10)).build();
        limited.bootstrap("lxd", null, null);
        clock.advance(Duration.ofSeconds(20));

        String output = limited.ignoringSoftDeadline(() -> limited.addMachine());

        assertThat(output).isEqualTo("created machine 0");
        assertThat(limited.destroyController(false)).isZero();
    }

    // ==================== Deployment and Machines ====================

    @Test
    void removeApplication_returnsNotPresentCondition() {
        bootstrap();
        client.deploy("dummy-sink");

        WaitApplicationNotPresent condition = client.removeApplication("dummy-sink");
        StatusDocument status = client.waitFor(condition);

        assertThat(condition.timeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(status.applicationCount()).isZero();
    }

    @Test
    void removeMachine_returnsConditionWithLongTimeout() {
        bootstrap();
        client.addMachine();

        WaitMachineNotPresent condition = client.removeMachine("0", true);

        assertThat(condition.machine()).isEqualTo("0");
        assertThat(condition.timeout()).isEqualTo(ModelClient.REMOVE_MACHINE_TIMEOUT);
        assertThat(client.waitFor(condition).machines(true)).isEmpty();
    }

    @Test
    void setConfig_token_isVisibleOverSsh() {
        bootstrap();
        client.deploy("dummy-source");
        client.deploy("dummy-sink");
        client.addRelation("dummy-source", "dummy-sink");

        client.setConfig("dummy-source", Map.of("token", "abc"));

        assertThat(client.getOutput("ssh", List.of("dummy-sink/0", "cat", "/var/run/dummy-sink/token")))
            .isEqualTo("abc");
    }

    @Test
    void addSshMachines_retriesFirstHostOnce() {
        bootstrap();
        backend.fail("ssh:10.0.0.1");

        client.addSshMachines(List.of("10.0.0.1", "10.0.0.2"));

        assertThat(backend.pauses).containsExactly(ModelClient.SSH_RETRY_PAUSE);
        assertThat(controller.model("default").machines()).containsExactly("0", "1");
    }

    @Test
    void addSshMachines_failureOnLaterHost_propagates() {
        bootstrap();
        backend.fail("ssh:10.0.0.3");

        assertThatThrownBy(() -> client.addSshMachines(List.of("10.0.0.2", "10.0.0.3")))
            .isInstanceOf(ProcessFailedException.class);
        assertThat(backend.pauses).isEmpty();
    }

    // ==================== Users and Actions ====================

    @Test
    void addUser_returnsRegistrationToken() throws Exception {
        bootstrap();

        String token = client.addUser("bob", "read");

        byte[] digest = MessageDigest.getInstance("SHA-512").digest("bob".getBytes(StandardCharsets.UTF_8));
        assertThat(token).isEqualTo(Base64.getEncoder().encodeToString(digest));
        assertThat(controller.userNames()).contains("bob");
    }

    @Test
    void grant_modelPermission_givesLoginAccess() {
        bootstrap();
        client.addUser("bob", "read");

        client.grant("bob", "write");

        assertThat(controller.access("bob")).isEqualTo("login");
    }

    @Test
    void runAction_returnsQueuedIdAndOutput() {
        bootstrap();
        client.deploy("dummy-source");
        backend.dispatcher().setActionResult("dummy-source/0", "fetch", "result: ok");

        String actionId = client.runAction("dummy-source/0", "fetch");

        assertThat(actionId).isNotBlank();
        assertThat(client.showActionOutput(actionId)).isEqualTo("result: ok");
    }

    @Test
    void runAction_unknownAction_fails() {
        bootstrap();
        client.deploy("dummy-source");

        assertThatThrownBy(() -> client.runAction("dummy-source/0", "fetch"))
            .isInstanceOf(ProcessFailedException.class);
    }

    @Test
    void createBackup_onControllerModel_returnsFileName() {
        bootstrap();

        assertThat(client.controllerClient().createBackup()).isEqualTo("juju-backup-0.tar.gz");
    }

    // ==================== Configuration ====================

    @Test
    void configure_appliesHarnessConfig() {
        HarnessConfig config = new HarnessConfig(
            new HarnessConfig.CliConfig("juju", "prod", "staging", null),
            HarnessConfig.PollingConfig.defaults(),
            HarnessConfig.DeadlineConfig.defaults());

        ModelClient configured = ModelClient.configure(ModelClient.builder(backend), config).build();

        assertThat(configured.controllerName()).isEqualTo("prod");
        assertThat(configured.modelName()).isEqualTo("staging");
    }

    @Test
    void juju_returnsCommandResult() {
        bootstrap();

        CommandResult result = client.juju("add-machine", List.of("-n", "2"));

        assertThat(result.returnCode()).isZero();
        assertThat(result.output()).isEqualTo("created machine 0\ncreated machine 1");
        assertThat(result.time().fullArgs()).containsExactly("juju", "add-machine", "-m", "default", "-n", "2");
    }

    /**
     * Simulator backend recording commands and pauses; fails one {@code add-machine} for a chosen placement.
     */
    private static class RecordingBackend extends FakeBackend {
        private final List<String> commands = new ArrayList<>();
        private final List<Duration> pauses = new ArrayList<>();
        private String failingPlacement;

        void fail(String placement) {
            failingPlacement = placement;
        }

        RecordingBackend(CommandDispatcher dispatcher) {
            super(dispatcher);
        }

        @Override
        public CommandResult run(String command, List<String> args, String model, Duration timeout) {
            if (!command.equals("show-status")) {
                commands.add(command);
            }
            if (command.equals("add-machine") && args.contains(failingPlacement)) {
                failingPlacement = null;
                throw new ProcessFailedException(1, List.of("juju", command), "", "connection refused");
            }
            return super.run(command, args, model, timeout);
        }

        @Override
        public void pause(Duration duration) {
            pauses.add(duration);
        }
    }
}
