package com.statuswatch.core.fake;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.StatusEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EnvironmentState}.
 */
class EnvironmentStateTest {

    private ControllerState controller;
    private EnvironmentState model;

    @BeforeEach
    void setUp() {
        controller = new ControllerState();
        model = controller.bootstrap("ctl", "default", Map.of());
    }

    @Test
    void addMachine_assignsSequentialIdsAndHostNames() {
        assertThat(model.addMachine()).isEqualTo("0");
        assertThat(model.addMachine("manual.host")).isEqualTo("1");

        assertThat(model.machines()).containsExactly("0", "1");
        assertThat(model.hostName("0")).isEqualTo("0.example.com");
        assertThat(model.hostName("1")).isEqualTo("manual.host");
    }

    @Test
    void addContainer_numbersContainersPerHostAndType() {
        String first = model.addContainer("lxd", null);
        String second = model.addContainer("lxd", "0");
        String kvm = model.addContainer("kvm", "0");

        assertThat(first).isEqualTo("0/lxd/0");
        assertThat(second).isEqualTo("0/lxd/1");
        assertThat(kvm).isEqualTo("0/kvm/0");
        assertThat(model.containers("0")).containsExactly("0/kvm/0", "0/lxd/0", "0/lxd/1");
    }

    @Test
    void removeMachine_removesItsContainers() {
        model.addContainer("lxd", null);

        model.removeMachine("0", false);

        assertThat(model.machines()).isEmpty();
        assertThat(model.containers("0")).isEmpty();
        assertThat(model.hostName("0/lxd/0")).isNull();
    }

    @Test
    void removeMachine_withAssignedUnit_requiresForce() {
        model.deploy("app", 1, null);

        assertThatThrownBy(() -> model.removeMachine("0", false))
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("machine assigned.");

        model.removeMachine("0", true);

        assertThat(model.machines()).isEmpty();
        assertThat(model.applications().get("app")).containsEntry("app/0", null);
        ObjectNode unit = (ObjectNode) model.statusTree().path("applications").path("app").path("units").path("app/0");
        assertThat(unit.has("machine")).isFalse();
    }

    @Test
    void removeMachine_unknownMachine_throwsProcessFailure() {
        assertThatThrownBy(() -> model.removeMachine("4", true))
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("machine 4 not found");
    }

    @Test
    void addUnit_unitIndexesAreNeverReused() {
        model.deploy("app", 2, null);
        model.removeUnit("app/1");

        List<String> added = model.addUnit("app", 1, null);

        assertThat(added).containsExactly("app/2");
        assertThat(model.applications().get("app")).containsOnlyKeys("app/0", "app/2");
    }

    @Test
    void addUnit_placementOnMissingMachine_fails() {
        model.deploy("app", 1, null);

        assertThatThrownBy(() -> model.addUnit("app", 1, "9"))
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("machine 9 not found");
        assertThatThrownBy(() -> model.addUnit("other", 1, null))
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("application \"other\" not found");
    }

    @Test
    void removeUnit_sharedMachine_isReleasedWithLastUnit() {
        model.deploy("app", 1, null);
        model.addUnit("app", 1, "0");

        model.removeUnit("app/0");
        assertThat(model.machines()).containsExactly("0");

        model.removeUnit("app/1");
        assertThat(model.machines()).isEmpty();
    }

    @Test
    void removeApplication_keepsStateServerMachines() {
        EnvironmentState controllerModel = controller.controllerModel();
        controllerModel.deploy("app", 1, "0");
        controllerModel.deploy("other", 1, null);

        controllerModel.removeApplication("app");
        controllerModel.removeApplication("other");

        assertThat(controllerModel.machines()).containsExactly("0");
        assertThat(controllerModel.applications()).isEmpty();
    }

    @Test
    void enableHa_onlyOnControllerModel() {
        controller.controllerModel().enableHa(3);

        assertThat(controller.controllerModel().stateServers()).containsExactly("0", "1", "2");
        assertThatThrownBy(() -> model.enableHa(3))
            .isInstanceOf(ControllerOperationException.class)
            .hasMessage("Operation \"enable-ha\" is only valid on controller models.");
    }

    @Test
    void restoreBackup_requiresNoStateServer() {
        EnvironmentState controllerModel = controller.controllerModel();

        assertThatThrownBy(controllerModel::restoreBackup)
            .isInstanceOf(ProcessFailedException.class)
            .satisfies(e -> assertThat(((ProcessFailedException) e).stderr()).isEqualTo("Operation not permitted"));

        controllerModel.removeMachine("0", true);
        controllerModel.restoreBackup();

        assertThat(controllerModel.stateServers()).containsExactly("1");
    }

    @Test
    void unexpose_notExposed_fails() {
        model.deploy("app", 1, null);
        model.expose("app");

        assertThat(model.isExposed("app")).isTrue();
        model.unexpose("app");
        assertThat(model.isExposed("app")).isFalse();
        assertThatThrownBy(() -> model.unexpose("app")).isInstanceOf(ProcessFailedException.class);
    }

    @Test
    void sshKeys_invalidAndDuplicateKeysAreReported() {
        String result = model.addSshKeys(List.of("ssh-rsa AAAA user@host", "bad", "ssh-rsa AAAA user@host"));

        assertThat(result).isEqualTo("cannot add key \"bad\": invalid ssh key: bad\n"
            + "cannot add key \"ssh-rsa AAAA user@host\": duplicate ssh key: ssh-rsa AAAA user@host");
        assertThat(model.sshKeys()).containsExactly("ssh-rsa AAAA user@host");
    }

    @Test
    void removeSshKeys_internalAndUnknownKeysAreReported() {
        model.importSshKeys(List.of("gh:bob"));

        String result = model.removeSshKeys(List.of("juju-client-key", "missing"));

        assertThat(result).isEqualTo(
            "cannot remove key id \"juju-client-key\": may not delete internal key: juju-client-key\n"
                + "cannot remove key id \"missing\": invalid ssh key: missing");
        assertThat(model.sshKeys()).containsExactly("ssh-rsa FAKE_KEY a key gh:bob");
    }

    @Test
    void statusTree_describesMachinesApplicationsAndModel() {
        model.deploy("app", 1, null);
        model.addRelation("app", "dummy-source");
        model.expose("app");

        ObjectNode tree = model.statusTree();

        assertThat(tree.path("model").path("name").asText()).isEqualTo("default");
        assertThat(tree.path("machines").path("0").path("juju-status").path("current").asText()).isEqualTo("idle");
        assertThat(tree.path("machines").path("0").path("dns-name").asText()).isEqualTo("0.example.com");
        assertThat(tree.path("applications").path("app").path("exposed").asBoolean()).isTrue();
        assertThat(tree.path("applications").path("app").path("relations").path("source").get(0).asText())
            .isEqualTo("dummy-source");
        assertThat(model.statusDocument().units()).extracting(StatusEntry::name).containsExactly("app/0");
    }

    @Test
    void destroyModel_unregistersFromController() {
        model.deploy("app", 1, null);

        model.destroyModel();

        assertThat(controller.modelNames()).containsExactly("controller");
        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.MODEL_DESTROYED);
        assertThat(model.machines()).isEmpty();
        assertThat(controller.activeModel()).isEmpty();
    }
}
