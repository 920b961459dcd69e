package com.statuswatch.core.fake;

import com.statuswatch.core.process.ProcessFailedException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ControllerState}.
 */
class ControllerStateTest {

    @Test
    void newController_isNotBootstrappedWithAdminOnly() {
        ControllerState controller = new ControllerState();

        assertThat(controller.name()).isEqualTo("name");
        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.NOT_BOOTSTRAPPED);
        assertThat(controller.userNames()).containsExactly("admin");
        assertThat(controller.shares()).containsExactly("admin");
        assertThat(controller.activeModel()).isEmpty();
        assertThat(controller.modelNames()).isEmpty();
    }

    @Test
    void bootstrap_createsDefaultAndControllerModels() {
        ControllerState controller = new ControllerState();

        EnvironmentState model = controller.bootstrap("ctl", "default", Map.of("type", "lxd"));

        assertThat(controller.name()).isEqualTo("ctl");
        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.BOOTSTRAPPED);
        assertThat(controller.modelNames()).containsExactly("default", "controller");
        assertThat(controller.activeModel()).hasValue("default");
        assertThat(model.modelConfig()).containsEntry("type", "lxd");
        assertThat(controller.controllerModel().stateServers()).containsExactly("0");
        assertThat(model.stateServers()).isEmpty();
    }

    @Test
    void addModel_setsCreated() {
        ControllerState controller = new ControllerState();

        controller.addModel("extra");

        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.CREATED);
        assertThat(controller.findModel("extra")).isPresent();
    }

    @Test
    void model_unknownName_throwsProcessFailure() {
        ControllerState controller = new ControllerState();

        assertThatThrownBy(() -> controller.model("missing"))
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("model \"missing\" not found");
    }

    @Test
    void requireController_otherModel_throwsControllerOperation() {
        ControllerState controller = new ControllerState();
        controller.bootstrap("ctl", "default", Map.of());

        controller.requireController("backup", ControllerState.CONTROLLER_MODEL);
        assertThatThrownBy(() -> controller.requireController("backup", "default"))
            .isInstanceOf(ControllerOperationException.class)
            .hasMessage("Operation \"backup\" is only valid on controller models.");
    }

    @Test
    void destroy_removesAllModels() {
        ControllerState controller = new ControllerState();
        controller.bootstrap("ctl", "default", Map.of());

        controller.destroy(false);

        assertThat(controller.modelNames()).isEmpty();
        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.CONTROLLER_DESTROYED);
        assertThat(controller.activeModel()).isEmpty();
        assertThatThrownBy(controller::controllerModel).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void destroy_kill_marksKilled() {
        ControllerState controller = new ControllerState();
        controller.bootstrap("ctl", "default", Map.of());

        controller.destroy(true);

        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.CONTROLLER_KILLED);
    }

    @Test
    void register_addsExternalUserWithEmail() {
        ControllerState controller = new ControllerState();

        controller.register("shared", "jrandom@example.com");

        assertThat(controller.name()).isEqualTo("shared");
        assertThat(controller.lifecycle()).isEqualTo(ControllerLifecycle.REGISTERED);
        assertThat(controller.email("jrandom@external")).hasValue("jrandom@example.com");
        assertThat(controller.permission("jrandom@external")).isEqualTo("write");
    }

    @Test
    void grant_modelPermission_givesLoginAccess() {
        ControllerState controller = new ControllerState();
        controller.addUser("bob", "read");

        controller.grant("bob", "write");
        assertThat(controller.access("bob")).isEqualTo("login");

        controller.grant("bob", "superuser");
        assertThat(controller.access("bob")).isEqualTo("superuser");
    }

    @Test
    void revoke_writeDropsToRead_readRemovesShare() {
        ControllerState controller = new ControllerState();
        controller.addUser("bob", "write");

        controller.revoke("bob", "write");
        assertThat(controller.permission("bob")).isEqualTo("read");
        assertThat(controller.shares()).contains("bob");

        controller.revoke("bob", "read");
        assertThat(controller.permission("bob")).isEmpty();
        assertThat(controller.shares()).doesNotContain("bob");
    }

    @Test
    void revoke_otherPermission_isIgnored() {
        ControllerState controller = new ControllerState();
        controller.addUser("bob", "read");

        controller.revoke("bob", "write");

        assertThat(controller.permission("bob")).isEqualTo("read");
    }

    @Test
    void removeUser_unknownUser_throwsProcessFailure() {
        ControllerState controller = new ControllerState();
        controller.addUser("bob", "read");

        controller.removeUser("bob");

        assertThat(controller.userNames()).containsExactly("admin");
        assertThatThrownBy(() -> controller.removeUser("bob"))
            .isInstanceOf(ProcessFailedException.class)
            .hasMessageContaining("user \"bob\" not found");
    }
}
