package com.statuswatch.cli;

import com.statuswatch.core.wait.BaseCondition;
import com.statuswatch.core.wait.WaitAgentsStarted;
import com.statuswatch.core.wait.WaitCondition;
import com.statuswatch.core.wait.WaitDeployStarted;
import com.statuswatch.core.wait.WaitHaEnabled;
import com.statuswatch.core.wait.WaitMachineNotPresent;
import com.statuswatch.core.wait.WaitSubordinateUnits;
import com.statuswatch.core.wait.WaitVersion;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConditionFactory}.
 */
class ConditionFactoryTest {

    @Test
    void create_started_usesConditionDefaultTimeout() {
        WaitCondition condition = ConditionFactory.create("started", List.of(), null);

        assertThat(condition).isInstanceOf(WaitAgentsStarted.class);
        assertThat(condition.timeout()).isEqualTo(WaitAgentsStarted.DEFAULT_TIMEOUT);
    }

    @Test
    void create_withTimeout_overridesDefault() {
        WaitCondition condition = ConditionFactory.create("ha", List.of(), Duration.ofSeconds(42));

        assertThat(condition).isInstanceOf(WaitHaEnabled.class);
        assertThat(condition.timeout()).isEqualTo(Duration.ofSeconds(42));
    }

    @Test
    void create_conditionsWithArguments() {
        assertThat(ConditionFactory.create("version", List.of("2.9.1"), null)).isInstanceOf(WaitVersion.class);
        assertThat(ConditionFactory.create("deploy-started", List.of("3"), null)).isInstanceOf(WaitDeployStarted.class);
        assertThat(ConditionFactory.create("subordinates", List.of("wordpress", "ntp"), null))
            .isInstanceOf(WaitSubordinateUnits.class);

        WaitCondition machineGone = ConditionFactory.create("machine-gone", List.of("3"), null);
        assertThat(machineGone).isInstanceOf(WaitMachineNotPresent.class);
        assertThat(machineGone.timeout()).isEqualTo(BaseCondition.DEFAULT_TIMEOUT);
    }

    @Test
    void create_missingArgument_throws() {
        assertThatThrownBy(() -> ConditionFactory.create("subordinates", List.of("wordpress"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Condition subordinates expects <application> <unit-prefix>");
    }

    @Test
    void create_badCount_throws() {
        assertThatThrownBy(() -> ConditionFactory.create("deploy-started", List.of("many"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Not a number: many");
    }

    @Test
    void create_unknownName_throws() {
        assertThatThrownBy(() -> ConditionFactory.create("sunrise", List.of(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Unknown condition: sunrise");
    }

    @Test
    void conditions_coverEveryFactoryName() {
        for (String name : ConditionFactory.CONDITIONS.keySet()) {
            List<String> args = List.of("1", "ntp");
            assertThat(ConditionFactory.create(name, args, null)).as(name).isNotNull();
        }
    }
}
