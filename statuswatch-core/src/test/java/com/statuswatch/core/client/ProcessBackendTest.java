package com.statuswatch.core.client;

import com.statuswatch.core.config.HarnessConfig;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.wait.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProcessBackend}.
 */
class ProcessBackendTest {

    @Test
    void fullArgs_withModel_addsModelFlag() {
        ProcessBackend backend = new ProcessBackend("/usr/bin/juju", Map.of());

        assertThat(backend.fullArgs("show-status", List.of("--format", "yaml"), "ctl:default"))
            .containsExactly("/usr/bin/juju", "show-status", "-m", "ctl:default", "--format", "yaml");
    }

    @Test
    void fullArgs_withoutModel_omitsModelFlag() {
        ProcessBackend backend = ProcessBackend.fromConfig(HarnessConfig.CliConfig.defaults());

        assertThat(backend.fullArgs("list-models", List.of(), null))
            .containsExactly("juju", "list-models");
    }

    @Test
    void run_missingExecutable_failsWithLaunchCode() {
        ProcessBackend backend = new ProcessBackend("/nonexistent/statuswatch-juju", Map.of());

        assertThatThrownBy(() -> backend.run("show-status", List.of(), "default", Duration.ofSeconds(5)))
            .isInstanceOfSatisfying(ProcessFailedException.class, e -> {
                assertThat(e.returnCode()).isEqualTo(ProcessBackend.LAUNCH_FAILED);
                assertThat(e.command()).startsWith("/nonexistent/statuswatch-juju", "show-status");
            });
    }

    @Test
    void pause_usesSleeper() {
        ManualClock clock = new ManualClock();
        ProcessBackend backend = new ProcessBackend("juju", Map.of(), clock, clock.sleeper());

        backend.pause(Duration.ofSeconds(30));

        assertThat(clock.sleeps()).isEqualTo(1);
    }
}
