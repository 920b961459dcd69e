package com.statuswatch.cli;

import com.statuswatch.core.wait.BaseCondition;
import com.statuswatch.core.wait.WaitAgentsStarted;
import com.statuswatch.core.wait.WaitApplicationNotPresent;
import com.statuswatch.core.wait.WaitCondition;
import com.statuswatch.core.wait.WaitDeployStarted;
import com.statuswatch.core.wait.WaitHaEnabled;
import com.statuswatch.core.wait.WaitMachineNotPresent;
import com.statuswatch.core.wait.WaitSubordinateUnits;
import com.statuswatch.core.wait.WaitVersion;
import com.statuswatch.core.wait.WaitWorkloadsReady;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds wait conditions from their command-line names.
 */
final class ConditionFactory {

    /** Condition name to argument synopsis. */
    static final Map<String, String> CONDITIONS = new TreeMap<>(Map.of(
        "started", "",
        "workloads", "",
        "ha", "",
        "version", "<version>",
        "machine-gone", "<machine-id>",
        "application-gone", "<application>",
        "deploy-started", "<application-count>",
        "subordinates", "<application> <unit-prefix>"
    ));

    private ConditionFactory() {
    }

    /**
     * @param name    condition name, see {@link #CONDITIONS}
     * @param args    condition arguments
     * @param timeout timeout, or null for the condition's default
     * @throws IllegalArgumentException if the name is unknown or arguments are missing
     */
    static WaitCondition create(String name, List<String> args, Duration timeout) {
        return switch (name) {
            case "started" -> new WaitAgentsStarted(orDefault(timeout, WaitAgentsStarted.DEFAULT_TIMEOUT));
            case "workloads" -> new WaitWorkloadsReady(orDefault(timeout, WaitWorkloadsReady.DEFAULT_TIMEOUT));
            case "ha" -> new WaitHaEnabled(orDefault(timeout, WaitHaEnabled.DEFAULT_TIMEOUT));
            case "version" -> new WaitVersion(arg(name, args, 0), orDefault(timeout, BaseCondition.DEFAULT_TIMEOUT));
            case "machine-gone" -> new WaitMachineNotPresent(arg(name, args, 0),
                orDefault(timeout, BaseCondition.DEFAULT_TIMEOUT));
            case "application-gone" -> new WaitApplicationNotPresent(arg(name, args, 0),
                orDefault(timeout, BaseCondition.DEFAULT_TIMEOUT));
            case "deploy-started" -> new WaitDeployStarted(parseCount(arg(name, args, 0)),
                orDefault(timeout, WaitDeployStarted.DEFAULT_TIMEOUT));
            case "subordinates" -> new WaitSubordinateUnits(arg(name, args, 0), arg(name, args, 1),
                orDefault(timeout, WaitSubordinateUnits.DEFAULT_TIMEOUT));
            default -> throw new IllegalArgumentException(
                "Unknown condition: " + name + ". Use one of " + CONDITIONS.keySet());
        };
    }

    private static Duration orDefault(Duration timeout, Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    private static String arg(String name, List<String> args, int index) {
        if (index >= args.size()) {
            throw new IllegalArgumentException("Condition " + name + " expects " + CONDITIONS.get(name));
        }
        return args.get(index);
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value, e);
        }
    }
}
