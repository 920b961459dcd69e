package com.statuswatch.cli;

import com.statuswatch.core.fake.SimulatorCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Lists available wait conditions or simulator commands.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * statuswatch list conditions
 * statuswatch list commands
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available wait conditions or simulator commands",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "What to list: conditions, commands",
        defaultValue = "conditions"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        switch (type.toLowerCase()) {
            case "conditions" -> listConditions(out);
            case "commands" -> listCommands(out);
            default -> {
                spec.commandLine().getErr().println("Unknown type: " + type);
                spec.commandLine().getErr().println("Valid types: conditions, commands");
                return 1;
            }
        }
        return 0;
    }

    private void listConditions(PrintWriter out) {
        out.println("Wait conditions:");
        out.println();
        for (Map.Entry<String, String> condition : ConditionFactory.CONDITIONS.entrySet()) {
            if (condition.getValue().isEmpty()) {
                out.printf("  • %s%n", condition.getKey());
            } else {
                out.printf("  • %s %s%n", condition.getKey(), condition.getValue());
            }
        }
    }

    private void listCommands(PrintWriter out) {
        out.println("Simulator commands:");
        out.println();
        for (SimulatorCommand command : SimulatorCommand.values()) {
            out.printf("  • %-22s %s%n", command.commandName(), command.scope().name().toLowerCase());
        }
    }
}
