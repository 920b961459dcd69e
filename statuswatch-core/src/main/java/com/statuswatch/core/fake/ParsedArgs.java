package com.statuswatch.core.fake;

import com.statuswatch.core.process.ProcessFailedException;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import picocli.CommandLine.ParseResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arguments of one simulator command, parsed against the syntax its
 * {@link SimulatorCommand} declares.
 *
 * <p>Parse failures surface as {@link ProcessFailedException} with return code 2, the way
 * the real tool rejects bad arguments.
 */
public final class ParsedArgs {

    static final int USAGE_ERROR = 2;

    private final SimulatorCommand command;
    private final List<String> raw;
    private final List<String> positionals;
    private final Map<String, String> options;
    private final Set<String> flags;

    private ParsedArgs(SimulatorCommand command, List<String> raw, List<String> positionals,
                       Map<String, String> options, Set<String> flags) {
        this.command = command;
        this.raw = raw;
        this.positionals = positionals;
        this.options = options;
        this.flags = flags;
    }

    /**
     * Parses {@code args} for {@code command}.
     *
     * @throws ProcessFailedException if an option is unknown (strict commands only) or lacks its value
     */
    public static ParsedArgs parse(SimulatorCommand command, List<String> args) {
        List<String> raw = List.copyOf(args);
        if (command.argumentMode() == ArgumentMode.RAW) {
            return new ParsedArgs(command, raw, raw, Map.of(), Set.of());
        }

        CommandSpec spec = CommandSpec.create().name(command.commandName());
        spec.parser().expandAtFiles(false);
        spec.parser().unmatchedArgumentsAllowed(command.argumentMode() == ArgumentMode.LENIENT);
        PositionalParamSpec positional = PositionalParamSpec.builder()
            .index("0..*")
            .arity("0..*")
            .type(String[].class)
            .paramLabel("ARG")
            .build();
        spec.addPositional(positional);
        for (String option : command.valueOptions()) {
            spec.addOption(OptionSpec.builder(option.split("\\|")).arity("1").type(String.class).build());
        }
        for (String flag : command.flagOptions()) {
            spec.addOption(OptionSpec.builder(flag.split("\\|")).arity("0").type(boolean.class).build());
        }

        ParseResult result;
        try {
            result = new CommandLine(spec).parseArgs(raw.toArray(new String[0]));
        } catch (CommandLine.ParameterException e) {
            throw new ProcessFailedException(USAGE_ERROR, fullCommand(command, raw), "", "error: " + e.getMessage());
        }

        Map<String, String> options = new HashMap<>();
        for (String option : command.valueOptions()) {
            String name = primaryName(option);
            String value = result.matchedOptionValue(name, (String) null);
            if (value != null) {
                options.put(name, value);
            }
        }
        Set<String> flags = new HashSet<>();
        for (String flag : command.flagOptions()) {
            String name = primaryName(flag);
            if (result.hasMatchedOption(name)) {
                flags.add(name);
            }
        }
        String[] values = positional.getValue();
        List<String> positionals = values == null ? List.of() : List.of(values);
        return new ParsedArgs(command, raw, positionals, options, flags);
    }

    private static String primaryName(String option) {
        return option.split("\\|")[0];
    }

    static List<String> fullCommand(SimulatorCommand command, List<String> args) {
        List<String> full = new ArrayList<>();
        full.add("juju");
        full.add(command.commandName());
        full.addAll(args);
        return full;
    }

    public SimulatorCommand command() {
        return command;
    }

    public List<String> raw() {
        return raw;
    }

    public List<String> positionals() {
        return positionals;
    }

    /**
     * Returns a required positional argument.
     *
     * @throws ProcessFailedException if fewer arguments were given
     */
    public String positional(int index) {
        return optionalPositional(index).orElseThrow(() -> usageError(
            "missing argument " + (index + 1) + " for " + command.commandName()));
    }

    public Optional<String> optionalPositional(int index) {
        return index < positionals.size() ? Optional.of(positionals.get(index)) : Optional.empty();
    }

    /**
     * Returns an option value by its first declared name, e.g. {@code -n} for {@code -n|--num-units}.
     */
    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public int intOption(String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw usageError("invalid int value for " + name + ": '" + value + "'");
        }
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }

    ProcessFailedException usageError(String message) {
        return new ProcessFailedException(USAGE_ERROR, fullCommand(command, raw), "", "error: " + message);
    }
}
