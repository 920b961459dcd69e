package com.statuswatch.core.report;

import java.io.Flushable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Incremental, append-only progress output for a wait loop.
 *
 * <p>Each update is a group mapping a state to the entities in it. A changed group is
 * written as {@code state: a, b | other: c} on a new line, omitting the expected state.
 * An unchanged group appends a single tick ({@code .}) to the current line, wrapping to a
 * new line at {@link #DEFAULT_WRAP_WIDTH} columns.
 *
 * <p><b>Example output:</b>
 * <pre>
 * pending: 0, 1 ....
 * pending: 1 ..
 * </pre>
 *
 * <p>Not thread-safe; one reporter serves one wait loop.
 */
public class GroupReporter {

    public static final int DEFAULT_WRAP_WIDTH = 79;

    private final Appendable stream;
    private final String expected;
    private final int wrapWidth;

    private SortedMap<String, List<String>> lastGroup;
    private int ticks;
    private int wrapOffset;

    /**
     * Creates a reporter.
     *
     * @param stream destination; flushed after each write if {@link Flushable}
     * @param expected state that is not worth printing, or null to print every state
     */
    public GroupReporter(Appendable stream, String expected) {
        this(stream, expected, DEFAULT_WRAP_WIDTH);
    }

    public GroupReporter(Appendable stream, String expected, int wrapWidth) {
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        if (wrapWidth <= 0) {
            throw new IllegalArgumentException("wrapWidth must be positive: " + wrapWidth);
        }
        this.expected = expected;
        this.wrapWidth = wrapWidth;
    }

    /**
     * Reports the current group.
     *
     * @param group state to entity names
     */
    public void update(Map<String, ? extends Collection<String>> group) {
        SortedMap<String, List<String>> current = copyOf(group);
        if (current.equals(lastGroup)) {
            if ((wrapOffset + ticks) % wrapWidth == 0) {
                write("\n");
            }
            write(ticks > 0 || wrapOffset == 0 ? "." : " .");
            ticks++;
            return;
        }

        List<String> listing = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : current.entrySet()) {
            if (entry.getKey().equals(expected)) {
                continue;
            }
            listing.add(entry.getKey() + ": " + String.join(", ", entry.getValue()));
        }
        String line = String.join(" | ", listing);
        int leadLength = line.length() + 1;
        if (hasOpenLine()) {
            line = "\n" + line;
        }
        write(line);
        lastGroup = current;
        ticks = 0;
        wrapOffset = leadLength < wrapWidth ? leadLength : 0;
    }

    /**
     * Closes the current line, if any group was written.
     */
    public void finish() {
        if (hasOpenLine()) {
            write("\n");
        }
    }

    private boolean hasOpenLine() {
        return lastGroup != null && !lastGroup.isEmpty();
    }

    private static SortedMap<String, List<String>> copyOf(Map<String, ? extends Collection<String>> group) {
        SortedMap<String, List<String>> copy = new TreeMap<>();
        group.forEach((state, entities) -> copy.put(state, List.copyOf(entities)));
        return copy;
    }

    private void write(String text) {
        try {
            stream.append(text);
            if (stream instanceof Flushable flushable) {
                flushable.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write progress output", e);
        }
    }
}
