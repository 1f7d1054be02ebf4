package com.questrail.logic.block;

import com.questrail.logic.api.EventData;
import com.questrail.logic.api.InvalidCircuitStateException;
import com.questrail.logic.api.Undef;
import com.questrail.logic.event.Event;
import com.questrail.logic.kernel.Circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * CBlock
 * =============================================================================
 * Base class of combinational blocks.
 *
 * <p>
 * The output is a pure function of the current input values, computed by
 * {@link #calcOutput()}. The propagation scheduler calls {@link #evalBlock()}
 * whenever an input might have changed.
 * </p>
 *
 * <h2>Connecting</h2>
 * {@link #connect(Connections)} may be called exactly once, before the circuit
 * is finalized. The specification is resolved into blocks and constants during
 * finalization; only then are the input values readable through {@link #in()}.
 *
 * <h2>Signatures</h2>
 * Blocks with a fixed input shape check it in {@link #start()} with
 * {@link #checkSignature(Map)}, which reports every mismatch in one message.
 */
public abstract non-sealed class CBlock extends Block
{
    private final InputValues inputValues = new InputValues(this);
    private final Set<Block> iconnections = new LinkedHashSet<>();
    private final Map<String, List<OutputSource>> resolved = new LinkedHashMap<>();
    private Connections connections;
    private boolean inputsResolved;

    protected CBlock(Circuit circuit, String name, BlockConfig config)
    {
        super(circuit, name, config);
    }

    protected CBlock(Circuit circuit, String name)
    {
        this(circuit, name, null);
    }

    /**
     * Connects positional inputs.
     */
    public CBlock connect(Object... positional)
    {
        return connect(Connections.of(positional));
    }

    public CBlock connect(Connections spec)
    {
        Objects.requireNonNull(spec, "spec");
        circuit().checkNotFinalized();
        if (connections != null) {
            throw new InvalidCircuitStateException("connect() may be called only once");
        }
        if (spec.isEmpty()) {
            throw new IllegalArgumentException("No inputs to connect were given");
        }
        connections = spec.copy();
        return this;
    }

    public final boolean isConnected()
    {
        return connections != null;
    }

    /**
     * The input specification as given to {@code connect()}.
     */
    public final Connections connections()
    {
        if (connections == null) {
            throw new InvalidCircuitStateException(this + ": not connected yet");
        }
        return connections;
    }

    public final InputSignature inputSignature()
    {
        Connections spec = connections();
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (String name : spec.names()) {
            sizes.put(name, spec.isGroup(name) ? spec.members(name).size() : null);
        }
        return new InputSignature(sizes);
    }

    /**
     * Compares the actual input signature with the expected one.
     *
     * @param expected input names ({@link Connections#POSITIONAL} for positional
     *                 inputs) mapped to their expected shape
     * @return the actual signature
     * @throws IllegalArgumentException describing all differences
     */
    public final InputSignature checkSignature(Map<String, InputExpectation> expected)
    {
        InputSignature actual = inputSignature();
        Set<String> names = actual.names();
        if (!names.equals(expected.keySet())) {
            throw new IllegalArgumentException(
                    "Not connected correctly: " + nameDiff(names, expected.keySet()));
        }
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, InputExpectation> e : expected.entrySet()) {
            String msg = e.getValue().mismatch(e.getKey(), actual.groupSize(e.getKey()));
            if (msg != null) {
                errors.add(msg);
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Not connected correctly: " + String.join("; ", errors));
        }
        return actual;
    }

    private static String nameDiff(Set<String> actual, Set<String> expected)
    {
        Set<String> unexpected = new TreeSet<>(actual);
        unexpected.removeAll(expected);
        Set<String> missing = new TreeSet<>(expected);
        missing.removeAll(actual);
        List<String> parts = new ArrayList<>();
        if (!unexpected.isEmpty()) {
            List<String> sub = new ArrayList<>();
            for (String name : unexpected) {
                List<String> suggestions = NameSuggestions.closeMatches(name, missing, 3);
                if (suggestions.isEmpty()) {
                    sub.add(quote(name));
                } else {
                    List<String> quoted = new ArrayList<>();
                    suggestions.forEach(s -> quoted.add(quote(s)));
                    sub.add(quote(name) + " (did you mean " + String.join(" or ", quoted) + " ?)");
                }
            }
            parts.add("unexpected: " + String.join(", ", sub));
        }
        if (!missing.isEmpty()) {
            List<String> quoted = new ArrayList<>();
            missing.forEach(s -> quoted.add(quote(s)));
            parts.add("missing: " + String.join(", ", quoted));
        }
        return String.join(", ", parts);
    }

    private static String quote(String name)
    {
        return "'" + name + "'";
    }

    /**
     * Resolves the input specification into blocks and constants and records
     * the connections in both directions. Called by the circuit during
     * finalization; repeated calls are ignored.
     *
     * @param resolver turns one input specification into an output source
     */
    public final void resolveInputs(Function<Object, OutputSource> resolver)
    {
        if (inputsResolved) {
            return;
        }
        if (connections != null) {
            for (String name : connections.names()) {
                List<OutputSource> sources = new ArrayList<>();
                for (Object spec : connections.members(name)) {
                    OutputSource source;
                    try {
                        source = resolver.apply(spec);
                    } catch (RuntimeException e) {
                        throw new IllegalArgumentException(
                                "failed connection: " + spec + " --> " + this + ": " + e.getMessage(), e);
                    }
                    sources.add(source);
                    if (source instanceof Block upstream) {
                        iconnections.add(upstream);
                        upstream.addOutputConnection(this);
                    }
                }
                resolved.put(name, Collections.unmodifiableList(sources));
            }
        }
        inputsResolved = true;
    }

    public final boolean isResolved()
    {
        return inputsResolved;
    }

    /**
     * Blocks (not constants) this block reads from.
     */
    public final Set<Block> iconnections()
    {
        return Collections.unmodifiableSet(iconnections);
    }

    protected final InputValues in()
    {
        return inputValues;
    }

    final List<OutputSource> sources(String name)
    {
        if (!inputsResolved) {
            throw new InvalidCircuitStateException(this + ": inputs are not resolved yet");
        }
        List<OutputSource> sources = resolved.get(name);
        if (sources == null) {
            throw new IllegalArgumentException(this + " has no input '" + name + "'");
        }
        return sources;
    }

    final boolean isGroupInput(String name)
    {
        return connections != null && connections.isGroup(name);
    }

    final Set<String> inputNames()
    {
        return Collections.unmodifiableSet(resolved.keySet());
    }

    /**
     * Computes the output from the current input values. Must not return
     * {@link Undef#UNDEF}.
     */
    protected abstract Object calcOutput();

    /**
     * Recomputes the output.
     *
     * @return whether the output changed
     */
    public final boolean evalBlock()
    {
        Object previous = output();
        Object value = calcOutput();
        if (value == Undef.UNDEF) {
            throw new IllegalStateException("Output value must not be <UNDEF>");
        }
        if (Objects.equals(previous, value)) {
            return false;
        }
        logDebug("output: {} -> {}", previous, value);
        assignOutput(value);
        EventData data = EventData.of(EventData.TRIGGER, "output", EventData.PREVIOUS, previous, EventData.VALUE, value);
        for (Event event : outputEvents()) {
            event.send(this, data);
        }
        return true;
    }

    @Override
    public Map<String, Object> describe()
    {
        Map<String, Object> conf = super.describe();
        conf.put("type", "combinational");
        if (inputsResolved) {
            Map<String, Object> inputs = new LinkedHashMap<>();
            resolved.forEach((name, sources) -> {
                List<String> names = new ArrayList<>();
                sources.forEach(s -> names.add(s.name()));
                inputs.put(name, isGroupInput(name) ? names : names.get(0));
            });
            conf.put("inputs", inputs);
        }
        return conf;
    }
}
