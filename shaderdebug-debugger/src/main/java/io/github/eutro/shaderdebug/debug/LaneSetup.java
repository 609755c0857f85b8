package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ssa.ShaderValue;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The initial state of one lane: whether it runs, whether it is a helper, and its inputs by slot.
 */
public final class LaneSetup {
    private final boolean active;
    private final boolean helper;
    private final Map<Integer, ShaderValue> inputs;

    private LaneSetup(boolean active, boolean helper, Map<Integer, ShaderValue> inputs) {
        this.active = active;
        this.helper = helper;
        this.inputs = Collections.unmodifiableMap(inputs);
    }

    public static LaneSetup create() {
        return new LaneSetup(true, false, new TreeMap<>());
    }

    public LaneSetup withInput(int slot, ShaderValue value) {
        Map<Integer, ShaderValue> newInputs = new TreeMap<>(inputs);
        newInputs.put(slot, value);
        return new LaneSetup(active, helper, newInputs);
    }

    /**
     * A helper lane runs only to feed derivatives; it never writes memory or outputs.
     */
    public LaneSetup asHelper() {
        return new LaneSetup(active, true, new TreeMap<>(inputs));
    }

    /**
     * An inactive lane never executes.
     */
    public LaneSetup inactive() {
        return new LaneSetup(false, helper, new TreeMap<>(inputs));
    }

    public boolean isActive() {
        return active;
    }

    public boolean isHelper() {
        return helper;
    }

    public Map<Integer, ShaderValue> getInputs() {
        return inputs;
    }
}
