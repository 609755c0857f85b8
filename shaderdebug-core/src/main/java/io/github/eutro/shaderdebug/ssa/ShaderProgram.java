package io.github.eutro.shaderdebug.ssa;

import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A compiled shader: its stage and its functions, the first of which is the entry point.
 */
public final class ShaderProgram extends ExtHolder {
    public final String name;
    public final ShaderStage stage;
    private final List<Function> functions = new ArrayList<>();
    private int groupsharedSize;

    public ShaderProgram(String name, ShaderStage stage) {
        this.name = name;
        this.stage = stage;
    }

    public Function newFunction(String name, int paramCount) {
        Function func = new Function(name, paramCount);
        func.attachExt(CommonExts.OWNING_PROGRAM, this);
        functions.add(func);
        return func;
    }

    /**
     * @return The number of bytes of groupshared memory the program declares.
     */
    public int getGroupsharedSize() {
        return groupsharedSize;
    }

    public void setGroupsharedSize(int groupsharedSize) {
        if (groupsharedSize < 0) throw new IllegalArgumentException("Negative groupshared size: " + groupsharedSize);
        this.groupsharedSize = groupsharedSize;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public Function getEntryPoint() {
        if (functions.isEmpty()) throw new IllegalStateException("Program " + name + " has no functions");
        return functions.get(0);
    }

    public @Nullable Function getFunction(String name) {
        for (Function function : functions) {
            if (function.name.equals(name)) return function;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(stage.name().toLowerCase()).append(" shader ").append(name).append('\n');
        for (Function function : functions) {
            sb.append(function).append('\n');
        }
        return sb.toString();
    }
}
