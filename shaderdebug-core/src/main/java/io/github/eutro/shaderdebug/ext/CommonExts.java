package io.github.eutro.shaderdebug.ext;

import io.github.eutro.shaderdebug.controlflow.ConvergenceAnalysis;
import io.github.eutro.shaderdebug.ssa.*;

import java.util.List;

public class CommonExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    public static final Ext<ConvergenceAnalysis> CONVERGENCE = Ext.create(ConvergenceAnalysis.class, "CONVERGENCE");

    public static final Object NULL_SENTINEL = new Object();

    public static Object fillNull(Object obj) {
        return obj == null ? NULL_SENTINEL : obj;
    }

    public static Object takeNull(Object obj) {
        return obj == NULL_SENTINEL ? null : obj;
    }

    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    public static final Ext<ShaderProgram> OWNING_PROGRAM = Ext.create(ShaderProgram.class, "OWNING_PROGRAM");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");
}
