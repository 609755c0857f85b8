package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ops.CommonOps;
import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Effect;
import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.ssa.ShaderValue;
import io.github.eutro.shaderdebug.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One function invocation of a lane: its registers, arguments and position.
 */
public final class StackFrame {
    public final Function function;
    public final FunctionLayout layout;
    private final ShaderValue[] registers;
    private final List<ShaderValue> args;
    private BasicBlock block;
    private int blockId;
    private int effectIndex;
    private @Nullable BasicBlock previousBlock;
    // phi arguments for the edge just taken, as they were when it was taken
    private final Map<Var, ShaderValue> phiInputs = new HashMap<>();

    public StackFrame(Function function, List<ShaderValue> args) {
        if (function.blocks.isEmpty()) {
            throw new IllegalArgumentException("Function " + function.name + " has no blocks");
        }
        this.function = function;
        this.layout = FunctionLayout.of(function);
        this.registers = new ShaderValue[function.getVarCount()];
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.block = function.blocks.get(0);
        this.blockId = 0;
    }

    public ShaderValue read(Var var) {
        ShaderValue value = peek(var);
        if (value == null) {
            throw new IllegalStateException("Read of unassigned " + var + " in " + function.name);
        }
        return value;
    }

    public @Nullable ShaderValue peek(Var var) {
        return var.index < registers.length ? registers[var.index] : null;
    }

    /**
     * @return The previous value of the register.
     */
    @Nullable ShaderValue write(Var var, ShaderValue value) {
        ShaderValue old = registers[var.index];
        registers[var.index] = value;
        return old;
    }

    void jump(BasicBlock target) {
        phiInputs.clear();
        for (Effect effect : target.getEffects()) {
            List<BasicBlock> from = CommonOps.PHI.argNullable(effect.insn().op);
            if (from == null) break;
            for (int i = 0; i < from.size(); i++) {
                if (from.get(i) != block) continue;
                Var var = effect.insn().arg(i);
                ShaderValue value = peek(var);
                if (value != null) phiInputs.put(var, value);
            }
        }
        previousBlock = block;
        block = target;
        blockId = layout.blockId(target);
        effectIndex = 0;
    }

    void advance() {
        effectIndex++;
    }

    public List<ShaderValue> getArgs() {
        return args;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public int getBlockId() {
        return blockId;
    }

    public int getEffectIndex() {
        return effectIndex;
    }

    public boolean atBlockStart() {
        return effectIndex == 0;
    }

    /**
     * @return The effect about to be executed, or null if the control is next.
     */
    public @Nullable Effect currentEffect() {
        List<Effect> effects = block.getEffects();
        return effectIndex < effects.size() ? effects.get(effectIndex) : null;
    }

    /**
     * Read a phi argument of the current block. All phis of a block see the registers as they were
     * when the block was entered, so phis that read each other's variables swap values correctly.
     *
     * @param var The argument.
     * @return Its value on entry to the block.
     * @throws IllegalStateException if it was unassigned then.
     */
    public ShaderValue readPhiInput(Var var) {
        ShaderValue value = phiInputs.get(var);
        if (value == null) {
            throw new IllegalStateException("Phi read of unassigned " + var + " in " + function.name);
        }
        return value;
    }

    public @Nullable BasicBlock getPreviousBlock() {
        return previousBlock;
    }

    public ExecutionPoint point(int depth) {
        return new ExecutionPoint(function, depth, blockId, layout.instructionIndex(blockId, effectIndex));
    }
}
