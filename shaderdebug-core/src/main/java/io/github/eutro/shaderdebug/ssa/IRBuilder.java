package io.github.eutro.shaderdebug.ssa;

import io.github.eutro.shaderdebug.ops.CommonOps;

/**
 * Appends instructions to the end of a block of a function.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock bb;

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    public void insert(Effect effect) {
        bb.addEffect(effect);
    }

    /**
     * Insert an instruction, assigning its result to a fresh variable.
     *
     * @param insn The instruction.
     * @param name The name of the new variable.
     * @return The new variable.
     */
    public Var insert(Insn insn, String name) {
        Var v = func.newVar(name);
        insert(insn.assignTo(v));
        return v;
    }

    public Var constant(ShaderValue value, String name) {
        return insert(CommonOps.constant(value), name);
    }

    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }
}
