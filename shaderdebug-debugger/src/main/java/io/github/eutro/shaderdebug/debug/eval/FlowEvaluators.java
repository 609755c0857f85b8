package io.github.eutro.shaderdebug.debug.eval;

import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.ShaderValue;

import java.util.List;

import static io.github.eutro.shaderdebug.ops.CommonOps.*;

/**
 * Control flow, calls, arguments, phis and constants.
 */
class FlowEvaluators {
    static void register() {
        Evaluators.register(IDENTITY, ctx -> ctx.setResult(ctx.arg(0)));
        Evaluators.register(CONST, ctx -> ctx.setResult(CONST.arg(ctx.insn().op)));
        Evaluators.register(ARG, ctx -> {
            int n = ARG.arg(ctx.insn().op);
            List<ShaderValue> args = ctx.frame().getArgs();
            if (n < 0 || n >= args.size()) {
                throw new IllegalStateException(ctx.frame().function.name + " has no argument " + n);
            }
            ctx.setResult(args.get(n));
        });
        Evaluators.register(PHI, ctx -> {
            List<BasicBlock> preds = PHI.arg(ctx.insn().op);
            BasicBlock from = ctx.frame().getPreviousBlock();
            for (int i = 0; i < preds.size(); i++) {
                if (preds.get(i) == from) {
                    ctx.setResult(ctx.frame().readPhiInput(ctx.insn().arg(i)));
                    return;
                }
            }
            throw new IllegalStateException("Phi " + ctx.insn() + " has no entry for "
                    + (from == null ? "the function entry" : from.toTargetString()));
        });
        Evaluators.register(CALL, ctx -> ctx.call(CALL.arg(ctx.insn().op), ctx.args()));

        Evaluators.registerControl(BR, ctx -> ctx.targets().get(0));
        Evaluators.registerControl(BR_IF, ctx -> ctx.targets().get(ctx.arg(0).getBool(0) ? 0 : 1));
        Evaluators.registerControl(SWITCH, ctx -> {
            int value = ctx.arg(0).getInt(0);
            int[] cases = SWITCH.arg(ctx.insn().op);
            for (int i = 0; i < cases.length; i++) {
                if (cases[i] == value) return ctx.targets().get(i + 1);
            }
            return ctx.targets().get(0);
        });
        Evaluators.registerControl(RETURN, ctx -> {
            ctx.setReturnValue(ctx.arity() == 0 ? null : ctx.arg(0));
            return null;
        });
        Evaluators.registerControl(KILL, ctx -> {
            ctx.kill();
            return null;
        });
    }
}
