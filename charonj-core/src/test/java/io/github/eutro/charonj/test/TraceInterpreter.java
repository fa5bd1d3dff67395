package io.github.eutro.charonj.test;

import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Rvalue;
import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.ullbc.*;

import java.util.*;

/**
 * Runs bodies built with {@link Utils#cfg(Terminator...)}, recording the markers of the blocks visited.
 * <p>
 * Branches on the condition and switches on the discriminant take their direction from a seeded
 * random source, so two runs with the same seed that make the same decisions in the same order
 * visit the same blocks. Calls and assertions also take a decision, on whether they complete.
 * Locals past the original ones are join flags, and are actually evaluated.
 */
public class TraceInterpreter {
    private final Random choices;
    private final int limit;
    private final List<Integer> trace = new ArrayList<>();

    private TraceInterpreter(long seed, int limit) {
        this.choices = new Random(seed);
        this.limit = limit;
    }

    public static List<Integer> runUllbc(UllbcBody body, long seed, int limit) {
        TraceInterpreter interp = new TraceInterpreter(seed, limit);
        try {
            interp.ullbc(body);
        } catch (Stop ignored) {
            // ran out of steps
        }
        return interp.trace;
    }

    public static List<Integer> runLlbc(LlbcBody body, int originalLocals, long seed, int limit) {
        TraceInterpreter interp = new TraceInterpreter(seed, limit);
        try {
            interp.new Llbc(originalLocals).exec(body.body);
        } catch (Stop ignored) {
            // ran out of steps
        }
        return interp.trace;
    }

    private static final class Stop extends RuntimeException {
        Stop() {
            super(null, null, false, false);
        }
    }

    private void record(Statement stmt) {
        if (stmt instanceof Statement.StorageLive) {
            trace.add(((Statement.StorageLive) stmt).local);
            if (trace.size() >= limit) throw new Stop();
        }
    }

    private int choose(int arms) {
        return choices.nextInt(arms);
    }

    private void ullbc(UllbcBody body) {
        int block = 0;
        while (true) {
            BasicBlock bb = body.blocks.get(block);
            for (Statement stmt : bb.statements) record(stmt);
            Terminator term = bb.getTerminator();
            if (term instanceof Terminator.Goto) {
                block = ((Terminator.Goto) term).target;
            } else if (term instanceof Terminator.Switch) {
                SwitchTargets targets = ((Terminator.Switch) term).switchTargets;
                if (targets instanceof SwitchTargets.If) {
                    SwitchTargets.If st = (SwitchTargets.If) targets;
                    block = choose(2) == 0 ? st.thenTarget : st.elseTarget;
                } else {
                    SwitchTargets.SwitchInt st = (SwitchTargets.SwitchInt) targets;
                    int c = choose(st.values.size() + (st.otherwise == null ? 0 : 1));
                    block = c < st.values.size() ? st.valueTargets.get(c) : st.otherwise;
                }
            } else if (term instanceof Terminator.Call) {
                // a call that unwinds leaves the body
                if (choose(2) != 0) return;
                block = ((Terminator.Call) term).target;
            } else if (term instanceof Terminator.Assert) {
                if (choose(2) != 0) return;
                block = ((Terminator.Assert) term).target;
            } else {
                return;
            }
        }
    }

    /**
     * How a statement completed.
     */
    private static final class Signal {
        static final Signal NORMAL = new Signal(0, 0);
        static final Signal RETURN = new Signal(1, 0);
        static final int BREAK = 2;
        static final int CONTINUE = 3;
        static final int GOTO = 4;

        final int kind;
        final int arg;

        Signal(int kind, int arg) {
            this.kind = kind;
            this.arg = arg;
        }
    }

    private final class Llbc {
        private final int originalLocals;
        private final Map<Integer, Boolean> flags = new HashMap<>();

        Llbc(int originalLocals) {
            this.originalLocals = originalLocals;
        }

        Signal exec(Stmt.Sequence seq) {
            for (Stmt stmt : seq.stmts) {
                Signal signal = exec(stmt);
                if (signal != Signal.NORMAL) return signal;
            }
            return Signal.NORMAL;
        }

        Signal exec(Stmt stmt) {
            if (stmt instanceof Stmt.Simple) {
                Statement statement = ((Stmt.Simple) stmt).statement;
                if (statement instanceof Statement.Assign) {
                    Statement.Assign assign = (Statement.Assign) statement;
                    Operand value = ((Rvalue.Use) assign.rvalue).operand;
                    flags.put(assign.place.local, Objects.requireNonNull(value.value).isTrue());
                } else {
                    record(statement);
                }
                return Signal.NORMAL;
            }
            if (stmt instanceof Stmt.Return || stmt instanceof Stmt.Abort) return Signal.RETURN;
            if (stmt instanceof Stmt.Call || stmt instanceof Stmt.Assert) {
                return choose(2) == 0 ? Signal.NORMAL : Signal.RETURN;
            }
            if (stmt instanceof Stmt.Break) return new Signal(Signal.BREAK, ((Stmt.Break) stmt).depth);
            if (stmt instanceof Stmt.Continue) return new Signal(Signal.CONTINUE, ((Stmt.Continue) stmt).depth);
            if (stmt instanceof Stmt.Goto) return new Signal(Signal.GOTO, ((Stmt.Goto) stmt).block);
            if (stmt instanceof Stmt.Sequence) return exec((Stmt.Sequence) stmt);
            if (stmt instanceof Stmt.If) {
                Stmt.If ifStmt = (Stmt.If) stmt;
                int local = ifStmt.cond.place.local;
                boolean taken = local >= originalLocals
                        ? flags.getOrDefault(local, false)
                        : choose(2) == 0;
                return exec(taken ? ifStmt.thenBranch : ifStmt.elseBranch);
            }
            if (stmt instanceof Stmt.Switch) {
                Stmt.Switch sw = (Stmt.Switch) stmt;
                int total = 0;
                for (Stmt.SwitchArm arm : sw.arms) total += arm.values.size();
                int c = choose(total + (sw.otherwise == null ? 0 : 1));
                if (c < total) {
                    Literal value = Utils.u32(c);
                    for (Stmt.SwitchArm arm : sw.arms) {
                        if (arm.values.contains(value)) return exec(arm.body);
                    }
                    throw new IllegalStateException("no arm for " + value);
                }
                return exec(Objects.requireNonNull(sw.otherwise));
            }
            if (stmt instanceof Stmt.Loop) {
                Stmt.Sequence body = ((Stmt.Loop) stmt).body;
                while (true) {
                    Signal signal = exec(body);
                    if (signal.kind == Signal.BREAK) {
                        return signal.arg == 0 ? Signal.NORMAL : new Signal(Signal.BREAK, signal.arg - 1);
                    }
                    if (signal.kind == Signal.CONTINUE) {
                        if (signal.arg == 0) continue;
                        return new Signal(Signal.CONTINUE, signal.arg - 1);
                    }
                    if (signal != Signal.NORMAL) return signal;
                }
            }
            if (stmt instanceof Stmt.Flattened) {
                Stmt.Flattened flat = (Stmt.Flattened) stmt;
                int current = flat.entry;
                while (true) {
                    Signal signal = exec(Objects.requireNonNull(flat.getBlock(current)).body);
                    if (signal.kind == Signal.GOTO && flat.getBlock(signal.arg) != null) {
                        current = signal.arg;
                        continue;
                    }
                    return signal;
                }
            }
            throw new IllegalStateException("unexpected " + stmt);
        }
    }
}
