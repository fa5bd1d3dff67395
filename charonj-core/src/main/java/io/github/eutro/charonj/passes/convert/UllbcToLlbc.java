package io.github.eutro.charonj.passes.convert;

import io.github.eutro.charonj.expr.Local;
import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Place;
import io.github.eutro.charonj.expr.Rvalue;
import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.ext.MetadataState;
import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.passes.IRPass;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.LiteralTy;
import io.github.eutro.charonj.types.Ty;
import io.github.eutro.charonj.ullbc.*;
import io.github.eutro.charonj.util.LoopForest;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A pass that structures an unstructured body into an equivalent {@link LlbcBody}.
 * <p>
 * Blocks are translated from the entry, nesting only where the structure nests.
 * A jump to another block becomes, in order of preference:
 * <ul>
 *     <li>a {@link Stmt.Goto} if the block is in an irreducible region being flattened;</li>
 *     <li>a {@link Stmt.Continue} or {@link Stmt.Break} if it is the header or chosen exit of an enclosing loop;</li>
 *     <li>nothing, if it is where the enclosing branch rejoins, in which case control falls through;</li>
 *     <li>setting a join flag, if it is a tail shared by the arms of the enclosing branch;</li>
 *     <li>a {@link Stmt.Flattened} node, if it enters an irreducible region;</li>
 *     <li>the code of the block itself, opening a {@link Stmt.Loop} if it is a loop header.</li>
 * </ul>
 * A sequence that completes normally has reached the join of its context (or set a join flag).
 * The body of a loop has no join, so it never completes normally.
 * <p>
 * Every choice is made by block index and reverse post-order, so the result is deterministic.
 * The {@link CommonExts#LOOP_FOREST} of the body is left attached, with the irreducible regions found.
 */
public class UllbcToLlbc implements IRPass<UllbcBody, LlbcBody> {
    private final DuplicationMode mode;

    public UllbcToLlbc(DuplicationMode mode) {
        this.mode = mode;
    }

    @Override
    public LlbcBody run(UllbcBody body) {
        MetadataState ms = body.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(body, MetadataState.LOOPS);
        return new Structurer(body, body.getExtOrThrow(CommonExts.LOOP_FOREST), mode).run();
    }

    private static final class Frame {
        final int header;
        final @Nullable Integer exit;

        Frame(int header, @Nullable Integer exit) {
            this.header = header;
            this.exit = exit;
        }
    }

    private static final class Ctx {
        final List<Frame> loops;
        final @Nullable Integer join;
        /**
         * Shared tails, by block, to the local of their flag.
         */
        final Map<Integer, Integer> tails;
        final List<List<Integer>> regions;

        Ctx(List<Frame> loops, @Nullable Integer join, Map<Integer, Integer> tails, List<List<Integer>> regions) {
            this.loops = loops;
            this.join = join;
            this.tails = tails;
            this.regions = regions;
        }

        @Nullable Integer top() {
            return loops.isEmpty() ? null : loops.get(loops.size() - 1).header;
        }

        boolean inActiveRegion(int block) {
            for (List<Integer> region : regions) {
                if (region.contains(block)) return true;
            }
            return false;
        }

        boolean onStack(int block) {
            for (Frame frame : loops) {
                if (frame.header == block || Objects.equals(frame.exit, block)) return true;
            }
            return false;
        }

        Ctx enterLoop(int header, @Nullable Integer exit) {
            List<Frame> inner = new ArrayList<>(loops);
            inner.add(new Frame(header, exit));
            return new Ctx(inner, null, Collections.emptyMap(), regions);
        }

        Ctx withJoin(@Nullable Integer join, Map<Integer, Integer> tails) {
            return new Ctx(loops, join, tails, regions);
        }

        Ctx enterRegion(List<Integer> region) {
            List<List<Integer>> inner = new ArrayList<>(regions);
            inner.add(region);
            return new Ctx(loops, join, tails, inner);
        }
    }

    /**
     * A block whose code continues the sequence being built.
     */
    private static final class Next {
        final int block;
        final Ctx ctx;

        Next(int block, Ctx ctx) {
            this.block = block;
            this.ctx = ctx;
        }
    }

    private static final class ReachKey {
        final List<Frame> loops; // by identity, contexts share the list until a loop is entered
        final @Nullable Integer join;
        final @Nullable Integer stop;

        ReachKey(List<Frame> loops, @Nullable Integer join, @Nullable Integer stop) {
            this.loops = loops;
            this.join = join;
            this.stop = stop;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ReachKey)) return false;
            ReachKey other = (ReachKey) o;
            return loops == other.loops && Objects.equals(join, other.join) && Objects.equals(stop, other.stop);
        }

        @Override
        public int hashCode() {
            return (System.identityHashCode(loops) * 31 + Objects.hashCode(join)) * 31 + Objects.hashCode(stop);
        }
    }

    private static final class Structurer {
        private final UllbcBody body;
        private final LoopForest<Integer> forest;
        private final DuplicationMode mode;
        private final List<Local> locals;
        private final Map<Integer, Integer> flags = new HashMap<>();
        private final Map<ReachKey, BitSet[]> reachable = new HashMap<>();

        Structurer(UllbcBody body, LoopForest<Integer> forest, DuplicationMode mode) {
            this.body = body;
            this.forest = forest;
            this.mode = mode;
            this.locals = new ArrayList<>(body.locals);
        }

        LlbcBody run() {
            List<Stmt> out = new ArrayList<>();
            if (!body.blocks.isEmpty()) {
                drive(translate(0, new Ctx(Collections.emptyList(), null, Collections.emptyMap(), Collections.emptyList()), out), out);
            }
            return new LlbcBody(locals, body.argCount, new Stmt.Sequence(out));
        }

        private List<Integer> successors(int block) {
            return body.blocks.get(block).getTerminator().targets();
        }

        /**
         * Translate blocks into {@code out} until a block ends without falling into another.
         * Straight-line code is translated here in a loop, so only nesting deepens the stack.
         */
        private void drive(@Nullable Next next, List<Stmt> out) {
            while (next != null) {
                next = translate(next.block, next.ctx, out);
            }
        }

        private @Nullable Next translate(int block, Ctx ctx, List<Stmt> out) {
            if (forest.isHeader(block) && !ctx.onStack(block) && !ctx.inActiveRegion(block)) {
                Integer exit = chooseExit(block);
                List<Stmt> loopBody = new ArrayList<>();
                drive(translateBlock(block, ctx.enterLoop(block, exit), loopBody), loopBody);
                out.add(new Stmt.Loop(new Stmt.Sequence(loopBody)));
                return exit == null ? null : jump(exit, ctx, out);
            }
            return translateBlock(block, ctx, out);
        }

        private @Nullable Next translateBlock(int block, Ctx ctx, List<Stmt> out) {
            BasicBlock bb = body.blocks.get(block);
            int start = out.size();
            for (Statement stmt : bb.statements) {
                out.add(new Stmt.Simple(stmt));
            }
            return bb.getTerminator().accept(new Terminator.Visitor<Next>() {
                @Override
                public Next visitGoto(Terminator.Goto term) {
                    return jump(term.target, ctx, out);
                }

                @Override
                public Next visitSwitch(Terminator.Switch term) {
                    return translateSwitch(term, ctx, out, start);
                }

                @Override
                public Next visitReturn(Terminator.Return term) {
                    out.add(Stmt.RETURN);
                    return null;
                }

                @Override
                public Next visitAbort(Terminator.Abort term) {
                    out.add(new Stmt.Abort(term.cause));
                    return null;
                }

                @Override
                public Next visitCall(Terminator.Call term) {
                    out.add(new Stmt.Call(term.call));
                    return jump(term.target, ctx, out);
                }

                @Override
                public Next visitAssert(Terminator.Assert term) {
                    out.add(new Stmt.Assert(term.cond, term.expected));
                    return jump(term.target, ctx, out);
                }
            });
        }

        /**
         * Emit a jump to {@code target}.
         *
         * @return The block to translate next into {@code out}, if the jump falls into its code.
         */
        private @Nullable Next jump(int target, Ctx ctx, List<Stmt> out) {
            if (ctx.inActiveRegion(target)) {
                out.add(new Stmt.Goto(target));
                return null;
            }
            for (int i = ctx.loops.size() - 1; i >= 0; i--) {
                Frame frame = ctx.loops.get(i);
                int depth = ctx.loops.size() - 1 - i;
                if (frame.header == target) {
                    out.add(new Stmt.Continue(depth));
                    return null;
                }
                if (Objects.equals(frame.exit, target)) {
                    out.add(new Stmt.Break(depth));
                    return null;
                }
            }
            if (Objects.equals(ctx.join, target)) return null;
            Integer flag = ctx.tails.get(target);
            if (flag != null) {
                out.add(setFlag(flag, true));
                return null;
            }
            List<Integer> region = forest.regionOf(target);
            if (region != null) {
                Ctx inner = ctx.enterRegion(region);
                List<Stmt.PseudoBlock> blocks = new ArrayList<>(region.size());
                for (int block : region) {
                    List<Stmt> code = new ArrayList<>();
                    drive(translate(block, inner, code), code);
                    blocks.add(new Stmt.PseudoBlock(block, new Stmt.Sequence(code)));
                }
                out.add(new Stmt.Flattened(target, blocks));
                return null;
            }
            return new Next(target, ctx);
        }

        /**
         * Pick the exit of a loop that {@link Stmt.Break} goes to: the successor of the loop at the level of
         * the enclosing loop with the most edges from the loop, first in reverse post-order on a tie.
         */
        private @Nullable Integer chooseExit(int header) {
            Set<Integer> loop = forest.body(header);
            Integer parent = forest.parent(header);
            Map<Integer, Integer> edges = new HashMap<>();
            for (int block : loop) {
                for (int succ : successors(block)) {
                    if (!loop.contains(succ) && Objects.equals(forest.level(succ), parent)) {
                        edges.merge(succ, 1, Integer::sum);
                    }
                }
            }
            Integer best = null;
            for (Map.Entry<Integer, Integer> e : edges.entrySet()) {
                if (best == null || better(e.getKey(), e.getValue(), best, edges.get(best))) {
                    best = e.getKey();
                }
            }
            return best;
        }

        private boolean better(int block, int count, int best, int bestCount) {
            if (count != bestCount) return count > bestCount;
            return forest.rpoIndex(block) < forest.rpoIndex(best);
        }

        /**
         * Find the blocks reachable from a target without taking back edges, leaving the current
         * loop, or entering an enclosing loop's header or exit or an irreducible region.
         * The context's join is included but not passed through, as is {@code stop}.
         * <p>
         * Without back edges and irreducible regions the blocks form a DAG, so the set of a block is
         * itself plus the sets of its successors. Sets are memoised for each loop stack, join and stop,
         * and must not be modified.
         */
        private BitSet reach(int start, Ctx ctx, @Nullable Integer stop) {
            if (!admits(start, ctx)) return new BitSet();
            BitSet[] memo = reachable.computeIfAbsent(new ReachKey(ctx.loops, ctx.join, stop),
                    k -> new BitSet[body.blocks.size()]);
            if (memo[start] != null) return memo[start];

            Deque<Integer> stack = new ArrayDeque<>();
            Set<Integer> open = new HashSet<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                int block = stack.peek();
                if (memo[block] != null) {
                    stack.pop();
                    continue;
                }
                List<Integer> next = reachSuccessors(block, ctx, stop);
                if (open.add(block)) {
                    for (int succ : next) {
                        if (memo[succ] != null) continue;
                        if (open.contains(succ)) {
                            throw new IllegalStateException("cycle through block " + succ + " outside loops and irreducible regions");
                        }
                        stack.push(succ);
                    }
                    continue;
                }
                BitSet set = new BitSet();
                set.set(block);
                for (int succ : next) set.or(memo[succ]);
                memo[block] = set;
                open.remove(block);
                stack.pop();
            }
            return memo[start];
        }

        private List<Integer> reachSuccessors(int block, Ctx ctx, @Nullable Integer stop) {
            if (Objects.equals(block, ctx.join) || Objects.equals(block, stop)) return Collections.emptyList();
            List<Integer> next = new ArrayList<>();
            for (int succ : successors(block)) {
                if (!forest.isBackEdge(block, succ) && admits(succ, ctx)) next.add(succ);
            }
            return next;
        }

        private boolean admits(int block, Ctx ctx) {
            if (ctx.onStack(block) || forest.regionOf(block) != null) return false;
            Integer top = ctx.top();
            return top == null || forest.body(top).contains(block);
        }

        /**
         * The blocks reached by at least two arms, at the level of the current loop, by number of arms
         * reaching them and then reverse post-order.
         */
        private List<Integer> shared(List<BitSet> reached, Ctx ctx) {
            int[] counts = new int[body.blocks.size()];
            for (BitSet set : reached) {
                for (int block = set.nextSetBit(0); block >= 0; block = set.nextSetBit(block + 1)) {
                    counts[block]++;
                }
            }
            Integer top = ctx.top();
            List<Integer> shared = new ArrayList<>();
            for (int block = 0; block < counts.length; block++) {
                if (counts[block] >= 2 && Objects.equals(forest.level(block), top)) shared.add(block);
            }
            shared.sort(Comparator.<Integer>comparingInt(b -> -counts[b]).thenComparingInt(forest::rpoIndex));
            return shared;
        }

        /**
         * Translate a switch, with the join flags it needs set up before the code of its block,
         * which starts at {@code start} in {@code out}.
         */
        private @Nullable Next translateSwitch(Terminator.Switch term, Ctx ctx, List<Stmt> out, int start) {
            List<Integer> arms = new ArrayList<>();
            SwitchTargets targets = term.switchTargets;
            Map<Integer, List<Literal>> grouped = new LinkedHashMap<>();
            if (targets instanceof SwitchTargets.If) {
                SwitchTargets.If st = (SwitchTargets.If) targets;
                arms.add(st.thenTarget);
                arms.add(st.elseTarget);
            } else {
                SwitchTargets.SwitchInt st = (SwitchTargets.SwitchInt) targets;
                for (int i = 0; i < st.values.size(); i++) {
                    grouped.computeIfAbsent(st.valueTargets.get(i), k -> new ArrayList<>()).add(st.values.get(i));
                }
                arms.addAll(grouped.keySet());
                if (st.otherwise != null) arms.add(st.otherwise);
            }

            List<BitSet> reached = new ArrayList<>();
            for (int arm : arms) reached.add(reach(arm, ctx, null));
            List<Integer> candidates = shared(reached, ctx);
            candidates.remove(ctx.join);

            Integer join = null;
            boolean joinReachable = false;
            if (ctx.join != null) {
                for (BitSet set : reached) joinReachable |= set.get(ctx.join);
            }
            if (joinReachable) {
                for (int candidate : candidates) {
                    if (separates(candidate, arms, ctx)) {
                        join = candidate;
                        break;
                    }
                }
            } else if (!candidates.isEmpty()) {
                join = candidates.get(0);
            }
            Integer effectiveJoin = join == null ? ctx.join : join;

            Map<Integer, Integer> newTails = new LinkedHashMap<>();
            if (mode == DuplicationMode.SYNTHETIC_JOIN) {
                List<BitSet> upToJoin = new ArrayList<>();
                for (int arm : arms) upToJoin.add(reach(arm, ctx, effectiveJoin));
                List<Integer> tails = shared(upToJoin, ctx);
                tails.remove(effectiveJoin);
                tails.removeAll(ctx.tails.keySet());
                tails.sort(Comparator.comparingInt(forest::rpoIndex));
                for (int tail : tails) {
                    newTails.put(tail, flagFor(tail));
                }
            }
            // outer tails are only reachable by falling through if the switch has no join of its own
            Map<Integer, Integer> armTails = new LinkedHashMap<>();
            if (join == null) armTails.putAll(ctx.tails);
            armTails.putAll(newTails);
            Ctx armCtx = ctx.withJoin(effectiveJoin, armTails);

            // ahead of the block's statements, so a discriminant read stays next to its switch
            List<Stmt> inits = new ArrayList<>();
            for (int flag : newTails.values()) {
                inits.add(setFlag(flag, false));
            }
            out.addAll(start, inits);
            if (targets instanceof SwitchTargets.If) {
                SwitchTargets.If st = (SwitchTargets.If) targets;
                out.add(new Stmt.If(term.discriminant, arm(st.thenTarget, armCtx), arm(st.elseTarget, armCtx)));
            } else {
                SwitchTargets.SwitchInt st = (SwitchTargets.SwitchInt) targets;
                List<Stmt.SwitchArm> switchArms = new ArrayList<>();
                for (Map.Entry<Integer, List<Literal>> e : grouped.entrySet()) {
                    switchArms.add(new Stmt.SwitchArm(e.getValue(), arm(e.getKey(), armCtx)));
                }
                out.add(new Stmt.Switch(term.discriminant, st.intTy, switchArms,
                        st.otherwise == null ? null : arm(st.otherwise, armCtx)));
            }

            List<Integer> pending = new ArrayList<>(newTails.keySet());
            for (int i = 0; i < pending.size(); i++) {
                int tail = pending.get(i);
                Map<Integer, Integer> later = new LinkedHashMap<>();
                if (join == null) later.putAll(ctx.tails);
                for (int j = i + 1; j < pending.size(); j++) {
                    later.put(pending.get(j), newTails.get(pending.get(j)));
                }
                List<Stmt> code = new ArrayList<>();
                drive(jump(tail, ctx.withJoin(effectiveJoin, later), code), code);
                out.add(new Stmt.If(Operand.copy(Place.local(newTails.get(tail))),
                        new Stmt.Sequence(code),
                        Stmt.seq()));
            }
            return join == null ? null : jump(join, ctx, out);
        }

        private Stmt.Sequence arm(int target, Ctx ctx) {
            List<Stmt> code = new ArrayList<>();
            drive(jump(target, ctx, code), code);
            return new Stmt.Sequence(code);
        }

        private boolean separates(int candidate, List<Integer> arms, Ctx ctx) {
            for (int arm : arms) {
                if (arm == candidate) continue;
                if (reach(arm, ctx, candidate).get(ctx.join)) return false;
            }
            return true;
        }

        private int flagFor(int block) {
            Integer local = flags.get(block);
            if (local == null) {
                local = locals.size();
                locals.add(new Local(local, "join_bb" + block, Ty.literal(LiteralTy.BOOL)));
                flags.put(block, local);
            }
            return local;
        }

        private static Stmt setFlag(int local, boolean value) {
            return new Stmt.Simple(new Statement.Assign(
                    Place.local(local),
                    new Rvalue.Use(Operand.literal(Literal.bool(value)))));
        }
    }
}
