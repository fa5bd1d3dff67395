package io.github.eutro.charonj.test;

import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.passes.convert.UllbcToLlbc;
import io.github.eutro.charonj.passes.opts.EliminateDeadBlocks;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.ullbc.Terminator;
import io.github.eutro.charonj.ullbc.UllbcBody;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Structures random control flow graphs, reducible or not, and checks that the structured body
 * visits the same blocks as the original under the same branch decisions.
 * Failed assertions and unwinding calls end a run; unwind blocks are never entered.
 */
public class ControlFlowEquivalenceTest {
    static final int GRAPHS = 300;
    static final int RUNS = 8;
    static final int STEPS = 200;

    static UllbcBody randomBody(Random rnd) {
        int n = 2 + rnd.nextInt(9);
        Terminator[] terms = new Terminator[n];
        for (int i = 0; i < n; i++) {
            int r = rnd.nextInt(12);
            if (r < 2) {
                terms[i] = ret();
            } else if (r < 5) {
                terms[i] = goTo(rnd.nextInt(n));
            } else if (r < 8) {
                terms[i] = branch(rnd.nextInt(n), rnd.nextInt(n));
            } else if (r < 10) {
                int[] targets = new int[1 + rnd.nextInt(3)];
                for (int j = 0; j < targets.length; j++) targets[j] = rnd.nextInt(n);
                terms[i] = switchOn(rnd.nextBoolean() ? rnd.nextInt(n) : null, targets);
            } else if (r < 11) {
                terms[i] = assertion(rnd.nextInt(n));
            } else {
                terms[i] = call(rnd.nextInt(n), rnd.nextBoolean() ? rnd.nextInt(n) : null);
            }
        }
        UllbcBody body = cfg(terms);
        EliminateDeadBlocks.INSTANCE.runInPlace(body);
        return body;
    }

    void check(DuplicationMode mode) {
        Random rnd = new Random(0x5eed);
        for (int graph = 0; graph < GRAPHS; graph++) {
            UllbcBody body = randomBody(rnd);
            LlbcBody llbc = new UllbcToLlbc(mode).run(body);
            for (int run = 0; run < RUNS; run++) {
                long seed = graph * 31L + run;
                List<Integer> expected = TraceInterpreter.runUllbc(body, seed, STEPS);
                List<Integer> actual = TraceInterpreter.runLlbc(llbc, body.locals.size(), seed, STEPS);
                assertEquals(expected, actual, () -> "graph " + body + "\nstructured as " + llbc);
            }
        }
    }

    @Test
    void duplicateTails() {
        check(DuplicationMode.DUPLICATE_TAILS);
    }

    @Test
    void syntheticJoin() {
        check(DuplicationMode.SYNTHETIC_JOIN);
    }
}
