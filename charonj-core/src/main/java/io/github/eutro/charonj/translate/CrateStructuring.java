package io.github.eutro.charonj.translate;

import io.github.eutro.charonj.decls.BodyOwner;
import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.decls.Declaration;
import io.github.eutro.charonj.decls.Diagnostic;
import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.passes.convert.UllbcToLlbc;
import io.github.eutro.charonj.ullbc.UllbcBody;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Structures every body of a frozen crate, in parallel.
 * <p>
 * Each body is structured on its own, into its own slot; the results, and the diagnostics for
 * irreducible regions, are attached in id order once every body is done, so the outcome does not
 * depend on the number of threads.
 */
public class CrateStructuring implements InPlaceIRPass<DeclTable> {
    private final DuplicationMode mode;
    private final int threads;

    public CrateStructuring(DuplicationMode mode, int threads) {
        this.mode = mode;
        this.threads = threads;
    }

    public CrateStructuring(TranslateConfig config) {
        this(config.duplicationMode, config.threads);
    }

    @Override
    public void runInPlace(DeclTable table) {
        if (!table.isFrozen()) {
            throw new IllegalStateException("Declaration table of " + table.crateName + " must be frozen before structuring");
        }
        List<BodyOwner> owners = table.getBodyOwners();
        LlbcBody[] results = new LlbcBody[owners.size()];
        List<List<List<Integer>>> regions = new ArrayList<>(owners.size());
        for (int i = 0; i < owners.size(); i++) regions.add(null);

        if (threads <= 1) {
            for (int i = 0; i < owners.size(); i++) {
                structure(owners, i, results, regions);
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<?>> futures = new ArrayList<>(owners.size());
                for (int i = 0; i < owners.size(); i++) {
                    int index = i;
                    futures.add(executor.submit(() -> structure(owners, index, results, regions)));
                }
                for (Future<?> future : futures) {
                    await(future);
                }
            } finally {
                executor.shutdownNow();
            }
        }

        for (int i = 0; i < owners.size(); i++) {
            BodyOwner owner = owners.get(i);
            if (results[i] == null) continue;
            owner.setLlbcBody(results[i]);
            Declaration decl = owner.getDeclaration();
            for (List<Integer> region : regions.get(i)) {
                table.report(new Diagnostic(Diagnostic.Kind.IRREDUCIBLE_REGION, decl.id, decl.name.toString(),
                        "irreducible control flow flattened", region));
            }
        }
    }

    private void structure(List<BodyOwner> owners, int index, LlbcBody[] results, List<List<List<Integer>>> regions) {
        BodyOwner owner = owners.get(index);
        UllbcBody body = owner.getBody();
        if (body == null) return;
        try {
            results[index] = new UllbcToLlbc(mode).run(body);
            regions.set(index, body.getExtOrThrow(CommonExts.LOOP_FOREST).irreducibleRegions());
        } catch (RuntimeException | Error t) {
            t.addSuppressed(new RuntimeException("structuring " + owner.getDeclaration().id
                    + " (" + owner.getDeclaration().name + ")"));
            throw t;
        }
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while structuring");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new CompletionException(cause);
        }
    }
}
