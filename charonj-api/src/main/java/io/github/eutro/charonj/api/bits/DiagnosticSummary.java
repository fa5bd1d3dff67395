package io.github.eutro.charonj.api.bits;

import io.github.eutro.charonj.api.CrateTranslator;
import io.github.eutro.charonj.api.events.DiagnosticEvent;
import io.github.eutro.charonj.decls.Diagnostic;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the diagnostics of every crate a translator runs, for reporting at the end.
 */
public class DiagnosticSummary {
    /**
     * A bit to attach a fresh summary to a translator.
     */
    public static final Bit<CrateTranslator, DiagnosticSummary> BIT = translator -> {
        DiagnosticSummary summary = new DiagnosticSummary();
        translator.lift().listen(DiagnosticEvent.class, evt -> summary.add(evt.diagnostic));
        return summary;
    };

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<Diagnostic.Kind, Integer> counts = new EnumMap<>(Diagnostic.Kind.class);

    public synchronized void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        counts.merge(diagnostic.kind, 1, Integer::sum);
    }

    public synchronized List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public synchronized int count(Diagnostic.Kind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public synchronized boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /**
     * Print every diagnostic, then a count for each kind that occurred.
     *
     * @param out Where to print.
     */
    public synchronized void print(PrintStream out) {
        for (Diagnostic diagnostic : diagnostics) {
            out.printf("warning: %s%n", diagnostic);
        }
        if (diagnostics.isEmpty()) return;
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Diagnostic.Kind, Integer> entry : counts.entrySet()) {
            if (sb.length() != 0) sb.append(", ");
            sb.append(entry.getValue()).append(' ').append(entry.getKey());
        }
        out.printf("%d diagnostic%s (%s)%n", diagnostics.size(), diagnostics.size() == 1 ? "" : "s", sb);
    }
}
