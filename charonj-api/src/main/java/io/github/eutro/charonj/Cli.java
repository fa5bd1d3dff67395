package io.github.eutro.charonj;

import io.github.eutro.charonj.api.CrateTranslation;
import io.github.eutro.charonj.api.CrateTranslator;
import io.github.eutro.charonj.api.bits.DiagnosticSummary;
import io.github.eutro.charonj.api.bits.OutputsToDirectory;
import io.github.eutro.charonj.decls.TranslationException;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.translate.TranslateConfig;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        boolean setOutput = false;
        File outputDir = new File(".");
        boolean suppressFlags = false;
        TranslateConfig.Builder config = TranslateConfig.builder();
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            err.printf("%s: expected directory%n", arg);
                            return 1;
                        }
                        if (setOutput) {
                            err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        setOutput = true;
                        outputDir = new File(args[i++]);
                        break;
                    case "--ullbc-only":
                        config.structureOutput(false);
                        break;
                    case "--duplication":
                        if (i == args.length) {
                            err.printf("%s: expected mode%n", arg);
                            return 1;
                        }
                        String mode = args[i++];
                        switch (mode) {
                            case "duplicate-tails":
                                config.duplicationMode(DuplicationMode.DUPLICATE_TAILS);
                                break;
                            case "synthetic-join":
                                config.duplicationMode(DuplicationMode.SYNTHETIC_JOIN);
                                break;
                            default:
                                err.printf("%s: unknown mode \"%s\"%n", arg, mode);
                                return 1;
                        }
                        break;
                    case "--opaque":
                        if (i == args.length) {
                            err.printf("%s: expected pattern%n", arg);
                            return 1;
                        }
                        try {
                            config.opaque(args[i++]);
                        } catch (IllegalArgumentException e) {
                            err.printf("%s: %s%n", arg, e.getMessage());
                            return 1;
                        }
                        break;
                    case "--no-match-rewrite":
                        config.removeReadDiscriminant(false);
                        break;
                    case "-j":
                    case "--threads":
                        if (i == args.length) {
                            err.printf("%s: expected thread count%n", arg);
                            return 1;
                        }
                        try {
                            config.threads(Integer.parseInt(args[i++]));
                        } catch (IllegalArgumentException e) {
                            err.printf("%s: invalid thread count \"%s\"%n", arg, args[i - 1]);
                            return 1;
                        }
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp(err);
            return 1;
        }

        CrateTranslator translator = new CrateTranslator(config.build());
        DiagnosticSummary summary = translator.add(DiagnosticSummary.BIT);
        new OutputsToDirectory<>(outputDir.toPath()).addTo(translator.lift());
        int status = 0;
        for (String path : paths) {
            File file = new File(path);
            try {
                CrateTranslation translation = translator.submitFile(file.toPath());
                translation.run();
            } catch (IOException e) {
                err.printf("could not read file %s: %s%n", file, e);
                status = 1;
            } catch (UncheckedIOException e) {
                err.printf("could not write output for %s: %s%n", file, e.getCause());
                status = 1;
            } catch (TranslationException e) {
                err.printf("%s: %s%n", file, e.getMessage());
                status = 1;
            }
        }
        summary.print(err);
        return status;
    }

    private static void printHelp(PrintStream out) {
        out.println(
                "usage: charonj [-h|--help] [-o|--output <dir>] [--ullbc-only]\n" +
                        "               [--duplication duplicate-tails|synthetic-join] [--opaque <pattern>]...\n" +
                        "               [--no-match-rewrite] [-j|--threads <n>] <feed.json> ...\n" +
                        "\n" +
                        "  <feed.json> : a crate feed to translate; each is translated on its own\n" +
                        "  -o|--output <dir> : write <dir>/<crate>.ullbc.json and <dir>/<crate>.llbc.json\n" +
                        "  --ullbc-only : do not structure bodies, and write only <crate>.ullbc.json\n" +
                        "  --duplication <mode> : how to structure code shared by several branches\n" +
                        "                         (default duplicate-tails)\n" +
                        "  --opaque <pattern> : import items matching <pattern>, like a::b::*, without bodies\n" +
                        "  --no-match-rewrite : keep discriminant reads instead of rewriting them to matches\n" +
                        "  -j|--threads <n> : structure bodies on <n> threads\n" +
                        "  -h|--help : show this help"
        );
    }
}
