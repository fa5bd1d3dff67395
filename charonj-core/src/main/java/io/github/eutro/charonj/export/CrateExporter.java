package io.github.eutro.charonj.export;

import com.google.gson.*;
import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.types.TraitInstanceId;
import io.github.eutro.charonj.types.Ty;
import io.github.eutro.charonj.expr.Rvalue;
import io.github.eutro.charonj.ullbc.Statement;
import io.github.eutro.charonj.ullbc.SwitchTargets;
import io.github.eutro.charonj.ullbc.Terminator;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes a crate as a versioned JSON document, and reads it back.
 * <p>
 * The document is a pure function of the declaration table: declarations in id order, fields in
 * declaration order, variant nodes tagged with their {@code kind}.
 */
public final class CrateExporter {
    /**
     * The version of the document format. Documents of any other version are rejected.
     */
    public static final int SCHEMA_VERSION = 1;

    private static final Gson WITH_LLBC = gson(true);
    private static final Gson WITHOUT_LLBC = gson(false);

    private CrateExporter() {
    }

    private static Gson gson(boolean includeLlbc) {
        GsonBuilder builder = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .disableHtmlEscaping()
                .setPrettyPrinting()
                .registerTypeAdapterFactory(new TaggedTypeAdapterFactory(
                        Ty.class,
                        TraitInstanceId.class,
                        Rvalue.class,
                        Statement.class,
                        SwitchTargets.class,
                        Terminator.class,
                        Stmt.class));
        if (!includeLlbc) {
            builder.setExclusionStrategies(new ExclusionStrategy() {
                @Override
                public boolean shouldSkipField(FieldAttributes f) {
                    return f.getName().equals("llbcBody") && BodyOwner.class.isAssignableFrom(f.getDeclaringClass());
                }

                @Override
                public boolean shouldSkipClass(Class<?> clazz) {
                    return false;
                }
            });
        }
        return builder.create();
    }

    /**
     * The shape of the document.
     */
    private static final class CrateDocument {
        int schemaVersion;
        String crateName;
        List<DeclarationGroup> declarations;
        List<TypeDecl> types;
        List<FunDecl> functions;
        List<GlobalDecl> globals;
        List<TraitDecl> traitDecls;
        List<TraitImpl> traitImpls;
        List<Diagnostic> diagnostics;
    }

    /**
     * Export a crate.
     *
     * @param table       The declarations of the crate.
     * @param includeLlbc Whether to include structured bodies.
     * @return The UTF-8 encoded document.
     */
    public static byte[] export(DeclTable table, boolean includeLlbc) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            write(table, includeLlbc, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Export a crate to a stream. The stream is not closed.
     *
     * @param table       The declarations of the crate.
     * @param includeLlbc Whether to include structured bodies.
     * @param out         The stream to write the UTF-8 encoded document to.
     * @throws IOException If writing fails.
     */
    public static void write(DeclTable table, boolean includeLlbc, OutputStream out) throws IOException {
        CrateDocument doc = new CrateDocument();
        doc.schemaVersion = SCHEMA_VERSION;
        doc.crateName = table.crateName;
        doc.declarations = ReorderDecls.compute(table);
        doc.types = table.getTypes();
        doc.functions = table.getFuns();
        doc.globals = table.getGlobals();
        doc.traitDecls = table.getTraitDecls();
        doc.traitImpls = table.getTraitImpls();
        doc.diagnostics = table.getDiagnostics();
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try {
            (includeLlbc ? WITH_LLBC : WITHOUT_LLBC).toJson(doc, CrateDocument.class, writer);
        } catch (JsonIOException e) {
            if (e.getCause() instanceof IOException) throw (IOException) e.getCause();
            throw e;
        }
        writer.flush();
    }

    public static DeclTable decode(byte[] bytes) {
        return decode(new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8));
    }

    /**
     * Decode an exported crate.
     *
     * @param reader The document.
     * @return The declarations, frozen.
     * @throws SchemaVersionMismatchException If the document is of a different schema version.
     * @throws ExportFormatException          If the document cannot be decoded.
     */
    public static DeclTable decode(Reader reader) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) throw new ExportFormatException("exported crate is not a JSON object");
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ExportFormatException("exported crate is not valid JSON", e);
        }
        JsonElement version = root.get("schema_version");
        if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()) {
            throw new ExportFormatException("exported crate has no schema version");
        }
        if (version.getAsInt() != SCHEMA_VERSION) {
            throw new SchemaVersionMismatchException(SCHEMA_VERSION, version.getAsInt());
        }

        CrateDocument doc;
        try {
            doc = WITH_LLBC.fromJson(root, CrateDocument.class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new ExportFormatException("malformed exported crate", e);
        }
        if (doc.crateName == null
                || doc.types == null
                || doc.functions == null
                || doc.globals == null
                || doc.traitDecls == null
                || doc.traitImpls == null
                || doc.diagnostics == null) {
            throw new ExportFormatException("exported crate is missing a section");
        }

        DeclTable table = new DeclTable(doc.crateName);
        try {
            restoreAll(table, DeclId.Kind.TYPE, doc.types);
            restoreAll(table, DeclId.Kind.FUN, doc.functions);
            restoreAll(table, DeclId.Kind.GLOBAL, doc.globals);
            restoreAll(table, DeclId.Kind.TRAIT_DECL, doc.traitDecls);
            restoreAll(table, DeclId.Kind.TRAIT_IMPL, doc.traitImpls);
        } catch (IllegalArgumentException e) {
            throw new ExportFormatException("declarations of exported crate are out of order", e);
        }
        for (Diagnostic diagnostic : doc.diagnostics) {
            table.report(diagnostic);
        }
        table.freeze();
        return table;
    }

    private static void restoreAll(DeclTable table, DeclId.Kind kind, List<? extends Declaration> decls) {
        for (Declaration decl : decls) {
            if (decl == null || decl.id == null || decl.id.kind != kind) {
                throw new ExportFormatException("exported crate has a misplaced declaration in its "
                        + kind.feedName + " section");
            }
            table.restore(decl);
        }
    }
}
