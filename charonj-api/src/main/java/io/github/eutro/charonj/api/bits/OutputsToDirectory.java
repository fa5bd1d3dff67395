package io.github.eutro.charonj.api.bits;

import io.github.eutro.charonj.api.events.EmitCrateEvent;
import io.github.eutro.charonj.api.events.EventDispatcher;
import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.export.CrateExporter;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A bit which writes emitted crates to the given directory.
 * <p>
 * Each crate gets {@code <crate>.ullbc.json}, without structured bodies, and, if it was structured,
 * {@code <crate>.llbc.json} with them. Both documents are written to temporary files in the directory
 * and only then moved into place, so a failed write leaves neither file behind.
 *
 * @param <T> The type on which this listens to events.
 */
public class OutputsToDirectory<T extends EventDispatcher<? super EmitCrateEvent>>
        implements Bit<T, Void> {
    public static final String ULLBC_SUFFIX = ".ullbc.json";
    public static final String LLBC_SUFFIX = ".llbc.json";

    private final Path directory;

    /**
     * Construct a {@link OutputsToDirectory} for writing to the given directory.
     *
     * @param directory The directory to write output files to. Created if missing.
     */
    public OutputsToDirectory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Void addTo(T target) {
        target.listen(EmitCrateEvent.class, evt -> {
            DeclTable table = evt.table;
            byte[] ullbc = CrateExporter.export(table, false);
            byte[] llbc = evt.structured ? CrateExporter.export(table, true) : null;
            try {
                Files.createDirectories(directory);
                write(table.crateName, ullbc, llbc);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return null;
    }

    private void write(String crateName, byte[] ullbc, @Nullable byte[] llbc) throws IOException {
        Map<Path, Path> pending = new LinkedHashMap<>();
        List<Path> moved = new ArrayList<>();
        try {
            pending.put(temp(crateName, ullbc), directory.resolve(crateName + ULLBC_SUFFIX));
            if (llbc != null) {
                pending.put(temp(crateName, llbc), directory.resolve(crateName + LLBC_SUFFIX));
            }
            for (Map.Entry<Path, Path> e : pending.entrySet()) {
                Files.move(e.getKey(), e.getValue(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                moved.add(e.getValue());
            }
        } catch (IOException e) {
            for (Path path : pending.keySet()) deleteAfter(e, path);
            for (Path path : moved) deleteAfter(e, path);
            throw e;
        }
    }

    private Path temp(String crateName, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(directory, crateName, ".tmp");
        try {
            Files.write(temp, bytes);
        } catch (IOException e) {
            deleteAfter(e, temp);
            throw e;
        }
        return temp;
    }

    private static void deleteAfter(IOException cause, Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
