package work.lcod.cosmic.xlsx;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packages a {@link Workbook} as a deflate-compressed {@code .xlsx} archive.
 *
 * <p>The archive is assembled in memory and written to a temporary sibling file that is then moved over the target,
 * so a failed write never leaves a partial workbook at the target path.
 */
public final class XlsxWriter {
    private static final Logger LOG = LoggerFactory.getLogger(XlsxWriter.class);
    // fixed entry timestamps keep the archive byte-for-byte reproducible
    private static final LocalDateTime ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    private XlsxWriter() {}

    public static byte[] toBytes(Workbook workbook) {
        Objects.requireNonNull(workbook, "workbook");
        var buffer = new ByteArrayOutputStream();
        try (var zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            zip.setMethod(ZipOutputStream.DEFLATED);
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            for (PackagePart part : WorkbookParts.parts(workbook)) {
                byte[] data = part.bytes();
                var entry = new ZipEntry(part.path());
                entry.setTimeLocal(ENTRY_TIME);
                zip.putNextEntry(entry);
                zip.write(data);
                zip.closeEntry();
                LOG.trace("Packed {} ({} bytes)", part.path(), data.length);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to assemble workbook archive", ex);
        }
        return buffer.toByteArray();
    }

    /**
     * Writes the workbook to {@code target}, creating parent directories, and returns {@code target}.
     *
     * @throws WorkbookWriteException when any file system step fails; the target is left untouched
     */
    public static Path write(Workbook workbook, Path target) {
        Objects.requireNonNull(target, "target");
        byte[] archive = toBytes(workbook);
        Path absolute = target.toAbsolutePath().normalize();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path candidate = absolute.resolveSibling("." + absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
            // plain creation so the process umask applies, as for any other new file
            try (OutputStream out = Files.newOutputStream(candidate, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                temp = candidate;
                out.write(archive);
            }
            copyPermissions(absolute, temp);
            moveIntoPlace(temp, absolute);
        } catch (IOException ex) {
            deleteTemp(temp, ex);
            throw new WorkbookWriteException(target, ex);
        }
        LOG.info("Wrote workbook {} ({} sheets, {} bytes)", absolute, workbook.size(), archive.length);
        return target;
    }

    /**
     * An overwritten report keeps the POSIX permissions of the file it replaces.
     */
    private static void copyPermissions(Path existing, Path replacement) throws IOException {
        if (!Files.exists(existing)
            || !Files.getFileStore(replacement).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Files.setPosixFilePermissions(replacement, Files.getPosixFilePermissions(existing));
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOG.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
