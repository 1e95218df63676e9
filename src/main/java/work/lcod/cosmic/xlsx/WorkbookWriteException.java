package work.lcod.cosmic.xlsx;

import java.nio.file.Path;

/**
 * Raised when a workbook archive cannot be written to its target path.
 */
public final class WorkbookWriteException extends RuntimeException {
    private final Path target;

    public WorkbookWriteException(Path target, Throwable cause) {
        super("Failed to write workbook '" + target + "': " + cause.getMessage(), cause);
        this.target = target;
    }

    public Path target() {
        return target;
    }
}
