package work.lcod.cosmic.xlsx;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One entry of the package: its path inside the archive and its XML text.
 */
public record PackagePart(String path, String content) {
    public PackagePart {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }

    public byte[] bytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
