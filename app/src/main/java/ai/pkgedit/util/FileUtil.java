package ai.pkgedit.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class FileUtil {
    private static final Logger logger = LogManager.getLogger(FileUtil.class);

    private FileUtil() {}

    /**
     * Deletes a file or directory tree. Failures on individual entries are logged and skipped.
     *
     * @return true if {@code path} no longer exists afterwards
     */
    public static boolean deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return false;
        }

        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    logger.warn("Failed to delete {}", p, e);
                }
            });
            return !Files.exists(path);
        } catch (IOException e) {
            logger.error("Failed to walk or initiate deletion for directory: {}", path, e);
            return false;
        }
    }

    /**
     * Writes {@code content} to {@code file}, creating parent directories.
     *
     * @return false if the file already existed, in which case it is left untouched
     */
    public static boolean writeIfAbsent(Path file, String content) throws IOException {
        if (Files.exists(file)) {
            logger.debug("Not overwriting existing file {}", file);
            return false;
        }
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return true;
    }
}
