package com.domainmodel.analyzer.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed. The
     * content goes to a sibling temp file first and is then moved into place,
     * so readers never see a half-written document.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        if (Files.isDirectory(filePath)) {
            throw new IOException("Target is a directory: " + filePath);
        }
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Path tmp = Files.createTempFile(parentDir, filePath.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
