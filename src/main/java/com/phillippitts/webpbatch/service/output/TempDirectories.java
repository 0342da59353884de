package com.phillippitts.webpbatch.service.output;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * File-system helpers for the per-folder temporary output directory.
 */
public final class TempDirectories {

    private TempDirectories() {
    }

    /**
     * Creates an empty directory, deleting whatever a previous run left behind at that path.
     *
     * @param dir directory to prepare
     * @throws IOException if the old content cannot be removed or the directory cannot be created
     */
    public static void prepare(Path dir) throws IOException {
        deleteRecursively(dir);
        Files.createDirectories(dir);
    }

    /**
     * Deletes a directory tree. A missing directory is not an error.
     *
     * @param dir directory to delete
     * @throws IOException if any entry cannot be deleted
     */
    public static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
