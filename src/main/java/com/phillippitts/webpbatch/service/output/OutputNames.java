package com.phillippitts.webpbatch.service.output;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assigns WebP file names to the convertible images of a folder.
 *
 * <p>{@code photo.png} becomes {@code photo.webp}. When two sources share a stem
 * ({@code photo.png} and {@code photo.jpg}) the later one keeps its extension in the name
 * ({@code photo_jpg.webp}) so neither output overwrites the other. Names of WebP files that
 * stay in the folder untouched are reserved the same way.
 */
public final class OutputNames {

    private static final String WEBP_SUFFIX = ".webp";

    private OutputNames() {
    }

    public static Map<Path, String> assign(List<Path> sources) {
        return assign(sources, List.of());
    }

    /**
     * @param sources  convertible images in processing order
     * @param reserved files whose names no output may take, e.g. WebP originals left out by skip mode
     * @return output file name per source, in the same order
     */
    public static Map<Path, String> assign(List<Path> sources, List<Path> reserved) {
        Map<Path, String> names = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Path taken : reserved) {
            used.add(taken.getFileName().toString().toLowerCase(Locale.ROOT));
        }
        for (Path source : sources) {
            String fileName = source.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
            String ext = dot > 0 ? fileName.substring(dot + 1) : "";

            String candidate = stem + WEBP_SUFFIX;
            if (!used.add(candidate.toLowerCase(Locale.ROOT))) {
                String base = ext.isEmpty() ? stem : stem + "_" + ext;
                candidate = base + WEBP_SUFFIX;
                int counter = 2;
                while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
                    candidate = base + "_" + counter++ + WEBP_SUFFIX;
                }
            }
            names.put(source, candidate);
        }
        return names;
    }
}
