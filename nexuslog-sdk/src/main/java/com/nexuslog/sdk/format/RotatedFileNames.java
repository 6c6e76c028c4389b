package com.nexuslog.sdk.format;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Derives the dated file a rotating sink writes to.
 *
 * <ul>
 *   <li>{@code logs/app.log} on 2024-01-15 becomes {@code logs/app_20240115.log}</li>
 *   <li>a template without a {@code stem.ext} file name, such as {@code logs/app}, becomes
 *       {@code logs/app_20240115.log}, the suffix appended to the raw template</li>
 * </ul>
 */
public final class RotatedFileNames {

    private static final DateTimeFormatter SUFFIX = DateTimeFormatter.ofPattern("'_'yyyyMMdd");

    private RotatedFileNames() {
        // Prevent instantiation
    }

    public static Path forDate(String template, LocalDate date) {
        String suffix = SUFFIX.format(date);
        Path input = Paths.get(template);
        Path fileName = input.getFileName();
        if (fileName != null) {
            String name = fileName.toString();
            int dot = name.lastIndexOf('.');
            // a leading dot (".hidden") is part of the stem, not an extension
            if (dot > 0) {
                String dated = name.substring(0, dot) + suffix + name.substring(dot);
                Path parent = input.getParent();
                return parent != null ? parent.resolve(dated) : Paths.get(dated);
            }
        }
        return Paths.get(template + suffix + ".log");
    }
}
