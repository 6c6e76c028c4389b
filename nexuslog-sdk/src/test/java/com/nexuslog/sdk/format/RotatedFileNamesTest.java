package com.nexuslog.sdk.format;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RotatedFileNamesTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    @Test
    void insertsDateBetweenStemAndExtension() {
        assertEquals(Paths.get("app_20240115.log"), RotatedFileNames.forDate("app.log", DATE));
    }

    @Test
    void keepsParentDirectory() {
        assertEquals(Paths.get("logs", "nested", "app_20240115.txt"),
                RotatedFileNames.forDate(Paths.get("logs", "nested", "app.txt").toString(), DATE));
    }

    @Test
    void onlyLastExtensionCounts() {
        assertEquals(Paths.get("archive.tar_20240115.gz"), RotatedFileNames.forDate("archive.tar.gz", DATE));
    }

    @Test
    void appendsSuffixAndLogExtensionWithoutExtension() {
        String template = Paths.get("logs", "app").toString();
        assertEquals(Paths.get(template + "_20240115.log"), RotatedFileNames.forDate(template, DATE));
    }

    @Test
    void leadingDotIsNotAnExtension() {
        assertEquals(Paths.get(".hidden_20240115.log"), RotatedFileNames.forDate(".hidden", DATE));
    }

    @Test
    void padsMonthAndDay() {
        assertEquals(Paths.get("app_20240305.log"), RotatedFileNames.forDate("app.log", LocalDate.of(2024, 3, 5)));
    }
}
