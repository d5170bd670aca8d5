package com.gridintel.generation.output;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared CSV plumbing. Tables are written as UTF-8 with a BOM so they open
 * cleanly in spreadsheet tools; readers strip it again.
 */
public final class CsvFiles {

    public static final char BOM = '\uFEFF';

    private CsvFiles() {
    }

    public static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == BOM) {
            return value.substring(1);
        }
        return value;
    }

    /** Writer for a brand-new file (BOM first). */
    public static CSVWriter newWriter(Path path) throws IOException {
        OutputStream out = Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        OutputStreamWriter writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        writer.write(BOM);
        return csvWriter(writer);
    }

    /** Writer that appends; writes the BOM only when the file is new or empty. */
    public static CSVWriter appendingWriter(Path path) throws IOException {
        boolean fresh = !Files.exists(path) || Files.size(path) == 0;
        OutputStream out = Files.newOutputStream(path,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        OutputStreamWriter writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        if (fresh) writer.write(BOM);
        return csvWriter(writer);
    }

    public static boolean isNewOrEmpty(Path path) throws IOException {
        return !Files.exists(path) || Files.size(path) == 0;
    }

    /**
     * Reads a headed CSV into one map per row, keyed by header name.
     * Missing trailing cells are absent from the row's map.
     */
    public static List<Map<String, String>> readRecords(Path path) {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            String[] header = reader.readNext();
            if (header == null) return List.of();
            if (header.length > 0) header[0] = stripBom(header[0]);

            List<Map<String, String>> records = new ArrayList<>();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                Map<String, String> named = new LinkedHashMap<>();
                for (int i = 0; i < header.length && i < row.length; i++) {
                    named.put(header[i].trim(), row[i]);
                }
                records.add(named);
            }
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Corrupt CSV " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replace {@code target} with {@code tmp}, atomically where the filesystem allows.
     */
    public static void replace(Path tmp, Path target) {
        try {
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot replace " + target, e);
        }
    }

    public static void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory: " + dir, e);
        }
    }

    private static CSVWriter csvWriter(OutputStreamWriter writer) {
        return new CSVWriter(writer,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
    }
}
