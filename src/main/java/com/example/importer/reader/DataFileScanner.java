package com.example.importer.reader;

import com.example.importer.model.DataFile;
import com.example.importer.model.FileFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists importable files of a data folder and routes each one to the reader for its format.
 */
@Slf4j
public class DataFileScanner {

    private final List<DataFileReader> readers;
    private final Set<String> extensions;

    public DataFileScanner(List<DataFileReader> readers, Set<String> extensions) {
        this.readers = readers;
        this.extensions = extensions.stream()
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Importable files ordered by last-modified time, then by name. Office lock files ({@code ~$*}) are skipped.
     */
    public List<Path> scan(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Data folder does not exist: " + folder);
        }
        try (Stream<Path> paths = Files.walk(folder)) {
            List<Path> files = paths.filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().startsWith("~$"))
                    .filter(path -> formatOf(path).isPresent())
                    .sorted(Comparator.comparing(DataFileScanner::lastModified).thenComparing(Path::toString))
                    .collect(Collectors.toList());
            log.info("Found {} data files in {}", files.size(), folder);
            return files;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list data folder " + folder, e);
        }
    }

    public DataFile read(Path path) {
        FileFormat format = formatOf(path)
                .orElseThrow(() -> new FileReadException("Unsupported file type: " + path));
        return readers.stream()
                .filter(reader -> reader.supports(format))
                .findFirst()
                .orElseThrow(() -> new FileReadException("No reader registered for " + format + ": " + path))
                .read(path, format);
    }

    public Optional<FileFormat> formatOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!extensions.contains(extension)) {
            return Optional.empty();
        }
        return FileFormat.fromExtension(extension);
    }

    public static String stemOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }
    }
}
