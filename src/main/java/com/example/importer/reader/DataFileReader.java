package com.example.importer.reader;

import com.example.importer.model.DataFile;
import com.example.importer.model.FileFormat;

import java.nio.file.Path;

public interface DataFileReader {

    boolean supports(FileFormat format);

    DataFile read(Path path, FileFormat format);
}
