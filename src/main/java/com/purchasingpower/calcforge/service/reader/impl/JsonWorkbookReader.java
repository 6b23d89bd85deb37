package com.purchasingpower.calcforge.service.reader.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.calcforge.exception.WorkbookReadException;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.reader.WorkbookReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads the JSON (or YAML, by extension) workbook export.
 */
@Slf4j
@Service
public class JsonWorkbookReader implements WorkbookReader {

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public WorkbookStructure read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new WorkbookReadException("Workbook export not found", String.valueOf(path));
        }

        WorkbookStructure workbook;
        try (InputStream in = Files.newInputStream(path)) {
            workbook = mapperFor(path).readValue(in, WorkbookStructure.class);
        } catch (IOException e) {
            throw new WorkbookReadException("Failed to parse workbook export: " + e.getMessage(), path.toString(), e);
        }

        if (workbook == null || workbook.getSheets() == null || workbook.getSheets().isEmpty()) {
            throw new WorkbookReadException("Workbook has no sheets", path.toString());
        }
        if (workbook.getFileName() == null || workbook.getFileName().isBlank()) {
            workbook.setFileName(path.getFileName().toString());
        }

        log.info("Loaded workbook {} ({} sheets, {} named ranges)",
                workbook.getFileName(), workbook.getSheets().size(), workbook.getNamedRanges().size());
        return workbook;
    }

    private ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
    }
}
