package com.pdfextract.backend.services.export;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import com.pdfextract.backend.config.StorageProperties;
import com.pdfextract.backend.dto.ExportFileDTO;
import com.pdfextract.backend.dto.ExportInfoDTO;
import com.pdfextract.backend.entities.ExtractionJob;
import com.pdfextract.backend.exceptions.ResourceNotFoundException;
import com.pdfextract.backend.repositories.JobStore;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves generated workbooks and the CSV derived from their data sheet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportService {

    static final String XLSX = ".xlsx";
    static final String CSV = ".csv";
    static final String RESULTS_SUFFIX = "_results";

    private final JobStore jobStore;
    private final StorageProperties storageProperties;

    public Path download(String jobId) {
        Path xlsx = outputPathOf(jobId);
        if (!Files.isRegularFile(xlsx)) {
            throw new ResourceNotFoundException("Output file not found");
        }
        log.info("[Export] Serving download jobId={} path={}", jobId, xlsx);
        return xlsx;
    }

    /**
     * CSV next to the workbook; built from the data sheet on first request and reused afterwards.
     */
    public Path downloadCsv(String jobId) {
        Path xlsx = download(jobId);
        Path csv = csvPathFor(xlsx);
        if (Files.isRegularFile(csv)) {
            return csv;
        }

        convertToCsv(xlsx, csv);
        log.info("[Export] Converted {} to {}", xlsx.getFileName(), csv.getFileName());
        return csv;
    }

    public ExportInfoDTO info(String jobId) {
        ExtractionJob job = jobStore.get(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));

        if (job.getOutputPath() == null || job.getOutputPath().isBlank()) {
            return ExportInfoDTO.builder().available(false).message("No export file available").build();
        }
        Path xlsx = Paths.get(job.getOutputPath());
        if (!Files.isRegularFile(xlsx)) {
            return ExportInfoDTO.builder().available(false).message("Export file not found").build();
        }

        return ExportInfoDTO.builder()
                .available(true)
                .jobId(jobId)
                .filename(xlsx.getFileName().toString())
                .fileSize(sizeOf(xlsx))
                .format("xlsx")
                .downloadUrl("/api/export/download/" + jobId)
                .csvDownloadUrl("/api/export/download/" + jobId + "/csv")
                .build();
    }

    /**
     * All workbooks in the output directory, newest first.
     */
    public List<ExportFileDTO> list() {
        Path dir = Paths.get(storageProperties.getOutputDir()).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        List<ExportFileDTO> exports = new ArrayList<>();
        try (Stream<Path> paths = Files.list(dir)) {
            paths.filter(p -> p.getFileName().toString().endsWith(XLSX))
                    .filter(Files::isRegularFile)
                    .forEach(p -> {
                        String stem = p.getFileName().toString();
                        stem = stem.substring(0, stem.length() - XLSX.length());
                        String jobId = stem.endsWith(RESULTS_SUFFIX)
                                ? stem.substring(0, stem.length() - RESULTS_SUFFIX.length())
                                : stem;
                        exports.add(ExportFileDTO.builder()
                                .filename(p.getFileName().toString())
                                .jobId(jobId)
                                .fileSize(sizeOf(p))
                                .createdAt(modifiedAt(p))
                                .downloadUrl("/api/export/download/" + jobId)
                                .build());
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list exports", e);
        }

        exports.sort(Comparator.comparing(ExportFileDTO::getCreatedAt).reversed());
        return exports;
    }

    /**
     * Removes the workbook and its cached CSV, if any.
     */
    public void deleteArtifacts(String outputPath) {
        if (outputPath == null || outputPath.isBlank()) return;
        Path xlsx = Paths.get(outputPath);
        try {
            Files.deleteIfExists(xlsx);
            Files.deleteIfExists(csvPathFor(xlsx));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete output " + xlsx.getFileName(), e);
        }
    }

    static Path csvPathFor(Path xlsx) {
        String name = xlsx.getFileName().toString();
        String stem = name.endsWith(XLSX) ? name.substring(0, name.length() - XLSX.length()) : name;
        return xlsx.resolveSibling(stem + CSV);
    }

    private Path outputPathOf(String jobId) {
        ExtractionJob job = jobStore.get(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
        if (job.getOutputPath() == null || job.getOutputPath().isBlank()) {
            throw new ResourceNotFoundException(
                    "No output file available. Job may not have completed or consolidation was disabled.");
        }
        return Paths.get(job.getOutputPath());
    }

    private void convertToCsv(Path xlsx, Path csv) {
        DataFormatter formatter = new DataFormatter();
        try (InputStream in = Files.newInputStream(xlsx);
             Workbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet(SpreadsheetGenerator.DATA_SHEET);
            if (sheet == null) {
                sheet = workbook.getSheetAt(0);
            }

            int width = sheet.getRow(sheet.getFirstRowNum()) == null ? 0 : sheet.getRow(sheet.getFirstRowNum()).getLastCellNum();
            CsvWriterSettings settings = new CsvWriterSettings();
            settings.getFormat().setLineSeparator("\n");

            // A failed conversion must not leave a cached CSV behind.
            Path partial = csv.resolveSibling(csv.getFileName() + ".part");
            try (Writer writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
                CsvWriter csvWriter = new CsvWriter(writer, settings);
                for (Row row : sheet) {
                    String[] values = new String[Math.max(width, 0)];
                    for (int c = 0; c < values.length; c++) {
                        Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                        values[c] = cell == null ? "" : formatter.formatCellValue(cell);
                    }
                    csvWriter.writeRow((Object[]) values);
                }
                csvWriter.close();
            }
            Files.move(partial, csv, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new SpreadsheetExportException("Failed to convert " + xlsx.getFileName() + " to CSV", e);
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + path, e);
        }
    }

    private static LocalDateTime modifiedAt(Path path) {
        try {
            return LocalDateTime.ofInstant(Files.getLastModifiedTime(path).toInstant(), ZoneId.systemDefault());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + path, e);
        }
    }
}
