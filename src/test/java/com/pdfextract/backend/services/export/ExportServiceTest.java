package com.pdfextract.backend.services.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pdfextract.backend.config.StorageProperties;
import com.pdfextract.backend.dto.ExportFileDTO;
import com.pdfextract.backend.dto.ExportInfoDTO;
import com.pdfextract.backend.entities.ExtractionJob;
import com.pdfextract.backend.exceptions.ResourceNotFoundException;
import com.pdfextract.backend.repositories.InMemoryJobStore;
import com.pdfextract.backend.repositories.JobStore;
import com.pdfextract.backend.services.consolidation.ConsolidatedTable;
import com.pdfextract.backend.services.consolidation.SummaryStatistics;

class ExportServiceTest {

    @TempDir
    Path outputDir;

    private JobStore jobStore;
    private SpreadsheetGenerator generator;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        StorageProperties props = new StorageProperties();
        props.setOutputDir(outputDir.toString());
        jobStore = new InMemoryJobStore();
        generator = new SpreadsheetGenerator(props);
        exportService = new ExportService(jobStore, props);
    }

    private void jobWithOutput(String jobId, Path outputPath) {
        ExtractionJob job = new ExtractionJob();
        job.setId(jobId);
        job.setOutputPath(outputPath == null ? null : outputPath.toString());
        jobStore.create(job);
    }

    private Path workbook(String jobId) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("filename", "a.pdf");
        row.put("supplier_name", "ACME, Inc.");
        row.put("total_amount", new BigDecimal("120.5"));
        ConsolidatedTable table = new ConsolidatedTable(List.of("filename", "supplier_name", "total_amount"), List.of(row));
        SummaryStatistics stats = new SummaryStatistics(1, table.columns(), Map.of(), Map.of());
        return generator.generate(table, jobId + "_results", true, stats);
    }

    @Test
    void download_unknownJob_isNotFound() {
        assertThatThrownBy(() -> exportService.download("job_missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void download_jobWithoutOutput_isNotFound() {
        jobWithOutput("job_1", null);

        assertThatThrownBy(() -> exportService.download("job_1"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("No output file available");
    }

    @Test
    void download_outputDeletedFromDisk_isNotFound() {
        jobWithOutput("job_1", outputDir.resolve("gone.xlsx"));

        assertThatThrownBy(() -> exportService.download("job_1"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Output file not found");
    }

    @Test
    void downloadCsv_convertsDataSheet_andReusesCachedFile() throws Exception {
        Path xlsx = workbook("job_2");
        jobWithOutput("job_2", xlsx);

        Path csv = exportService.downloadCsv("job_2");

        assertThat(csv).isEqualTo(outputDir.toAbsolutePath().normalize().resolve("job_2_results.csv"));
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertThat(lines).containsExactly("filename,supplier_name,total_amount", "a.pdf,\"ACME, Inc.\",120.5");

        Files.writeString(csv, "cached");
        assertThat(Files.readString(exportService.downloadCsv("job_2"))).isEqualTo("cached");
    }

    @Test
    void info_describesAvailableExport() {
        Path xlsx = workbook("job_3");
        jobWithOutput("job_3", xlsx);

        ExportInfoDTO info = exportService.info("job_3");

        assertThat(info.isAvailable()).isTrue();
        assertThat(info.getFilename()).isEqualTo("job_3_results.xlsx");
        assertThat(info.getFormat()).isEqualTo("xlsx");
        assertThat(info.getFileSize()).isPositive();
        assertThat(info.getDownloadUrl()).isEqualTo("/api/export/download/job_3");
        assertThat(info.getCsvDownloadUrl()).isEqualTo("/api/export/download/job_3/csv");
    }

    @Test
    void info_withoutOutput_isUnavailable() {
        jobWithOutput("job_4", null);

        ExportInfoDTO info = exportService.info("job_4");

        assertThat(info.isAvailable()).isFalse();
        assertThat(info.getMessage()).isEqualTo("No export file available");
    }

    @Test
    void list_returnsWorkbooksWithJobIds() {
        workbook("job_5");
        workbook("job_6");

        List<ExportFileDTO> exports = exportService.list();

        assertThat(exports).extracting(ExportFileDTO::getJobId).containsExactlyInAnyOrder("job_5", "job_6");
        assertThat(exports).allSatisfy(e -> assertThat(e.getFilename()).endsWith("_results.xlsx"));
    }

    @Test
    void deleteArtifacts_removesWorkbookAndCsv() {
        Path xlsx = workbook("job_7");
        jobWithOutput("job_7", xlsx);
        Path csv = exportService.downloadCsv("job_7");

        exportService.deleteArtifacts(xlsx.toString());

        assertThat(Files.exists(xlsx)).isFalse();
        assertThat(Files.exists(csv)).isFalse();
    }
}
