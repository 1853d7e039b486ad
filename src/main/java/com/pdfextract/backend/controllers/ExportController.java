package com.pdfextract.backend.controllers;

import java.nio.file.Path;
import java.util.List;

import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.pdfextract.backend.dto.ApiResponse;
import com.pdfextract.backend.dto.ExportFileDTO;
import com.pdfextract.backend.dto.ExportInfoDTO;
import com.pdfextract.backend.services.export.ExportService;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
@Tag(name = "export")
public class ExportController {

    static final MediaType XLSX = MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    static final MediaType CSV = MediaType.parseMediaType("text/csv");

    private final ExportService exportService;

    @GetMapping("/download/{jobId}")
    public ResponseEntity<Resource> download(@PathVariable String jobId) {
        return attachment(exportService.download(jobId), XLSX);
    }

    @GetMapping("/download/{jobId}/csv")
    public ResponseEntity<Resource> downloadCsv(@PathVariable String jobId) {
        return attachment(exportService.downloadCsv(jobId), CSV);
    }

    @GetMapping("/info/{jobId}")
    public ResponseEntity<ApiResponse<ExportInfoDTO>> info(@PathVariable String jobId) {
        ExportInfoDTO info = exportService.info(jobId);
        return ResponseEntity.ok(ApiResponse.success(info, info.isAvailable() ? "Export available" : info.getMessage()));
    }

    @GetMapping("/list")
    public ResponseEntity<ApiResponse<List<ExportFileDTO>>> list() {
        List<ExportFileDTO> exports = exportService.list();
        return ResponseEntity.ok(ApiResponse.success(exports, exports.size() + " export(s)"));
    }

    private static ResponseEntity<Resource> attachment(Path file, MediaType type) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(file.getFileName().toString())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(type)
                .body(new FileSystemResource(file));
    }
}
