package com.pdfextract.backend.controllers;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.pdfextract.backend.dto.ApiResponse;
import com.pdfextract.backend.dto.UploadedFileDTO;
import com.pdfextract.backend.services.upload.UploadStorageService;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/upload")
@RequiredArgsConstructor
@Tag(name = "upload")
public class UploadController {

    private final UploadStorageService uploadStorageService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<List<UploadedFileDTO>>> upload(@RequestParam("files") List<MultipartFile> files) {
        List<UploadedFileDTO> uploaded = uploadStorageService.upload(files).stream()
                .map(UploadedFileDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(uploaded, "Successfully uploaded " + uploaded.size() + " file(s)"));
    }

    @GetMapping("/list")
    public ResponseEntity<ApiResponse<List<UploadedFileDTO>>> list() {
        List<UploadedFileDTO> files = uploadStorageService.list().stream()
                .map(UploadedFileDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(files, files.size() + " file(s)"));
    }

    @DeleteMapping("/{fileId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String fileId) {
        uploadStorageService.delete(fileId);
        return ResponseEntity.ok(ApiResponse.done("File deleted successfully"));
    }
}
