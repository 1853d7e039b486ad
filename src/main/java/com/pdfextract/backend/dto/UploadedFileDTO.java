package com.pdfextract.backend.dto;

import java.time.LocalDateTime;

import com.pdfextract.backend.services.upload.UploadedFile;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UploadedFileDTO {
    private String fileId;
    private String filename;
    private long fileSize;
    private LocalDateTime uploadTime;

    public static UploadedFileDTO from(UploadedFile file) {
        return UploadedFileDTO.builder()
                .fileId(file.fileId())
                .filename(file.filename())
                .fileSize(file.fileSize())
                .uploadTime(file.uploadTime())
                .build();
    }
}
