package com.pdfextract.backend.services.upload;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * A PDF kept in the upload directory as {@code <fileId>_<filename>}.
 */
public record UploadedFile(String fileId, String filename, Path path, long fileSize, LocalDateTime uploadTime) {
}
