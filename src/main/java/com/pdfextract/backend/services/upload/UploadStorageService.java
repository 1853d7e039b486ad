package com.pdfextract.backend.services.upload;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.pdfextract.backend.config.StorageProperties;
import com.pdfextract.backend.exceptions.BadRequestException;
import com.pdfextract.backend.exceptions.ResourceNotFoundException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class UploadStorageService {

    private static final String INVALID_FILENAME_CHARS = "<>:\"/\\|?*";

    private final StorageProperties storageProperties;

    @PostConstruct
    void init() {
        try {
            Files.createDirectories(uploadDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create upload directory " + uploadDir(), e);
        }
    }

    /**
     * Validates the whole batch before anything is written, then stores each file under a fresh id.
     */
    public List<UploadedFile> upload(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new BadRequestException("No files provided");
        }
        if (files.size() > storageProperties.getMaxFilesPerUpload()) {
            throw new BadRequestException("Too many files. Maximum "
                    + storageProperties.getMaxFilesPerUpload() + " files allowed.");
        }
        for (MultipartFile file : files) {
            validate(file);
        }

        List<UploadedFile> stored = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            stored.add(store(file));
        }
        return stored;
    }

    public List<UploadedFile> list() {
        Path dir = uploadDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        try (Stream<Path> paths = Files.list(dir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> hasAllowedExtension(p.getFileName().toString()))
                    .map(this::toUploadedFile)
                    .sorted(Comparator.comparing(UploadedFile::uploadTime).reversed())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list uploaded files", e);
        }
    }

    public UploadedFile resolve(String fileId) {
        return find(fileId).orElseThrow(() -> new ResourceNotFoundException("File not found: " + fileId));
    }

    public void delete(String fileId) {
        UploadedFile file = resolve(fileId);
        try {
            Files.deleteIfExists(file.path());
            log.info("[Upload] Deleted fileId={} path={}", fileId, file.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete file " + fileId, e);
        }
    }

    public Optional<UploadedFile> find(String fileId) {
        if (fileId == null || fileId.isBlank() || fileId.contains("/") || fileId.contains("\\") || fileId.contains("..")) {
            return Optional.empty();
        }
        Path dir = uploadDir();
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }

        String prefix = fileId + "_";
        try (Stream<Path> paths = Files.list(dir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .findFirst()
                    .map(this::toUploadedFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to look up file " + fileId, e);
        }
    }

    /**
     * Drops any path components and replaces {@code < > : " / \ | ? *} with '_'.
     */
    public static String cleanFilename(String filename) {
        if (filename == null) return "";
        String name = filename.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }

        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            sb.append(INVALID_FILENAME_CHARS.indexOf(c) >= 0 ? '_' : c);
        }
        return sb.toString().trim();
    }

    private void validate(MultipartFile file) {
        String original = file.getOriginalFilename() != null ? file.getOriginalFilename() : "";
        if (!hasAllowedExtension(original)) {
            throw new BadRequestException("Invalid file type: " + original + ". Allowed: "
                    + String.join(", ", storageProperties.getAllowedExtensionList()));
        }
        if (file.getSize() > storageProperties.getMaxUploadSizeBytes()) {
            throw new BadRequestException("File too large: " + original + ". Maximum size is "
                    + storageProperties.getMaxUploadSizeMb() + "MB.");
        }
        if (file.isEmpty()) {
            throw new BadRequestException("Empty file: " + original);
        }
    }

    private UploadedFile store(MultipartFile file) {
        String fileId = UUID.randomUUID().toString();
        String cleanName = cleanFilename(file.getOriginalFilename());
        Path target = uploadDir().resolve(fileId + "_" + cleanName);

        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store " + cleanName, e);
        }

        log.info("[Upload] Stored {} ({} bytes) fileId={}", cleanName, file.getSize(), fileId);
        return new UploadedFile(fileId, cleanName, target, file.getSize(), LocalDateTime.now());
    }

    private UploadedFile toUploadedFile(Path path) {
        String name = path.getFileName().toString();
        int sep = name.indexOf('_');
        String fileId = sep > 0 ? name.substring(0, sep) : stripExtension(name);
        String filename = sep > 0 ? name.substring(sep + 1) : name;

        try {
            LocalDateTime modified = LocalDateTime.ofInstant(Files.getLastModifiedTime(path).toInstant(), ZoneId.systemDefault());
            return new UploadedFile(fileId, filename, path, Files.size(path), modified);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + path, e);
        }
    }

    private boolean hasAllowedExtension(String filename) {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        return storageProperties.getAllowedExtensionList().stream().anyMatch(lower::endsWith);
    }

    private Path uploadDir() {
        return Paths.get(storageProperties.getUploadDir()).toAbsolutePath().normalize();
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
