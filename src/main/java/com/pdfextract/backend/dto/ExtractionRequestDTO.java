package com.pdfextract.backend.dto;

import java.util.ArrayList;
import java.util.List;

import com.pdfextract.backend.enums.DocumentType;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class ExtractionRequestDTO {

    @NotEmpty(message = "No file IDs provided")
    private List<String> fileIds = new ArrayList<>();

    // "unknown" asks for auto-detection per document
    private DocumentType documentType = DocumentType.INVOICE;

    private List<String> customFields;

    private boolean consolidate = true;
}
