package com.pdfextract.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI pdfExtractOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PDF Extraction API")
                        .description("Batch extraction of invoices and utility bills into consolidated spreadsheets.")
                        .version("v1")
                )
                .addTagsItem(new Tag().name("upload").description("PDF uploads"))
                .addTagsItem(new Tag().name("extraction").description("Extraction jobs"))
                .addTagsItem(new Tag().name("export").description("Spreadsheet and CSV downloads"));
    }
}
