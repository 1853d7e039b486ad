package com.pdfextract.backend;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
		"pdfextract.storage.upload-dir=target/test-uploads",
		"pdfextract.storage.output-dir=target/test-outputs",
		"pdfextract.ocr.fallback=none",
		"gemini.api-key=",
		"openai.api-key="
})
class BackendApplicationTests {

	@Test
	void contextLoads() {
	}

}
