package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.response.FileAnalysisResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

/**
 * Document upload and analysis.
 */
@RequestMapping("/api/files")
public interface FileApi {

    /**
     * Analyses an uploaded document and returns size-derived estimates.
     *
     * <p>For a ZIP archive the first entry with a supported extension
     * (pdf, docx, xlsx, pptx, txt, html) is analysed instead; 400 if there is none.
     *
     * @param file Multipart part named {@code file}
     * @return Analysis of the document
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<FileAnalysisResponse> upload(@RequestPart(value = "file", required = false) MultipartFile file);
}
