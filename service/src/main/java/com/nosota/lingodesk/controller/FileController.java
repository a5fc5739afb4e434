package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.FileApi;
import com.nosota.lingodesk.api.response.FileAnalysisResponse;
import com.nosota.lingodesk.service.FileAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
@Slf4j
public class FileController implements FileApi {

    private final FileAnalysisService fileAnalysisService;

    @Override
    public ResponseEntity<FileAnalysisResponse> upload(MultipartFile file) {
        FileAnalysisResponse analysis = fileAnalysisService.analyze(file);
        log.info("File analyzed: fileName={}, format={}, characters={}",
                analysis.fileName(), analysis.fileFormat(), analysis.characterCount());
        return ResponseEntity.ok(analysis);
    }
}
