package com.nosota.lingodesk.api.response;

/**
 * Size-derived analysis of an uploaded document. Counts are estimates,
 * the document content is not parsed.
 */
public record FileAnalysisResponse(
        String fileName,
        String fileFormat,
        long fileSize,
        long wordCount,
        long characterCount,
        int imagesWithText,
        String subjectMatter,
        String sourceLanguage
) {
}
