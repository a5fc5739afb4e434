package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.response.FileAnalysisResponse;
import com.nosota.lingodesk.error.UnsupportedUploadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Size-derived analysis of an uploaded document.
 *
 * <p>No real parsing happens: word and character counts are estimated from the byte size
 * ({@code size / 10} and {@code size / 2}), the number of images containing text is a random
 * value in {@code [0, 3)}, and language and subject are guessed by {@link ContentClassifier}
 * from the first 5000 characters.
 *
 * <p>A ZIP archive is analysed through its first supported entry, skipping directories,
 * {@code __MACOSX} metadata and hidden files.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileAnalysisService {

    static final Set<String> SUPPORTED_ARCHIVE_ENTRIES = Set.of("pdf", "docx", "xlsx", "pptx", "txt", "html");
    static final int SAMPLE_CHARACTERS = 5000;
    // worst case four bytes per character
    private static final int SAMPLE_BYTES = SAMPLE_CHARACTERS * 4;

    private final ContentClassifier contentClassifier;

    public FileAnalysisResponse analyze(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new UnsupportedUploadException("No file uploaded");
        }
        String originalName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        String extension = extensionOf(originalName);

        try {
            if ("zip".equals(extension)) {
                return analyzeArchive(originalName, file.getSize(), file.getInputStream());
            }
            return analyzeDocument(originalName, extension, file.getSize(), file.getBytes());
        } catch (IOException e) {
            throw new UnsupportedUploadException("Error processing uploaded file", e);
        }
    }

    FileAnalysisResponse analyzeDocument(String fileName, String extension, long size, byte[] content) {
        String sample = sample(content, content.length);
        log.debug("Analyzing document: fileName={}, size={}", fileName, size);

        return new FileAnalysisResponse(
                fileName,
                extension.isEmpty() ? "UNKNOWN" : extension.toUpperCase(Locale.ROOT),
                size,
                size / 10,
                size / 2,
                randomImageCount(),
                contentClassifier.detectSubjectMatter(sample),
                contentClassifier.detectLanguage(sample)
        );
    }

    FileAnalysisResponse analyzeArchive(String archiveName, long archiveSize, InputStream archive) throws IOException {
        List<String> supportedEntries = new ArrayList<>();
        String analyzedEntry = null;
        long analyzedSize = 0;
        byte[] analyzedSample = new byte[0];

        try (ZipInputStream zip = new ZipInputStream(archive)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String baseName = baseName(entry.getName());
                if (!isAnalyzable(entry, baseName)) {
                    continue;
                }
                supportedEntries.add(baseName);

                if (analyzedEntry == null) {
                    analyzedEntry = baseName;
                    ByteArrayOutputStream head = new ByteArrayOutputStream();
                    analyzedSize = drain(zip, head);
                    analyzedSample = head.toByteArray();
                }
            }
        }

        if (analyzedEntry == null) {
            throw new UnsupportedUploadException("No analyzable files found in the ZIP archive. "
                    + "Please include PDF, DOCX, XLSX, PPTX, TXT, or HTML files.");
        }
        log.debug("ZIP {} contains {} analyzable file(s), analyzing {}", archiveName, supportedEntries.size(), analyzedEntry);

        String sample = sample(analyzedSample, analyzedSample.length);
        int count = supportedEntries.size();
        return new FileAnalysisResponse(
                archiveName + " (analyzing " + analyzedEntry + ")",
                "ZIP (" + count + (count == 1 ? " file)" : " files)"),
                archiveSize,
                analyzedSize / 10,
                analyzedSize / 2,
                randomImageCount(),
                contentClassifier.detectSubjectMatter(sample),
                contentClassifier.detectLanguage(sample)
        );
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && dot < fileName.length() - 1
                ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT)
                : "";
    }

    private static boolean isAnalyzable(ZipEntry entry, String baseName) {
        String path = entry.getName();
        if (entry.isDirectory() || path.startsWith("__MACOSX") || path.startsWith(".")) {
            return false;
        }
        return SUPPORTED_ARCHIVE_ENTRIES.contains(extensionOf(baseName));
    }

    private static String baseName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Reads the current entry to its end, keeping only the first {@link #SAMPLE_BYTES} bytes.
     *
     * @return uncompressed size of the entry
     */
    private static long drain(InputStream in, ByteArrayOutputStream head) throws IOException {
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            int keep = (int) Math.min(read, Math.max(0, SAMPLE_BYTES - total));
            if (keep > 0) {
                head.write(buffer, 0, keep);
            }
            total += read;
        }
        return total;
    }

    private static String sample(byte[] content, int length) {
        String text = new String(content, 0, Math.min(length, SAMPLE_BYTES), StandardCharsets.UTF_8);
        return text.length() > SAMPLE_CHARACTERS ? text.substring(0, SAMPLE_CHARACTERS) : text;
    }

    private static int randomImageCount() {
        return ThreadLocalRandom.current().nextInt(3);
    }
}
