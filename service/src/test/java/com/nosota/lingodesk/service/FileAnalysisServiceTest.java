package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.response.FileAnalysisResponse;
import com.nosota.lingodesk.error.UnsupportedUploadException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileAnalysisServiceTest {

    private final FileAnalysisService service = new FileAnalysisService(new ContentClassifier());

    @Test
    void derivesCountsFromFileSize() {
        byte[] content = "a".repeat(1000).getBytes(StandardCharsets.US_ASCII);
        MockMultipartFile file = new MockMultipartFile("file", "report.txt", "text/plain", content);

        FileAnalysisResponse analysis = service.analyze(file);

        assertThat(analysis.fileName()).isEqualTo("report.txt");
        assertThat(analysis.fileFormat()).isEqualTo("TXT");
        assertThat(analysis.fileSize()).isEqualTo(1000);
        assertThat(analysis.wordCount()).isEqualTo(100);
        assertThat(analysis.characterCount()).isEqualTo(500);
        assertThat(analysis.imagesWithText()).isBetween(0, 2);
        assertThat(analysis.subjectMatter()).isEqualTo(ContentClassifier.GENERAL_CONTENT);
    }

    @Test
    void fileWithoutExtensionIsUnknownFormat() {
        MockMultipartFile file = new MockMultipartFile("file", "README", "text/plain", new byte[25]);

        assertThat(service.analyze(file).fileFormat()).isEqualTo("UNKNOWN");
    }

    @Test
    void analyzesFirstSupportedArchiveEntry() throws IOException {
        byte[] manual = ("The software runs on a server and the database is in the cloud. "
                + "x".repeat(1936)).getBytes(StandardCharsets.US_ASCII);
        byte[] archive = zip(
                new Entry("__MACOSX/._manual.docx", new byte[10]),
                new Entry(".hidden.txt", new byte[10]),
                new Entry("folder/", null),
                new Entry("images/logo.png", new byte[300]),
                new Entry("docs/manual.txt", manual),
                new Entry("notes.pdf", new byte[50]));
        MockMultipartFile file = new MockMultipartFile("file", "bundle.zip", "application/zip", archive);

        FileAnalysisResponse analysis = service.analyze(file);

        assertThat(manual).hasSize(2000);
        assertThat(analysis.fileName()).isEqualTo("bundle.zip (analyzing manual.txt)");
        assertThat(analysis.fileFormat()).isEqualTo("ZIP (2 files)");
        assertThat(analysis.fileSize()).isEqualTo(archive.length);
        assertThat(analysis.wordCount()).isEqualTo(200);
        assertThat(analysis.characterCount()).isEqualTo(1000);
        assertThat(analysis.subjectMatter()).isEqualTo("Technical/IT");
        assertThat(analysis.sourceLanguage()).isEqualTo("English");
    }

    @Test
    void singleEntryArchiveUsesSingularLabel() throws IOException {
        byte[] archive = zip(new Entry("page.html", new byte[40]));
        MockMultipartFile file = new MockMultipartFile("file", "site.zip", "application/zip", archive);

        assertThat(service.analyze(file).fileFormat()).isEqualTo("ZIP (1 file)");
    }

    @Test
    void archiveWithoutSupportedEntriesIsRejected() throws IOException {
        byte[] archive = zip(new Entry("images/logo.png", new byte[300]), new Entry("__MACOSX/notes.txt", new byte[5]));
        MockMultipartFile file = new MockMultipartFile("file", "images.zip", "application/zip", archive);

        assertThatThrownBy(() -> service.analyze(file))
                .isInstanceOf(UnsupportedUploadException.class)
                .hasMessageContaining("No analyzable files");
    }

    @Test
    void emptyUploadIsRejected() {
        MockMultipartFile file = new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0]);

        assertThatThrownBy(() -> service.analyze(file)).isInstanceOf(UnsupportedUploadException.class);
    }

    private record Entry(String name, byte[] content) {
    }

    private static byte[] zip(Entry... entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Entry entry : entries) {
                zip.putNextEntry(new ZipEntry(entry.name()));
                if (entry.content() != null) {
                    zip.write(entry.content());
                }
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }
}
