package com.example.sectionfinder.service;

import com.example.sectionfinder.service.dto.SearchMode;
import com.example.sectionfinder.service.dto.SimilarSearchRequest;
import com.example.sectionfinder.service.dto.TextMatchRequest;
import com.example.sectionfinder.util.pdf.PdfFixtures;
import com.example.sectionfinder.util.similarity.GroupedPageCache;
import com.example.sectionfinder.util.similarity.NgramTextMatcher;
import com.example.sectionfinder.util.similarity.SectionGrouper;
import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.SimilarityResult;
import com.example.sectionfinder.util.similarity.dto.TextMatch;
import com.example.sectionfinder.util.similarity.scoring.SignatureScorer;
import com.example.sectionfinder.util.similarity.source.ScaledViewportConverter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimilarSectionServiceTest {

    @TempDir
    Path storage;

    private SimilarSectionService service;

    @BeforeEach
    void setUp() {
        service = new SimilarSectionService();
        ReflectionTestUtils.setField(service, "basePath", storage.toString());
        ReflectionTestUtils.setField(service, "renderScale", 1.0f);
        ReflectionTestUtils.setField(service, "batchSize", 5);
        ReflectionTestUtils.setField(service, "sectionGrouper", new SectionGrouper());
        ReflectionTestUtils.setField(service, "signatureScorer", new SignatureScorer());
        ReflectionTestUtils.setField(service, "groupedPageCache", new GroupedPageCache(16));
        ReflectionTestUtils.setField(service, "viewportConverter", new ScaledViewportConverter());
        ReflectionTestUtils.setField(service, "ngramTextMatcher", new NgramTextMatcher());
    }

    /**
     * 两页 PDF：每页左上角一个同版式标题
     */
    private static byte[] twoHeadingPdf() throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PdfFixtures.addPage(document, Standard14Fonts.FontName.HELVETICA, 12, 50, 700, "Section 2.1 Overview");
            PdfFixtures.addPage(document, Standard14Fonts.FontName.HELVETICA, 12, 50, 700, "Section 4.2 Overview");
            document.save(out);
            return out.toByteArray();
        }
    }

    private String upload() throws IOException {
        MockMultipartFile file = new MockMultipartFile("file", "contract.pdf", "application/pdf", twoHeadingPdf());
        return (String) service.uploadPdf(file).get("taskId");
    }

    private static SimilarSearchRequest headingSearch() {
        // 选区紧贴第 1 页标题（基线 y=700，自顶向下约 142；宽约 113）
        NormalizedRect rect = new NormalizedRect(48, 133, 166, 143,
                PDRectangle.A4.getWidth(), PDRectangle.A4.getHeight(), 1);
        SimilarSearchRequest request = new SimilarSearchRequest();
        request.setSelectedText("Section 2.1 Overview");
        request.setSelectedPosition(new NormalizedPosition(1, rect, Collections.singletonList(rect)));
        return request;
    }

    @Test
    void uploadPdf_shouldStoreFileUnderTaskDirectory() throws IOException {
        MockMultipartFile file = new MockMultipartFile("file", "contract.pdf", "application/pdf", new byte[]{1, 2, 3});

        Map<String, Object> result = service.uploadPdf(file);

        String taskId = (String) result.get("taskId");
        assertThat(taskId).hasSize(32);
        Path saved = Paths.get((String) result.get("filePath"));
        assertThat(saved).isEqualTo(storage.resolve(taskId).resolve(taskId + ".pdf").toAbsolutePath());
        assertThat(Files.readAllBytes(saved)).isEqualTo(new byte[]{1, 2, 3});
    }

    @Test
    void search_shouldFindMatchingHeadingOnOtherPage() throws IOException {
        String taskId = upload();

        List<SimilarityResult> results = service.search(taskId, headingSearch());

        assertThat(results).isNotEmpty();
        assertThat(results.get(0).getPosition().getPageNumber()).isEqualTo(2);
        assertThat(results.get(0).getScore()).isGreaterThanOrEqualTo(0.6);
    }

    @Test
    void search_shouldUseTextBackend_whenModeIsText() throws IOException {
        String taskId = upload();
        SimilarSearchRequest request = headingSearch();
        request.setMode(SearchMode.TEXT);

        List<SimilarityResult> results = service.search(taskId, request);

        // 第 2 页措辞不同，n-gram 得分低于 0.8；第 1 页为选区自身
        assertThat(results).isEmpty();
    }

    @Test
    void search_shouldThrowNotFound_forUnknownTask() {
        assertThatThrownBy(() -> service.search("0123456789abcdef0123456789abcdef", headingSearch()))
                .isInstanceOf(FileNotFoundException.class);
        assertThatThrownBy(() -> service.search("../../etc/passwd", headingSearch()))
                .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void search_shouldRejectInvalidOptions() throws IOException {
        String taskId = upload();
        SimilarSearchRequest request = headingSearch();
        request.setMaxResults(0);

        assertThatThrownBy(() -> service.search(taskId, request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textMatch_shouldUseDefaultThreshold() {
        TextMatchRequest request = new TextMatchRequest();
        request.setSearchText("the quick brown fox");
        request.setCorpusText("a lazy dog sleeps while the quick brown fox runs");

        List<TextMatch> matches = service.textMatch(request);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).getStartWordIndex()).isEqualTo(5);
    }
}
