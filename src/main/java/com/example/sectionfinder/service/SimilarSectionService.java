package com.example.sectionfinder.service;

import com.example.sectionfinder.service.dto.SearchMode;
import com.example.sectionfinder.service.dto.SimilarSearchRequest;
import com.example.sectionfinder.service.dto.TextMatchRequest;
import com.example.sectionfinder.util.pdf.PdfBoxDocumentInfo;
import com.example.sectionfinder.util.pdf.PdfBoxFragmentSource;
import com.example.sectionfinder.util.similarity.GroupedPageCache;
import com.example.sectionfinder.util.similarity.NgramSectionFinder;
import com.example.sectionfinder.util.similarity.NgramTextMatcher;
import com.example.sectionfinder.util.similarity.SearchOptions;
import com.example.sectionfinder.util.similarity.SectionGrouper;
import com.example.sectionfinder.util.similarity.SimilarSectionFinder;
import com.example.sectionfinder.util.similarity.SimilarityBackend;
import com.example.sectionfinder.util.similarity.dto.SimilarityResult;
import com.example.sectionfinder.util.similarity.dto.TextMatch;
import com.example.sectionfinder.util.similarity.scoring.SignatureScorer;
import com.example.sectionfinder.util.similarity.source.ViewportConverter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 相似区段搜索服务
 * 负责PDF的保存、加载，以及按模式选择搜索后端
 */
@Slf4j
@Service
public class SimilarSectionService {

    private static final Pattern TASK_ID_PATTERN = Pattern.compile("[0-9a-fA-F]{32}");

    /**
     * 数据存储基础目录
     */
    @Value("${section-finder.storage.base-path:/data/section_finder}")
    private String basePath;

    /**
     * PDF 点到视口像素的缩放
     */
    @Value("${section-finder.render-scale:1.0}")
    private float renderScale;

    @Value("${section-finder.extraction.batch-size:5}")
    private int batchSize;

    @Autowired
    private SectionGrouper sectionGrouper;

    @Autowired
    private SignatureScorer signatureScorer;

    @Autowired
    private GroupedPageCache groupedPageCache;

    @Autowired
    private ViewportConverter viewportConverter;

    @Autowired
    private NgramTextMatcher ngramTextMatcher;

    /**
     * 上传并保存PDF文件
     *
     * @param file PDF文件
     * @return 包含taskId、filePath的Map
     * @throws IOException 文件保存异常
     */
    public Map<String, Object> uploadPdf(MultipartFile file) throws IOException {
        Map<String, Object> result = new HashMap<>();

        String taskId = UUID.randomUUID().toString().replace("-", "");

        File taskDir = new File(basePath, taskId);
        if (!taskDir.exists()) {
            boolean created = taskDir.mkdirs();
            log.info("创建任务目录: {}, 结果: {}", taskDir.getAbsolutePath(), created);
        }

        File savedFile = new File(taskDir, taskId + ".pdf");
        try (InputStream is = file.getInputStream();
             OutputStream os = Files.newOutputStream(savedFile.toPath())) {
            byte[] buffer = new byte[8192];
            int bytesRead;
            while ((bytesRead = is.read(buffer)) != -1) {
                os.write(buffer, 0, bytesRead);
            }
        }

        log.info("文件保存成功: {}", savedFile.getAbsolutePath());

        result.put("taskId", taskId);
        result.put("filePath", savedFile.getAbsolutePath());
        return result;
    }

    /**
     * 在任务PDF中搜索与选区相似的区段
     *
     * @param taskId 任务ID
     * @param request 搜索请求
     * @return 按得分降序的结果
     * @throws FileNotFoundException 任务不存在
     * @throws IOException PDF读取失败
     * @throws IllegalArgumentException 搜索参数越界
     */
    public List<SimilarityResult> search(String taskId, SimilarSearchRequest request) throws IOException {
        File pdfFile = resolvePdf(taskId);
        SearchMode mode = request.getMode() == null ? SearchMode.LAYOUT : request.getMode();
        SearchOptions options = toOptions(request, mode);
        options.validate();

        long start = System.currentTimeMillis();
        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            PdfBoxDocumentInfo documentInfo = new PdfBoxDocumentInfo(document, renderScale);
            PdfBoxFragmentSource fragmentSource = new PdfBoxFragmentSource(document, renderScale);

            SimilarityBackend backend = createBackend(mode, documentInfo, fragmentSource);
            List<SimilarityResult> results = backend.findSimilarSections(options);

            log.info("任务 {} 搜索完成: mode={}, 结果 {} 条, 耗时 {} ms",
                    taskId, mode, results.size(), System.currentTimeMillis() - start);
            return results;
        }
    }

    /**
     * 纯文本相似匹配（不涉及PDF）
     */
    public List<TextMatch> textMatch(TextMatchRequest request) {
        double threshold = request.getThreshold() == null
                ? NgramTextMatcher.DEFAULT_THRESHOLD : request.getThreshold();
        return ngramTextMatcher.findSimilarText(request.getSearchText(), request.getCorpusText(), threshold);
    }

    private SimilarityBackend createBackend(SearchMode mode, PdfBoxDocumentInfo documentInfo,
                                            PdfBoxFragmentSource fragmentSource) {
        if (mode == SearchMode.TEXT) {
            return new NgramSectionFinder(documentInfo, fragmentSource, viewportConverter, ngramTextMatcher);
        }
        // PDFBox 文档非线程安全，在调用线程内逐页提取
        return new SimilarSectionFinder(documentInfo, fragmentSource, viewportConverter, sectionGrouper,
                signatureScorer, groupedPageCache, Runnable::run, batchSize);
    }

    private SearchOptions toOptions(SimilarSearchRequest request, SearchMode mode) {
        double defaultThreshold = mode == SearchMode.TEXT
                ? NgramTextMatcher.DEFAULT_THRESHOLD : SearchOptions.DEFAULT_THRESHOLD;

        return SearchOptions.builder()
                .selectedText(request.getSelectedText())
                .selectedPosition(request.getSelectedPosition())
                .threshold(request.getThreshold() == null ? defaultThreshold : request.getThreshold())
                .maxResults(request.getMaxResults() == null ? SearchOptions.DEFAULT_MAX_RESULTS : request.getMaxResults())
                .maxPages(request.getMaxPages() == null ? SearchOptions.DEFAULT_MAX_PAGES : request.getMaxPages())
                .progressListener((current, total, found) ->
                        log.debug("搜索进度: {}/{}, 已找到 {}", current, total, found))
                .build();
    }

    private File resolvePdf(String taskId) throws FileNotFoundException {
        if (taskId == null || !TASK_ID_PATTERN.matcher(taskId).matches()) {
            throw new FileNotFoundException("任务不存在: " + taskId);
        }
        File pdfFile = new File(new File(basePath, taskId), taskId + ".pdf");
        if (!pdfFile.exists()) {
            throw new FileNotFoundException("任务不存在: " + taskId);
        }
        return pdfFile;
    }
}
