package com.example.sectionfinder.controller;

import com.example.sectionfinder.service.SimilarSectionService;
import com.example.sectionfinder.service.dto.SimilarSearchRequest;
import com.example.sectionfinder.service.dto.TextMatchRequest;
import com.example.sectionfinder.util.similarity.dto.SimilarityResult;
import com.example.sectionfinder.util.similarity.dto.TextMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 相似区段搜索控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/similar-section")
public class SimilarSectionController {

    @Autowired
    private SimilarSectionService similarSectionService;

    /**
     * 上传PDF文件
     *
     * @param file PDF文件
     * @return 包含taskId和文件路径的响应
     */
    @PostMapping("/upload")
    public ResponseEntity<Map<String, Object>> uploadPdf(@RequestParam("file") MultipartFile file) {
        Map<String, Object> result = new HashMap<>();

        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".pdf")) {
            result.put("success", false);
            result.put("message", "只支持.pdf文件");
            return ResponseEntity.badRequest().body(result);
        }

        try {
            Map<String, Object> uploadResult = similarSectionService.uploadPdf(file);

            result.put("success", true);
            result.put("taskId", uploadResult.get("taskId"));
            result.put("filePath", uploadResult.get("filePath"));
            result.put("originalFilename", originalFilename);
            result.put("message", "上传成功");

            return ResponseEntity.ok(result);

        } catch (IOException e) {
            log.error("文件保存失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "文件保存失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 搜索与选区相似的区段
     *
     * @param taskId 任务ID
     * @param request 选中文本、选区位置及可选的阈值/数量/页窗口/模式
     * @return 按得分降序的结果列表
     */
    @PostMapping("/{taskId}/search")
    public ResponseEntity<Map<String, Object>> search(@PathVariable String taskId,
                                                      @RequestBody SimilarSearchRequest request) {
        Map<String, Object> result = new HashMap<>();

        try {
            List<SimilarityResult> results = similarSectionService.search(taskId, request);

            result.put("success", true);
            result.put("taskId", taskId);
            result.put("count", results.size());
            result.put("results", results);
            return ResponseEntity.ok(result);

        } catch (FileNotFoundException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);

        } catch (IllegalArgumentException e) {
            result.put("success", false);
            result.put("message", "参数错误: " + e.getMessage());
            return ResponseEntity.badRequest().body(result);

        } catch (IOException e) {
            log.error("任务 {} 读取PDF失败: {}", taskId, e.getMessage(), e);
            result.put("success", false);
            result.put("message", "读取PDF失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 纯文本相似匹配
     */
    @PostMapping("/text-match")
    public ResponseEntity<Map<String, Object>> textMatch(@RequestBody TextMatchRequest request) {
        Map<String, Object> result = new HashMap<>();

        try {
            List<TextMatch> matches = similarSectionService.textMatch(request);

            result.put("success", true);
            result.put("count", matches.size());
            result.put("matches", matches);
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            result.put("success", false);
            result.put("message", "参数错误: " + e.getMessage());
            return ResponseEntity.badRequest().body(result);
        }
    }
}
