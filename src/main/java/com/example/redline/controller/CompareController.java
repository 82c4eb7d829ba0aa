package com.example.redline.controller;

import com.example.redline.exception.RedlineException;
import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import com.example.redline.model.RedlineOutcome;
import com.example.redline.service.RedlineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

/**
 * 文档比对控制器（docx / xlsx / pptx）
 */
@Slf4j
@RestController
@RequestMapping("/api/redline")
public class CompareController {

    @Autowired
    private RedlineService redlineService;

    /**
     * 比对两个文档，返回带修订标记的新文档
     *
     * @param oldFile 旧文档
     * @param newFile 新文档（决定输出的类型）
     * @param author 修订作者（可选）
     * @param date 修订时间 ISO-8601（可选）
     * @param detailThreshold 段落相似度阈值（可选，仅 Word）
     * @param trackFormatting 是否记录格式变更（可选）
     */
    @PostMapping("/compare")
    public ResponseEntity<?> compare(
            @RequestParam("oldFile") MultipartFile oldFile,
            @RequestParam("newFile") MultipartFile newFile,
            @RequestParam(value = "author", required = false) String author,
            @RequestParam(value = "date", required = false) String date,
            @RequestParam(value = "detailThreshold", required = false) Double detailThreshold,
            @RequestParam(value = "trackFormatting", required = false) Boolean trackFormatting) {

        Map<String, Object> result = new HashMap<>();
        DocumentType type = validatePair(oldFile, newFile, result);
        if (type == null) {
            return ResponseEntity.badRequest().body(result);
        }

        try {
            log.info("比对请求: old={}, new={}, type={}", oldFile.getOriginalFilename(), newFile.getOriginalFilename(), type);
            RedlineOptions options = new RedlineOptions(author, date, detailThreshold, trackFormatting);
            RedlineOutcome outcome = redlineService.compare(type, oldFile.getBytes(), newFile.getBytes(), options);

            HttpHeaders headers = downloadHeaders(type, baseName(newFile.getOriginalFilename()) + "_redline" + type.getExtension());
            headers.add("X-Revision-Count", String.valueOf(outcome.getRevisionCount()));
            return new ResponseEntity<>(outcome.getDocument(), headers, HttpStatus.OK);

        } catch (Exception e) {
            return failure("比对失败", e, result);
        }
    }

    /**
     * 列出两个文档之间的变更
     */
    @PostMapping("/changes")
    public ResponseEntity<Map<String, Object>> changes(
            @RequestParam("oldFile") MultipartFile oldFile,
            @RequestParam("newFile") MultipartFile newFile) {

        Map<String, Object> result = new HashMap<>();
        DocumentType type = validatePair(oldFile, newFile, result);
        if (type == null) {
            return ResponseEntity.badRequest().body(result);
        }

        try {
            RedlineOutcome outcome = redlineService.changes(type, oldFile.getBytes(), newFile.getBytes());
            result.put("success", true);
            result.put("type", type.name());
            result.put("revisionCount", outcome.getRevisionCount());
            result.put("changes", outcome.getChanges());
            result.put("items", outcome.getItems());
            return ResponseEntity.ok(result);

        } catch (Exception e) {
            return failure("变更提取失败", e, result);
        }
    }

    /**
     * 应用变更：Word 接受修订，Excel / PowerPoint 把变更写入旧文档
     *
     * @param file 基础文档
     * @param changes 变更 JSON 数组
     */
    @PostMapping("/apply")
    public ResponseEntity<?> apply(@RequestParam("file") MultipartFile file,
                                   @RequestParam("changes") String changes) {
        return patch(file, changes, false);
    }

    /**
     * 撤销变更：Word 拒绝修订，Excel / PowerPoint 在比对结果上还原
     */
    @PostMapping("/revert")
    public ResponseEntity<?> revert(@RequestParam("file") MultipartFile file,
                                    @RequestParam("changes") String changes) {
        return patch(file, changes, true);
    }

    private ResponseEntity<?> patch(MultipartFile file, String changes, boolean revert) {
        Map<String, Object> result = new HashMap<>();
        DocumentType type = validateFile(file, result);
        if (type == null) {
            return ResponseEntity.badRequest().body(result);
        }
        if (changes == null || changes.trim().isEmpty()) {
            result.put("success", false);
            result.put("message", "变更列表不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        try {
            byte[] json = changes.getBytes(StandardCharsets.UTF_8);
            byte[] document = revert
                    ? redlineService.revert(type, file.getBytes(), json)
                    : redlineService.apply(type, file.getBytes(), json);
            String suffix = revert ? "_reverted" : "_applied";
            HttpHeaders headers = downloadHeaders(type, baseName(file.getOriginalFilename()) + suffix + type.getExtension());
            return new ResponseEntity<>(document, headers, HttpStatus.OK);

        } catch (Exception e) {
            return failure(revert ? "撤销失败" : "应用失败", e, result);
        }
    }

    /**
     * 异步比对：保存文件后立即返回 taskId
     *
     * 使用 /status/{taskId} 轮询状态，完成后使用 /artifact/{taskId} 下载结果。
     */
    @PostMapping("/compare/async")
    public ResponseEntity<Map<String, Object>> compareAsync(
            @RequestParam("oldFile") MultipartFile oldFile,
            @RequestParam("newFile") MultipartFile newFile,
            @RequestParam(value = "author", required = false) String author,
            @RequestParam(value = "date", required = false) String date,
            @RequestParam(value = "detailThreshold", required = false) Double detailThreshold,
            @RequestParam(value = "trackFormatting", required = false) Boolean trackFormatting) {

        Map<String, Object> result = new HashMap<>();
        DocumentType type = validatePair(oldFile, newFile, result);
        if (type == null) {
            return ResponseEntity.badRequest().body(result);
        }

        try {
            String taskId = redlineService.createTask(type, oldFile, newFile);
            redlineService.compareAsync(taskId, type, new RedlineOptions(author, date, detailThreshold, trackFormatting));

            result.put("success", true);
            result.put("taskId", taskId);
            result.put("message", "文件已接收，正在后台比对。请使用 /status/{taskId} 查询进度，完成后使用 /artifact/{taskId} 下载结果");
            return ResponseEntity.ok(result);

        } catch (Exception e) {
            log.error("文件上传失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "上传失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 查询任务状态
     */
    @GetMapping("/status/{taskId}")
    public ResponseEntity<Map<String, Object>> getTaskStatus(@PathVariable String taskId) {
        log.info("查询任务状态: taskId={}", taskId);
        return ResponseEntity.ok(redlineService.getTaskStatus(taskId));
    }

    /**
     * 下载异步比对结果
     */
    @GetMapping("/artifact/{taskId}")
    public ResponseEntity<?> downloadArtifact(@PathVariable String taskId) {
        Map<String, Object> result = new HashMap<>();
        File resultFile = redlineService.getTaskResult(taskId);
        if (resultFile == null) {
            result.put("success", false);
            result.put("message", "结果不存在或任务未完成");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }

        try {
            DocumentType type = DocumentType.fromFileName(resultFile.getName());
            HttpHeaders headers = downloadHeaders(type, taskId + "_redline" + type.getExtension());
            log.info("下载比对结果: taskId={}, file={}", taskId, resultFile.getName());
            return new ResponseEntity<>(Files.readAllBytes(resultFile.toPath()), headers, HttpStatus.OK);

        } catch (IOException e) {
            log.error("下载比对结果失败: taskId={}, error={}", taskId, e.getMessage(), e);
            result.put("success", false);
            result.put("message", "读取结果失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    // ==================== 校验与响应 ====================

    private DocumentType validateFile(MultipartFile file, Map<String, Object> result) {
        if (file == null || file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return null;
        }
        DocumentType type = DocumentType.fromFileName(file.getOriginalFilename());
        if (type == null) {
            result.put("success", false);
            result.put("message", "只支持.docx、.xlsx、.pptx文件");
        }
        return type;
    }

    private DocumentType validatePair(MultipartFile oldFile, MultipartFile newFile, Map<String, Object> result) {
        DocumentType oldType = validateFile(oldFile, result);
        if (oldType == null) {
            return null;
        }
        DocumentType newType = validateFile(newFile, result);
        if (newType == null) {
            return null;
        }
        if (oldType != newType) {
            result.put("success", false);
            result.put("message", "两个文件类型不一致: " + oldType + " / " + newType);
            return null;
        }
        return newType;
    }

    /**
     * 请求参数问题 400，输入文档问题 422，其余 500
     */
    private ResponseEntity<Map<String, Object>> failure(String action, Exception e, Map<String, Object> result) {
        result.put("success", false);
        result.put("message", action + ": " + e.getMessage());
        if (e instanceof IllegalArgumentException) {
            log.warn("{}: {}", action, e.getMessage());
            return ResponseEntity.badRequest().body(result);
        }
        if (e instanceof RedlineException && ((RedlineException) e).isInputError()) {
            RedlineException re = (RedlineException) e;
            log.warn("{}: kind={}, locator={}, {}", action, re.getKind(), re.getLocator(), e.getMessage());
            result.put("errorKind", re.getKind().name());
            result.put("locator", re.getLocator());
            return ResponseEntity.unprocessableEntity().body(result);
        }
        log.error("{}: {}", action, e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }

    private HttpHeaders downloadHeaders(DocumentType type, String fileName) throws UnsupportedEncodingException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(type.getMediaType()));
        headers.setContentDispositionFormData("attachment", URLEncoder.encode(fileName, "UTF-8"));
        return headers;
    }

    private static String baseName(String fileName) {
        if (fileName == null) {
            return "document";
        }
        String name = new File(fileName).getName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
