package com.example.redline.service;

import com.example.redline.config.RedlineProperties;
import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import com.example.redline.model.RedlineOutcome;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 文档比对服务：同步比对、变更列表、接受 / 撤销，以及基于任务目录的异步比对
 */
@Slf4j
@Service
public class RedlineService {

    /**
     * 任务状态常量
     */
    public static final String STATUS_UPLOADED = "UPLOADED";       // 文件已上传
    public static final String STATUS_PROCESSING = "PROCESSING";   // 正在比对
    public static final String STATUS_COMPLETED = "COMPLETED";     // 比对完成
    public static final String STATUS_FAILED = "FAILED";           // 比对失败
    public static final String STATUS_NOT_FOUND = "NOT_FOUND";     // 任务不存在

    private static final String STATUS_FILE_NAME = "status.json";
    private static final String OLD_FILE_PREFIX = "old";
    private static final String NEW_FILE_PREFIX = "new";
    private static final String RESULT_FILE_PREFIX = "redline";

    private final RedlineProperties properties;
    private final DocumentRedliner redliner;

    @Autowired
    public RedlineService(RedlineProperties properties) {
        this.properties = properties;
        this.redliner = new DocumentRedliner();
    }

    public RedlineOutcome compare(DocumentType type, byte[] older, byte[] newer, RedlineOptions options) {
        return redliner.compare(type, older, newer, withDefaults(options));
    }

    public RedlineOutcome changes(DocumentType type, byte[] older, byte[] newer) {
        return redliner.changes(type, older, newer, withDefaults(null));
    }

    public byte[] apply(DocumentType type, byte[] base, byte[] changesJson) {
        return redliner.apply(type, base, changesJson);
    }

    public byte[] revert(DocumentType type, byte[] result, byte[] changesJson) {
        return redliner.revert(type, result, changesJson);
    }

    /**
     * 请求未指定的参数取配置默认值
     */
    RedlineOptions withDefaults(RedlineOptions options) {
        RedlineOptions o = options == null ? new RedlineOptions() : options;
        if (isBlank(o.getAuthor()) && !isBlank(properties.getDefaultAuthor())) {
            o.setAuthor(properties.getDefaultAuthor());
        }
        if (o.getDetailThreshold() == null) {
            o.setDetailThreshold(properties.getDetailThreshold());
        }
        if (o.getTrackFormatting() == null) {
            o.setTrackFormatting(properties.isTrackFormatting());
        }
        return o;
    }

    // ==================== 异步任务 ====================

    /**
     * 保存两个上传文件到新任务目录
     *
     * @return taskId
     */
    public String createTask(DocumentType type, MultipartFile oldFile, MultipartFile newFile) throws IOException {
        String taskId = UUID.randomUUID().toString().replace("-", "");
        File taskDir = new File(properties.getTaskBasePath(), taskId);
        if (!taskDir.exists() && !taskDir.mkdirs()) {
            throw new IOException("无法创建任务目录: " + taskDir.getAbsolutePath());
        }
        saveUpload(oldFile, new File(taskDir, OLD_FILE_PREFIX + type.getExtension()));
        saveUpload(newFile, new File(taskDir, NEW_FILE_PREFIX + type.getExtension()));

        Map<String, Object> extra = new HashMap<>();
        extra.put("type", type.name());
        updateTaskStatus(taskId, STATUS_UPLOADED, "文件已上传，等待比对", extra);
        log.info("[taskId: {}] 文件已保存: old={}, new={}", taskId, oldFile.getOriginalFilename(),
                newFile.getOriginalFilename());
        return taskId;
    }

    private void saveUpload(MultipartFile file, File target) throws IOException {
        try (InputStream inputStream = file.getInputStream();
             OutputStream outputStream = new FileOutputStream(target)) {
            byte[] buffer = new byte[8192];
            int bytesRead;
            while ((bytesRead = inputStream.read(buffer)) != -1) {
                outputStream.write(buffer, 0, bytesRead);
            }
        }
    }

    /**
     * 后台比对，结果写入任务目录，进度写入 status.json
     */
    @Async
    public void compareAsync(String taskId, DocumentType type, RedlineOptions options) {
        log.info("[taskId: {}] 开始异步比对...", taskId);
        File taskDir = new File(properties.getTaskBasePath(), taskId);
        try {
            updateTaskStatus(taskId, STATUS_PROCESSING, "正在比对", null);
            byte[] older = Files.readAllBytes(new File(taskDir, OLD_FILE_PREFIX + type.getExtension()).toPath());
            byte[] newer = Files.readAllBytes(new File(taskDir, NEW_FILE_PREFIX + type.getExtension()).toPath());

            RedlineOutcome outcome = compare(type, older, newer, options);
            File resultFile = new File(taskDir, RESULT_FILE_PREFIX + type.getExtension());
            Files.write(resultFile.toPath(), outcome.getDocument());

            Map<String, Object> resultInfo = new HashMap<>();
            resultInfo.put("type", type.name());
            resultInfo.put("revisionCount", outcome.getRevisionCount());
            resultInfo.put("resultPath", resultFile.getAbsolutePath());
            log.info("[taskId: {}] 异步比对完成！revisionCount={}", taskId, outcome.getRevisionCount());
            updateTaskStatus(taskId, STATUS_COMPLETED, "比对完成", resultInfo);

        } catch (Exception e) {
            log.error("[taskId: {}] 异步比对失败: {}", taskId, e.getMessage(), e);
            Map<String, Object> errorInfo = new HashMap<>();
            errorInfo.put("type", type.name());
            errorInfo.put("error", e.getMessage());
            updateTaskStatus(taskId, STATUS_FAILED, "比对失败: " + e.getMessage(), errorInfo);
        }
    }

    /**
     * 比对结果文件；任务不存在或尚未完成时返回 null
     */
    public File getTaskResult(String taskId) {
        File taskDir = new File(properties.getTaskBasePath(), taskId);
        for (DocumentType type : DocumentType.values()) {
            File file = new File(taskDir, RESULT_FILE_PREFIX + type.getExtension());
            if (file.isFile()) {
                return file;
            }
        }
        return null;
    }

    /**
     * 更新任务状态（写入 status.json）
     */
    public void updateTaskStatus(String taskId, String status, String message, Map<String, Object> extra) {
        File statusFile = new File(new File(properties.getTaskBasePath(), taskId), STATUS_FILE_NAME);

        Map<String, Object> statusData = new HashMap<>();
        statusData.put("taskId", taskId);
        statusData.put("status", status);
        statusData.put("message", message);
        statusData.put("updateTime", System.currentTimeMillis());

        if (extra != null) {
            for (Map.Entry<String, Object> entry : extra.entrySet()) {
                // 服务器路径不对外暴露
                if (!"resultPath".equals(entry.getKey())) {
                    statusData.put(entry.getKey(), entry.getValue());
                }
            }
        }

        try {
            String json = new GsonBuilder().setPrettyPrinting().create().toJson(statusData);
            Files.write(statusFile.toPath(), json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("[taskId: {}] 写入状态文件失败: {}", taskId, e.getMessage());
        }
    }

    /**
     * 查询任务状态（读取 status.json）
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getTaskStatus(String taskId) {
        Map<String, Object> result = new HashMap<>();
        result.put("taskId", taskId);

        File taskDir = new File(properties.getTaskBasePath(), taskId);
        if (!taskDir.exists() || !taskDir.isDirectory()) {
            result.put("exists", false);
            result.put("status", STATUS_NOT_FOUND);
            result.put("message", "任务不存在");
            return result;
        }

        result.put("exists", true);

        File statusFile = new File(taskDir, STATUS_FILE_NAME);
        if (statusFile.exists()) {
            try {
                String json = new String(Files.readAllBytes(statusFile.toPath()), StandardCharsets.UTF_8);
                Map<String, Object> statusData = new Gson().fromJson(json, Map.class);
                result.putAll(statusData);
            } catch (IOException e) {
                log.error("[taskId: {}] 读取状态文件失败: {}", taskId, e.getMessage());
                result.put("status", "UNKNOWN");
                result.put("message", "无法读取状态文件");
            }
        } else {
            result.put("status", "UNKNOWN");
            result.put("message", "状态未知");
        }
        return result;
    }

    public DocumentRedliner getRedliner() {
        return redliner;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
