package com.example.redline.service;

import com.example.redline.config.RedlineProperties;
import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

import static com.example.redline.support.OoxmlFixtures.xlsx;
import static org.assertj.core.api.Assertions.assertThat;

class RedlineServiceTest {

    @TempDir
    Path tempDir;

    private RedlineProperties properties;
    private RedlineService service;

    @BeforeEach
    void setUp() {
        properties = new RedlineProperties();
        properties.setTaskBasePath(tempDir.toString());
        service = new RedlineService(properties);
    }

    @Test
    void asyncTaskWritesResultAndStatus() throws Exception {
        MockMultipartFile older = new MockMultipartFile("oldFile", "old.xlsx", null,
                xlsx().sheet("Sheet1", "A1=100").build());
        MockMultipartFile newer = new MockMultipartFile("newFile", "new.xlsx", null,
                xlsx().sheet("Sheet1", "A1=200").build());

        String taskId = service.createTask(DocumentType.EXCEL, older, newer);
        assertThat(service.getTaskStatus(taskId).get("status")).isEqualTo(RedlineService.STATUS_UPLOADED);
        assertThat(service.getTaskResult(taskId)).isNull();

        service.compareAsync(taskId, DocumentType.EXCEL, new RedlineOptions());

        Map<String, Object> status = service.getTaskStatus(taskId);
        assertThat(status.get("status")).isEqualTo(RedlineService.STATUS_COMPLETED);
        assertThat(status.get("exists")).isEqualTo(true);
        assertThat(status.get("type")).isEqualTo("EXCEL");
        assertThat(((Number) status.get("revisionCount")).intValue()).isEqualTo(1);
        assertThat(status).doesNotContainKey("resultPath");
        File result = service.getTaskResult(taskId);
        assertThat(result).isFile();
        assertThat(result.getName()).isEqualTo("redline.xlsx");
    }

    @Test
    void corruptUploadMarksTaskFailed() throws Exception {
        MockMultipartFile older = new MockMultipartFile("oldFile", "old.docx", null, "not a zip".getBytes());
        MockMultipartFile newer = new MockMultipartFile("newFile", "new.docx", null, "not a zip".getBytes());

        String taskId = service.createTask(DocumentType.WORD, older, newer);
        service.compareAsync(taskId, DocumentType.WORD, null);

        Map<String, Object> status = service.getTaskStatus(taskId);
        assertThat(status.get("status")).isEqualTo(RedlineService.STATUS_FAILED);
        assertThat((String) status.get("message")).startsWith("比对失败");
        assertThat(service.getTaskResult(taskId)).isNull();
    }

    @Test
    void unknownTaskIsNotFound() {
        Map<String, Object> status = service.getTaskStatus("missing");

        assertThat(status.get("status")).isEqualTo(RedlineService.STATUS_NOT_FOUND);
        assertThat(status.get("exists")).isEqualTo(false);
    }

    @Test
    void configuredDefaultsFillMissingOptions() {
        properties.setDefaultAuthor("Service");
        properties.setTrackFormatting(true);
        properties.setDetailThreshold(0.5);

        RedlineOptions options = service.withDefaults(new RedlineOptions(null, null, null, false));

        assertThat(options.getAuthor()).isEqualTo("Service");
        assertThat(options.getDetailThreshold()).isEqualTo(0.5);
        assertThat(options.getTrackFormatting()).isFalse();
    }
}
