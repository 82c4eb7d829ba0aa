package com.example.redline.controller;

import com.example.redline.exception.RedlineException;
import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import com.example.redline.model.RedlineOutcome;
import com.example.redline.service.RedlineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompareController.class)
class CompareControllerTest {

    private static final byte[] BYTES = {1, 2, 3};

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RedlineService redlineService;

    @Test
    void compareReturnsRedlineDownload() throws Exception {
        RedlineOutcome outcome = new RedlineOutcome(DocumentType.WORD);
        outcome.setDocument(new byte[]{9, 9});
        outcome.setRevisionCount(4);
        when(redlineService.compare(eq(DocumentType.WORD), any(byte[].class), any(byte[].class), any(RedlineOptions.class)))
                .thenReturn(outcome);

        mockMvc.perform(multipart("/api/redline/compare")
                        .file(new MockMultipartFile("oldFile", "a.docx", null, BYTES))
                        .file(new MockMultipartFile("newFile", "report.docx", null, BYTES))
                        .param("author", "Alice"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Revision-Count", "4"))
                .andExpect(header().string("Content-Type", DocumentType.WORD.getMediaType()))
                .andExpect(header().string("Content-Disposition", containsString("report_redline.docx")))
                .andExpect(content().bytes(new byte[]{9, 9}));
    }

    @Test
    void unsupportedExtensionIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/redline/compare")
                        .file(new MockMultipartFile("oldFile", "a.pdf", null, BYTES))
                        .file(new MockMultipartFile("newFile", "b.pdf", null, BYTES)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("只支持.docx、.xlsx、.pptx文件"));
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/redline/changes")
                        .file(new MockMultipartFile("oldFile", "a.docx", null, new byte[0]))
                        .file(new MockMultipartFile("newFile", "b.docx", null, BYTES)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("文件不能为空"));
    }

    @Test
    void mixedTypesAreRejected() throws Exception {
        mockMvc.perform(multipart("/api/redline/compare")
                        .file(new MockMultipartFile("oldFile", "a.docx", null, BYTES))
                        .file(new MockMultipartFile("newFile", "b.xlsx", null, BYTES)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(startsWith("两个文件类型不一致")));
    }

    @Test
    void malformedDocumentMapsToUnprocessableEntity() throws Exception {
        when(redlineService.compare(any(DocumentType.class), any(byte[].class), any(byte[].class), any(RedlineOptions.class)))
                .thenThrow(RedlineException.missingPart("word/document.xml", "部件不存在"));

        mockMvc.perform(multipart("/api/redline/compare")
                        .file(new MockMultipartFile("oldFile", "a.docx", null, BYTES))
                        .file(new MockMultipartFile("newFile", "b.docx", null, BYTES)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorKind").value("MISSING_PART"))
                .andExpect(jsonPath("$.locator").value("word/document.xml"));
    }

    @Test
    void changesReturnsJsonListing() throws Exception {
        RedlineOutcome outcome = new RedlineOutcome(DocumentType.EXCEL);
        outcome.setRevisionCount(2);
        outcome.setChanges(Arrays.asList("first", "second"));
        outcome.setItems(Collections.singletonList("grouped"));
        when(redlineService.changes(eq(DocumentType.EXCEL), any(byte[].class), any(byte[].class))).thenReturn(outcome);

        mockMvc.perform(multipart("/api/redline/changes")
                        .file(new MockMultipartFile("oldFile", "a.xlsx", null, BYTES))
                        .file(new MockMultipartFile("newFile", "b.xlsx", null, BYTES)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.type").value("EXCEL"))
                .andExpect(jsonPath("$.revisionCount").value(2))
                .andExpect(jsonPath("$.changes.length()").value(2))
                .andExpect(jsonPath("$.items[0]").value("grouped"));
    }

    @Test
    void applyRequiresChanges() throws Exception {
        mockMvc.perform(multipart("/api/redline/apply")
                        .file(new MockMultipartFile("file", "a.docx", null, BYTES))
                        .param("changes", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("变更列表不能为空"));
        verify(redlineService, never()).apply(any(DocumentType.class), any(byte[].class), any(byte[].class));
    }

    @Test
    void badChangesJsonIsBadRequest() throws Exception {
        when(redlineService.revert(eq(DocumentType.POWERPOINT), any(byte[].class), any(byte[].class)))
                .thenThrow(new IllegalArgumentException("变更 JSON 必须是数组"));

        mockMvc.perform(multipart("/api/redline/revert")
                        .file(new MockMultipartFile("file", "deck.pptx", null, BYTES))
                        .param("changes", "{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void applyReturnsPatchedDocument() throws Exception {
        when(redlineService.apply(eq(DocumentType.EXCEL), any(byte[].class), any(byte[].class)))
                .thenReturn(new byte[]{7});

        mockMvc.perform(multipart("/api/redline/apply")
                        .file(new MockMultipartFile("file", "book.xlsx", null, BYTES))
                        .param("changes", "[]"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("book_applied.xlsx")))
                .andExpect(content().bytes(new byte[]{7}));
    }

    @Test
    void asyncCompareReturnsTaskId() throws Exception {
        when(redlineService.createTask(eq(DocumentType.POWERPOINT), any(), any())).thenReturn("task1");

        mockMvc.perform(multipart("/api/redline/compare/async")
                        .file(new MockMultipartFile("oldFile", "a.pptx", null, BYTES))
                        .file(new MockMultipartFile("newFile", "b.pptx", null, BYTES)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("task1"));
        verify(redlineService).compareAsync(eq("task1"), eq(DocumentType.POWERPOINT), any(RedlineOptions.class));
    }

    @Test
    void statusAndMissingArtifact() throws Exception {
        Map<String, Object> status = new HashMap<>();
        status.put("taskId", "task1");
        status.put("status", RedlineService.STATUS_PROCESSING);
        when(redlineService.getTaskStatus("task1")).thenReturn(status);
        when(redlineService.getTaskResult("task1")).thenReturn(null);

        mockMvc.perform(get("/api/redline/status/task1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING"));
        mockMvc.perform(get("/api/redline/artifact/task1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }
}
