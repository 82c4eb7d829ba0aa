package com.example.redline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * redline.* 配置
 */
@ConfigurationProperties(prefix = "redline")
public class RedlineProperties {

    /** 请求未指定作者时使用；为空则取新文档的 lastModifiedBy */
    private String defaultAuthor;

    /** 异步任务工作目录，每个任务一个子目录 */
    private String taskBasePath = "/data/redline_server";

    /** Word 比对是否记录格式修订 */
    private boolean trackFormatting = false;

    /** 段落相似度低于该值时整段替换 */
    private double detailThreshold = 0.0;

    private List<String> allowedOrigins = new ArrayList<>(Collections.singletonList("*"));

    public String getDefaultAuthor() { return defaultAuthor; }
    public void setDefaultAuthor(String defaultAuthor) { this.defaultAuthor = defaultAuthor; }

    public String getTaskBasePath() { return taskBasePath; }
    public void setTaskBasePath(String taskBasePath) { this.taskBasePath = taskBasePath; }

    public boolean isTrackFormatting() { return trackFormatting; }
    public void setTrackFormatting(boolean trackFormatting) { this.trackFormatting = trackFormatting; }

    public double getDetailThreshold() { return detailThreshold; }
    public void setDetailThreshold(double detailThreshold) { this.detailThreshold = detailThreshold; }

    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
}
