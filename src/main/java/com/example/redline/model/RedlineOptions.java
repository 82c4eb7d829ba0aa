package com.example.redline.model;

/**
 * 一次比对的可调参数（HTTP 请求参数 / 命令行选项）
 *
 * 字段为空表示使用各比对器的默认值。
 */
public class RedlineOptions {

    private String author;
    /** ISO-8601 */
    private String dateTime;
    private Double detailThreshold;
    private Boolean trackFormatting;

    public RedlineOptions() {
    }

    public RedlineOptions(String author, String dateTime, Double detailThreshold, Boolean trackFormatting) {
        this.author = author;
        this.dateTime = dateTime;
        this.detailThreshold = detailThreshold;
        this.trackFormatting = trackFormatting;
    }

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }

    public String getDateTime() { return dateTime; }
    public void setDateTime(String dateTime) { this.dateTime = dateTime; }

    public Double getDetailThreshold() { return detailThreshold; }
    public void setDetailThreshold(Double detailThreshold) { this.detailThreshold = detailThreshold; }

    public Boolean getTrackFormatting() { return trackFormatting; }
    public void setTrackFormatting(Boolean trackFormatting) { this.trackFormatting = trackFormatting; }
}
