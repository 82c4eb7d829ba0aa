package com.example.redline.util.wml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class WmlChangeDetails {

    @JsonProperty("old_text")
    private String oldText;

    @JsonProperty("new_text")
    private String newText;

    @JsonProperty("format_description")
    private String formatDescription;

    private String author;

    @JsonProperty("date_time")
    private String dateTime;

    /** 如 "In footnote"、"In table, In textbox" */
    @JsonProperty("location_context")
    private String locationContext;

    public String getOldText() { return oldText; }
    public void setOldText(String oldText) { this.oldText = oldText; }

    public String getNewText() { return newText; }
    public void setNewText(String newText) { this.newText = newText; }

    public String getFormatDescription() { return formatDescription; }
    public void setFormatDescription(String formatDescription) { this.formatDescription = formatDescription; }

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }

    public String getDateTime() { return dateTime; }
    public void setDateTime(String dateTime) { this.dateTime = dateTime; }

    public String getLocationContext() { return locationContext; }
    public void setLocationContext(String locationContext) { this.locationContext = locationContext; }
}
