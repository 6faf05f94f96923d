package com.example.AlignAi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Request size caps for the ingestion endpoints.
 */
@ConfigurationProperties(prefix = "app.upload")
public class UploadProperties {

    private int maxResumeChars = 50_000;
    private int maxJobChars = 20_000;
    private int maxExtractChars = 50_000;

    public int getMaxResumeChars() {
        return maxResumeChars;
    }

    public void setMaxResumeChars(int maxResumeChars) {
        this.maxResumeChars = maxResumeChars;
    }

    public int getMaxJobChars() {
        return maxJobChars;
    }

    public void setMaxJobChars(int maxJobChars) {
        this.maxJobChars = maxJobChars;
    }

    public int getMaxExtractChars() {
        return maxExtractChars;
    }

    public void setMaxExtractChars(int maxExtractChars) {
        this.maxExtractChars = maxExtractChars;
    }
}
