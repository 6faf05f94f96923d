package com.example.AlignAi.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class RootController {

    private final String name;
    private final String version;

    public RootController(@Value("${spring.application.name:AlignAI}") String name,
                          @Value("${app.version:1.0.0}") String version) {
        this.name = name;
        this.version = version;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("upload_resume", "POST /api/v1/upload-resume");
        endpoints.put("upload_resume_file", "POST /api/v1/upload-resume/file");
        endpoints.put("upload_job", "POST /api/v1/upload-job");
        endpoints.put("upload_job_file", "POST /api/v1/upload-job/file");
        endpoints.put("analyze", "POST /api/v1/analyze");
        endpoints.put("history", "GET /api/v1/history");
        endpoints.put("analysis", "GET|DELETE /api/v1/analysis/{id}");
        endpoints.put("health", "GET /api/v1/health");
        endpoints.put("stats", "GET /api/v1/stats");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Welcome to " + name);
        body.put("version", version);
        body.put("endpoints", endpoints);
        return body;
    }
}
