package com.proofly.backend.services.reports;

public record ReportDownload(String filename, String contentType, byte[] content) {}
