package com.proofly.backend.exceptions;

public class ReportExpiredException extends RuntimeException {
    public ReportExpiredException(String message) {
        super(message);
    }
}
