package com.example.pipeline.api;

public record ApiErrorResponse(String code, String message) {}
