package com.example.pipeline.api;

public record WebhookIngestResponse(int accepted, int rejected) {}
