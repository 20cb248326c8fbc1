package com.example.pipeline.ingest;

public record WebhookIngestResult(int accepted, int rejected) {}
