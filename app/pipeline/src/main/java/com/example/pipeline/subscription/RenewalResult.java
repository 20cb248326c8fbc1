package com.example.pipeline.subscription;

public enum RenewalResult {
  RENEWED,
  SKIPPED_NOT_CONFIGURED,
  SKIPPED_MISSING_CREDENTIALS,
  TOKEN_FAILED,
  RENEWAL_FAILED
}
