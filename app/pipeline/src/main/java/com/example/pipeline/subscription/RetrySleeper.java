package com.example.pipeline.subscription;

import java.time.Duration;

@FunctionalInterface
public interface RetrySleeper {

  void sleep(Duration delay) throws InterruptedException;
}
