/*
 * Where: pipeline application entry point
 * What: boots Spring, property scanning and the scheduled workers
 * Why: the same artifact serves the webhook/queue side and, in runner mode, the job side
 */
package com.example.pipeline;

import com.example.common.config.TimeConfig;
import com.example.pipeline.job.TranscriptJobRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class PipelineApplication {

  public static void main(String[] args) {
    final ConfigurableApplicationContext context =
        SpringApplication.run(PipelineApplication.class, args);
    // runner mode is a one-shot job: propagate its exit code instead of idling
    if (context.getBeanProvider(TranscriptJobRunner.class).getIfAvailable() != null) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
