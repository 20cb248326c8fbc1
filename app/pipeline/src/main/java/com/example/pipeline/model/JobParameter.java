package com.example.pipeline.model;

/** One environment entry for a job start: either a literal value or a secret reference. */
public record JobParameter(String name, String value, String secretRef) {

  public static JobParameter plain(String name, String value) {
    return new JobParameter(name, value, null);
  }

  public static JobParameter secret(String name, String secretRef) {
    return new JobParameter(name, null, secretRef);
  }

  public boolean isSecret() {
    return secretRef != null;
  }
}
