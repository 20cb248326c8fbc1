package com.example.pipeline.ingest;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls ids out of a change-notification resource path such as
 * {@code users('u')/onlineMeetings('m')/transcripts('t')}.
 */
final class TranscriptResourcePath {

  private static final Pattern USER = Pattern.compile("users\\('([^']+)'\\)");
  private static final Pattern MEETING = Pattern.compile("onlineMeetings\\('([^']+)'\\)");
  private static final Pattern TRANSCRIPT = Pattern.compile("transcripts\\('([^']+)'\\)");

  private TranscriptResourcePath() {}

  static Optional<String> userId(String resource) {
    return find(USER, resource);
  }

  static Optional<String> meetingId(String resource) {
    return find(MEETING, resource);
  }

  static Optional<String> transcriptId(String resource) {
    return find(TRANSCRIPT, resource);
  }

  private static Optional<String> find(Pattern pattern, String resource) {
    if (resource == null) {
      return Optional.empty();
    }
    final Matcher matcher = pattern.matcher(resource);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }
}
