package com.scholary.meeting.pipeline.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana Discover URLs for pipeline monitoring.
 *
 * <p>Stage logs carry {@code meetingId} in MDC, so one query shows every stage and attempt of a
 * meeting.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:meeting-pipeline-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /** Discover URL showing every log line for one meeting. */
  public String generateMeetingUrl(String meetingId) {
    return discoverUrl(String.format("meetingId:\"%s\"", meetingId));
  }

  /** Discover URL showing abandoned tasks. */
  public String generateDeadLetterUrl() {
    return discoverUrl("event_type:\"stage_dead_lettered\"");
  }

  private String discoverUrl(String query) {
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
