package com.scholary.meeting.pipeline.insights;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.meeting.pipeline.meeting.ActionItem;
import com.scholary.meeting.pipeline.meeting.MeetingInsights;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Insight extraction through an OpenAI-compatible chat-completions API.
 *
 * <p>Three prompts per transcript: summary, action items, key topics. List answers are requested as
 * "- " lines; action items as {@code - task | assignee | due date} with "unknown" for missing
 * parts.
 */
public class LlmInsightExtractor implements InsightExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(LlmInsightExtractor.class);

  private static final String SYSTEM_PROMPT =
      "You analyze meeting transcripts. Answer only with what is asked, no preamble.";

  private static final String SUMMARY_PROMPT =
      "Summarize this meeting transcript in three to five sentences.\n\nTranscript:\n%s\n\nSummary:";

  private static final String ACTION_ITEMS_PROMPT =
      "Extract action items from this meeting transcript.\n"
          + "List each action item on a new line as \"- task | assignee | due date\", writing"
          + " \"unknown\" for a missing assignee or due date.\n"
          + "If no action items are found, respond with \"No action items found.\"\n\n"
          + "Transcript:\n%s\n\nAction items:";

  private static final String TOPICS_PROMPT =
      "List the main topics discussed in this meeting.\n"
          + "Provide 3-5 key topics, one per line starting with \"- \".\n\n"
          + "Transcript:\n%s\n\nKey topics:";

  private static final String UNKNOWN = "unknown";

  private final HttpClient httpClient;
  private final InsightsProperties.Llm llm;
  private final int promptCharLimit;
  private final int maxActionItems;
  private final ObjectMapper objectMapper;

  public LlmInsightExtractor(InsightsProperties properties, ObjectMapper objectMapper) {
    this.llm = properties.llm();
    this.promptCharLimit = properties.promptCharLimit();
    this.maxActionItems = properties.maxActionItems();
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(llm.connectTimeout())).build();

    LOGGER.info("Initialized LLM insight extractor: baseUrl={}, model={}", llm.baseUrl(), llm.model());
  }

  @Override
  public MeetingInsights analyze(String transcript) {
    String excerpt =
        transcript.length() > promptCharLimit ? transcript.substring(0, promptCharLimit) : transcript;

    String summary = complete(String.format(SUMMARY_PROMPT, excerpt)).strip();
    if (summary.isEmpty()) {
      throw new InsightExtractionException("Model returned an empty summary");
    }

    List<ActionItem> actionItems =
        parseActionItems(complete(String.format(ACTION_ITEMS_PROMPT, excerpt)));
    List<String> topics = BulletLines.parse(complete(String.format(TOPICS_PROMPT, excerpt)));

    LOGGER.info(
        "LLM analysis complete: summaryChars={}, actionItems={}, topics={}",
        summary.length(),
        actionItems.size(),
        topics.size());

    return new MeetingInsights(null, summary, actionItems, topics);
  }

  List<ActionItem> parseActionItems(String output) {
    List<ActionItem> items = new ArrayList<>();
    for (String line : BulletLines.parse(output)) {
      if (line.toLowerCase().contains("no action items")) {
        continue;
      }
      String[] parts = line.split("\\|");
      String text = parts[0].strip();
      if (text.isEmpty()) {
        continue;
      }
      items.add(new ActionItem(text, part(parts, 1), part(parts, 2)));
      if (items.size() >= maxActionItems) {
        break;
      }
    }
    return items;
  }

  private static String part(String[] parts, int index) {
    if (parts.length <= index) {
      return null;
    }
    String value = parts[index].strip();
    return value.isEmpty() || value.equalsIgnoreCase(UNKNOWN) ? null : value;
  }

  private String complete(String prompt) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", llm.model());
    body.put("temperature", 0);
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
    messages.addObject().put("role", "user").put("content", prompt);

    try {
      HttpRequest.Builder request =
          HttpRequest.newBuilder()
              .uri(URI.create(llm.baseUrl() + "/v1/chat/completions"))
              .timeout(Duration.ofSeconds(llm.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      if (llm.apiKey() != null && !llm.apiKey().isBlank()) {
        request.header("Authorization", "Bearer " + llm.apiKey());
      }

      HttpResponse<String> response =
          httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new InsightExtractionException(
            String.format(
                "Chat completion returned status %d: %s", response.statusCode(), response.body()));
      }

      JsonNode content =
          objectMapper.readTree(response.body()).path("choices").path(0).path("message").path("content");
      if (!content.isTextual()) {
        throw new InsightExtractionException("Chat completion response has no message content");
      }
      return content.asText();

    } catch (IOException e) {
      throw new InsightExtractionException("Chat completion request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InsightExtractionException("Chat completion interrupted", e);
    }
  }
}
