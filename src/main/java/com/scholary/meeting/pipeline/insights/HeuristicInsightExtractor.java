package com.scholary.meeting.pipeline.insights;

import com.scholary.meeting.pipeline.meeting.ActionItem;
import com.scholary.meeting.pipeline.meeting.MeetingInsights;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Model-free insight extraction.
 *
 * <p>Summary: the leading sentences. Action items: sentences with commitment phrases. Topics: the
 * most frequent non-trivial words.
 */
public class HeuristicInsightExtractor implements InsightExtractor {

  static final int SUMMARY_SENTENCES = 3;
  static final int SUMMARY_MAX_CHARS = 600;
  static final int MAX_TOPICS = 5;

  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");

  private static final Pattern ACTION_CUE =
      Pattern.compile(
          "\\b(action item|follow up|follow-up|i will|i'll|we will|we'll|need to|needs to"
              + "|has to|have to|should|todo|to-do|let's|assigned to)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern ASSIGNEE =
      Pattern.compile("^([A-Z][a-z]+)\\s+(will|should|needs to|has to|is going to)\\b");

  private static final Pattern DUE_DATE =
      Pattern.compile(
          "\\bby\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday|tomorrow|tonight"
              + "|next week|next month|end of (?:the )?(?:day|week|month)|\\d{4}-\\d{2}-\\d{2})\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Set<String> STOP_WORDS =
      Set.of(
          "about", "after", "again", "also", "because", "been", "before", "being", "could",
          "does", "doing", "from", "going", "have", "here", "into", "just", "know", "like",
          "make", "more", "need", "only", "over", "really", "should", "some", "that", "their",
          "them", "then", "there", "these", "they", "thing", "things", "think", "this", "those",
          "very", "want", "well", "were", "what", "when", "where", "which", "while", "will",
          "with", "would", "yeah", "your", "okay", "right", "sure", "maybe", "actually", "other",
          "than", "through", "said", "says", "meeting", "today", "next", "week");

  private final int maxActionItems;

  public HeuristicInsightExtractor(int maxActionItems) {
    this.maxActionItems = maxActionItems;
  }

  @Override
  public MeetingInsights analyze(String transcript) {
    List<String> sentences = sentences(transcript);
    return new MeetingInsights(null, summarize(sentences), actionItems(sentences), topics(transcript));
  }

  private static List<String> sentences(String text) {
    return Arrays.stream(SENTENCE_BREAK.split(text.strip()))
        .map(String::strip)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  private static String summarize(List<String> sentences) {
    String summary =
        sentences.stream().limit(SUMMARY_SENTENCES).collect(Collectors.joining(" "));
    if (summary.length() <= SUMMARY_MAX_CHARS) {
      return summary;
    }
    int cut = summary.lastIndexOf(' ', SUMMARY_MAX_CHARS);
    return summary.substring(0, cut > 0 ? cut : SUMMARY_MAX_CHARS) + "...";
  }

  private List<ActionItem> actionItems(List<String> sentences) {
    List<ActionItem> items = new ArrayList<>();
    for (String sentence : sentences) {
      if (!ACTION_CUE.matcher(sentence).find()) {
        continue;
      }
      Matcher assignee = ASSIGNEE.matcher(sentence);
      Matcher due = DUE_DATE.matcher(sentence);
      items.add(
          new ActionItem(
              sentence,
              assignee.find() ? assignee.group(1) : null,
              due.find() ? due.group(1) : null));
      if (items.size() >= maxActionItems) {
        break;
      }
    }
    return items;
  }

  private static List<String> topics(String text) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}'-]+")) {
      if (word.length() < 4 || STOP_WORDS.contains(word) || word.chars().allMatch(Character::isDigit)) {
        continue;
      }
      counts.merge(word, 1, Integer::sum);
    }
    // stable sort over an insertion-ordered map: ties keep first-mention order
    return counts.entrySet().stream()
        .filter(e -> e.getValue() >= 2)
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(MAX_TOPICS)
        .map(Map.Entry::getKey)
        .toList();
  }
}
