package com.scholary.meeting.pipeline.insights;

import java.util.ArrayList;
import java.util.List;

/** Parses "- " or "• " prefixed lines out of model output. */
final class BulletLines {

  private BulletLines() {}

  static List<String> parse(String output) {
    List<String> items = new ArrayList<>();
    if (output == null) {
      return items;
    }
    for (String line : output.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.startsWith("- ") || trimmed.startsWith("• ")) {
        String item = trimmed.substring(2).strip();
        if (!item.isEmpty()) {
          items.add(item);
        }
      }
    }
    return items;
  }
}
