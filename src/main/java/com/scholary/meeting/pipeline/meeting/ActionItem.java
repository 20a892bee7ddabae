package com.scholary.meeting.pipeline.meeting;

/** A task mentioned in the meeting. Assignee and due date are free text and may be null. */
public record ActionItem(String text, String assignee, String dueDate) {

  public ActionItem(String text) {
    this(text, null, null);
  }
}
