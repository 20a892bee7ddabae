package com.scholary.meeting.pipeline.api;

import com.scholary.meeting.pipeline.meeting.MeetingStatus;

/**
 * Response for a registered meeting.
 *
 * <p>Returns the meeting id to poll for status and a Kibana URL for monitoring.
 */
public record MeetingAcceptedResponse(String meetingId, MeetingStatus status, String kibanaUrl) {}
