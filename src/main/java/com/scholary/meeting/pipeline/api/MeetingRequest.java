package com.scholary.meeting.pipeline.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to register a meeting and start processing it.
 *
 * <p>{@code audioLocation} is {@code s3://bucket/key} or a key in the default bucket.
 */
public record MeetingRequest(@NotBlank String title, @NotBlank String audioLocation) {}
