package com.scholary.meeting.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetingPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(MeetingPipelineApplication.class, args);
  }
}
