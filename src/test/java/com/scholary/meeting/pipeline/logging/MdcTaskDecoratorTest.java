package com.scholary.meeting.pipeline.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcTaskDecoratorTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void decoratedTask_shouldSeeSubmitterContext() throws Exception {
    MDC.put("meetingId", "m1");
    AtomicReference<String> seen = new AtomicReference<>();
    Runnable task = new MdcTaskDecorator().decorate(() -> seen.set(MDC.get("meetingId")));
    MDC.clear();

    Thread thread = new Thread(task);
    thread.start();
    thread.join();

    assertThat(seen.get()).isEqualTo("m1");
  }

  @Test
  void decoratedTask_shouldRestorePreviousContext() {
    MDC.put("meetingId", "submitter");
    Runnable task = new MdcTaskDecorator().decorate(() -> MDC.put("stage", "insights"));

    MDC.put("meetingId", "runner");
    task.run();

    assertThat(MDC.get("meetingId")).isEqualTo("runner");
    assertThat(MDC.get("stage")).isNull();
  }
}
