package com.acme.workqueue.web.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ThreadIdTurboFilterTest {

  @Test
  void putsThreadIdIntoMdcAndStaysNeutral() {
    MDC.clear();

    FilterReply reply = new ThreadIdTurboFilter().decide(null, null, null, "msg", null, null);

    assertThat(reply).isEqualTo(FilterReply.NEUTRAL);
    assertThat(MDC.get(ThreadIdTurboFilter.THREAD_ID_KEY))
        .isEqualTo(String.valueOf(Thread.currentThread().getId()));
  }
}
