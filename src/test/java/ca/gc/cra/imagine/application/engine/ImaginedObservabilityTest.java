package ca.gc.cra.imagine.application.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.imagine.config.BalanceCheck;
import ca.gc.cra.imagine.config.ImagineConfig;
import ca.gc.cra.imagine.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ImaginedObservabilityTest {

  @Test
  void countsImaginedAndComputedCallsUnderPrefix() {
    RecordingMetrics metrics = new RecordingMetrics();
    ImagineConfig config = new ImagineConfig(BalanceCheck.WARN, false, "whatif", 256);
    Imagined<Integer> f = new ImagineEngine(config, metrics).wrap("f", args -> 1);

    f.call(0);
    f.at(0).imagine(2).run(() -> {
      f.call(0);
      f.call(1);
    });

    assertEquals(1, metrics.counter("whatif.call.imagined"));
    assertEquals(2, metrics.counter("whatif.call.computed"));
    assertEquals(1, metrics.counter("whatif.activation.entered"));
  }

  @Test
  void observesChainLengthOnEnter() {
    RecordingMetrics metrics = new RecordingMetrics();
    ImagineConfig config = new ImagineConfig(BalanceCheck.WARN, false, "whatif", 256);
    Imagined<Integer> f = new ImagineEngine(config, metrics).wrap("f", args -> 1);

    SceneActivation<Integer> outer = f.at(0).imagine(2);
    outer.run(() -> {
      assertEquals(1, metrics.observation("whatif.activation.chain.length"));
      f.at(1).imagine(3).at(2).imagine(4).run(() ->
          assertEquals(3, metrics.observation("whatif.activation.chain.length")));
    });
  }

  @Test
  void traceRendersArgumentsWithinBudget() {
    Logger logger = (Logger) LoggerFactory.getLogger(Imagined.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level previous = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.TRACE);
    appender.start();
    logger.addAppender(appender);

    try {
      ImagineConfig config = new ImagineConfig(BalanceCheck.WARN, false, "imagine", 8);
      Imagined<String> f = new ImagineEngine(config, new RecordingMetrics()).wrap("f", args -> "x");
      f.at("k").imagine("v").run(() -> f.call("k"));
      f.call("a-long-argument-value");
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(previous);
      appender.stop();
    }

    List<ILoggingEvent> events = appender.list;
    assertEquals(2, events.size());
    assertEquals("f(k) imagined as v", events.get(0).getFormattedMessage());
    assertTrue(events.get(1).getFormattedMessage().contains("truncated, 8 of 23"));
  }
}
