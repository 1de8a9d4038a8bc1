package emitter.micrometer;

import emitter.EmitStatus;
import emitter.dispatch.EventBus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementDispatchSuccess() {
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchSuccess();
    assertEquals(2.0, counter("emitter.dispatch.success").count());
  }

  @Test
  void incrementDispatchFailure() {
    exporter.incrementDispatchFailure();
    assertEquals(1.0, counter("emitter.dispatch.failure").count());
  }

  @Test
  void incrementNotFoundAndArgsMismatch() {
    exporter.incrementNotFound();
    exporter.incrementArgsMismatch();
    exporter.incrementArgsMismatch();
    assertEquals(1.0, counter("emitter.send.not.found").count());
    assertEquals(2.0, counter("emitter.send.args.mismatch").count());
  }

  @Test
  void incrementEnqueuedAndRejected() {
    exporter.incrementEnqueued();
    exporter.incrementEnqueued();
    exporter.incrementEnqueued();
    exporter.incrementRejected();
    assertEquals(3.0, counter("emitter.enqueue").count());
    assertEquals(1.0, counter("emitter.enqueue.rejected").count());
  }

  @Test
  void recordQueueDepth() {
    exporter.recordQueueDepth(42);
    assertEquals(42.0, gauge("emitter.queue.depth").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("emitter.queue.depth").value());
  }

  @Test
  void recordHandlerDuration() {
    exporter.recordHandlerDurationMs(15);
    exporter.recordHandlerDurationMs(5);
    Timer timer = registry.find("emitter.handler.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry customRegistry = new SimpleMeterRegistry();
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(customRegistry, "orders.events");

    custom.incrementDispatchSuccess();

    assertEquals(1.0, customRegistry.find("orders.events.dispatch.success").counter().count());
    assertNull(customRegistry.find("emitter.dispatch.success").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "app."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.incrementDispatchSuccess();
    exporter.close();

    assertNull(registry.find("emitter.dispatch.success").counter());
    assertNull(registry.find("emitter.queue.depth").gauge());
    assertNull(registry.find("emitter.handler.duration").timer());

    exporter.incrementDispatchSuccess();
    exporter.recordQueueDepth(3);
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void eventBusReportsThroughExporter() {
    EventBus events = EventBus.builder().metrics(exporter).build();
    events.on("add", (Integer a, Integer b) -> {});
    events.on("boom", () -> {
      throw new IllegalStateException("raise");
    });

    assertEquals(EmitStatus.OK, events.send("add", 1, 2));
    assertEquals(EmitStatus.ARGS_NOT_MATCH, events.send("add", 1));
    assertEquals(EmitStatus.NOT_FOUND, events.send("missing"));
    assertEquals(EmitStatus.HANDLER_FAILED, events.send("boom"));

    assertEquals(1.0, counter("emitter.dispatch.success").count());
    assertEquals(1.0, counter("emitter.dispatch.failure").count());
    assertEquals(1.0, counter("emitter.send.args.mismatch").count());
    assertEquals(1.0, counter("emitter.send.not.found").count());
    assertEquals(2, registry.find("emitter.handler.duration").timer().count());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
