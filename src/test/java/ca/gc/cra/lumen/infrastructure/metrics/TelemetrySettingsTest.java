package ca.gc.cra.lumen.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {

  @Test
  void blankValuesFallBackToDefaults() {
    TelemetrySettings settings = new TelemetrySettings(" ", null, null);

    assertFalse(settings.enabled());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals(Duration.ofSeconds(30), settings.exportInterval());
  }

  @Test
  void otlpIsCaseInsensitive() {
    assertTrue(new TelemetrySettings("OTLP", "http://collector:4317", null).enabled());
  }

  @Test
  void unknownExporterRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TelemetrySettings("prometheus", null, null));
  }
}
