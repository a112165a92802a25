package ca.gc.cra.imagine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImagineConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadsDefaultsWhenNothingConfigured() throws IOException {
    ImagineConfig config = ImagineConfigLoader.load(null, new Properties());
    assertEquals(ImagineConfig.defaults(), config);
  }

  @Test
  void missingFileFallsBackToDefaults() throws IOException {
    ImagineConfig config = ImagineConfigLoader.load(tempDir.resolve("missing.yaml"), new Properties());
    assertEquals(ImagineConfig.defaults(), config);
  }

  @Test
  void yamlSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("imagine.yaml");
    Files.writeString(yaml, """
        common:
          balanceCheck: off
          metrics:
            prefix: shared
        imagine:
          balanceCheck: fail
          log:
            argumentBytes: 64
        """);

    ImagineConfig config = ImagineConfigLoader.load(yaml, new Properties());

    assertEquals(BalanceCheck.FAIL, config.balanceCheck());
    assertEquals("shared", config.metricsPrefix());
    assertEquals(64, config.logArgumentBytes());
    assertFalse(config.metricsEnabled());
  }

  @Test
  void propertiesFileAcceptsPrefixedAndPlainKeys() throws IOException {
    Path props = tempDir.resolve("imagine.properties");
    Files.writeString(props, "imagine.balanceCheck=off\nmetrics.prefix=whatif\n");

    ImagineConfig config = ImagineConfigLoader.load(props, new Properties());

    assertEquals(BalanceCheck.OFF, config.balanceCheck());
    assertEquals("whatif", config.metricsPrefix());
  }

  @Test
  void systemPropertiesWinOverFile() throws IOException {
    Path props = tempDir.resolve("imagine.properties");
    Files.writeString(props, "balanceCheck=off\n");
    Properties system = new Properties();
    system.setProperty("imagine.balanceCheck", "fail");
    system.setProperty("imagine.config", props.toString());
    system.setProperty("unrelated.key", "x");

    ImagineConfig config = ImagineConfigLoader.load(props, system);

    assertEquals(BalanceCheck.FAIL, config.balanceCheck());
  }

  @Test
  void invalidValueNamesTheKey() throws IOException {
    Path props = tempDir.resolve("bad.properties");
    Files.writeString(props, "log.argumentBytes=0\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ImagineConfigLoader.load(props, new Properties()));
    assertTrue(ex.getMessage().contains("log.argumentBytes"));
  }

  @Test
  void unknownBalanceCheckIsRejected() {
    Properties system = new Properties();
    system.setProperty("imagine.balanceCheck", "sometimes");
    assertThrows(IllegalArgumentException.class, () -> ImagineConfigLoader.load(null, system));
  }
}
