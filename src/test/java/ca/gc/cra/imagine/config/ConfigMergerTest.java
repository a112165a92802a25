package ca.gc.cra.imagine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void precedenceIsOverridesThenFileThenDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Map.of("a", "default-a", "b", "default-b", "c", "default-c"),
        Optional.of(Map.of("b", "file-b", "c", "file-c")),
        Map.of("c", "override-c"),
        warnings::add);

    assertEquals(Map.of("a", "default-a", "b", "file-b", "c", "override-c"), merged);
    assertEquals(List.of("System property imagine.c overrides config file value"), warnings);
  }

  @Test
  void unknownKeysAreReportedAndDropped() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Map.of("a", "1"),
        Optional.of(Map.of("typo", "x")),
        Map.of("other", "y"),
        warnings::add);

    assertFalse(merged.containsKey("typo"));
    assertFalse(merged.containsKey("other"));
    assertEquals(2, warnings.size());
  }

  @Test
  void systemOverridesStripPrefixAndSkipLocator() {
    Properties props = new Properties();
    props.setProperty("imagine.balanceCheck", "fail");
    props.setProperty("imagine.config", "/tmp/imagine.yaml");
    props.setProperty("java.version", "17");

    assertEquals(Map.of("balanceCheck", "fail"), ConfigMerger.systemOverrides(props));
  }
}
