package io.intellixity.nativa.mime.defaults;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RegistrySettingsTest {

  @Test
  void unsetEnvironmentGivesLazyJsonWithoutCache() {
    RegistrySettings s = RegistrySettings.from(k -> null);
    assertTrue(s.lazyLoad());
    assertNull(s.cachePath());
    assertEquals("json", s.loadFormat());
    assertEquals(RegistrySettings.defaults(), s);
  }

  @Test
  void onlyFalseDisablesLazyLoading() {
    assertFalse(RegistrySettings.from(Map.of(RegistrySettings.LAZY_LOAD_ENV, "false")::get).lazyLoad());
    assertFalse(RegistrySettings.from(Map.of(RegistrySettings.LAZY_LOAD_ENV, " FALSE ")::get).lazyLoad());
    assertTrue(RegistrySettings.from(Map.of(RegistrySettings.LAZY_LOAD_ENV, "no")::get).lazyLoad());
    assertTrue(RegistrySettings.from(Map.of(RegistrySettings.LAZY_LOAD_ENV, "")::get).lazyLoad());
  }

  @Test
  void cacheAndFormatAreRead() {
    Map<String, String> env = Map.of(
        RegistrySettings.CACHE_ENV, "/tmp/types.cache",
        RegistrySettings.LOAD_FORMAT_ENV, "mime.types");
    RegistrySettings s = RegistrySettings.from(env::get);
    assertEquals(Path.of("/tmp/types.cache"), s.cachePath());
    assertEquals("mime.types", s.loadFormat());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    Map<String, String> env = Map.of(RegistrySettings.CACHE_ENV, "  ", RegistrySettings.LOAD_FORMAT_ENV, "");
    RegistrySettings s = RegistrySettings.from(env::get);
    assertNull(s.cachePath());
    assertEquals("json", s.loadFormat());
  }

  @Test
  void blankFormatIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RegistrySettings(true, null, " "));
    assertThrows(NullPointerException.class, () -> new RegistrySettings(true, null, null));
  }
}
