package io.intellixity.nativa.mime.defaults;

import io.intellixity.nativa.mime.loader.JsonTypeLoader;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * How the default registry is populated.\n
 *
 * Environment:\n
 * - {@value #LAZY_LOAD_ENV}: anything but {@code false} defers population to first use (default: lazy)\n
 * - {@value #CACHE_ENV}: cache file path; unset or blank disables the cache\n
 * - {@value #LOAD_FORMAT_ENV}: loader format (default {@value JsonTypeLoader#FORMAT})\n
 *
 * @param cachePath nullable
 */
public record RegistrySettings(boolean lazyLoad, Path cachePath, String loadFormat) {
  public static final String LAZY_LOAD_ENV = "NATIVA_MIME_LAZY_LOAD";
  public static final String CACHE_ENV = "NATIVA_MIME_CACHE";
  public static final String LOAD_FORMAT_ENV = "NATIVA_MIME_LOAD_FORMAT";

  public RegistrySettings {
    Objects.requireNonNull(loadFormat, "loadFormat");
    if (loadFormat.isBlank()) throw new IllegalArgumentException("loadFormat must not be blank");
  }

  public static RegistrySettings defaults() {
    return new RegistrySettings(true, null, JsonTypeLoader.FORMAT);
  }

  public static RegistrySettings fromEnvironment() {
    return from(System::getenv);
  }

  public static RegistrySettings from(Function<String, String> env) {
    Objects.requireNonNull(env, "env");
    String lazy = env.apply(LAZY_LOAD_ENV);
    boolean lazyLoad = lazy == null || !"false".equals(lazy.trim().toLowerCase(Locale.ROOT));

    String cache = env.apply(CACHE_ENV);
    Path cachePath = cache == null || cache.isBlank() ? null : Path.of(cache.trim());

    String format = env.apply(LOAD_FORMAT_ENV);
    String loadFormat = format == null || format.isBlank() ? JsonTypeLoader.FORMAT : format.trim();

    return new RegistrySettings(lazyLoad, cachePath, loadFormat);
  }

  public RegistrySettings withCachePath(Path path) {
    return new RegistrySettings(lazyLoad, path, loadFormat);
  }
}
