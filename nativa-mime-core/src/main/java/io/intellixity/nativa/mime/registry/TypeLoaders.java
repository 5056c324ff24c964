package io.intellixity.nativa.mime.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * {@link TypeLoader}s by format.\n
 *
 * Discovery reads every {@value #FACTORIES_RESOURCE} on the classpath. Each is a Properties file listing\n
 * loader classes under the {@link TypeLoader} interface name, comma separated:\n
 *
 * <pre>\n
 * io.intellixity.nativa.mime.registry.TypeLoader=com.acme.YamlTypeLoader,com.acme.CsvTypeLoader\n
 * </pre>\n
 *
 * A class listed by several files is created once. For a format claimed by several loaders the first\n
 * one discovered wins.\n
 */
public final class TypeLoaders {
  public static final String FACTORIES_RESOURCE = "META-INF/nativa-mime.factories";

  private static final Logger log = LoggerFactory.getLogger(TypeLoaders.class);

  private final Map<String, TypeLoader> byFormat;

  /** Loaders discovered through the context class loader. */
  public TypeLoaders() {
    this(discover(Thread.currentThread().getContextClassLoader()));
  }

  public TypeLoaders(List<TypeLoader> loaders) {
    Objects.requireNonNull(loaders, "loaders");
    Map<String, TypeLoader> m = new LinkedHashMap<>();
    for (TypeLoader l : loaders) {
      if (l == null) continue;
      String f = normalizeFormat(l.format());
      if (f.isEmpty()) continue;
      TypeLoader winner = m.putIfAbsent(f, l);
      if (winner != null && winner != l) {
        log.debug("Format {} already served by {}; ignoring {}", f, winner.getClass().getName(), l.getClass().getName());
      }
    }
    this.byFormat = Collections.unmodifiableMap(m);
  }

  public Set<String> formats() { return byFormat.keySet(); }

  public TypeLoader forFormat(String format) {
    TypeLoader l = byFormat.get(normalizeFormat(format));
    if (l == null) {
      throw new IllegalArgumentException("No TypeLoader for format: " + format + " (known=" + byFormat.keySet() + ")");
    }
    return l;
  }

  /**
   * Creates the loaders listed in the factories files visible to {@code cl}, in classpath order.
   *
   * @throws TypeLoadException when a factories file cannot be read or a listed class is not a usable loader
   */
  public static List<TypeLoader> discover(ClassLoader cl) {
    if (cl == null) cl = TypeLoaders.class.getClassLoader();

    // class name -> factories file that listed it first
    Map<String, URL> listed = new LinkedHashMap<>();
    for (URL url : factoriesFiles(cl)) {
      for (String name : loaderNames(url)) listed.putIfAbsent(name, url);
    }

    List<TypeLoader> out = new ArrayList<>(listed.size());
    for (var e : listed.entrySet()) {
      TypeLoader l = instantiate(e.getKey(), e.getValue(), cl);
      log.debug("Discovered {} loader {} from {}", l.format(), e.getKey(), e.getValue());
      out.add(l);
    }
    return out;
  }

  private static List<URL> factoriesFiles(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(FACTORIES_RESOURCE));
    } catch (IOException e) {
      throw new TypeLoadException("Failed to enumerate " + FACTORIES_RESOURCE, e);
    }
  }

  private static List<String> loaderNames(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new TypeLoadException("Failed to read " + url, e);
    }
    String v = p.getProperty(TypeLoader.class.getName());
    if (v == null || v.isBlank()) return List.of();

    List<String> names = new ArrayList<>();
    for (String part : v.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) names.add(name);
    }
    return names;
  }

  private static TypeLoader instantiate(String name, URL source, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new TypeLoadException("Unknown loader class " + name + " listed in " + source, e);
    }
    if (!TypeLoader.class.isAssignableFrom(raw)) {
      throw new TypeLoadException(name + " listed in " + source + " is not a " + TypeLoader.class.getSimpleName());
    }
    try {
      return (TypeLoader) raw.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new TypeLoadException("Cannot create loader " + name + " listed in " + source, e);
    }
  }

  private static String normalizeFormat(String format) {
    return format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
  }
}
