package io.intellixity.nativa.mime.loader;

import io.intellixity.nativa.mime.registry.RegistryIndex;
import io.intellixity.nativa.mime.registry.TypeLoadException;
import io.intellixity.nativa.mime.registry.TypeLoader;
import io.intellixity.nativa.mime.type.InvalidContentTypeException;
import io.intellixity.nativa.mime.type.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Loads Apache style {@code mime.types} tables.\n
 *
 * <pre>\n
 * # comment\n
 * text/html            html htm\n
 * application/x-empty\n
 * </pre>\n
 *
 * Each line is a content type followed by its extensions. Types from this format carry no\n
 * registration data, so they are unregistered with the default encoding. A type repeated in the\n
 * same table gets the extensions of every line.\n
 */
public final class MimeTypesFileLoader implements TypeLoader {
  public static final String FORMAT = "mime.types";
  public static final String DEFAULT_RESOURCE = "nativa-mime/mime.types";

  private static final Logger log = LoggerFactory.getLogger(MimeTypesFileLoader.class);
  private static final Pattern SPLIT = Pattern.compile("\\s+");

  private final Path path;
  private final String resource;
  private final ClassLoader classLoader;

  public MimeTypesFileLoader() {
    this(DEFAULT_RESOURCE, MimeTypesFileLoader.class.getClassLoader());
  }

  public MimeTypesFileLoader(String resource, ClassLoader classLoader) {
    this.path = null;
    this.resource = Objects.requireNonNull(resource, "resource");
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  public MimeTypesFileLoader(Path path) {
    this.path = Objects.requireNonNull(path, "path");
    this.resource = null;
    this.classLoader = null;
  }

  @Override
  public String format() { return FORMAT; }

  @Override
  public void loadInto(RegistryIndex index) {
    Objects.requireNonNull(index, "index");
    String source = path == null ? "classpath:" + resource : path.toString();
    try (InputStream in = open()) {
      parse(new InputStreamReader(in, StandardCharsets.UTF_8), source, index);
    } catch (IOException e) {
      throw new TypeLoadException("Failed to read " + source, e);
    }
  }

  private InputStream open() throws IOException {
    if (path != null) return Files.newInputStream(path);
    InputStream in = classLoader.getResourceAsStream(resource);
    if (in == null) throw new TypeLoadException("Missing type resource: " + resource);
    return in;
  }

  static void parse(Reader reader, String source, RegistryIndex index) throws IOException {
    Map<String, TypeDescriptor> seen = new LinkedHashMap<>();
    BufferedReader r = new BufferedReader(reader);
    String line;
    int lineNo = 0;
    while ((line = r.readLine()) != null) {
      lineNo++;
      int comment = line.indexOf('#');
      if (comment >= 0) line = line.substring(0, comment);
      line = line.trim();
      if (line.isEmpty()) continue;

      String[] parts = SPLIT.split(line);
      List<String> exts = Arrays.asList(parts).subList(1, parts.length);
      TypeDescriptor t = seen.get(parts[0]);
      if (t == null) {
        try {
          t = new TypeDescriptor(parts[0], index.valuePool());
        } catch (InvalidContentTypeException e) {
          throw new TypeLoadException(source + ":" + lineNo + ": " + e.getMessage(), e);
        }
        t.setExtensions(exts);
        seen.put(parts[0], t);
      } else {
        t.addExtensions(exts.toArray(new String[0]));
      }
    }
    index.addAll(seen.values(), true);
    log.debug("Loaded {} content types from {}", seen.size(), source);
  }
}
