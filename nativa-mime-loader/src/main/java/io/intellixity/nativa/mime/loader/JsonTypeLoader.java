package io.intellixity.nativa.mime.loader;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.intellixity.nativa.mime.registry.RegistryIndex;
import io.intellixity.nativa.mime.registry.TypeLoadException;
import io.intellixity.nativa.mime.registry.TypeLoader;
import io.intellixity.nativa.mime.type.TypeDescriptor;
import io.intellixity.nativa.mime.type.ValuePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Loads JSON type documents: an array of descriptor mappings per document.\n
 *
 * Sources:\n
 * - a classpath resource (default {@value #DEFAULT_RESOURCE})\n
 * - a single {@code .json} file\n
 * - a directory of {@code .json} files, read in file name order\n
 */
public final class JsonTypeLoader implements TypeLoader {
  public static final String FORMAT = "json";
  public static final String DEFAULT_RESOURCE = "nativa-mime/types.json";

  private static final Logger log = LoggerFactory.getLogger(JsonTypeLoader.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private final Path path;
  private final String resource;
  private final ClassLoader classLoader;

  public JsonTypeLoader() {
    this(DEFAULT_RESOURCE, JsonTypeLoader.class.getClassLoader());
  }

  public JsonTypeLoader(String resource, ClassLoader classLoader) {
    this.path = null;
    this.resource = Objects.requireNonNull(resource, "resource");
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  public JsonTypeLoader(Path path) {
    this.path = Objects.requireNonNull(path, "path");
    this.resource = null;
    this.classLoader = null;
  }

  @Override
  public String format() { return FORMAT; }

  @Override
  public void loadInto(RegistryIndex index) {
    Objects.requireNonNull(index, "index");
    if (path == null) {
      try (InputStream in = classLoader.getResourceAsStream(resource)) {
        if (in == null) throw new TypeLoadException("Missing type resource: " + resource);
        readDocument(in, "classpath:" + resource, index);
      } catch (IOException e) {
        throw new TypeLoadException("Failed to read " + resource, e);
      }
      return;
    }

    for (Path file : documents(path)) {
      try (InputStream in = Files.newInputStream(file)) {
        readDocument(in, file.toString(), index);
      } catch (IOException e) {
        throw new TypeLoadException("Failed to read " + file, e);
      }
    }
  }

  private static List<Path> documents(Path path) {
    if (!Files.isDirectory(path)) return List.of(path);
    try (Stream<Path> files = Files.list(path)) {
      return files
          .filter(p -> p.getFileName().toString().endsWith(".json"))
          .filter(Files::isRegularFile)
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new TypeLoadException("Failed to list " + path, e);
    }
  }

  private static void readDocument(InputStream in, String source, RegistryIndex index) throws IOException {
    ObjectReader reader = JSON.readerFor(TypeDescriptor.class).withAttribute(ValuePool.class, index.valuePool());
    List<TypeDescriptor> types = new ArrayList<>();
    // array elements read so far, nulls included
    int consumed = 0;
    try (MappingIterator<TypeDescriptor> it = reader.readValues(in)) {
      while (it.hasNextValue()) {
        TypeDescriptor t = it.nextValue();
        consumed++;
        if (t != null) types.add(t);
      }
    } catch (RuntimeException | JsonMappingException e) {
      throw new TypeLoadException("Invalid type definition #" + (consumed + 1) + " in " + source + ": " + e.getMessage(), e);
    }
    index.addAll(types, true);
    log.debug("Loaded {} content types from {}", types.size(), source);
  }
}
