package io.intellixity.nativa.mime.cache;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.intellixity.nativa.mime.registry.RegistryIndex;
import io.intellixity.nativa.mime.registry.RegistryVersion;
import io.intellixity.nativa.mime.type.TypeDescriptor;
import io.intellixity.nativa.mime.type.ValuePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Snapshot file for a {@link RegistryIndex}, so the type data need not be parsed on every start.\n
 *
 * File layout (gzip compressed JSON):\n
 * <pre>\n
 * { "version": "1.0.0", "types": [ { "content-type": ... }, ... ] }\n
 * </pre>\n
 *
 * The version comes first and is checked before any type is read. Only descriptors are stored;\n
 * the indexes are rebuilt from them.\n
 *
 * Writers publish by renaming a finished temp file over the target, so readers see either the old\n
 * file or the new one. Concurrent writers are not coordinated: the last rename wins.\n
 */
public final class RegistryCache {
  static final String VERSION_FIELD = "version";
  static final String TYPES_FIELD = "types";

  private static final Logger log = LoggerFactory.getLogger(RegistryCache.class);

  private final ObjectMapper mapper;
  private final String version;

  public RegistryCache() {
    this(new ObjectMapper(), RegistryVersion.CURRENT);
  }

  public RegistryCache(ObjectMapper mapper, String version) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.version = Objects.requireNonNull(version, "version");
  }

  public String version() { return version; }

  /**
   * Writes {@code index} to {@code file}.
   *
   * @return false when the file could not be written; the failure is logged, never thrown
   */
  public boolean save(RegistryIndex index, Path file) {
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(file, "file");
    Path target = file.toAbsolutePath();
    Path dir = target.getParent();
    Path tmp = null;
    try {
      Files.createDirectories(dir);
      tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
      try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp));
           JsonGenerator g = mapper.createGenerator(out)) {
        g.writeStartObject();
        g.writeStringField(VERSION_FIELD, version);
        g.writeArrayFieldStart(TYPES_FIELD);
        for (TypeDescriptor t : index) g.writeObject(t);
        g.writeEndArray();
        g.writeEndObject();
      }
      publish(tmp, target);
      log.debug("Wrote content type cache {} ({} types, version {})", target, index.count(), version);
      return true;
    } catch (IOException | RuntimeException e) {
      log.warn("Could not write content type cache {}: {}", target, e.toString());
      deleteQuietly(tmp);
      return false;
    }
  }

  /**
   * Reads a snapshot written by {@link #save(RegistryIndex, Path)}.
   *
   * @return empty when the file is missing, unreadable, corrupt, or written by another version
   */
  public Optional<RegistryIndex> load(Path file) {
    Objects.requireNonNull(file, "file");
    if (!Files.isRegularFile(file)) {
      log.debug("No content type cache at {}", file);
      return Optional.empty();
    }

    try (InputStream in = new GZIPInputStream(Files.newInputStream(file));
         JsonParser p = mapper.createParser(in)) {
      expect(p, p.nextToken(), JsonToken.START_OBJECT);
      expectField(p, VERSION_FIELD);
      String cached = p.nextTextValue();
      if (!version.equals(cached)) {
        log.warn("Content type cache {} is version {}; this registry is version {}, cache ignored", file, cached, version);
        return Optional.empty();
      }

      expectField(p, TYPES_FIELD);
      expect(p, p.nextToken(), JsonToken.START_ARRAY);

      RegistryIndex index = new RegistryIndex();
      ObjectReader reader = mapper.readerFor(TypeDescriptor.class).withAttribute(ValuePool.class, index.valuePool());
      List<TypeDescriptor> types = new ArrayList<>();
      JsonToken t;
      while ((t = p.nextToken()) == JsonToken.START_OBJECT) {
        types.add(reader.readValue(p));
      }
      expect(p, t, JsonToken.END_ARRAY);
      expect(p, p.nextToken(), JsonToken.END_OBJECT);
      if (p.nextToken() != null) throw new JsonParseException(p, "Trailing content after cache payload");

      index.addAll(types, true);
      return Optional.of(index);
    } catch (IOException | RuntimeException e) {
      log.warn("Could not load content type cache {}: {}", file, e.toString());
      return Optional.empty();
    }
  }

  private static void publish(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void expectField(JsonParser p, String name) throws IOException {
    expect(p, p.nextToken(), JsonToken.FIELD_NAME);
    if (!name.equals(p.currentName())) {
      throw new JsonParseException(p, "Expected field '" + name + "' but found '" + p.currentName() + "'");
    }
  }

  private static void expect(JsonParser p, JsonToken actual, JsonToken expected) throws IOException {
    if (actual != expected) throw new JsonParseException(p, "Expected " + expected + " but found " + actual);
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.debug("Could not delete temp cache file {}", tmp, e);
    }
  }
}
