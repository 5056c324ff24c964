package io.intellixity.nativa.mime.defaults;

import io.intellixity.nativa.mime.cache.RegistryCache;
import io.intellixity.nativa.mime.registry.RegistryIndex;
import io.intellixity.nativa.mime.registry.TypeLoader;
import io.intellixity.nativa.mime.registry.TypeLoaders;
import io.intellixity.nativa.mime.type.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Registry populated from the configured cache or loader.\n
 *
 * Population happens once, on {@link #ensurePopulated()} or on first query:\n
 * 1. the cache file, when one is configured and holds a snapshot of this version\n
 * 2. otherwise the loader for {@link RegistrySettings#loadFormat()}; the result is then written to the cache\n
 *
 * Queries are safe from any thread once populated. {@link #add(TypeDescriptor)} is serialized with\n
 * population but not with concurrent queries.\n
 */
public final class DefaultRegistry {
  private static final Logger log = LoggerFactory.getLogger(DefaultRegistry.class);

  private final RegistrySettings settings;
  private final TypeLoaders loaders;
  private final RegistryCache cache;
  private final Object lock = new Object();

  private volatile RegistryIndex index;

  public DefaultRegistry(RegistrySettings settings) {
    this(settings, new TypeLoaders(), new RegistryCache());
  }

  public DefaultRegistry(RegistrySettings settings, TypeLoaders loaders, RegistryCache cache) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.loaders = Objects.requireNonNull(loaders, "loaders");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  /**
   * Process-wide registry configured from the environment. Unless lazy loading is configured the
   * registry is populated before it is returned; a failed population is retried by the next call.
   */
  public static DefaultRegistry instance() {
    return populateUnlessLazy(Holder.INSTANCE);
  }

  static DefaultRegistry populateUnlessLazy(DefaultRegistry registry) {
    if (!registry.settings().lazyLoad()) registry.ensurePopulated();
    return registry;
  }

  public RegistrySettings settings() { return settings; }

  public boolean isPopulated() { return index != null; }

  /** Populates the registry unless already done; concurrent callers wait for a single build. */
  public void ensurePopulated() {
    if (index != null) return;
    synchronized (lock) {
      if (index == null) index = populate();
    }
  }

  /** The populated index. */
  public RegistryIndex index() {
    ensurePopulated();
    return index;
  }

  // ---- queries ----

  public List<TypeDescriptor> lookup(String typeId) {
    return index().lookup(typeId);
  }

  public List<TypeDescriptor> lookup(String typeId, boolean complete, boolean registered) {
    return index().lookup(typeId, complete, registered);
  }

  public List<TypeDescriptor> lookup(Pattern pattern, boolean complete, boolean registered) {
    return index().lookup(pattern, complete, registered);
  }

  public List<TypeDescriptor> typeFor(String filename) {
    return index().typeFor(filename);
  }

  public List<TypeDescriptor> typeFor(Collection<String> filenames) {
    return index().typeFor(filenames);
  }

  public int count() {
    return index().count();
  }

  public Stream<TypeDescriptor> stream() {
    return index().stream();
  }

  // ---- registration ----

  public void add(TypeDescriptor type) {
    add(type, false);
  }

  public void add(TypeDescriptor type, boolean quiet) {
    Objects.requireNonNull(type, "type");
    ensurePopulated();
    synchronized (lock) {
      index.add(type, quiet);
    }
  }

  @Override
  public String toString() {
    RegistryIndex i = index;
    return "DefaultRegistry[" + (i == null ? "unpopulated" : i.toString()) + "]";
  }

  private RegistryIndex populate() {
    if (settings.cachePath() != null) {
      Optional<RegistryIndex> cached = cache.load(settings.cachePath());
      if (cached.isPresent()) {
        log.info("Loaded {} content types from cache {}", cached.get().count(), settings.cachePath());
        return cached.get();
      }
    }

    TypeLoader loader = loaders.forFormat(settings.loadFormat());
    RegistryIndex loaded = loader.load();
    log.info("Loaded {} content types with the {} loader", loaded.count(), loader.format());

    if (settings.cachePath() != null) cache.save(loaded, settings.cachePath());
    return loaded;
  }

  private static final class Holder {
    static final DefaultRegistry INSTANCE = new DefaultRegistry(RegistrySettings.fromEnvironment());
  }
}
