package io.intellixity.nativa.mime.registry;

import io.intellixity.nativa.mime.type.ExtensionListener;
import io.intellixity.nativa.mime.type.PriorityComparator;
import io.intellixity.nativa.mime.type.TypeDescriptor;
import io.intellixity.nativa.mime.type.TypeDescriptorMapping;
import io.intellixity.nativa.mime.type.ValuePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A registry of content types.\n
 *
 * Indexes:\n
 * - type variants: simplified content type -> descriptors sharing it (e.g. platform specific variants)\n
 * - extensions: lowercase file extension -> descriptors listing it, derived from the type variants\n
 *
 * Every lookup returns descriptors in {@link PriorityComparator#LOOKUP_ORDER}. Descriptors accumulate;\n
 * there is no removal. The index subscribes to each descriptor it holds and re-indexes it when its\n
 * extension list is reassigned.\n
 *
 * Not thread-safe: populate before sharing, or guard externally.
 */
public final class RegistryIndex implements Iterable<TypeDescriptor> {
  private static final Logger log = LoggerFactory.getLogger(RegistryIndex.class);

  private final ValuePool valuePool;
  private final Map<String, Variants> typeVariants = new TreeMap<>();
  private final Map<String, Variants> extensionIndex = new HashMap<>();
  private final ExtensionListener reindexer = this::reindexExtensions;

  public RegistryIndex() {
    this(new ValuePool());
  }

  public RegistryIndex(ValuePool valuePool) {
    this.valuePool = Objects.requireNonNull(valuePool, "valuePool");
  }

  /** Pool for descriptors built for this index. */
  public ValuePool valuePool() { return valuePool; }

  // ---- lookups ----

  public List<TypeDescriptor> lookup(String typeId) {
    return lookup(typeId, false, false);
  }

  /**
   * Descriptors whose simplified type equals the simplified form of {@code typeId}.
   * An invalid or unknown id yields an empty list.
   *
   * @param complete only descriptors with extensions
   * @param registered only registered descriptors
   */
  public List<TypeDescriptor> lookup(String typeId, boolean complete, boolean registered) {
    String key = TypeDescriptor.simplified(typeId);
    if (key == null) return List.of();
    return prune(typeVariants.get(key), complete, registered);
  }

  public List<TypeDescriptor> lookup(TypeDescriptor type, boolean complete, boolean registered) {
    Objects.requireNonNull(type, "type");
    return prune(typeVariants.get(type.simplified()), complete, registered);
  }

  /** Union of the variants of every simplified key the pattern finds a match in. */
  public List<TypeDescriptor> lookup(Pattern pattern, boolean complete, boolean registered) {
    Objects.requireNonNull(pattern, "pattern");
    List<TypeDescriptor> matches = new ArrayList<>();
    for (var e : typeVariants.entrySet()) {
      if (pattern.matcher(e.getKey()).find()) matches.addAll(e.getValue().items);
    }
    return prune(matches, complete, registered);
  }

  /**
   * Descriptors mapped to the extension of {@code filename}: the text after the last dot of the final
   * path component, lowercased. A name without a dot is used whole, so {@code README} looks up
   * {@code readme}.
   */
  public List<TypeDescriptor> typeFor(String filename) {
    Objects.requireNonNull(filename, "filename");
    return typeFor(List.of(filename));
  }

  /** Merged matches for several filenames; a descriptor matched by more than one name appears once. */
  public List<TypeDescriptor> typeFor(Collection<String> filenames) {
    Objects.requireNonNull(filenames, "filenames");
    Set<TypeDescriptor> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<TypeDescriptor> out = new ArrayList<>();
    for (String fn : filenames) {
      if (fn == null) continue;
      Variants hits = extensionIndex.get(extensionKey(fn));
      if (hits == null) continue;
      for (TypeDescriptor t : hits.items) {
        if (seen.add(t)) out.add(t);
      }
    }
    out.sort(PriorityComparator.LOOKUP_ORDER);
    return Collections.unmodifiableList(out);
  }

  /** The extension index key for a filename. */
  public static String extensionKey(String filename) {
    String s = filename.trim();
    int slash = Math.max(s.lastIndexOf('/'), s.lastIndexOf('\\'));
    if (slash >= 0) s = s.substring(slash + 1);
    int dot = s.lastIndexOf('.');
    if (dot >= 0) s = s.substring(dot + 1);
    return s.toLowerCase(Locale.ROOT);
  }

  // ---- registration ----

  public void add(TypeDescriptor type) {
    add(type, false);
  }

  /**
   * Adds one descriptor. A descriptor equal to an already registered variant is logged as a
   * duplicate (unless {@code quiet}) and still added. Re-adding a held descriptor re-subscribes
   * to it and re-indexes its current extensions.
   */
  public void add(TypeDescriptor type, boolean quiet) {
    Objects.requireNonNull(type, "type");
    Variants variants = typeVariants.computeIfAbsent(type.simplified(), k -> new Variants());
    if (!quiet && variants.containsEqual(type)) {
      log.warn("Type {} is already registered as a variant of {}", type, type.simplified());
    }
    if (!variants.add(type)) unindexExtensions(type);
    type.addListener(reindexer);
    indexExtensions(type);
  }

  public void addAll(Collection<TypeDescriptor> types) {
    addAll(types, false);
  }

  public void addAll(Collection<TypeDescriptor> types, boolean quiet) {
    Objects.requireNonNull(types, "types");
    for (TypeDescriptor t : types) {
      if (t != null) add(t, quiet);
    }
  }

  /** Adds every descriptor of {@code other}; the descriptors are shared, not copied. */
  public void merge(RegistryIndex other) {
    merge(other, false);
  }

  public void merge(RegistryIndex other, boolean quiet) {
    Objects.requireNonNull(other, "other");
    addAll(other.stream().toList(), quiet);
  }

  /** Builds a descriptor from its mapping form with this index's pool and adds it. */
  public TypeDescriptor addMapping(Map<String, ?> mapping) {
    return addMapping(mapping, false);
  }

  public TypeDescriptor addMapping(Map<String, ?> mapping, boolean quiet) {
    TypeDescriptor t = TypeDescriptorMapping.fromMap(mapping, valuePool);
    add(t, quiet);
    return t;
  }

  /** Stops re-indexing on behalf of this index; call when the index is discarded. */
  public void detach() {
    for (Variants v : typeVariants.values()) {
      for (TypeDescriptor t : v.items) t.removeListener(reindexer);
    }
  }

  // ---- inspection ----

  /** Number of type variants. */
  public int count() {
    int n = 0;
    for (Variants v : typeVariants.values()) n += v.items.size();
    return n;
  }

  public int extensionCount() { return extensionIndex.size(); }

  public boolean isEmpty() { return typeVariants.isEmpty(); }

  @Override
  public Iterator<TypeDescriptor> iterator() {
    return stream().iterator();
  }

  public Stream<TypeDescriptor> stream() {
    return typeVariants.values().stream().flatMap(v -> v.items.stream());
  }

  @Override
  public String toString() {
    return "RegistryIndex[" + count() + " variants, " + extensionCount() + " extensions]";
  }

  // ---- internals ----

  private void indexExtensions(TypeDescriptor type) {
    Variants variants = typeVariants.get(type.simplified());
    if (variants == null || !variants.contains(type)) return;
    for (String ext : type.extensions()) {
      extensionIndex.computeIfAbsent(key(ext), k -> new Variants()).add(type);
    }
  }

  private void unindexExtensions(TypeDescriptor type) {
    for (Iterator<Variants> it = extensionIndex.values().iterator(); it.hasNext(); ) {
      Variants hits = it.next();
      hits.remove(type);
      if (hits.items.isEmpty()) it.remove();
    }
  }

  private void reindexExtensions(TypeDescriptor type, Set<String> previous) {
    Variants variants = typeVariants.get(type.simplified());
    if (variants == null || !variants.contains(type)) return;

    Set<String> current = new HashSet<>();
    for (String ext : type.extensions()) current.add(key(ext));
    for (String ext : previous) {
      String k = key(ext);
      if (current.contains(k)) continue;
      Variants hits = extensionIndex.get(k);
      if (hits == null) continue;
      hits.remove(type);
      if (hits.items.isEmpty()) extensionIndex.remove(k);
    }
    indexExtensions(type);
  }

  private String key(String ext) {
    return valuePool.intern(ext.toLowerCase(Locale.ROOT));
  }

  private static List<TypeDescriptor> prune(Collection<TypeDescriptor> matches, boolean complete, boolean registered) {
    if (matches == null || matches.isEmpty()) return List.of();
    List<TypeDescriptor> out = new ArrayList<>(matches.size());
    for (TypeDescriptor t : matches) {
      if (complete && !t.complete()) continue;
      if (registered && !t.registered()) continue;
      out.add(t);
    }
    out.sort(PriorityComparator.LOOKUP_ORDER);
    return Collections.unmodifiableList(out);
  }

  private static List<TypeDescriptor> prune(Variants variants, boolean complete, boolean registered) {
    return prune(variants == null ? null : variants.items, complete, registered);
  }

  /** Insertion-ordered set of descriptors keyed by identity; equal descriptors may coexist. */
  private static final class Variants {
    final List<TypeDescriptor> items = new ArrayList<>(2);

    boolean contains(TypeDescriptor t) {
      for (TypeDescriptor x : items) if (x == t) return true;
      return false;
    }

    boolean containsEqual(TypeDescriptor t) {
      return items.contains(t);
    }

    boolean add(TypeDescriptor t) {
      if (contains(t)) return false;
      items.add(t);
      return true;
    }

    void remove(TypeDescriptor t) {
      items.removeIf(x -> x == t);
    }
  }
}
