package io.intellixity.nativa.mime.type;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The definition of one content type.\n
 *
 * <pre>\n
 * TypeDescriptor text = new TypeDescriptor("text/plain");\n
 * text.mediaType();   // text\n
 * text.subType();     // plain\n
 * text.encoding();    // quoted-printable\n
 * </pre>\n
 *
 * {@link #compareTo(TypeDescriptor)} orders by {@link #simplified()} while {@link #equals(Object)} requires the
 * exact {@link #contentType()}, so the natural ordering is not consistent with equals.
 */
@JsonSerialize(using = TypeDescriptorJsonSerializer.class)
@JsonDeserialize(using = TypeDescriptorJsonDeserializer.class)
public final class TypeDescriptor implements Comparable<TypeDescriptor> {
  public static final String ENCODING_7BIT = "7bit";
  public static final String ENCODING_8BIT = "8bit";
  public static final String ENCODING_QUOTED_PRINTABLE = "quoted-printable";
  public static final String ENCODING_BASE64 = "base64";
  public static final String DEFAULT_ENCODING = "default";

  private static final Pattern MEDIA_TYPE = Pattern.compile("(\\p{Alpha}[-\\w.+]*)/(\\p{Alnum}[-\\w.+]*)");
  private static final Set<String> BINARY_ENCODINGS = Set.of(ENCODING_BASE64, ENCODING_8BIT);
  private static final Set<String> ASCII_ENCODINGS = Set.of(ENCODING_7BIT, ENCODING_QUOTED_PRINTABLE);

  private final ValuePool pool;
  private final String contentType;
  private final String simplified;
  private final String mediaType;
  private final String subType;
  private final String rawMediaType;
  private final String rawSubType;

  private Set<String> extensions = Set.of();
  private String preferredExtension;
  private String encoding;
  private boolean registered;
  private boolean obsolete;
  private boolean signature;
  private String useInstead;
  private String docs;
  private final Map<String, String> friendly = new LinkedHashMap<>();
  private Map<String, Set<String>> xrefs = Map.of();

  private final CopyOnWriteArrayList<ExtensionListener> listeners = new CopyOnWriteArrayList<>();

  public TypeDescriptor(String contentType) {
    this(contentType, ValuePool.disabled());
  }

  public TypeDescriptor(String contentType, ValuePool pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
    Matcher m = match(contentType);
    if (m == null) throw new InvalidContentTypeException(contentType);

    this.contentType = pool.intern(contentType);
    this.rawMediaType = pool.intern(m.group(1));
    this.rawSubType = pool.intern(m.group(2));
    this.simplified = pool.intern(contentType.toLowerCase(Locale.ROOT));
    int slash = simplified.indexOf('/');
    this.mediaType = pool.intern(simplified.substring(0, slash));
    this.subType = pool.intern(simplified.substring(slash + 1));
    this.encoding = defaultEncoding();
  }

  /** Shorthand for a descriptor with a list of extensions. */
  public static TypeDescriptor of(String contentType, String... extensions) {
    TypeDescriptor t = new TypeDescriptor(contentType);
    t.setExtensions(Arrays.asList(extensions));
    return t;
  }

  // ---- identity ----

  public String contentType() { return contentType; }
  public String simplified() { return simplified; }
  public String mediaType() { return mediaType; }
  public String subType() { return subType; }
  public String rawMediaType() { return rawMediaType; }
  public String rawSubType() { return rawSubType; }

  /**
   * True when both types are the same after lowercasing and removing a leading {@code x-}
   * from the media type and the sub type, so {@code x-foo/bar} is like {@code foo/bar}.
   */
  public boolean like(TypeDescriptor other) {
    return other != null && like(other.simplified());
  }

  public boolean like(String other) {
    if (other == null) return false;
    String mine = simplified(simplified, true);
    return mine != null && mine.equals(simplified(other, true));
  }

  // ---- extensions ----

  public Set<String> extensions() { return extensions; }

  /**
   * Replaces the extension list. Null and blank values are dropped and duplicates collapsed; every registry
   * index holding this descriptor is told to re-index it.
   */
  public void setExtensions(Collection<String> values) {
    LinkedHashSet<String> next = new LinkedHashSet<>();
    if (values != null) {
      for (String v : values) {
        if (v != null && !v.isBlank()) next.add(pool.intern(v));
      }
    }
    Set<String> previous = this.extensions;
    this.extensions = Collections.unmodifiableSet(next);
    if (preferredExtension != null && !next.contains(preferredExtension)) preferredExtension = null;
    for (ExtensionListener l : listeners) l.extensionsChanged(this, previous);
  }

  public void addExtensions(String... values) {
    List<String> merged = new ArrayList<>(extensions);
    merged.addAll(Arrays.asList(values));
    setExtensions(merged);
  }

  /** The explicitly preferred extension, or the first extension when none was set. */
  public String preferredExtension() {
    if (preferredExtension != null) return preferredExtension;
    return extensions.isEmpty() ? null : extensions.iterator().next();
  }

  /** A blank value clears the explicit preference. */
  public void setPreferredExtension(String value) {
    if (value != null && value.isBlank()) value = null;
    if (value != null && !extensions.contains(value)) addExtensions(value);
    this.preferredExtension = pool.intern(value);
  }

  /** A descriptor is complete when it lists at least one extension. */
  public boolean complete() { return !extensions.isEmpty(); }

  // ---- encoding ----

  public String encoding() { return encoding; }

  /** {@code null} or {@code "default"} resets to {@link #defaultEncoding()}. */
  public void setEncoding(String value) {
    if (value == null || DEFAULT_ENCODING.equals(value)) {
      this.encoding = defaultEncoding();
    } else if (BINARY_ENCODINGS.contains(value) || ASCII_ENCODINGS.contains(value)) {
      this.encoding = pool.intern(value);
    } else {
      throw new InvalidEncodingException(value);
    }
  }

  public String defaultEncoding() {
    return "text".equals(mediaType) ? ENCODING_QUOTED_PRINTABLE : ENCODING_BASE64;
  }

  public boolean binary() { return BINARY_ENCODINGS.contains(encoding); }
  public boolean ascii() { return ASCII_ENCODINGS.contains(encoding); }

  // ---- registration state ----

  public boolean registered() { return registered; }
  public void setRegistered(boolean registered) { this.registered = registered; }

  public boolean obsolete() { return obsolete; }
  public void setObsolete(boolean obsolete) { this.obsolete = obsolete; }

  /** Replacement type name; only reported while the type is obsolete. */
  public String useInstead() { return obsolete ? useInstead : null; }
  public void setUseInstead(String useInstead) { this.useInstead = pool.intern(useInstead); }

  public boolean signature() { return signature; }
  public void setSignature(boolean signature) { this.signature = signature; }

  // ---- carried data ----

  public String docs() { return docs; }
  public void setDocs(String docs) { this.docs = docs; }

  /** Friendly names keyed by language. */
  public Map<String, String> friendly() { return Collections.unmodifiableMap(friendly); }
  public String friendly(String lang) { return friendly.get(lang); }
  public void putFriendly(String lang, String name) {
    Objects.requireNonNull(lang, "lang");
    if (name == null) friendly.remove(lang);
    else friendly.put(pool.intern(lang), name);
  }

  /** Cross-references keyed by kind (rfc, person, template, ...). */
  public Map<String, Set<String>> xrefs() { return xrefs; }

  public void setXrefs(Map<String, ? extends Collection<String>> values) {
    Map<String, Set<String>> out = new LinkedHashMap<>();
    if (values != null) {
      for (var e : values.entrySet()) {
        if (e.getKey() == null || e.getValue() == null) continue;
        Set<String> refs = new LinkedHashSet<>();
        for (String v : e.getValue()) if (v != null) refs.add(pool.intern(v));
        out.put(pool.intern(e.getKey()), Collections.unmodifiableSet(refs));
      }
    }
    this.xrefs = Collections.unmodifiableMap(out);
  }

  // ---- listeners ----

  public void addListener(ExtensionListener listener) {
    listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ExtensionListener listener) {
    listeners.remove(listener);
  }

  // ---- comparison ----

  @Override
  public int compareTo(TypeDescriptor other) {
    return simplified.compareTo(other.simplified);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return contentType.equals(((TypeDescriptor) o).contentType);
  }

  @Override
  public int hashCode() { return contentType.hashCode(); }

  @Override
  public String toString() { return contentType; }

  // ---- static helpers ----

  /**
   * Lowercase form of {@code contentType}, or null when it is not a valid content type.\n
   *
   * <pre>\n
   * simplified("text/Plain")   // text/plain\n
   * simplified("text/x-Plain") // text/x-plain\n
   * simplified("text/_plain")  // null\n
   * </pre>
   */
  public static String simplified(String contentType) {
    return simplified(contentType, false);
  }

  public static String simplified(String contentType, boolean removeXPrefix) {
    Matcher m = match(contentType);
    if (m == null) return null;
    if (!removeXPrefix) return contentType.toLowerCase(Locale.ROOT);
    return stripX(m.group(1)) + "/" + stripX(m.group(2));
  }

  public static boolean isValid(String contentType) {
    return match(contentType) != null;
  }

  private static Matcher match(String contentType) {
    if (contentType == null) return null;
    Matcher m = MEDIA_TYPE.matcher(contentType);
    return m.matches() ? m : null;
  }

  private static String stripX(String part) {
    String s = part.toLowerCase(Locale.ROOT);
    return s.startsWith("x-") ? s.substring(2) : s;
  }
}
