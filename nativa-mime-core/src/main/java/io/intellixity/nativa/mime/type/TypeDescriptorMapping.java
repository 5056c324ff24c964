package io.intellixity.nativa.mime.type;

import java.util.*;

/**
 * Mapping form of a {@link TypeDescriptor}: the unit written by loaders' JSON documents and by the cache.\n
 *
 * Keys: content-type, docs, friendly, encoding, extensions, preferred-extension, obsolete, use-instead,\n
 * xrefs, registered, signature. Empty or default values are left out of {@link #toMap(TypeDescriptor)}\n
 * and defaulted by {@link #fromMap(Map, ValuePool)}.\n
 */
public final class TypeDescriptorMapping {
  public static final String CONTENT_TYPE = "content-type";
  public static final String DOCS = "docs";
  public static final String FRIENDLY = "friendly";
  public static final String ENCODING = "encoding";
  public static final String EXTENSIONS = "extensions";
  public static final String PREFERRED_EXTENSION = "preferred-extension";
  public static final String OBSOLETE = "obsolete";
  public static final String USE_INSTEAD = "use-instead";
  public static final String XREFS = "xrefs";
  public static final String REGISTERED = "registered";
  public static final String SIGNATURE = "signature";

  private TypeDescriptorMapping() {}

  public static Map<String, Object> toMap(TypeDescriptor t) {
    Objects.requireNonNull(t, "type");
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(CONTENT_TYPE, t.contentType());
    if (t.docs() != null && !t.docs().isEmpty()) m.put(DOCS, t.docs());
    if (!t.friendly().isEmpty()) m.put(FRIENDLY, new LinkedHashMap<>(t.friendly()));
    m.put(ENCODING, t.encoding());
    if (!t.extensions().isEmpty()) m.put(EXTENSIONS, new ArrayList<>(t.extensions()));
    if (t.preferredExtension() != null) m.put(PREFERRED_EXTENSION, t.preferredExtension());
    if (t.obsolete()) {
      m.put(OBSOLETE, true);
      if (t.useInstead() != null) m.put(USE_INSTEAD, t.useInstead());
    }
    if (!t.xrefs().isEmpty()) {
      Map<String, List<String>> xr = new LinkedHashMap<>();
      for (var e : t.xrefs().entrySet()) {
        List<String> refs = new ArrayList<>(e.getValue());
        Collections.sort(refs);
        xr.put(e.getKey(), refs);
      }
      m.put(XREFS, xr);
    }
    m.put(REGISTERED, t.registered());
    if (t.signature()) m.put(SIGNATURE, true);
    return m;
  }

  /**
   * Builds a descriptor from its mapping form.
   *
   * @throws InvalidContentTypeException when content-type is missing or malformed
   * @throws InvalidEncodingException when encoding is not a supported transfer encoding
   */
  public static TypeDescriptor fromMap(Map<String, ?> m, ValuePool pool) {
    Objects.requireNonNull(m, "mapping");
    Object ct = m.get(CONTENT_TYPE);
    TypeDescriptor t = new TypeDescriptor(ct == null ? null : String.valueOf(ct), pool);

    t.setDocs(stringOrNull(m.get(DOCS)));
    t.setEncoding(stringOrNull(m.get(ENCODING)));
    t.setExtensions(stringList(m.get(EXTENSIONS)));
    String preferred = stringOrNull(m.get(PREFERRED_EXTENSION));
    if (preferred != null) t.setPreferredExtension(preferred);
    t.setObsolete(bool(m.get(OBSOLETE)));
    t.setRegistered(bool(m.get(REGISTERED)));
    t.setSignature(bool(m.get(SIGNATURE)));
    t.setUseInstead(stringOrNull(m.get(USE_INSTEAD)));

    Object xr = m.get(XREFS);
    if (xr instanceof Map<?, ?> xm) {
      Map<String, List<String>> refs = new LinkedHashMap<>();
      for (var e : xm.entrySet()) {
        if (e.getKey() == null) continue;
        refs.put(String.valueOf(e.getKey()), stringList(e.getValue()));
      }
      t.setXrefs(refs);
    } else if (xr != null) {
      throw new IllegalArgumentException(XREFS + " must be a map for " + t + ": " + xr);
    }

    Object fr = m.get(FRIENDLY);
    if (fr instanceof Map<?, ?> fm) {
      for (var e : fm.entrySet()) {
        if (e.getKey() == null || e.getValue() == null) continue;
        t.putFriendly(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
      }
    } else if (fr != null) {
      throw new IllegalArgumentException(FRIENDLY + " must be a map for " + t + ": " + fr);
    }
    return t;
  }

  private static String stringOrNull(Object v) {
    return v == null ? null : String.valueOf(v);
  }

  private static boolean bool(Object v) {
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    return Boolean.parseBoolean(String.valueOf(v));
  }

  private static List<String> stringList(Object v) {
    if (v == null) return List.of();
    Collection<?> c;
    if (v instanceof Collection<?> col) c = col;
    else if (v instanceof Object[] oa) c = Arrays.asList(oa);
    else c = List.of(v);
    List<String> out = new ArrayList<>(c.size());
    for (Object o : c) if (o != null) out.add(String.valueOf(o));
    return out;
  }
}
