package io.intellixity.nativa.mime.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TypeDescriptorMappingTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void toMap_omitsDefaults() {
    TypeDescriptor t = new TypeDescriptor("image/png");
    Map<String, Object> m = TypeDescriptorMapping.toMap(t);
    assertEquals(List.of("content-type", "encoding", "registered"), List.copyOf(m.keySet()));
    assertEquals("image/png", m.get("content-type"));
    assertEquals("base64", m.get("encoding"));
    assertEquals(false, m.get("registered"));
  }

  @Test
  void toMap_writesObsoleteAndReplacementTogether() {
    TypeDescriptor t = TypeDescriptor.of("application/x-old", "old");
    t.setUseInstead("application/new");
    assertFalse(TypeDescriptorMapping.toMap(t).containsKey("use-instead"));

    t.setObsolete(true);
    t.setSignature(true);
    Map<String, Object> m = TypeDescriptorMapping.toMap(t);
    assertEquals(true, m.get("obsolete"));
    assertEquals("application/new", m.get("use-instead"));
    assertEquals(true, m.get("signature"));
    assertEquals("old", m.get("preferred-extension"));
  }

  @Test
  void fromMap_defaultsMissingKeys() {
    TypeDescriptor t = TypeDescriptorMapping.fromMap(Map.of("content-type", "text/plain"), ValuePool.disabled());
    assertEquals("text/plain", t.contentType());
    assertEquals("quoted-printable", t.encoding());
    assertTrue(t.extensions().isEmpty());
    assertFalse(t.registered());
    assertFalse(t.obsolete());
    assertFalse(t.signature());
    assertTrue(t.xrefs().isEmpty());
    assertTrue(t.friendly().isEmpty());
  }

  @Test
  void fromMap_rejectsMissingContentType() {
    assertThrows(InvalidContentTypeException.class,
        () -> TypeDescriptorMapping.fromMap(Map.of("extensions", List.of("x")), ValuePool.disabled()));
  }

  @Test
  void jsonCarriesEveryField() throws Exception {
    String s = """
        {
          "content-type": "application/xml",
          "docs": "Extensible Markup Language",
          "friendly": { "en": "XML Document" },
          "encoding": "8bit",
          "extensions": ["xml", "xsl"],
          "preferred-extension": "xsl",
          "xrefs": { "rfc": ["rfc7303", "rfc3023"] },
          "registered": true
        }
        """;
    ValuePool pool = new ValuePool();
    TypeDescriptor t = JSON.readerFor(TypeDescriptor.class).withAttribute(ValuePool.class, pool).readValue(s);

    assertEquals("application/xml", t.contentType());
    assertEquals("Extensible Markup Language", t.docs());
    assertEquals("XML Document", t.friendly("en"));
    assertEquals("8bit", t.encoding());
    assertEquals(List.of("xml", "xsl"), List.copyOf(t.extensions()));
    assertEquals("xsl", t.preferredExtension());
    assertEquals(Set.of("rfc7303", "rfc3023"), t.xrefs().get("rfc"));
    assertTrue(t.registered());
    assertTrue(pool.size() > 0);

    TypeDescriptor back = JSON.readValue(JSON.writeValueAsString(t), TypeDescriptor.class);
    assertEquals(t, back);
    assertEquals(TypeDescriptorMapping.toMap(t), TypeDescriptorMapping.toMap(back));
    @SuppressWarnings("unchecked")
    Map<String, Object> xrefs = (Map<String, Object>) TypeDescriptorMapping.toMap(back).get("xrefs");
    assertEquals(List.of("rfc3023", "rfc7303"), xrefs.get("rfc"));
  }
}
