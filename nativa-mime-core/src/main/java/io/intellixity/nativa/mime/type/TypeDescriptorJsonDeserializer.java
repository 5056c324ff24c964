package io.intellixity.nativa.mime.type;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;

/**
 * Reads a {@link TypeDescriptor} from its mapping form.\n
 *
 * Strings are interned through the {@link ValuePool} found under the {@code ValuePool.class}\n
 * context attribute (see {@code ObjectReader#withAttribute}); without one nothing is pooled.\n
 */
public final class TypeDescriptorJsonDeserializer extends JsonDeserializer<TypeDescriptor> {
  @Override
  public TypeDescriptor deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Type JSON must be an object");

    @SuppressWarnings("unchecked")
    Map<String, Object> m = codec.treeToValue(root, Map.class);
    return TypeDescriptorMapping.fromMap(m, poolOf(ctxt));
  }

  static ValuePool poolOf(DeserializationContext ctxt) {
    Object pool = ctxt.getAttribute(ValuePool.class);
    return pool instanceof ValuePool vp ? vp : ValuePool.disabled();
  }
}
