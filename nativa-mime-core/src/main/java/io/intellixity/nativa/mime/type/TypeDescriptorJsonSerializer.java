package io.intellixity.nativa.mime.type;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Writes a {@link TypeDescriptor} as its {@link TypeDescriptorMapping mapping form}. */
public final class TypeDescriptorJsonSerializer extends JsonSerializer<TypeDescriptor> {
  @Override
  public void serialize(TypeDescriptor t, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (t == null) {
      g.writeNull();
      return;
    }
    serializers.defaultSerializeValue(TypeDescriptorMapping.toMap(t), g);
  }
}
