package io.intellixity.nativa.mime.loader;

import io.intellixity.nativa.mime.registry.RegistryIndex;
import io.intellixity.nativa.mime.registry.TypeLoadException;
import io.intellixity.nativa.mime.registry.TypeLoaders;
import io.intellixity.nativa.mime.type.TypeDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonTypeLoaderTest {

  private static List<String> names(List<TypeDescriptor> types) {
    return types.stream().map(TypeDescriptor::contentType).toList();
  }

  @Test
  void bundledDataLoads() {
    RegistryIndex idx = new JsonTypeLoader().load();

    assertEquals(38, idx.count());
    assertEquals(List.of("application/xml", "text/xml"), names(idx.typeFor("report.xml")));
    assertEquals(List.of("text/javascript", "application/javascript", "application/x-javascript"),
        names(idx.typeFor("app.js")));
    assertEquals(List.of("application/zip", "application/x-zip-compressed"), names(idx.typeFor("bundle.ZIP")));
  }

  @Test
  void bundledDataKeepsVariantsAndFlags() {
    RegistryIndex idx = new JsonTypeLoader().load();

    List<TypeDescriptor> plain = idx.lookup("text/plain");
    assertEquals(2, plain.size());
    assertTrue(plain.get(0).registered());
    assertEquals("VMS text variant", plain.get(1).docs());

    TypeDescriptor sig = idx.lookup("application/pgp-signature").get(0);
    assertTrue(sig.signature());
    assertEquals("7bit", sig.encoding());

    TypeDescriptor js = idx.lookup("application/javascript").get(0);
    assertTrue(js.obsolete());
    assertEquals("text/javascript", js.useInstead());
    assertEquals(1, idx.lookup("application/javascript", false, true).size());
  }

  @Test
  void discoveredUnderJsonFormat() {
    assertInstanceOf(JsonTypeLoader.class, new TypeLoaders().forFormat("json"));
  }

  @Test
  void directoryDocumentsAreReadInNameOrder(@TempDir Path dir) throws Exception {
    Files.writeString(dir.resolve("b.json"), """
        [ { "content-type": "text/x-b", "extensions": ["shared"] } ]
        """);
    Files.writeString(dir.resolve("a.json"), """
        [ { "content-type": "text/x-a", "extensions": ["shared"] },
          { "content-type": "text/x-a2" } ]
        """);
    Files.writeString(dir.resolve("notes.txt"), "not json");

    RegistryIndex idx = new JsonTypeLoader(dir).load();
    assertEquals(3, idx.count());
    assertEquals(List.of("text/x-a", "text/x-b"), names(idx.typeFor("f.shared")));
    assertEquals(List.of("text/x-a", "text/x-a2", "text/x-b"), names(idx.stream().toList()));
  }

  @Test
  void invalidDefinitionNamesItsSource(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("broken.json");
    Files.writeString(file, """
        [ { "content-type": "text/plain" }, { "content-type": "plain" } ]
        """);

    TypeLoadException e = assertThrows(TypeLoadException.class, () -> new JsonTypeLoader(file).load());
    assertTrue(e.getMessage().contains("broken.json"), e.getMessage());
    assertTrue(e.getMessage().contains("#2"), e.getMessage());
  }

  @Test
  void entryNumberCountsSkippedNulls(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("sparse.json");
    Files.writeString(file, """
        [ null, { "content-type": "text/plain" }, null, { "content-type": "plain" } ]
        """);

    TypeLoadException e = assertThrows(TypeLoadException.class, () -> new JsonTypeLoader(file).load());
    assertTrue(e.getMessage().contains("#4"), e.getMessage());
  }

  @Test
  void missingResourceFails() {
    JsonTypeLoader loader = new JsonTypeLoader("nativa-mime/none.json", getClass().getClassLoader());
    assertThrows(TypeLoadException.class, loader::load);
  }
}
