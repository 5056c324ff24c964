package io.intellixity.nativa.mime.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TypeLoadersTest {

  private static URLClassLoader withFactories(Path dir, String listing) throws Exception {
    Path file = dir.resolve(TypeLoaders.FACTORIES_RESOURCE);
    Files.createDirectories(file.getParent());
    Files.writeString(file, TypeLoader.class.getName() + "=" + listing + "\n");
    return new URLClassLoader(new URL[] { dir.toUri().toURL() }, TypeLoadersTest.class.getClassLoader());
  }

  @Test
  void discoversLoadersFromFactoriesFile() {
    TypeLoaders loaders = new TypeLoaders();
    assertTrue(loaders.formats().contains("fixed"));

    RegistryIndex idx = loaders.forFormat(" FIXED ").load();
    assertEquals(1, idx.count());
    assertEquals("text/plain", idx.typeFor("notes.txt").get(0).contentType());
  }

  @Test
  void classListedTwiceIsCreatedOnce(@TempDir Path dir) throws Exception {
    try (URLClassLoader cl = withFactories(dir, " " + FixedTypeLoader.class.getName() + " , ")) {
      List<TypeLoader> found = TypeLoaders.discover(cl);
      assertEquals(1, found.size());
      assertInstanceOf(FixedTypeLoader.class, found.get(0));
    }
  }

  @Test
  void unknownClassNamesItsFactoriesFile(@TempDir Path dir) throws Exception {
    try (URLClassLoader cl = withFactories(dir, "com.acme.MissingLoader")) {
      TypeLoadException e = assertThrows(TypeLoadException.class, () -> TypeLoaders.discover(cl));
      assertTrue(e.getMessage().contains("com.acme.MissingLoader"), e.getMessage());
      assertTrue(e.getMessage().contains("nativa-mime.factories"), e.getMessage());
    }
  }

  @Test
  void nonLoaderClassIsRejected(@TempDir Path dir) throws Exception {
    try (URLClassLoader cl = withFactories(dir, "java.lang.StringBuilder")) {
      TypeLoadException e = assertThrows(TypeLoadException.class, () -> TypeLoaders.discover(cl));
      assertTrue(e.getMessage().contains("is not a TypeLoader"), e.getMessage());
    }
  }

  @Test
  void firstLoaderForAFormatWins() {
    TypeLoader a = new FixedTypeLoader();
    TypeLoader b = new FixedTypeLoader();
    TypeLoaders loaders = new TypeLoaders(List.of(a, b));
    assertSame(a, loaders.forFormat("fixed"));
  }

  @Test
  void unknownFormatIsRejected() {
    TypeLoaders loaders = new TypeLoaders(List.of(new FixedTypeLoader()));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> loaders.forFormat("yaml"));
    assertTrue(e.getMessage().contains("yaml"));
  }
}
