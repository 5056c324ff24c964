package io.intellixity.nativa.mime.registry;

/**
 * Source of content type definitions for one on-disk representation.\n
 *
 * Implementations are discovered through {@code META-INF/nativa-mime.factories}\n
 * (see {@link TypeLoaders}) and must have a public no-arg constructor.\n
 */
public interface TypeLoader {
  /** Representation handled by this loader, e.g. {@code json} or {@code mime.types}. */
  String format();

  /**
   * Adds every definition to {@code index}. Output must be deterministic for a given data version.
   *
   * @throws TypeLoadException when the source cannot be read or holds an invalid definition
   */
  void loadInto(RegistryIndex index);

  default RegistryIndex load() {
    RegistryIndex index = new RegistryIndex();
    loadInto(index);
    return index;
  }
}
