package io.intellixity.nativa.mime.registry;

/** Version of the registry schema; cache files written by another version are ignored. */
public final class RegistryVersion {
  public static final String CURRENT = "1.0.0";

  private RegistryVersion() {}
}
