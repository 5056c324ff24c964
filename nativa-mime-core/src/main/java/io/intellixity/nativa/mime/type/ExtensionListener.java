package io.intellixity.nativa.mime.type;

import java.util.Set;

/**
 * Notified after the extension list of a {@link TypeDescriptor} is reassigned.
 * Registry indexes subscribe to every descriptor they hold so they can re-index.
 */
@FunctionalInterface
public interface ExtensionListener {
  void extensionsChanged(TypeDescriptor type, Set<String> previous);
}
