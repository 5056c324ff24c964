package io.intellixity.nativa.mime.type;

import java.util.Comparator;

/**
 * Orders descriptors by how reliable they are when several match the same lookup.\n
 *
 * First discriminating rule wins:\n
 * - registered before unregistered\n
 * - complete (has extensions) before incomplete\n
 * - current before obsolete\n
 * - obsolete with a replacement name before obsolete without one\n
 * - replacement names compared lexically\n
 *
 * The content type itself is not compared; see {@link #LOOKUP_ORDER} for the order lookups return.
 */
public final class PriorityComparator implements Comparator<TypeDescriptor> {
  public static final PriorityComparator INSTANCE = new PriorityComparator();

  /** Priority first, then {@link TypeDescriptor#simplified()}. */
  public static final Comparator<TypeDescriptor> LOOKUP_ORDER =
      INSTANCE.thenComparing(Comparator.<TypeDescriptor>naturalOrder());

  private PriorityComparator() {}

  @Override
  public int compare(TypeDescriptor a, TypeDescriptor b) {
    if (a.registered() != b.registered()) return a.registered() ? -1 : 1;
    if (a.complete() != b.complete()) return a.complete() ? -1 : 1;
    if (a.obsolete() != b.obsolete()) return a.obsolete() ? 1 : -1;
    if (!a.obsolete()) return 0;

    String ui = a.useInstead();
    String oui = b.useInstead();
    if (ui == null && oui == null) return 0;
    if (ui == null) return 1;
    if (oui == null) return -1;
    return ui.compareTo(oui);
  }
}
