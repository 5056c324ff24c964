package io.intellixity.nativa.mime.type;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PriorityComparatorTest {

  private static TypeDescriptor type(boolean registered, boolean complete, boolean obsolete, String useInstead) {
    TypeDescriptor t = new TypeDescriptor("application/example");
    t.setRegistered(registered);
    if (complete) t.setExtensions(List.of("ex"));
    t.setObsolete(obsolete);
    t.setUseInstead(useInstead);
    return t;
  }

  private static List<TypeDescriptor> sorted(TypeDescriptor... ts) {
    List<TypeDescriptor> out = new ArrayList<>(List.of(ts));
    out.sort(PriorityComparator.INSTANCE);
    return out;
  }

  @Test
  void registeredSortsFirst() {
    TypeDescriptor a = type(true, true, false, null);
    TypeDescriptor b = type(false, true, false, null);
    List<TypeDescriptor> out = sorted(b, a);
    assertSame(a, out.get(0));
    assertSame(b, out.get(1));
  }

  @Test
  void completeBeforeIncomplete_currentBeforeObsolete() {
    TypeDescriptor complete = type(false, true, false, null);
    TypeDescriptor incomplete = type(false, false, false, null);
    assertSame(complete, sorted(incomplete, complete).get(0));

    TypeDescriptor current = type(true, true, false, null);
    TypeDescriptor obsolete = type(true, true, true, null);
    assertSame(current, sorted(obsolete, current).get(0));
  }

  @Test
  void obsoleteWithReplacementSortsFirst() {
    TypeDescriptor c = type(false, false, true, "x/y");
    TypeDescriptor d = type(false, false, true, null);
    List<TypeDescriptor> out = sorted(d, c);
    assertSame(c, out.get(0));
    assertSame(d, out.get(1));
  }

  @Test
  void replacementNamesCompareLexically() {
    TypeDescriptor a = type(false, false, true, "a/b");
    TypeDescriptor z = type(false, false, true, "z/b");
    assertTrue(PriorityComparator.INSTANCE.compare(a, z) < 0);
    assertTrue(PriorityComparator.INSTANCE.compare(z, a) > 0);
  }

  @Test
  void otherwiseEqual_andStableSortKeepsOrder() {
    TypeDescriptor a = type(true, true, false, "ignored/when-current");
    TypeDescriptor b = type(true, true, false, null);
    assertEquals(0, PriorityComparator.INSTANCE.compare(a, b));
    List<TypeDescriptor> out = sorted(b, a);
    assertSame(b, out.get(0));
  }

  @Test
  void lookupOrderBreaksTiesOnSimplified() {
    TypeDescriptor xml = new TypeDescriptor("text/xml");
    TypeDescriptor app = new TypeDescriptor("application/xml");
    List<TypeDescriptor> out = new ArrayList<>(List.of(xml, app));
    out.sort(PriorityComparator.LOOKUP_ORDER);
    assertEquals(List.of(app, xml), out);
  }
}
