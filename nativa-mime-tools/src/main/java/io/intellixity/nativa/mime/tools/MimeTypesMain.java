package io.intellixity.nativa.mime.tools;

import io.intellixity.nativa.mime.cache.RegistryCache;
import io.intellixity.nativa.mime.defaults.DefaultRegistry;
import io.intellixity.nativa.mime.defaults.RegistrySettings;
import io.intellixity.nativa.mime.registry.RegistryIndex;
import io.intellixity.nativa.mime.registry.TypeLoadException;
import io.intellixity.nativa.mime.registry.TypeLoader;
import io.intellixity.nativa.mime.registry.TypeLoaders;
import io.intellixity.nativa.mime.type.TypeDescriptor;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * CLI:
 *   MimeTypesMain type &lt;content-type&gt;...
 *   MimeTypesMain for &lt;filename&gt;...
 *   MimeTypesMain warm-cache &lt;cacheFile&gt;
 *
 * Settings come from the NATIVA_MIME_* environment (see {@link RegistrySettings}).
 * Exit codes: 0 ok, 1 nothing found or failure, 2 usage.
 */
public final class MimeTypesMain {
  static final String USAGE = String.join(System.lineSeparator(),
      "Usage: MimeTypesMain type <content-type>...",
      "       MimeTypesMain for <filename>...",
      "       MimeTypesMain warm-cache <cacheFile>");

  private final PrintStream out;
  private final PrintStream err;
  private final RegistrySettings settings;

  MimeTypesMain(PrintStream out, PrintStream err, RegistrySettings settings) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err, System::getenv));
  }

  public static int run(String[] args, PrintStream out, PrintStream err, Function<String, String> env) {
    if (args.length == 0) return usage(err);
    List<String> operands = Arrays.asList(args).subList(1, args.length);
    MimeTypesMain main = new MimeTypesMain(out, err, RegistrySettings.from(env));

    try {
      switch (args[0]) {
        case "type":
          return operands.isEmpty() ? usage(err) : main.types(operands);
        case "for":
          return operands.isEmpty() ? usage(err) : main.filenames(operands);
        case "warm-cache":
          return operands.size() != 1 ? usage(err) : main.warmCache(Paths.get(operands.get(0)));
        default:
          err.println("Unknown command: " + args[0]);
          return usage(err);
      }
    } catch (TypeLoadException | IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  int types(List<String> ids) {
    DefaultRegistry registry = new DefaultRegistry(settings);
    int status = 0;
    for (String id : ids) {
      List<TypeDescriptor> hits = registry.lookup(id);
      if (hits.isEmpty()) {
        err.println("No content type matches " + id);
        status = 1;
      }
      for (TypeDescriptor t : hits) out.println(describe(t));
    }
    return status;
  }

  int filenames(List<String> names) {
    DefaultRegistry registry = new DefaultRegistry(settings);
    int status = 0;
    for (String name : names) {
      List<TypeDescriptor> hits = registry.typeFor(name);
      if (hits.isEmpty()) {
        err.println("No content type for " + name);
        status = 1;
      }
      for (TypeDescriptor t : hits) out.println(name + "\t" + describe(t));
    }
    return status;
  }

  int warmCache(Path file) {
    TypeLoader loader = new TypeLoaders().forFormat(settings.loadFormat());
    RegistryIndex index = loader.load();
    if (!new RegistryCache().save(index, file)) {
      err.println("Could not write cache: " + file);
      return 1;
    }
    out.println("Wrote " + index.count() + " content types to: " + file);
    return 0;
  }

  /** {@code type<TAB>ext,ext<TAB>flags}. */
  static String describe(TypeDescriptor t) {
    StringBuilder sb = new StringBuilder(t.contentType())
        .append('\t').append(String.join(",", t.extensions()))
        .append('\t').append(t.registered() ? "registered" : "unregistered");
    if (t.obsolete()) {
      sb.append(" obsolete");
      if (t.useInstead() != null) sb.append(" use-instead=").append(t.useInstead());
    }
    if (t.signature()) sb.append(" signature");
    sb.append(" encoding=").append(t.encoding());
    return sb.toString();
  }

  private static int usage(PrintStream err) {
    err.println(USAGE);
    return 2;
  }
}
