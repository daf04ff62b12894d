package io.intellixity.quill.dialect;

import io.intellixity.quill.util.QuillFactoriesLoader;

import java.util.*;

/**
 * Resolves dialects by id.
 * <p>
 * Contains the {@link Dialects#builtIns() built-ins} plus every dialect contributed by a discovered
 * {@link DialectProvider}. Ids are unique; a provider re-declaring an id fails fast.
 */
public final class DialectRegistry {
  private final Map<String, Dialect> byId;

  public DialectRegistry() {
    this(QuillFactoriesLoader.load(DialectProvider.class));
  }

  DialectRegistry(List<DialectProvider> providers) {
    Map<String, Dialect> out = new LinkedHashMap<>();
    for (Dialect d : Dialects.builtIns()) out.put(d.id(), d);
    for (DialectProvider p : providers) {
      if (p == null) continue;
      Collection<Dialect> ds = p.dialects();
      if (ds == null) continue;
      for (Dialect d : ds) {
        if (d == null) continue;
        Dialect existing = out.putIfAbsent(d.id(), d);
        if (existing != null) {
          throw new IllegalArgumentException("Duplicate dialect id '" + d.id() + "' from provider " +
              p.getClass().getName());
        }
      }
    }
    this.byId = Collections.unmodifiableMap(out);
  }

  public Dialect get(String id) {
    Objects.requireNonNull(id, "id");
    Dialect d = byId.get(id.trim().toLowerCase(Locale.ROOT));
    if (d == null) throw new IllegalArgumentException("Unknown dialect id: " + id + " (known: " + byId.keySet() + ")");
    return d;
  }

  public Optional<Dialect> find(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(byId.get(id.trim().toLowerCase(Locale.ROOT)));
  }

  public Set<String> ids() { return byId.keySet(); }
}
