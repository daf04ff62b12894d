package io.intellixity.quill.spi.bind;

import io.intellixity.quill.query.Literal;
import io.intellixity.quill.util.QuillFactoriesLoader;

import java.util.*;

/**
 * Binder registry built via discovery ({@code META-INF/quill.factories}).
 * <p>
 * Resolution: dialect-specific providers first, then global providers (dialectId "*"); within a provider
 * binder order is preserved; the first binder whose target/value types match and whose
 * {@link Binder#supports} accepts the literal wins.
 */
public final class DiscoveredBinderRegistry {
  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final List<Binder<?, ?>> dialectOrdered;
  private final List<Binder<?, ?>> globalOrdered;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, QuillFactoriesLoader.load(BinderProvider.class));
  }

  DiscoveredBinderRegistry(String dialectId, List<BinderProvider> providers) {
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? "" : dialectId;
    List<Binder<?, ?>> dialect = new ArrayList<>();
    List<Binder<?, ?>> global = new ArrayList<>();

    for (BinderProvider p : providers) {
      if (p == null) continue;
      String did = normalizeDialect(p.dialectId());
      Collection<Binder<?, ?>> bs = p.binders();
      if (bs == null) continue;
      if (GLOBAL_DIALECT.equals(did)) global.addAll(bs);
      else if (Objects.equals(this.dialectId, did)) dialect.addAll(bs);
    }

    this.dialectOrdered = List.copyOf(dialect);
    this.globalOrdered = List.copyOf(global);
  }

  public String dialectId() { return dialectId; }

  public <TTarget> void bind(TTarget target, BindContext ctx, Literal literal) {
    if (target == null) throw new IllegalArgumentException("target is required");
    if (ctx == null) throw new IllegalArgumentException("ctx is required");
    Literal l = literal == null ? Literal.NULL : literal;
    if (tryBind(dialectOrdered, target, ctx, l)) return;
    if (tryBind(globalOrdered, target, ctx, l)) return;
    throw new IllegalArgumentException("No binder found for dialectId=" + dialectId +
        ", target=" + target.getClass().getName() +
        ", literalType=" + l.type() +
        ", value=" + (l.value() == null ? "null" : l.value().getClass().getName()));
  }

  private static <TTarget> boolean tryBind(List<Binder<?, ?>> ordered, TTarget target, BindContext ctx, Literal literal) {
    Object value = literal.value();
    for (Binder<?, ?> b : ordered) {
      if (b == null) continue;
      if (!b.targetType().isInstance(target)) continue;
      if (value != null && !b.valueType().isInstance(value)) continue;
      @SuppressWarnings("unchecked")
      Binder<TTarget, Object> bb = (Binder<TTarget, Object>) b;
      if (bb.supports(ctx, literal, value)) {
        bb.bind(target, ctx, literal, value);
        return true;
      }
    }
    return false;
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }
}
