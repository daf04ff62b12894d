package io.intellixity.quill.jdbc.bind;

import io.intellixity.quill.spi.bind.DiscoveredBinderRegistry;

/**
 * Global JDBC provider discovered via META-INF/quill.factories.
 * <p>
 * Supplies base JDBC binders from {@link JdbcBinderProvider} for all dialects.
 */
public final class DefaultJdbcBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return DiscoveredBinderRegistry.GLOBAL_DIALECT;
  }
}
