package io.intellixity.quill.jdbc.bind;

import io.intellixity.quill.spi.bind.BindContext;

public interface JdbcBindContext extends BindContext {
  int position1Based();
}
