package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.adapter.AdapterFactory;
import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.adapter.StoreAdapter;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.config.MissingSettingException;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.ParamType;
import io.intellixity.polystore.op.Paradigm;

import java.time.Duration;

import static io.intellixity.polystore.op.ParamSpec.optional;
import static io.intellixity.polystore.op.ParamSpec.required;

/**
 * Settings: {@code jdbcUrl} (required, e.g. {@code jdbc:duckdb:./data/analytics.db}), {@code username},
 * {@code password}, {@code maxPoolSize} (default 1), {@code connectionTimeout} (default 5s),
 * {@code createSampleData} (default false).
 */
public final class ColumnarStoreAdapterFactory implements AdapterFactory {
  static final OperationSchema SCHEMA = OperationSchema.builder(Paradigm.COLUMNAR)
      .kind("createTable", required("schema", ParamType.MAP))
      .kind("bulkInsert", required("table", ParamType.STRING), required("rows", ParamType.LIST))
      .kind("query", optional("name", ParamType.STRING), optional("params", ParamType.MAP),
          optional("statement", ParamType.STRING))
      .kind("tableStats", required("table", ParamType.STRING))
      .build();

  private final NamedQueryRegistry namedQueries;

  public ColumnarStoreAdapterFactory() {
    this(NamedQueryRegistry.salesAnalytics());
  }

  public ColumnarStoreAdapterFactory(NamedQueryRegistry namedQueries) {
    this.namedQueries = namedQueries;
  }

  @Override
  public Paradigm paradigm() { return Paradigm.COLUMNAR; }

  @Override
  public OperationSchema operations() { return SCHEMA; }

  @Override
  public ErrorMappingTable errorMappings() { return ColumnarStoreErrors.TABLE; }

  @Override
  public StoreAdapter create(AdapterSettings settings) {
    int pool = settings.getInt("maxPoolSize", 1);
    if (pool < 1) throw new MissingSettingException("maxPoolSize must be >= 1: " + pool);
    return new ColumnarStoreAdapter(new ColumnarStoreAdapter.Config(
        settings.require("jdbcUrl"),
        settings.get("username").orElse(null),
        settings.get("password").orElse(null),
        pool,
        settings.getDuration("connectionTimeout", Duration.ofSeconds(5)).toMillis(),
        settings.getBoolean("createSampleData", false)), namedQueries);
  }
}
