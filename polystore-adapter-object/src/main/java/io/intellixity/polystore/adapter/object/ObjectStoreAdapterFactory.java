package io.intellixity.polystore.adapter.object;

import io.intellixity.polystore.adapter.AdapterFactory;
import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.adapter.StoreAdapter;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.config.MissingSettingException;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.ParamType;
import io.intellixity.polystore.op.Paradigm;

import static io.intellixity.polystore.op.ParamSpec.optional;
import static io.intellixity.polystore.op.ParamSpec.required;

/**
 * Settings: {@code backend=memory|s3} (default memory); for s3 {@code bucket} (required), {@code endpoint},
 * {@code region} (default us-east-1), {@code accessKey}, {@code secretKey}, {@code pathStyle} (default true).
 */
public final class ObjectStoreAdapterFactory implements AdapterFactory {
  static final OperationSchema SCHEMA = OperationSchema.builder(Paradigm.OBJECT)
      .kind("put", required("key", ParamType.STRING), required("data", ParamType.BYTES),
          optional("contentType", ParamType.STRING))
      .kind("get", required("key", ParamType.STRING))
      .kind("list", optional("prefix", ParamType.STRING))
      .kind("delete", required("key", ParamType.STRING))
      .kind("stat", required("key", ParamType.STRING))
      .build();

  @Override
  public Paradigm paradigm() { return Paradigm.OBJECT; }

  @Override
  public OperationSchema operations() { return SCHEMA; }

  @Override
  public ErrorMappingTable errorMappings() { return ObjectStoreErrors.TABLE; }

  @Override
  public StoreAdapter create(AdapterSettings settings) {
    String backend = settings.get("backend", "memory");
    return switch (backend) {
      case "memory" -> new ObjectStoreAdapter(new InMemoryObjectStoreBackend());
      case "s3" -> new ObjectStoreAdapter(new S3ObjectStoreBackend(new S3ObjectStoreBackend.Config(
          settings.get("endpoint").orElse(null),
          settings.get("region", "us-east-1"),
          settings.get("accessKey").orElse(null),
          settings.get("secretKey").orElse(null),
          settings.require("bucket"),
          settings.getBoolean("pathStyle", true))));
      default -> throw new MissingSettingException("Unsupported object backend: " + backend);
    };
  }
}
