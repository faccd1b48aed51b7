package io.intellixity.federa.sdl;

import io.intellixity.federa.catalog.ArgDef;
import io.intellixity.federa.catalog.DataObject;
import io.intellixity.federa.catalog.DataSourceInfo;
import io.intellixity.federa.catalog.FieldType;
import io.intellixity.federa.catalog.SdlLocation;

import java.util.*;

/** Result of the first parsing pass over one data source: objects and unresolved references. */
final class SourceDraft {
  final DataSourceInfo info;
  final LinkedHashMap<String, ObjectDraft> objects = new LinkedHashMap<>();
  final List<FunctionDraft> functions = new ArrayList<>();
  final List<PendingFk> foreignKeys = new ArrayList<>();
  final List<PendingJoin> joins = new ArrayList<>();
  final List<PendingCall> calls = new ArrayList<>();
  final List<SchemaError> errors = new ArrayList<>();

  SourceDraft(DataSourceInfo info) {
    this.info = Objects.requireNonNull(info, "info");
  }

  String name() { return info.name(); }

  static final class ObjectDraft {
    final String declaredName;
    final DataObject.Builder builder;
    final SdlLocation location;

    ObjectDraft(String declaredName, DataObject.Builder builder, SdlLocation location) {
      this.declaredName = declaredName;
      this.builder = builder;
      this.location = location;
    }
  }

  record FunctionDraft(String name, String module, String sql, List<ArgDef> arguments, FieldType returnScalar,
                       String returnTypeName, boolean returnsList, boolean skipNullArgs, String description,
                       SdlLocation location) {}

  record PendingFk(String owner, List<String> sourceFields, String referencesName, List<String> referencesFields,
                   String query, String referencesQuery, SdlLocation location) {}

  record PendingJoin(String owner, String fieldName, boolean list, String referencesName, List<String> sourceFields,
                     List<String> referencesFields, String sql, SdlLocation location) {}

  record PendingCall(String owner, String fieldName, FieldType scalarType, boolean list, String referencesName,
                     Map<String, String> args, List<String> sourceFields, List<String> referencesFields,
                     String module, String description, SdlLocation location) {
    boolean tableJoin() { return !sourceFields.isEmpty(); }
  }
}
