package io.intellixity.federa.sdl;

import graphql.language.*;

import java.util.*;

/** Literal values of directive arguments as plain Java values. */
final class SdlValues {
  private SdlValues() {}

  static Object toJava(Value<?> v) {
    if (v == null || v instanceof NullValue) return null;
    if (v instanceof StringValue s) return s.getValue();
    if (v instanceof IntValue i) return i.getValue().intValueExact();
    if (v instanceof FloatValue f) return f.getValue().doubleValue();
    if (v instanceof BooleanValue b) return b.isValue();
    if (v instanceof EnumValue e) return e.getName();
    if (v instanceof ArrayValue a) {
      List<Object> out = new ArrayList<>();
      for (Value<?> x : a.getValues()) out.add(toJava(x));
      return out;
    }
    if (v instanceof ObjectValue o) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (ObjectField f : o.getObjectFields()) out.put(f.getName(), toJava(f.getValue()));
      return out;
    }
    throw new IllegalArgumentException("Unsupported literal in SDL: " + v.getClass().getSimpleName());
  }
}
