package io.intellixity.federa.catalog;

public record GeometryInfo(String type, int srid) {}
