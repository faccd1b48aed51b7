package io.intellixity.federa.catalog;

public record EmbeddingsSpec(String model, String vectorField, String distance, int length) {}
