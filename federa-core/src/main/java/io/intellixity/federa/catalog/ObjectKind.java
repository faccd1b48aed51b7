package io.intellixity.federa.catalog;

public enum ObjectKind { TABLE, VIEW, PARAMETERIZED_VIEW }
