package io.intellixity.federa.query;

public enum Clause { AND, OR }
