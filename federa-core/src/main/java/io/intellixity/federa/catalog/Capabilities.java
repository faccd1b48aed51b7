package io.intellixity.federa.catalog;

/** What a data source can evaluate natively. */
public record Capabilities(boolean joinPushdown, boolean aggregationPushdown, boolean supportsSpatial) {
  public static final Capabilities FULL = new Capabilities(true, true, true);
  public static final Capabilities RELATIONAL = new Capabilities(true, true, false);
  public static final Capabilities SCAN_ONLY = new Capabilities(false, false, false);
}
