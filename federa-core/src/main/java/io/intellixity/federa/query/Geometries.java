package io.intellixity.federa.query;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/** WKT/WKB conversion of Geometry values. SRID 4326 unless the value says otherwise. */
public final class Geometries {
  public static final int DEFAULT_SRID = 4326;

  private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), DEFAULT_SRID);

  private Geometries() {}

  public static Geometry parse(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Geometry g) return g;
    try {
      if (raw instanceof byte[] wkb) return new WKBReader(FACTORY).read(wkb);
      String s = raw.toString().trim();
      if (s.regionMatches(true, 0, "SRID=", 0, 5)) {
        int semi = s.indexOf(';');
        Geometry g = new WKTReader(FACTORY).read(s.substring(semi + 1));
        g.setSRID(Integer.parseInt(s.substring(5, semi)));
        return g;
      }
      if (!s.isEmpty() && Character.isDigit(s.charAt(0))) {
        // hex encoded (E)WKB as returned by PostGIS text output
        return new WKBReader(FACTORY).read(WKBReader.hexToBytes(s));
      }
      return new WKTReader(FACTORY).read(s);
    } catch (ParseException | RuntimeException e) {
      throw new QueryValidationException("Invalid geometry value: " + e.getMessage(), e);
    }
  }

  public static String toWkt(Geometry g) {
    return g == null ? null : new WKTWriter().write(g);
  }
}
