package io.intellixity.federa.engine.memory;

import io.intellixity.federa.config.DataSourceDef;
import io.intellixity.federa.query.QueryFilters;
import io.intellixity.federa.query.SortField;
import io.intellixity.federa.spi.source.CancellationToken;
import io.intellixity.federa.spi.source.ScanRequest;
import io.intellixity.federa.spi.source.SourceExecutionException;
import io.intellixity.federa.spi.source.SourceResult;
import io.intellixity.federa.spi.source.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class InMemorySourceAdapterTest {
  private static InMemorySourceAdapter shop() {
    return (InMemorySourceAdapter) new InMemorySourceAdapterProvider()
        .create(DataSourceDef.of("shop", "memory", "classpath:data/shop.json"));
  }

  private static List<Object> column(SourceResult r, String field) {
    List<Object> out = new ArrayList<>();
    for (Map<String, Object> row : r.rows()) out.add(row.get(field));
    return out;
  }

  @Test
  void selectFiltersSortsAndPages() {
    ScanRequest scan = ScanRequest.select("shop", "orders", List.of("id", "total"),
        QueryFilters.eq("status", "closed"), List.of(new SortField("total", SortField.Direction.ASC)), 1, 0);

    SourceResult r = shop().execute(scan, CancellationToken.create());

    assertEquals(List.of(13), column(r, "id"));
    assertEquals(List.of("id", "total"), new ArrayList<>(r.rows().get(0).keySet()));
  }

  @Test
  void distinctOnKeepsFirstRowPerKey() {
    ScanRequest scan = new ScanRequest("shop", ScanRequest.Action.SELECT, "orders", List.of("id", "status"), null,
        List.of(new SortField("total", SortField.Direction.DESC)), null, null, List.of("status"), null, null);

    SourceResult r = shop().execute(scan, CancellationToken.create());

    assertEquals(List.of("closed", "open"), column(r, "status"));
    assertEquals(List.of(11, 10), column(r, "id"));
  }

  @Test
  void writesChangeStoredRows() {
    InMemorySourceAdapter adapter = shop();
    CancellationToken token = CancellationToken.create();

    SourceResult inserted = adapter.execute(new ScanRequest("shop", ScanRequest.Action.INSERT, "customers",
        List.of("id"), null, null, null, null, null, null, Map.of("id", 4, "name", "Dee")), token);
    SourceResult updated = adapter.execute(new ScanRequest("shop", ScanRequest.Action.UPDATE, "customers", null,
        QueryFilters.eq("region", "EU"), null, null, null, null, null, Map.of("region", "APAC")), token);
    SourceResult deleted = adapter.execute(new ScanRequest("shop", ScanRequest.Action.DELETE, "customers", null,
        QueryFilters.eq("id", 2), null, null, null, null, null, null), token);

    assertEquals(List.of(Map.of("id", 4)), inserted.rows());
    assertEquals(2, updated.affectedRows());
    assertEquals(1, deleted.affectedRows());
    List<Map<String, Object>> rows = adapter.rows("customers");
    assertEquals(3, rows.size());
    assertEquals("APAC", rows.get(0).get("region"));
    assertEquals("Dee", rows.get(2).get("name"));
  }

  @Test
  void rejectsUnknownObjectsAndSql() {
    InMemorySourceAdapter adapter = shop();

    SourceExecutionException unknown = assertThrows(SourceExecutionException.class, () -> adapter.execute(
        ScanRequest.select("shop", "invoices", List.of(), null, null, null, null), CancellationToken.create()));
    SourceExecutionException sql = assertThrows(SourceExecutionException.class, () -> adapter.execute(
        new SqlStatement("shop", "SELECT 1", List.of()), CancellationToken.create()));

    assertEquals(SourceExecutionException.Code.EXECUTION_FAILED, unknown.code());
    assertEquals(SourceExecutionException.Code.EXECUTION_FAILED, sql.code());
  }

  @Test
  void cancelledTokenStopsTheScan() {
    CancellationToken token = CancellationToken.create();
    token.cancel("client gone");

    SourceExecutionException ex = assertThrows(SourceExecutionException.class, () -> shop().execute(
        ScanRequest.select("shop", "orders", List.of(), null, null, null, null), token));

    assertEquals(SourceExecutionException.Code.CANCELLED, ex.code());
  }

  @Test
  void missingDataResourceMakesSourceUnavailable() {
    SourceExecutionException ex = assertThrows(SourceExecutionException.class, () -> new InMemorySourceAdapterProvider()
        .create(DataSourceDef.of("shop", "memory", "classpath:data/none.json")));

    assertEquals(SourceExecutionException.Code.SOURCE_UNAVAILABLE, ex.code());
  }

  @Test
  void sourceWithoutPathStartsEmpty() {
    InMemorySourceAdapter adapter = (InMemorySourceAdapter) new InMemorySourceAdapterProvider()
        .create(DataSourceDef.of("scratch", "memory", null));
    adapter.put("notes", List.of(Map.of("id", 1)));

    assertEquals(List.of(Map.of("id", 1)), adapter.rows("notes"));
    assertEquals("scratch", adapter.name());
    assertNull(adapter.dialect());
  }
}
