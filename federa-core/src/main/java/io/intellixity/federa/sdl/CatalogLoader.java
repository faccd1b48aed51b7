package io.intellixity.federa.sdl;

import io.intellixity.federa.catalog.Capabilities;
import io.intellixity.federa.catalog.Catalog;
import io.intellixity.federa.catalog.DataSourceInfo;
import io.intellixity.federa.config.CatalogDef;
import io.intellixity.federa.config.DataSourceDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.*;
import java.util.function.Function;

/**
 * Builds a {@link Catalog} from a data source snapshot.
 * <p>
 * Loading is all-or-nothing per data source: a source with any schema error is left out of the
 * catalog (its failure is reported in the {@link CatalogLoadResult}) and the remaining sources are
 * linked again, so a source referencing a rejected one through {@code @join} is rejected as well.
 */
public final class CatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

  /** SDL documents of one data source. */
  public record SourceDocuments(DataSourceInfo info, List<SdlSource> documents) {
    public SourceDocuments {
      Objects.requireNonNull(info, "info");
      documents = List.copyOf(documents);
    }
  }

  private final Function<String, Capabilities> capabilitiesByType;

  /** @param capabilitiesByType capabilities of the adapter serving a data source type */
  public CatalogLoader(Function<String, Capabilities> capabilitiesByType) {
    this.capabilitiesByType = Objects.requireNonNull(capabilitiesByType, "capabilitiesByType");
  }

  public CatalogLoadResult load(List<DataSourceDef> dataSources) {
    List<SourceDocuments> docs = new ArrayList<>();
    Map<String, SchemaDefinitionException> failures = new LinkedHashMap<>();
    for (DataSourceDef ds : dataSources) {
      DataSourceInfo info = info(ds);
      List<SdlSource> sdl = new ArrayList<>();
      try {
        for (CatalogDef c : ds.catalogs()) sdl.addAll(SdlSourceReader.read(c));
      } catch (UncheckedIOException | IllegalArgumentException e) {
        failures.put(ds.name(), new SchemaDefinitionException(ds.name(), List.of(
            new SchemaError(SchemaError.Code.INVALID_DEFINITION, e.getMessage(), null))));
        continue;
      }
      docs.add(new SourceDocuments(info, sdl));
    }
    return loadDocuments(docs, failures);
  }

  public CatalogLoadResult loadDocuments(List<SourceDocuments> sources) {
    return loadDocuments(sources, new LinkedHashMap<>());
  }

  private CatalogLoadResult loadDocuments(List<SourceDocuments> sources, Map<String, SchemaDefinitionException> failures) {
    List<SourceDraft> alive = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (SourceDocuments s : sources) {
      if (!names.add(s.info().name())) {
        failures.put(s.info().name(), new SchemaDefinitionException(s.info().name(), List.of(
            new SchemaError(SchemaError.Code.DUPLICATE_OBJECT, "Duplicate data source " + s.info().name(), null))));
        continue;
      }
      SourceDraft draft = new DirectiveSchemaParser(s.info()).parse(s.documents());
      if (draft.errors.isEmpty()) {
        alive.add(draft);
      } else {
        reject(failures, draft.name(), draft.errors);
      }
    }

    while (true) {
      CatalogLinker.Attempt attempt = new CatalogLinker(alive).link();
      if (attempt.ok()) {
        Catalog catalog = attempt.catalog();
        log.info("federa.sdl loaded sources={} objects={} relations={} functions={} failed={}",
            catalog.dataSources().size(), catalog.objects().size(), catalog.relations().size(),
            catalog.functions().size(), failures.keySet());
        return new CatalogLoadResult(catalog, failures);
      }
      for (var e : attempt.errors().entrySet()) reject(failures, e.getKey(), e.getValue());
      alive.removeIf(d -> attempt.errors().containsKey(d.name()));
    }
  }

  private static void reject(Map<String, SchemaDefinitionException> failures, String dataSource, List<SchemaError> errors) {
    SchemaDefinitionException ex = new SchemaDefinitionException(dataSource, errors);
    log.warn("federa.sdl rejected source={} errors={}", dataSource, errors.size());
    if (log.isDebugEnabled()) log.debug("federa.sdl rejected source={} detail={}", dataSource, ex.getMessage());
    failures.put(dataSource, ex);
  }

  private DataSourceInfo info(DataSourceDef ds) {
    Capabilities caps = capabilitiesByType.apply(ds.type());
    if (caps == null) caps = Capabilities.SCAN_ONLY;
    return new DataSourceInfo(ds.name(), ds.type(), ds.prefix(), ds.readOnly(), ds.asModule(), caps);
  }
}
