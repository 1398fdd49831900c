package org.sedfuse.application.pipeline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.sedfuse.application.catalog.CatalogId;
import org.sedfuse.application.catalog.CatalogQuery;
import org.sedfuse.application.catalog.CatalogTable;
import org.sedfuse.application.catalog.CatalogUnavailableException;
import org.sedfuse.application.normalize.BandSurveyNormalizer;
import org.sedfuse.application.normalize.CatalogNormalizer;
import org.sedfuse.application.normalize.NormalizationResult;
import org.sedfuse.application.port.CatalogGateway;
import org.sedfuse.application.port.MetricsPort;
import org.sedfuse.domain.sed.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs every catalog query and normalizer for one source in catalog order.
 * <p><strong>Why:</strong> The order matters: the primary position sets the search position used by all cone
 * searches, and the reddening must be known before any measurement is appended.</p>
 * <p><strong>Role:</strong> Application service used by {@link SedFusionUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Retry name-keyed lookups with the alternate identifier when the name yields nothing.</li>
 *   <li>Reuse SURVEY_B magnitudes carried inline by the SURVEY_A response instead of querying SURVEY_B.</li>
 *   <li>Turn gateway failures into soft per-catalog failures.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the gateway it drives is single-threaded.</p>
 * <p><strong>Observability:</strong> Emits {@code sed.catalog.<catalog>.accepted} and
 * {@code sed.catalog.<catalog>.failed}.</p>
 *
 * @since 0.1.0
 */
public final class SourceFusionProcessor {
  private static final Logger log = LoggerFactory.getLogger(SourceFusionProcessor.class);

  private final CatalogGateway gateway;
  private final Map<CatalogId, CatalogNormalizer> normalizers;
  private final BandSurveyNormalizer inlineSurveyB;
  private final MetricsPort metrics;

  /**
   * Creates a processor.
   *
   * @param gateway catalog access port
   * @param normalizers one normalizer per {@link CatalogId}
   * @param inlineSurveyB normalizer reading SURVEY_B bands from a SURVEY_A response
   * @param metrics metrics port
   * @throws IllegalArgumentException when a catalog has no normalizer
   */
  public SourceFusionProcessor(
      CatalogGateway gateway,
      List<? extends CatalogNormalizer> normalizers,
      BandSurveyNormalizer inlineSurveyB,
      MetricsPort metrics) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.inlineSurveyB = Objects.requireNonNull(inlineSurveyB, "inlineSurveyB");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Map<CatalogId, CatalogNormalizer> byCatalog = new EnumMap<>(CatalogId.class);
    for (CatalogNormalizer normalizer : normalizers) {
      if (byCatalog.put(normalizer.catalog(), normalizer) != null) {
        throw new IllegalArgumentException("duplicate normalizer for " + normalizer.catalog());
      }
    }
    for (CatalogId id : CatalogId.values()) {
      if (!byCatalog.containsKey(id)) {
        throw new IllegalArgumentException("missing normalizer for " + id);
      }
    }
    if (inlineSurveyB.catalog() != CatalogId.SURVEY_B) {
      throw new IllegalArgumentException("inline normalizer must target " + CatalogId.SURVEY_B);
    }
    this.normalizers = byCatalog;
  }

  /**
   * Queries every catalog for {@code source} and applies the responses.
   *
   * @param source source to reconcile; mutated in place
   * @return one result per catalog that was consulted, in query order
   */
  public List<NormalizationResult> process(Source source) {
    List<NormalizationResult> results = new ArrayList<>(CatalogId.values().length);
    byName(source, CatalogId.PRIMARY_POSITION).ifPresent(results::add);
    byPosition(source, CatalogId.EXTINCTION_MAP).ifPresent(results::add);
    byName(source, CatalogId.PRIMARY_SED).ifPresent(results::add);
    surveys(source, results);
    byPosition(source, CatalogId.UV_SURVEY).ifPresent(results::add);
    return results;
  }

  private void surveys(Source source, List<NormalizationResult> results) {
    if (!source.searchPosition().isFinite()) {
      log.info("No reference position; skipping {} and {}", CatalogId.SURVEY_A.token(), CatalogId.SURVEY_B.token());
      return;
    }
    CatalogQuery query = CatalogQuery.byPosition(CatalogId.SURVEY_A, source.searchPosition());
    Optional<CatalogTable> surveyA = fetch(query);
    results.add(apply(source, normalizers.get(CatalogId.SURVEY_A), surveyA, query));
    if (surveyA.isPresent() && inlineSurveyB.carriesBands(surveyA.get())) {
      log.debug("{} response carries {} bands inline", CatalogId.SURVEY_A.token(), CatalogId.SURVEY_B.token());
      results.add(record(source, inlineSurveyB.normalize(source, surveyA.get()), query));
      return;
    }
    byPosition(source, CatalogId.SURVEY_B).ifPresent(results::add);
  }

  private Optional<NormalizationResult> byName(Source source, CatalogId catalog) {
    List<String> names = new ArrayList<>(2);
    source.catalogName().ifPresent(names::add);
    source.alternateId().filter(id -> !names.contains(id)).ifPresent(names::add);
    if (names.isEmpty()) {
      log.info("No catalog name or alternate id; skipping {}", catalog.token());
      return Optional.empty();
    }
    NormalizationResult result = null;
    for (String name : names) {
      CatalogQuery query = CatalogQuery.byName(catalog, name);
      result = apply(source, normalizers.get(catalog), fetch(query), query);
      if (!result.isSoftFailure()) {
        return Optional.of(result);
      }
    }
    return Optional.of(result);
  }

  private Optional<NormalizationResult> byPosition(Source source, CatalogId catalog) {
    if (!source.searchPosition().isFinite()) {
      log.info("No reference position; skipping {}", catalog.token());
      return Optional.empty();
    }
    CatalogQuery query = CatalogQuery.byPosition(catalog, source.searchPosition());
    return Optional.of(apply(source, normalizers.get(catalog), fetch(query), query));
  }

  private Optional<CatalogTable> fetch(CatalogQuery query) {
    try {
      return gateway.fetch(query);
    } catch (CatalogUnavailableException ex) {
      log.warn("Catalog query {} failed: {}", query.describe(), ex.getMessage());
      log.debug("Catalog failure detail", ex);
      return Optional.empty();
    }
  }

  private NormalizationResult apply(
      Source source, CatalogNormalizer normalizer, Optional<CatalogTable> table, CatalogQuery query) {
    NormalizationResult result = table.isPresent()
        ? normalizer.normalize(source, table.get())
        : NormalizationResult.softFailure(normalizer.catalog(), "no response");
    return record(source, result, query);
  }

  private NormalizationResult record(Source source, NormalizationResult result, CatalogQuery query) {
    String prefix = "sed.catalog." + result.catalog().token();
    if (result.isSoftFailure()) {
      metrics.increment(prefix + ".failed");
      log.warn("{} contributed nothing for {} ({}): {}",
          result.catalog().token(), source.identity(), query.describe(), result.failure().get());
    } else {
      metrics.increment(prefix + ".accepted");
      log.debug("{} accepted {} entries", result.catalog().token(), result.accepted());
    }
    return result;
  }
}
