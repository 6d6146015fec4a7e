package com.autoinsight.mapper.service.mapping;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.config.MappingProperties;
import com.autoinsight.mapper.model.catalog.SchemaCatalog;
import com.autoinsight.mapper.model.catalog.StandardField;
import com.autoinsight.mapper.model.mapping.ColumnMapping;
import com.autoinsight.mapper.model.mapping.ConfidenceLevel;
import com.autoinsight.mapper.model.mapping.FieldMapping;
import com.autoinsight.mapper.model.mapping.MappingCandidate;
import com.autoinsight.mapper.model.mapping.MappingMethod;
import com.autoinsight.mapper.model.mapping.NameMatch;
import com.autoinsight.mapper.model.profile.ColumnAnalysis;
import com.autoinsight.mapper.model.profile.ColumnProfile;
import com.autoinsight.mapper.model.scoring.TypeScores;
import com.autoinsight.mapper.model.table.DataTable;
import com.autoinsight.mapper.service.matching.NameMatcherService;
import com.autoinsight.mapper.service.profiling.ColumnProfilerService;
import com.autoinsight.mapper.service.scoring.TypeScorerService;
import com.google.common.base.Preconditions;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps user columns onto the standard fields of a catalog by blending column-name similarity with
 * the type evidence found in the data.
 *
 * <p>Every (column, field) pair scores {@code nameWeight * nameScore + dataWeight * typeScore},
 * where the type score is the column's score for the field's semantic type. Pairs reaching
 * {@value #MIN_CANDIDATE_SCORE} become candidates. Candidates are then assigned greedily from the
 * highest score down, ties broken by catalog field order and then table column order, so that each
 * field receives at most one column and each column serves at most one field. Candidates that lose
 * are reported on the field they competed for rather than dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridColumnMapperService {

  public static final double MIN_CANDIDATE_SCORE = 50;

  private final ColumnProfilerService columnProfiler;
  private final TypeScorerService typeScorer;
  private final NameMatcherService nameMatcher;
  private final MappingProperties properties;

  /** Hybrid mapping with the configured weights. */
  public ColumnMapping mapColumns(DataTable table, SchemaCatalog catalog) {
    return mapColumns(table, catalog, properties.getNameWeight(), properties.getDataWeight());
  }

  /**
   * Hybrid mapping with explicit weights.
   *
   * @throws IllegalArgumentException if a weight is negative or NaN, or both are zero
   */
  public ColumnMapping mapColumns(
      DataTable table, SchemaCatalog catalog, double nameWeight, double dataWeight) {
    checkWeights(nameWeight, dataWeight);
    return mapColumns(table, catalog, analyzeColumns(table), nameWeight, dataWeight);
  }

  /**
   * Hybrid mapping over analyses already produced by {@link #analyzeColumns(DataTable)} for the
   * same table, so callers that also report the profiles score each column only once.
   *
   * @throws IllegalArgumentException if a weight is invalid or a column has no analysis
   */
  public ColumnMapping mapColumns(
      DataTable table,
      SchemaCatalog catalog,
      Map<String, ColumnAnalysis> analyses,
      double nameWeight,
      double dataWeight) {
    checkWeights(nameWeight, dataWeight);
    List<String> columns = table.getColumnNames();
    List<ScoredCandidate> candidates = new ArrayList<>();

    for (int f = 0; f < catalog.getFields().size(); f++) {
      StandardField field = catalog.getFields().get(f);
      for (int c = 0; c < columns.size(); c++) {
        String column = columns.get(c);
        int nameScore = nameMatcher.fieldScore(column, field);
        ColumnAnalysis analysis = analyses.get(column);
        Preconditions.checkArgument(analysis != null, "No analysis for column '%s'", column);
        int dataScore = analysis.getTypeScores().get(field.getSemanticType());
        double score = combinedScore(nameScore, dataScore, nameWeight, dataWeight);
        if (score < MIN_CANDIDATE_SCORE) {
          continue;
        }
        candidates.add(
            new ScoredCandidate(
                field.getName(),
                f,
                c,
                score,
                MappingCandidate.builder()
                    .userColumn(column)
                    .score(round(score))
                    .nameScore(nameScore)
                    .dataScore(dataScore)
                    .build()));
      }
    }

    ColumnMapping mapping = resolve(catalog, candidates, MappingMethod.HYBRID);
    log.info(
        "Hybrid mapping for '{}' matched {}/{} fields from {} columns (weights {}/{})",
        catalog.getName(),
        mapping.size(),
        catalog.getFields().size(),
        columns.size(),
        nameWeight,
        dataWeight);
    return mapping;
  }

  /** Name-only mapping: every column nominates its best matching field. No data is read. */
  public ColumnMapping mapColumnsByName(DataTable table, SchemaCatalog catalog) {
    return mapColumnsByName(table.getColumnNames(), catalog);
  }

  public ColumnMapping mapColumnsByName(List<String> columnNames, SchemaCatalog catalog) {
    List<ScoredCandidate> candidates = new ArrayList<>();
    for (int c = 0; c < columnNames.size(); c++) {
      String column = columnNames.get(c);
      NameMatch match = nameMatcher.bestMatch(column, catalog);
      if (!match.isMatched()) {
        continue;
      }
      candidates.add(
          new ScoredCandidate(
              match.getStandardField(),
              catalog.indexOf(match.getStandardField()),
              c,
              match.getScore(),
              MappingCandidate.builder()
                  .userColumn(column)
                  .score(match.getScore())
                  .nameScore(match.getScore())
                  .build()));
    }

    ColumnMapping mapping = resolve(catalog, candidates, MappingMethod.NAME_ONLY);
    log.info(
        "Name-only mapping for '{}' matched {}/{} fields from {} columns",
        catalog.getName(),
        mapping.size(),
        catalog.getFields().size(),
        columnNames.size());
    return mapping;
  }

  /**
   * Profiles and type-scores every column once. A column whose profiling fails gets an empty
   * profile and all-zero scores, so it can still match by name.
   */
  public Map<String, ColumnAnalysis> analyzeColumns(DataTable table) {
    if (table.getColumnCount() > properties.getMaxColumns()) {
      log.warn(
          "Table has {} columns (more than {}); hybrid mapping profiles every column and may be"
              + " slow",
          table.getColumnCount(),
          properties.getMaxColumns());
    }
    Map<String, ColumnAnalysis> analyses = new LinkedHashMap<>();
    for (String column : table.getColumnNames()) {
      ColumnAnalysis analysis;
      try {
        ColumnProfile profile = columnProfiler.profile(table, column);
        analysis = new ColumnAnalysis(profile, typeScorer.score(profile));
      } catch (RuntimeException e) {
        log.warn("Profiling column '{}' failed, scoring it as empty: {}", column, e.getMessage());
        analysis =
            new ColumnAnalysis(
                ColumnProfile.empty(column, table.getRowCount()), TypeScores.empty());
      }
      log.debug("Column '{}' type scores: {}", column, analysis.getTypeScores());
      analyses.put(column, analysis);
    }
    return analyses;
  }

  /**
   * Keeps only the mapped columns, renamed to their standard field names in catalog order. Row
   * count and cell values are unchanged and the source table is left untouched.
   *
   * @throws IllegalArgumentException if the mapping names a column the table lacks
   */
  public DataTable applyMapping(DataTable table, ColumnMapping mapping) {
    return table.selectAndRename(mapping.getColumnRenames());
  }

  public static double combinedScore(
      int nameScore, int dataScore, double nameWeight, double dataWeight) {
    return nameWeight * nameScore + dataWeight * dataScore;
  }

  static void checkWeights(double nameWeight, double dataWeight) {
    Preconditions.checkArgument(
        !Double.isNaN(nameWeight) && nameWeight >= 0,
        "nameWeight must be a non-negative number: %s",
        nameWeight);
    Preconditions.checkArgument(
        !Double.isNaN(dataWeight) && dataWeight >= 0,
        "dataWeight must be a non-negative number: %s",
        dataWeight);
    Preconditions.checkArgument(
        nameWeight + dataWeight > 0, "nameWeight and dataWeight must not both be zero");
  }

  private ColumnMapping resolve(
      SchemaCatalog catalog, List<ScoredCandidate> candidates, MappingMethod method) {
    List<ScoredCandidate> ordered = new ArrayList<>(candidates);
    ordered.sort(
        Comparator.comparingDouble((ScoredCandidate s) -> s.rawScore)
            .reversed()
            .thenComparingInt(s -> s.fieldIndex)
            .thenComparingInt(s -> s.columnIndex));

    Map<String, ScoredCandidate> selected = new HashMap<>();
    Map<String, String> columnOwner = new HashMap<>();
    for (ScoredCandidate scored : ordered) {
      String column = scored.candidate.getUserColumn();
      if (selected.containsKey(scored.field)) {
        continue;
      }
      String owner = columnOwner.get(column);
      if (owner != null) {
        log.warn(
            "Column '{}' matches '{}' with score {} but is already assigned to '{}' with score {}",
            column,
            scored.field,
            scored.candidate.getScore(),
            owner,
            selected.get(owner).candidate.getScore());
        continue;
      }
      selected.put(scored.field, scored);
      columnOwner.put(column, scored.field);
    }

    Map<String, FieldMapping> fields = new LinkedHashMap<>();
    Map<String, List<MappingCandidate>> unresolved = new LinkedHashMap<>();
    for (StandardField field : catalog.getFields()) {
      String name = field.getName();
      List<ScoredCandidate> losers = new ArrayList<>();
      for (ScoredCandidate scored : ordered) {
        if (scored.field.equals(name) && scored != selected.get(name)) {
          losers.add(scored);
        }
      }

      ScoredCandidate winner = selected.get(name);
      if (winner == null) {
        if (!losers.isEmpty()) {
          log.warn(
              "Field '{}' left unmapped: all {} candidate columns were assigned elsewhere",
              name,
              losers.size());
          unresolved.put(name, annotate(losers, columnOwner));
        } else {
          log.debug("No candidate column for field '{}'", name);
        }
        continue;
      }

      FieldMapping.FieldMappingBuilder builder =
          FieldMapping.builder()
              .standardField(name)
              .userColumn(winner.candidate.getUserColumn())
              .confidence(winner.candidate.getScore())
              .confidenceLevel(ConfidenceLevel.of(winner.rawScore))
              .nameScore(winner.candidate.getNameScore())
              .dataScore(winner.candidate.getDataScore())
              .method(method);
      for (ScoredCandidate loser : losers) {
        MappingCandidate annotated =
            loser.candidate.withAssignedTo(columnOwner.get(loser.candidate.getUserColumn()));
        if (loser.rawScore > winner.rawScore) {
          builder.preemption(annotated);
        } else {
          builder.alternative(annotated);
        }
      }
      fields.put(name, builder.build());
    }

    return new ColumnMapping(catalog.getName(), method, fields, unresolved);
  }

  private static List<MappingCandidate> annotate(
      List<ScoredCandidate> losers, Map<String, String> columnOwner) {
    List<MappingCandidate> annotated = new ArrayList<>();
    for (ScoredCandidate loser : losers) {
      annotated.add(
          loser.candidate.withAssignedTo(columnOwner.get(loser.candidate.getUserColumn())));
    }
    return annotated;
  }

  private static double round(double score) {
    return Math.round(score * 10) / 10.0;
  }

  private static final class ScoredCandidate {
    private final String field;
    private final int fieldIndex;
    private final int columnIndex;
    // unrounded; orders the assignment and picks the confidence level
    private final double rawScore;
    private final MappingCandidate candidate;

    private ScoredCandidate(
        String field,
        int fieldIndex,
        int columnIndex,
        double rawScore,
        MappingCandidate candidate) {
      this.field = field;
      this.fieldIndex = fieldIndex;
      this.columnIndex = columnIndex;
      this.rawScore = rawScore;
      this.candidate = candidate;
    }
  }
}
