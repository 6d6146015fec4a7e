package com.autoinsight.mapper.fixtures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.autoinsight.mapper.config.MappingProperties;
import com.autoinsight.mapper.model.table.DataTable;
import com.autoinsight.mapper.service.catalog.SchemaCatalogRegistry;
import com.autoinsight.mapper.service.mapping.HybridColumnMapperService;
import com.autoinsight.mapper.service.matching.NameMatcherService;
import com.autoinsight.mapper.service.profiling.ColumnProfilerService;
import com.autoinsight.mapper.service.profiling.DateDetector;
import com.autoinsight.mapper.service.profiling.FtaDateDetector;
import com.autoinsight.mapper.service.scoring.TypeScorerService;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared tables and service wiring for mapping tests. */
public final class MappingFixtures {

  private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}.*");

  private MappingFixtures() {}

  /** Recognises ISO dates only, so mapping tests do not depend on locale heuristics. */
  public static DateDetector isoDateDetector() {
    return sample -> {
      int hits = 0;
      for (String value : sample) {
        if (value != null && ISO_DATE.matcher(value.trim()).matches()) {
          hits++;
        }
      }
      return hits;
    };
  }

  public static SchemaCatalogRegistry catalogRegistry() {
    SchemaCatalogRegistry registry =
        new SchemaCatalogRegistry(new ObjectMapper(), new MappingProperties());
    registry.init();
    return registry;
  }

  public static ColumnProfilerService columnProfiler() {
    return new ColumnProfilerService(isoDateDetector());
  }

  public static HybridColumnMapperService hybridMapper() {
    return hybridMapper(new MappingProperties());
  }

  public static HybridColumnMapperService hybridMapper(MappingProperties properties) {
    return new HybridColumnMapperService(
        columnProfiler(), new TypeScorerService(), new NameMatcherService(), properties);
  }

  /** The mapper as the application wires it, with FTA date detection. */
  public static HybridColumnMapperService ftaHybridMapper() {
    MappingProperties properties = new MappingProperties();
    return new HybridColumnMapperService(
        new ColumnProfilerService(new FtaDateDetector(properties)),
        new TypeScorerService(),
        new NameMatcherService(),
        properties);
  }

  public static List<Object> customerIds() {
    return List.of(12346, 12347, 12348, 12349, 12350, 12352, 12353, 12354, 12355, 12356);
  }

  public static List<Object> invoiceDates() {
    List<Object> dates = new ArrayList<>();
    for (int day = 1; day <= 10; day++) {
      dates.add(String.format("2010-12-%02d 08:26:00", day));
    }
    return dates;
  }

  public static List<Object> quantities() {
    return List.of(6, 6, 8, 6, 6, 3, 2, 32, 6, 6);
  }

  public static List<Object> unitPrices() {
    return List.of(2.55, 3.39, 2.75, 3.39, 3.39, 7.65, 4.25, 1.85, 1.69, 2.10);
  }

  /** Online-retail style transactions with the canonical column names. */
  public static DataTable ecommerceTable() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("CustomerID", customerIds());
    columns.put("InvoiceDate", invoiceDates());
    columns.put("Quantity", quantities());
    columns.put("UnitPrice", unitPrices());
    return DataTable.fromColumns(columns);
  }

  public static DataTable koreanEcommerceTable() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("고객ID", customerIds());
    columns.put("주문일", invoiceDates());
    columns.put("수량", quantities());
    columns.put("단가", unitPrices());
    return DataTable.fromColumns(columns);
  }

  public static List<Object> reviewTexts() {
    return List.of(
        "This product was great and arrived quickly, would buy again for sure!",
        "Terrible quality. Broke after two days of light use, asking for a refund.",
        "Decent value for the money but the instructions were hard to follow honestly.",
        "Absolutely love it, my kids use it every single day without any complaints.",
        "Shipping took three weeks and the box was damaged when it finally arrived.");
  }

  /** Sales records with string order ids and short product names next to the dates. */
  public static DataTable salesTable() {
    List<Object> orderIds = new ArrayList<>();
    List<Object> dates = new ArrayList<>();
    for (int i = 1; i <= 10; i++) {
      orderIds.add(String.format("C%03d", i));
      dates.add(String.format("2024-03-%02d", i));
    }
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("order_id", orderIds);
    columns.put("date", dates);
    columns.put(
        "product",
        List.of(
            "Desk Lamp",
            "Wireless Mouse",
            "USB-C Cable",
            "Desk Lamp",
            "Coffee Mug",
            "Notebook",
            "Wireless Mouse",
            "Coffee Mug",
            "Desk Lamp",
            "Notebook"));
    columns.put("quantity", quantities());
    columns.put("price", unitPrices());
    return DataTable.fromColumns(columns);
  }

  public static DataTable reviewTable() {
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    columns.put("comment", reviewTexts());
    columns.put("stars", List.of(5, 1, 3, 5, 2));
    return DataTable.fromColumns(columns);
  }
}
