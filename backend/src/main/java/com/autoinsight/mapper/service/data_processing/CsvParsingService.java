package com.autoinsight.mapper.service.data_processing;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.autoinsight.mapper.model.table.DataTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads uploaded CSV files into a {@link DataTable}. Cells stay strings; the profiler decides what
 * they hold. Spreadsheets exported on Korean Windows are usually CP949, so the encoding is probed
 * before parsing.
 */
@Slf4j
@Service
public class CsvParsingService {

  private static final char BOM = '\uFEFF';

  /** Tried in order; the last entry decodes any byte sequence. */
  private static final List<String> CANDIDATE_ENCODINGS =
      List.of("UTF-8", "x-windows-949", "EUC-KR", "ISO-8859-1");

  public DataTable parse(byte[] csvData, Integer maxRows) throws IOException {
    if (csvData == null || csvData.length == 0) {
      throw new IllegalArgumentException("CSV file is empty");
    }

    Charset charset = detectCharset(csvData);
    String text = new String(csvData, charset);
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }

    List<String> columns;
    List<Map<String, Object>> rows = new ArrayList<>();
    int skipped = 0;

    try (CSVReader reader = new CSVReader(new StringReader(text))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0 || isBlankHeader(headers)) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      columns = Arrays.asList(headers);

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length != headers.length) {
          log.debug(
              "Skipping row with incorrect column count: {} vs {}", row.length, headers.length);
          skipped++;
          continue;
        }

        Map<String, Object> rowData = new LinkedHashMap<>();
        for (int i = 0; i < headers.length; i++) {
          rowData.put(headers[i], row[i]);
        }
        rows.add(rowData);

        if (maxRows != null && rows.size() >= maxRows) {
          break;
        }
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
    }

    if (rows.isEmpty()) {
      throw new IllegalArgumentException("CSV file contains no data");
    }

    log.info(
        "Parsed CSV ({}): {} columns, {} rows, {} skipped",
        charset.name(),
        columns.size(),
        rows.size(),
        skipped);
    return DataTable.fromRows(columns, rows);
  }

  /** First candidate encoding that decodes the whole input without errors. */
  Charset detectCharset(byte[] data) {
    for (String name : CANDIDATE_ENCODINGS) {
      if (!Charset.isSupported(name)) {
        continue;
      }
      Charset charset = Charset.forName(name);
      try {
        charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(data));
        return charset;
      } catch (CharacterCodingException e) {
        log.debug("CSV is not valid {}: {}", name, e.getMessage());
      }
    }
    return StandardCharsets.ISO_8859_1;
  }

  private boolean isBlankHeader(String[] headers) {
    return headers.length == 1 && headers[0].replace(String.valueOf(BOM), "").isBlank();
  }
}
