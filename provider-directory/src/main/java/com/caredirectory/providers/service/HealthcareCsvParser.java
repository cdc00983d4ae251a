package com.caredirectory.providers.service;

import com.caredirectory.providers.exception.FeedParseException;
import com.caredirectory.providers.model.HealthcareCategory;
import com.caredirectory.providers.model.HealthcareProvider;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the national provider register CSV into HealthcareProvider records.
 *
 * Columns are resolved by header name so reordering upstream does not break ingest.
 * Rows without a numeric composite key are skipped and counted.
 */
@Component
@Slf4j
public class HealthcareCsvParser {

    static final String COL_LOCATION_ID     = "ZdravotnickeZarizeniId";
    static final String COL_INSTITUTION_ID  = "PCZ";
    static final String COL_TITLE           = "NazevCely";
    static final String COL_INSTITUTION_TYPE = "DruhZarizeni";
    static final String COL_CITY            = "Obec";
    static final String COL_POSTAL_CODE     = "Psc";
    static final String COL_STREET          = "Ulice";
    static final String COL_HOUSE_NUMBER    = "CisloDomovniOrientacni";
    static final String COL_PHONE           = "PoskytovatelTelefon";
    static final String COL_FAX             = "PoskytovatelFax";
    static final String COL_EMAIL           = "PoskytovatelEmail";
    static final String COL_WEBSITE         = "PoskytovatelWeb";
    static final String COL_ICO             = "Ico";
    static final String COL_CARE_FIELD      = "OborPece";
    static final String COL_CARE_FORM       = "FormaPece";
    static final String COL_CARE_TYPE       = "DruhPece";
    static final String COL_SUBSTITUTE      = "OdbornyZastupce";
    static final String COL_GPS             = "GPS";

    private static final List<String> REQUIRED_COLUMNS = List.of(COL_LOCATION_ID, COL_INSTITUTION_ID, COL_TITLE);
    private static final char BOM = '\uFEFF';

    /**
     * @throws FeedParseException if the header lacks a key column or the CSV is malformed
     */
    public List<HealthcareProvider> parse(byte[] content) {
        try (CSVReader reader = new CSVReaderBuilder(
                new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8)).build()) {

            String[] header = reader.readNext();
            if (header == null) {
                return List.of();
            }
            Map<String, Integer> columns = indexHeader(header);

            List<HealthcareProvider> providers = new ArrayList<>();
            int skipped = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;

                Long locationId = parseLong(get(row, columns, COL_LOCATION_ID));
                Long institutionId = parseLong(get(row, columns, COL_INSTITUTION_ID));
                if (locationId == null || institutionId == null) {
                    skipped++;
                    continue;
                }
                providers.add(toProvider(row, columns, locationId, institutionId));
            }

            log.info("Parsed provider register: {} records, {} without a usable key skipped",
                    providers.size(), skipped);
            return providers;

        } catch (CsvValidationException e) {
            throw new FeedParseException("Provider register is not valid CSV", e);
        } catch (IOException e) {
            throw new FeedParseException("Provider register could not be read", e);
        }
    }

    private Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new FeedParseException("Provider register header is missing column " + required
                        + " (found " + Arrays.toString(header) + ")");
            }
        }
        return columns;
    }

    private HealthcareProvider toProvider(String[] row, Map<String, Integer> columns,
                                          Long locationId, Long institutionId) {
        String careField = get(row, columns, COL_CARE_FIELD);
        double[] gps = parseGps(get(row, columns, COL_GPS));

        return HealthcareProvider.builder()
                .locationId(locationId)
                .institutionId(institutionId)
                .title(emptyToNull(get(row, columns, COL_TITLE)))
                .institutionType(emptyToNull(get(row, columns, COL_INSTITUTION_TYPE)))
                .street(emptyToNull(get(row, columns, COL_STREET)))
                .houseNumber(emptyToNull(get(row, columns, COL_HOUSE_NUMBER)))
                .city(emptyToNull(get(row, columns, COL_CITY)))
                .postalCode(emptyToNull(get(row, columns, COL_POSTAL_CODE)))
                .phoneNumber(emptyToNull(get(row, columns, COL_PHONE)))
                .fax(emptyToNull(get(row, columns, COL_FAX)))
                .email(emptyToNull(get(row, columns, COL_EMAIL)))
                .website(emptyToNull(get(row, columns, COL_WEBSITE)))
                .ico(emptyToNull(get(row, columns, COL_ICO)))
                .category(categoriesFor(careField))
                .specialization(emptyToNull(careField))
                .careForm(emptyToNull(get(row, columns, COL_CARE_FORM)))
                .careType(emptyToNull(get(row, columns, COL_CARE_TYPE)))
                .substitute(emptyToNull(get(row, columns, COL_SUBSTITUTE)))
                .lat(gps == null ? null : gps[0])
                .lng(gps == null ? null : gps[1])
                .build();
    }

    private List<String> categoriesFor(String careField) {
        List<String> values = new ArrayList<>();
        for (HealthcareCategory category : HealthcareCategory.values()) {
            if (category.matches(careField)) {
                values.add(category.getValue());
            }
        }
        return values;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String get(String[] row, Map<String, Integer> columns, String column) {
        Integer idx = columns.get(column);
        if (idx == null || idx >= row.length || row[idx] == null) return "";
        return row[idx].trim();
    }

    private Long parseLong(String val) {
        if (val.isBlank()) return null;
        try { return Long.parseLong(val); } catch (NumberFormatException e) { return null; }
    }

    /** GPS column holds "lat lng" separated by whitespace. */
    private double[] parseGps(String val) {
        if (val.isBlank()) return null;
        String[] parts = val.trim().split("\\s+");
        if (parts.length != 2) return null;
        try {
            return new double[]{Double.parseDouble(parts[0]), Double.parseDouble(parts[1])};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
