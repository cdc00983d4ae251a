package com.caredirectory.providers.persistence;

import com.caredirectory.providers.model.HealthcareProvider;
import com.caredirectory.providers.model.HealthcareProviderId;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to healthcare_provider and its category links.
 *
 * Methods do not open transactions themselves; callers decide the unit of work.
 */
@Repository
@RequiredArgsConstructor
public class HealthcareProviderRepository {

    private static final String SELECT_COLUMNS = """
            location_id, institution_id, title, institution_type, street, house_number, city,
            postal_code, phone_number, fax, email, website, ico, specialization, care_form,
            care_type, substitute, lat, lng
            """;

    private static final RowMapper<HealthcareProvider> ROW_MAPPER = HealthcareProviderRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Upserts the providers, stamps them with {@code cycleId} and replaces their category links.
     */
    public void upsertBatch(List<HealthcareProvider> providers, String cycleId) {
        jdbcTemplate.batchUpdate("""
                MERGE INTO healthcare_provider
                (location_id, institution_id, title, institution_type, street, house_number, city,
                 postal_code, phone_number, fax, email, website, ico, specialization, care_form,
                 care_type, substitute, lat, lng, cycle_id)
                KEY (location_id, institution_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                providers, providers.size(), (ps, p) -> {
                    ps.setLong(1, p.getLocationId());
                    ps.setLong(2, p.getInstitutionId());
                    ps.setString(3, p.getTitle());
                    ps.setString(4, p.getInstitutionType());
                    ps.setString(5, p.getStreet());
                    ps.setString(6, p.getHouseNumber());
                    ps.setString(7, p.getCity());
                    ps.setString(8, p.getPostalCode());
                    ps.setString(9, p.getPhoneNumber());
                    ps.setString(10, p.getFax());
                    ps.setString(11, p.getEmail());
                    ps.setString(12, p.getWebsite());
                    ps.setString(13, p.getIco());
                    ps.setString(14, p.getSpecialization());
                    ps.setString(15, p.getCareForm());
                    ps.setString(16, p.getCareType());
                    ps.setString(17, p.getSubstitute());
                    setDouble(ps, 18, p.getLat());
                    setDouble(ps, 19, p.getLng());
                    ps.setString(20, cycleId);
                });

        jdbcTemplate.batchUpdate(
                "DELETE FROM healthcare_provider_category WHERE location_id = ? AND institution_id = ?",
                providers, providers.size(), (ps, p) -> {
                    ps.setLong(1, p.getLocationId());
                    ps.setLong(2, p.getInstitutionId());
                });

        List<Object[]> links = new ArrayList<>();
        for (HealthcareProvider p : providers) {
            List<String> categories = p.getCategory() == null ? List.of() : p.getCategory();
            for (int i = 0; i < categories.size(); i++) {
                links.add(new Object[]{p.getLocationId(), p.getInstitutionId(), categories.get(i), i});
            }
        }
        if (!links.isEmpty()) {
            jdbcTemplate.batchUpdate("""
                    MERGE INTO healthcare_provider_category
                    (location_id, institution_id, category_value, sort_order)
                    KEY (location_id, institution_id, category_value)
                    VALUES (?, ?, ?, ?)
                    """, links);
        }
    }

    /**
     * Deletes providers last written by any cycle other than {@code cycleId}, with their links.
     *
     * @return number of provider rows removed
     */
    public int deleteOtherCycles(String cycleId) {
        int removed = jdbcTemplate.update("DELETE FROM healthcare_provider WHERE cycle_id <> ?", cycleId);
        jdbcTemplate.update("""
                DELETE FROM healthcare_provider_category c
                WHERE NOT EXISTS (
                    SELECT 1 FROM healthcare_provider p
                    WHERE p.location_id = c.location_id AND p.institution_id = c.institution_id)
                """);
        return removed;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM healthcare_provider", Long.class);
        return count == null ? 0 : count;
    }

    /**
     * One page of providers in key order. Pages are zero-based.
     */
    public List<HealthcareProvider> findPage(int page, int pageSize) {
        long offset = (long) page * pageSize;
        List<HealthcareProvider> providers = jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM healthcare_provider"
                        + " ORDER BY location_id, institution_id LIMIT ? OFFSET ?",
                ROW_MAPPER, pageSize, offset);

        Map<HealthcareProviderId, List<String>> categories = new HashMap<>();
        jdbcTemplate.query("""
                SELECT c.location_id, c.institution_id, c.category_value
                FROM healthcare_provider_category c
                JOIN (SELECT location_id, institution_id FROM healthcare_provider
                      ORDER BY location_id, institution_id LIMIT ? OFFSET ?) p
                  ON p.location_id = c.location_id AND p.institution_id = c.institution_id
                ORDER BY c.location_id, c.institution_id, c.sort_order
                """,
                (RowCallbackHandler) rs -> {
                    HealthcareProviderId id = new HealthcareProviderId(
                            rs.getLong("location_id"), rs.getLong("institution_id"));
                    categories.computeIfAbsent(id, k -> new ArrayList<>()).add(rs.getString("category_value"));
                },
                pageSize, offset);

        for (HealthcareProvider provider : providers) {
            provider.setCategory(categories.getOrDefault(provider.id(), List.of()));
        }
        return providers;
    }

    public Optional<HealthcareProvider> findById(HealthcareProviderId id) {
        List<HealthcareProvider> found = jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM healthcare_provider WHERE location_id = ? AND institution_id = ?",
                ROW_MAPPER, id.locationId(), id.institutionId());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        HealthcareProvider provider = found.get(0);
        provider.setCategory(jdbcTemplate.queryForList("""
                SELECT category_value FROM healthcare_provider_category
                WHERE location_id = ? AND institution_id = ?
                ORDER BY sort_order
                """, String.class, id.locationId(), id.institutionId()));
        return Optional.of(provider);
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private static HealthcareProvider mapRow(ResultSet rs, int rowNum) throws SQLException {
        return HealthcareProvider.builder()
                .locationId(rs.getLong("location_id"))
                .institutionId(rs.getLong("institution_id"))
                .title(rs.getString("title"))
                .institutionType(rs.getString("institution_type"))
                .street(rs.getString("street"))
                .houseNumber(rs.getString("house_number"))
                .city(rs.getString("city"))
                .postalCode(rs.getString("postal_code"))
                .phoneNumber(rs.getString("phone_number"))
                .fax(rs.getString("fax"))
                .email(rs.getString("email"))
                .website(rs.getString("website"))
                .ico(rs.getString("ico"))
                .specialization(rs.getString("specialization"))
                .careForm(rs.getString("care_form"))
                .careType(rs.getString("care_type"))
                .substitute(rs.getString("substitute"))
                .lat(getDouble(rs, "lat"))
                .lng(getDouble(rs, "lng"))
                .category(List.of())
                .build();
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void setDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.DOUBLE);
        } else {
            ps.setDouble(idx, value);
        }
    }
}
