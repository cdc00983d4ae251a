package com.caredirectory.providers.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class HealthcareCategoryRepository {

    private final JdbcTemplate jdbcTemplate;

    public void replaceAll(List<String> values) {
        jdbcTemplate.update("DELETE FROM healthcare_category");
        jdbcTemplate.batchUpdate("INSERT INTO healthcare_category (category_value) VALUES (?)",
                values.stream().map(v -> new Object[]{v}).toList());
    }

    public List<String> findAll() {
        return jdbcTemplate.queryForList(
                "SELECT category_value FROM healthcare_category ORDER BY category_value", String.class);
    }
}
