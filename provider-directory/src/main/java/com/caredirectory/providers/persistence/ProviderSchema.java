package com.caredirectory.providers.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the directory tables if they do not exist yet.
 *
 * Categories are referenced by value from healthcare_provider_category, deliberately without a
 * foreign key: the seeder replaces the category set every cycle.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProviderSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring provider directory schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS healthcare_category
            (
                category_value      VARCHAR(255) PRIMARY KEY
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS healthcare_provider
            (
                location_id         BIGINT NOT NULL,
                institution_id      BIGINT NOT NULL,
                title               VARCHAR(512),
                institution_type    VARCHAR(255),
                street              VARCHAR(255),
                house_number        VARCHAR(64),
                city                VARCHAR(255),
                postal_code         VARCHAR(16),
                phone_number        VARCHAR(255),
                fax                 VARCHAR(255),
                email               VARCHAR(255),
                website             VARCHAR(512),
                ico                 VARCHAR(16),
                specialization      VARCHAR(2048),
                care_form           VARCHAR(255),
                care_type           VARCHAR(255),
                substitute          VARCHAR(512),
                lat                 DOUBLE PRECISION,
                lng                 DOUBLE PRECISION,
                cycle_id            VARCHAR(36) NOT NULL,
                PRIMARY KEY (location_id, institution_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS healthcare_provider_category
            (
                location_id         BIGINT NOT NULL,
                institution_id      BIGINT NOT NULL,
                category_value      VARCHAR(255) NOT NULL,
                sort_order          INT NOT NULL,
                PRIMARY KEY (location_id, institution_id, category_value)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS server_properties
            (
                id                  INT PRIMARY KEY,
                last_update         DATE NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS refresh_run
            (
                run_id              VARCHAR(36) PRIMARY KEY,
                trigger_source      VARCHAR(16) NOT NULL,
                started_at          TIMESTAMP NOT NULL,
                completed_at        TIMESTAMP,
                status              VARCHAR(16) NOT NULL,
                records_parsed      INT NOT NULL,
                records_written     INT NOT NULL,
                error_code          VARCHAR(64),
                error_message       VARCHAR(1024)
            )
        """);

        log.info("Provider directory schema ready.");
    }
}
