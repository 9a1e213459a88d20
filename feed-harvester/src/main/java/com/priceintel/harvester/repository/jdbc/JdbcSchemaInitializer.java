package com.priceintel.harvester.repository.jdbc;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the harvester tables when missing. Safe to run on every startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcSchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring harvester schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS feeds
            (
                id                       TEXT PRIMARY KEY,
                retailer_id              TEXT NOT NULL,
                merchant_id              TEXT,
                name                     TEXT NOT NULL,
                feed_type                TEXT NOT NULL DEFAULT 'RETAILER',
                transport_kind           TEXT NOT NULL,
                transport_url            TEXT,
                transport_host           TEXT,
                transport_port           INTEGER,
                transport_path           TEXT,
                transport_username       TEXT,
                transport_password       TEXT,
                max_file_size_bytes      BIGINT,
                format                   TEXT NOT NULL DEFAULT 'AUTO',
                max_row_count            INTEGER,
                schedule_frequency_hours INTEGER NOT NULL DEFAULT 24,
                next_run_at              TIMESTAMPTZ,
                manual_run_pending       BOOLEAN NOT NULL DEFAULT FALSE,
                status                   TEXT NOT NULL DEFAULT 'ENABLED',
                consecutive_failures     INTEGER NOT NULL DEFAULT 0,
                last_content_hash        TEXT,
                last_run_at              TIMESTAMPTZ,
                last_success_at          TIMESTAMPTZ
            )
        """);
        jdbcTemplate.execute("""
            ALTER TABLE feeds
                ADD COLUMN IF NOT EXISTS manual_request_seq BIGINT NOT NULL DEFAULT 0,
                ADD COLUMN IF NOT EXISTS manual_claimed_seq BIGINT,
                ADD COLUMN IF NOT EXISTS manual_claimed_at  TIMESTAMPTZ
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS feeds_due_idx ON feeds (status, next_run_at)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS feed_runs
            (
                id                 TEXT PRIMARY KEY,
                feed_id            TEXT NOT NULL REFERENCES feeds (id),
                trigger            TEXT NOT NULL,
                status             TEXT NOT NULL,
                started_at         TIMESTAMPTZ NOT NULL,
                finished_at        TIMESTAMPTZ,
                rows_read          INTEGER NOT NULL DEFAULT 0,
                rows_parsed        INTEGER NOT NULL DEFAULT 0,
                row_count          INTEGER NOT NULL DEFAULT 0,
                prices_written     INTEGER NOT NULL DEFAULT 0,
                quarantined_count  INTEGER NOT NULL DEFAULT 0,
                error_count        INTEGER NOT NULL DEFAULT 0,
                primary_error_code TEXT,
                error_message      TEXT,
                skipped_reason     TEXT,
                parse_errors       JSONB NOT NULL DEFAULT '[]'
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS feed_runs_finished_idx ON feed_runs (status, finished_at)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS quarantined_records
            (
                id              TEXT PRIMARY KEY,
                feed_id         TEXT NOT NULL,
                retailer_id     TEXT NOT NULL,
                run_id          TEXT,
                feed_type       TEXT NOT NULL,
                match_key       TEXT NOT NULL,
                row_number      INTEGER NOT NULL,
                raw_fields      JSONB NOT NULL,
                parsed_fields   JSONB NOT NULL,
                blocking_errors JSONB NOT NULL,
                status          TEXT NOT NULL,
                dismiss_note    TEXT,
                created_at      TIMESTAMPTZ NOT NULL,
                updated_at      TIMESTAMPTZ NOT NULL,
                UNIQUE (feed_id, match_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS feed_corrections
            (
                id                    TEXT PRIMARY KEY,
                quarantined_record_id TEXT NOT NULL REFERENCES quarantined_records (id),
                field                 TEXT NOT NULL,
                old_value             TEXT,
                new_value             TEXT,
                author                TEXT NOT NULL,
                created_at            TIMESTAMPTZ NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS source_products
            (
                id              TEXT PRIMARY KEY,
                retailer_id     TEXT NOT NULL,
                feed_id         TEXT,
                identity_key    TEXT NOT NULL,
                identity_type   TEXT NOT NULL,
                title           TEXT,
                url             TEXT,
                brand           TEXT,
                upc             TEXT,
                sku             TEXT,
                network_item_id TEXT,
                created_at      TIMESTAMPTZ NOT NULL,
                updated_at      TIMESTAMPTZ NOT NULL,
                UNIQUE (retailer_id, identity_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS source_product_presence
            (
                source_product_id TEXT PRIMARY KEY REFERENCES source_products (id),
                last_seen_at      TIMESTAMPTZ NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS source_product_seen
            (
                run_id            TEXT NOT NULL,
                source_product_id TEXT NOT NULL REFERENCES source_products (id),
                PRIMARY KEY (run_id, source_product_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS prices
            (
                id                TEXT PRIMARY KEY,
                source_product_id TEXT NOT NULL REFERENCES source_products (id),
                retailer_id       TEXT NOT NULL,
                price             NUMERIC(12, 2) NOT NULL,
                original_price    NUMERIC(12, 2),
                currency          TEXT NOT NULL,
                in_stock          BOOLEAN NOT NULL,
                price_signature   TEXT NOT NULL,
                run_type          TEXT NOT NULL,
                run_id            TEXT NOT NULL,
                observed_at       TIMESTAMPTZ NOT NULL,
                UNIQUE (run_id, source_product_id, price_signature)
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS prices_latest_idx ON prices (source_product_id, observed_at DESC)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS canonical_products
            (
                id           TEXT PRIMARY KEY,
                upc          TEXT,
                title        TEXT NOT NULL,
                brand        TEXT,
                caliber      TEXT,
                grain_weight INTEGER,
                round_count  INTEGER
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS canonical_products_upc_idx ON canonical_products (upc)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS product_links
            (
                source_product_id    TEXT PRIMARY KEY REFERENCES source_products (id),
                canonical_product_id TEXT REFERENCES canonical_products (id),
                status               TEXT NOT NULL,
                tier                 TEXT NOT NULL,
                confidence           DOUBLE PRECISION NOT NULL,
                matched_signals      TEXT NOT NULL DEFAULT '',
                candidate_count      INTEGER NOT NULL DEFAULT 0,
                resolver_version     TEXT NOT NULL,
                resolved_at          TIMESTAMPTZ NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS retailers
            (
                id          TEXT PRIMARY KEY,
                name        TEXT NOT NULL,
                eligibility TEXT NOT NULL DEFAULT 'ELIGIBLE'
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS merchants
            (
                id                          TEXT PRIMARY KEY,
                name                        TEXT NOT NULL,
                tier                        TEXT NOT NULL DEFAULT 'STANDARD',
                subscription_status         TEXT NOT NULL DEFAULT 'ACTIVE',
                subscription_expires_at     TIMESTAMPTZ,
                last_subscription_notify_at TIMESTAMPTZ
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS merchant_retailers
            (
                merchant_id    TEXT NOT NULL,
                retailer_id    TEXT NOT NULL,
                status         TEXT NOT NULL,
                listing_status TEXT NOT NULL,
                PRIMARY KEY (merchant_id, retailer_id)
            )
        """);

        log.info("Harvester schema ready.");
    }
}
