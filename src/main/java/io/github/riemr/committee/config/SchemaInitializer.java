package io.github.riemr.committee.config;

import io.github.riemr.committee.util.Weekdays;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "committee.scheduling.schema-init", havingValue = "true", matchIfMissing = true)
public class SchemaInitializer {
    private final JdbcTemplate jdbc;
    private final SchedulingProperties properties;

    @PostConstruct
    public void ensureTables() {
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS app_setting (" +
                    "setting_key VARCHAR(64) PRIMARY KEY, " +
                    "setting_value TEXT, " +
                    "description TEXT, " +
                    "updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS hativot (" +
                    "hativa_id BIGSERIAL PRIMARY KEY, " +
                    "name TEXT NOT NULL, " +
                    "color VARCHAR(16), " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE" +
                    ")");
            // active division names are unique
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_hativot_active_name ON hativot(name) WHERE is_active");
            jdbc.execute("CREATE TABLE IF NOT EXISTS hativa_day_constraints (" +
                    "hativa_id BIGINT NOT NULL REFERENCES hativot(hativa_id), " +
                    "day_of_week SMALLINT NOT NULL CHECK (day_of_week BETWEEN 0 AND 6), " +
                    "PRIMARY KEY (hativa_id, day_of_week)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS maslulim (" +
                    "maslul_id BIGSERIAL PRIMARY KEY, " +
                    "hativa_id BIGINT NOT NULL REFERENCES hativot(hativa_id), " +
                    "name TEXT NOT NULL, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "sla_days INTEGER, " +
                    "stage_a_days INTEGER NOT NULL DEFAULT 10, " +
                    "stage_b_days INTEGER NOT NULL DEFAULT 15, " +
                    "stage_c_days INTEGER NOT NULL DEFAULT 10, " +
                    "stage_d_days INTEGER NOT NULL DEFAULT 10" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS committee_types (" +
                    "committee_type_id BIGSERIAL PRIMARY KEY, " +
                    "hativa_id BIGINT NOT NULL REFERENCES hativot(hativa_id), " +
                    "name TEXT NOT NULL, " +
                    "scheduled_day SMALLINT NOT NULL CHECK (scheduled_day BETWEEN 0 AND 6), " +
                    "frequency VARCHAR(16) NOT NULL DEFAULT 'weekly', " +
                    "week_of_month SMALLINT CHECK (week_of_month BETWEEN 1 AND 5), " +
                    "is_operational BOOLEAN NOT NULL DEFAULT FALSE, " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS exception_dates (" +
                    "exception_date_id BIGSERIAL PRIMARY KEY, " +
                    "exception_date DATE NOT NULL UNIQUE, " +
                    "description TEXT, " +
                    "date_type VARCHAR(16) NOT NULL DEFAULT 'holiday', " +
                    "is_active BOOLEAN NOT NULL DEFAULT TRUE" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS vaadot (" +
                    "vaadot_id BIGSERIAL PRIMARY KEY, " +
                    "committee_type_id BIGINT NOT NULL REFERENCES committee_types(committee_type_id), " +
                    "hativa_id BIGINT NOT NULL REFERENCES hativot(hativa_id), " +
                    "vaada_date DATE NOT NULL, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'planned', " +
                    "exception_date_id BIGINT REFERENCES exception_dates(exception_date_id), " +
                    "notes TEXT, " +
                    "is_deleted BOOLEAN NOT NULL DEFAULT FALSE" +
                    ")");
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_vaadot_slot ON vaadot(committee_type_id, hativa_id, vaada_date) " +
                    "WHERE NOT is_deleted AND status <> 'cancelled'");
            jdbc.execute("CREATE TABLE IF NOT EXISTS events (" +
                    "event_id BIGSERIAL PRIMARY KEY, " +
                    "vaadot_id BIGINT NOT NULL REFERENCES vaadot(vaadot_id), " +
                    "maslul_id BIGINT NOT NULL REFERENCES maslulim(maslul_id), " +
                    "name TEXT NOT NULL, " +
                    "expected_requests INTEGER NOT NULL DEFAULT 0 CHECK (expected_requests >= 0), " +
                    "call_publication_date DATE, " +
                    "call_deadline_date DATE, " +
                    "intake_deadline_date DATE, " +
                    "review_deadline_date DATE, " +
                    "response_deadline_date DATE, " +
                    "is_deleted BOOLEAN NOT NULL DEFAULT FALSE" +
                    ")");

            seedSetting("work_days", Weekdays.toCsv(properties.getWorkDays()));
            seedSetting("max_meetings_per_day", Integer.toString(properties.getCapacity().getMaxMeetingsPerDay()));
            seedSetting("max_weekly_meetings", Integer.toString(properties.getCapacity().getMaxWeeklyMeetings()));
            seedSetting("max_third_week_meetings", Integer.toString(properties.getCapacity().getMaxThirdWeekMeetings()));
            seedSetting("max_requests_per_day", Integer.toString(properties.getCapacity().getMaxRequestsPerDay()));
            seedSetting("sla_days_before", Integer.toString(properties.getSla().getDaysBefore()));
            log.info("Committee schedule tables ensured");
        } catch (Exception e) {
            log.warn("Schema initialization skipped or failed: {}", e.getMessage());
        }
    }

    private void seedSetting(String key, String value) {
        jdbc.update("INSERT INTO app_setting(setting_key, setting_value) VALUES (?, ?) ON CONFLICT (setting_key) DO NOTHING", key, value);
    }
}
