package io.github.riemr.committee.application.service;

import io.github.riemr.committee.config.SchedulingProperties;
import io.github.riemr.committee.domain.model.CapacityLimits;
import io.github.riemr.committee.domain.model.RecommendationWeights;
import io.github.riemr.committee.domain.model.SlaDefaults;
import io.github.riemr.committee.infrastructure.mapper.AppSettingMapper;
import io.github.riemr.committee.infrastructure.persistence.entity.AppSetting;
import io.github.riemr.committee.util.Weekdays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scheduling settings stored in app_setting. Missing or malformed values fall back to
 * {@code committee.scheduling.*} defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppSettingService {
    static final String KEY_WORK_DAYS = "work_days";
    static final String KEY_MAX_PER_DAY = "max_meetings_per_day";
    static final String KEY_MAX_WEEKLY = "max_weekly_meetings";
    static final String KEY_MAX_THIRD_WEEK = "max_third_week_meetings";
    static final String KEY_MAX_REQUESTS = "max_requests_per_day";
    static final String KEY_SLA_DAYS_BEFORE = "sla_days_before";
    static final String REC_PREFIX = "rec_";

    private final AppSettingMapper mapper;
    private final SchedulingProperties properties;

    public Set<Integer> getWorkDays() {
        Set<Integer> fallback = new TreeSet<>(properties.getWorkDays());
        AppSetting s = mapper.selectByKey(KEY_WORK_DAYS);
        if (s == null) return fallback;
        Set<Integer> parsed = Weekdays.parseCsv(s.getSettingValue());
        if (parsed == null || parsed.isEmpty()) {
            log.warn("Malformed {} '{}', using {}", KEY_WORK_DAYS, s.getSettingValue(), fallback);
            return fallback;
        }
        return parsed;
    }

    @Transactional
    public void updateWorkDays(Collection<Integer> days) {
        if (days == null || days.isEmpty()) throw new IllegalArgumentException("work days must not be empty");
        for (Integer d : days) {
            if (!Weekdays.isValid(d)) throw new IllegalArgumentException("work day must be 0..6: " + d);
        }
        mapper.upsert(KEY_WORK_DAYS, Weekdays.toCsv(days));
    }

    public CapacityLimits getCapacityLimits() {
        SchedulingProperties.Capacity d = properties.getCapacity();
        return CapacityLimits.builder()
                .maxMeetingsPerDay(readInt(KEY_MAX_PER_DAY, d.getMaxMeetingsPerDay(), 0, 10))
                .maxMeetingsPerStandardWeek(readInt(KEY_MAX_WEEKLY, d.getMaxWeeklyMeetings(), 0, 30))
                .maxMeetingsPerThirdWeek(readInt(KEY_MAX_THIRD_WEEK, d.getMaxThirdWeekMeetings(), 0, 30))
                .maxRequestsPerDay(readInt(KEY_MAX_REQUESTS, d.getMaxRequestsPerDay(), 0, 1000))
                .build();
    }

    @Transactional
    public void updateCapacityLimits(CapacityLimits limits) {
        requireRange("max_meetings_per_day", limits.getMaxMeetingsPerDay(), 0, 10);
        requireRange("max_weekly_meetings", limits.getMaxMeetingsPerStandardWeek(), 0, 30);
        requireRange("max_third_week_meetings", limits.getMaxMeetingsPerThirdWeek(), 0, 30);
        requireRange("max_requests_per_day", limits.getMaxRequestsPerDay(), 0, 1000);
        if (limits.getMaxMeetingsPerStandardWeek() < limits.getMaxMeetingsPerDay()) {
            throw new IllegalArgumentException("max_weekly_meetings must be >= max_meetings_per_day");
        }
        if (limits.getMaxMeetingsPerThirdWeek() < limits.getMaxMeetingsPerStandardWeek()) {
            throw new IllegalArgumentException("max_third_week_meetings must be >= max_weekly_meetings");
        }
        mapper.upsert(KEY_MAX_PER_DAY, Integer.toString(limits.getMaxMeetingsPerDay()));
        mapper.upsert(KEY_MAX_WEEKLY, Integer.toString(limits.getMaxMeetingsPerStandardWeek()));
        mapper.upsert(KEY_MAX_THIRD_WEEK, Integer.toString(limits.getMaxMeetingsPerThirdWeek()));
        mapper.upsert(KEY_MAX_REQUESTS, Integer.toString(limits.getMaxRequestsPerDay()));
    }

    public int getSlaDaysBefore() {
        return readInt(KEY_SLA_DAYS_BEFORE, properties.getSla().getDaysBefore(), 1, 180);
    }

    @Transactional
    public void updateSlaDaysBefore(int days) {
        requireRange("sla_days_before", days, 1, 180);
        mapper.upsert(KEY_SLA_DAYS_BEFORE, Integer.toString(days));
    }

    public SlaDefaults getSlaDefaults() {
        SchedulingProperties.Sla sla = properties.getSla();
        return SlaDefaults.builder()
                .totalSlaDays(sla.getTotalDays())
                .stageADays(sla.getStageADays())
                .stageBDays(sla.getStageBDays())
                .stageCDays(sla.getStageCDays())
                .stageDDays(sla.getStageDDays())
                .slaDaysBefore(getSlaDaysBefore())
                .build();
    }

    public RecommendationWeights getRecommendationWeights() {
        Map<String, String> rec = new HashMap<>();
        for (AppSetting s : mapper.selectAll()) {
            if (s.getSettingKey() != null && s.getSettingKey().startsWith(REC_PREFIX)) {
                rec.put(s.getSettingKey(), s.getSettingValue());
            }
        }
        RecommendationWeights d = RecommendationWeights.defaults();
        return RecommendationWeights.builder()
                .baseScore(weight(rec, "rec_base_score", d.getBaseScore()))
                .bestBonus(weight(rec, "rec_best_bonus", d.getBestBonus()))
                .spaceBonus(weight(rec, "rec_space_bonus", d.getSpaceBonus()))
                .slaBonus(weight(rec, "rec_sla_bonus", d.getSlaBonus()))
                .optimalRangeBonus(weight(rec, "rec_optimal_range_bonus", d.getOptimalRangeBonus()))
                .noEventsBonus(weight(rec, "rec_no_events_bonus", d.getNoEventsBonus()))
                .highLoadPenalty(weight(rec, "rec_high_load_penalty", d.getHighLoadPenalty()))
                .mediumLoadPenalty(weight(rec, "rec_medium_load_penalty", d.getMediumLoadPenalty()))
                .noSpacePenalty(weight(rec, "rec_no_space_penalty", d.getNoSpacePenalty()))
                .noSlaPenalty(weight(rec, "rec_no_sla_penalty", d.getNoSlaPenalty()))
                .tightSlaPenalty(weight(rec, "rec_tight_sla_penalty", d.getTightSlaPenalty()))
                .farFuturePenalty(weight(rec, "rec_far_future_penalty", d.getFarFuturePenalty()))
                .weekFullPenalty(weight(rec, "rec_week_full_penalty", d.getWeekFullPenalty()))
                .optimalRangeStart(weight(rec, "rec_optimal_range_start", d.getOptimalRangeStart()))
                .optimalRangeEnd(weight(rec, "rec_optimal_range_end", d.getOptimalRangeEnd()))
                .farFutureThreshold(weight(rec, "rec_far_future_threshold", d.getFarFutureThreshold()))
                .build();
    }

    @Transactional
    public void updateRecommendationWeight(String key, int value) {
        if (key == null || !key.startsWith(REC_PREFIX)) {
            throw new IllegalArgumentException("recommendation setting keys start with " + REC_PREFIX);
        }
        if (value < 0) throw new IllegalArgumentException(key + " must be >= 0");
        mapper.upsert(key, Integer.toString(value));
    }

    private int readInt(String key, int fallback, int min, int max) {
        AppSetting s = mapper.selectByKey(key);
        if (s == null || s.getSettingValue() == null) return fallback;
        try {
            int v = Integer.parseInt(s.getSettingValue().trim());
            if (v < min || v > max) {
                log.warn("Setting {}={} out of range {}..{}, using {}", key, v, min, max, fallback);
                return fallback;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("Malformed setting {}='{}', using {}", key, s.getSettingValue(), fallback);
            return fallback;
        }
    }

    private static int weight(Map<String, String> values, String key, int fallback) {
        String raw = values.get(key);
        if (raw == null) return fallback;
        try {
            int v = Integer.parseInt(raw.trim());
            return v < 0 ? fallback : v;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be " + min + ".." + max);
        }
    }
}
