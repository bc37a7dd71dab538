package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;

/** Allowed meeting weekday of a division (0 = Sunday). */
public class HativaDay implements Serializable {
    private Long hativaId;
    private Short dayOfWeek;

    public Long getHativaId() { return hativaId; }
    public void setHativaId(Long hativaId) { this.hativaId = hativaId; }
    public Short getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Short dayOfWeek) { this.dayOfWeek = dayOfWeek; }
}
