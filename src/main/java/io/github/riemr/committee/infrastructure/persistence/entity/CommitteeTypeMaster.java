package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;

public class CommitteeTypeMaster implements Serializable {
    private Long committeeTypeId;
    private Long hativaId;
    private String name;
    private Short scheduledDay;
    private String frequency; // weekly / monthly
    private Short weekOfMonth;
    private Boolean operational;
    private Boolean active;

    public Long getCommitteeTypeId() { return committeeTypeId; }
    public void setCommitteeTypeId(Long committeeTypeId) { this.committeeTypeId = committeeTypeId; }
    public Long getHativaId() { return hativaId; }
    public void setHativaId(Long hativaId) { this.hativaId = hativaId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Short getScheduledDay() { return scheduledDay; }
    public void setScheduledDay(Short scheduledDay) { this.scheduledDay = scheduledDay; }
    public String getFrequency() { return frequency; }
    public void setFrequency(String frequency) { this.frequency = frequency; }
    public Short getWeekOfMonth() { return weekOfMonth; }
    public void setWeekOfMonth(Short weekOfMonth) { this.weekOfMonth = weekOfMonth; }
    public Boolean getOperational() { return operational; }
    public void setOperational(Boolean operational) { this.operational = operational; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
