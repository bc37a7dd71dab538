package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;

public class ExceptionDateMaster implements Serializable {
    private Long exceptionDateId;
    private LocalDate exceptionDate;
    private String description;
    private String dateType; // holiday, sabbatical, ...
    private Boolean active;

    public Long getExceptionDateId() { return exceptionDateId; }
    public void setExceptionDateId(Long exceptionDateId) { this.exceptionDateId = exceptionDateId; }
    public LocalDate getExceptionDate() { return exceptionDate; }
    public void setExceptionDate(LocalDate exceptionDate) { this.exceptionDate = exceptionDate; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getDateType() { return dateType; }
    public void setDateType(String dateType) { this.dateType = dateType; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
