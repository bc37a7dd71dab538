package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;

public class Vaada implements Serializable {
    private Long vaadaId;
    private Long committeeTypeId;
    private Long hativaId;
    private LocalDate vaadaDate;
    private String status;
    private Long exceptionDateId;
    private String notes;
    private Boolean deleted;

    public Long getVaadaId() { return vaadaId; }
    public void setVaadaId(Long vaadaId) { this.vaadaId = vaadaId; }
    public Long getCommitteeTypeId() { return committeeTypeId; }
    public void setCommitteeTypeId(Long committeeTypeId) { this.committeeTypeId = committeeTypeId; }
    public Long getHativaId() { return hativaId; }
    public void setHativaId(Long hativaId) { this.hativaId = hativaId; }
    public LocalDate getVaadaDate() { return vaadaDate; }
    public void setVaadaDate(LocalDate vaadaDate) { this.vaadaDate = vaadaDate; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public Long getExceptionDateId() { return exceptionDateId; }
    public void setExceptionDateId(Long exceptionDateId) { this.exceptionDateId = exceptionDateId; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public Boolean getDeleted() { return deleted; }
    public void setDeleted(Boolean deleted) { this.deleted = deleted; }
}
