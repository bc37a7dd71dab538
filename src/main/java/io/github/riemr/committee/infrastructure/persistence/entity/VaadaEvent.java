package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;
import java.time.LocalDate;

public class VaadaEvent implements Serializable {
    private Long eventId;
    private Long vaadaId;
    private Long maslulId;
    private String name;
    private Integer expectedRequests;
    private LocalDate callPublicationDate;
    private LocalDate callDeadlineDate;
    private LocalDate intakeDeadlineDate;
    private LocalDate reviewDeadlineDate;
    private LocalDate responseDeadlineDate;

    public Long getEventId() { return eventId; }
    public void setEventId(Long eventId) { this.eventId = eventId; }
    public Long getVaadaId() { return vaadaId; }
    public void setVaadaId(Long vaadaId) { this.vaadaId = vaadaId; }
    public Long getMaslulId() { return maslulId; }
    public void setMaslulId(Long maslulId) { this.maslulId = maslulId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Integer getExpectedRequests() { return expectedRequests; }
    public void setExpectedRequests(Integer expectedRequests) { this.expectedRequests = expectedRequests; }
    public LocalDate getCallPublicationDate() { return callPublicationDate; }
    public void setCallPublicationDate(LocalDate callPublicationDate) { this.callPublicationDate = callPublicationDate; }
    public LocalDate getCallDeadlineDate() { return callDeadlineDate; }
    public void setCallDeadlineDate(LocalDate callDeadlineDate) { this.callDeadlineDate = callDeadlineDate; }
    public LocalDate getIntakeDeadlineDate() { return intakeDeadlineDate; }
    public void setIntakeDeadlineDate(LocalDate intakeDeadlineDate) { this.intakeDeadlineDate = intakeDeadlineDate; }
    public LocalDate getReviewDeadlineDate() { return reviewDeadlineDate; }
    public void setReviewDeadlineDate(LocalDate reviewDeadlineDate) { this.reviewDeadlineDate = reviewDeadlineDate; }
    public LocalDate getResponseDeadlineDate() { return responseDeadlineDate; }
    public void setResponseDeadlineDate(LocalDate responseDeadlineDate) { this.responseDeadlineDate = responseDeadlineDate; }
}
