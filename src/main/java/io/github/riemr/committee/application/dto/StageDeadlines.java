package io.github.riemr.committee.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class StageDeadlines {
    LocalDate callStart;
    LocalDate callDeadline;
    LocalDate intakeDeadline;
    LocalDate reviewDeadline;
    LocalDate meetingDate;
    LocalDate responseDeadline;
}
