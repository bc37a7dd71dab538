package io.github.riemr.committee.scheduling.suggestion;

import io.github.riemr.committee.application.dto.Candidate;
import io.github.riemr.committee.application.dto.Decision;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.CommitteeType;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.exception.InvalidCommitteeTypeConfigException;
import io.github.riemr.committee.exception.InvalidSearchWindowException;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import io.github.riemr.committee.scheduling.constraint.MeetingAdmissionService;
import io.github.riemr.committee.util.Weekdays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lists the dates in a window on which a committee type could meet, with the reasons the others cannot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DateSuggester {
    private final MeetingAdmissionService admissionService;

    public List<Candidate> suggestDates(ConfigurationSnapshot snapshot,
                                        CommitteeType committeeType,
                                        Long divisionId,
                                        LocalDate searchFrom,
                                        int searchWindowDays) {
        return suggestDates(snapshot, committeeType, divisionId, searchFrom, searchWindowDays, snapshot.getMeetings());
    }

    /**
     * Same as {@link #suggestDates(ConfigurationSnapshot, CommitteeType, Long, LocalDate, int)} but checked
     * against the given meetings instead of the snapshot's.
     */
    List<Candidate> suggestDates(ConfigurationSnapshot snapshot,
                                 CommitteeType committeeType,
                                 Long divisionId,
                                 LocalDate searchFrom,
                                 int searchWindowDays,
                                 Collection<CommitteeMeeting> meetings) {
        if (searchWindowDays < 0) {
            throw new InvalidSearchWindowException("searchWindowDays must be >= 0 but was " + searchWindowDays);
        }
        Objects.requireNonNull(searchFrom, "searchFrom");
        committeeType.validate();
        if (!Objects.equals(committeeType.getDivisionId(), divisionId)) {
            throw new InvalidCommitteeTypeConfigException(committeeType.getId(),
                    "belongs to division " + committeeType.getDivisionId() + ", not " + divisionId);
        }

        BusinessCalendar calendar = BusinessCalendar.of(snapshot.getWorkCalendar());
        LocalDate end = searchFrom.plusDays(searchWindowDays);
        int shift = (committeeType.getScheduledWeekday() - Weekdays.ordinalOf(searchFrom) + 7) % 7;

        List<Candidate> candidates = new ArrayList<>();
        for (LocalDate date = searchFrom.plusDays(shift); date.isBefore(end); date = date.plusWeeks(1)) {
            if (!committeeType.recursOn(date)) {
                continue;
            }
            Optional<String> closed = calendar.closedReason(date);
            if (closed.isPresent()) {
                candidates.add(new Candidate(date, false, List.of(closed.get())));
                continue;
            }
            Decision decision = admissionService.assess(snapshot, committeeType, divisionId, date, meetings);
            candidates.add(new Candidate(date, decision.isOk(), decision.messages()));
        }
        log.debug("Suggested {} dates for committee type {} from {} (+{} days)",
                candidates.size(), committeeType.getId(), searchFrom, searchWindowDays);
        return candidates;
    }
}
