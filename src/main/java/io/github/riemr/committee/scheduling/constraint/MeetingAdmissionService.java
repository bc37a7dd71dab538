package io.github.riemr.committee.scheduling.constraint;

import io.github.riemr.committee.application.dto.AdmissionResult;
import io.github.riemr.committee.application.dto.Decision;
import io.github.riemr.committee.application.dto.MeetingProposal;
import io.github.riemr.committee.application.dto.Violation;
import io.github.riemr.committee.application.dto.ViolationType;
import io.github.riemr.committee.config.AdmissionPolicy;
import io.github.riemr.committee.config.SchedulingProperties;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.CommitteeType;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.domain.model.Division;
import io.github.riemr.committee.exception.InvalidCommitteeTypeConfigException;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
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
 * Decides whether a new meeting may be added on a date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingAdmissionService {
    private final CapacityValidator capacityValidator;
    private final SchedulingProperties properties;

    public AdmissionResult evaluate(ConfigurationSnapshot snapshot, MeetingProposal proposal, boolean override) {
        Decision decision = assess(snapshot, proposal, snapshot.getMeetings());
        AdmissionPolicy policy = properties.getEnforcement();
        boolean admitted = policy == AdmissionPolicy.WARN || decision.isOk() || override;
        boolean overridden = policy == AdmissionPolicy.BLOCK && !decision.isOk() && override;
        if (!decision.isOk()) {
            log.info("Meeting proposal {} on {}: policy={} admitted={} violations={}",
                    proposal.committeeTypeId(), proposal.date(), policy, admitted, decision.messages());
        }
        return new AdmissionResult(admitted, overridden, decision);
    }

    /**
     * Calendar, division, slot and capacity checks of a proposal against the given meetings.
     */
    public Decision assess(ConfigurationSnapshot snapshot, MeetingProposal proposal, Collection<CommitteeMeeting> meetings) {
        CommitteeType type = snapshot.committeeType(proposal.committeeTypeId())
                .orElseThrow(() -> new InvalidCommitteeTypeConfigException(proposal.committeeTypeId(), "committee type not found"));
        return assess(snapshot, type, proposal.divisionId(), proposal.date(), meetings);
    }

    /**
     * Same checks for a committee type that need not be part of the snapshot. A division missing from the
     * snapshot has no weekday restriction.
     */
    public Decision assess(ConfigurationSnapshot snapshot,
                           CommitteeType type,
                           Long divisionId,
                           LocalDate date,
                           Collection<CommitteeMeeting> meetings) {
        Objects.requireNonNull(date, "date");
        if (!Objects.equals(type.getDivisionId(), divisionId)) {
            throw new InvalidCommitteeTypeConfigException(type.getId(),
                    "belongs to division " + type.getDivisionId() + ", not " + divisionId);
        }
        Optional<Division> division = snapshot.division(divisionId);

        BusinessCalendar calendar = BusinessCalendar.of(snapshot.getWorkCalendar());
        List<Violation> leading = new ArrayList<>();
        calendar.closedReason(date)
                .ifPresent(reason -> leading.add(new Violation(ViolationType.NON_BUSINESS_DAY, reason)));
        int weekday = Weekdays.ordinalOf(date);
        if (division.isPresent() && !division.get().isWeekdayAllowed(weekday)) {
            leading.add(new Violation(ViolationType.DIVISION_WEEKDAY_NOT_ALLOWED,
                    Weekdays.nameOf(weekday) + " is not an allowed meeting day for division " + division.get().getName()));
        }
        if (meetings.stream().anyMatch(m -> m.occupies(type.getId(), divisionId, date))) {
            leading.add(new Violation(ViolationType.DUPLICATE_SLOT,
                    "committee type " + type.getName() + " already meets on " + date));
        }

        Decision capacity = capacityValidator.checkCapacity(calendar, date, meetings, snapshot.getEvents(),
                snapshot.getCapacityLimits(), 0);
        return capacity.withLeading(leading);
    }
}
