package io.github.riemr.committee.scheduling.suggestion;

import io.github.riemr.committee.application.dto.ApprovalResult;
import io.github.riemr.committee.application.dto.Candidate;
import io.github.riemr.committee.application.dto.Decision;
import io.github.riemr.committee.application.dto.MeetingProposal;
import io.github.riemr.committee.application.dto.MeetingSuggestion;
import io.github.riemr.committee.application.dto.MonthlySchedule;
import io.github.riemr.committee.application.dto.RejectedSuggestion;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.CommitteeType;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.domain.model.Division;
import io.github.riemr.committee.domain.model.Frequency;
import io.github.riemr.committee.domain.model.MeetingStatus;
import io.github.riemr.committee.exception.SchedulingException;
import io.github.riemr.committee.scheduling.constraint.MeetingAdmissionService;
import io.github.riemr.committee.util.Weekdays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drafts a month of meetings for every active committee type and turns approved drafts into meetings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonthlyScheduleGenerator {
    private final DateSuggester dateSuggester;
    private final MeetingAdmissionService admissionService;

    public MonthlySchedule generate(ConfigurationSnapshot snapshot, YearMonth month, Collection<Long> divisionIds) {
        List<Division> divisions = snapshot.getDivisions().stream()
                .filter(Division::isActive)
                .filter(d -> divisionIds == null || divisionIds.contains(d.getId()))
                .sorted(Comparator.comparing(Division::getId))
                .collect(Collectors.toList());

        // drafts count toward capacity of the types processed after them
        List<CommitteeMeeting> working = new ArrayList<>(snapshot.getMeetings());
        List<MeetingSuggestion> suggestions = new ArrayList<>();
        for (Division division : divisions) {
            List<CommitteeType> types = snapshot.getCommitteeTypes().stream()
                    .filter(CommitteeType::isActive)
                    .filter(t -> division.getId().equals(t.getDivisionId()))
                    .sorted(Comparator.comparing(CommitteeType::getId))
                    .collect(Collectors.toList());
            for (CommitteeType type : types) {
                List<Candidate> candidates;
                try {
                    candidates = dateSuggester.suggestDates(snapshot, type, division.getId(),
                            month.atDay(1), month.lengthOfMonth(), working);
                } catch (SchedulingException e) {
                    log.warn("Skipping committee type {} in {}: {}", type.getId(), month, e.getMessage());
                    continue;
                }
                List<Candidate> available = candidates.stream().filter(Candidate::available).collect(Collectors.toList());
                if (type.getFrequency() == Frequency.MONTHLY && available.size() > 1) {
                    available = available.subList(0, 1);
                }
                for (Candidate c : available) {
                    suggestions.add(MeetingSuggestion.builder()
                            .committeeTypeId(type.getId())
                            .committeeTypeName(type.getName())
                            .divisionId(division.getId())
                            .date(c.date())
                            .weekday(Weekdays.ordinalOf(c.date()))
                            .build());
                    working.add(CommitteeMeeting.builder()
                            .committeeTypeId(type.getId())
                            .divisionId(division.getId())
                            .date(c.date())
                            .build());
                }
            }
        }
        log.info("Generated {} meeting suggestions for {} across {} divisions", suggestions.size(), month, divisions.size());
        return new MonthlySchedule(month, suggestions);
    }

    /**
     * Re-validates each suggestion against the snapshot plus the ones approved before it. Nothing is persisted.
     */
    public ApprovalResult approve(ConfigurationSnapshot snapshot, List<MeetingSuggestion> suggestions, boolean autoApprove) {
        MeetingStatus status = autoApprove ? MeetingStatus.SCHEDULED : MeetingStatus.PLANNED;
        List<CommitteeMeeting> working = new ArrayList<>(snapshot.getMeetings());
        List<CommitteeMeeting> approved = new ArrayList<>();
        List<RejectedSuggestion> rejected = new ArrayList<>();

        for (MeetingSuggestion s : suggestions) {
            Decision decision;
            try {
                decision = admissionService.assess(snapshot,
                        new MeetingProposal(s.getCommitteeTypeId(), s.getDivisionId(), s.getDate()), working);
            } catch (SchedulingException e) {
                rejected.add(new RejectedSuggestion(s, List.of(e.getMessage())));
                continue;
            }
            if (!decision.isOk()) {
                rejected.add(new RejectedSuggestion(s, decision.messages()));
                continue;
            }
            CommitteeMeeting meeting = CommitteeMeeting.builder()
                    .committeeTypeId(s.getCommitteeTypeId())
                    .divisionId(s.getDivisionId())
                    .date(s.getDate())
                    .status(status)
                    .notes("auto-generated")
                    .build();
            working.add(meeting);
            approved.add(meeting);
        }
        log.info("Approved {} of {} suggestions ({} rejected)", approved.size(), suggestions.size(), rejected.size());
        return new ApprovalResult(approved, rejected);
    }
}
