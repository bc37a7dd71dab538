package io.github.riemr.committee.application.service;

import io.github.riemr.committee.application.repository.ExceptionDateRepository;
import io.github.riemr.committee.application.repository.MasterDataRepository;
import io.github.riemr.committee.application.repository.VaadaRepository;
import io.github.riemr.committee.config.SchedulingProperties;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.CommitteeType;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.domain.model.Division;
import io.github.riemr.committee.domain.model.Event;
import io.github.riemr.committee.domain.model.ExceptionDate;
import io.github.riemr.committee.domain.model.ExceptionDateKind;
import io.github.riemr.committee.domain.model.Frequency;
import io.github.riemr.committee.domain.model.MeetingStatus;
import io.github.riemr.committee.domain.model.Route;
import io.github.riemr.committee.domain.model.WorkCalendar;
import io.github.riemr.committee.exception.InvalidSearchWindowException;
import io.github.riemr.committee.infrastructure.persistence.entity.CommitteeTypeMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.ExceptionDateMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaDay;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.MaslulMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.Vaada;
import io.github.riemr.committee.infrastructure.persistence.entity.VaadaEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reads everything the scheduling engine needs for a date range into one immutable snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigurationSnapshotService {
    // meetings of the partial weeks around the range count toward weekly caps
    private static final int WEEK_PADDING_DAYS = 7;

    private final AppSettingService settings;
    private final ExceptionDateRepository exceptionDates;
    private final MasterDataRepository masterData;
    private final VaadaRepository vaadot;
    private final SchedulingProperties properties;

    @Transactional(readOnly = true)
    public ConfigurationSnapshot load(LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new InvalidSearchWindowException("invalid snapshot range " + from + ".." + to);
        }
        int pad = properties.getCalendarPaddingDays();
        List<ExceptionDate> exceptions = exceptionDates.listActiveBetween(from.minusDays(pad), to.plusDays(pad)).stream()
                .map(ConfigurationSnapshotService::toExceptionDate)
                .collect(Collectors.toList());
        WorkCalendar calendar = WorkCalendar.of(settings.getWorkDays(), exceptions);

        Map<Long, TreeSet<Integer>> allowedDays = masterData.listHativaDays().stream()
                .filter(d -> d.getDayOfWeek() != null)
                .collect(Collectors.groupingBy(HativaDay::getHativaId,
                        Collectors.mapping(d -> (int) d.getDayOfWeek(), Collectors.toCollection(TreeSet::new))));
        List<Division> divisions = masterData.listHativot().stream()
                .map(h -> toDivision(h, allowedDays.getOrDefault(h.getHativaId(), new TreeSet<>())))
                .collect(Collectors.toList());
        List<Route> routes = masterData.listMaslulim().stream()
                .map(ConfigurationSnapshotService::toRoute)
                .collect(Collectors.toList());
        List<CommitteeType> types = masterData.listCommitteeTypes().stream()
                .map(ConfigurationSnapshotService::toCommitteeType)
                .collect(Collectors.toList());

        List<Vaada> rows = vaadot.listBetween(from.minusDays(WEEK_PADDING_DAYS), to.plusDays(WEEK_PADDING_DAYS));
        List<CommitteeMeeting> meetings = rows.stream()
                .map(ConfigurationSnapshotService::toMeeting)
                .collect(Collectors.toList());
        List<Long> ids = rows.stream().map(Vaada::getVaadaId).collect(Collectors.toList());
        List<Event> events = vaadot.listEvents(ids).stream()
                .map(ConfigurationSnapshotService::toEvent)
                .collect(Collectors.toList());

        ConfigurationSnapshot snapshot = ConfigurationSnapshot.builder()
                .workCalendar(calendar)
                .capacityLimits(settings.getCapacityLimits())
                .slaDefaults(settings.getSlaDefaults())
                .recommendationWeights(settings.getRecommendationWeights())
                .divisions(divisions)
                .routes(routes)
                .committeeTypes(types)
                .meetings(meetings)
                .events(events)
                .build();
        log.info("Loaded snapshot {}..{}: {} exception dates, {} meetings, {} events",
                from, to, exceptions.size(), meetings.size(), events.size());
        return snapshot;
    }

    static ExceptionDate toExceptionDate(ExceptionDateMaster row) {
        return ExceptionDate.builder()
                .id(row.getExceptionDateId())
                .date(row.getExceptionDate())
                .description(row.getDescription())
                .kind(ExceptionDateKind.normalize(row.getDateType()))
                .build();
    }

    static Division toDivision(HativaMaster row, Set<Integer> allowedDays) {
        return Division.builder()
                .id(row.getHativaId())
                .name(row.getName())
                .color(row.getColor())
                .active(!Boolean.FALSE.equals(row.getActive()))
                .allowedWeekdays(Set.copyOf(allowedDays))
                .build();
    }

    static Route toRoute(MaslulMaster row) {
        return Route.builder()
                .id(row.getMaslulId())
                .divisionId(row.getHativaId())
                .name(row.getName())
                .active(!Boolean.FALSE.equals(row.getActive()))
                .totalSlaDays(row.getSlaDays())
                .stageADays(row.getStageADays())
                .stageBDays(row.getStageBDays())
                .stageCDays(row.getStageCDays())
                .stageDDays(row.getStageDDays())
                .build();
    }

    static CommitteeType toCommitteeType(CommitteeTypeMaster row) {
        return CommitteeType.builder()
                .id(row.getCommitteeTypeId())
                .divisionId(row.getHativaId())
                .name(row.getName())
                .scheduledWeekday(row.getScheduledDay() == null ? null : (int) row.getScheduledDay())
                .frequency(Frequency.fromCode(row.getFrequency()))
                .weekOfMonth(row.getWeekOfMonth() == null ? null : (int) row.getWeekOfMonth())
                .operational(Boolean.TRUE.equals(row.getOperational()))
                .active(!Boolean.FALSE.equals(row.getActive()))
                .build();
    }

    static CommitteeMeeting toMeeting(Vaada row) {
        MeetingStatus status = MeetingStatus.fromCode(row.getStatus());
        return CommitteeMeeting.builder()
                .id(row.getVaadaId())
                .committeeTypeId(row.getCommitteeTypeId())
                .divisionId(row.getHativaId())
                .date(row.getVaadaDate())
                .status(status == null ? MeetingStatus.PLANNED : status)
                .exceptionDateId(row.getExceptionDateId())
                .notes(row.getNotes())
                .build();
    }

    static Event toEvent(VaadaEvent row) {
        return Event.builder()
                .id(row.getEventId())
                .meetingId(row.getVaadaId())
                .routeId(row.getMaslulId())
                .name(row.getName())
                .expectedRequests(row.getExpectedRequests() == null ? 0 : row.getExpectedRequests())
                .callPublicationDate(row.getCallPublicationDate())
                .callDeadlineDate(row.getCallDeadlineDate())
                .intakeDeadlineDate(row.getIntakeDeadlineDate())
                .reviewDeadlineDate(row.getReviewDeadlineDate())
                .responseDeadlineDate(row.getResponseDeadlineDate())
                .build();
    }
}
