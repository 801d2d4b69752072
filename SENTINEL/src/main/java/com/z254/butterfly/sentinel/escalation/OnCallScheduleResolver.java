package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.DailyTimeRange;
import com.z254.butterfly.sentinel.domain.model.EscalationContact;
import com.z254.butterfly.sentinel.domain.model.EscalationRole;
import com.z254.butterfly.sentinel.domain.model.OnCallRule;
import com.z254.butterfly.sentinel.domain.model.OnCallSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a role to the contacts on call at a given instant.
 * <p>
 * Rules are evaluated in the schedule's timezone. A rule whose end is before its start covers
 * the night, and the hours after midnight belong to the previous day's shift. When no rule
 * covers the instant, every active contact of the role is returned so an escalation step is
 * never silently dropped.
 */
@Slf4j
@Component
public class OnCallScheduleResolver {

    public List<EscalationContact> resolve(EscalationRole role, Instant at) {
        List<EscalationContact> active = role.getContacts().stream()
                .filter(EscalationContact::isActive)
                .toList();
        OnCallSchedule schedule = role.getSchedule();
        if (schedule == null || schedule.getRules().isEmpty()) {
            return active;
        }

        ZonedDateTime local = at.atZone(schedule.getTimezone());
        Set<String> onCallIds = new LinkedHashSet<>();
        boolean anyRuleMatched = false;
        for (OnCallRule rule : schedule.getRules()) {
            if (covers(rule, local.getDayOfWeek(), local.toLocalTime())) {
                anyRuleMatched = true;
                if (rule.getContactIds().isEmpty()) {
                    return active;
                }
                onCallIds.addAll(rule.getContactIds());
            }
        }
        if (!anyRuleMatched) {
            log.debug("No on-call rule of role {} covers {}, notifying all active contacts", role.getId(), local);
            return active;
        }
        return active.stream()
                .filter(contact -> onCallIds.contains(contact.getId()))
                .toList();
    }

    static boolean covers(OnCallRule rule, DayOfWeek day, LocalTime time) {
        DailyTimeRange range = new DailyTimeRange(rule.getStart(), rule.getEnd());
        if (!range.contains(time)) {
            return false;
        }
        boolean overnight = rule.getEnd().isBefore(rule.getStart());
        if (overnight && time.isBefore(rule.getEnd())) {
            return rule.getDays().contains(day.minus(1));
        }
        return rule.getDays().contains(day);
    }
}
