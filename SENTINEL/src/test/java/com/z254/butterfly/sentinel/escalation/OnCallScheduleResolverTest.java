package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.ContactType;
import com.z254.butterfly.sentinel.domain.model.EscalationContact;
import com.z254.butterfly.sentinel.domain.model.EscalationRole;
import com.z254.butterfly.sentinel.domain.model.OnCallRule;
import com.z254.butterfly.sentinel.domain.model.OnCallSchedule;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static com.z254.butterfly.sentinel.support.TestAlerts.T0;
import static org.assertj.core.api.Assertions.assertThat;

class OnCallScheduleResolverTest {

    private final OnCallScheduleResolver resolver = new OnCallScheduleResolver();

    private static EscalationContact contact(String id, boolean active) {
        return EscalationContact.builder().id(id).name(id).type(ContactType.SLACK).address("@" + id).active(active).build();
    }

    private static EscalationRole role(OnCallSchedule schedule) {
        return EscalationRole.builder()
                .id("sre")
                .contacts(List.of(contact("day", true), contact("night", true), contact("away", false)))
                .schedule(schedule)
                .build();
    }

    private static OnCallSchedule shifts() {
        return OnCallSchedule.builder()
                .rules(List.of(
                        OnCallRule.builder()
                                .days(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY))
                                .start(LocalTime.of(8, 0))
                                .end(LocalTime.of(20, 0))
                                .contactIds(List.of("day"))
                                .build(),
                        OnCallRule.builder()
                                .days(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY))
                                .start(LocalTime.of(20, 0))
                                .end(LocalTime.of(8, 0))
                                .contactIds(List.of("night", "away"))
                                .build()))
                .build();
    }

    @Test
    void withoutScheduleAllActiveContactsAreOnCall() {
        assertThat(resolver.resolve(role(null), T0))
                .extracting(EscalationContact::getId)
                .containsExactly("day", "night");
    }

    @Test
    void daytimeRuleSelectsItsContacts() {
        assertThat(resolver.resolve(role(shifts()), T0))
                .extracting(EscalationContact::getId)
                .containsExactly("day");
    }

    @Test
    void inactiveContactsAreNeverReturned() {
        // Monday 22:00
        assertThat(resolver.resolve(role(shifts()), T0.plus(Duration.ofHours(12))))
                .extracting(EscalationContact::getId)
                .containsExactly("night");
    }

    @Test
    void earlyHoursBelongToPreviousDaysNightShift() {
        // Saturday 03:00 is still Friday's night shift
        assertThat(resolver.resolve(role(shifts()), T0.plus(Duration.ofDays(4)).plus(Duration.ofHours(17))))
                .extracting(EscalationContact::getId)
                .containsExactly("night");
    }

    @Test
    void uncoveredInstantFallsBackToAllActiveContacts() {
        // Monday 03:00 follows Sunday, which has no night shift
        assertThat(resolver.resolve(role(shifts()), T0.minus(Duration.ofHours(7))))
                .extracting(EscalationContact::getId)
                .containsExactly("day", "night");
    }

    @Test
    void ruleWithoutContactIdsMeansEveryone() {
        OnCallSchedule schedule = OnCallSchedule.builder()
                .rules(List.of(OnCallRule.builder().build()))
                .build();

        assertThat(resolver.resolve(role(schedule), T0))
                .extracting(EscalationContact::getId)
                .containsExactly("day", "night");
    }

    @Test
    void rulesAreEvaluatedInScheduleTimezone() {
        OnCallSchedule tokyo = shifts();
        tokyo.setTimezone(ZoneId.of("Asia/Tokyo"));

        // 10:00 UTC is 19:00 in Tokyo, 12:00 UTC is 21:00
        assertThat(resolver.resolve(role(tokyo), T0)).extracting(EscalationContact::getId).containsExactly("day");
        assertThat(resolver.resolve(role(tokyo), T0.plus(Duration.ofHours(2))))
                .extracting(EscalationContact::getId)
                .containsExactly("night");
    }

    @Test
    void overnightCoverageChecksStartDay() {
        OnCallRule fridayNight = OnCallRule.builder()
                .days(EnumSet.of(DayOfWeek.FRIDAY))
                .start(LocalTime.of(22, 0))
                .end(LocalTime.of(6, 0))
                .build();

        assertThat(OnCallScheduleResolver.covers(fridayNight, DayOfWeek.FRIDAY, LocalTime.of(23, 0))).isTrue();
        assertThat(OnCallScheduleResolver.covers(fridayNight, DayOfWeek.SATURDAY, LocalTime.of(5, 59))).isTrue();
        assertThat(OnCallScheduleResolver.covers(fridayNight, DayOfWeek.FRIDAY, LocalTime.of(5, 0))).isFalse();
        assertThat(OnCallScheduleResolver.covers(fridayNight, DayOfWeek.SATURDAY, LocalTime.of(6, 0))).isFalse();
    }
}
