package com.makeithappen.backend.daily.service;

import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.repo.DailyActionRepository;
import com.makeithappen.backend.testsupport.TestDays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class RolloverServiceTest {

    private static final String USER = "u-rollover";
    private static final LocalDate TODAY = TestDays.TODAY;
    private static final LocalDate YESTERDAY = TODAY.minusDays(1);

    @Autowired DailyActionRepository actions;

    private RolloverService service;

    @BeforeEach
    void setUp() {
        service = new RolloverService(actions, TestDays.resolver());
    }

    private DailyAction row(String plan, String area, String text, LocalDate day, boolean completed) {
        DailyAction a = DailyAction.fresh(USER, plan, area, text, day);
        a.setCompleted(completed);
        return actions.save(a);
    }

    @Test
    void carries_every_incomplete_row_from_yesterday() {
        row("p1", "Fitness", "Run 2 km", YESTERDAY, false);
        row("p1", "Career", "Update CV", YESTERDAY, false);
        row("p1", "Career", "Email mentor", YESTERDAY, true);

        int inserted = service.rescheduleIncomplete(USER);

        assertThat(inserted).isEqualTo(2);
        List<DailyAction> carried = actions.findByUserIdAndDayAndRescheduledFrom(USER, TODAY, YESTERDAY);
        assertThat(carried)
                .extracting(DailyAction::getActionText)
                .containsExactlyInAnyOrder("Run 2 km", "Update CV");
        assertThat(carried).allSatisfy(a -> {
            assertThat(a.isCompleted()).isFalse();
            assertThat(a.getCompletedAt()).isNull();
            assertThat(a.getPlanId()).isEqualTo("p1");
        });
    }

    @Test
    void second_call_same_day_inserts_nothing() {
        row("p1", "Fitness", "Run 2 km", YESTERDAY, false);

        assertThat(service.rescheduleIncomplete(USER)).isEqualTo(1);
        assertThat(service.rescheduleIncomplete(USER)).isZero();
        assertThat(actions.findByUserIdAndDay(USER, TODAY)).hasSize(1);
    }

    @Test
    void identical_rows_collapse_into_one_carry() {
        row("p1", "Fitness", "Run 2 km", YESTERDAY, false);
        row("p1", "Fitness", "Run 2 km", YESTERDAY, false);
        row("p2", "Fitness", "Run 2 km", YESTERDAY, false);

        assertThat(service.rescheduleIncomplete(USER)).isEqualTo(2);
    }

    @Test
    void only_yesterday_is_considered() {
        row("p1", "Fitness", "Old thing", TODAY.minusDays(2), false);

        assertThat(service.rescheduleIncomplete(USER)).isZero();
        assertThat(actions.findByUserIdAndDay(USER, TODAY)).isEmpty();
    }

    @Test
    void other_users_are_untouched() {
        DailyAction foreign = DailyAction.fresh("someone-else", "p9", "Fitness", "Swim", YESTERDAY);
        actions.save(foreign);

        assertThat(service.rescheduleIncomplete(USER)).isZero();
        assertThat(actions.findByUserIdAndDay("someone-else", TODAY)).isEmpty();
    }
}
