package com.makeithappen.backend.daily.repo;

import com.makeithappen.backend.daily.entity.DailyAction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface DailyActionRepository extends JpaRepository<DailyAction, String> {

    // ===== rollover =====

    boolean existsByUserIdAndDayAndRescheduledFrom(String userId, LocalDate day, LocalDate rescheduledFrom);

    List<DailyAction> findByUserIdAndDayAndCompletedFalse(String userId, LocalDate day);

    List<DailyAction> findByUserIdAndDayAndRescheduledFrom(String userId, LocalDate day, LocalDate rescheduledFrom);

    // ===== fresh actions =====

    @Query("""
            select distinct a.planId from DailyAction a
            where a.userId = :userId
              and a.day = :day
              and a.rescheduledFrom is null
              and a.planId in :planIds
            """)
    List<String> findPlanIdsWithFreshAction(@Param("userId") String userId,
                                            @Param("day") LocalDate day,
                                            @Param("planIds") Collection<String> planIds);

    List<DailyAction> findByUserIdAndDayAndPlanIdIn(String userId, LocalDate day, Collection<String> planIds);

    /** First recorded day per plan; plans without history are absent from the result. */
    @Query("""
            select a.planId as planId, min(a.day) as firstDay from DailyAction a
            where a.userId = :userId
              and a.planId in :planIds
            group by a.planId
            """)
    List<PlanFirstDay> findFirstDayByPlan(@Param("userId") String userId,
                                          @Param("planIds") Collection<String> planIds);

    interface PlanFirstDay {
        String getPlanId();
        LocalDate getFirstDay();
    }

    // ===== reads =====

    List<DailyAction> findByUserIdAndDay(String userId, LocalDate day);

    List<DailyAction> findByUserIdAndDayBetween(String userId, LocalDate from, LocalDate to);

    List<DailyAction> findByUserIdAndDayGreaterThanEqualOrderByDayAsc(String userId, LocalDate from);

    @Query("select a.day from DailyAction a where a.userId = :userId and a.completed = true order by a.day desc")
    List<LocalDate> findCompletedDays(@Param("userId") String userId, Pageable page);

    // ===== writes =====

    /** @return affected rows; 0 means the id does not exist or belongs to someone else */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DailyAction a
               set a.completed = :completed, a.completedAt = :completedAt
             where a.id = :id and a.userId = :userId
            """)
    int updateCompletion(@Param("id") String id,
                         @Param("userId") String userId,
                         @Param("completed") boolean completed,
                         @Param("completedAt") Instant completedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from DailyAction a where a.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);
}
