package com.example.autoschedule.task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface TaskRepository extends JpaRepository<Task, Long> {

    @Query("select t from Task t where t.userId = :userId and t.autoScheduled = true " +
            "and t.scheduleLocked = :locked and t.status not in :excluded order by t.id")
    List<Task> findAutoScheduled(@Param("userId") String userId,
                                 @Param("locked") boolean locked,
                                 @Param("excluded") Collection<TaskStatus> excluded);

    default List<Task> findSchedulingCandidates(String userId) {
        return findAutoScheduled(userId, false, TaskStatus.NOT_SCHEDULABLE);
    }

    default List<Task> findLockedTasks(String userId) {
        return findAutoScheduled(userId, true, TaskStatus.NOT_SCHEDULABLE);
    }

    List<Task> findByUserIdAndIdIn(String userId, Collection<Long> ids);

    List<Task> findByUserIdAndScheduledStartGreaterThanEqualAndScheduledStartLessThanOrderByScheduledStartAsc(
            String userId, LocalDateTime from, LocalDateTime to);

    List<Task> findByUserIdAndScheduledStartGreaterThanEqual(String userId, LocalDateTime from);
}
