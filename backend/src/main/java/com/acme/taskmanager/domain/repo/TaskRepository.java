package com.acme.taskmanager.domain.repo;

import com.acme.taskmanager.domain.entity.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface TaskRepository extends JpaRepository<Task, Long>, JpaSpecificationExecutor<Task> {
    long countByCompletedTrue();
    long countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant from, Instant to);

    @Query("select t.id from Task t where t.createdAt < :cutoff")
    List<Long> findIdsCreatedBefore(@Param("cutoff") Instant cutoff);

    @Query("select t.priority as priority, count(t) as total from Task t group by t.priority")
    List<PriorityCount> countGroupedByPriority();

    interface PriorityCount {
        Integer getPriority();
        Long getTotal();
    }
}
