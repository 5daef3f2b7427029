package com.pantrysync.backend.menu.repo;

import com.pantrysync.backend.menu.entity.MealPlanEntry;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface MealPlanEntryRepository extends JpaRepository<MealPlanEntry, Long> {

    // 早的先處理；同一天用 id 決定順序
    @Query("""
        select e from MealPlanEntry e
        where e.planDate <= :asOf and e.usageApplied = false
        order by e.planDate asc, e.id asc
    """)
    List<MealPlanEntry> findPendingUpTo(@Param("asOf") LocalDate asOf);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from MealPlanEntry e where e.id = :id")
    Optional<MealPlanEntry> findByIdForUpdate(@Param("id") Long id);
}
