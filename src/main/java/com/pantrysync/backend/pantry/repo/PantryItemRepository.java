package com.pantrysync.backend.pantry.repo;

import com.pantrysync.backend.pantry.entity.PantryItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PantryItemRepository extends JpaRepository<PantryItem, Long> {

    // 扣量前鎖住：兩個 entry 共用同一個 pantry 項目時不會互相蓋掉
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PantryItem p where p.id = :id")
    Optional<PantryItem> findByIdForUpdate(@Param("id") Long id);
}
