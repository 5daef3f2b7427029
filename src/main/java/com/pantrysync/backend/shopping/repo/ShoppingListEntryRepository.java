package com.pantrysync.backend.shopping.repo;

import com.pantrysync.backend.shopping.entity.ShoppingListEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ShoppingListEntryRepository extends JpaRepository<ShoppingListEntry, Long> {

    // open = pending / 空字串 / null；已購買、已關閉的不會被撈回來合併
    @Query("""
        select s from ShoppingListEntry s
        where s.linkedPantryId = :pantryId
          and (s.status is null or trim(s.status) = '' or lower(trim(s.status)) = 'pending')
        order by s.id asc
    """)
    List<ShoppingListEntry> findOpenByLinkedPantryId(@Param("pantryId") Long pantryId);

    @Query("""
        select s from ShoppingListEntry s
        where s.name = :name
          and coalesce(s.unit, '') = :unit
          and (s.status is null or trim(s.status) = '' or lower(trim(s.status)) = 'pending')
        order by s.id asc
    """)
    List<ShoppingListEntry> findOpenByNameAndUnit(@Param("name") String name, @Param("unit") String unit);

    // schema 沒有 status 欄位時：每一筆都視為 open
    @Query("""
        select s from ShoppingListEntry s
        where s.linkedPantryId = :pantryId
        order by s.id asc
    """)
    List<ShoppingListEntry> findAnyByLinkedPantryId(@Param("pantryId") Long pantryId);

    @Query("""
        select s from ShoppingListEntry s
        where s.name = :name and coalesce(s.unit, '') = :unit
        order by s.id asc
    """)
    List<ShoppingListEntry> findAnyByNameAndUnit(@Param("name") String name, @Param("unit") String unit);
}
