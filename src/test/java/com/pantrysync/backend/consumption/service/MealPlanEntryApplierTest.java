package com.pantrysync.backend.consumption.service;

import com.pantrysync.backend.consumption.config.ConsumptionProperties;
import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.model.UnitPolicy;
import com.pantrysync.backend.menu.entity.MealPlanEntry;
import com.pantrysync.backend.menu.repo.MealPlanEntryRepository;
import com.pantrysync.backend.pantry.entity.PantryItem;
import com.pantrysync.backend.pantry.repo.PantryItemRepository;
import com.pantrysync.backend.recipe.entity.RecipeIngredient;
import com.pantrysync.backend.recipe.repo.RecipeIngredientRepository;
import com.pantrysync.backend.shopping.dto.ShoppingCandidate;
import com.pantrysync.backend.shopping.service.ShoppingListMerger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MealPlanEntryApplierTest {

    private ConsumptionProperties props;
    private MealPlanEntryApplier applier;
    private MealPlanEntryRepository menuRepo;
    private RecipeIngredientRepository ingredientRepo;
    private PantryItemRepository pantryRepo;

    @BeforeEach
    void setUp() {
        props = new ConsumptionProperties();
        menuRepo = Mockito.mock(MealPlanEntryRepository.class);
        ingredientRepo = Mockito.mock(RecipeIngredientRepository.class);
        pantryRepo = Mockito.mock(PantryItemRepository.class);
        applier = new MealPlanEntryApplier(
                menuRepo,
                ingredientRepo,
                pantryRepo,
                Mockito.mock(ShoppingListMerger.class),
                props,
                Clock.systemUTC());
    }

    @Test
    void strict_policy_skips_unknown_units_with_different_text() {
        assertTrue(applier.resolveRequired(2, "pcs", "g").isEmpty());
        assertTrue(applier.resolveRequired(100, "g", "cup").isEmpty());
        assertEquals(2.0, applier.resolveRequired(2, "pcs", "pcs").getAsDouble());
        assertEquals(1500.0, applier.resolveRequired(1.5, "kg", "g").getAsDouble(), 1e-9);
    }

    @Test
    void permissive_policy_passes_unknown_through_but_not_cross_family() {
        props.setUnitPolicy(UnitPolicy.PERMISSIVE);

        assertEquals(2.0, applier.resolveRequired(2, "pcs", "g").getAsDouble());
        assertEquals(3.0, applier.resolveRequired(3, "g", null).getAsDouble());
        assertTrue(applier.resolveRequired(100, "g", "cup").isEmpty());
    }

    @Test
    void missing_entry_returns_zero() {
        when(menuRepo.findByIdForUpdate(42L)).thenReturn(Optional.empty());

        assertEquals(0, applier.apply(42L).processedEntries());
        verify(menuRepo, never()).save(any());
    }

    @Test
    void pantry_item_is_loaded_with_row_lock() {
        MealPlanEntry entry = new MealPlanEntry();
        entry.setId(1L);
        entry.setRecipeId(2L);
        entry.setPlanDate(LocalDate.of(2026, 3, 10));

        RecipeIngredient ing = new RecipeIngredient();
        ing.setId(3L);
        ing.setRecipeId(2L);
        ing.setQuantity(100.0);
        ing.setUnit("g");
        ing.setLinkedPantryId(4L);

        PantryItem rice = new PantryItem();
        rice.setId(4L);
        rice.setName("Rice");
        rice.setUnit("g");
        rice.setAmount(500.0);

        when(menuRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(entry));
        when(ingredientRepo.findByRecipeIdOrderByIdAsc(2L)).thenReturn(List.of(ing));
        when(pantryRepo.findByIdForUpdate(4L)).thenReturn(Optional.of(rice));

        SyncReport report = applier.apply(1L);

        assertEquals(new SyncReport(1, 1, 0, 0), report);
        assertEquals(400.0, rice.getAmount());
        assertTrue(entry.isUsageApplied());
        verify(pantryRepo).findByIdForUpdate(4L);
        verify(pantryRepo, never()).findById(any());
    }

    @Test
    void restock_candidate_defaults_and_notes() {
        PantryItem p = new PantryItem();
        p.setId(5L);
        p.setName(" ");
        p.setBrand("Acme");
        p.setStore("Costco");

        ShoppingCandidate c = MealPlanEntryApplier.restockCandidate(p, 0.5, 2.0);

        assertEquals("Item", c.name());
        assertEquals(1.0, c.quantity());
        assertEquals("Acme", c.brand());
        assertEquals("Costco", c.store());
        assertEquals("pending", c.status());
        assertEquals(5L, c.linkedPantryId());
        assertEquals("Auto-added: remaining 0.5 ≤ threshold 2", c.notes());
    }
}
