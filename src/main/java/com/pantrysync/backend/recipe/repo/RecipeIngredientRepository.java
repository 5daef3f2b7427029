package com.pantrysync.backend.recipe.repo;

import com.pantrysync.backend.recipe.entity.RecipeIngredient;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RecipeIngredientRepository extends JpaRepository<RecipeIngredient, Long> {

    List<RecipeIngredient> findByRecipeIdOrderByIdAsc(Long recipeId);
}
