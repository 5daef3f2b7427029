package com.pantrysync.backend.recipe.repo;

import com.pantrysync.backend.recipe.entity.Recipe;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecipeRepository extends JpaRepository<Recipe, Long> {
}
