package com.restaurant.costkeeper.repository;

import com.restaurant.costkeeper.model.Recipe;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface RecipeRepository extends JpaRepository<Recipe, Long> {
    Optional<Recipe> findByIdAndTenantId(Long id, Long tenantId);

    List<Recipe> findByTenantIdOrderByNameAsc(Long tenantId);
}
