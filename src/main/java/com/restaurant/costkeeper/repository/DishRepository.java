package com.restaurant.costkeeper.repository;

import com.restaurant.costkeeper.model.Dish;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface DishRepository extends JpaRepository<Dish, Long> {
    Optional<Dish> findByIdAndTenantId(Long id, Long tenantId);

    List<Dish> findByTenantIdOrderByNameAsc(Long tenantId);

    List<Dish> findByTenantIdAndActiveTrueOrderByNameAsc(Long tenantId);
}
