package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.ItemCostHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ItemCostHistoryRepository extends JpaRepository<ItemCostHistory, Long> {

    List<ItemCostHistory> findByItemIdOrderByEffectiveDateDesc(Long itemId);
}
