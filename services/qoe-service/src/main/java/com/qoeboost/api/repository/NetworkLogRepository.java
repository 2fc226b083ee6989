package com.qoeboost.api.repository;

import com.qoeboost.api.entity.NetworkLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NetworkLogRepository extends JpaRepository<NetworkLog, Long> {

    List<NetworkLog> findByUserId(Long userId, Pageable pageable);

    List<NetworkLog> findAllBy(Pageable pageable);

    // Exact match, feeds the recommendation aggregator
    List<NetworkLog> findByLocation(String location, Sort sort);
}
