package com.qoeboost.api.repository;

import com.qoeboost.api.entity.Feedback;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FeedbackRepository extends JpaRepository<Feedback, Long> {

    List<Feedback> findByUserId(Long userId, Pageable pageable);

    List<Feedback> findAllBy(Pageable pageable);
}
