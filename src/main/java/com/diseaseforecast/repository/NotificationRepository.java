package com.diseaseforecast.repository;

import com.diseaseforecast.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    boolean existsByCodeAndYearweek(String code, String yearweek);

    List<Notification> findByCodeOrderByCreatedAtDesc(String code);

    List<Notification> findAllByOrderByCreatedAtDesc();
}
