package com.diseaseforecast.repository;

import com.diseaseforecast.entity.ModelArtifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ModelArtifactRepository extends JpaRepository<ModelArtifact, Long> {

    Optional<ModelArtifact> findByCodeAndVersion(String code, String version);

    List<ModelArtifact> findByCodeOrderByCreatedAtDesc(String code);
}
