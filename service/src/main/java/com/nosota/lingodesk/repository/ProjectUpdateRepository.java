package com.nosota.lingodesk.repository;

import com.nosota.lingodesk.model.ProjectUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectUpdateRepository extends JpaRepository<ProjectUpdate, Long> {
    List<ProjectUpdate> findByRequestIdOrderByCreatedAtAscIdAsc(Long requestId);

    boolean existsByUserId(Long userId);
}
