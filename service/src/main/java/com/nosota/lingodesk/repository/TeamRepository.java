package com.nosota.lingodesk.repository;

import com.nosota.lingodesk.model.Team;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TeamRepository extends JpaRepository<Team, Long> {
    /**
     * Same as {@link AccountRepository#getOneForUpdate(Long)} for team balances.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Team t WHERE t.id = :id")
    Optional<Team> getOneForUpdate(@Param("id") Long id);

    List<Team> findAllByOrderByCreatedAtDescIdDesc();
}
