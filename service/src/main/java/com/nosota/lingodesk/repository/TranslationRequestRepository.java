package com.nosota.lingodesk.repository;

import com.nosota.lingodesk.api.model.OrderStatus;
import com.nosota.lingodesk.model.TranslationRequest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TranslationRequestRepository extends JpaRepository<TranslationRequest, Long> {

    /**
     * Orders submitted by one user, newest first.
     */
    List<TranslationRequest> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    /**
     * Every order of an account, newest first. Administrators see this list.
     */
    List<TranslationRequest> findByAccountIdOrderByCreatedAtDescIdDesc(Long accountId);

    /**
     * One user's orders, newest first, with optional status and creation-time filters.
     * A null filter argument matches every order.
     *
     * @param userId   owner of the orders
     * @param status   exact status, or null
     * @param dateFrom inclusive lower bound on createdAt, or null
     * @param dateTo   inclusive upper bound on createdAt, or null
     * @param pageable window of results; the total is counted over all matches
     */
    @Query(value = "SELECT t FROM TranslationRequest t WHERE t.userId = :userId " +
            "AND (:status IS NULL OR t.status = :status) " +
            "AND (:dateFrom IS NULL OR t.createdAt >= :dateFrom) " +
            "AND (:dateTo IS NULL OR t.createdAt <= :dateTo) " +
            "ORDER BY t.createdAt DESC, t.id DESC",
            countQuery = "SELECT COUNT(t) FROM TranslationRequest t WHERE t.userId = :userId " +
                    "AND (:status IS NULL OR t.status = :status) " +
                    "AND (:dateFrom IS NULL OR t.createdAt >= :dateFrom) " +
                    "AND (:dateTo IS NULL OR t.createdAt <= :dateTo)")
    Page<TranslationRequest> search(@Param("userId") Long userId,
                                    @Param("status") OrderStatus status,
                                    @Param("dateFrom") LocalDateTime dateFrom,
                                    @Param("dateTo") LocalDateTime dateTo,
                                    Pageable pageable);

    boolean existsByUserId(Long userId);
}
