package com.nosota.lingodesk.repository;

import com.nosota.lingodesk.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByUsernameIgnoreCase(String username);

    Optional<User> findByEmailVerificationToken(String token);

    Optional<User> findByPasswordResetToken(String token);

    List<User> findByAccountIdOrderByCreatedAtDescIdDesc(Long accountId);

    List<User> findByTeamIdOrderByCreatedAtDescIdDesc(Long teamId);

    long countByAccountId(Long accountId);

    long countByTeamId(Long teamId);
}
