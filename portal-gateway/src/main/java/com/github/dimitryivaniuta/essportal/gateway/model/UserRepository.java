package com.github.dimitryivaniuta.essportal.gateway.model;

import java.time.OffsetDateTime;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive repository for {@link UserEntity} using Spring Data R2DBC.
 *
 * <p>Reset token handling is done with targeted updates so that consuming a token
 * is a single conditional statement.</p>
 */
@Repository
public interface UserRepository extends ReactiveCrudRepository<UserEntity, Long> {

    /** Finds a user by email, case-insensitive. */
    Mono<UserEntity> findByEmailIgnoreCase(String email);

    /** Checks existence by email (CI). */
    Mono<Boolean> existsByEmailIgnoreCase(String email);

    Flux<UserEntity> findAllByOrderByIdAsc();

    /**
     * Stores a fresh reset token, replacing any previous one.
     *
     * @return rows updated (0 or 1)
     */
    @Modifying
    @Query("""
      UPDATE users
         SET password_reset_token = :token,
             password_reset_expires_at = :expiresAt,
             updated_at = now()
       WHERE id = :id
      """)
    Mono<Integer> storePasswordResetToken(@Param("id") Long id,
                                          @Param("token") String token,
                                          @Param("expiresAt") OffsetDateTime expiresAt);

    /** Active user holding an unexpired reset token. */
    @Query("""
      SELECT * FROM users
       WHERE password_reset_token = :token
         AND password_reset_expires_at > :now
         AND active = TRUE
      """)
    Mono<UserEntity> findByValidPasswordResetToken(@Param("token") String token,
                                                   @Param("now") OffsetDateTime now);

    /**
     * Sets the new hash and clears the token in one statement, only if the token is
     * still the current one and unexpired. A second consumer gets 0.
     *
     * @return rows updated (0 or 1)
     */
    @Modifying
    @Query("""
      UPDATE users
         SET password_hash = :hash,
             password_reset_token = NULL,
             password_reset_expires_at = NULL,
             updated_at = now()
       WHERE id = :id
         AND password_reset_token = :token
         AND password_reset_expires_at > :now
      """)
    Mono<Integer> consumePasswordResetToken(@Param("id") Long id,
                                            @Param("token") String token,
                                            @Param("hash") String hash,
                                            @Param("now") OffsetDateTime now);
}
