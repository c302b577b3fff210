package com.websubrelay.repository;

import com.websubrelay.model.Subscription;
import com.websubrelay.model.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, String> {

    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO subscriptions (source_id, topic, status, renewal_attempts, created_at, updated_at)
            VALUES (:sourceId, :topic, 'pending', 0, :now, :now)
            ON CONFLICT (source_id) DO NOTHING
            """, nativeQuery = true)
    int insertPendingIfAbsent(@Param("sourceId") String sourceId,
                              @Param("topic") String topic,
                              @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO subscriptions
              (source_id, topic, status, expires_at, last_renewed_at, renewal_attempts, error_message, created_at, updated_at)
            VALUES
              (:sourceId, :topic, 'active', :expiresAt, :now, 0, NULL, :now, :now)
            ON CONFLICT (source_id) DO UPDATE SET
              topic = EXCLUDED.topic,
              status = 'active',
              expires_at = EXCLUDED.expires_at,
              last_renewed_at = EXCLUDED.last_renewed_at,
              renewal_attempts = 0,
              error_message = NULL,
              updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertActive(@Param("sourceId") String sourceId,
                     @Param("topic") String topic,
                     @Param("expiresAt") Instant expiresAt,
                     @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO subscriptions
              (source_id, topic, status, renewal_attempts, error_message, created_at, updated_at)
            VALUES
              (:sourceId, :topic, 'failed', 1, :errorMessage, :now, :now)
            ON CONFLICT (source_id) DO UPDATE SET
              status = 'failed',
              error_message = EXCLUDED.error_message,
              renewal_attempts = subscriptions.renewal_attempts + 1,
              updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertFailed(@Param("sourceId") String sourceId,
                     @Param("topic") String topic,
                     @Param("errorMessage") String errorMessage,
                     @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Subscription s set s.status = :newStatus, s.updatedAt = :now " +
            "where s.sourceId = :sourceId and s.status = :expectedStatus")
    int updateStatusIfMatches(@Param("sourceId") String sourceId,
                              @Param("expectedStatus") SubscriptionStatus expectedStatus,
                              @Param("newStatus") SubscriptionStatus newStatus,
                              @Param("now") Instant now);
}
