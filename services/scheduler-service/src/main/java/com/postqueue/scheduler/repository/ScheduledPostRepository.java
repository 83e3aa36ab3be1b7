package com.postqueue.scheduler.repository;

import com.postqueue.scheduler.entity.PostStatus;
import com.postqueue.scheduler.entity.ScheduledPost;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ScheduledPostRepository extends JpaRepository<ScheduledPost, UUID> {

    @Query("SELECT p FROM ScheduledPost p WHERE p.status = :status AND p.scheduledTime <= :now ORDER BY p.scheduledTime ASC")
    List<ScheduledPost> findDue(@Param("status") PostStatus status, @Param("now") OffsetDateTime now);

    List<ScheduledPost> findByStatusOrderByScheduledTimeDesc(PostStatus status);

    List<ScheduledPost> findByStatusOrderByScheduledTimeAsc(PostStatus status);

    boolean existsByRequeuedFrom(UUID requeuedFrom);

    long countByStatus(PostStatus status);

    /**
     * Tail of an account chain, derived on every call
     */
    @Query("SELECT MAX(p.scheduledTime) FROM ScheduledPost p WHERE p.accountRef = :accountRef AND p.status IN :statuses")
    OffsetDateTime findChainTail(@Param("accountRef") String accountRef,
                                 @Param("statuses") Collection<PostStatus> statuses);

    boolean existsByAccountRefAndScheduledTimeAndStatusIn(String accountRef, OffsetDateTime scheduledTime,
                                                          Collection<PostStatus> statuses);

    boolean existsByAccountRefAndScheduledTimeAndStatusInAndIdNot(String accountRef, OffsetDateTime scheduledTime,
                                                                  Collection<PostStatus> statuses, UUID id);

    // ==================== Conditional transitions ====================
    // Each returns the number of rows changed: 0 means the post was not in the expected status.

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledPost p SET p.status = :to, p.updatedAt = :now WHERE p.id = :id AND p.status = :from")
    int transition(@Param("id") UUID id,
                   @Param("from") PostStatus from,
                   @Param("to") PostStatus to,
                   @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledPost p SET p.status = :to, p.postedAt = :postedAt, p.platformPostId = :platformPostId, " +
            "p.shareUrl = :shareUrl, p.updatedAt = :postedAt WHERE p.id = :id AND p.status = :from")
    int markPosted(@Param("id") UUID id,
                   @Param("from") PostStatus from,
                   @Param("to") PostStatus to,
                   @Param("postedAt") OffsetDateTime postedAt,
                   @Param("platformPostId") String platformPostId,
                   @Param("shareUrl") String shareUrl);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledPost p SET p.status = :to, p.errorDetail = :errorDetail, p.updatedAt = :now " +
            "WHERE p.id = :id AND p.status = :from")
    int markFailed(@Param("id") UUID id,
                   @Param("from") PostStatus from,
                   @Param("to") PostStatus to,
                   @Param("errorDetail") String errorDetail,
                   @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledPost p SET p.scheduledTime = :time, p.updatedAt = :now WHERE p.id = :id AND p.status = :status")
    int reschedule(@Param("id") UUID id,
                   @Param("status") PostStatus status,
                   @Param("time") OffsetDateTime time,
                   @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ScheduledPost p WHERE p.id = :id AND p.status = :status")
    int deleteInStatus(@Param("id") UUID id, @Param("status") PostStatus status);
}
