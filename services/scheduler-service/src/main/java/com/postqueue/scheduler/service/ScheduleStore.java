package com.postqueue.scheduler.service;

import com.postqueue.connector.model.Platform;
import com.postqueue.scheduler.dto.CreateScheduledPostRequest;
import com.postqueue.scheduler.dto.RequeueAllResponse;
import com.postqueue.scheduler.dto.RequeueRequest;
import com.postqueue.scheduler.dto.ScheduledPostResponse;
import com.postqueue.scheduler.dto.SchedulerStatsResponse;
import com.postqueue.scheduler.entity.PostStatus;
import com.postqueue.scheduler.entity.ScheduledPost;
import com.postqueue.scheduler.exception.InvalidStateException;
import com.postqueue.scheduler.exception.PostNotFoundException;
import com.postqueue.scheduler.exception.ValidationException;
import com.postqueue.scheduler.repository.ScheduledPostRepository;
import com.postqueue.scheduler.staging.BlobStaging;
import com.postqueue.scheduler.staging.BlobStagingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable schedule records and their status transitions.
 * <p>
 * Every transition is a conditional update on the current status, so two publisher runs can never
 * both own a post: {@link #claim(UUID)} succeeds for exactly one caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleStore {

    static final int MAX_ERROR_DETAIL_LENGTH = 500;
    static final int ACCOUNT_LOCK_STRIPES = 64;

    private final ScheduledPostRepository postRepository;
    private final SlotCalculator slotCalculator;
    private final BlobStaging blobStaging;
    private final Clock clock;

    // accounts hashing to the same stripe share a lock
    private final Object[] accountLocks = newLockStripes(ACCOUNT_LOCK_STRIPES);

    // ==================== Creation ====================

    /**
     * Persist a new PENDING post.
     *
     * @throws ValidationException if the post breaks a record invariant
     */
    public UUID insert(ScheduledPost post) {
        if (post.getStatus() != null && post.getStatus() != PostStatus.PENDING) {
            throw new ValidationException("New posts must be PENDING, got " + post.getStatus());
        }
        validate(post);
        if (postRepository.existsByAccountRefAndScheduledTimeAndStatusIn(
                post.getAccountRef(), post.getScheduledTime(), PostStatus.LIVE)) {
            throw new ValidationException(String.format("Account %s already has a post scheduled at %s",
                    post.getAccountRef(), post.getScheduledTime()));
        }

        post.setStatus(PostStatus.PENDING);
        ScheduledPost saved = postRepository.save(post);
        log.info("Scheduled {} post {} for account {} at {}",
                saved.getPlatform(), saved.getId(), saved.getAccountRef(), saved.getScheduledTime());
        return saved.getId();
    }

    /**
     * Producer entry point: takes the next slot of the account chain unless a time is given.
     * Slot assignment for one account is serialized so two producers never take the same slot.
     */
    public ScheduledPost schedule(CreateScheduledPostRequest request) {
        if (request.getPlatform() == null) {
            throw new ValidationException("Platform is required");
        }
        String accountRef = requireAccount(request.getAccountRef());

        ScheduledPost post = ScheduledPost.builder()
                .platform(request.getPlatform())
                .accountRef(accountRef)
                .mediaRef(request.getMediaRef())
                .caption(request.getCaption() != null ? request.getCaption() : "")
                .replyToPostId(request.getReplyToPostId())
                .build();

        return assignSlotAndInsert(post, request.getScheduledTime());
    }

    /**
     * Re-create a FAILED post as a new PENDING one at the next slot of its account chain.
     * The failed record itself is never transitioned.
     */
    public ScheduledPost requeue(UUID id, RequeueRequest request) {
        ScheduledPost failed = findById(id);
        if (failed.getStatus() != PostStatus.FAILED) {
            throw new InvalidStateException(id, "requeue", failed.getStatus(), PostStatus.FAILED);
        }

        ScheduledPost post = ScheduledPost.builder()
                .platform(failed.getPlatform())
                .accountRef(failed.getAccountRef())
                .mediaRef(request != null ? request.getMediaRef() : null)
                .caption(failed.getCaption())
                .replyToPostId(failed.getReplyToPostId())
                .requeuedFrom(failed.getId())
                .build();

        ScheduledPost created = assignSlotAndInsert(post, request != null ? request.getScheduledTime() : null);
        log.info("Requeued failed post {} as {}", id, created.getId());
        return created;
    }

    /**
     * Requeue every FAILED post not requeued before, oldest scheduled first, each at the next slot
     * of its account chain. Posts of media platforms are only reported: their staged blob is gone
     * and each needs {@link #requeue(UUID, RequeueRequest)} with a new media reference.
     */
    public RequeueAllResponse requeueAllFailed() {
        List<ScheduledPostResponse> requeued = new ArrayList<>();
        List<UUID> needsMedia = new ArrayList<>();

        for (ScheduledPost failed : postRepository.findByStatusOrderByScheduledTimeAsc(PostStatus.FAILED)) {
            if (postRepository.existsByRequeuedFrom(failed.getId())) {
                continue;
            }
            if (failed.getPlatform().isRequiresMedia()) {
                needsMedia.add(failed.getId());
                continue;
            }
            requeued.add(ScheduledPostResponse.from(requeue(failed.getId(), null)));
        }

        log.info("Requeued {} failed posts, {} need new media", requeued.size(), needsMedia.size());
        return RequeueAllResponse.builder()
                .requeued(requeued)
                .needsMedia(needsMedia)
                .build();
    }

    private ScheduledPost assignSlotAndInsert(ScheduledPost post, OffsetDateTime explicitTime) {
        synchronized (lockFor(post.getAccountRef())) {
            post.setScheduledTime(explicitTime != null
                    ? explicitTime
                    : nextSlot(post.getAccountRef()));
            UUID id = insert(post);
            return findById(id);
        }
    }

    // ==================== Queries ====================

    /**
     * PENDING posts due at {@code now}, oldest first
     */
    public List<ScheduledPost> queryDue(OffsetDateTime now) {
        return postRepository.findDue(PostStatus.PENDING, now);
    }

    /**
     * Newest scheduled first
     */
    public List<ScheduledPost> listByStatus(PostStatus status) {
        return postRepository.findByStatusOrderByScheduledTimeDesc(status);
    }

    public ScheduledPost findById(UUID id) {
        return postRepository.findById(id)
                .orElseThrow(() -> new PostNotFoundException(id));
    }

    /**
     * Latest scheduled time among the account's PENDING and PROCESSING posts
     */
    public Optional<OffsetDateTime> chainTail(String accountRef) {
        return Optional.ofNullable(postRepository.findChainTail(accountRef, PostStatus.LIVE));
    }

    public OffsetDateTime nextSlot(String accountRef) {
        return slotCalculator.nextSlot(chainTail(accountRef).orElse(null), OffsetDateTime.now(clock));
    }

    public SchedulerStatsResponse stats() {
        long pending = postRepository.countByStatus(PostStatus.PENDING);
        long processing = postRepository.countByStatus(PostStatus.PROCESSING);
        long posted = postRepository.countByStatus(PostStatus.POSTED);
        long failed = postRepository.countByStatus(PostStatus.FAILED);

        return SchedulerStatsResponse.builder()
                .totalScheduled(pending + processing + posted + failed)
                .pendingCount(pending)
                .processingCount(processing)
                .postedCount(posted)
                .failedCount(failed)
                .build();
    }

    // ==================== Transitions ====================

    /**
     * PENDING -> PROCESSING as one conditional update.
     *
     * @return false when the post is no longer PENDING, i.e. another run owns it
     */
    public boolean claim(UUID id) {
        boolean claimed = postRepository.transition(id, PostStatus.PENDING, PostStatus.PROCESSING,
                OffsetDateTime.now(clock)) == 1;
        if (claimed) {
            log.info("Claimed post {}", id);
        } else {
            log.info("Post {} is no longer pending, skipping", id);
        }
        return claimed;
    }

    public void markPosted(UUID id, OffsetDateTime postedAt, String platformPostId, String shareUrl) {
        int updated = postRepository.markPosted(id, PostStatus.PROCESSING, PostStatus.POSTED,
                postedAt, platformPostId, shareUrl);
        if (updated == 0) {
            throw rejected(id, "mark posted", PostStatus.PROCESSING);
        }
        log.info("Post {} posted: {}", id, shareUrl);
    }

    public void markFailed(UUID id, String errorDetail) {
        String detail = truncate(errorDetail);
        int updated = postRepository.markFailed(id, PostStatus.PROCESSING, PostStatus.FAILED,
                detail, OffsetDateTime.now(clock));
        if (updated == 0) {
            throw rejected(id, "mark failed", PostStatus.PROCESSING);
        }
        log.error("Post {} failed: {}", id, detail);
    }

    public ScheduledPost reschedule(UUID id, OffsetDateTime newTime) {
        if (newTime == null) {
            throw new ValidationException("A new scheduled time is required");
        }
        ScheduledPost post = findById(id);
        if (post.getStatus() != PostStatus.PENDING) {
            throw new InvalidStateException(id, "reschedule", post.getStatus(), PostStatus.PENDING);
        }
        if (postRepository.existsByAccountRefAndScheduledTimeAndStatusInAndIdNot(
                post.getAccountRef(), newTime, PostStatus.LIVE, id)) {
            throw new ValidationException(String.format("Account %s already has a post scheduled at %s",
                    post.getAccountRef(), newTime));
        }

        if (postRepository.reschedule(id, PostStatus.PENDING, newTime, OffsetDateTime.now(clock)) == 0) {
            throw rejected(id, "reschedule", PostStatus.PENDING);
        }
        log.info("Rescheduled post {} from {} to {}", id, post.getScheduledTime(), newTime);
        return findById(id);
    }

    /**
     * Delete a PENDING post and its staged blob
     */
    public void cancel(UUID id) {
        ScheduledPost post = findById(id);
        if (postRepository.deleteInStatus(id, PostStatus.PENDING) == 0) {
            throw rejected(id, "cancel", PostStatus.PENDING);
        }
        log.info("Cancelled post {}", id);

        if (post.hasMedia()) {
            try {
                blobStaging.delete(post.getMediaRef());
            } catch (BlobStagingException e) {
                log.warn("Cancelled post {} but could not remove staged media {}: {}",
                        id, post.getMediaRef(), e.getMessage(), e);
            }
        }
    }

    // ==================== Helpers ====================

    private void validate(ScheduledPost post) {
        if (post.getPlatform() == null) {
            throw new ValidationException("Platform is required");
        }
        requireAccount(post.getAccountRef());
        if (post.getScheduledTime() == null) {
            throw new ValidationException("Scheduled time is required");
        }

        if (post.getReplyToPostId() != null && post.getPlatform() == Platform.INSTAGRAM) {
            throw new ValidationException("Instagram posts cannot reply to another post");
        }

        List<String> violations = post.getPlatform().toContentLimits()
                .violations(post.getCaption(), post.hasMedia());
        if (!violations.isEmpty()) {
            throw new ValidationException(String.join("; ", violations));
        }
    }

    private static String requireAccount(String accountRef) {
        if (accountRef == null || accountRef.isBlank()) {
            throw new ValidationException("Account reference is required");
        }
        return accountRef;
    }

    /**
     * Explain a conditional update that changed nothing: the post is gone or in another status
     */
    private RuntimeException rejected(UUID id, String operation, PostStatus required) {
        return postRepository.findById(id)
                .<RuntimeException>map(post -> new InvalidStateException(id, operation, post.getStatus(), required))
                .orElseGet(() -> new PostNotFoundException(id));
    }

    Object lockFor(String accountRef) {
        return accountLocks[Math.floorMod(accountRef.hashCode(), accountLocks.length)];
    }

    private static Object[] newLockStripes(int count) {
        Object[] locks = new Object[count];
        for (int i = 0; i < count; i++) {
            locks[i] = new Object();
        }
        return locks;
    }

    static String truncate(String detail) {
        if (detail == null) {
            return null;
        }
        return detail.length() <= MAX_ERROR_DETAIL_LENGTH ? detail : detail.substring(0, MAX_ERROR_DETAIL_LENGTH);
    }
}
