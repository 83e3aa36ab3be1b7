package com.postqueue.scheduler.controller;

import com.postqueue.scheduler.dto.*;
import com.postqueue.scheduler.entity.PostStatus;
import com.postqueue.scheduler.service.Publisher;
import com.postqueue.scheduler.service.ScheduleStore;
import com.postqueue.scheduler.staging.BlobStaging;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final ScheduleStore scheduleStore;
    private final Publisher publisher;
    private final BlobStaging blobStaging;

    @PostMapping("/posts")
    public ResponseEntity<ScheduledPostResponse> createScheduledPost(@RequestBody CreateScheduledPostRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ScheduledPostResponse.from(scheduleStore.schedule(request)));
    }

    @PostMapping(value = "/media", consumes = {"video/*", "image/*", "application/octet-stream"})
    public ResponseEntity<StagedMediaResponse> stageMedia(
            @RequestHeader(HttpHeaders.CONTENT_TYPE) String contentType,
            @RequestBody byte[] content
    ) {
        String ref = blobStaging.put(content, contentType);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StagedMediaResponse.builder()
                        .mediaRef(ref)
                        .contentType(contentType)
                        .sizeBytes((long) content.length)
                        .build());
    }

    @GetMapping("/posts")
    public ResponseEntity<List<ScheduledPostResponse>> listPosts(
            @RequestParam(defaultValue = "PENDING") PostStatus status
    ) {
        return ResponseEntity.ok(scheduleStore.listByStatus(status).stream()
                .map(ScheduledPostResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/posts/{postId}")
    public ResponseEntity<ScheduledPostResponse> getPost(@PathVariable UUID postId) {
        return ResponseEntity.ok(ScheduledPostResponse.from(scheduleStore.findById(postId)));
    }

    @PutMapping("/posts/{postId}/schedule")
    public ResponseEntity<ScheduledPostResponse> reschedulePost(
            @PathVariable UUID postId,
            @RequestBody RescheduleRequest request
    ) {
        return ResponseEntity.ok(ScheduledPostResponse.from(
                scheduleStore.reschedule(postId, request.getScheduledTime())));
    }

    @DeleteMapping("/posts/{postId}")
    public ResponseEntity<Void> cancelPost(@PathVariable UUID postId) {
        scheduleStore.cancel(postId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/posts/{postId}/requeue")
    public ResponseEntity<ScheduledPostResponse> requeuePost(
            @PathVariable UUID postId,
            @RequestBody(required = false) RequeueRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ScheduledPostResponse.from(scheduleStore.requeue(postId, request)));
    }

    @PostMapping("/posts/requeue-failed")
    public ResponseEntity<RequeueAllResponse> requeueFailedPosts() {
        return ResponseEntity.ok(scheduleStore.requeueAllFailed());
    }

    @GetMapping("/accounts/{accountRef}/next-slot")
    public ResponseEntity<NextSlotResponse> nextSlot(@PathVariable String accountRef) {
        return ResponseEntity.ok(NextSlotResponse.builder()
                .accountRef(accountRef)
                .chainTail(scheduleStore.chainTail(accountRef).orElse(null))
                .nextSlot(scheduleStore.nextSlot(accountRef))
                .build());
    }

    @GetMapping("/stats")
    public ResponseEntity<SchedulerStatsResponse> getStats() {
        return ResponseEntity.ok(scheduleStore.stats());
    }

    @PostMapping("/runs")
    public ResponseEntity<PublishRunSummary> runPublisher() {
        return ResponseEntity.ok(publisher.run());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scheduler Service is healthy");
    }
}
