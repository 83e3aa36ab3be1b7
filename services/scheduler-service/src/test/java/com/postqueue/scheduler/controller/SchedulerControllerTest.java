package com.postqueue.scheduler.controller;

import com.postqueue.connector.model.Platform;
import com.postqueue.scheduler.dto.CreateScheduledPostRequest;
import com.postqueue.scheduler.dto.PublishRunSummary;
import com.postqueue.scheduler.dto.RequeueAllResponse;
import com.postqueue.scheduler.dto.ScheduledPostResponse;
import com.postqueue.scheduler.entity.PostStatus;
import com.postqueue.scheduler.entity.ScheduledPost;
import com.postqueue.scheduler.exception.InvalidStateException;
import com.postqueue.scheduler.exception.PostNotFoundException;
import com.postqueue.scheduler.exception.ValidationException;
import com.postqueue.scheduler.service.Publisher;
import com.postqueue.scheduler.service.ScheduleStore;
import com.postqueue.scheduler.staging.BlobStaging;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SchedulerController.class)
class SchedulerControllerTest {

    private static final OffsetDateTime SLOT = OffsetDateTime.parse("2024-03-10T14:00:00+05:30");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScheduleStore scheduleStore;

    @MockBean
    private Publisher publisher;

    @MockBean
    private BlobStaging blobStaging;

    @Test
    void createsPostFromWireNames() throws Exception {
        ScheduledPost created = ScheduledPost.builder()
                .id(UUID.randomUUID())
                .platform(Platform.TEXT_ONLY)
                .accountRef("acct-a")
                .caption("hello")
                .scheduledTime(SLOT)
                .status(PostStatus.PENDING)
                .build();
        when(scheduleStore.schedule(any())).thenReturn(created);

        mockMvc.perform(post("/api/v1/scheduler/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"text_only\",\"accountRef\":\"acct-a\",\"caption\":\"hello\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.platform").value("text_only"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.id").value(created.getId().toString()));

        ArgumentCaptor<CreateScheduledPostRequest> request = ArgumentCaptor.forClass(CreateScheduledPostRequest.class);
        verify(scheduleStore).schedule(request.capture());
        assertEquals(Platform.TEXT_ONLY, request.getValue().getPlatform());
        assertEquals("acct-a", request.getValue().getAccountRef());
    }

    @Test
    void validationFailureIsBadRequest() throws Exception {
        when(scheduleStore.schedule(any())).thenThrow(new ValidationException("Video-attached posts require a media reference"));

        mockMvc.perform(post("/api/v1/scheduler/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"video_attached\",\"accountRef\":\"acct-a\",\"caption\":\"clip\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancellingAProcessingPostIsConflict() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new InvalidStateException(id, "cancel", PostStatus.PROCESSING, PostStatus.PENDING))
                .when(scheduleStore).cancel(id);

        mockMvc.perform(delete("/api/v1/scheduler/posts/{id}", id))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownPostIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(scheduleStore.findById(id)).thenThrow(new PostNotFoundException(id));

        mockMvc.perform(get("/api/v1/scheduler/posts/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void listsPostsByStatus() throws Exception {
        ScheduledPost failed = ScheduledPost.builder()
                .id(UUID.randomUUID())
                .platform(Platform.INSTAGRAM)
                .accountRef("acct-a")
                .caption("")
                .scheduledTime(SLOT)
                .status(PostStatus.FAILED)
                .errorDetail("[TIMEOUT] Instagram processing did not complete")
                .build();
        when(scheduleStore.listByStatus(PostStatus.FAILED)).thenReturn(List.of(failed));

        mockMvc.perform(get("/api/v1/scheduler/posts").param("status", "FAILED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].errorDetail").value("[TIMEOUT] Instagram processing did not complete"))
                .andExpect(jsonPath("$[0].platform").value("instagram"));
    }

    @Test
    void manualRunReturnsSummary() throws Exception {
        when(publisher.run()).thenReturn(new PublishRunSummary(3, 1, 1, 1));

        mockMvc.perform(post("/api/v1/scheduler/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.due").value(3))
                .andExpect(jsonPath("$.published").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.skipped").value(1));
    }

    @Test
    void requeuesAllFailedPosts() throws Exception {
        UUID failedText = UUID.randomUUID();
        UUID failedReel = UUID.randomUUID();
        ScheduledPost copy = ScheduledPost.builder()
                .id(UUID.randomUUID())
                .platform(Platform.TEXT_ONLY)
                .accountRef("acct-a")
                .caption("hello")
                .scheduledTime(SLOT)
                .status(PostStatus.PENDING)
                .requeuedFrom(failedText)
                .build();
        when(scheduleStore.requeueAllFailed()).thenReturn(RequeueAllResponse.builder()
                .requeued(List.of(ScheduledPostResponse.from(copy)))
                .needsMedia(List.of(failedReel))
                .build());

        mockMvc.perform(post("/api/v1/scheduler/posts/requeue-failed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requeued[0].requeuedFrom").value(failedText.toString()))
                .andExpect(jsonPath("$.needsMedia[0]").value(failedReel.toString()));
    }

    @Test
    void createsReplyPost() throws Exception {
        when(scheduleStore.schedule(any())).thenReturn(ScheduledPost.builder()
                .id(UUID.randomUUID())
                .platform(Platform.TEXT_ONLY)
                .accountRef("acct-a")
                .caption("part 2")
                .replyToPostId("1799")
                .scheduledTime(SLOT)
                .status(PostStatus.PENDING)
                .build());

        mockMvc.perform(post("/api/v1/scheduler/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"text_only\",\"accountRef\":\"acct-a\",\"caption\":\"part 2\",\"replyToPostId\":\"1799\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.replyToPostId").value("1799"));

        ArgumentCaptor<CreateScheduledPostRequest> request = ArgumentCaptor.forClass(CreateScheduledPostRequest.class);
        verify(scheduleStore).schedule(request.capture());
        assertEquals("1799", request.getValue().getReplyToPostId());
    }

    @Test
    void previewsNextSlotOfAccount() throws Exception {
        when(scheduleStore.chainTail("acct-a")).thenReturn(Optional.empty());
        when(scheduleStore.nextSlot("acct-a")).thenReturn(SLOT);

        mockMvc.perform(get("/api/v1/scheduler/accounts/{account}/next-slot", "acct-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountRef").value("acct-a"))
                .andExpect(jsonPath("$.nextSlot").exists());
    }

    @Test
    void stagesRawMedia() throws Exception {
        when(blobStaging.put(any(), eq("video/mp4"))).thenReturn("https://storage.example/ready_to_publish/a.mp4");

        mockMvc.perform(post("/api/v1/scheduler/media")
                        .contentType("video/mp4")
                        .content(new byte[]{1, 2, 3}))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.mediaRef").value("https://storage.example/ready_to_publish/a.mp4"))
                .andExpect(jsonPath("$.sizeBytes").value(3));
    }
}
