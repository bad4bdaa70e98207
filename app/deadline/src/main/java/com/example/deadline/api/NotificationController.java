/*
 * Where: Deadline user API
 * What: Inbox listing, mark-as-read and ad-hoc notification creation
 * Why: The caller is identified by X-User-Id, set by the gateway in front of this service
 */
package com.example.deadline.api;

import com.example.deadline.api.request.CreateNotificationRequest;
import com.example.deadline.api.response.NotificationInboxResponse;
import com.example.deadline.api.response.NotificationSummary;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.service.NotificationPage;
import com.example.deadline.service.NotificationService;
import com.example.deadline.service.NotificationSubmissionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final NotificationService notificationService;
  private final NotificationSubmissionService submissionService;
  private final ObjectMapper objectMapper;

  @GetMapping
  public ResponseEntity<NotificationInboxResponse> inbox(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "limit", defaultValue = "20") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset,
      @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly) {
    final NotificationPage page =
        notificationService.getUserNotifications(userId, limit, offset, unreadOnly);
    return ResponseEntity.ok(
        new NotificationInboxResponse(
            userId,
            page.items().stream().map(this::toSummary).toList(),
            page.total(),
            page.limit(),
            page.offset()));
  }

  @PatchMapping("/{notificationId}/read")
  public ResponseEntity<Void> markRead(
      @PathVariable("notificationId") UUID notificationId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    notificationService.markRead(notificationId, userId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping
  public ResponseEntity<NotificationSummary> create(
      @Valid @RequestBody CreateNotificationRequest request) {
    final NotificationRecord record = submissionService.submit(request.toCommand());
    return ResponseEntity.status(HttpStatus.CREATED).body(toSummary(record));
  }

  private NotificationSummary toSummary(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.type(),
        record.title(),
        record.message(),
        record.scheduledFor(),
        record.createdAt(),
        record.sentAt(),
        record.read(),
        readMetadata(record));
  }

  private JsonNode readMetadata(NotificationRecord record) {
    if (record.metadataJson() == null) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(record.metadataJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification metadata parse failure", ex);
    }
  }
}
