package com.example.deadline.service;

import com.example.deadline.model.NotificationRecord;
import java.util.List;

public record NotificationPage(List<NotificationRecord> items, int total, int limit, int offset) {

  public NotificationPage {
    items = List.copyOf(items);
  }
}
