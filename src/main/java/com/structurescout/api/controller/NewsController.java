package com.structurescout.api.controller;

import com.structurescout.api.dto.request.ScheduledEventRequest;
import com.structurescout.domain.model.BlackoutWindow;
import com.structurescout.domain.model.ScheduledEvent;
import com.structurescout.news.NewsCalendarService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for scheduled economic events and their blackout windows.
 */
@RestController
@RequestMapping("/api/news")
public class NewsController {

    private final NewsCalendarService newsCalendarService;

    public NewsController(NewsCalendarService newsCalendarService) {
        this.newsCalendarService = newsCalendarService;
    }

    @GetMapping("/events")
    public ResponseEntity<List<ScheduledEvent>> getEvents(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (from == null && to == null) {
            return ResponseEntity.ok(newsCalendarService.getEvents());
        }
        return ResponseEntity.ok(newsCalendarService.getEvents(
                from != null ? from : Instant.MIN, to != null ? to : Instant.MAX));
    }

    @PostMapping("/events")
    public ResponseEntity<ScheduledEvent> registerEvent(@Valid @RequestBody ScheduledEventRequest request) {
        return ResponseEntity.ok(
                newsCalendarService.register(request.getTitle(), request.getEventTime(), request.getImpact()));
    }

    @GetMapping("/blackouts")
    public ResponseEntity<List<BlackoutWindow>> getBlackoutWindows() {
        return ResponseEntity.ok(newsCalendarService.getBlackoutWindows());
    }
}
