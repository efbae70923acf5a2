package com.familyagenda.controller;

import com.familyagenda.model.MessageResponse;
import com.familyagenda.model.ScheduleRequest;
import com.familyagenda.security.ParentPrincipal;
import com.familyagenda.service.ScheduleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/schedules")
public class ScheduleApiController {

    private final ScheduleService scheduleService;

    public ScheduleApiController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createSchedule(@AuthenticationPrincipal ParentPrincipal parent,
                                                              @RequestBody ScheduleRequest body) {
        Long id = scheduleService.create(body, parent.parentId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", id);
        response.put("message", "Schedule created successfully.");
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> deleteSchedule(@AuthenticationPrincipal ParentPrincipal parent,
                                                          @PathVariable Long id) {
        scheduleService.delete(id, parent.parentId());
        return ResponseEntity.ok(new MessageResponse("Schedule deleted successfully."));
    }
}
