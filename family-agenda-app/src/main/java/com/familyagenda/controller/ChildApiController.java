package com.familyagenda.controller;

import com.familyagenda.model.Child;
import com.familyagenda.model.ChildRequest;
import com.familyagenda.model.MessageResponse;
import com.familyagenda.model.Schedule;
import com.familyagenda.security.ParentPrincipal;
import com.familyagenda.service.ChildService;
import com.familyagenda.service.ChildService.ChildCreated;
import com.familyagenda.service.ScheduleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/children")
public class ChildApiController {

    private final ChildService childService;
    private final ScheduleService scheduleService;

    public ChildApiController(ChildService childService, ScheduleService scheduleService) {
        this.childService = childService;
        this.scheduleService = scheduleService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createChild(@AuthenticationPrincipal ParentPrincipal parent,
                                                           @RequestBody ChildRequest body) {
        ChildCreated created = childService.create(body.fullName(), body.nationalId(), body.birthDate(), parent.parentId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", created.id());
        response.put("fullName", created.fullName());
        response.put("message", "Child registered successfully.");
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<Child>> listChildren(@AuthenticationPrincipal ParentPrincipal parent) {
        return ResponseEntity.ok(childService.list(parent.parentId()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> deleteChild(@AuthenticationPrincipal ParentPrincipal parent,
                                                       @PathVariable Long id) {
        childService.delete(id, parent.parentId());
        return ResponseEntity.ok(new MessageResponse("Child deleted successfully."));
    }

    @GetMapping("/{id}/schedules")
    public ResponseEntity<List<Schedule>> listSchedules(@AuthenticationPrincipal ParentPrincipal parent,
                                                        @PathVariable Long id) {
        return ResponseEntity.ok(scheduleService.listForChild(id, parent.parentId()));
    }
}
