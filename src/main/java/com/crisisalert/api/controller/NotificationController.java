package com.crisisalert.api.controller;

import com.crisisalert.api.dto.request.CheckInRequest;
import com.crisisalert.api.dto.request.CrisisAlertRequest;
import com.crisisalert.api.dto.request.ReminderRequest;
import com.crisisalert.api.dto.request.SnoozeRequest;
import com.crisisalert.api.dto.response.AlertCreatedResponse;
import com.crisisalert.api.dto.response.SnoozeResponse;
import com.crisisalert.domain.model.ActionOutcome;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.exception.ResourceNotFoundException;
import com.crisisalert.mapper.AlertRequestMapper;
import com.crisisalert.notification.ActionHandler;
import com.crisisalert.notification.NotificationService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the alert delivery engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/notifications/preferences/{userId}} -- stored preferences, 404 if none</li>
 *   <li>{@code PUT /api/notifications/preferences} -- replace a user's preferences</li>
 *   <li>{@code POST /api/notifications/alerts/crisis} -- send a crisis alert</li>
 *   <li>{@code POST /api/notifications/alerts/reminder} -- send a wellness reminder</li>
 *   <li>{@code POST /api/notifications/alerts/check-in} -- send a wellness check-in</li>
 *   <li>{@code GET /api/notifications/alerts/active?userId=} -- active alerts, newest first</li>
 *   <li>{@code GET /api/notifications/alerts/{id}} -- one tracked alert</li>
 *   <li>{@code POST /api/notifications/alerts/{id}/acknowledge|dismiss|delivered|snooze}</li>
 *   <li>{@code POST /api/notifications/alerts/{id}/actions/{actionId}} -- handle an action click</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final ActionHandler actionHandler;
    private final AlertRequestMapper alertRequestMapper = Mappers.getMapper(AlertRequestMapper.class);

    public NotificationController(NotificationService notificationService, ActionHandler actionHandler) {
        this.notificationService = notificationService;
        this.actionHandler = actionHandler;
    }

    @GetMapping("/preferences/{userId}")
    public NotificationPreferences getPreferences(@PathVariable String userId) {
        return notificationService
                .getPreferences(userId)
                .orElseThrow(() -> new ResourceNotFoundException("NotificationPreferences", userId));
    }

    @PutMapping("/preferences")
    public NotificationPreferences updatePreferences(@Valid @RequestBody NotificationPreferences preferences) {
        return notificationService.setPreferences(preferences);
    }

    @PostMapping("/alerts/crisis")
    @ResponseStatus(HttpStatus.CREATED)
    public AlertCreatedResponse sendCrisisAlert(@Valid @RequestBody CrisisAlertRequest request) {
        return created(notificationService.sendCrisisAlert(alertRequestMapper.toDraft(request)));
    }

    @PostMapping("/alerts/reminder")
    @ResponseStatus(HttpStatus.CREATED)
    public AlertCreatedResponse sendReminder(@Valid @RequestBody ReminderRequest request) {
        return created(notificationService.sendReminder(
                request.getUserId(), request.getReminderType(), request.getCustomMessage()));
    }

    @PostMapping("/alerts/check-in")
    @ResponseStatus(HttpStatus.CREATED)
    public AlertCreatedResponse sendCheckIn(@Valid @RequestBody CheckInRequest request) {
        return created(notificationService.sendWellnessCheckIn(request.getUserId(), request.getMoodTrend()));
    }

    @GetMapping("/alerts/active")
    public List<Alert> getActiveAlerts(@RequestParam String userId) {
        return notificationService.getActiveAlerts(userId);
    }

    @GetMapping("/alerts/{alertId}")
    public Alert getAlert(@PathVariable String alertId) {
        return notificationService.getAlert(alertId);
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    public Alert acknowledge(@PathVariable String alertId) {
        return notificationService.acknowledge(alertId);
    }

    @PostMapping("/alerts/{alertId}/dismiss")
    public Alert dismiss(@PathVariable String alertId) {
        return notificationService.dismiss(alertId);
    }

    @PostMapping("/alerts/{alertId}/delivered")
    public Alert markDelivered(@PathVariable String alertId) {
        return notificationService.markDelivered(alertId);
    }

    @PostMapping("/alerts/{alertId}/snooze")
    public SnoozeResponse snooze(@PathVariable String alertId, @Valid @RequestBody SnoozeRequest request) {
        return new SnoozeResponse(alertId, notificationService.snooze(alertId, request.getDuration()));
    }

    @PostMapping("/alerts/{alertId}/actions/{actionId}")
    public ActionOutcome handleAction(@PathVariable String alertId, @PathVariable String actionId) {
        return actionHandler.handle(alertId, actionId);
    }

    private static AlertCreatedResponse created(Alert alert) {
        return new AlertCreatedResponse(alert.getId(), alert.getStatus());
    }
}
