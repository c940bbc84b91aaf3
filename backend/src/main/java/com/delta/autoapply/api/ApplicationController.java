package com.delta.autoapply.api;

import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.ReviewEdits;
import com.delta.autoapply.apply.service.ApplicationSessionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/applications")
public class ApplicationController {
    private final ApplicationSessionService sessionService;

    public ApplicationController(ApplicationSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApplicationSessionView startApplication(@RequestBody JobListing job) {
        if (job == null || job.applicationUrl() == null || job.applicationUrl().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "applicationUrl is required");
        }
        return view(sessionService.startPreparation(job));
    }

    @GetMapping
    public List<ApplicationSessionView> listApplications() {
        return sessionService.list().stream().map(this::view).toList();
    }

    @GetMapping("/{id}")
    public ApplicationSessionView getApplication(@PathVariable("id") UUID id) {
        return view(sessionService.find(id));
    }

    @PostMapping("/{id}/approve")
    public ApplicationSessionView approve(
        @PathVariable("id") UUID id,
        @RequestBody(required = false) ApproveRequest request
    ) {
        ReviewEdits edits = request == null
            ? ReviewEdits.none()
            : new ReviewEdits(request.applicationMessage(), parseAnswers(request.answers()));
        return view(sessionService.approve(id, edits));
    }

    @PostMapping("/{id}/cancel")
    public ApplicationSessionView cancel(@PathVariable("id") UUID id) {
        return view(sessionService.cancel(id));
    }

    @PostMapping("/{id}/abort")
    public ApplicationSessionView abort(@PathVariable("id") UUID id) {
        return view(sessionService.abort(id));
    }

    private Map<UUID, String> parseAnswers(Map<String, String> raw) {
        Map<UUID, String> answers = new LinkedHashMap<>();
        if (raw == null) {
            return answers;
        }
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            try {
                answers.put(UUID.fromString(entry.getKey()), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(BAD_REQUEST, "Invalid question id: " + entry.getKey());
            }
        }
        return answers;
    }

    private ApplicationSessionView view(ApplicationSession session) {
        return ApplicationSessionView.from(
            session,
            sessionService.isInFlight(session.getId()),
            sessionService.latestProgress(session.getId())
        );
    }
}
