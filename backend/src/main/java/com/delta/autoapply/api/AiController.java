package com.delta.autoapply.api;

import com.delta.autoapply.apply.ai.AiCollaborator;
import com.delta.autoapply.apply.ai.AiCollaboratorException;
import com.delta.autoapply.apply.ai.JobSummaryResult;
import com.delta.autoapply.config.AutoApplyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/ai")
public class AiController {
    private static final Logger log = LoggerFactory.getLogger(AiController.class);

    private final AiCollaborator aiCollaborator;
    private final AutoApplyProperties properties;

    public AiController(AiCollaborator aiCollaborator, AutoApplyProperties properties) {
        this.aiCollaborator = aiCollaborator;
        this.properties = properties;
    }

    @PostMapping("/validate")
    public ApiKeyStatusView validateKey() {
        try {
            aiCollaborator.validateApiKey();
            return new ApiKeyStatusView(true, "API key is valid");
        } catch (AiCollaboratorException e) {
            log.info("AI API key rejected: {}", e.getMessage());
            return new ApiKeyStatusView(false, e.getMessage());
        }
    }

    @PostMapping("/summary")
    public JobSummaryResult summarize(@RequestBody(required = false) JobSummaryRequest request)
        throws AiCollaboratorException {
        if (request == null || request.jobDescription() == null || request.jobDescription().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "jobDescription is required");
        }
        return aiCollaborator.summarizeJob(request.jobDescription(), properties.getProfile().resolve());
    }

    public record JobSummaryRequest(String jobDescription) {
    }

    public record ApiKeyStatusView(boolean valid, String message) {
    }
}
