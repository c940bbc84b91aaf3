package com.delta.autoapply.api;

import java.util.Map;

/**
 * Reviewer edits. Answers are keyed by question id; a missing message keeps the draft.
 */
public record ApproveRequest(String applicationMessage, Map<String, String> answers) {
}
