package com.delta.autoapply.apply.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplicationSessionStatusTest {

    @Test
    void terminalStatusesHaveNoOutgoingEdges() {
        for (ApplicationSessionStatus terminal : new ApplicationSessionStatus[] {
            ApplicationSessionStatus.SUBMITTED, ApplicationSessionStatus.FAILED, ApplicationSessionStatus.CANCELLED
        }) {
            assertTrue(terminal.isTerminal());
            for (ApplicationSessionStatus target : ApplicationSessionStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void onlyPendingAndReviewAllowEdits() {
        assertTrue(ApplicationSessionStatus.PENDING.allowsEdits());
        assertTrue(ApplicationSessionStatus.READY_FOR_REVIEW.allowsEdits());
        assertFalse(ApplicationSessionStatus.APPROVED.allowsEdits());
        assertFalse(ApplicationSessionStatus.SUBMITTING.allowsEdits());
    }

    @Test
    void approvedCannotBeCancelledOrFailedDirectly() {
        assertFalse(ApplicationSessionStatus.APPROVED.canTransitionTo(ApplicationSessionStatus.CANCELLED));
        assertFalse(ApplicationSessionStatus.APPROVED.canTransitionTo(ApplicationSessionStatus.FAILED));
        assertTrue(ApplicationSessionStatus.APPROVED.canTransitionTo(ApplicationSessionStatus.SUBMITTING));
        assertFalse(ApplicationSessionStatus.PENDING.canTransitionTo(null));
    }
}
