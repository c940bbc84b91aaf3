package com.delta.autoapply.apply.platform;

import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.flow.ProgressListener;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.SearchFilter;

import java.util.List;

/**
 * One hiring platform driven through a single browser surface. Implementations run at most one
 * preparation or submission at a time.
 */
public interface JobPlatformAdapter {
    Platform platform();

    /**
     * True once a logged-in platform session has been observed.
     */
    boolean isReady();

    boolean checkLoginStatus();

    void openLoginWindow();

    List<JobListing> searchJobs(SearchFilter filter, ProgressListener progress, CancellationSignal cancel);

    /**
     * Returns null when the page cannot be loaded or parsed.
     */
    JobDetails fetchJobDetails(String jobUrl);

    /**
     * Detects every question of the job's application form and leaves the session in
     * READY_FOR_REVIEW, or FAILED with a reason. Returns null, without touching the session, when
     * the platform session is not ready.
     */
    ApplicationSession prepareApplication(ApplicationSession session, ProgressListener progress, CancellationSignal cancel);

    default ApplicationSession prepareApplication(JobListing job, ProgressListener progress, CancellationSignal cancel) {
        return prepareApplication(ApplicationSession.forJob(job), progress, cancel);
    }

    /**
     * Fills and submits an APPROVED session. Any other status is rejected without side effects.
     * Returns true only when the platform confirmed the submission. Failures never escape: once
     * accepted, the session always ends SUBMITTED or FAILED.
     */
    boolean submitApplication(ApplicationSession session, ProgressListener progress, CancellationSignal cancel);

    /**
     * Best-effort dismissal of an open application surface. Never throws.
     */
    void cancelApplication();

    /**
     * Dismisses the application surface only if it currently shows this session's form. Never throws.
     */
    default void cancelApplication(ApplicationSession session) {
        cancelApplication();
    }

    void close();
}
