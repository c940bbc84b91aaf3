package com.delta.autoapply.apply.platform;

import com.delta.autoapply.apply.browser.BrowserSurface;
import com.delta.autoapply.apply.browser.BrowserSurfaceFactory;
import com.delta.autoapply.apply.flow.ApplicationCancelledException;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.flow.ProgressListener;
import com.delta.autoapply.apply.model.ActionTypes;
import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.ApplicationSessionStatus;
import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.SearchFilter;
import com.delta.autoapply.apply.pacing.PacingGovernor;
import com.delta.autoapply.config.AutoApplyProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared lifecycle for adapters that drive a platform through one lazily opened browser surface.
 * Subclasses describe the platform: its URLs, its login marker, its page parsers and its form
 * profile.
 */
public abstract class BrowserPlatformAdapter implements JobPlatformAdapter {
    private static final Logger log = LoggerFactory.getLogger(BrowserPlatformAdapter.class);

    private final BrowserSurfaceFactory surfaceFactory;
    private final AutoApplyProperties properties;
    protected final PacingGovernor pacing;
    private final FormApplicationDriver driver;

    private BrowserSurface surface;
    private volatile boolean loggedIn;

    protected BrowserPlatformAdapter(
        BrowserSurfaceFactory surfaceFactory,
        PacingGovernor pacing,
        AutoApplyProperties properties,
        PlatformProfile profile
    ) {
        this.surfaceFactory = surfaceFactory;
        this.pacing = pacing;
        this.properties = properties;
        this.driver = new FormApplicationDriver(profile, pacing, properties.getForm());
    }

    protected abstract String homeUrl();

    protected abstract String loginUrl();

    protected abstract String loggedInSelector();

    protected abstract String searchUrl(SearchFilter filter, int pageIndex);

    protected abstract List<JobListing> parseSearchResults(String html);

    protected abstract JobDetails parseJobDetails(String html);

    protected synchronized BrowserSurface surface() {
        if (surface == null) {
            surface = surfaceFactory.open(platform());
        }
        return surface;
    }

    @Override
    public boolean isReady() {
        return loggedIn;
    }

    @Override
    public boolean checkLoginStatus() {
        try {
            BrowserSurface current = surface();
            current.navigate(homeUrl());
            pacing.pause(CancellationSignal.none());
            loggedIn = current.isPresent(loggedInSelector());
        } catch (RuntimeException e) {
            log.warn("{} login check failed: {}", platform().displayName(), e.getMessage());
            loggedIn = false;
        }
        log.info("{} login status: {}", platform().displayName(), loggedIn ? "logged in" : "not logged in");
        return loggedIn;
    }

    @Override
    public void openLoginWindow() {
        surface().navigate(loginUrl());
    }

    @Override
    public List<JobListing> searchJobs(SearchFilter filter, ProgressListener progress, CancellationSignal cancel) {
        List<JobListing> results = new ArrayList<>();
        Set<String> seenIds = new LinkedHashSet<>();
        int maxPages = properties.getSearch().getMaxResultPages();
        try {
            for (int pageIndex = 0; pageIndex < maxPages && results.size() < filter.maxResults(); pageIndex++) {
                cancel.throwIfCancelled();
                progress.onProgress("Searching " + platform().displayName() + " page " + (pageIndex + 1));
                surface().navigate(searchUrl(filter, pageIndex));
                pacing.pause(cancel);
                List<JobListing> page = parseSearchResults(surface().pageSource());
                int added = 0;
                for (JobListing listing : page) {
                    if (results.size() >= filter.maxResults()) {
                        break;
                    }
                    if (listing.externalJobId() != null && seenIds.add(listing.externalJobId())) {
                        results.add(listing);
                        added++;
                    }
                }
                if (added == 0) {
                    break;
                }
            }
        } catch (ApplicationCancelledException e) {
            log.info("{} search cancelled after {} result(s)", platform().displayName(), results.size());
        } catch (RuntimeException e) {
            log.warn("{} search stopped early: {}", platform().displayName(), e.getMessage());
        }
        return results;
    }

    @Override
    public JobDetails fetchJobDetails(String jobUrl) {
        try {
            surface().navigate(jobUrl);
            pacing.pause(CancellationSignal.none());
            return parseJobDetails(surface().pageSource());
        } catch (RuntimeException e) {
            log.warn("Could not load {} job details from {}: {}", platform().displayName(), jobUrl, e.getMessage());
            return null;
        }
    }

    @Override
    public ApplicationSession prepareApplication(
        ApplicationSession session,
        ProgressListener progress,
        CancellationSignal cancel
    ) {
        if (!isReady() && !checkLoginStatus()) {
            log.warn("{} is not logged in, cannot prepare session {}", platform().displayName(), session.getId());
            return null;
        }
        try {
            String refusal = checkPreconditions(session);
            if (refusal != null) {
                log.warn("Not preparing session {}: {}", session.getId(), refusal);
                session.logAction(ApplicationAction.failed(ActionTypes.OPEN_APPLICATION, "Preconditions not met", refusal));
                session.failIfActive(refusal);
                return session;
            }
            return driver.prepare(surface(), session, progress, cancel);
        } catch (RuntimeException e) {
            log.warn("{} surface unavailable for session {}: {}", platform().displayName(), session.getId(), e.getMessage());
            session.logAction(ApplicationAction.failed(ActionTypes.ERROR, "Browser surface unavailable", e.getMessage()));
            session.failIfActive("Preparation failed: " + e.getMessage());
            return session;
        }
    }

    /**
     * Platform-specific checks that must pass before an application form is opened. Returns the
     * reason for refusing, or null.
     */
    protected String checkPreconditions(ApplicationSession session) {
        return null;
    }

    @Override
    public boolean submitApplication(ApplicationSession session, ProgressListener progress, CancellationSignal cancel) {
        if (session.getStatus() != ApplicationSessionStatus.APPROVED) {
            log.warn("Rejected submit of session {} in status {}", session.getId(), session.getStatus());
            return false;
        }
        session.transitionTo(ApplicationSessionStatus.SUBMITTING);
        try {
            return driver.submit(surface(), session, progress, cancel);
        } catch (RuntimeException e) {
            log.warn("{} surface unavailable for session {}: {}", platform().displayName(), session.getId(), e.getMessage());
            session.logAction(ApplicationAction.failed(ActionTypes.ERROR, "Browser surface unavailable", e.getMessage()));
            session.failIfActive("Submission failed: " + e.getMessage());
            return false;
        }
    }

    @Override
    public void cancelApplication() {
        driver.dismiss(currentSurface());
    }

    @Override
    public void cancelApplication(ApplicationSession session) {
        driver.dismiss(currentSurface(), session);
    }

    private synchronized BrowserSurface currentSurface() {
        return surface;
    }

    @Override
    @PreDestroy
    public synchronized void close() {
        if (surface != null) {
            surface.close();
            surface = null;
        }
        loggedIn = false;
    }
}
