package com.delta.autoapply.apply.platform.upwork;

import com.delta.autoapply.apply.browser.BrowserSurface;
import com.delta.autoapply.apply.browser.BrowserSurfaceFactory;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.form.FormLayout;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.SearchFilter;
import com.delta.autoapply.apply.pacing.PacingGovernor;
import com.delta.autoapply.apply.platform.BrowserPlatformAdapter;
import com.delta.autoapply.apply.platform.PlatformProfile;
import com.delta.autoapply.config.AutoApplyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Upwork proposals: a single page with cover letter, bid and screening questions.
 */
@Component
public class UpworkPlatformAdapter extends BrowserPlatformAdapter {
    private static final Logger log = LoggerFactory.getLogger(UpworkPlatformAdapter.class);

    static final String CONNECTS_URL = UpworkPageParser.BASE_URL + "/nx/plans/connects/history/";

    static final PlatformProfile PROFILE = new PlatformProfile(
        new FormLayout(
            "[data-test='question'], .screening-question, .additional-question, [data-test='cover-letter-section'], [data-test='bid-section']",
            "label, legend, .question-title",
            ".attachment-name, [data-test='attachment-name']",
            "button",
            List.of("submit proposal", "send for", "submit"),
            List.of(),
            List.of("next", "continue"),
            List.of("back"),
            List.of("select an option", "select")
        ),
        List.of("[data-test='apply-button']", "button[data-cy='submit-proposal-button']"),
        List.of("apply now", "submit a proposal"),
        "[data-test='proposal-form'], .proposal-form, form#proposal-form",
        "[data-test='proposal-submitted'], .success-message",
        List.of("proposal submitted", "your proposal was submitted"),
        "[data-test='error-message'], .error-message, .alert-danger",
        "[data-test='modal-close'], button[aria-label='Close'], .modal-close",
        List.of("discard", "leave"),
        List.of("cover letter", "proposal")
    );

    private final UpworkPageParser parser = new UpworkPageParser();

    public UpworkPlatformAdapter(
        BrowserSurfaceFactory surfaceFactory,
        PacingGovernor pacing,
        AutoApplyProperties properties
    ) {
        super(surfaceFactory, pacing, properties, PROFILE);
    }

    @Override
    public Platform platform() {
        return Platform.UPWORK;
    }

    @Override
    protected String homeUrl() {
        return UpworkPageParser.BASE_URL + "/nx/find-work/";
    }

    @Override
    protected String loginUrl() {
        return UpworkPageParser.BASE_URL + "/ab/account-security/login";
    }

    @Override
    protected String loggedInSelector() {
        return "[data-test='nav-user-avatar'], .nav-user-avatar, [data-cy='user-avatar']";
    }

    @Override
    protected String searchUrl(SearchFilter filter, int pageIndex) {
        return UpworkPageParser.buildSearchUrl(filter, pageIndex);
    }

    @Override
    protected List<JobListing> parseSearchResults(String html) {
        return parser.parseSearchResults(html);
    }

    @Override
    protected JobDetails parseJobDetails(String html) {
        return parser.parseJobDetails(html);
    }

    /**
     * Reads the account's available Connects. Null when not logged in or the balance cannot be read.
     */
    public Integer connectsBalance() {
        if (!isReady() && !checkLoginStatus()) {
            return null;
        }
        try {
            BrowserSurface current = surface();
            current.navigate(CONNECTS_URL);
            pacing.pause(CancellationSignal.none());
            Integer balance = parser.parseConnectsBalance(current.pageSource());
            if (balance == null) {
                log.warn("Connects balance not found on {}", CONNECTS_URL);
            }
            return balance;
        } catch (RuntimeException e) {
            log.warn("Could not read Connects balance: {}", e.getMessage());
            return null;
        }
    }

    /**
     * False only when the balance is known and lower than required.
     */
    public boolean hasEnoughConnects(int required) {
        Integer balance = connectsBalance();
        return balance == null || balance >= required;
    }

    @Override
    protected String checkPreconditions(ApplicationSession session) {
        Integer required = session.getConnectsRequired();
        if (required == null || required <= 0) {
            return null;
        }
        Integer balance = connectsBalance();
        if (balance == null) {
            log.warn("Connects balance unknown, preparing session {} that needs {} Connects", session.getId(), required);
            return null;
        }
        if (balance < required) {
            return "Not enough Connects: job needs " + required + ", balance is " + balance;
        }
        return null;
    }
}
