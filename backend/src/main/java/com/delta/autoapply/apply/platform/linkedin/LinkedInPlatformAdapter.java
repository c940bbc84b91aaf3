package com.delta.autoapply.apply.platform.linkedin;

import com.delta.autoapply.apply.browser.BrowserSurfaceFactory;
import com.delta.autoapply.apply.form.FormLayout;
import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.SearchFilter;
import com.delta.autoapply.apply.pacing.PacingGovernor;
import com.delta.autoapply.apply.platform.BrowserPlatformAdapter;
import com.delta.autoapply.apply.platform.PlatformProfile;
import com.delta.autoapply.config.AutoApplyProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * LinkedIn "Easy Apply": a modal wizard of Next / Review / Submit pages.
 */
@Component
public class LinkedInPlatformAdapter extends BrowserPlatformAdapter {

    static final PlatformProfile PROFILE = new PlatformProfile(
        new FormLayout(
            ".jobs-easy-apply-form-section__grouping, .fb-dash-form-element, .jobs-easy-apply-form-element",
            "legend, label, .fb-dash-form-element__label",
            ".jobs-document-upload__file-name, .jobs-document-upload-redesign-card__file-name",
            "button",
            List.of("submit application", "submit"),
            List.of("review your application", "review"),
            List.of("continue to next step", "next", "continue"),
            List.of("back to previous step", "back"),
            List.of("select an option")
        ),
        List.of(
            "button.jobs-apply-button--top-card",
            ".jobs-apply-button",
            "[data-job-apply-button]",
            ".jobs-s-apply button"
        ),
        List.of("easy apply"),
        ".jobs-easy-apply-modal, .jobs-easy-apply-content, [data-test-modal-id='easy-apply-modal']",
        "[data-test-modal-id='post-apply-modal'], .jobs-post-apply-modal",
        List.of("application sent", "your application was sent"),
        ".artdeco-inline-feedback--error, .fb-form-element--error",
        "button[aria-label='Dismiss'], .artdeco-modal__dismiss",
        List.of("discard"),
        List.of("cover letter", "message to the hiring manager", "message")
    );

    private final LinkedInPageParser parser = new LinkedInPageParser();

    public LinkedInPlatformAdapter(
        BrowserSurfaceFactory surfaceFactory,
        PacingGovernor pacing,
        AutoApplyProperties properties
    ) {
        super(surfaceFactory, pacing, properties, PROFILE);
    }

    @Override
    public Platform platform() {
        return Platform.LINKEDIN;
    }

    @Override
    protected String homeUrl() {
        return LinkedInPageParser.BASE_URL + "/feed/";
    }

    @Override
    protected String loginUrl() {
        return LinkedInPageParser.BASE_URL + "/login";
    }

    @Override
    protected String loggedInSelector() {
        return ".global-nav__me, .feed-identity-module, img.global-nav__me-photo";
    }

    @Override
    protected String searchUrl(SearchFilter filter, int pageIndex) {
        return LinkedInPageParser.buildSearchUrl(filter, pageIndex);
    }

    @Override
    protected List<JobListing> parseSearchResults(String html) {
        return parser.parseSearchResults(html);
    }

    @Override
    protected JobDetails parseJobDetails(String html) {
        return parser.parseJobDetails(html);
    }
}
