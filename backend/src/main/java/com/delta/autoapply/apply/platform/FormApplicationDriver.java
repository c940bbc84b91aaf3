package com.delta.autoapply.apply.platform;

import com.delta.autoapply.apply.browser.BrowserSurface;
import com.delta.autoapply.apply.flow.ApplicationCancelledException;
import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.flow.ProgressListener;
import com.delta.autoapply.apply.form.FormInspector;
import com.delta.autoapply.apply.form.FormPage;
import com.delta.autoapply.apply.form.FormScan;
import com.delta.autoapply.apply.form.NavigationControl;
import com.delta.autoapply.apply.form.NavigationButton;
import com.delta.autoapply.apply.model.ActionTypes;
import com.delta.autoapply.apply.model.ApplicationAction;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.ApplicationSessionStatus;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.apply.model.QuestionType;
import com.delta.autoapply.apply.pacing.PacingGovernor;
import com.delta.autoapply.config.AutoApplyProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a multi-page application form on a {@link BrowserSurface}. Platform adapters compose one
 * driver each and supply a {@link PlatformProfile}; the driver owns the prepare, submit and
 * dismiss flows and turns every failure into a FAILED session with a reason.
 */
public class FormApplicationDriver {
    private static final Logger log = LoggerFactory.getLogger(FormApplicationDriver.class);

    static final String BUSY_MESSAGE = "Automation surface busy with another application";

    private final PlatformProfile profile;
    private final FormInspector inspector;
    private final PacingGovernor pacing;
    private final AutoApplyProperties.Form formSettings;
    private final AtomicBoolean busy = new AtomicBoolean(false);
    // Session whose prepared form is currently open on the surface, if any.
    private volatile UUID openFormOwner;

    public FormApplicationDriver(PlatformProfile profile, PacingGovernor pacing, AutoApplyProperties.Form formSettings) {
        this.profile = profile;
        this.pacing = pacing;
        this.formSettings = formSettings;
        this.inspector = new FormInspector(
            profile.formLayout(),
            formSettings.getMaxPages(),
            formSettings.getMinLabelLength()
        );
    }

    public FormInspector inspector() {
        return inspector;
    }

    public ApplicationSession prepare(
        BrowserSurface surface,
        ApplicationSession session,
        ProgressListener progress,
        CancellationSignal cancel
    ) {
        if (!busy.compareAndSet(false, true)) {
            session.failIfActive(BUSY_MESSAGE);
            return session;
        }
        try {
            openForm(surface, session, progress, cancel);
            if (session.getStatus() != ApplicationSessionStatus.PENDING) {
                return session;
            }

            FormScan scan = inspector.scan(new SurfaceFormPage(surface, session, cancel), progress, cancel);
            session.recordQuestions(scan.questions(), scan.totalPages());
            session.logAction(ApplicationAction.succeeded(
                ActionTypes.DETECT_PAGE,
                "Detected " + scan.questions().size() + " question(s) across " + scan.totalPages() + " page(s)"
                    + (scan.pageCapReached() ? " (page cap reached)" : "")
            ));

            rewind(surface, session, cancel);
            session.setCurrentPage(0);
            session.transitionTo(ApplicationSessionStatus.READY_FOR_REVIEW);
            openFormOwner = session.getId();
            progress.onProgress("Application form ready for review");
            log.info("Prepared {} application for '{}' with {} question(s)",
                session.getPlatform().displayName(), session.getJobTitle(), scan.questions().size());
        } catch (ApplicationCancelledException e) {
            session.logAction(ApplicationAction.failed(ActionTypes.CANCEL, "Preparation cancelled", e.getMessage()));
            session.failIfActive("Preparation cancelled");
            dismiss(surface);
        } catch (RuntimeException e) {
            log.warn("Preparation of session {} failed: {}", session.getId(), e.getMessage());
            session.logAction(ApplicationAction.failed(ActionTypes.ERROR, "Preparation failed", e.getMessage()));
            session.failIfActive("Preparation failed: " + e.getMessage());
        } finally {
            busy.set(false);
        }
        return session;
    }

    /**
     * Fills and submits an APPROVED session, or one the adapter already moved to SUBMITTING. The
     * open form is reused only when this session prepared it; otherwise it is dismissed and the
     * session's own job page is opened again.
     */
    public boolean submit(
        BrowserSurface surface,
        ApplicationSession session,
        ProgressListener progress,
        CancellationSignal cancel
    ) {
        if (session.getStatus() == ApplicationSessionStatus.APPROVED) {
            session.transitionTo(ApplicationSessionStatus.SUBMITTING);
        } else if (session.getStatus() != ApplicationSessionStatus.SUBMITTING) {
            log.warn("Rejected submit of session {} in status {}", session.getId(), session.getStatus());
            return false;
        }
        if (!busy.compareAndSet(false, true)) {
            session.fail(BUSY_MESSAGE);
            return false;
        }
        try {
            boolean formOpen = surface.isPresent(profile.surfaceSelector());
            if (!formOpen || !session.getId().equals(openFormOwner)) {
                if (formOpen) {
                    log.info("Closing a form prepared for another session before submitting {}", session.getId());
                    dismiss(surface);
                }
                openForm(surface, session, progress, cancel);
                if (session.getStatus() != ApplicationSessionStatus.SUBMITTING) {
                    return false;
                }
                openFormOwner = session.getId();
            }
            walkAndSubmit(surface, session, progress, cancel);
        } catch (ApplicationCancelledException e) {
            session.logAction(ApplicationAction.failed(ActionTypes.CANCEL, "Submission cancelled", e.getMessage()));
            session.failIfActive("Cancelled before final submission");
            dismiss(surface);
        } catch (RuntimeException e) {
            log.warn("Submission of session {} failed: {}", session.getId(), e.getMessage());
            session.logAction(ApplicationAction.failed(ActionTypes.ERROR, "Submission failed", e.getMessage()));
            session.failIfActive("Submission failed: " + e.getMessage());
        } finally {
            openFormOwner = null;
            busy.set(false);
        }
        return session.getStatus() == ApplicationSessionStatus.SUBMITTED;
    }

    /**
     * Closes the application surface and confirms a discard prompt when one appears. Never throws.
     */
    public void dismiss(BrowserSurface surface) {
        if (surface == null) {
            return;
        }
        openFormOwner = null;
        try {
            if (profile.dismissSelector() != null && surface.isPresent(profile.dismissSelector())) {
                surface.click(profile.dismissSelector());
                pacing.pause(500, 1000, CancellationSignal.none());
            }
            Document document = Jsoup.parse(surface.pageSource());
            NavigationButton discard = inspector.findButton(document, profile.discardCaptions(), NavigationControl.NONE);
            if (discard != null) {
                surface.click(discard.selector());
            }
        } catch (RuntimeException e) {
            log.debug("Ignoring failure while dismissing application surface: {}", e.getMessage());
        }
    }

    /**
     * Dismisses the open form only when it was prepared for the given session. Returns whether a
     * dismissal was attempted.
     */
    public boolean dismiss(BrowserSurface surface, ApplicationSession session) {
        if (!session.getId().equals(openFormOwner)) {
            log.debug("Open form does not belong to session {}, leaving it alone", session.getId());
            return false;
        }
        dismiss(surface);
        return true;
    }

    private void openForm(
        BrowserSurface surface,
        ApplicationSession session,
        ProgressListener progress,
        CancellationSignal cancel
    ) {
        openFormOwner = null;
        progress.onProgress("Opening " + session.getJobUrl());
        long started = System.currentTimeMillis();
        surface.navigate(session.getJobUrl());
        session.logAction(ApplicationAction.succeeded(
            ActionTypes.NAVIGATE,
            "Opened job page",
            System.currentTimeMillis() - started
        ));
        pacing.pause(cancel);

        String entry = findEntryPoint(surface);
        if (entry == null) {
            session.logAction(ApplicationAction.failed(ActionTypes.OPEN_APPLICATION, "Apply button not found", session.getJobUrl()));
            session.fail("Apply entry point not found on job page");
            return;
        }
        surface.click(entry);
        session.logAction(ApplicationAction.succeeded(ActionTypes.OPEN_APPLICATION, "Clicked apply entry point"));
        pacing.pause(cancel);

        Duration wait = Duration.ofSeconds(formSettings.getSurfaceWaitSeconds());
        if (!surface.waitForPresent(profile.surfaceSelector(), wait)) {
            session.logAction(ApplicationAction.failed(ActionTypes.OPEN_APPLICATION, "Application form did not appear", null));
            session.fail("Application form did not appear within " + wait.getSeconds() + "s");
        }
    }

    private String findEntryPoint(BrowserSurface surface) {
        for (String selector : profile.entrySelectors()) {
            if (surface.isPresent(selector)) {
                return selector;
            }
        }
        if (profile.entryCaptions().isEmpty()) {
            return null;
        }
        Document document = Jsoup.parse(surface.pageSource());
        NavigationButton entry = inspector.findButton(document, profile.entryCaptions(), NavigationControl.NONE);
        return entry == null ? null : entry.selector();
    }

    private void rewind(BrowserSurface surface, ApplicationSession session, CancellationSignal cancel) {
        for (int step = 0; step < formSettings.getMaxRewindSteps(); step++) {
            Element root = snapshotRoot(surface);
            NavigationButton back = inspector.findBackButton(root);
            if (back == null) {
                return;
            }
            pacing.pause(500, 1000, cancel);
            surface.click(back.selector());
            session.logAction(ApplicationAction.succeeded(ActionTypes.REWIND, "Returned to previous page"));
        }
    }

    private void walkAndSubmit(
        BrowserSurface surface,
        ApplicationSession session,
        ProgressListener progress,
        CancellationSignal cancel
    ) {
        int page = 0;
        while (true) {
            cancel.throwIfCancelled();
            Element root = snapshotRoot(surface);
            if (root == null) {
                session.fail("Application form closed unexpectedly on page " + (page + 1));
                return;
            }
            session.setCurrentPage(page);
            progress.onProgress("Filling page " + (page + 1));
            fillPage(surface, session, root, page, cancel);

            NavigationButton navigation = inspector.classifyNavigation(snapshotRoot(surface));
            if (navigation.control() == NavigationControl.NONE) {
                session.fail("No navigation control found on page " + (page + 1));
                return;
            }
            if (navigation.control() == NavigationControl.SUBMIT) {
                cancel.throwIfCancelled();
                pacing.pause(cancel);
                cancel.throwIfCancelled();
                clickSubmitAndConfirm(surface, session, navigation, progress);
                return;
            }

            pacing.pause(cancel);
            surface.click(navigation.selector());
            session.logAction(ApplicationAction.succeeded(
                navigation.control() == NavigationControl.REVIEW ? ActionTypes.REVIEW : ActionTypes.NEXT_PAGE,
                "Clicked '" + navigation.label() + "' on page " + (page + 1)
            ));
            pacing.pause(cancel);
            String validation = validationError(surface);
            if (validation != null) {
                session.logAction(ApplicationAction.failed(ActionTypes.VALIDATION_ERROR, "Form rejected page " + (page + 1), validation));
                session.fail("Form validation error: " + validation);
                return;
            }
            page++;
            if (page >= formSettings.getMaxPages()) {
                session.fail("Application form exceeded " + formSettings.getMaxPages() + " pages");
                return;
            }
        }
    }

    // Past this point the click has happened; cancellation is no longer honored.
    private void clickSubmitAndConfirm(
        BrowserSurface surface,
        ApplicationSession session,
        NavigationButton submit,
        ProgressListener progress
    ) {
        surface.click(submit.selector());
        session.logAction(ApplicationAction.succeeded(ActionTypes.SUBMIT, "Clicked '" + submit.label() + "'"));
        progress.onProgress("Submitted, waiting for confirmation");

        long waited = 0;
        int pollMs = formSettings.getConfirmationPollMs();
        while (waited < formSettings.getConfirmationWaitMs()) {
            pacing.sleep(pollMs, CancellationSignal.none());
            waited += pollMs;
            if (isConfirmed(surface)) {
                session.logAction(ApplicationAction.succeeded(ActionTypes.CONFIRMATION, "Platform confirmed submission"));
                session.transitionTo(ApplicationSessionStatus.SUBMITTED);
                log.info("Submitted {} application for '{}'", session.getPlatform().displayName(), session.getJobTitle());
                return;
            }
            String validation = validationError(surface);
            if (validation != null) {
                session.logAction(ApplicationAction.failed(ActionTypes.VALIDATION_ERROR, "Form rejected submission", validation));
                session.fail("Form validation error: " + validation);
                return;
            }
        }
        session.logAction(ApplicationAction.failed(ActionTypes.CONFIRMATION, "No confirmation detected", null));
        session.fail("Submission confirmation not detected");
    }

    private void fillPage(
        BrowserSurface surface,
        ApplicationSession session,
        Element root,
        int page,
        CancellationSignal cancel
    ) {
        FieldFiller filler = new FieldFiller(surface, pacing);
        List<Question> recorded = session.getQuestions();
        for (Question live : inspector.inspectPage(root, page)) {
            cancel.throwIfCancelled();
            Question source = match(recorded, live, page);
            if (live.isPreFilled() || (source != null && source.isPreFilled())) {
                continue;
            }
            String answer = answerFor(session, source, live);
            if (answer == null || answer.isBlank()) {
                if (live.getType() == QuestionType.UNKNOWN) {
                    session.logAction(ApplicationAction.failed(ActionTypes.SKIP, "Skipped unclassified field '" + live.getText() + "'", null));
                }
                continue;
            }
            long started = System.currentTimeMillis();
            FieldFiller.Result result = filler.fill(live, answer, cancel);
            long elapsed = System.currentTimeMillis() - started;
            switch (result.outcome()) {
                case FILLED:
                    log.debug("Filled '{}' with {}", live.getText(), result.detail());
                    session.logAction(ApplicationAction.succeeded(ActionTypes.FILL, "Filled '" + live.getText() + "'", elapsed));
                    break;
                case SKIPPED:
                    session.logAction(ApplicationAction.succeeded(ActionTypes.SKIP, "Skipped '" + live.getText() + "': " + result.detail()));
                    break;
                default:
                    session.logAction(ApplicationAction.failed(ActionTypes.SKIP, "Could not fill '" + live.getText() + "'", result.detail()));
                    break;
            }
        }
    }

    private String answerFor(ApplicationSession session, Question source, Question live) {
        String answer = source == null ? null : source.getAnswer();
        if ((answer == null || answer.isBlank())
            && live.getType() == QuestionType.MULTI_LINE_TEXT
            && profile.isMessageField(live.getText())) {
            return session.getApplicationMessage();
        }
        return answer;
    }

    // Same label on another page is a different question.
    static Question match(List<Question> recorded, Question live, int page) {
        for (Question candidate : recorded) {
            if (candidate.getPageIndex() == page && candidate.getText().equals(live.getText())) {
                return candidate;
            }
        }
        return null;
    }

    private boolean isConfirmed(BrowserSurface surface) {
        if (profile.successSelector() != null && surface.isPresent(profile.successSelector())) {
            return true;
        }
        if (profile.successPhrases().isEmpty()) {
            return false;
        }
        Document document = Jsoup.parse(surface.pageSource());
        String text = document.text().toLowerCase(Locale.ROOT);
        for (String phrase : profile.successPhrases()) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private String validationError(BrowserSurface surface) {
        if (profile.errorSelector() == null || !surface.isPresent(profile.errorSelector())) {
            return null;
        }
        String text = surface.text(profile.errorSelector());
        return text == null || text.isBlank() ? "unspecified" : text.trim();
    }

    private Element snapshotRoot(BrowserSurface surface) {
        Document document = Jsoup.parse(surface.pageSource());
        return document.selectFirst(profile.surfaceSelector());
    }

    private final class SurfaceFormPage implements FormPage {
        private final BrowserSurface surface;
        private final ApplicationSession session;
        private final CancellationSignal cancel;

        private SurfaceFormPage(BrowserSurface surface, ApplicationSession session, CancellationSignal cancel) {
            this.surface = surface;
            this.session = session;
            this.cancel = cancel;
        }

        @Override
        public Element snapshot() {
            return snapshotRoot(surface);
        }

        @Override
        public void advance(NavigationButton button) {
            pacing.pause(cancel);
            surface.click(button.selector());
            session.logAction(ApplicationAction.succeeded(
                button.control() == NavigationControl.REVIEW ? ActionTypes.REVIEW : ActionTypes.NEXT_PAGE,
                "Clicked '" + button.label() + "' while detecting"
            ));
            pacing.pause(cancel);
        }
    }
}
