package com.delta.autoapply.apply.form;

import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.flow.ProgressListener;
import com.delta.autoapply.apply.model.Question;
import com.delta.autoapply.apply.model.QuestionType;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns snapshots of an application surface into typed {@link Question}s and decides how to leave
 * each page. Detection never fails: anything it cannot classify becomes an UNKNOWN question.
 */
public class FormInspector {
    private static final Logger log = LoggerFactory.getLogger(FormInspector.class);

    private static final Set<String> SINGLE_LINE_TYPES = Set.of("", "text", "tel", "email", "number", "date", "url", "search");
    private static final Set<String> NON_FIELD_INPUT_TYPES = Set.of("hidden", "submit", "button", "reset", "image");
    private static final String CONTROL_SELECTOR = "input, textarea, select";

    private final FormLayout layout;
    private final int maxPages;
    private final int minLabelLength;

    public FormInspector(FormLayout layout, int maxPages, int minLabelLength) {
        this.layout = layout;
        this.maxPages = Math.max(1, maxPages);
        this.minLabelLength = Math.max(1, minLabelLength);
    }

    public FormLayout layout() {
        return layout;
    }

    /**
     * Walks the form page by page without filling anything. Stops on a submit page, on a page with
     * no navigation, when the surface disappears, or at the page cap.
     */
    public FormScan scan(FormPage page, ProgressListener progress, CancellationSignal cancel) {
        List<Question> questions = new ArrayList<>();
        int pageIndex = 0;
        boolean capped = false;
        NavigationControl lastControl = NavigationControl.NONE;
        while (true) {
            cancel.throwIfCancelled();
            Element root = page.snapshot();
            if (root == null) {
                log.info("Application surface disappeared on page {}", pageIndex + 1);
                break;
            }
            List<Question> found = inspectPage(root, pageIndex);
            questions.addAll(found);
            NavigationButton navigation = classifyNavigation(root);
            lastControl = navigation.control();
            progress.onProgress("Page " + (pageIndex + 1) + ": " + found.size() + " question(s), next control " + lastControl);
            if (navigation.isTerminalPage()) {
                break;
            }
            if (pageIndex + 1 >= maxPages) {
                capped = true;
                log.warn("Stopped form scan at page cap {}", maxPages);
                break;
            }
            page.advance(navigation);
            pageIndex++;
        }
        return new FormScan(questions, pageIndex + 1, capped, lastControl);
    }

    public List<Question> inspectPage(Element root, int pageIndex) {
        List<Question> questions = new ArrayList<>();
        if (root == null) {
            return questions;
        }
        for (Element group : fieldGroups(root)) {
            Question question = inspectGroup(group, pageIndex);
            if (question != null) {
                questions.add(question);
            }
        }
        return questions;
    }

    /**
     * Exactly one control, by priority SUBMIT, REVIEW, NEXT. Hidden and disabled buttons are ignored.
     */
    public NavigationButton classifyNavigation(Element root) {
        if (root == null) {
            return NavigationButton.none();
        }
        NavigationButton submit = findButton(root, layout.submitKeywords(), NavigationControl.SUBMIT);
        if (submit != null) {
            return submit;
        }
        NavigationButton review = findButton(root, layout.reviewKeywords(), NavigationControl.REVIEW);
        if (review != null) {
            return review;
        }
        NavigationButton next = findButton(root, layout.nextKeywords(), NavigationControl.NEXT);
        if (next != null) {
            return next;
        }
        return NavigationButton.none();
    }

    public NavigationButton findBackButton(Element root) {
        if (root == null) {
            return null;
        }
        return findButton(root, layout.backKeywords(), NavigationControl.NONE);
    }

    /**
     * First visible button whose text or aria-label contains one of the keywords.
     */
    public NavigationButton findButton(Element root, List<String> keywords, NavigationControl control) {
        for (Element button : root.select(layout.buttonSelector())) {
            if (isHidden(button)) {
                continue;
            }
            String caption = buttonCaption(button);
            for (String keyword : keywords) {
                if (!keyword.isEmpty() && caption.contains(keyword)) {
                    return new NavigationButton(control, button.cssSelector(), button.text().trim());
                }
            }
        }
        return null;
    }

    private List<Element> fieldGroups(Element root) {
        Elements groups = layout.fieldGroupSelector() == null || layout.fieldGroupSelector().isBlank()
            ? new Elements()
            : root.select(layout.fieldGroupSelector());
        List<Element> result = new ArrayList<>();
        for (Element group : groups) {
            // Nested matches would report the same control twice.
            if (!hasMatchingAncestor(group, groups)) {
                result.add(group);
            }
        }
        if (!result.isEmpty()) {
            return result;
        }
        return controlGroups(root);
    }

    // Without group markup every control stands alone, except radios and checkboxes sharing a name.
    private List<Element> controlGroups(Element root) {
        List<Element> result = new ArrayList<>();
        Set<String> seenNames = new LinkedHashSet<>();
        for (Element control : root.select(CONTROL_SELECTOR)) {
            String type = inputType(control);
            if ("input".equals(control.normalName()) && NON_FIELD_INPUT_TYPES.contains(type)) {
                continue;
            }
            if ("radio".equals(type) || "checkbox".equals(type)) {
                String name = control.attr("name");
                if (!name.isBlank()) {
                    if (!seenNames.add(name)) {
                        continue;
                    }
                    Element fieldset = control.closest("fieldset");
                    if (fieldset != null) {
                        result.add(fieldset);
                        continue;
                    }
                }
            }
            Element parent = control.parent();
            result.add(parent == null ? control : parent);
        }
        return result;
    }

    private boolean hasMatchingAncestor(Element element, Elements candidates) {
        for (Element ancestor : element.parents()) {
            if (candidates.contains(ancestor)) {
                return true;
            }
        }
        return false;
    }

    private Question inspectGroup(Element group, int pageIndex) {
        List<Element> controls = new ArrayList<>();
        for (Element control : group.select(CONTROL_SELECTOR)) {
            if ("input".equals(control.normalName()) && NON_FIELD_INPUT_TYPES.contains(inputType(control))) {
                continue;
            }
            controls.add(control);
        }

        String label = labelFor(group, controls);
        if (label.length() < minLabelLength) {
            return null;
        }
        boolean required = label.endsWith("*");
        if (required) {
            label = label.substring(0, label.length() - 1).trim();
        }

        Element textInput = firstOfType(controls, SINGLE_LINE_TYPES);
        if (textInput != null) {
            return textQuestion(label, textInputType(textInput), textInput, required, pageIndex);
        }
        Element textarea = firstByTag(controls, "textarea");
        if (textarea != null) {
            return textQuestion(label, QuestionType.MULTI_LINE_TEXT, textarea, required, pageIndex);
        }
        Element select = firstByTag(controls, "select");
        if (select != null) {
            return selectQuestion(label, select, required, pageIndex);
        }
        List<Element> radios = allOfType(controls, "radio");
        if (!radios.isEmpty()) {
            return optionGroupQuestion(label, group, radios, true, required, pageIndex);
        }
        List<Element> checkboxes = allOfType(controls, "checkbox");
        if (!checkboxes.isEmpty()) {
            return optionGroupQuestion(label, group, checkboxes, false, required, pageIndex);
        }
        Element file = firstOfType(controls, Set.of("file"));
        if (file != null || group.selectFirst(layout.attachedFileSelector()) != null) {
            return fileQuestion(label, group, file, required, pageIndex);
        }
        if (controls.isEmpty()) {
            return null;
        }
        log.debug("Unclassified field '{}' on page {}", label, pageIndex + 1);
        Element control = controls.get(0);
        return new Question(
            label,
            QuestionType.UNKNOWN,
            List.of(),
            required || isRequired(control),
            false,
            null,
            pageIndex,
            CssFieldReference.of(control.cssSelector()),
            null
        );
    }

    private Question textQuestion(String label, QuestionType type, Element control, boolean required, int pageIndex) {
        String value = LiveState.value(control);
        boolean preFilled = value != null && !value.isBlank();
        return new Question(
            label,
            type,
            List.of(),
            required || isRequired(control),
            preFilled,
            preFilled ? value.trim() : null,
            pageIndex,
            CssFieldReference.of(control.cssSelector()),
            parseMaxLength(control)
        );
    }

    private Question selectQuestion(String label, Element select, boolean required, int pageIndex) {
        List<String> options = new ArrayList<>();
        String selected = null;
        for (Element option : select.select("option")) {
            String text = option.text().trim();
            if (isPlaceholderOption(option, text)) {
                continue;
            }
            options.add(text);
            if (LiveState.isSelected(option) && selected == null) {
                selected = text;
            }
        }
        boolean preFilled = selected != null;
        return new Question(
            label,
            QuestionType.SINGLE_SELECT,
            options,
            required || isRequired(select),
            preFilled,
            selected,
            pageIndex,
            CssFieldReference.of(select.cssSelector()),
            null
        );
    }

    private Question optionGroupQuestion(
        String label,
        Element group,
        List<Element> inputs,
        boolean radio,
        boolean required,
        int pageIndex
    ) {
        Map<String, String> optionSelectors = new LinkedHashMap<>();
        List<String> checked = new ArrayList<>();
        boolean anyRequired = required;
        for (Element input : inputs) {
            String optionLabel = optionLabel(group, input);
            if (optionLabel.isEmpty() || optionSelectors.containsKey(optionLabel)) {
                continue;
            }
            optionSelectors.put(optionLabel, input.cssSelector());
            if (LiveState.isChecked(input)) {
                checked.add(optionLabel);
            }
            anyRequired = anyRequired || isRequired(input);
        }
        List<String> options = new ArrayList<>(optionSelectors.keySet());
        QuestionType type;
        if (radio) {
            type = ChoiceMatcher.isBooleanPair(options) ? QuestionType.BOOLEAN : QuestionType.CHOICE;
        } else {
            type = QuestionType.CHECKBOX_GROUP;
        }
        boolean preFilled = !checked.isEmpty();
        return new Question(
            label,
            type,
            options,
            anyRequired,
            preFilled,
            preFilled ? String.join(", ", checked) : null,
            pageIndex,
            new CssFieldReference(inputs.get(0).cssSelector(), optionSelectors),
            null
        );
    }

    private Question fileQuestion(String label, Element group, Element file, boolean required, int pageIndex) {
        Element attached = group.selectFirst(layout.attachedFileSelector());
        boolean preFilled = attached != null && !attached.text().isBlank();
        Element anchor = file == null ? group : file;
        return new Question(
            label,
            QuestionType.FILE_UPLOAD,
            List.of(),
            required || (file != null && isRequired(file)),
            preFilled,
            preFilled ? attached.text().trim() : null,
            pageIndex,
            CssFieldReference.of(anchor.cssSelector()),
            null
        );
    }

    private String labelFor(Element group, List<Element> controls) {
        Element label = layout.labelSelector() == null ? null : group.selectFirst(layout.labelSelector());
        if (label != null && !label.text().isBlank()) {
            return collapse(label.text());
        }
        for (Element control : controls) {
            String id = control.id();
            if (!id.isEmpty() && group.ownerDocument() != null) {
                for (Element byFor : group.ownerDocument().select("label[for]")) {
                    if (id.equals(byFor.attr("for")) && !byFor.text().isBlank()) {
                        return collapse(byFor.text());
                    }
                }
            }
            if (!control.attr("aria-label").isBlank()) {
                return collapse(control.attr("aria-label"));
            }
            if (!control.attr("placeholder").isBlank()) {
                return collapse(control.attr("placeholder"));
            }
        }
        return "";
    }

    private String optionLabel(Element group, Element input) {
        String id = input.id();
        if (!id.isEmpty()) {
            for (Element label : group.select("label")) {
                if (id.equals(label.attr("for"))) {
                    return collapse(label.text());
                }
            }
        }
        Element wrapping = input.closest("label");
        if (wrapping != null && !wrapping.text().isBlank()) {
            return collapse(wrapping.text());
        }
        if (!input.attr("aria-label").isBlank()) {
            return collapse(input.attr("aria-label"));
        }
        return collapse(input.attr("value"));
    }

    private boolean isPlaceholderOption(Element option, String text) {
        if (text.isEmpty()) {
            return true;
        }
        if (option.hasAttr("value") && option.attr("value").isEmpty()) {
            return true;
        }
        return layout.placeholderOptions().contains(text.toLowerCase(Locale.ROOT));
    }

    private QuestionType textInputType(Element input) {
        switch (inputType(input)) {
            case "tel":
                return QuestionType.PHONE;
            case "email":
                return QuestionType.EMAIL;
            case "number":
                return QuestionType.NUMERIC;
            case "date":
                return QuestionType.DATE;
            default:
                return QuestionType.SHORT_TEXT;
        }
    }

    private Element firstOfType(List<Element> controls, Set<String> types) {
        for (Element control : controls) {
            if ("input".equals(control.normalName()) && types.contains(inputType(control))) {
                return control;
            }
        }
        return null;
    }

    private List<Element> allOfType(List<Element> controls, String type) {
        List<Element> matches = new ArrayList<>();
        for (Element control : controls) {
            if ("input".equals(control.normalName()) && type.equals(inputType(control))) {
                matches.add(control);
            }
        }
        return matches;
    }

    private Element firstByTag(List<Element> controls, String tag) {
        for (Element control : controls) {
            if (tag.equals(control.normalName())) {
                return control;
            }
        }
        return null;
    }

    private static String inputType(Element control) {
        return control.attr("type").trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isRequired(Element control) {
        return control.hasAttr("required") || "true".equalsIgnoreCase(control.attr("aria-required"));
    }

    private static Integer parseMaxLength(Element control) {
        String raw = control.attr("maxlength").trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String buttonCaption(Element button) {
        String text = button.text() + " " + button.attr("aria-label") + " " + button.attr("value");
        return collapse(text).toLowerCase(Locale.ROOT);
    }

    static boolean isHidden(Element element) {
        for (Element current = element; current != null; current = current.parent()) {
            if (current.hasAttr("hidden")
                || current.hasAttr("disabled")
                || "true".equalsIgnoreCase(current.attr("aria-hidden"))) {
                return true;
            }
            String style = current.attr("style").replace(" ", "").toLowerCase(Locale.ROOT);
            if (style.contains("display:none") || style.contains("visibility:hidden")) {
                return true;
            }
        }
        return false;
    }

    private static String collapse(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
