package com.delta.autoapply.apply.platform.linkedin;

import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.SearchFilter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class LinkedInPageParser {
    static final String BASE_URL = "https://www.linkedin.com";
    private static final int RESULTS_PER_PAGE = 25;

    private static final Pattern JOB_ID = Pattern.compile("/view/(\\d+)");
    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static final String CARD_SELECTOR =
        "li[data-occludable-job-id], .job-card-container, .jobs-search-results__list-item, .base-card";
    private static final String TITLE_SELECTOR =
        ".job-card-list__title, .job-card-container__link, .base-search-card__title";
    private static final String COMPANY_SELECTOR =
        ".job-card-container__primary-description, .artdeco-entity-lockup__subtitle, .base-search-card__subtitle";
    private static final String LOCATION_SELECTOR =
        ".job-card-container__metadata-item, .artdeco-entity-lockup__caption, .job-search-card__location";
    private static final String DESCRIPTION_SELECTOR =
        ".jobs-description__content, .jobs-box__html-content, .description__text";
    private static final String APPLY_BUTTON_SELECTOR = ".jobs-apply-button, button.jobs-apply-button--top-card";
    private static final String INSIGHT_SELECTOR =
        ".job-details-jobs-unified-top-card__job-insight, .description__job-criteria-item, .jobs-unified-top-card__job-insight";
    private static final String SKILL_SELECTOR =
        ".job-details-skill-match-status-list__text, .job-details-how-you-match__skills-item-subtitle, .job-skill";
    private static final List<String> EXPERIENCE_LEVELS =
        List.of("internship", "entry level", "associate", "mid-senior level", "director", "executive");

    public static String buildSearchUrl(SearchFilter filter, int pageIndex) {
        StringBuilder url = new StringBuilder(BASE_URL).append("/jobs/search/?keywords=")
            .append(encode(filter.keywords()));
        if (!filter.primaryLocation().isBlank()) {
            url.append("&location=").append(encode(filter.primaryLocation()));
        }
        if (filter.remoteOnly()) {
            url.append("&f_WT=2");
        }
        List<String> levels = new ArrayList<>();
        for (String level : filter.experienceLevels()) {
            String code = experienceCode(level);
            if (code != null && !levels.contains(code)) {
                levels.add(code);
            }
        }
        if (!levels.isEmpty()) {
            url.append("&f_E=").append(encode(String.join(",", levels)));
        }
        if (pageIndex > 0) {
            url.append("&start=").append(pageIndex * RESULTS_PER_PAGE);
        }
        return url.toString();
    }

    public static String extractJobId(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = JOB_ID.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    public List<JobListing> parseSearchResults(String html) {
        List<JobListing> listings = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return listings;
        }
        Document document = Jsoup.parse(html, BASE_URL);
        Set<String> seen = new LinkedHashSet<>();
        for (Element card : document.select(CARD_SELECTOR)) {
            String jobId = firstNonBlank(card.attr("data-occludable-job-id"), card.attr("data-job-id"));
            Element link = card.selectFirst("a[href*=/jobs/view/]");
            if (jobId == null && link != null) {
                jobId = extractJobId(link.attr("href"));
            }
            if (jobId == null || !seen.add(jobId)) {
                continue;
            }
            String title = textOf(card, TITLE_SELECTOR);
            if (title == null && link != null) {
                title = link.text().trim();
            }
            if (title == null || title.isBlank()) {
                continue;
            }
            listings.add(new JobListing(
                Platform.LINKEDIN,
                jobId,
                title,
                textOf(card, COMPANY_SELECTOR),
                textOf(card, LOCATION_SELECTOR),
                BASE_URL + "/jobs/view/" + jobId + "/",
                null
            ));
        }
        return listings;
    }

    public JobDetails parseJobDetails(String html) {
        Document document = Jsoup.parse(html == null ? "" : html, BASE_URL);
        Element descriptionElement = document.selectFirst(DESCRIPTION_SELECTOR);
        String description = descriptionElement == null ? "" : descriptionElement.wholeText().trim();

        String email = null;
        Matcher matcher = EMAIL.matcher(description);
        if (matcher.find()) {
            email = matcher.group();
        }

        boolean quickApply = false;
        String externalUrl = null;
        for (Element button : document.select(APPLY_BUTTON_SELECTOR)) {
            String caption = (button.text() + " " + button.attr("aria-label")).toLowerCase(Locale.ROOT);
            if (caption.contains("easy apply")) {
                quickApply = true;
            } else if (button.hasAttr("href")) {
                externalUrl = button.absUrl("href");
            }
        }

        String level = null;
        for (Element insight : document.select(INSIGHT_SELECTOR)) {
            String text = insight.text().toLowerCase(Locale.ROOT);
            for (String candidate : EXPERIENCE_LEVELS) {
                if (text.contains(candidate)) {
                    level = candidate;
                    break;
                }
            }
            if (level != null) {
                break;
            }
        }

        List<String> skills = new ArrayList<>();
        for (Element skill : document.select(SKILL_SELECTOR)) {
            String text = skill.text().trim();
            if (!text.isEmpty() && !skills.contains(text)) {
                skills.add(text);
            }
        }
        return new JobDetails(description, email, externalUrl, quickApply, level, skills, null, null);
    }

    private static String experienceCode(String level) {
        String normalized = level == null ? "" : level.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "internship":
                return "1";
            case "entry":
            case "entry level":
                return "2";
            case "associate":
                return "3";
            case "mid":
            case "mid-senior":
            case "mid-senior level":
            case "senior":
                return "4";
            case "director":
                return "5";
            case "executive":
                return "6";
            default:
                return null;
        }
    }

    private static String textOf(Element root, String selector) {
        Element element = root.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
