package com.delta.autoapply.apply.platform.upwork;

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
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class UpworkPageParser {
    static final String BASE_URL = "https://www.upwork.com";

    private static final Pattern JOB_ID = Pattern.compile("~([a-zA-Z0-9]+)");
    private static final Pattern CONNECTS = Pattern.compile("(\\d+)\\s*(?:required\\s+)?connects", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+)");

    private static final String TILE_SELECTOR = "article[data-test='JobTile'], section.job-tile, article.job-tile";
    private static final String TITLE_LINK_SELECTOR = "[data-test='job-tile-title-link'], h2 a, .job-tile-title a";
    private static final String CLIENT_LOCATION_SELECTOR = "[data-test='location'], .client-location";
    private static final String SNIPPET_SELECTOR = "[data-test='JobDescription'], [data-test='UpCLineClamp JobDescription'], .job-description";
    private static final String DESCRIPTION_SELECTOR = "[data-test='Description'], .job-description, [data-test='job-description-text']";
    private static final String SKILL_SELECTOR = "[data-test='Skill'], .skills-list .air3-token, [data-test='token']";
    private static final String DURATION_SELECTOR = "[data-test='duration'], [data-test='Duration'], .duration";
    private static final String LEVEL_SELECTOR = "[data-test='experience-level'], [data-test='ExperienceLevel'], .contractor-tier";
    private static final String CONNECTS_COST_SELECTOR = "[data-test='connects-required'], [data-test='ConnectsRequired'], span:containsOwn(connects), div:containsOwn(connects)";
    private static final String CONNECTS_BALANCE_SELECTOR = "[data-test='connects-balance'], [data-test='ConnectsBalance'], .connects-balance";

    public static String buildSearchUrl(SearchFilter filter, int pageIndex) {
        StringBuilder url = new StringBuilder(BASE_URL).append("/nx/search/jobs/?q=")
            .append(URLEncoder.encode(filter.keywords(), StandardCharsets.UTF_8));
        if (pageIndex > 0) {
            url.append("&page=").append(pageIndex + 1);
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

    /**
     * Reads a Connects cost such as "Send a proposal for: 16 Connects". Null when the text names none.
     */
    public static Integer parseConnectsRequired(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = CONNECTS.matcher(text);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * Reads the account's available Connects from a page that shows the balance. Null when the
     * page has no balance marker.
     */
    public Integer parseConnectsBalance(String html) {
        Document document = Jsoup.parse(html == null ? "" : html, BASE_URL);
        Element balance = document.selectFirst(CONNECTS_BALANCE_SELECTOR);
        if (balance == null) {
            return null;
        }
        Matcher matcher = FIRST_NUMBER.matcher(balance.text());
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    public List<JobListing> parseSearchResults(String html) {
        List<JobListing> listings = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return listings;
        }
        Document document = Jsoup.parse(html, BASE_URL);
        Set<String> seen = new LinkedHashSet<>();
        for (Element tile : document.select(TILE_SELECTOR)) {
            Element link = tile.selectFirst(TITLE_LINK_SELECTOR);
            if (link == null) {
                continue;
            }
            String href = link.absUrl("href");
            String jobId = extractJobId(href);
            if (jobId == null || !seen.add(jobId)) {
                continue;
            }
            Element location = tile.selectFirst(CLIENT_LOCATION_SELECTOR);
            Element snippet = tile.selectFirst(SNIPPET_SELECTOR);
            listings.add(new JobListing(
                Platform.UPWORK,
                jobId,
                link.text().trim(),
                "Upwork client",
                location == null ? null : location.text().trim(),
                href,
                snippet == null ? null : snippet.text().trim(),
                connectsIn(tile)
            ));
        }
        return listings;
    }

    public JobDetails parseJobDetails(String html) {
        Document document = Jsoup.parse(html == null ? "" : html, BASE_URL);
        Element description = document.selectFirst(DESCRIPTION_SELECTOR);
        List<String> skills = new ArrayList<>();
        for (Element skill : document.select(SKILL_SELECTOR)) {
            String text = skill.text().trim();
            if (!text.isEmpty() && !skills.contains(text)) {
                skills.add(text);
            }
        }
        Element duration = document.selectFirst(DURATION_SELECTOR);
        Element level = document.selectFirst(LEVEL_SELECTOR);
        return new JobDetails(
            description == null ? "" : description.wholeText().trim(),
            null,
            null,
            false,
            level == null ? null : level.text().trim(),
            skills,
            duration == null ? null : duration.text().trim(),
            connectsIn(document)
        );
    }

    private static Integer connectsIn(Element scope) {
        for (Element candidate : scope.select(CONNECTS_COST_SELECTOR)) {
            Integer connects = parseConnectsRequired(candidate.text());
            if (connects != null) {
                return connects;
            }
        }
        return null;
    }
}
