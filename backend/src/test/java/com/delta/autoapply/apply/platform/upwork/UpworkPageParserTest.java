package com.delta.autoapply.apply.platform.upwork;

import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.Platform;
import com.delta.autoapply.apply.model.SearchFilter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UpworkPageParserTest {
    private final UpworkPageParser parser = new UpworkPageParser();

    @Test
    void buildsSearchUrl() {
        SearchFilter filter = new SearchFilter("react native", List.of(), List.of(), false, 20);

        assertThat(UpworkPageParser.buildSearchUrl(filter, 0))
            .isEqualTo("https://www.upwork.com/nx/search/jobs/?q=react+native");
        assertThat(UpworkPageParser.buildSearchUrl(filter, 1))
            .isEqualTo("https://www.upwork.com/nx/search/jobs/?q=react+native&page=2");
    }

    @Test
    void extractsCipherJobId() {
        assertThat(UpworkPageParser.extractJobId("https://www.upwork.com/jobs/Build-API_~01abc23def/"))
            .isEqualTo("01abc23def");
        assertThat(UpworkPageParser.extractJobId("https://www.upwork.com/nx/find-work/")).isNull();
    }

    @Test
    void parsesJobTiles() {
        String html = """
            <section>
              <article data-test="JobTile">
                <h2><a data-test="job-tile-title-link" href="/jobs/Spring-Boot-API_~01aa/">Spring Boot API</a></h2>
                <div data-test="location">Canada</div>
                <p data-test="JobDescription">Need a REST API</p>
                <span data-test="connects-required">Send a proposal for: 16 Connects</span>
              </article>
              <article data-test="JobTile"><h2><a href="/jobs/Other_~01aa/">Duplicate</a></h2></article>
              <article data-test="JobTile"><p>No link</p></article>
            </section>
            """;

        List<JobListing> listings = parser.parseSearchResults(html);

        assertThat(listings).hasSize(1);
        JobListing listing = listings.get(0);
        assertThat(listing.platform()).isEqualTo(Platform.UPWORK);
        assertThat(listing.externalJobId()).isEqualTo("01aa");
        assertThat(listing.applicationUrl()).isEqualTo("https://www.upwork.com/jobs/Spring-Boot-API_~01aa/");
        assertThat(listing.location()).isEqualTo("Canada");
        assertThat(listing.description()).isEqualTo("Need a REST API");
        assertThat(listing.connectsRequired()).isEqualTo(16);
    }

    @Test
    void parsesJobDetails() {
        JobDetails details = parser.parseJobDetails("""
            <div data-test="Description">Migrate our backend to Java 17.</div>
            <span data-test="Skill">Java</span><span data-test="Skill">Spring Boot</span>
            <div data-test="duration">1 to 3 months</div>
            <div data-test="experience-level">Expert</div>
            """);

        assertThat(details.description()).isEqualTo("Migrate our backend to Java 17.");
        assertThat(details.requiredSkills()).containsExactly("Java", "Spring Boot");
        assertThat(details.projectDuration()).isEqualTo("1 to 3 months");
        assertThat(details.experienceLevel()).isEqualTo("Expert");
        assertThat(details.quickApply()).isFalse();
        assertThat(details.connectsRequired()).isNull();
    }

    @Test
    void readsConnectsCostFromDetailsPage() {
        JobDetails details = parser.parseJobDetails("""
            <div data-test="Description">Short task.</div>
            <div class="sidebar"><span>Connects balance shown at checkout</span><span>8 required connects</span></div>
            """);

        assertThat(details.connectsRequired()).isEqualTo(8);
    }

    @Test
    void parsesConnectsCostText() {
        assertThat(UpworkPageParser.parseConnectsRequired("Send a proposal for: 12 Connects")).isEqualTo(12);
        assertThat(UpworkPageParser.parseConnectsRequired("Costs 6 connects")).isEqualTo(6);
        assertThat(UpworkPageParser.parseConnectsRequired("Payment verified")).isNull();
        assertThat(UpworkPageParser.parseConnectsRequired(null)).isNull();
    }

    @Test
    void parsesConnectsBalance() {
        assertThat(parser.parseConnectsBalance("<div class=\"connects-balance\">Balance: 73 Connects</div>")).isEqualTo(73);
        assertThat(parser.parseConnectsBalance("<div>No balance here</div>")).isNull();
    }
}
