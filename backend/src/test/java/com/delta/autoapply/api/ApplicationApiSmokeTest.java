package com.delta.autoapply.api;

import com.delta.autoapply.apply.browser.BrowserSurfaceFactory;
import com.delta.autoapply.apply.browser.FakeBrowserSurface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private BrowserSurfaceFactory surfaceFactory;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        when(surfaceFactory.open(any())).thenAnswer(invocation -> new FakeBrowserSurface()
            .screen("https://www.linkedin.com/feed/", "<html><body><form class=\"login\"></form></body></html>"));
    }

    @Test
    void listsBothPlatforms() throws Exception {
        mockMvc.perform(get("/api/platforms"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].platform").value("LINKEDIN"))
            .andExpect(jsonPath("$[1].displayName").value("Upwork"));
    }

    @Test
    void unknownPlatformIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/platforms/indeed/login/check"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("unsupported_platform"));
    }

    @Test
    void searchRequiresKeywords() throws Exception {
        mockMvc.perform(post("/api/platforms/linkedin/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keywords\": \"  \"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/applications/" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_session"));
    }

    @Test
    void startingAnApplicationRequiresAUrl() throws Exception {
        mockMvc.perform(post("/api/applications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"platform\": \"LINKEDIN\", \"title\": \"Backend Engineer\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void startedApplicationIsAcceptedAndListed() throws Exception {
        mockMvc.perform(post("/api/applications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"platform": "LINKEDIN", "externalJobId": "4012", "title": "Backend Engineer",
                     "company": "Acme", "applicationUrl": "https://www.linkedin.com/jobs/view/4012/"}
                    """))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.id").isNotEmpty())
            .andExpect(jsonPath("$.jobTitle").value("Backend Engineer"));

        mockMvc.perform(get("/api/applications"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.externalJobId == '4012')]").exists());
    }

    @Test
    void approvingWithMalformedQuestionIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/applications/" + UUID.randomUUID() + "/approve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"answers\": {\"not-a-uuid\": \"5\"}}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void connectsBalanceIsUnknownWithoutUpworkLogin() throws Exception {
        mockMvc.perform(get("/api/platforms/upwork/connects"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.known").value(false));
    }

    @Test
    void unreachableAiEndpointFailsKeyValidation() throws Exception {
        mockMvc.perform(post("/api/ai/validate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    void summaryNeedsADescriptionAndAReachableModel() throws Exception {
        mockMvc.perform(post("/api/ai/summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/ai/summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobDescription\": \"Spring Boot services\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("ai_unavailable"));
    }

    @Test
    void cancellingAnUnknownSessionIsNotFound() throws Exception {
        mockMvc.perform(post("/api/applications/" + UUID.randomUUID() + "/cancel"))
            .andExpect(status().isNotFound());
    }
}
