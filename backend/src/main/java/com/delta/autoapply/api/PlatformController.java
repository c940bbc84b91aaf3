package com.delta.autoapply.api;

import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.model.JobDetails;
import com.delta.autoapply.apply.model.JobListing;
import com.delta.autoapply.apply.model.SearchFilter;
import com.delta.autoapply.apply.platform.JobPlatformAdapter;
import com.delta.autoapply.apply.platform.PlatformAdapterRegistry;
import com.delta.autoapply.apply.platform.upwork.UpworkPlatformAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/platforms")
public class PlatformController {
    private static final Logger log = LoggerFactory.getLogger(PlatformController.class);

    private final PlatformAdapterRegistry adapters;
    private final UpworkPlatformAdapter upwork;

    public PlatformController(PlatformAdapterRegistry adapters, UpworkPlatformAdapter upwork) {
        this.adapters = adapters;
        this.upwork = upwork;
    }

    @GetMapping
    public List<PlatformStatusView> platforms() {
        return adapters.all().stream()
            .map(adapter -> new PlatformStatusView(
                adapter.platform().name(),
                adapter.platform().displayName(),
                adapter.isReady()
            ))
            .toList();
    }

    @PostMapping("/{platform}/login")
    public PlatformStatusView openLogin(@PathVariable("platform") String platform) {
        JobPlatformAdapter adapter = adapters.get(platform);
        adapter.openLoginWindow();
        return new PlatformStatusView(adapter.platform().name(), adapter.platform().displayName(), adapter.isReady());
    }

    @PostMapping("/{platform}/login/check")
    public PlatformStatusView checkLogin(@PathVariable("platform") String platform) {
        JobPlatformAdapter adapter = adapters.get(platform);
        boolean ready = adapter.checkLoginStatus();
        return new PlatformStatusView(adapter.platform().name(), adapter.platform().displayName(), ready);
    }

    @PostMapping("/{platform}/search")
    public List<JobListing> search(
        @PathVariable("platform") String platform,
        @RequestBody(required = false) SearchFilter filter
    ) {
        JobPlatformAdapter adapter = adapters.get(platform);
        SearchFilter safeFilter = filter == null ? new SearchFilter(null, null, null, false, null) : filter;
        if (safeFilter.keywords().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "keywords are required");
        }
        return adapter.searchJobs(
            safeFilter,
            message -> log.debug("{} search: {}", adapter.platform().displayName(), message),
            CancellationSignal.none()
        );
    }

    @GetMapping("/upwork/connects")
    public ConnectsBalanceView upworkConnects() {
        return ConnectsBalanceView.of(upwork.connectsBalance());
    }

    @GetMapping("/{platform}/details")
    public JobDetails details(
        @PathVariable("platform") String platform,
        @RequestParam(name = "url") String url
    ) {
        JobDetails details = adapters.get(platform).fetchJobDetails(url);
        if (details == null) {
            throw new ResponseStatusException(NOT_FOUND, "Job details unavailable for " + url);
        }
        return details;
    }
}
