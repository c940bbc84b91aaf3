package com.delta.autoapply.apply.platform;

import com.delta.autoapply.apply.model.Platform;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PlatformAdapterRegistry {
    private final Map<Platform, JobPlatformAdapter> adapters = new EnumMap<>(Platform.class);

    public PlatformAdapterRegistry(List<JobPlatformAdapter> adapters) {
        for (JobPlatformAdapter adapter : adapters) {
            JobPlatformAdapter previous = this.adapters.put(adapter.platform(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.platform());
            }
        }
    }

    public JobPlatformAdapter get(Platform platform) {
        JobPlatformAdapter adapter = platform == null ? null : adapters.get(platform);
        if (adapter == null) {
            throw new UnsupportedPlatformException("No automation adapter for platform " + platform);
        }
        return adapter;
    }

    public JobPlatformAdapter get(String platformName) {
        Platform platform = Platform.fromValue(platformName);
        if (platform == null) {
            throw new UnsupportedPlatformException("Unknown platform: " + platformName);
        }
        return get(platform);
    }

    public List<JobPlatformAdapter> all() {
        return new ArrayList<>(adapters.values());
    }
}
