package com.delta.autoapply.apply.browser;

import com.delta.autoapply.apply.model.Platform;

@FunctionalInterface
public interface BrowserSurfaceFactory {
    BrowserSurface open(Platform platform);
}
