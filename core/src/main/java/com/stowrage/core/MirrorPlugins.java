package com.stowrage.core;

import java.util.ServiceLoader;

/**
 * Locates the default {@link MirrorPlugin} registered under {@code META-INF/services}.
 */
public final class MirrorPlugins {

    private MirrorPlugins() {
    }

    public static MirrorPlugin load() {
        return ServiceLoader.load(MirrorPlugin.class)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No " + MirrorPlugin.class.getName() + " registered on the class path"));
    }
}
