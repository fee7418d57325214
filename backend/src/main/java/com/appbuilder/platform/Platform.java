package com.appbuilder.platform;

import java.util.List;

/**
 * Host capabilities the build tooling depends on: executable naming and command lookup.
 * Resolved once at startup and injected, so nothing else branches on the OS name.
 */
public interface Platform {

    String name();

    /** File name of a tool launcher, e.g. {@code flutter} or {@code flutter.bat}. */
    String executableName(String tool);

    /** Command that locates {@code tool} on the PATH, exiting 0 when found. */
    List<String> lookupCommand(String tool);

    static Platform current() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.startsWith("windows") ? new WindowsPlatform() : new UnixPlatform();
    }
}
