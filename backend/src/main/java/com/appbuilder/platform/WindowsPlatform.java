package com.appbuilder.platform;

import java.util.List;

public class WindowsPlatform implements Platform {

    @Override
    public String name() {
        return "windows";
    }

    // SDK launchers ship as batch files on Windows
    @Override
    public String executableName(String tool) {
        return tool + ".bat";
    }

    @Override
    public List<String> lookupCommand(String tool) {
        return List.of("where", tool);
    }
}
