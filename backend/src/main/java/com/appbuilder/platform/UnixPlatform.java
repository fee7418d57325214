package com.appbuilder.platform;

import java.util.List;

public class UnixPlatform implements Platform {

    @Override
    public String name() {
        return "unix";
    }

    @Override
    public String executableName(String tool) {
        return tool;
    }

    @Override
    public List<String> lookupCommand(String tool) {
        return List.of("which", tool);
    }
}
