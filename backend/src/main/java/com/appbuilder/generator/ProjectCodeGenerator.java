package com.appbuilder.generator;

import com.appbuilder.model.Project;

import java.util.Map;

/**
 * Produces the Flutter sources of a project as relative path to file content.
 * Implementations may throw; the build pipeline turns that into a failed build.
 */
public interface ProjectCodeGenerator {

    Map<String, String> generate(Project project);
}
