package com.appbuilder.generator;

import com.appbuilder.model.Project;
import com.appbuilder.toolchain.FlutterBuilder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default generator: a single-screen app showing the project name.
 */
@Component
public class FlutterSkeletonGenerator implements ProjectCodeGenerator {

    @Override
    public Map<String, String> generate(Project project) {
        String dartName = FlutterBuilder.projectNameOf(project.getPackageName());
        String title = project.getName().replace("'", "\\'");

        Map<String, String> files = new LinkedHashMap<>();
        files.put("pubspec.yaml", """
                name: %s
                description: %s
                publish_to: 'none'
                version: 1.0.0+1

                environment:
                  sdk: '>=3.0.0 <4.0.0'

                dependencies:
                  flutter:
                    sdk: flutter

                dev_dependencies:
                  flutter_lints: ^3.0.0

                flutter:
                  uses-material-design: true
                """.formatted(dartName, yamlEscape(project.getDescription())));
        files.put("analysis_options.yaml", """
                include: package:flutter_lints/flutter.yaml
                """);
        files.put("lib/main.dart", """
                import 'package:flutter/material.dart';

                void main() => runApp(const GeneratedApp());

                class GeneratedApp extends StatelessWidget {
                  const GeneratedApp({super.key});

                  @override
                  Widget build(BuildContext context) {
                    return MaterialApp(
                      title: '%1$s',
                      home: Scaffold(
                        appBar: AppBar(title: const Text('%1$s')),
                        body: const Center(child: Text('%1$s')),
                      ),
                    );
                  }
                }
                """.formatted(title));
        return files;
    }

    private static String yamlEscape(String value) {
        if (value == null || value.isBlank()) {
            return "A generated Flutter application.";
        }
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ") + "\"";
    }
}
