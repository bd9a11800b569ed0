package io.latmon.core.sampler;

import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.SourceKind;
import java.util.List;

public final class ClassificationRules {

    private ClassificationRules() {
    }

    public static List<ClassificationRule> defaults() {
        return List.of(
            new ClassificationRule(
                "editor",
                ComponentClass.EDITOR,
                SourceKind.PROCESS_SCAN,
                List.of("code", "code-oss", "codium"),
                List.of("code-server", "code.exe"),
                List.of(),
                null,
                0.0
            ),
            new ClassificationRule(
                "extension-host",
                ComponentClass.EXTENSION_HOST,
                SourceKind.PROCESS_SCAN,
                List.of(),
                List.of("extensionhost"),
                List.of("extensionhost"),
                null,
                0.0
            ),
            new ClassificationRule(
                "copilot",
                ComponentClass.AI_MODEL_REMOTE,
                SourceKind.PROCESS_SCAN,
                List.of(),
                List.of("copilot"),
                List.of("github.copilot", "copilot-agent"),
                null,
                0.0
            ),
            new ClassificationRule(
                "local-model",
                ComponentClass.AI_MODEL_LOCAL,
                SourceKind.PROCESS_SCAN,
                List.of(),
                List.of("ollama", "llama", "gpt4all", "localai"),
                List.of("ollama", "llama", "gpt4all", "localai"),
                null,
                0.0
            ),
            new ClassificationRule(
                "terminal",
                ComponentClass.TERMINAL,
                SourceKind.PROCESS_SCAN,
                List.of("bash", "zsh", "fish", "sh"),
                List.of("terminal", "konsole"),
                List.of(),
                null,
                0.1
            )
        );
    }

    public static List<ClassificationRule> forClass(List<ClassificationRule> rules, ComponentClass componentClass) {
        return rules.stream().filter(rule -> rule.target() == componentClass).toList();
    }
}
