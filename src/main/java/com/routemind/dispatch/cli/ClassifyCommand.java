package com.routemind.dispatch.cli;

import com.routemind.core.classifier.PromptClassifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: routemind classify "&lt;prompt&gt;"
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify a prompt's complexity and task type")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Prompt to classify")
    private String prompt;

    private final PromptClassifier classifier;

    public ClassifyCommand(PromptClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void run() {
        var classification = classifier.classify(prompt);
        ConsoleOutput.info(String.format("Complexity: %s | Task type: %s%s",
                classification.complexity().tag(), classification.taskType().tag(),
                classification.defaulted() ? " (default, no pattern matched)" : ""));
    }
}
