package com.codemend.core.plan;

/**
 * Creates or overwrites a file, either with literal {@code content} or with
 * content produced from {@code generatePrompt}. Exactly one of the two is set.
 */
public final class CreateFileStep extends PlanStep {

    private final String path;
    private final String content;          // nullable
    private final String generatePrompt;   // nullable

    public CreateFileStep(int number, String description, String path,
                          String content, String generatePrompt) {
        super(number, PlanStepAction.CREATE_FILE, description);
        if ((content == null) == (generatePrompt == null)) {
            throw new IllegalArgumentException(
                    "create_file needs exactly one of content or generate_prompt");
        }
        this.path           = path;
        this.content        = content;
        this.generatePrompt = generatePrompt;
    }

    public String getPath()           { return path; }
    public String getContent()        { return content; }
    public String getGeneratePrompt() { return generatePrompt; }

    public boolean isGenerated() {
        return generatePrompt != null;
    }

    @Override
    PlanStep renumbered(int newNumber) {
        return new CreateFileStep(newNumber, getDescription(), path, content, generatePrompt);
    }

    @Override
    public String defaultDescription() {
        return isGenerated()
                ? "Creating file: `" + path + "`"
                : "Creating file: `" + path + "` (with predefined content)";
    }
}
