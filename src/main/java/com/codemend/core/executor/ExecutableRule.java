package com.codemend.core.executor;

import java.util.List;
import java.util.regex.Pattern;

/**
 * What the security policy allows for one executable.
 */
public final class ExecutableRule {

    static final ExecutableRule DISALLOWED = builder().build();

    private final boolean       allowed;
    private final boolean       highRisk;
    private final boolean       strictArgValidation;
    private final boolean       requiresExplicitConfirmation;
    private final boolean       allowMetaCharacters;
    private final List<Pattern> allowedArgs;
    private final List<Pattern> allowedUrlPatterns;

    private ExecutableRule(Builder b) {
        this.allowed                      = b.allowed;
        this.highRisk                     = b.highRisk;
        this.strictArgValidation          = b.strictArgValidation;
        this.requiresExplicitConfirmation = b.requiresExplicitConfirmation;
        this.allowMetaCharacters          = b.allowMetaCharacters;
        this.allowedArgs                  = List.copyOf(b.allowedArgs);
        this.allowedUrlPatterns           = List.copyOf(b.allowedUrlPatterns);
    }

    public boolean       isAllowed()                      { return allowed; }
    public boolean       isHighRisk()                     { return highRisk; }
    public boolean       isStrictArgValidation()          { return strictArgValidation; }
    public boolean       isRequiresExplicitConfirmation() { return requiresExplicitConfirmation; }
    public boolean       isAllowMetaCharacters()          { return allowMetaCharacters; }
    public List<Pattern> getAllowedArgs()                 { return allowedArgs; }
    public List<Pattern> getAllowedUrlPatterns()          { return allowedUrlPatterns; }

    /** High-risk or explicitly flagged commands always need a human decision. */
    public boolean needsCarefulConfirmation() {
        return highRisk || requiresExplicitConfirmation;
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private boolean       allowed                      = false;
        private boolean       highRisk                     = false;
        private boolean       strictArgValidation          = false;
        private boolean       requiresExplicitConfirmation = false;
        private boolean       allowMetaCharacters          = false;
        private List<Pattern> allowedArgs                  = List.of();
        private List<Pattern> allowedUrlPatterns           = List.of();

        Builder allowed()                      { this.allowed = true;                      return this; }
        Builder highRisk()                     { this.highRisk = true;                     return this; }
        Builder strictArgValidation()          { this.strictArgValidation = true;          return this; }
        Builder requiresExplicitConfirmation() { this.requiresExplicitConfirmation = true; return this; }
        Builder allowMetaCharacters()          { this.allowMetaCharacters = true;          return this; }

        Builder allowedArgs(String... regexes)        { this.allowedArgs = compile(regexes);        return this; }
        Builder allowedUrlPatterns(String... regexes) { this.allowedUrlPatterns = compile(regexes); return this; }

        ExecutableRule build() { return new ExecutableRule(this); }

        private static List<Pattern> compile(String... regexes) {
            Pattern[] patterns = new Pattern[regexes.length];
            for (int i = 0; i < regexes.length; i++) patterns[i] = Pattern.compile(regexes[i]);
            return List.of(patterns);
        }
    }
}
