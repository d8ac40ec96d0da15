package com.codemend.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Allowlist screen for commands proposed by correction plans.
 *
 * A command passes only when its executable is allowlisted, it is not an
 * absolute path, it carries no shell meta-characters (unless the
 * executable's rule allows them), and its arguments pass the rule's checks.
 */
@Component
public class CommandSecurityPolicy {

    private static final Logger log = LoggerFactory.getLogger(CommandSecurityPolicy.class);

    static final List<String> SHELL_META_CHARACTERS =
            List.of("&&", "||", ";", "`", "$(", ">", "<", "|", "&", "\\");

    private static final Pattern URL = Pattern.compile("^(http|https)://[^\\s$.?#].\\S*$", Pattern.CASE_INSENSITIVE);

    private static final String[] NPM_REGISTRIES = {
            "^https://(registry\\.)?npmjs\\.org/.*",
            "^https://registry\\.yarnpkg\\.com/.*"
    };

    private static final Map<String, ExecutableRule> RULES = Map.ofEntries(
            Map.entry("git", ExecutableRule.builder().allowed()
                    .allowedUrlPatterns("^https://github\\.com/.*", "^git@github\\.com:.*").build()),
            Map.entry("npm", ExecutableRule.builder().allowed().allowedUrlPatterns(NPM_REGISTRIES).build()),
            Map.entry("yarn", ExecutableRule.builder().allowed().allowedUrlPatterns(NPM_REGISTRIES).build()),
            Map.entry("pnpm", ExecutableRule.builder().allowed().build()),
            Map.entry("node", ExecutableRule.builder().allowed().highRisk().strictArgValidation()
                    .allowedArgs("^(?!-e).*$").build()),
            Map.entry("npx", ExecutableRule.builder().allowed().highRisk().strictArgValidation()
                    .requiresExplicitConfirmation()
                    .allowedArgs("^[a-zA-Z0-9@/.\\\\-]+$", "^(?!-c).*$")
                    .allowedUrlPatterns("^https://.*").build()),
            Map.entry("echo", ExecutableRule.builder().allowed().allowMetaCharacters().build()),
            Map.entry("mkdir", ExecutableRule.builder().allowed().build()),
            Map.entry("rm", ExecutableRule.builder().allowed().build()),
            Map.entry("cp", ExecutableRule.builder().allowed().build()),
            Map.entry("mv", ExecutableRule.builder().allowed().build()),
            Map.entry("ls", ExecutableRule.builder().allowed().build()),
            Map.entry("cd", ExecutableRule.builder().allowed().build()),
            Map.entry("pwd", ExecutableRule.builder().allowed().build()),
            Map.entry("python", ExecutableRule.builder().highRisk().strictArgValidation().build()),
            Map.entry("bash", ExecutableRule.builder().highRisk().strictArgValidation().build()),
            Map.entry("sh", ExecutableRule.builder().highRisk().strictArgValidation().build())
    );

    /**
     * @return the rule that admitted the command
     * @throws CommandBlockedException if the command violates the policy
     */
    public ExecutableRule check(CommandLine command) {
        String executable = command.getExecutable();
        if (executable.isEmpty()) {
            throw blocked("Executable cannot be empty.");
        }

        String lower = executable.toLowerCase(Locale.ROOT);
        ExecutableRule rule = RULES.getOrDefault(lower, ExecutableRule.DISALLOWED);
        if (!rule.isAllowed()) {
            throw blocked("Executable '" + executable + "' is explicitly disallowed or not in the allowlist.");
        }

        if (executable.startsWith("/") || Paths.get(executable).isAbsolute()) {
            throw blocked("Absolute path executable '" + executable + "' is not allowed.");
        }

        if (!rule.isAllowMetaCharacters()) {
            List<String> found = new ArrayList<>();
            for (String meta : SHELL_META_CHARACTERS) {
                if (command.getOriginal().contains(meta)) found.add(meta);
            }
            if (!found.isEmpty()) {
                throw blocked("Shell meta-characters ('" + String.join("', '", found)
                        + "') are not allowed in plan commands.");
            }
        }

        List<String> args = command.getArguments();
        checkDestructiveArguments(lower, args);

        if (rule.isStrictArgValidation()) {
            validateArgumentsStrictly(lower, args, rule);
        } else {
            checkAllowedArgs(lower, args, rule);
            warnOnUrls(lower, args, rule);
        }
        return rule;
    }

    // ================================================================
    // Argument checks
    // ================================================================

    private static void checkDestructiveArguments(String executable, List<String> args) {
        switch (executable) {
            case "rm":
                for (String arg : args) {
                    if (arg.toLowerCase(Locale.ROOT).contains("-rf") || arg.equals("/") || arg.equals("/*")
                            || arg.equals("./*") || arg.equals("*")) {
                        throw blocked("Potentially dangerous 'rm' operation (" + arg + ").");
                    }
                }
                break;
            case "git":
                if ((args.contains("reset") && (args.contains("--hard") || args.contains("--force")))
                        || (args.contains("clean") && (args.contains("-f") || args.contains("--force")))) {
                    throw blocked("'git reset --hard' and 'git clean --force' can lose work irreversibly.");
                }
                break;
            case "npm":
            case "yarn":
            case "pnpm":
                if (args.contains("exec") || args.contains("dlx")) {
                    throw blocked("'" + executable + " exec/dlx' can run arbitrary code.");
                }
                break;
            default:
                break;
        }
    }

    private static void validateArgumentsStrictly(String executable, List<String> args, ExecutableRule rule) {
        for (String arg : args) {
            if (arg.contains("../") || arg.contains("/..")) {
                throw blocked("Path traversal in argument '" + arg + "' for '" + executable + "'.");
            }
            if (URL.matcher(arg).matches()) {
                if (rule.getAllowedUrlPatterns().isEmpty()) {
                    throw blocked("URLs are not allowed for '" + executable + "' under strict validation.");
                }
                if (!matchesAny(rule.getAllowedUrlPatterns(), arg)) {
                    throw blocked("URL '" + arg + "' is not permitted for '" + executable + "'.");
                }
            }
            if (!rule.getAllowedArgs().isEmpty() && !matchesAny(rule.getAllowedArgs(), arg)) {
                throw blocked("Argument '" + arg + "' for '" + executable + "' does not match any allowed pattern.");
            }
            if (arg.contains("`") || arg.contains("$(")) {
                throw blocked("Command substitution in argument '" + arg + "' for '" + executable + "'.");
            }
        }
    }

    private static void checkAllowedArgs(String executable, List<String> args, ExecutableRule rule) {
        if (rule.getAllowedArgs().isEmpty()) return;
        for (String arg : args) {
            if (!matchesAny(rule.getAllowedArgs(), arg)) {
                throw blocked("Argument '" + arg + "' for '" + executable + "' does not match any allowed pattern.");
            }
        }
    }

    private static void warnOnUrls(String executable, List<String> args, ExecutableRule rule) {
        for (String arg : args) {
            if (!URL.matcher(arg).matches()) continue;
            if (!rule.getAllowedUrlPatterns().isEmpty()) {
                if (!matchesAny(rule.getAllowedUrlPatterns(), arg)) {
                    throw blocked("URL '" + arg + "' is not permitted for '" + executable + "'.");
                }
            } else {
                log.warn("[CommandSecurity] URL '{}' in arguments for '{}'; make sure it is trusted", arg, executable);
            }
        }
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        for (Pattern p : patterns) {
            if (p.matcher(value).find()) return true;
        }
        return false;
    }

    private static CommandBlockedException blocked(String reason) {
        log.warn("[CommandSecurity] {}", reason);
        return new CommandBlockedException(reason);
    }
}
