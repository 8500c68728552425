package com.cdnarchiver.core.policy;

import com.cdnarchiver.common.config.ArchiverEnv;
import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.model.ArchiveMeta;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Blocks files whose name matches any configured regex (case-insensitive, partial match).
 */
public class FilenamePatternContentPolicy implements ContentPolicy {

    private final List<Pattern> patterns;

    public FilenamePatternContentPolicy(List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes) {
            try {
                compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid blocked filename pattern: " + regex, e);
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    public static FilenamePatternContentPolicy fromEnv(ArchiverEnv env) {
        return new FilenamePatternContentPolicy(env.blockedFilenamePatterns());
    }

    @Override
    public PolicyDecision evaluate(Path path, ArchiveMeta meta) {
        String name = PolicyEngine.displayName(path, meta);
        List<String> reasons = new ArrayList<>();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).find()) {
                reasons.add("filename matches blocked pattern: " + pattern.pattern());
            }
        }
        return PolicyDecision.fromReasons(reasons);
    }
}
