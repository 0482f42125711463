package me.golemcore.codeshell.tools;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Glob filter over file names, shared by the search tools. An entry is kept
 * if it matches one of the match globs (when any are given) and none of the
 * ignore globs. The configured default ignore list always applies.
 */
final class NameFilter {

    private final List<PathMatcher> match;
    private final List<PathMatcher> ignore;

    private NameFilter(List<PathMatcher> match, List<PathMatcher> ignore) {
        this.match = match;
        this.ignore = ignore;
    }

    static NameFilter of(List<String> matchGlobs, List<String> ignoreGlobs, List<String> defaultIgnore) {
        List<String> allIgnore = new ArrayList<>(defaultIgnore);
        allIgnore.addAll(ignoreGlobs);
        return new NameFilter(compile(matchGlobs), compile(allIgnore));
    }

    boolean isIgnored(Path path) {
        Path name = path.getFileName();
        return name != null && ignore.stream().anyMatch(matcher -> matcher.matches(name));
    }

    boolean isMatched(Path path) {
        if (match.isEmpty()) {
            return true;
        }
        Path name = path.getFileName();
        return name != null && match.stream().anyMatch(matcher -> matcher.matches(name));
    }

    boolean accepts(Path path) {
        return !isIgnored(path) && isMatched(path);
    }

    /**
     * Reads an optional list-of-strings tool argument.
     */
    static List<String> stringList(Object value) {
        if (!(value instanceof List<?> raw)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item != null && !item.toString().isBlank()) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static List<PathMatcher> compile(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>(globs.size());
        for (String glob : globs) {
            String trimmed = glob.endsWith("/") ? glob.substring(0, glob.length() - 1) : glob;
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + trimmed));
        }
        return matchers;
    }
}
