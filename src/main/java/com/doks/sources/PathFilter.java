package com.doks.sources;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class PathFilter {
    private static final PathFilter ACCEPT_ALL = new PathFilter(List.of(), List.of());

    private final List<Pattern> include;
    private final List<Pattern> exclude;

    public PathFilter(List<Pattern> include, List<Pattern> exclude) {
        this.include = List.copyOf(include);
        this.exclude = List.copyOf(exclude);
    }

    public static PathFilter acceptAll() {
        return ACCEPT_ALL;
    }

    public static PathFilter compile(List<String> include, List<String> exclude) {
        return new PathFilter(compileAll(include, "include"), compileAll(exclude, "exclude"));
    }

    public boolean accepts(String path) {
        return include.stream().allMatch(pattern -> pattern.matcher(path).find())
                && exclude.stream().noneMatch(pattern -> pattern.matcher(path).find());
    }

    public PathFilter and(PathFilter other) {
        List<Pattern> mergedInclude = new ArrayList<>(include);
        mergedInclude.addAll(other.include);
        List<Pattern> mergedExclude = new ArrayList<>(exclude);
        mergedExclude.addAll(other.exclude);
        return new PathFilter(mergedInclude, mergedExclude);
    }

    private static List<Pattern> compileAll(List<String> expressions, String kind) {
        if (expressions == null) {
            return List.of();
        }
        List<Pattern> patterns = new ArrayList<>();
        for (String expression : expressions) {
            try {
                patterns.add(Pattern.compile(expression));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid " + kind + " pattern '" + expression + "': " + e.getDescription(), e);
            }
        }
        return patterns;
    }

    @Override
    public String toString() {
        return "PathFilter{" +
                "include=" + include +
                ", exclude=" + exclude +
                '}';
    }
}
