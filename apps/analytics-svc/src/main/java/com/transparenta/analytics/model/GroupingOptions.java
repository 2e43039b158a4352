package com.transparenta.analytics.model;

import java.util.List;
import java.util.Set;

public record GroupingOptions(
        ClassificationDimension dimension,
        List<String> path,
        PivotConstraint pivotConstraint,
        RootDepth rootDepth,
        Set<String> excludeChapters
) {

    public GroupingOptions {
        if (dimension == null) {
            throw new IllegalArgumentException("grouping dimension must be provided");
        }
        path = path == null ? List.of() : List.copyOf(path);
        rootDepth = rootDepth != null ? rootDepth : RootDepth.CHAPTER;
        excludeChapters = excludeChapters == null ? Set.of() : Set.copyOf(excludeChapters);
    }

    public static GroupingOptions of(ClassificationDimension dimension, String... path) {
        return new GroupingOptions(dimension, List.of(path), null, RootDepth.CHAPTER, Set.of());
    }

    public GroupingOptions withPivot(PivotConstraint constraint) {
        return new GroupingOptions(dimension, path, constraint, rootDepth, excludeChapters);
    }

    public GroupingOptions withRootDepth(RootDepth depth) {
        return new GroupingOptions(dimension, path, pivotConstraint, depth, excludeChapters);
    }

    public GroupingOptions withExcludeChapters(Set<String> chapters) {
        return new GroupingOptions(dimension, path, pivotConstraint, rootDepth, chapters);
    }
}
