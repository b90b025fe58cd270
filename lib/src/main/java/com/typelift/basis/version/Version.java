package com.typelift.basis.version;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The version of a piece of software.
 *
 * <p>A version has an ordered list of numeric branch components and a collection of tags. Two
 * versions are equal if they have the same branch components, in the same order, and the same tags
 * in any order.
 *
 * <p>Example:
 * <pre>{@code
 * Version v = Version.of(List.of(1, 2, 3), List.of("beta"));
 * v.toString();                          // "1.2.3-beta"
 * Version.parse("1.2.3-beta").equals(v); // true
 * }</pre>
 */
public final class Version implements Comparable<Version> {

    private static final Comparator<List<Integer>> BRANCH_ORDER = (left, right) -> {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = Integer.compare(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    };

    private static final Comparator<List<String>> TAG_ORDER = (left, right) -> {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    };

    private final List<Integer> branch;
    private final List<String> tags;

    // Sorted copy of tags, used for equality, hashing and ordering
    private final List<String> sortedTags;

    private Version(List<Integer> branch, List<String> tags) {
        this.branch = branch;
        this.tags = tags;
        List<String> sorted = new ArrayList<>(tags);
        sorted.sort(Comparator.naturalOrder());
        this.sortedTags = List.copyOf(sorted);
    }

    /**
     * Creates a version.
     *
     * @param branch the numeric components, most significant first
     * @param tags the tags, in any order
     * @return the version
     * @throws IllegalArgumentException if a component is negative or a tag is blank or contains '-'
     */
    public static Version of(List<Integer> branch, List<String> tags) {
        Objects.requireNonNull(branch, "branch cannot be null");
        Objects.requireNonNull(tags, "tags cannot be null");
        for (Integer component : branch) {
            if (component == null || component < 0) {
                throw new IllegalArgumentException("Version components must be non-negative: " + branch);
            }
        }
        for (String tag : tags) {
            if (tag == null || tag.isBlank() || tag.indexOf('-') >= 0) {
                throw new IllegalArgumentException("Invalid version tag: '" + tag + "'");
            }
        }
        return new Version(List.copyOf(branch), List.copyOf(tags));
    }

    /**
     * Creates an untagged version.
     */
    public static Version of(int... branch) {
        Objects.requireNonNull(branch, "branch cannot be null");
        return of(Arrays.stream(branch).boxed().collect(Collectors.toList()), List.of());
    }

    /**
     * Parses the rendering produced by {@link #toString()}, e.g. {@code "1.2.3-beta-rc1"}.
     *
     * @param text the text to parse
     * @return the version
     * @throws IllegalArgumentException if the text is not a valid version
     */
    public static Version parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        String[] parts = text.split("-", -1);
        if (parts[0].isEmpty()) {
            throw new IllegalArgumentException("Version has no numeric components: '" + text + "'");
        }

        List<Integer> branch = new ArrayList<>();
        for (String component : parts[0].split("\\.", -1)) {
            try {
                branch.add(Integer.parseInt(component));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version component '" + component + "' in '" + text + "'", e);
            }
        }

        List<String> tags = new ArrayList<>(Arrays.asList(parts).subList(1, parts.length));
        return of(branch, tags);
    }

    public List<Integer> branch() {
        return branch;
    }

    /**
     * Returns the tags in the order they were given.
     */
    public List<String> tags() {
        return tags;
    }

    /**
     * Orders by branch components, then by sorted tags.
     */
    @Override
    public int compareTo(Version other) {
        int cmp = BRANCH_ORDER.compare(branch, other.branch);
        return cmp != 0 ? cmp : TAG_ORDER.compare(sortedTags, other.sortedTags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version)) {
            return false;
        }
        Version other = (Version) o;
        return branch.equals(other.branch) && sortedTags.equals(other.sortedTags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(branch, sortedTags);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(branch.stream().map(String::valueOf).collect(Collectors.joining(".")));
        for (String tag : tags) {
            sb.append('-').append(tag);
        }
        return sb.toString();
    }
}
