package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;

import java.util.Objects;

/**
 * One occurrence of a pattern in a text. Offsets are in the unit the PatternFinder was configured with; the end
 * offset is exclusive.
 */
@Immutable
public final class Match {

    private final String pattern;
    private final int start;
    private final int end;

    Match(final String pattern, final int start, final int end) {
        this.pattern = pattern;
        this.start = start;
        this.end = end;
    }

    public String getPattern() {
        return pattern;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match other = (Match) o;
        return start == other.start && end == other.end && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, start, end);
    }

    @Override
    public String toString() {
        return "Match{pattern='" + pattern + "', start=" + start + ", end=" + end + '}';
    }
}
