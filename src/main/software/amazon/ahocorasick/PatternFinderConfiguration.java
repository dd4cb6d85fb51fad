package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a PatternFinder. For descriptions of the options, see PatternFinder.Builder.
 */
@Immutable
public class PatternFinderConfiguration {

    private final OffsetUnit offsetUnit;

    PatternFinderConfiguration(OffsetUnit offsetUnit) {
        this.offsetUnit = offsetUnit;
    }

    public OffsetUnit getOffsetUnit() {
        return offsetUnit;
    }

    @Override
    public String toString() {
        return "PatternFinderConfiguration{offsetUnit=" + offsetUnit + '}';
    }
}
