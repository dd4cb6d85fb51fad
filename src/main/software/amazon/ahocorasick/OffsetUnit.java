package software.amazon.ahocorasick;

/**
 * The units in which a PatternFinder reports match offsets. Patterns are always compared code point by code point.
 */
public enum OffsetUnit {
    CODE_POINT,          // one per Unicode code point, the default
    CHAR,                // one per UTF-16 char, usable with String.substring
}
