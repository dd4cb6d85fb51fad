package software.amazon.ahocorasick;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PatternFinderTest {

    private static Map<String, List<Integer>> expected(Object... patternsAndOffsets) {
        Map<String, List<Integer>> expected = new HashMap<>();
        for (int i = 0; i < patternsAndOffsets.length; i += 2) {
            expected.put((String) patternsAndOffsets[i], Arrays.asList((Integer[]) patternsAndOffsets[i + 1]));
        }
        return expected;
    }

    private static Integer[] at(Integer... offsets) {
        return offsets;
    }

    private static void checkCorrectOutput(List<String> patterns, String text, Map<String, List<Integer>> expected) {
        assertEquals(expected, new PatternFinder(patterns).findPatterns(text));
    }

    @Test
    public void testEmpty() {
        checkCorrectOutput(Collections.emptyList(), "", expected());
        checkCorrectOutput(Collections.emptyList(), "some text", expected());
    }

    @Test
    public void testSingle() {
        checkCorrectOutput(Collections.singletonList("a"), "aa", expected("a", at(0, 1)));
    }

    @Test
    public void testOverlapping() {
        checkCorrectOutput(Arrays.asList("foo", "oof", "o"), "foof",
                expected("foo", at(0), "oof", at(1), "o", at(1, 2)));
    }

    @Test
    public void testSimpleOverlap() {
        checkCorrectOutput(Arrays.asList("aa", "ab"), "aab", expected("aa", at(0), "ab", at(1)));
    }

    @Test
    public void testSubPattern() {
        checkCorrectOutput(Arrays.asList("a", "aa"), "aaa", expected("a", at(0, 1, 2), "aa", at(0, 1)));
    }

    @Test
    public void testDuplicatePattern() {
        checkCorrectOutput(Arrays.asList("a", "a"), "aaa", expected("a", at(0, 1, 2)));
    }

    @Test
    public void testBananananaspaj() {
        checkCorrectOutput(Arrays.asList("anas", "ana", "an", "a"), "bananananaspaj",
                expected("anas", at(7),
                        "ana", at(1, 3, 5, 7),
                        "an", at(1, 3, 5, 7),
                        "a", at(1, 3, 5, 7, 9, 12)));
    }

    @Test
    public void testPatternLongerThanText() {
        checkCorrectOutput(Arrays.asList("abcdef", "cd"), "abcd", expected("cd", at(2)));
    }

    @Test
    public void testNoOccurrenceLeavesPatternAbsent() {
        Map<String, List<Integer>> found = new PatternFinder(Arrays.asList("x", "b")).findPatterns("abc");
        assertEquals(Collections.singleton("b"), found.keySet());
        assertFalse(found.containsKey("x"));
    }

    @Test
    public void testFailureRecoveryDoesNotLoseMatches() {
        // after failing out of "abcd" the scan must still see "bcx" starting inside it
        checkCorrectOutput(Arrays.asList("abcd", "bcx", "c"), "abcxabcd",
                expected("abcd", at(4), "bcx", at(1), "c", at(2, 6)));
    }

    @Test
    public void testEmptyPatternIsReportedAtEverySymbolEnd() {
        checkCorrectOutput(Arrays.asList("", "b"), "abc", expected("", at(1, 2, 3), "b", at(1)));
        checkCorrectOutput(Collections.singletonList(""), "", expected());
    }

    @Test
    public void testOffsetsCountCodePointsByDefault() {
        checkCorrectOutput(Arrays.asList("😀", "b"), "a😀b😀", expected("😀", at(1, 3), "b", at(2)));
    }

    @Test
    public void testOffsetsCanCountChars() {
        String text = "a😀b😀";
        PatternFinder finder = PatternFinder.builder()
                .withPatterns("😀", "b")
                .withOffsetUnit(OffsetUnit.CHAR)
                .build();

        Map<String, List<Integer>> found = finder.findPatterns(text);
        assertEquals(expected("😀", at(1, 4), "b", at(3)), found);
        for (int start : found.get("😀")) {
            assertEquals("😀", text.substring(start, start + "😀".length()));
        }
    }

    @Test
    public void testNonBmpPatternDoesNotMatchHalfASurrogatePair() {
        String highSurrogate = "😀".substring(0, 1);
        checkCorrectOutput(Collections.singletonList(highSurrogate), "😀", expected());
        checkCorrectOutput(Collections.singletonList(highSurrogate), highSurrogate + "x",
                expected(highSurrogate, at(0)));
    }

    @Test
    public void testFindMatchesReportsLongestFirstAtEachEnd() {
        PatternFinder finder = PatternFinder.builder().withPatterns("a", "aa").build();
        List<Match> matches = new ArrayList<>();
        finder.findMatches("aaa", matches::add);
        assertEquals(Arrays.asList(
                new Match("a", 0, 1),
                new Match("aa", 0, 2),
                new Match("a", 1, 2),
                new Match("aa", 1, 3),
                new Match("a", 2, 3)), matches);
    }

    @Test
    public void testFindMatchesOffsetsHonourTheOffsetUnit() {
        PatternFinder finder = PatternFinder.builder().withPattern("b😀").withOffsetUnit(OffsetUnit.CHAR).build();
        List<Match> matches = new ArrayList<>();
        finder.findMatches("ab😀", matches::add);
        assertEquals(Collections.singletonList(new Match("b😀", 1, 4)), matches);
    }

    @Test
    public void testContainsAny() {
        PatternFinder finder = new PatternFinder(Arrays.asList("needle", "pin"));
        assertTrue(finder.containsAny("a haystack with a needle"));
        assertTrue(finder.containsAny("spinning"));
        assertFalse(finder.containsAny("a haystack with a needl"));
        assertFalse(finder.containsAny(""));
        assertFalse(new PatternFinder(Collections.emptyList()).containsAny("anything"));
        assertTrue(new PatternFinder(Collections.singletonList("")).containsAny("x"));
    }

    @Test
    public void testResultIsUnmodifiable() {
        Map<String, List<Integer>> found = new PatternFinder(Collections.singletonList("a")).findPatterns("aa");
        try {
            found.get("a").add(5);
            fail("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            found.remove("a");
            fail("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testPatternsAreDistinctInInsertionOrder() {
        PatternFinder finder = new PatternFinder(Arrays.asList("b", "a", "b", ""));
        assertEquals(Arrays.asList("b", "a", ""), new ArrayList<>(finder.getPatterns()));
        // root, a, b
        assertEquals(3, finder.getStateCount());
    }

    @Test
    public void testBuilderAndConstructorAgree() {
        List<String> patterns = Arrays.asList("he", "she", "his", "hers");
        String text = "ushers and his sheep";
        assertEquals(new PatternFinder(patterns).findPatterns(text),
                PatternFinder.builder().withPatterns(patterns).build().findPatterns(text));
    }

    @Test
    public void testResultIteratesInOrderOfFirstOccurrence() {
        Map<String, List<Integer>> found = new PatternFinder(Arrays.asList("c", "b", "ab", "a")).findPatterns("abc");
        // "ab" and "b" end together, so the longer one is seen first
        assertEquals(Arrays.asList("a", "ab", "b", "c"), new ArrayList<>(found.keySet()));
    }

    @Test
    public void testBuildingTwiceIsDeterministic() {
        List<String> patterns = Arrays.asList("anas", "ana", "an", "a", "nas", "s");
        String text = "bananananaspaj";
        Map<String, List<Integer>> first = new PatternFinder(patterns).findPatterns(text);
        Map<String, List<Integer>> second = new PatternFinder(patterns).findPatterns(text);
        assertEquals(first, second);
        assertEquals(new ArrayList<>(first.keySet()), new ArrayList<>(second.keySet()));
    }

    @Test
    public void testFinderCanBeSharedBetweenThreads() throws Exception {
        PatternFinder finder = new PatternFinder(Arrays.asList("anas", "ana", "an", "a"));
        Map<String, List<Integer>> single = finder.findPatterns("bananananaspaj");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Map<String, List<Integer>>>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                futures.add(executor.submit(() -> finder.findPatterns("bananananaspaj")));
            }
            for (Future<Map<String, List<Integer>>> future : futures) {
                assertEquals(single, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testNullArgumentsAreRejected() {
        PatternFinder finder = new PatternFinder(Collections.singletonList("a"));
        try {
            finder.findPatterns(null);
            fail("expected NullPointerException");
        } catch (NullPointerException e) {
            // expected
        }
        try {
            finder.findMatches("a", null);
            fail("expected NullPointerException");
        } catch (NullPointerException e) {
            // expected
        }
        try {
            PatternFinder.builder().withPattern(null);
            fail("expected NullPointerException");
        } catch (NullPointerException e) {
            // expected
        }
        try {
            new PatternFinder(Arrays.asList("a", null));
            fail("expected NullPointerException");
        } catch (NullPointerException e) {
            // expected
        }
    }

    @Test
    public void testLongPatternChainsDoNotOverflowTheStack() {
        StringBuilder pattern = new StringBuilder();
        for (int i = 0; i < 100_000; i++) {
            pattern.append('a');
        }
        PatternFinder finder = new PatternFinder(Arrays.asList(pattern.toString(), "a", "b"));
        Map<String, List<Integer>> found = finder.findPatterns(pattern + "b");
        assertEquals(Collections.singletonList(0), found.get(pattern.toString()));
        assertEquals(Collections.singletonList(100_000), found.get("b"));
        assertEquals(100_000, found.get("a").size());
    }
}
