package software.amazon.ahocorasick;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a pattern set from its JSON form, an array of strings:
 * <pre>
 *   [ "foo", "oof", "o" ]
 * </pre>
 * Order and duplicates are preserved; the PatternFinder collapses duplicates itself. Every string is taken literally,
 * including the empty string.
 */
public class JsonPatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern set
     * @param source pattern set, as a String
     * @return null if the pattern set is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern set from its JSON form.
     *
     * @param source pattern set, as a String
     * @return the patterns, in document order
     * @throws IOException if the pattern set isn't syntactically valid
     */
    public static List<String> compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a pattern set and build a PatternFinder for it with the default configuration.
     */
    public static PatternFinder compileFinder(final String source) throws IOException {
        return new PatternFinder(compile(source));
    }

    private static List<String> doCompile(final JsonParser parser) throws IOException {
        try {
            final List<String> patterns = new ArrayList<>();
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, "Pattern set is not an array");
            }
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token != JsonToken.VALUE_STRING) {
                    barf(parser, "Pattern must be a string, found " + token);
                }
                patterns.add(parser.getText());
            }
            if (parser.nextToken() != null) {
                barf(parser, "Unexpected content after the pattern set");
            }
            return patterns;
        } finally {
            parser.close();
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
