package com.voicepilot.core.planner;

import com.voicepilot.core.rules.RuleProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Heuristic detection and splitting of utterances that describe several tasks,
 * e.g. "打开Safari然后搜索Python教程" or "open safari, then search for java".
 * <p>
 * Connectives: 然后, 接着, 之后, 随后, 最后, and then, then, after that, finally, and "next"
 * when it opens a clause (so "play the next song" stays one task). Delimiters: comma, semicolon,
 * and a period that ends a sentence.
 */
@Component
public class MultiStepSplitter {

    private static final String CONNECTIVES =
            "然后|接着|之后|随后|最后"
            + "|\\band then\\b|\\bafter that\\b|\\bthen\\b|\\bfinally\\b"
            + "|(?:^|(?<=[,;，；。]))\\s*next\\b";

    private static final String DELIMITERS = "[,;，；。]|\\.(?=\\s|$)";

    private static final Pattern CONNECTIVE = Pattern.compile(CONNECTIVES, Pattern.CASE_INSENSITIVE);
    private static final Pattern DELIMITER = Pattern.compile(DELIMITERS);
    private static final Pattern SPLITTER =
            Pattern.compile(CONNECTIVES + "|" + DELIMITERS, Pattern.CASE_INSENSITIVE);

    private final RuleProperties properties;

    public MultiStepSplitter(RuleProperties properties) {
        this.properties = properties;
    }

    /**
     * True if the text contains a connective, or at least two delimited clauses of
     * {@code voicepilot.rules.min-clause-length} characters or more.
     */
    public boolean looksMultiStep(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (CONNECTIVE.matcher(text).find()) {
            return true;
        }
        long longClauses = Arrays.stream(DELIMITER.split(text))
                .map(String::trim)
                .filter(c -> c.length() >= properties.getMinClauseLength())
                .count();
        return longClauses >= 2;
    }

    /**
     * Splits on connectives and delimiters, trims, and drops fragments shorter than
     * {@code voicepilot.rules.min-fragment-length}. Order is preserved.
     */
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SPLITTER.split(text))
                .map(String::trim)
                .filter(f -> f.length() >= properties.getMinFragmentLength())
                .toList();
    }
}
