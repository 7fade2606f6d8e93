package com.zzf.selfpatch.core.workflow;

import java.util.regex.Pattern;

/**
 * Keyword matching for replies given while a workflow is active.
 * <p>
 * Quit phrases only count as the whole reply or as a leading command, so a clarification such
 * as "it needs start and stop buttons" is not mistaken for one. An affirmation that follows a
 * negator ("not sure", "not ok") or comes with a hedge ("maybe", "wait") is uncertain and never
 * treated as a yes.
 */
final class ReplyClassifier {
    private static final String QUIT_WORDS = "(quit|cancel|stop|exit|abort|never\\s*mind|forget\\s+it)";
    private static final Pattern QUIT_WHOLE = Pattern.compile(
            "(?i)^\\s*(please\\s+)?" + QUIT_WORDS
                    + "(\\s+(it|that|this|please|the\\s+request|the\\s+feature))?\\s*[.!]*\\s*$");
    private static final Pattern QUIT_LEADING = Pattern.compile("(?i)^\\s*" + QUIT_WORDS + "\\s*[,;:!.-]");
    private static final Pattern NEGATION = Pattern.compile("(?i)\\b(no|nope|nah|cancel|don'?t|do\\s+not)\\b");
    private static final Pattern NEGATED_AFFIRMATION = Pattern.compile(
            "(?i)\\b(not|never|isn'?t|ain'?t)\\s+(\\w+\\s+){0,2}?"
                    + "(yes|yeah|yep|sure|ok|okay|confirm|proceed|go\\s+ahead|do\\s+it|ready|yet|certain)\\b");
    private static final Pattern HEDGE = Pattern.compile(
            "(?i)\\b(maybe|perhaps|unsure|hold\\s+on|wait|later|i\\s+guess)\\b");
    private static final Pattern AFFIRMATION = Pattern.compile(
            "(?i)\\b(yes|yeah|yep|confirm|proceed|go\\s+ahead|do\\s+it|sure|ok|okay)\\b");

    private ReplyClassifier() {}

    static boolean isQuit(String text) {
        return text != null && (QUIT_WHOLE.matcher(text).matches() || QUIT_LEADING.matcher(text).find());
    }

    static boolean isNegation(String text) {
        return text != null && NEGATION.matcher(text).find();
    }

    static boolean isUncertain(String text) {
        return text != null && (NEGATED_AFFIRMATION.matcher(text).find() || HEDGE.matcher(text).find());
    }

    static boolean isAffirmation(String text) {
        return text != null && !isUncertain(text) && AFFIRMATION.matcher(text).find();
    }
}
