package dk.cloudcreate.cqrs.bus.transport;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Subject pattern matching. Subjects are dot separated tokens, e.g. <code>event.c1.success</code>.
 * In a pattern <code>*</code> matches exactly one token and a trailing <code>&gt;</code> matches one or more remaining tokens.
 */
public final class Subjects {
    private Subjects() {
    }

    public static boolean matches(String subjectPattern, String subject) {
        requireNonNull(subjectPattern, "No subjectPattern provided");
        requireNonNull(subject, "No subject provided");
        var patternTokens = subjectPattern.split("\\.", -1);
        var subjectTokens = subject.split("\\.", -1);
        for (int i = 0; i < patternTokens.length; i++) {
            var patternToken = patternTokens[i];
            if (patternToken.equals(">") && i == patternTokens.length - 1) {
                return subjectTokens.length > i;
            }
            if (i >= subjectTokens.length) {
                return false;
            }
            if (!patternToken.equals("*") && !patternToken.equals(subjectTokens[i])) {
                return false;
            }
        }
        return patternTokens.length == subjectTokens.length;
    }

    /**
     * The last token of a subject
     */
    public static String lastToken(String subject) {
        requireNonNull(subject, "No subject provided");
        return subject.substring(subject.lastIndexOf('.') + 1);
    }
}
