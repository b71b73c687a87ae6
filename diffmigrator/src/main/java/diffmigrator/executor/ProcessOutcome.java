package diffmigrator.executor;

/**
 * Result of running one external process to completion or to its timeout.
 *
 * @param exitCode process exit status; -1 if the process was killed on timeout
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param timedOut true if the process exceeded its timeout and was killed
 * @param wallTimeMs elapsed wall-clock time
 */
public record ProcessOutcome(int exitCode, String stdout, String stderr, boolean timedOut, long wallTimeMs) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /** Returns at most {@code maxChars} characters of stderr, for reports. */
    public String stderrExcerpt(int maxChars) {
        return excerpt(stderr, maxChars);
    }

    static String excerpt(String text, int maxChars) {
        if (text == null) return "";
        String trimmed = text.strip();
        return trimmed.length() <= maxChars ? trimmed : trimmed.substring(0, maxChars) + "...";
    }
}
