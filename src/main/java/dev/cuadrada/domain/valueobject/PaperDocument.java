package dev.cuadrada.domain.valueobject;

/**
 * Immutable extracted paper text handed to every reviewer of a submission.
 */
public record PaperDocument(String title, String text, boolean truncated) {

    public static PaperDocument of(String title, String rawText, int maxChars) {
        if (rawText == null) throw new IllegalArgumentException("text required");
        if (maxChars > 0 && rawText.length() > maxChars) {
            return new PaperDocument(title, rawText.substring(0, maxChars), true);
        }
        return new PaperDocument(title, rawText, false);
    }

    public int length() {
        return text.length();
    }
}
