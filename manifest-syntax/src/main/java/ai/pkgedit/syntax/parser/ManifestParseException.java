package ai.pkgedit.syntax.parser;

/** Thrown when manifest text cannot be parsed. Line and column are 1-based. */
public class ManifestParseException extends Exception {
    private final int line;
    private final int column;

    public ManifestParseException(String message, int line, int column) {
        super("%d:%d: %s".formatted(line, column, message));
        this.line = line;
        this.column = column;
    }

    static ManifestParseException at(String source, int offset, String message) {
        int line = 1;
        int lineStart = 0;
        int end = Math.min(offset, source.length());
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new ManifestParseException(message, line, end - lineStart + 1);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
