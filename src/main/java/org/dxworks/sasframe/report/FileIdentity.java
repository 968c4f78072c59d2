package org.dxworks.sasframe.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"path", "fileName", "lineCount"})
public class FileIdentity {
    public final String path;
    public final String fileName;
    public final int lineCount;

    public FileIdentity(String path, String fileName, int lineCount) {
        this.path = path;
        this.fileName = fileName;
        this.lineCount = lineCount;
    }

    /** Identity of an in-memory source; line count follows the text's line breaks. */
    public static FileIdentity of(String path, String source) {
        String name = path;
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (slash >= 0) {
            name = path.substring(slash + 1);
        }
        return new FileIdentity(path, name, countLines(source));
    }

    static int countLines(String source) {
        if (source == null || source.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lines++;
            }
        }
        // a last line without a line break still counts
        return source.charAt(source.length() - 1) == '\n' ? lines : lines + 1;
    }

    @Override
    public String toString() {
        return path;
    }
}
