package build.tokenbuddy.source;

import java.io.IOException;

public class TokenFileException extends IOException {

    public enum Kind {
        NOT_FOUND,
        PARSE,
        PERMISSION,
        INVALID
    }

    private final String file;
    private final Kind kind;

    public TokenFileException(String file, Kind kind, String message) {
        super(message);
        this.file = file;
        this.kind = kind;
    }

    public TokenFileException(String file, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
        this.kind = kind;
    }

    public String file() {
        return file;
    }

    public Kind kind() {
        return kind;
    }
}
