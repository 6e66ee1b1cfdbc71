package dumb.deduction.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Course(
        @JsonProperty("name") String name,
        @JsonProperty("content") String content,
        @JsonProperty("statements") List<Statement> statements
) {
    public Course {
        statements = List.copyOf(statements);
    }

    /** The course file up to line {@code line} included (1-based). */
    public String linesUpTo(int line) {
        var lines = content.split("\n", -1);
        var n = Math.max(0, Math.min(line, lines.length));
        var sb = new StringBuilder();
        for (int i = 0; i < n; i++) sb.append(lines[i]).append('\n');
        return sb.toString();
    }
}
