package dumb.deduction.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

/**
 * A lemma of a course: its Lean name, the 1-based lines of its declaration and of the
 * {@code begin} of its proof in the course file, and its declaration text.
 */
public record Statement(
        @JsonProperty("name") String name,
        @JsonProperty("lemmaLine") int lemmaLine,
        @JsonProperty("beginLine") int beginLine,
        @JsonProperty("lemma") String lemma
) {
    public Statement {
        requireNonNull(name);
        requireNonNull(lemma);
        if (lemmaLine < 1 || beginLine < lemmaLine)
            throw new IllegalArgumentException("Bad lines " + lemmaLine + ".." + beginLine + " for " + name);
    }
}
