package dumb.deduction.proof;

public record Exercise(Statement statement, Course course) {
}
