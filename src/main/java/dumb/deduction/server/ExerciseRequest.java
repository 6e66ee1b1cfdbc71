package dumb.deduction.server;

import dumb.deduction.proof.Exercise;
import dumb.deduction.proof.ProofStep;

/** Opens an exercise: the course file up to the proof's {@code begin}, then the analysis code. */
public class ExerciseRequest extends HighLevelRequest {

    private final ProofStep proofStep;
    private final Exercise exercise;
    private final VirtualFile virtualFile;

    public ExerciseRequest(ProofStep proofStep, Exercise exercise) {
        this.proofStep = proofStep;
        this.exercise = exercise;
        this.virtualFile = new VirtualFile(exercise.course().linesUpTo(exercise.statement().beginLine()));
    }

    @Override
    public String requestType() {
        return "Exercise";
    }

    public Exercise exercise() {
        return exercise;
    }

    public VirtualFile virtualFile() {
        return virtualFile;
    }

    @Override
    public String fileContents() {
        virtualFile.setAfterword(analysisCode() + "end\n");
        return virtualFile.contents();
    }

    @Override
    protected ProofStep proofStep() {
        return proofStep;
    }
}
