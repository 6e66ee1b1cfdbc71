package dumb.deduction.server;

import dumb.deduction.backend.ProverMessage;
import dumb.deduction.proof.Course;
import dumb.deduction.proof.ProofState;
import dumb.deduction.proof.Statement;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks for the initial proof state of several statements at once. Each statement gets its
 * own {@code begin ... end} block of analysis code; diagnostics are routed back to their
 * statement by the line they were reported at.
 */
public class InitialProofStateRequest extends HighLevelRequest {

    private static final Logger logger = LoggerFactory.getLogger(InitialProofStateRequest.class);

    private final Course course;
    private final List<Statement> statements;
    private final Map<Integer, Integer> statementByTargetsLine = new HashMap<>();
    private final Map<Integer, Integer> statementByHypoLine = new HashMap<>();
    private final List<List<String>> hypos = new ArrayList<>();
    private final List<@Nullable String> targets = new ArrayList<>();

    public InitialProofStateRequest(Course course, List<Statement> statements) {
        if (statements.isEmpty()) throw new IllegalArgumentException("No statement");
        this.course = course;
        this.statements = List.copyOf(statements);
        clearAnalyses();
    }

    @Override
    public String requestType() {
        return "InitialProofState";
    }

    public List<Statement> statements() {
        return statements;
    }

    @Override
    public synchronized String fileContents() {
        statementByTargetsLine.clear();
        statementByHypoLine.clear();
        var n = seqNum();
        var sb = new StringBuilder(course.linesUpTo(statements.get(0).lemmaLine() - 1));
        sb.append("-- Seq num ").append(n).append('\n');
        for (int i = 0; i < statements.size(); i++) {
            var st = statements.get(i);
            sb.append(st.lemma().strip()).append('\n').append("begin\n");
            var targetsLine = VirtualFile.countLines(sb.toString()) + 1;
            statementByTargetsLine.put(targetsLine, i);
            statementByHypoLine.put(targetsLine + 1, i);
            sb.append(analysisCode()).append("sorry\nend\n\n");
        }
        return sb.toString();
    }

    @Override
    public synchronized void storeHypoAnalysis(String text, int line) {
        var i = statementByHypoLine.get(line);
        if (i == null) {
            logger.warn("Context analysis at unexpected line {} for request #{}", line, seqNum());
            return;
        }
        hypos.get(i).add(text);
    }

    @Override
    public synchronized void storeTargetsAnalysis(String text, int line) {
        var i = statementByTargetsLine.get(line);
        if (i == null) {
            logger.warn("Targets analysis at unexpected line {} for request #{}", line, seqNum());
            return;
        }
        targets.set(i, text);
    }

    /** Errors are logged against their statement but do not end the request. */
    @Override
    public synchronized void recordError(ProverMessage msg) {
        errors.add(msg);
    }

    @Override
    public synchronized boolean isComplete() {
        for (int i = 0; i < statements.size(); i++) {
            var t = targets.get(i);
            if (t == null || hypos.get(i).size() < countGoals(t)) return false;
        }
        return true;
    }

    /** Proof states by statement name, for the statements fully analysed so far. */
    public synchronized Map<String, ProofState> proofStates() {
        var out = new LinkedHashMap<String, ProofState>();
        for (int i = 0; i < statements.size(); i++) {
            var t = targets.get(i);
            if (t != null && hypos.get(i).size() >= countGoals(t))
                out.put(statements.get(i).name(), new ProofState(hypos.get(i), t));
        }
        return out;
    }

    @Override
    public synchronized void reset() {
        super.reset();
        clearAnalyses();
    }

    private void clearAnalyses() {
        hypos.clear();
        targets.clear();
        for (var ignored : statements) {
            hypos.add(new ArrayList<>());
            targets.add(null);
        }
    }
}
