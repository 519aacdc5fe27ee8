package nl.bytesoflife.deltasch.hierarchy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Result of following a net through sheet pins and hierarchical labels.
 */
public class SignalTrace {

    /**
     * One sheet reached by the signal, with the local net name there and the bridge crossed to
     * get there.
     */
    public record Step(String path, String netName, String via) {}

    private final String netName;
    private final String startPath;
    private final List<Step> steps = new ArrayList<>();

    SignalTrace(String netName, String startPath) {
        this.netName = netName;
        this.startPath = startPath;
    }

    void addStep(Step step) {
        steps.add(step);
    }

    public String getNetName() {
        return netName;
    }

    public String getStartPath() {
        return startPath;
    }

    public boolean isFound() {
        return !steps.isEmpty();
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Sheet paths in the order the trace reached them.
     */
    public List<String> getPaths() {
        LinkedHashSet<String> paths = new LinkedHashSet<>();
        for (Step step : steps) {
            paths.add(step.path());
        }
        return List.copyOf(paths);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Trace of ").append(netName).append(" from ").append(startPath);
        for (Step step : steps) {
            sb.append("\n  ").append(step.path()).append(' ').append(step.netName())
                    .append(" (").append(step.via()).append(')');
        }
        return sb.toString();
    }
}
