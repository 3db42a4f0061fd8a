package nexus.causal;

import nexus.data.DailyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Accepts a candidate as a driver of the target only when two cheap lagged-correlation tests agree.
 * <ol>
 *   <li>Lagged correlation: max |corr(target(t), v(t - lag))| over lag 1..L exceeds the threshold.</li>
 *   <li>One-step association: |corr(target(t), v(t - 1))| beats the target's own lag-1
 *       autocorrelation in magnitude and exceeds the threshold.</li>
 * </ol>
 * The second test is a lag-1 heuristic, not a multivariate Granger test.
 */
public class ConsensusCausalDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(ConsensusCausalDiscoverer.class);

    private final int maxLag;
    private final double threshold;

    public ConsensusCausalDiscoverer(int maxLag, double threshold) {
        if (maxLag < 1) throw new IllegalArgumentException("maxLag must be >= 1, got " + maxLag);
        this.maxLag = maxLag;
        this.threshold = threshold;
    }

    public Result discover(DailyTable table, String target, List<String> candidates) {
        double[] y = table.column(target);
        Set<String> laggedAccepted = new LinkedHashSet<>();
        Set<String> oneStepAccepted = new LinkedHashSet<>();

        double base = LaggedCorrelation.at(y, y, 1);
        for (String candidate : candidates) {
            if (candidate.equals(target)) continue;
            if (!table.hasColumn(candidate)) {
                log.warn("Causal candidate '{}' not present in table; skipped", candidate);
                continue;
            }
            double[] v = table.column(candidate);

            double[] profile = LaggedCorrelation.profile(y, v, maxLag);
            if (Math.abs(profile[strongestLagIndex(profile)]) > threshold) {
                laggedAccepted.add(candidate);
            }

            double cross = LaggedCorrelation.at(y, v, 1);
            if (Math.abs(cross) > Math.abs(base) && Math.abs(cross) > threshold) {
                oneStepAccepted.add(candidate);
            }
        }

        CausalGraph graph = new CausalGraph();
        for (String candidate : laggedAccepted) {
            if (!oneStepAccepted.contains(candidate)) continue;
            double[] profile = LaggedCorrelation.profile(y, table.column(candidate), maxLag);
            int best = strongestLagIndex(profile);
            CausalLink link = new CausalLink(candidate, target, best + 1, profile[best]);
            graph.addEdge(link);
            log.info("High-confidence link: {}", link);
        }
        if (graph.isEmpty()) {
            log.info("No candidate met both tests; no causal links reported");
        }
        return new Result(laggedAccepted, oneStepAccepted, graph);
    }

    /** First index of the largest absolute value. */
    static int strongestLagIndex(double[] profile) {
        int best = 0;
        for (int i = 1; i < profile.length; i++) {
            if (Math.abs(profile[i]) > Math.abs(profile[best])) best = i;
        }
        return best;
    }

    /** The two accepted sets and the consensus graph built from their intersection. */
    public static final class Result {
        private final Set<String> laggedCorrelationAccepted;
        private final Set<String> oneStepAccepted;
        private final CausalGraph graph;

        Result(Set<String> laggedCorrelationAccepted, Set<String> oneStepAccepted, CausalGraph graph) {
            this.laggedCorrelationAccepted = Collections.unmodifiableSet(laggedCorrelationAccepted);
            this.oneStepAccepted = Collections.unmodifiableSet(oneStepAccepted);
            this.graph = graph;
        }

        public Set<String> getLaggedCorrelationAccepted() { return laggedCorrelationAccepted; }
        public Set<String> getOneStepAccepted() { return oneStepAccepted; }
        public CausalGraph getGraph() { return graph; }
        public List<CausalLink> getLinks() { return graph.edges(); }
    }
}
