package nexus.causal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Directed edges into the target, at most one per cause. An empty graph is a valid result. */
public final class CausalGraph {

    private final Map<String, CausalLink> edges = new LinkedHashMap<>();

    void addEdge(CausalLink link) {
        if (edges.containsKey(link.getCause())) {
            throw new IllegalArgumentException("Duplicate edge for cause '" + link.getCause() + "'");
        }
        edges.put(link.getCause(), link);
    }

    public List<CausalLink> edges() {
        return Collections.unmodifiableList(new ArrayList<>(edges.values()));
    }

    public Optional<CausalLink> edgeFrom(String cause) {
        return Optional.ofNullable(edges.get(cause));
    }

    public int size() { return edges.size(); }
    public boolean isEmpty() { return edges.isEmpty(); }
}
