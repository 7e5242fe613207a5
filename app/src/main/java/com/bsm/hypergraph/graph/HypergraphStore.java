package com.bsm.hypergraph.graph;

import com.bsm.hypergraph.core.ChangeRecord;
import com.bsm.hypergraph.core.Scores;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds, transposes and queries change hypergraphs.
 *
 * Original view: nodes are entities (CIs, groups, services) and hyperedges are
 * change requests. Transposed view: nodes are change requests and hyperedges are
 * entities, each grouping every change that touched it.
 */
public class HypergraphStore {

    private static final int DEFAULT_TOP_N = 20;

    // Mutable accumulator for one change while rows are grouped
    private static final class EdgeDraft {
        final Map<String, String> attributes = new LinkedHashMap<>();
        final Set<String> members = new LinkedHashSet<>();
    }

    /**
     * Build a hypergraph whose nodes are every entity referenced by the records.
     */
    public Hypergraph build(List<ChangeRecord> records) {
        return build(records, null);
    }

    /**
     * Build a hypergraph restricted to a catalog of known entities. Catalog
     * entities that no change references become isolated nodes; references to
     * entities outside the catalog are dropped. A change left without members
     * is kept as an empty hyperedge.
     */
    public Hypergraph build(List<ChangeRecord> records, Collection<Entity> catalog) {
        Map<String, Entity> nodeMap = new LinkedHashMap<>();
        boolean restricted = catalog != null;
        if (restricted) {
            catalog.forEach(e -> nodeMap.putIfAbsent(e.uid(), e));
        }

        Map<String, EdgeDraft> drafts = new LinkedHashMap<>();
        for (ChangeRecord rec : records == null ? List.<ChangeRecord>of() : records) {
            if (rec == null || ChangeRecord.isBlank(rec.changeNumber()))
                continue;

            EdgeDraft draft = drafts.computeIfAbsent(rec.changeNumber().trim(), number -> newDraft(number, rec));

            if (!ChangeRecord.isBlank(rec.groupKey())) {
                addMember(draft, nodeMap, restricted,
                        Entity.of(EntityType.GROUP, rec.groupKey(), rec.assignmentGroup(), null));
            }
            if (!ChangeRecord.isBlank(rec.serviceKey())) {
                addMember(draft, nodeMap, restricted,
                        Entity.of(EntityType.SERVICE, rec.serviceKey(), rec.businessService(), null));
            }
            EntityType type = EntityType.fromId(rec.entityType());
            if (type != null && type != EntityType.CHANGE && !ChangeRecord.isBlank(rec.entityId())) {
                addMember(draft, nodeMap, restricted,
                        Entity.of(type, rec.entityId().trim(), rec.entityName(), rec.entityClass()));
            }
        }

        List<Entity> nodes = new ArrayList<>(nodeMap.values());
        Map<String, Set<String>> incidence = new LinkedHashMap<>();
        nodes.forEach(n -> incidence.put(n.uid(), new LinkedHashSet<>()));

        List<Hyperedge> edges = new ArrayList<>();
        for (Map.Entry<String, EdgeDraft> entry : drafts.entrySet()) {
            EdgeDraft draft = entry.getValue();
            Hyperedge edge = new Hyperedge(EntityType.CHANGE.uid(entry.getKey()),
                    new ArrayList<>(draft.members), draft.attributes);
            edges.add(edge);
            for (String member : edge.elements()) {
                incidence.get(member).add(edge.uid());
            }
        }

        return new Hypergraph(nodes, edges, incidence, false);
    }

    private EdgeDraft newDraft(String number, ChangeRecord rec) {
        EdgeDraft draft = new EdgeDraft();
        draft.attributes.put(Hyperedge.NUMBER, number);
        putIfPresent(draft.attributes, Hyperedge.RISK, rec.risk());
        putIfPresent(draft.attributes, Hyperedge.CHANGE_TYPE, rec.changeType());
        putIfPresent(draft.attributes, Hyperedge.ASSIGNMENT_GROUP, rec.assignmentGroup());
        putIfPresent(draft.attributes, Hyperedge.BUSINESS_SERVICE, rec.businessService());
        putIfPresent(draft.attributes, Hyperedge.CREATED_AT, rec.createdAt());
        return draft;
    }

    private void addMember(EdgeDraft draft, Map<String, Entity> nodeMap, boolean restricted, Entity candidate) {
        if (restricted) {
            if (nodeMap.containsKey(candidate.uid())) {
                draft.members.add(candidate.uid());
            }
            return;
        }
        nodeMap.putIfAbsent(candidate.uid(), candidate);
        draft.members.add(candidate.uid());
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value.trim());
        }
    }

    /**
     * Swap nodes and hyperedges. Every hyperedge becomes a node and every node
     * with at least one incidence becomes a hyperedge. Identifiers, node types
     * and attributes survive a double transpose.
     */
    public Hypergraph transpose(Hypergraph graph) {
        List<Entity> newNodes = new ArrayList<>();
        Map<String, Set<String>> newIncidence = new LinkedHashMap<>();

        for (Hyperedge oldEdge : graph.edges()) {
            if (oldEdge.elements().isEmpty())
                continue;
            newNodes.add(edgeToNode(oldEdge));
            newIncidence.put(oldEdge.uid(), new LinkedHashSet<>());
        }

        List<Hyperedge> newEdges = new ArrayList<>();
        for (Entity oldNode : graph.nodes()) {
            Set<String> memberOf = graph.edgesOf(oldNode.uid());
            if (memberOf.isEmpty())
                continue;

            Hyperedge edge = new Hyperedge(oldNode.uid(), new ArrayList<>(memberOf), nodeAttributes(oldNode));
            newEdges.add(edge);
            for (String changeUid : edge.elements()) {
                newIncidence.get(changeUid).add(oldNode.uid());
            }
        }

        return new Hypergraph(newNodes, newEdges, newIncidence, !graph.isTransposed());
    }

    private Entity edgeToNode(Hyperedge edge) {
        EntityType type = EntityType.fromId(edge.attribute(Hyperedge.TYPE));
        if (type == null) {
            return new Entity(edge.uid(), EntityType.CHANGE,
                    edge.attributeOr(Hyperedge.NUMBER, edge.uid()), null, edge.attributes());
        }
        // A transposed entity coming back: restore its descriptive fields
        Map<String, String> attributes = new LinkedHashMap<>(edge.attributes());
        attributes.remove(Hyperedge.TYPE);
        String name = attributes.remove(Hyperedge.NAME);
        String className = attributes.remove(Hyperedge.CLASS_NAME);
        return new Entity(edge.uid(), type, name == null ? edge.uid() : name, className, attributes);
    }

    private Map<String, String> nodeAttributes(Entity node) {
        if (node.type() == EntityType.CHANGE) {
            return node.attributes();
        }
        Map<String, String> attributes = new LinkedHashMap<>(node.attributes());
        attributes.put(Hyperedge.TYPE, node.type().id());
        attributes.put(Hyperedge.NAME, node.name());
        if (node.className() != null) {
            attributes.put(Hyperedge.CLASS_NAME, node.className());
        }
        return attributes;
    }

    public List<CooccurrencePair> cooccurrence(Hypergraph graph) {
        return cooccurrence(graph, null, DEFAULT_TOP_N);
    }

    /**
     * Rank node pairs by the number of hyperedges they share.
     *
     * @param filterType only count members of this type; null counts every member
     * @param topN       maximum number of pairs returned
     */
    public List<CooccurrencePair> cooccurrence(Hypergraph graph, EntityType filterType, int topN) {
        Map<String, List<String>> shared = new LinkedHashMap<>();

        for (Hyperedge edge : graph.edges()) {
            List<String> members = edge.elements();
            if (filterType != null) {
                members = members.stream()
                        .filter(uid -> uid.startsWith(filterType.prefix()))
                        .toList();
            }
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    String key = Scores.pairKey(members.get(i), members.get(j));
                    shared.computeIfAbsent(key, k -> new ArrayList<>()).add(edge.uid());
                }
            }
        }

        List<CooccurrencePair> pairs = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : shared.entrySet()) {
            String[] ab = Scores.splitPairKey(entry.getKey());
            pairs.add(new CooccurrencePair(ab[0], ab[1], entry.getValue().size(), entry.getValue()));
        }
        // Stable sort: first-seen pair keeps its position among equal counts
        pairs.sort((x, y) -> Integer.compare(y.count(), x.count()));
        return List.copyOf(pairs.subList(0, Math.min(Math.max(topN, 0), pairs.size())));
    }

    /**
     * Every other member of every hyperedge containing the node.
     */
    public List<String> neighbors(Hypergraph graph, String uid) {
        if (graph == null || uid == null)
            return List.of();
        return new ArrayList<>(graph.neighborSet(uid));
    }
}
