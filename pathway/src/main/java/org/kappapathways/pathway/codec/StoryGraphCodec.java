package org.kappapathways.pathway.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.kappapathways.common.codec.Codec;
import org.kappapathways.common.errorsor.ErrorsOr;
import org.kappapathways.hypergraph.CausalEdge;
import org.kappapathways.hypergraph.CausalGraph;
import org.kappapathways.hypergraph.EventNode;
import org.kappapathways.hypergraph.HyperEdge;
import org.kappapathways.hypergraph.HyperEdgeBuilder;
import org.kappapathways.hypergraph.MidNode;
import org.kappapathways.hypergraph.Node;
import org.kappapathways.hypergraph.NodeKind;
import org.kappapathways.hypergraph.RelationType;
import org.kappapathways.hypergraph.StateNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads and writes the logical state of a graph: nodes with their flags, hyperedges, covers, provenance. */
public final class StoryGraphCodec implements Codec<CausalGraph, String> {
    private static final Logger log = LoggerFactory.getLogger(StoryGraphCodec.class);

    private final ObjectMapper mapper;

    public StoryGraphCodec() {
        this.mapper = JsonMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .build();
    }

    public ObjectMapper objectMapper() {
        return mapper;
    }

    @Override
    public ErrorsOr<String> encode(CausalGraph graph) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(toDocument(graph)));
    }

    @Override
    public ErrorsOr<CausalGraph> decode(String json) {
        StoryDocument doc;
        try {
            doc = mapper.readValue(json, StoryDocument.class);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to parse story: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (doc == null) return ErrorsOr.error("Story document is empty");
        return fromDocument(doc);
    }

    // ---------- encoding ----------

    public static StoryDocument toDocument(CausalGraph graph) {
        List<NodeDocument> nodes = new ArrayList<>();
        for (Node n : graph.nodes()) {
            nodes.add(new NodeDocument(n.id(), n.label(), n.kind(), n.rank(), n.isIntro(), n.isFirst(), n.isShrink(),
                    n.pos(), n.prevcores().isEmpty() ? null : n.prevcores()));
        }
        return new StoryDocument(graph.id(), graph.eoi(), graph.occurrence(), graph.isHypergraph(), graph.producedBy(),
                graph.prevcores().isEmpty() ? null : graph.prevcores(),
                nodes, hyperEdgeDocuments(graph.hyperEdges()), hyperEdgeDocuments(graph.coverEdges()), null);
    }

    private static List<HyperEdgeDocument> hyperEdgeDocuments(List<HyperEdge> hyperEdges) {
        List<HyperEdgeDocument> result = new ArrayList<>(hyperEdges.size());
        for (HyperEdge h : hyperEdges) {
            List<EdgeDocument> members = new ArrayList<>(h.edgelist().size());
            for (CausalEdge e : h.edgelist()) members.add(edgeDocument(e));
            result.add(new HyperEdgeDocument(members, h.isUnderlying() ? Boolean.TRUE : null));
        }
        return result;
    }

    private static EdgeDocument edgeDocument(CausalEdge e) {
        return new EdgeDocument(e.source().id(), e.target().id(), e.weight(), e.number(),
                e.relationType() == RelationType.CAUSAL ? null : e.relationType(),
                e.isEssential() ? Boolean.TRUE : null,
                e.isReverse() ? Boolean.TRUE : null);
    }

    // ---------- decoding ----------

    /** Every problem in the document is reported, not only the first. */
    public static ErrorsOr<CausalGraph> fromDocument(StoryDocument doc) {
        List<String> errors = new ArrayList<>();
        if (doc.id() == null || doc.id().isBlank()) errors.add("Story has no id");
        String id = doc.id() == null ? "?" : doc.id();

        Map<String, Node> byId = new LinkedHashMap<>();
        List<NodeDocument> nodeDocs = doc.nodes() == null ? List.of() : doc.nodes();
        for (int i = 0; i < nodeDocs.size(); i++) {
            NodeDocument nd = nodeDocs.get(i);
            if (nd == null || nd.id() == null) {
                errors.add("Node [" + i + "] has no id");
                continue;
            }
            if (nd.kind() != NodeKind.MID && nd.label() == null) {
                errors.add("Node " + nd.id() + " has no label");
                continue;
            }
            if (byId.putIfAbsent(nd.id(), toNode(nd)) != null) errors.add("Duplicate node id " + nd.id());
        }

        boolean grouped = doc.hyperEdges() != null;
        if (grouped && doc.edges() != null) errors.add("Story " + id + " has both hyperEdges and edges");
        if (grouped && byId.values().stream().anyMatch(n -> n.kind() == NodeKind.MID)) {
            errors.add("Story " + id + " has midnodes but its hyperedges are already grouped");
        }
        List<List<CausalEdge>> hyperMembers = grouped ? members(doc.hyperEdges(), byId, "hyperedge", errors) : List.of();
        List<List<CausalEdge>> coverMembers = members(doc.coverEdges(), byId, "cover", errors);
        List<CausalEdge> flat = new ArrayList<>();
        if (!grouped) {
            List<EdgeDocument> edges = doc.edges() == null ? List.of() : doc.edges();
            for (int i = 0; i < edges.size(); i++) {
                CausalEdge e = toEdge(edges.get(i), byId, "edge [" + i + "]", errors);
                if (e != null) flat.add(e);
            }
        }
        if (!errors.isEmpty()) return ErrorsOr.<CausalGraph>errors(errors).addPrefixIfError("Story " + id + ": ");

        return ErrorsOr.<CausalGraph>trying(() -> {
            CausalGraph graph;
            if (grouped) {
                graph = new CausalGraph(id, doc.eoi());
                for (Node n : byId.values()) graph.addNode(n);
                for (List<CausalEdge> m : hyperMembers) graph.addHyperEdge(new HyperEdge(m));
                graph.setHypergraph(Boolean.TRUE.equals(doc.hypergraph()));
            } else {
                graph = HyperEdgeBuilder.buildGraph(id, doc.eoi(), new ArrayList<>(byId.values()), flat,
                        Boolean.TRUE.equals(doc.hypergraph()));
            }
            List<HyperEdgeDocument> hyperDocs = grouped ? doc.hyperEdges() : List.of();
            for (int i = 0; i < hyperDocs.size(); i++) {
                if (Boolean.TRUE.equals(hyperDocs.get(i).underlying())) graph.hyperEdges().get(i).setUnderlying(true);
            }
            for (List<CausalEdge> m : coverMembers) graph.addCoverEdge(new HyperEdge(m));
            if (doc.occurrence() != null) graph.setOccurrence(doc.occurrence());
            graph.setProducedBy(doc.producedBy());
            if (doc.prevcores() != null) graph.setPrevcores(doc.prevcores());
            graph.updateRankBounds();
            log.debug("Decoded {}", graph);
            return graph;
        }).addPrefixIfError("Story " + id + ": ");
    }

    private static Node toNode(NodeDocument nd) {
        NodeKind kind = nd.kind() == null ? NodeKind.EVENT : nd.kind();
        Node n = switch (kind) {
            case EVENT -> new EventNode(nd.id(), nd.label());
            case STATE -> new StateNode(nd.id(), nd.label());
            case MID -> new MidNode(nd.id());
        };
        n.setRank(nd.rank());
        n.setIntro(Boolean.TRUE.equals(nd.intro()));
        n.setFirst(Boolean.TRUE.equals(nd.first()));
        n.setShrink(Boolean.TRUE.equals(nd.shrink()));
        n.setPos(nd.pos());
        if (nd.prevcores() != null) n.addPrevcores(nd.prevcores());
        return n;
    }

    private static List<List<CausalEdge>> members(List<HyperEdgeDocument> docs, Map<String, Node> byId, String what,
                                                  List<String> errors) {
        if (docs == null) return List.of();
        List<List<CausalEdge>> result = new ArrayList<>(docs.size());
        for (int i = 0; i < docs.size(); i++) {
            HyperEdgeDocument hd = docs.get(i);
            if (hd == null || hd.edges() == null || hd.edges().isEmpty()) {
                errors.add(what + " [" + i + "] has no member edges");
                continue;
            }
            List<CausalEdge> m = new ArrayList<>(hd.edges().size());
            for (int k = 0; k < hd.edges().size(); k++) {
                CausalEdge e = toEdge(hd.edges().get(k), byId, what + " [" + i + "] edge [" + k + "]", errors);
                if (e != null) m.add(e);
            }
            result.add(m);
        }
        return result;
    }

    private static CausalEdge toEdge(EdgeDocument ed, Map<String, Node> byId, String where, List<String> errors) {
        if (ed == null) {
            errors.add(where + " is null");
            return null;
        }
        Node source = byId.get(ed.source());
        Node target = byId.get(ed.target());
        if (source == null) errors.add(where + " has unknown source " + ed.source());
        if (target == null) errors.add(where + " has unknown target " + ed.target());
        if (source == null || target == null) return null;
        int weight = ed.weight() == null ? 1 : ed.weight();
        int number = ed.number() == null ? 1 : ed.number();
        if (weight < 0 || number < 0) {
            errors.add(where + " has a negative weight or number");
            return null;
        }
        return new CausalEdge(source, target, weight, number)
                .withRelationType(ed.relationType() == null ? RelationType.CAUSAL : ed.relationType())
                .withEssential(Boolean.TRUE.equals(ed.essential()))
                .withReverse(Boolean.TRUE.equals(ed.reverse()));
    }
}
