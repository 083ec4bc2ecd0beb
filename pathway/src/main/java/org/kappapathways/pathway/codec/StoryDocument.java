package org.kappapathways.pathway.codec;

import java.util.List;

/**
 * JSON form of a story or pathway. Either {@code hyperEdges} is given, or a flat {@code edges} list that is
 * grouped on reading, through midnodes when {@code hypergraph} is set.
 */
public record StoryDocument(String id,
                            String eoi,
                            Integer occurrence,
                            Boolean hypergraph,
                            String producedBy,
                            List<String> prevcores,
                            List<NodeDocument> nodes,
                            List<HyperEdgeDocument> hyperEdges,
                            List<HyperEdgeDocument> coverEdges,
                            List<EdgeDocument> edges) {
}
