package org.kappapathways.pathway.codec;

import org.kappapathways.hypergraph.NodeKind;

import java.util.List;

public record NodeDocument(String id,
                           String label,
                           NodeKind kind,
                           Double rank,
                           Boolean intro,
                           Boolean first,
                           Boolean shrink,
                           String pos,
                           List<String> prevcores) {
}
