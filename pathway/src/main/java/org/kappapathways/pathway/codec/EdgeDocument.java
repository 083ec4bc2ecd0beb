package org.kappapathways.pathway.codec;

import org.kappapathways.hypergraph.RelationType;

/** One member edge; endpoints are node ids. */
public record EdgeDocument(String source,
                           String target,
                           Integer weight,
                           Integer number,
                           RelationType relationType,
                           Boolean essential,
                           Boolean reverse) {
}
