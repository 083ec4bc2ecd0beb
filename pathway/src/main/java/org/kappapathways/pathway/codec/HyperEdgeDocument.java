package org.kappapathways.pathway.codec;

import java.util.List;

public record HyperEdgeDocument(List<EdgeDocument> edges, Boolean underlying) {
}
