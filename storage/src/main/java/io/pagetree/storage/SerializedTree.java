package io.pagetree.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON shape of an embedded tree.
 * <pre>
 * {"version":1,"rootId":"n0","nodes":[{"id":"n0","parentId":null,"pageIndex":0,"childrenIds":["n1"]}, ...]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SerializedTree(int version, String rootId, List<SerializedNode> nodes) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SerializedNode(String id, String parentId, int pageIndex, List<String> childrenIds) {}
}
