package io.daqflow.core.document;

import io.daqflow.core.model.ProgramGraph;
import io.daqflow.core.model.ProjectMeta;
import java.util.Objects;

/**
 * A loaded project document: its metadata and its program graph.
 *
 * @param meta  project metadata
 * @param graph the program graph, built through the graph's mutation API
 */
public record DaqProject(ProjectMeta meta, ProgramGraph graph) {

    public DaqProject {
        Objects.requireNonNull(meta, "meta must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
    }
}
