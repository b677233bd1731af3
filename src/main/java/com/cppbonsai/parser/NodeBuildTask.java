package com.cppbonsai.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.AstNode;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.ast.SourceLocation;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.parser.extract.Dependency;
import com.cppbonsai.parser.extract.Extractor;

/**
 * A node whose id is already reserved, waiting to be expanded.
 */
class NodeBuildTask {

    private static final Logger log = LoggerFactory.getLogger(NodeBuildTask.class);

    private final int id;
    private final int parentId;
    private final Dependency dependency;

    NodeBuildTask(int id, int parentId, Dependency dependency) {
        this.id = id;
        this.parentId = parentId;
        this.dependency = dependency;
    }

    /**
     * Runs the strategy, schedules the children it reports and returns the finished node.
     */
    AstNode run(BuilderQueue queue) {
        Cursor cursor = dependency.getCursor();
        Extractor extractor = dependency.getExtractor();
        extractor.requireAccepted(cursor);

        NodeKind kind = extractor.nodeKind(cursor);
        AttributeMap attributes = new AttributeMap();
        List<Dependency> dependencies = extractor.extract(cursor, dependency.getContext(), attributes);

        List<Integer> children = new ArrayList<>(dependencies.size());
        for (Dependency child : dependencies) {
            children.add(queue.enqueue(child, id));
        }
        log.trace("Built #{} {} from {} with {} children", id, kind, cursor.getKindName(), children.size());

        SourceLocation location = extractor.location(cursor);
        if (location.equals(SourceLocation.EMPTY)) {
            dependency.getContext().getDiagnostics().info(
                    "no location for #" + id + " " + kind + " '" + cursor.getSpelling() + "'");
        }

        return AstNode.builder()
                .id(id)
                .kind(kind)
                .parent(parentId)
                .children(children)
                .attributes(attributes.snapshot())
                .location(location)
                .build();
    }
}
