package com.cppbonsai.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.Ast;
import com.cppbonsai.ast.AstNode;
import com.cppbonsai.parser.extract.Dependency;

/**
 * State of one build: the id counter, the FIFO of pending nodes and the finished nodes.
 *
 * Nodes are discovered breadth-first; an id is minted when the parent reports the child, so every
 * child id is larger than its parent's. A session drains once.
 */
public class BuildSession implements BuilderQueue {

    private static final Logger log = LoggerFactory.getLogger(BuildSession.class);

    public enum State {
        SEEDED,
        DRAINING,
        DONE,
        FAILED
    }

    private final String name;
    private final IdGenerator ids = new IdGenerator(AstNode.NULL_ID);
    private final Deque<NodeBuildTask> queue = new ArrayDeque<>();
    private final SortedMap<Integer, AstNode> nodes = new TreeMap<>();
    private State state;

    public BuildSession(String name, Dependency root) {
        this.name = name;
        int rootId = enqueue(root, AstNode.NULL_ID);
        if (rootId != AstNode.NULL_ID) {
            throw new IllegalStateException("Root must receive id " + AstNode.NULL_ID + ", got " + rootId);
        }
        this.state = State.SEEDED;
    }

    @Override
    public int enqueue(Dependency dependency, int parentId) {
        if (state == State.DONE || state == State.FAILED) {
            throw new IllegalStateException("Cannot enqueue into a " + state + " session");
        }
        int id = ids.next();
        queue.addLast(new NodeBuildTask(id, parentId, dependency));
        return id;
    }

    /**
     * Builds every pending node. Any failure aborts the session and is rethrown; no partial tree
     * is returned.
     */
    public Ast drain() {
        if (state != State.SEEDED) {
            throw new IllegalStateException("Session already " + state);
        }
        state = State.DRAINING;
        try {
            while (!queue.isEmpty()) {
                NodeBuildTask task = queue.pollFirst();
                AstNode node = task.run(this);
                nodes.put(node.getId(), node);
            }
            Ast ast = new Ast(name, nodes);
            state = State.DONE;
            log.debug("Session for '{}' finished with {} nodes", name, nodes.size());
            return ast;
        } catch (RuntimeException e) {
            state = State.FAILED;
            queue.clear();
            throw e;
        }
    }

    public State getState() {
        return state;
    }
}
