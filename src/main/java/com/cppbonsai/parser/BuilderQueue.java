package com.cppbonsai.parser;

import com.cppbonsai.parser.extract.Dependency;

/**
 * Accepts children discovered while a node is built.
 */
public interface BuilderQueue {

    /**
     * Mints an id for the dependency and schedules it.
     *
     * @return the id the finished node will carry
     */
    int enqueue(Dependency dependency, int parentId);
}
