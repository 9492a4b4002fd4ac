package com.codeoptimizer.core;

import java.io.IOException;
import java.util.List;

import com.codeoptimizer.api.LearningEntry;

/**
 * Where the outcome of every applied or rejected transformation is recorded after a run.
 */
public interface LearningLog {

    void append(List<LearningEntry> entries) throws IOException;

    List<LearningEntry> readAll() throws IOException;
}
