package com.codeoptimizer.core;

import java.util.ArrayList;
import java.util.List;

import com.codeoptimizer.api.LearningEntry;

public class InMemoryLearningLog implements LearningLog {
    private final List<LearningEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(List<LearningEntry> newEntries) {
        entries.addAll(newEntries);
    }

    @Override
    public synchronized List<LearningEntry> readAll() {
        return List.copyOf(entries);
    }
}
