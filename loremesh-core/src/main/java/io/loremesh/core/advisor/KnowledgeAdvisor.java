package io.loremesh.core.advisor;

import java.io.IOException;

public interface KnowledgeAdvisor {
    String query(String text) throws IOException;

    void store(LearningRecord record) throws IOException;

    String chat(String message) throws IOException;
}
